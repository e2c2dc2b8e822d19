package com.baseobject.core.schema;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.baseobject.core.BaseObject;

/**
 * Per-type registry of declared field schemas.
 *
 * A schema must be registered before the first instance of its type is built,
 * typically from a static initializer of the record class. Types without their
 * own schema inherit the nearest registered one from their superclasses.
 */
public final class FieldSchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(FieldSchemaRegistry.class);

    private static final Map<Class<?>, FieldSchema> SCHEMAS = new ConcurrentHashMap<>();
    private static final Set<Class<?>> FIXED = ConcurrentHashMap.newKeySet();

    private FieldSchemaRegistry() {
        // Utility class
    }

    public static void register(Class<? extends BaseObject> type, FieldSchema schema) {
        if (type == null || schema == null) {
            throw new IllegalArgumentException("Record type and schema are required");
        }
        if (FIXED.contains(type)) {
            throw new IllegalStateException("Schema of " + type.getSimpleName()
                    + " is already fixed: instances have been constructed");
        }
        FieldSchema existing = SCHEMAS.putIfAbsent(type, schema);
        if (existing != null && !existing.equals(schema)) {
            throw new IllegalStateException("A different schema is already registered for " + type.getSimpleName());
        }
        if (existing == null) {
            log.debug("Registered schema for {}: {}", type.getSimpleName(), schema.names());
        }
    }

    /**
     * Resolves the schema governing construction of the given type and fixes it.
     */
    public static FieldSchema lookup(Class<? extends BaseObject> type) {
        FIXED.add(type);
        return resolve(type);
    }

    /**
     * Resolves the schema without fixing it.
     */
    public static FieldSchema peek(Class<? extends BaseObject> type) {
        return resolve(type);
    }

    public static boolean isFixed(Class<? extends BaseObject> type) {
        return FIXED.contains(type);
    }

    private static FieldSchema resolve(Class<?> type) {
        for (Class<?> current = type; current != null && BaseObject.class.isAssignableFrom(current);
                current = current.getSuperclass()) {
            FieldSchema schema = SCHEMAS.get(current);
            if (schema != null) {
                return schema;
            }
        }
        return FieldSchema.EMPTY;
    }
}
