package com.baseobject.core.schema;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Type-level table of field names that have been materialized on a record type.
 *
 * The first name seen for a type creates its table; later names extend it.
 * Every instance of the type shares the table.
 */
public final class AccessorRegistry {

    private static final Logger log = LoggerFactory.getLogger(AccessorRegistry.class);

    private static final Map<Class<?>, Set<String>> KNOWN = new ConcurrentHashMap<>();

    private AccessorRegistry() {
        // Utility class
    }

    public static void materialize(Class<?> type, String name) {
        Set<String> names = KNOWN.computeIfAbsent(type, t -> {
            log.debug("Creating accessor table for {}", t.getSimpleName());
            return Collections.synchronizedSet(new LinkedHashSet<>());
        });
        names.add(name);
    }

    public static boolean isMaterialized(Class<?> type, String name) {
        Set<String> names = KNOWN.get(type);
        return names != null && names.contains(name);
    }

    public static Set<String> knownFields(Class<?> type) {
        Set<String> names = KNOWN.get(type);
        if (names == null) {
            return Set.of();
        }
        synchronized (names) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(names));
        }
    }
}
