package com.baseobject.core.ops;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.baseobject.core.BaseObject;

/**
 * Builds records of a given concrete type from a field mapping.
 *
 * <p>Every concrete type that is rebuilt (copies, unions, clones, conversions,
 * {@code fromMapping}) registers its factory once, usually from the same static
 * initializer that registers its field schema:</p>
 *
 * <pre>
 * static {
 *     RecordFactory.register(Person.class, Person::new);
 * }
 * </pre>
 *
 * <p>Factories are looked up by exact type; a subclass does not inherit its
 * parent's factory.</p>
 */
public final class RecordFactory {

    private static final Logger log = LoggerFactory.getLogger(RecordFactory.class);

    private static final Map<Class<?>, Function<Map<String, ?>, ? extends BaseObject>> FACTORIES =
            new ConcurrentHashMap<>();

    private RecordFactory() {
        // Utility class
    }

    public static <T extends BaseObject> void register(Class<T> type, Function<Map<String, ?>, ? extends T> factory) {
        if (type == null || factory == null) {
            throw new IllegalArgumentException("Type and factory are required");
        }
        FACTORIES.put(type, factory);
        log.debug("Registered record factory for {}", type.getName());
    }

    public static boolean isRegistered(Class<? extends BaseObject> type) {
        return FACTORIES.containsKey(type);
    }

    /**
     * Constructs a record; failures raised by the factory propagate unchanged.
     *
     * @throws IllegalStateException when no factory is registered for the type
     */
    public static <T extends BaseObject> T create(Class<T> type, Map<String, ?> values) {
        Function<Map<String, ?>, ? extends BaseObject> factory = FACTORIES.get(type);
        if (factory == null) {
            initialize(type);
            factory = FACTORIES.get(type);
        }
        if (factory == null) {
            throw new IllegalStateException("No record factory registered for " + type.getName());
        }
        return type.cast(factory.apply(values));
    }

    /**
     * Runs the type's static initializer, where factories are registered, when
     * the type is only known by its class literal so far.
     */
    private static void initialize(Class<?> type) {
        try {
            Class.forName(type.getName(), true, type.getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("Cannot initialize " + type.getName(), e);
        }
    }
}
