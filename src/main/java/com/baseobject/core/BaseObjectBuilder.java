package com.baseobject.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.baseobject.core.exception.FieldNotFoundException;

/**
 * Base class for builders collecting options before producing an object.
 *
 * The builder is an immutable record with a single locked field,
 * {@value #CONFIGURATION}, whose option map stays writable.
 *
 * @param <T> type of the built object
 */
public abstract class BaseObjectBuilder<T> extends ImmutableBaseObject {

    public static final String CONFIGURATION = "configuration";

    private final Map<String, Object> configuration;

    protected BaseObjectBuilder() {
        this(new LinkedHashMap<>());
    }

    private BaseObjectBuilder(Map<String, Object> configuration) {
        super(Attributes.of(CONFIGURATION, configuration));
        this.configuration = configuration;
    }

    private Map<String, Object> configuration() {
        return configuration;
    }

    public BaseObjectBuilder<T> with(String key, Object value) {
        configuration().put(key, value);
        return this;
    }

    /**
     * @throws FieldNotFoundException when the option was never set
     */
    public Object option(String key) {
        Map<String, Object> configuration = configuration();
        if (!configuration.containsKey(key)) {
            throw new FieldNotFoundException(key, getClass());
        }
        return configuration.get(key);
    }

    public Object option(String key, Object defaultValue) {
        return configuration().getOrDefault(key, defaultValue);
    }

    public boolean hasOption(String key) {
        return configuration().containsKey(key);
    }

    /**
     * @throws FieldNotFoundException when the option was never set
     */
    public void removeOption(String key) {
        Map<String, Object> configuration = configuration();
        if (!configuration.containsKey(key)) {
            throw new FieldNotFoundException(key, getClass());
        }
        configuration.remove(key);
    }

    public Map<String, Object> options() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(configuration()));
    }

    /**
     * Answers on option names rather than on the builder's own fields.
     */
    @Override
    public boolean contains(Object item) {
        return configuration().containsKey(item);
    }

    @Override
    public String toString() {
        return configuration().toString();
    }

    public abstract T build();
}
