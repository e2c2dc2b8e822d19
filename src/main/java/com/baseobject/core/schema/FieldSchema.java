package com.baseobject.core.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

/**
 * Declared field-type map of a record type: ordered field names with their expected types.
 *
 * An empty schema means the type is schema-less and accepts any field.
 */
@Value
public class FieldSchema {

    public static final FieldSchema EMPTY = FieldSchema.builder().build();

    List<FieldKey<?>> fields;

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Map<String, FieldKey<?>> byName;

    @Builder
    private FieldSchema(@Singular List<FieldKey<?>> fields) {
        Map<String, FieldKey<?>> index = new LinkedHashMap<>();
        for (FieldKey<?> key : fields) {
            if (index.putIfAbsent(key.getName(), key) != null) {
                throw new IllegalArgumentException("Field '" + key.getName() + "' is declared more than once");
            }
        }
        this.fields = List.copyOf(fields);
        this.byName = Collections.unmodifiableMap(index);
    }

    public static FieldSchema of(FieldKey<?>... keys) {
        return FieldSchema.builder().fields(List.of(keys)).build();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public int size() {
        return fields.size();
    }

    public boolean declares(String name) {
        return byName.containsKey(name);
    }

    /**
     * Expected type of the named field, or null when the name is not declared.
     */
    public Class<?> typeOf(String name) {
        FieldKey<?> key = byName.get(name);
        return key == null ? null : key.getType();
    }

    public List<String> names() {
        return new ArrayList<>(byName.keySet());
    }

    public static class FieldSchemaBuilder {

        /**
         * Declares a field by name and type; primitive types are boxed.
         */
        public FieldSchemaBuilder declare(String name, Class<?> type) {
            return field(FieldKey.of(name, type));
        }
    }
}
