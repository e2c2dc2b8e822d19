package com.baseobject.core;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.baseobject.core.clone.DeepCloner;
import com.baseobject.core.coercion.TypeCoercer;
import com.baseobject.core.exception.FieldNotFoundException;
import com.baseobject.core.exception.TypeMismatchException;
import com.baseobject.core.exception.UnexpectedFieldException;
import com.baseobject.core.guard.MutabilityGuard;
import com.baseobject.core.ops.RecordFactory;
import com.baseobject.core.ops.StructuralOperations;
import com.baseobject.core.schema.AccessorRegistry;
import com.baseobject.core.schema.FieldKey;
import com.baseobject.core.schema.FieldSchema;
import com.baseobject.core.schema.FieldSchemaRegistry;
import com.baseobject.serialization.RecordJson;

/**
 * Record holding an insertion-ordered mapping of field names to values.
 *
 * <p>When the concrete type has a registered {@link FieldSchema}, construction
 * builds exactly the declared fields, coercing each supplied value to its
 * declared type and rejecting undeclared names. Schema-less types accept any
 * name. Writes after construction are not type checked.</p>
 *
 * <p>Names starting with {@value #RESERVED_PREFIX} are bookkeeping entries. They
 * are readable and writable like any field but are kept apart: they never take
 * part in locking, equality, enumeration, projection or cloning.</p>
 *
 * <p>Concrete subclasses that need to be rebuilt (copies, unions, clones,
 * {@link #fromMapping}) register a factory with {@link RecordFactory}.</p>
 */
public abstract class BaseObject implements Iterable<Map.Entry<String, Object>>, Comparable<BaseObject> {

    public static final String RESERVED_PREFIX = "_";

    private final Map<String, Object> fields = new LinkedHashMap<>();
    private final Map<String, Object> reserved = new LinkedHashMap<>();
    private final MutabilityGuard guard;

    protected BaseObject(Map<String, ?> values,
            Function<Class<? extends BaseObject>, ? extends MutabilityGuard> guardFactory) {
        this.guard = Objects.requireNonNull(guardFactory.apply(getClass()), "guard");
        Map<String, ?> supplied = values == null ? Map.of() : values;

        FieldSchema schema = FieldSchemaRegistry.lookup(getClass());
        if (schema.isEmpty()) {
            supplied.forEach(this::store);
        } else {
            for (FieldKey<?> key : schema.getFields()) {
                String name = key.getName();
                store(name, TypeCoercer.coerce(name, supplied.get(name), key.getType()));
            }
            for (Map.Entry<String, ?> entry : supplied.entrySet()) {
                if (isReserved(entry.getKey())) {
                    store(entry.getKey(), entry.getValue());
                } else if (!schema.declares(entry.getKey())) {
                    throw new UnexpectedFieldException(entry.getKey(), getClass());
                }
            }
        }

        postConstruct();
        guard.constructionCompleted(supplied.keySet());
    }

    public static boolean isReserved(String name) {
        return name != null && name.startsWith(RESERVED_PREFIX);
    }

    /**
     * Runs once all construction values are stored, before the record is locked.
     */
    protected void postConstruct() {
    }

    protected final MutabilityGuard guard() {
        return guard;
    }

    // ---- reads ----

    /**
     * Value of the field, or null when it does not exist.
     */
    public Object get(String name) {
        return get(name, null);
    }

    public Object get(String name, Object defaultValue) {
        Map<String, Object> source = isReserved(name) ? reserved : fields;
        return source.containsKey(name) ? source.get(name) : defaultValue;
    }

    public Object getOrDefault(String name, Object defaultValue) {
        return get(name, defaultValue);
    }

    /**
     * Value of a field that must exist.
     *
     * @throws FieldNotFoundException when the field does not exist
     */
    public Object require(String name) {
        if (!has(name)) {
            throw new FieldNotFoundException(name, getClass());
        }
        return get(name);
    }

    /**
     * Typed read of a declared field.
     *
     * @throws TypeMismatchException when a later write stored a value of another type
     */
    public <T> T get(FieldKey<T> key) {
        return key.cast(fields.get(key.getName()));
    }

    // ---- writes ----

    public void set(String name, Object value) {
        requireName(name);
        guard.checkWrite(name);
        store(name, value);
    }

    public <T> void set(FieldKey<T> key, T value) {
        set(key.getName(), value);
    }

    /**
     * @throws FieldNotFoundException when the field does not exist
     */
    public void delete(String name) {
        requireName(name);
        if (isReserved(name)) {
            if (!reserved.containsKey(name)) {
                throw new FieldNotFoundException(name, getClass());
            }
            reserved.remove(name);
            return;
        }
        if (!fields.containsKey(name)) {
            throw new FieldNotFoundException(name, getClass());
        }
        guard.checkWrite(name);
        fields.remove(name);
        guard.fieldRemoved(name);
    }

    /**
     * Writes every given value. All names are checked before the first one is written.
     */
    public void update(Map<String, ?> values) {
        values.keySet().forEach(BaseObject::requireName);
        guard.checkWrites(values.keySet());
        values.forEach(this::store);
        guard.fieldsIntroduced(values.keySet());
    }

    /**
     * Writes only the values whose names are not present yet.
     */
    public void updateDefaults(Map<String, ?> defaults) {
        Map<String, Object> missing = new LinkedHashMap<>();
        defaults.forEach((name, value) -> {
            if (!has(name)) {
                missing.put(name, value);
            }
        });
        update(missing);
    }

    final void store(String name, Object value) {
        requireName(name);
        if (isReserved(name)) {
            reserved.put(name, value);
            return;
        }
        AccessorRegistry.materialize(getClass(), name);
        fields.put(name, value);
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field name must not be null or blank");
        }
    }

    // ---- membership ----

    public boolean has(String name) {
        return isReserved(name) ? reserved.containsKey(name) : fields.containsKey(name);
    }

    public boolean hasValue(Object value) {
        return fields.containsValue(value);
    }

    /**
     * True when a field with the given name exists and some field holds the given
     * value; either argument may be null to test only the other one.
     */
    public boolean has(String name, Object value) {
        if (name != null && value != null) {
            return has(name) && hasValue(value);
        }
        if (name != null) {
            return has(name);
        }
        if (value != null) {
            return hasValue(value);
        }
        return false;
    }

    /**
     * True when the item is a field name or a field value.
     */
    public boolean contains(Object item) {
        return (item instanceof String name && has(name)) || hasValue(item);
    }

    // ---- enumeration ----

    public List<String> keys() {
        return new ArrayList<>(fields.keySet());
    }

    public List<Object> values() {
        return new ArrayList<>(fields.values());
    }

    /**
     * Read-only snapshot of the (name, value) pairs; also backs {@link #iterator()}.
     */
    public List<Map.Entry<String, Object>> items() {
        List<Map.Entry<String, Object>> items = new ArrayList<>(fields.size());
        fields.forEach((name, value) -> items.add(new AbstractMap.SimpleImmutableEntry<>(name, value)));
        return Collections.unmodifiableList(items);
    }

    public List<IndexedField> enumerate() {
        List<IndexedField> indexed = new ArrayList<>(fields.size());
        int index = 0;
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            indexed.add(new IndexedField(index++, entry.getKey(), entry.getValue()));
        }
        return indexed;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @Override
    public Iterator<Map.Entry<String, Object>> iterator() {
        return items().iterator();
    }

    // ---- structure ----

    /**
     * Compares only the named fields; a field missing on both sides counts as equal.
     * A null key list compares every field.
     */
    public boolean equalsOn(BaseObject other, Collection<String> keys) {
        return StructuralOperations.equalsOn(this, other, keys);
    }

    @Override
    public int compareTo(BaseObject other) {
        return StructuralOperations.compare(this, other);
    }

    public boolean isLessThan(BaseObject other) {
        return compareTo(other) < 0;
    }

    public boolean isGreaterThan(BaseObject other) {
        return compareTo(other) > 0;
    }

    /**
     * New record of this type holding this record's fields overridden by the other's.
     */
    public BaseObject plus(BaseObject other) {
        return StructuralOperations.union(this, other);
    }

    /**
     * New record of this type holding the fields whose names the other record lacks.
     */
    public BaseObject minus(BaseObject other) {
        return StructuralOperations.difference(this, other);
    }

    public Map<String, Object> filterByType(Class<?> type) {
        return StructuralOperations.filterByType(this, type);
    }

    public Map<String, Object> toFilteredMapping(Collection<String> keys, Class<?> type) {
        return StructuralOperations.filter(this, keys, type);
    }

    // ---- copies ----

    /**
     * Shallow copy of the same concrete type; field values are shared.
     */
    public BaseObject copy() {
        return RecordFactory.create(getClass(), fields);
    }

    public BaseObject deepClone() {
        return deepClone(false);
    }

    /**
     * Deep copy sharing no container with this record. With {@code asMutable}
     * the copy and every nested record in it are mutable.
     */
    public BaseObject deepClone(boolean asMutable) {
        return DeepCloner.deepClone(this, asMutable);
    }

    // ---- projection ----

    public Map<String, Object> toMapping() {
        return new LinkedHashMap<>(fields);
    }

    public Map<String, Object> toMapping(Collection<String> exclude, SortOrder order) {
        Map<String, Object> mapping = toMapping();
        if (exclude != null) {
            exclude.forEach(mapping::remove);
        }
        return order == null ? mapping : order.arrange(mapping);
    }

    public String toText() {
        return RecordJson.defaults().write(this);
    }

    public String toText(Collection<String> exclude, boolean sortKeys) {
        return RecordJson.defaults().write(this, exclude, sortKeys);
    }

    /**
     * Builds a record of the given type from a flat mapping. Reserved names are dropped.
     */
    public static <T extends BaseObject> T fromMapping(Class<T> type, Map<String, ?> values) {
        Map<String, Object> accepted = new LinkedHashMap<>();
        values.forEach((name, value) -> {
            if (!isReserved(name)) {
                accepted.put(name, value);
            }
        });
        return RecordFactory.create(type, accepted);
    }

    public static <T extends BaseObject> T fromText(Class<T> type, String text) {
        return RecordJson.defaults().read(type, text);
    }

    // ---- object ----

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BaseObject other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(", ", getClass().getSimpleName() + "(", ")"));
    }
}
