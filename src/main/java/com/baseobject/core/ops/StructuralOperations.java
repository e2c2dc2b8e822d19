package com.baseobject.core.ops;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.commons.lang3.ObjectUtils;

import com.baseobject.core.BaseObject;

import lombok.experimental.UtilityClass;

/**
 * Comparison, merging and filtering over the field mappings of records.
 */
@UtilityClass
public class StructuralOperations {

    /**
     * Stand-in value for a field missing from a record, equal only to itself.
     */
    private final Object ABSENT = new Object();

    public boolean equalsOn(BaseObject left, BaseObject right, Collection<String> keys) {
        if (right == null) {
            return false;
        }
        if (keys == null) {
            return left.equals(right);
        }
        for (String key : keys) {
            if (!Objects.equals(left.get(key, ABSENT), right.get(key, ABSENT))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Orders two records by their key-sorted (name, value) pairs, lexicographically.
     * Null values sort first. Numbers of different types compare by value, then by
     * class name, so only equal records compare as 0 as long as each value type's
     * own ordering agrees with its equals.
     *
     * @throws ClassCastException when two values at the same position cannot be compared
     */
    public int compare(BaseObject left, BaseObject right) {
        Iterator<Map.Entry<String, Object>> a = sortedEntries(left).iterator();
        Iterator<Map.Entry<String, Object>> b = sortedEntries(right).iterator();
        while (a.hasNext() && b.hasNext()) {
            Map.Entry<String, Object> x = a.next();
            Map.Entry<String, Object> y = b.next();
            int byName = x.getKey().compareTo(y.getKey());
            if (byName != 0) {
                return byName;
            }
            int byValue = compareValues(x.getValue(), y.getValue());
            if (byValue != 0) {
                return byValue;
            }
        }
        return Boolean.compare(a.hasNext(), b.hasNext());
    }

    private List<Map.Entry<String, Object>> sortedEntries(BaseObject record) {
        List<Map.Entry<String, Object>> entries = new ArrayList<>(record.items());
        entries.sort(Map.Entry.comparingByKey());
        return entries;
    }

    private int compareValues(Object x, Object y) {
        if (x instanceof Number n && y instanceof Number m && x.getClass() != y.getClass()) {
            int byValue = Double.compare(n.doubleValue(), m.doubleValue());
            // equal values of different classes are not equal records
            return byValue != 0 ? byValue : x.getClass().getName().compareTo(y.getClass().getName());
        }
        return ObjectUtils.compare(comparable(x), comparable(y));
    }

    @SuppressWarnings("unchecked")
    private Comparable<Object> comparable(Object value) {
        if (value != null && !(value instanceof Comparable)) {
            throw new ClassCastException(value.getClass().getName() + " is not comparable");
        }
        return (Comparable<Object>) value;
    }

    /**
     * New record of the left operand's type: the left fields, overridden and extended by the right ones.
     *
     * @throws IllegalArgumentException when the right operand is not an instance of the left one's type
     */
    public BaseObject union(BaseObject left, BaseObject right) {
        if (right == null || !left.getClass().isInstance(right)) {
            throw new IllegalArgumentException("Cannot add " + (right == null ? "null" : right.getClass().getSimpleName())
                    + " to " + left.getClass().getSimpleName());
        }
        Map<String, Object> merged = left.toMapping();
        merged.putAll(right.toMapping());
        return RecordFactory.create(left.getClass(), merged);
    }

    /**
     * New record of the left operand's type holding the left fields whose names the right one lacks.
     */
    public BaseObject difference(BaseObject left, BaseObject right) {
        if (right == null) {
            throw new IllegalArgumentException("Cannot subtract null from " + left.getClass().getSimpleName());
        }
        Map<String, Object> remaining = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : left) {
            if (!right.has(entry.getKey())) {
                remaining.put(entry.getKey(), entry.getValue());
            }
        }
        return RecordFactory.create(left.getClass(), remaining);
    }

    /**
     * Fields whose current value is an instance of the given type. Null values never match.
     */
    public Map<String, Object> filterByType(BaseObject record, Class<?> type) {
        return filter(record, null, type);
    }

    /**
     * Fields restricted to the given names and value type; a null argument does not restrict.
     */
    public Map<String, Object> filter(BaseObject record, Collection<String> keys, Class<?> type) {
        Map<String, Object> filtered = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : record) {
            boolean named = keys == null || keys.contains(entry.getKey());
            boolean typed = type == null || type.isInstance(entry.getValue());
            if (named && typed) {
                filtered.put(entry.getKey(), entry.getValue());
            }
        }
        return filtered;
    }
}
