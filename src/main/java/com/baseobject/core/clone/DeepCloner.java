package com.baseobject.core.clone;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Queue;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

import org.apache.commons.lang3.SerializationUtils;

import com.baseobject.core.BaseObject;
import com.baseobject.core.MutableBaseObject;
import com.baseobject.core.Tuple;
import com.baseobject.core.exception.UncopyableValueException;
import com.baseobject.core.ops.RecordFactory;

import lombok.experimental.UtilityClass;

/**
 * Recursive copy of a record's field graph.
 *
 * <p>Nested records are cloned through the same procedure. Maps, sets, lists,
 * queues, tuples and object arrays are rebuilt with freshly allocated
 * containers of the same kind. Immutable scalars are shared; any
 * other {@link Serializable} value is copied by serialization.</p>
 *
 * <p>Reserved entries and lock state are not copied: the clone goes through
 * normal construction.</p>
 */
@UtilityClass
public class DeepCloner {

    private final Set<Class<?>> IMMUTABLE_TYPES = Set.of(
            String.class, Boolean.class, Character.class,
            Byte.class, Short.class, Integer.class, Long.class, Float.class, Double.class,
            BigInteger.class, BigDecimal.class, UUID.class, Class.class);

    /**
     * @param asMutable build the copy, and every record nested in it, as mutable records
     * @throws UncopyableValueException when some value has no way of being copied
     * @throws IllegalArgumentException when the field graph contains a cycle
     */
    public BaseObject deepClone(BaseObject source, boolean asMutable) {
        return cloneRecord(source, asMutable, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private BaseObject cloneRecord(BaseObject source, boolean asMutable, Set<Object> visiting) {
        enter(source, visiting);
        Map<String, Object> copied = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : source) {
            copied.put(entry.getKey(), copyValue(entry.getKey(), entry.getValue(), asMutable, visiting));
        }
        visiting.remove(source);

        if (asMutable && !(source instanceof MutableBaseObject)) {
            return new MutableBaseObject(copied);
        }
        return RecordFactory.create(source.getClass(), copied);
    }

    private Object copyValue(String field, Object value, boolean asMutable, Set<Object> visiting) {
        if (value == null || isImmutable(value)) {
            return value;
        }
        if (value instanceof BaseObject record) {
            return cloneRecord(record, asMutable, visiting);
        }
        if (value instanceof Tuple tuple) {
            return Tuple.copyOf(copyAll(field, tuple.toList(), new ArrayList<>(), asMutable, visiting));
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> target;
            if (map instanceof SortedMap<?, ?> sorted) {
                target = new TreeMap<>(comparatorOf(sorted.comparator()));
            } else {
                target = new LinkedHashMap<>();
            }
            enter(map, visiting);
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                target.put(copyValue(field, entry.getKey(), asMutable, visiting),
                        copyValue(field, entry.getValue(), asMutable, visiting));
            }
            visiting.remove(map);
            return target;
        }
        if (value instanceof Collection<?> collection) {
            return copyAll(field, collection, emptyLike(collection), asMutable, visiting);
        }
        if (value instanceof Object[] array) {
            Object[] target = Arrays.copyOf(array, array.length);
            enter(array, visiting);
            for (int i = 0; i < array.length; i++) {
                target[i] = copyValue(field, array[i], asMutable, visiting);
            }
            visiting.remove(array);
            return target;
        }
        if (value instanceof Serializable serializable) {
            try {
                return SerializationUtils.clone(serializable);
            } catch (org.apache.commons.lang3.SerializationException e) {
                throw new UncopyableValueException(field, value.getClass(), e);
            }
        }
        throw new UncopyableValueException(field, value.getClass());
    }

    private <C extends Collection<Object>> C copyAll(String field, Collection<?> source, C target,
            boolean asMutable, Set<Object> visiting) {
        enter(source, visiting);
        for (Object element : source) {
            target.add(copyValue(field, element, asMutable, visiting));
        }
        visiting.remove(source);
        return target;
    }

    /**
     * Fresh, empty collection of the same kind: sorted sets and priority queues
     * keep their comparator, deques and other queues stay queues.
     */
    private Collection<Object> emptyLike(Collection<?> collection) {
        if (collection instanceof SortedSet<?> sorted) {
            return new TreeSet<>(comparatorOf(sorted.comparator()));
        }
        if (collection instanceof Set) {
            return new LinkedHashSet<>();
        }
        if (collection instanceof PriorityQueue<?> queue) {
            return new PriorityQueue<>(comparatorOf(queue.comparator()));
        }
        if (collection instanceof LinkedList) {
            return new LinkedList<>();
        }
        if (collection instanceof Queue) {
            return new ArrayDeque<>(collection.size());
        }
        return new ArrayList<>(collection.size());
    }

    @SuppressWarnings("unchecked")
    private Comparator<Object> comparatorOf(Comparator<?> comparator) {
        return (Comparator<Object>) comparator;
    }

    private void enter(Object container, Set<Object> visiting) {
        if (!visiting.add(container)) {
            throw new IllegalArgumentException("Cannot deep copy a cyclic structure through "
                    + container.getClass().getSimpleName());
        }
    }

    private boolean isImmutable(Object value) {
        return IMMUTABLE_TYPES.contains(value.getClass())
                || value instanceof Enum
                || value.getClass().getPackageName().equals("java.time");
    }
}
