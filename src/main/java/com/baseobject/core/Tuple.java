package com.baseobject.core;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable fixed-size ordered sequence of values. Elements may be null.
 */
public final class Tuple implements Iterable<Object>, Serializable {

    private static final long serialVersionUID = 1L;

    private static final Tuple EMPTY = new Tuple(new Object[0]);

    private final Object[] elements;

    private Tuple(Object[] elements) {
        this.elements = elements;
    }

    public static Tuple of(Object... elements) {
        return elements.length == 0 ? EMPTY : new Tuple(elements.clone());
    }

    public static Tuple copyOf(Collection<?> elements) {
        return elements.isEmpty() ? EMPTY : new Tuple(elements.toArray());
    }

    public static Tuple empty() {
        return EMPTY;
    }

    public Object get(int index) {
        if (index < 0 || index >= elements.length) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for tuple of size " + elements.length);
        }
        return elements[index];
    }

    public int size() {
        return elements.length;
    }

    public boolean isEmpty() {
        return elements.length == 0;
    }

    /**
     * Unmodifiable list view of the elements.
     */
    public List<Object> toList() {
        return Collections.unmodifiableList(Arrays.asList(elements));
    }

    @Override
    public Iterator<Object> iterator() {
        return toList().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tuple)) return false;
        return Arrays.equals(elements, ((Tuple) o).elements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(elements);
    }

    @Override
    public String toString() {
        return Arrays.stream(elements)
                .map(String::valueOf)
                .collect(Collectors.joining(", ", "(", elements.length == 1 ? ",)" : ")"));
    }
}
