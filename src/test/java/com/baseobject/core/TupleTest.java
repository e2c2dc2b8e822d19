package com.baseobject.core;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

class TupleTest {

    @Test
    void testElementsAndSize() {
        Tuple tuple = Tuple.of("a", null, 3);

        assertThat(tuple.size()).isEqualTo(3);
        assertThat(tuple.get(1)).isNull();
        assertThat(tuple.toList()).containsExactly("a", null, 3);
    }

    @Test
    void testOfCopiesArgumentArray() {
        Object[] elements = { 1, 2 };
        Tuple tuple = Tuple.of(elements);

        elements[0] = 99;

        assertThat(tuple.get(0)).isEqualTo(1);
    }

    @Test
    void testCopyOfIsDetachedFromSource() {
        List<Object> source = new ArrayList<>(Arrays.asList(1, 2));
        Tuple tuple = Tuple.copyOf(source);

        source.add(3);

        assertThat(tuple.size()).isEqualTo(2);
    }

    @Test
    void testListViewIsUnmodifiable() {
        Tuple tuple = Tuple.of(1);

        assertThatThrownBy(() -> tuple.toList().set(0, 2)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testIndexOutOfBounds() {
        assertThatThrownBy(() -> Tuple.of(1).get(1)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> Tuple.empty().get(0)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void testEqualityAndToString() {
        assertThat(Tuple.of(1, "b")).isEqualTo(Tuple.copyOf(List.of(1, "b")));
        assertThat(Tuple.of(1, "b").hashCode()).isEqualTo(Tuple.of(1, "b").hashCode());
        assertThat(Tuple.of(1, "b")).hasToString("(1, b)");
        assertThat(Tuple.of(1)).hasToString("(1,)");
        assertThat(Tuple.empty()).hasToString("()").isSameAs(Tuple.of());
    }
}
