package com.baseobject.core;

import static org.assertj.core.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;

class AttributesTest {

    @Test
    void testPairsKeepOrderAndNulls() {
        Map<String, Object> values = Attributes.of("b", 1, "a", null);

        assertThat(values).containsExactly(entry("b", 1), entry("a", null));
    }

    @Test
    void testOddArgumentCountFails() {
        assertThatThrownBy(() -> Attributes.of("a", 1, "b"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("3 arguments");
    }

    @Test
    void testNonStringNameFails() {
        assertThatThrownBy(() -> Attributes.of(1, "a")).isInstanceOf(IllegalArgumentException.class);
    }
}
