package com.baseobject.core.coercion;

import static org.assertj.core.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.baseobject.core.Attributes;
import com.baseobject.core.RecordFixtures.Person;
import com.baseobject.core.Tuple;
import com.baseobject.core.exception.TypeMismatchException;

/**
 * Unit tests for construction-time coercion.
 */
class TypeCoercerTest {

    enum Color { RED, GREEN }

    @Test
    void testAbsentValueAndUndeclaredTypePassThrough() {
        assertThat(TypeCoercer.coerce("a", null, Integer.class)).isNull();
        Object value = new Object();
        assertThat(TypeCoercer.coerce("a", value, null)).isSameAs(value);
    }

    @Test
    void testMatchingValuePassesThroughUnchanged() {
        List<Object> value = new ArrayList<>();

        assertThat(TypeCoercer.coerce("a", value, List.class)).isSameAs(value);
        assertThat(TypeCoercer.coerce("a", 5, int.class)).isEqualTo(5);
    }

    @ParameterizedTest
    @CsvSource({
            "42, 42",
            "' 7 ', 7",
            "-3, -3"
    })
    void testTextToInteger(String text, int expected) {
        assertThat(TypeCoercer.coerce("n", text, Integer.class)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "true, true",
            "FALSE, false",
            "True, true"
    })
    void testTextToBoolean(String text, boolean expected) {
        assertThat(TypeCoercer.coerce("flag", text, Boolean.class)).isEqualTo(expected);
    }

    @Test
    void testNumbersConvertAcrossTypes() {
        assertThat(TypeCoercer.coerce("n", 3, Long.class)).isEqualTo(3L);
        assertThat(TypeCoercer.coerce("n", 2.5, BigDecimal.class)).isEqualTo(new BigDecimal("2.5"));
        assertThat(TypeCoercer.coerce("n", 1, Boolean.class)).isEqualTo(true);
        assertThat(TypeCoercer.coerce("n", 12, String.class)).isEqualTo("12");
    }

    @Test
    void testFractionsTruncateAndOverflowFails() {
        assertThat(TypeCoercer.coerce("n", 2.9, Integer.class)).isEqualTo(2);
        assertThatThrownBy(() -> TypeCoercer.coerce("n", 300, Byte.class))
                .isInstanceOf(TypeMismatchException.class);
    }

    @Test
    void testTextToValueTypes() {
        UUID id = UUID.randomUUID();

        assertThat(TypeCoercer.coerce("d", "2024-02-29", LocalDate.class)).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(TypeCoercer.coerce("id", id.toString(), UUID.class)).isEqualTo(id);
        assertThat(TypeCoercer.coerce("c", "GREEN", Color.class)).isEqualTo(Color.GREEN);
    }

    @Test
    void testContainersConvert() {
        assertThat(TypeCoercer.coerce("l", Set.of(1), List.class)).isEqualTo(List.of(1));
        assertThat(TypeCoercer.coerce("t", List.of(1, 2), Tuple.class)).isEqualTo(Tuple.of(1, 2));
        assertThat(TypeCoercer.coerce("s", List.of(1, 1, 2), Set.class)).isEqualTo(Set.of(1, 2));
    }

    @Test
    void testMappingConvertsToRecord() {
        Object converted = TypeCoercer.coerce("p", Map.of("name", "Ann", "age", "5"), Person.class);

        assertThat(converted).isInstanceOf(Person.class);
        assertThat(((Person) converted).get("age")).isEqualTo(5);
        assertThat(converted).isEqualTo(new Person(Attributes.of("name", "Ann", "age", 5)));
    }

    @Test
    void testTypeWithoutConverterFails() {
        assertThatThrownBy(() -> TypeCoercer.coerce("x", "text", Thread.class))
                .isInstanceOfSatisfying(TypeMismatchException.class, e -> {
                    assertThat(e.getExpectedType()).isEqualTo(Thread.class);
                    assertThat(e.getCause()).isNull();
                });
    }

    @Test
    void testUnknownEnumConstantFails() {
        assertThatThrownBy(() -> TypeCoercer.coerce("c", "BLUE", Color.class))
                .isInstanceOf(TypeMismatchException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }
}
