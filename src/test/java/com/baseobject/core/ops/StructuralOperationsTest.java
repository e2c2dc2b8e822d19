package com.baseobject.core.ops;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.junit.jupiter.api.Test;

import com.baseobject.core.Attributes;
import com.baseobject.core.BaseObject;
import com.baseobject.core.ImmutableBaseObject;
import com.baseobject.core.MutableBaseObject;
import com.baseobject.core.RecordFixtures;
import com.baseobject.core.RecordFixtures.Bag;
import com.baseobject.core.RecordFixtures.Person;

/**
 * Unit tests for comparison, union, difference and filtering.
 */
class StructuralOperationsTest {

    private static MutableBaseObject record(Object... namesAndValues) {
        return new MutableBaseObject(Attributes.of(namesAndValues));
    }

    @Test
    void testUnionRightSideWins() {
        BaseObject union = record("x", 1, "y", 2).plus(record("x", 5, "z", 9));

        assertThat(union.toMapping()).containsExactly(entry("x", 5), entry("y", 2), entry("z", 9));
        assertThatObject(union).isInstanceOf(MutableBaseObject.class);
    }

    @Test
    void testUnionKeepsLeftType() {
        Bag left = new Bag(Attributes.of("a", 1));

        assertThatObject(left.plus(new Bag(Attributes.of("b", 2)))).isInstanceOf(Bag.class);
    }

    @Test
    void testUnionWithIncompatibleTypeFails() {
        Bag left = new Bag(Attributes.of("a", 1));

        assertThatThrownBy(() -> left.plus(record("b", 2))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> left.plus(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testUnionOfImmutableRecordsIsLocked() {
        ImmutableBaseObject left = new ImmutableBaseObject(Attributes.of("a", 1));
        ImmutableBaseObject union = (ImmutableBaseObject) left.plus(new ImmutableBaseObject(Attributes.of("b", 2)));

        assertThat(union.lockedFields()).containsExactly("a", "b");
    }

    @Test
    void testDifferenceKeepsUnsharedLeftFields() {
        BaseObject difference = record("a", 1, "b", 2, "c", 3).minus(record("b", 99, "d", 4));

        assertThat(difference.toMapping()).containsExactly(entry("a", 1), entry("c", 3));
    }

    @Test
    void testEqualsOnSelectedKeys() {
        MutableBaseObject left = record("a", 1, "b", 2);
        MutableBaseObject right = record("a", 1, "b", 3);

        assertThat(left.equalsOn(right, List.of("a"))).isTrue();
        assertThat(left.equalsOn(right, List.of("a", "b"))).isFalse();
        assertThat(left.equalsOn(right, null)).isFalse();
        assertThat(left.equalsOn(null, List.of("a"))).isFalse();
    }

    @Test
    void testEqualsOnTreatsMissingAsAbsent() {
        MutableBaseObject left = record("a", 1);
        MutableBaseObject right = record("a", 1, "b", null);

        assertThat(left.equalsOn(right, List.of("a", "c"))).isTrue();
        assertThat(left.equalsOn(right, List.of("b"))).isFalse();
    }

    @Test
    void testOrderingComparesSortedPairs() {
        assertThat(record("a", 1, "b", 2).isLessThan(record("b", 2, "a", 2))).isTrue();
        assertThat(record("b", 1).isGreaterThan(record("a", 9))).isTrue();
        assertThat(record("a", 1).compareTo(record("a", 1, "b", 0))).isNegative();
        assertThat(record("a", 1L).compareTo(record("a", 2.5))).isNegative();
        assertThat(record("a", null).isLessThan(record("a", 0))).isTrue();
    }

    @Test
    void testOrderingAgreesWithEqualsAcrossNumberTypes() {
        MutableBaseObject asLong = record("a", 1L);
        MutableBaseObject asDouble = record("a", 1.0);

        assertThatObject(asLong).isNotEqualTo(asDouble);
        assertThat(asLong.compareTo(asDouble)).isPositive();
        assertThat(asDouble.compareTo(asLong)).isNegative();
        assertThat(new TreeSet<>(List.of(asLong, asDouble))).hasSize(2);
    }

    @Test
    void testOrderingOfIncomparableValuesFails() {
        assertThatThrownBy(() -> record("a", "x").compareTo(record("a", 1))).isInstanceOf(ClassCastException.class);
        assertThatThrownBy(() -> record("a", new Object()).compareTo(record("a", new Object())))
                .isInstanceOf(ClassCastException.class);
    }

    @Test
    void testFilterByType() {
        MutableBaseObject record = record("a", 1, "b", "two", "c", 3L, "d", null);

        assertThat(record.filterByType(Integer.class)).containsOnlyKeys("a");
        assertThat(record.filterByType(Number.class)).containsOnlyKeys("a", "c");
    }

    @Test
    void testFilteredMappingByKeysAndType() {
        MutableBaseObject record = record("a", 1, "b", "two", "c", 3);

        assertThat(record.toFilteredMapping(List.of("a", "b"), null)).containsOnlyKeys("a", "b");
        assertThat(record.toFilteredMapping(List.of("a", "b"), Integer.class)).containsOnlyKeys("a");
        assertThat(record.toFilteredMapping(null, null)).containsOnlyKeys("a", "b", "c");
    }

    @Test
    void testSchemaTypeUnion() {
        Person left = RecordFixtures.person("Alice", 30);
        Person right = new Person(Attributes.of("age", 31));

        BaseObject union = left.plus(right);

        assertThatObject(union).isInstanceOf(Person.class);
        assertThat(union.get("age")).isEqualTo(31);
        assertThat(union.get("name")).isNull();
    }

    @Test
    void testRecordsSortWithCollections() {
        List<MutableBaseObject> records = new ArrayList<>(List.of(record("a", 3), record("a", 1), record("a", 2)));

        records.sort(null);

        assertThat(records).extracting(r -> r.get("a")).containsExactly(1, 2, 3);
    }

    @Test
    void testFilterReturnsCopy() {
        MutableBaseObject record = record("a", 1);
        Map<String, Object> filtered = record.filterByType(Integer.class);

        filtered.put("b", 2);

        assertThat(record.has("b")).isFalse();
    }
}
