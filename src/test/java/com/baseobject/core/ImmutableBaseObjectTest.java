package com.baseobject.core;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.baseobject.core.RecordFixtures.FrozenPerson;
import com.baseobject.core.RecordFixtures.Labelled;
import com.baseobject.core.exception.FieldNotFoundException;
import com.baseobject.core.exception.ImmutableFieldException;
import com.baseobject.core.exception.MissingValueException;
import com.baseobject.core.exception.NotRegisteredException;
import com.baseobject.core.exception.PrivateFieldException;

/**
 * Unit tests for field locking on the immutable record.
 */
class ImmutableBaseObjectTest {

    @Test
    void testConstructionFieldsAreLocked() {
        FrozenPerson person = RecordFixtures.frozenPerson("Alice", 30);

        assertThat(person.isLocked()).isTrue();
        assertThat(person.lockedFields()).containsExactly("name", "age");
        assertThatThrownBy(() -> person.set("age", 31))
                .isInstanceOf(ImmutableFieldException.class)
                .hasMessageContaining("'age'")
                .hasMessageContaining("FrozenPerson");
        assertThat(person.get("age")).isEqualTo(30);
    }

    @Test
    void testDeleteOfLockedFieldFails() {
        ImmutableBaseObject record = new ImmutableBaseObject(Attributes.of("a", 1));

        assertThatThrownBy(() -> record.delete("a")).isInstanceOf(ImmutableFieldException.class);
        assertThat(record.has("a")).isTrue();
    }

    @Test
    void testSingleWriteOfNewFieldStaysUnlocked() {
        ImmutableBaseObject record = new ImmutableBaseObject(Attributes.of("a", 1));

        record.set("b", 2);
        record.set("b", 3);

        assertThat(record.get("b")).isEqualTo(3);
        assertThat(record.isLocked("b")).isFalse();
    }

    @Test
    void testUpdateLocksIntroducedFields() {
        ImmutableBaseObject record = new ImmutableBaseObject(Attributes.of("a", 1));

        record.update(Attributes.of("b", 2));

        assertThat(record.isLocked("b")).isTrue();
        assertThatThrownBy(() -> record.set("b", 3)).isInstanceOf(ImmutableFieldException.class);
    }

    @Test
    void testFailedUpdateChangesNothing() {
        ImmutableBaseObject record = new ImmutableBaseObject(Attributes.of("a", 1));

        assertThatThrownBy(() -> record.update(Attributes.of("b", 2, "a", 5)))
                .isInstanceOf(ImmutableFieldException.class);

        assertThat(record.has("b")).isFalse();
        assertThat(record.get("a")).isEqualTo(1);
    }

    @Test
    void testLockNewFieldWithValue() {
        ImmutableBaseObject record = new ImmutableBaseObject(Attributes.of("name", "Bob"));

        record.lock("age", true, 40);

        assertThat(record.get("age")).isEqualTo(40);
        assertThat(record.isLocked("age")).isTrue();
        assertThatThrownBy(() -> record.set("age", 41)).isInstanceOf(ImmutableFieldException.class);
    }

    @Test
    void testLockNewFieldWithoutValueFails() {
        ImmutableBaseObject record = new ImmutableBaseObject(Attributes.of("name", "Bob"));

        assertThatThrownBy(() -> record.lock("age", true))
                .isInstanceOf(MissingValueException.class)
                .extracting("fieldName").isEqualTo("age");
    }

    @Test
    void testLockUnknownFieldFails() {
        ImmutableBaseObject record = new ImmutableBaseObject(Attributes.of("name", "Bob"));

        assertThatThrownBy(() -> record.lock("age")).isInstanceOf(NotRegisteredException.class);
    }

    @Test
    void testLockExistingUnregisteredFieldWithAllowNew() {
        ImmutableBaseObject record = new ImmutableBaseObject(Attributes.of("name", "Bob"));
        record.set("nick", "B");

        record.lock("nick", true);

        assertThat(record.isLocked("nick")).isTrue();
        assertThat(record.get("nick")).isEqualTo("B");
    }

    @Test
    void testReservedNamesCannotBeLockedOrUnlocked() {
        ImmutableBaseObject record = new ImmutableBaseObject(Attributes.of("a", 1));

        assertThatThrownBy(() -> record.lock("_cache", true, 1)).isInstanceOf(PrivateFieldException.class);
        assertThatThrownBy(() -> record.unlock("_cache")).isInstanceOf(NotRegisteredException.class);
        assertThat(record.has("_cache")).isFalse();
    }

    @Test
    void testReservedNamesStayWritable() {
        ImmutableBaseObject record = new ImmutableBaseObject(Attributes.of("a", 1));
        record.lockAll();

        record.set("_cache", "x");
        record.set("_cache", "y");

        assertThat(record.get("_cache")).isEqualTo("y");
    }

    @Test
    void testUnlockThenRelock() {
        ImmutableBaseObject record = new ImmutableBaseObject(Attributes.of("a", 1));

        record.unlock("a");
        record.set("a", 2);
        record.lock("a");

        assertThat(record.get("a")).isEqualTo(2);
        assertThatThrownBy(() -> record.set("a", 3)).isInstanceOf(ImmutableFieldException.class);
    }

    @Test
    void testUnlockUnknownFieldFails() {
        ImmutableBaseObject record = new ImmutableBaseObject(Attributes.of("a", 1));

        assertThatThrownBy(() -> record.unlock("b")).isInstanceOf(NotRegisteredException.class);
    }

    @Test
    void testExplicitLockRejectsUnregisteredNames() {
        ImmutableBaseObject record = new ImmutableBaseObject(Attributes.of("a", 1));
        record.unlock("a");

        record.lock("a");

        assertThatThrownBy(() -> record.set("fresh", 1)).isInstanceOf(ImmutableFieldException.class);
    }

    @Test
    void testLockAllFreezesRecord() {
        ImmutableBaseObject record = new ImmutableBaseObject(Attributes.of("a", 1));
        record.set("b", 2);

        record.lockAll();

        assertThat(record.lockedFields()).containsExactlyInAnyOrder("a", "b");
        assertThatThrownBy(() -> record.set("b", 3)).isInstanceOf(ImmutableFieldException.class);
        assertThatThrownBy(() -> record.set("c", 3)).isInstanceOf(ImmutableFieldException.class);
    }

    @Test
    void testDeletingAbsentFieldOfFrozenRecordReportsNotFound() {
        ImmutableBaseObject record = new ImmutableBaseObject(Attributes.of("a", 1));
        record.lockAll();

        assertThatThrownBy(() -> record.delete("missing")).isInstanceOf(FieldNotFoundException.class);
        assertThatThrownBy(() -> record.delete("a")).isInstanceOf(ImmutableFieldException.class);
    }

    @Test
    void testPostConstructRunsBeforeLocking() {
        Labelled labelled = new Labelled(Attributes.of("first", "Ada", "last", "Lovelace"));

        assertThat(labelled.get("label")).isEqualTo("Ada Lovelace");
        assertThat(labelled.isLocked("first")).isTrue();
        assertThat(labelled.isLocked("label")).isFalse();
    }

    @Test
    void testCopyKeepsTypeAndLocks() {
        FrozenPerson person = RecordFixtures.frozenPerson("Alice", 30);

        ImmutableBaseObject copy = person.copy();

        assertThatObject(copy).isInstanceOf(FrozenPerson.class).isEqualTo(person);
        assertThatThrownBy(() -> copy.set("age", 31)).isInstanceOf(ImmutableFieldException.class);
    }

    @Test
    void testCopyAsMutable() {
        FrozenPerson person = RecordFixtures.frozenPerson("Alice", 30);

        BaseObject copy = person.copy(true);
        copy.set("age", 31);

        assertThatObject(copy).isInstanceOf(MutableBaseObject.class);
        assertThat(copy.get("age")).isEqualTo(31);
        assertThat(person.get("age")).isEqualTo(30);
    }

    @Test
    void testDeepCloneStaysLocked() {
        FrozenPerson person = RecordFixtures.frozenPerson("Alice", 30);

        BaseObject clone = person.deepClone();

        assertThatObject(clone).isInstanceOf(FrozenPerson.class);
        assertThatThrownBy(() -> clone.set("age", 31)).isInstanceOf(ImmutableFieldException.class);
    }
}
