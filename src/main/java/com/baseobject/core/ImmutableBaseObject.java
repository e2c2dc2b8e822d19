package com.baseobject.core;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.baseobject.core.exception.MissingValueException;
import com.baseobject.core.guard.LockState;
import com.baseobject.core.guard.LockTable;
import com.baseobject.core.ops.RecordFactory;

/**
 * Record whose construction fields are locked against writes and deletes.
 *
 * <p>Locks are tracked per field. Fields can be unlocked and locked again, and
 * new fields can be introduced through {@link #lock(String, boolean, Object)}.
 * {@link #lockAll()} freezes the whole record.</p>
 *
 * <p>{@link #postConstruct()} runs before the lock table is armed, so
 * subclasses may derive further fields there.</p>
 */
public class ImmutableBaseObject extends BaseObject {

    static {
        RecordFactory.register(ImmutableBaseObject.class, ImmutableBaseObject::new);
    }

    public ImmutableBaseObject() {
        this(Map.of());
    }

    public ImmutableBaseObject(Map<String, ?> values) {
        super(values, type -> new LockTable(type.getSimpleName()));
    }

    private LockTable locks() {
        return (LockTable) guard();
    }

    /**
     * True once construction has completed.
     */
    public boolean isLocked() {
        return locks().getState() == LockState.LOCKED;
    }

    public boolean isLocked(String name) {
        return locks().isLocked(name);
    }

    public List<String> lockedFields() {
        return locks().snapshot().entrySet().stream()
                .filter(Map.Entry::getValue)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public void lock(String name) {
        lock(name, false, null);
    }

    public void lock(String name, boolean allowNew) {
        lock(name, allowNew, null);
    }

    /**
     * Locks a field, optionally writing its value first.
     *
     * @param allowNew accept a name the lock table does not know yet
     * @param value value to store before locking, or null to keep the current one
     * @throws com.baseobject.core.exception.NotRegisteredException unknown name without {@code allowNew}
     * @throws com.baseobject.core.exception.PrivateFieldException reserved name
     * @throws MissingValueException new name without a value
     */
    public void lock(String name, boolean allowNew, Object value) {
        LockTable locks = locks();
        locks.verifyLockable(name, allowNew);
        if (value != null) {
            store(name, value);
        } else if (allowNew && !has(name)) {
            throw new MissingValueException(name);
        }
        locks.lock(name);
    }

    public void unlock(String name) {
        locks().unlock(name);
    }

    /**
     * Locks every current field and rejects any new one.
     */
    public void lockAll() {
        locks().lockAll(keys());
    }

    @Override
    public ImmutableBaseObject copy() {
        return RecordFactory.create(getClass(), toMapping());
    }

    /**
     * Shallow copy, mutable when {@code asMutable} is set.
     */
    public BaseObject copy(boolean asMutable) {
        return asMutable ? new MutableBaseObject(toMapping()) : copy();
    }
}
