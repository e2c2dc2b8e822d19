package com.baseobject.core.guard;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.baseobject.core.BaseObject;
import com.baseobject.core.exception.ImmutableFieldException;
import com.baseobject.core.exception.NotRegisteredException;
import com.baseobject.core.exception.PrivateFieldException;

/**
 * Guard of the immutable variant.
 *
 * <p>Every field supplied at construction starts locked. Fields written later
 * through a bulk update are registered and locked; fields written one at a time
 * stay unregistered and writable until they are locked explicitly. Once any
 * field has been locked explicitly, the table is sealed and only registered
 * names accept writes.</p>
 *
 * <p>Reserved names are never tracked and always writable.</p>
 */
public class LockTable implements MutabilityGuard {

    private final String recordName;
    private final Map<String, Boolean> locks = new LinkedHashMap<>();
    private LockState state = LockState.UNLOCKED;
    private boolean sealed;

    public LockTable(String recordName) {
        this.recordName = recordName;
    }

    @Override
    public void checkWrite(String name) {
        if (state == LockState.UNLOCKED || BaseObject.isReserved(name)) {
            return;
        }
        Boolean locked = locks.get(name);
        if (Boolean.TRUE.equals(locked) || (locked == null && sealed)) {
            throw new ImmutableFieldException(name, recordName);
        }
    }

    @Override
    public void constructionCompleted(Collection<String> suppliedNames) {
        if (state == LockState.LOCKED) {
            throw new IllegalStateException(recordName + " is already constructed");
        }
        for (String name : suppliedNames) {
            if (!BaseObject.isReserved(name)) {
                locks.put(name, Boolean.TRUE);
            }
        }
        state = LockState.LOCKED;
    }

    @Override
    public void fieldsIntroduced(Collection<String> names) {
        if (state == LockState.UNLOCKED) {
            return;
        }
        for (String name : names) {
            if (!BaseObject.isReserved(name)) {
                locks.putIfAbsent(name, Boolean.TRUE);
            }
        }
    }

    @Override
    public void fieldRemoved(String name) {
        locks.remove(name);
    }

    /**
     * Fails when the name cannot be locked: unknown without {@code allowNew}, or reserved.
     */
    public void verifyLockable(String name, boolean allowNew) {
        if (!locks.containsKey(name) && !allowNew) {
            throw new NotRegisteredException(name);
        }
        if (BaseObject.isReserved(name)) {
            throw new PrivateFieldException(name, true);
        }
    }

    public void lock(String name) {
        locks.put(name, Boolean.TRUE);
        sealed = true;
    }

    /**
     * Checked in the same order as {@link #verifyLockable}: registration, then reserved names.
     */
    public void unlock(String name) {
        if (!locks.containsKey(name)) {
            throw new NotRegisteredException(name);
        }
        if (BaseObject.isReserved(name)) {
            throw new PrivateFieldException(name, false);
        }
        locks.put(name, Boolean.FALSE);
    }

    /**
     * Locks every given name and seals the table: the whole record becomes read-only.
     */
    public void lockAll(Collection<String> names) {
        for (String name : names) {
            if (!BaseObject.isReserved(name)) {
                locks.put(name, Boolean.TRUE);
            }
        }
        sealed = true;
    }

    public boolean isLocked(String name) {
        return Boolean.TRUE.equals(locks.get(name));
    }

    public boolean isRegistered(String name) {
        return locks.containsKey(name);
    }

    public boolean isSealed() {
        return sealed;
    }

    public LockState getState() {
        return state;
    }

    public Map<String, Boolean> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(locks));
    }
}
