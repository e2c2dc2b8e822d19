package com.baseobject.core.guard;

/**
 * Whole-record lock state of an immutable record.
 *
 * <pre>
 * UNLOCKED  (construction in progress)
 *    │
 *    ▼ construction completed
 * LOCKED    (no way back)
 * </pre>
 */
public enum LockState {

    UNLOCKED,

    LOCKED
}
