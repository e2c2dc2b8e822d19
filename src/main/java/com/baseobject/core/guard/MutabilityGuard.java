package com.baseobject.core.guard;

import java.util.Collection;

/**
 * Decides whether a record accepts writes and deletes, and tracks the names it
 * has to protect.
 */
public interface MutabilityGuard {

    /**
     * Fails when the named field may not be written or deleted.
     */
    void checkWrite(String name);

    /**
     * Checks every name before any of them is applied.
     */
    default void checkWrites(Collection<String> names) {
        for (String name : names) {
            checkWrite(name);
        }
    }

    /**
     * Called once, after the record's fields and post-construction hook are in place.
     */
    void constructionCompleted(Collection<String> suppliedNames);

    /**
     * Called after a bulk update has written the given names.
     */
    void fieldsIntroduced(Collection<String> names);

    void fieldRemoved(String name);
}
