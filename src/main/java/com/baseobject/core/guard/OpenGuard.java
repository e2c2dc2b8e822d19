package com.baseobject.core.guard;

import java.util.Collection;

/**
 * Guard of the mutable variant: every write is accepted.
 */
public enum OpenGuard implements MutabilityGuard {

    INSTANCE;

    @Override
    public void checkWrite(String name) {
        // always writable
    }

    @Override
    public void constructionCompleted(Collection<String> suppliedNames) {
        // nothing to track
    }

    @Override
    public void fieldsIntroduced(Collection<String> names) {
        // nothing to track
    }

    @Override
    public void fieldRemoved(String name) {
        // nothing to track
    }
}
