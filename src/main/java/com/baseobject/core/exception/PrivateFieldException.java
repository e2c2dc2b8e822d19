package com.baseobject.core.exception;

/**
 * Lock or unlock requested for a reserved bookkeeping name.
 */
public class PrivateFieldException extends BaseObjectException {

    private static final long serialVersionUID = 1L;

    public PrivateFieldException(String fieldName, boolean locking) {
        super(fieldName, "Cannot " + (locking ? "lock" : "unlock") + " private attribute '" + fieldName + "'");
    }
}
