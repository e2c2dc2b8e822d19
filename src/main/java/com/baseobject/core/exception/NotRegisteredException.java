package com.baseobject.core.exception;

/**
 * Lock or unlock requested for a field the lock table does not know.
 */
public class NotRegisteredException extends BaseObjectException {

    private static final long serialVersionUID = 1L;

    public NotRegisteredException(String fieldName) {
        super(fieldName, "Attribute '" + fieldName + "' has not been registered");
    }
}
