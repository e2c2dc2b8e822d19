package com.baseobject.core.exception;

/**
 * A new field was locked without a value to hold.
 */
public class MissingValueException extends BaseObjectException {

    private static final long serialVersionUID = 1L;

    public MissingValueException(String fieldName) {
        super(fieldName, "New attribute '" + fieldName + "' must have a value when locking");
    }
}
