package com.baseobject.core.exception;

/**
 * Write or delete attempted on a locked field, or on a locked record as a whole.
 */
public class ImmutableFieldException extends BaseObjectException {

    private static final long serialVersionUID = 1L;

    public ImmutableFieldException(String fieldName, String recordName) {
        super(fieldName, fieldName == null
                ? "Cannot modify immutable object " + recordName
                : "Cannot modify immutable field '" + fieldName + "' of object " + recordName);
    }
}
