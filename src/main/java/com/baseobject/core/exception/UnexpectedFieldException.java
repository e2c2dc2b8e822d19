package com.baseobject.core.exception;

/**
 * A construction value was supplied for a name the record type does not declare.
 */
public class UnexpectedFieldException extends BaseObjectException {

    private static final long serialVersionUID = 1L;

    public UnexpectedFieldException(String fieldName, Class<?> recordType) {
        super(fieldName, "Unexpected argument: '" + fieldName + "' is not declared by " + recordType.getSimpleName());
    }
}
