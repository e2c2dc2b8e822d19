package com.baseobject.core.exception;

/**
 * Strict read or delete of a field that does not exist.
 */
public class FieldNotFoundException extends BaseObjectException {

    private static final long serialVersionUID = 1L;

    public FieldNotFoundException(String fieldName, Class<?> recordType) {
        super(fieldName, "'" + fieldName + "' not found in " + recordType.getSimpleName());
    }
}
