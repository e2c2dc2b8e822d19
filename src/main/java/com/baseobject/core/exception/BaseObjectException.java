package com.baseobject.core.exception;

/**
 * Base type for every failure raised by record construction, access and locking.
 */
public abstract class BaseObjectException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String fieldName;

    protected BaseObjectException(String fieldName, String message) {
        super(message);
        this.fieldName = fieldName;
    }

    protected BaseObjectException(String fieldName, String message, Throwable cause) {
        super(message, cause);
        this.fieldName = fieldName;
    }

    /**
     * Name of the field the failure refers to, or null when it concerns the whole record.
     */
    public String getFieldName() {
        return fieldName;
    }
}
