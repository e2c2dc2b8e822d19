package com.baseobject.core.exception;

/**
 * Text projection of a record could not be written or read.
 */
public class SerializationException extends BaseObjectException {

    private static final long serialVersionUID = 1L;

    public SerializationException(String message, Throwable cause) {
        super(null, message, cause);
    }
}
