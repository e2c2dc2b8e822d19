package com.baseobject.core.exception;

/**
 * A field value has no known way of being deep copied.
 */
public class UncopyableValueException extends BaseObjectException {

    private static final long serialVersionUID = 1L;

    public UncopyableValueException(String fieldName, Class<?> valueType) {
        super(fieldName, describe(fieldName, valueType) + ": it is not a known container, immutable value or Serializable");
    }

    public UncopyableValueException(String fieldName, Class<?> valueType, Throwable cause) {
        super(fieldName, describe(fieldName, valueType) + ": serialization failed", cause);
    }

    private static String describe(String fieldName, Class<?> valueType) {
        return "Cannot deep copy value of type " + valueType.getName()
                + (fieldName == null ? "" : " held by field '" + fieldName + "'");
    }
}
