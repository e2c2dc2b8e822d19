package com.baseobject.core.exception;

/**
 * A construction value could not be accepted or converted to its declared type.
 */
public class TypeMismatchException extends BaseObjectException {

    private static final long serialVersionUID = 1L;

    private final Class<?> expectedType;
    private final Class<?> actualType;

    public TypeMismatchException(String fieldName, Class<?> expectedType, Class<?> actualType) {
        this(fieldName, expectedType, actualType, null);
    }

    public TypeMismatchException(String fieldName, Class<?> expectedType, Class<?> actualType, Throwable cause) {
        super(fieldName, "Invalid type for field '" + fieldName + "': expected "
                + expectedType.getName() + ", got " + (actualType == null ? "null" : actualType.getName()), cause);
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public Class<?> getExpectedType() {
        return expectedType;
    }

    public Class<?> getActualType() {
        return actualType;
    }
}
