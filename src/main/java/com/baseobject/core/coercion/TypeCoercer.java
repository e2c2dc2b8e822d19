package com.baseobject.core.coercion;

import org.apache.commons.lang3.ClassUtils;

import com.baseobject.core.exception.TypeMismatchException;

import lombok.experimental.UtilityClass;

/**
 * Construction-time type check: accepts a value, converts it to the declared
 * type, or rejects it.
 */
@UtilityClass
public class TypeCoercer {

    /**
     * Returns the value to store for a declared field.
     *
     * Absent values and undeclared types pass through unchanged, as do values
     * already of the expected type. Anything else goes through the target
     * type's converter; a missing converter or a failed conversion is a
     * {@link TypeMismatchException}.
     */
    public Object coerce(String name, Object value, Class<?> expectedType) {
        if (value == null || expectedType == null) {
            return value;
        }
        Class<?> target = ClassUtils.primitiveToWrapper(expectedType);
        if (target.isInstance(value)) {
            return value;
        }

        Convertible<?> converter = ConversionTable.lookup(target);
        if (converter == null) {
            throw new TypeMismatchException(name, target, value.getClass());
        }

        Object converted;
        try {
            converted = converter.convert(value);
        } catch (RuntimeException e) {
            throw new TypeMismatchException(name, target, value.getClass(), e);
        }
        if (!target.isInstance(converted)) {
            throw new TypeMismatchException(name, target, value.getClass());
        }
        return converted;
    }
}
