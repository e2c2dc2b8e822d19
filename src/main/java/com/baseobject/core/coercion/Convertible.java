package com.baseobject.core.coercion;

/**
 * Conversion capability a target type registers with the {@link ConversionTable}.
 *
 * Implementations throw any runtime exception when the value cannot be converted.
 */
@FunctionalInterface
public interface Convertible<T> {

    T convert(Object value);
}
