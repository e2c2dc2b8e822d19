package com.baseobject.core.schema;

import org.apache.commons.lang3.ClassUtils;

import com.baseobject.core.BaseObject;
import com.baseobject.core.exception.TypeMismatchException;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * Typed handle on a declared field.
 *
 * Primitive types are stored boxed, so {@code FieldKey.of("age", int.class)}
 * declares an {@code Integer} field.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FieldKey<T> {

    @NonNull
    String name;

    @NonNull
    Class<T> type;

    @SuppressWarnings("unchecked")
    public static <T> FieldKey<T> of(String name, Class<T> type) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field name must not be blank");
        }
        if (BaseObject.isReserved(name)) {
            throw new IllegalArgumentException("Field name '" + name + "' uses the reserved prefix '"
                    + BaseObject.RESERVED_PREFIX + "'");
        }
        return new FieldKey<>(name, (Class<T>) ClassUtils.primitiveToWrapper(type));
    }

    /**
     * Casts a stored value to this key's type. Later writes skip coercion, so the
     * stored value may no longer match.
     */
    public T cast(Object value) {
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new TypeMismatchException(name, type, value.getClass());
        }
        return type.cast(value);
    }
}
