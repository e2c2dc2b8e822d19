package com.baseobject.core.coercion;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.commons.lang3.ClassUtils;

import com.baseobject.core.BaseObject;
import com.baseobject.core.Tuple;
import com.baseobject.core.ops.RecordFactory;

/**
 * Per-type table of converters used when a construction value does not already
 * match its declared type.
 *
 * Enum types convert from their constant names and record types convert from
 * mappings without being registered.
 */
public final class ConversionTable {

    private static final Map<Class<?>, Convertible<?>> CONVERTERS = new ConcurrentHashMap<>();

    static {
        register(String.class, String::valueOf);
        register(Long.class, ConversionTable::toLong);
        register(Integer.class, value -> Math.toIntExact(toLong(value)));
        register(Short.class, value -> narrow(toLong(value), Short.MIN_VALUE, Short.MAX_VALUE).shortValue());
        register(Byte.class, value -> narrow(toLong(value), Byte.MIN_VALUE, Byte.MAX_VALUE).byteValue());
        register(Double.class, ConversionTable::toDouble);
        register(Float.class, value -> (float) toDouble(value));
        register(BigDecimal.class, ConversionTable::toBigDecimal);
        register(BigInteger.class, value -> toBigDecimal(value).toBigInteger());
        register(Boolean.class, ConversionTable::toBoolean);
        register(Character.class, ConversionTable::toCharacter);
        register(UUID.class, value -> UUID.fromString(text(value)));
        register(LocalDate.class, value -> LocalDate.parse(text(value)));
        register(LocalDateTime.class, value -> LocalDateTime.parse(text(value)));
        register(Instant.class, value -> Instant.parse(text(value)));
        register(List.class, ConversionTable::toList);
        register(ArrayList.class, ConversionTable::toList);
        register(Collection.class, ConversionTable::toList);
        register(Set.class, value -> new LinkedHashSet<>(toList(value)));
        register(LinkedHashSet.class, value -> new LinkedHashSet<>(toList(value)));
        register(Map.class, ConversionTable::toMap);
        register(LinkedHashMap.class, ConversionTable::toMap);
        register(Tuple.class, value -> Tuple.copyOf(toList(value)));
    }

    private ConversionTable() {
        // Utility class
    }

    public static <T> void register(Class<T> type, Convertible<? extends T> convertible) {
        if (type == null || convertible == null) {
            throw new IllegalArgumentException("Type and converter are required");
        }
        CONVERTERS.put(ClassUtils.primitiveToWrapper(type), convertible);
    }

    /**
     * Finds the converter for a target type, or null when the type has none.
     */
    public static Convertible<?> lookup(Class<?> type) {
        Class<?> target = ClassUtils.primitiveToWrapper(type);
        Convertible<?> registered = CONVERTERS.get(target);
        if (registered != null) {
            return registered;
        }
        if (target.isEnum()) {
            return value -> enumConstant(target, text(value));
        }
        if (BaseObject.class.isAssignableFrom(target)) {
            Class<? extends BaseObject> recordType = target.asSubclass(BaseObject.class);
            return value -> RecordFactory.create(recordType, mapping(value));
        }
        return null;
    }

    private static Object enumConstant(Class<?> type, String name) {
        for (Object constant : type.getEnumConstants()) {
            if (((Enum<?>) constant).name().equals(name)) {
                return constant;
            }
        }
        throw new IllegalArgumentException("No constant " + name + " in " + type.getSimpleName());
    }

    private static String text(Object value) {
        if (value instanceof String s) {
            return s.trim();
        }
        if (value instanceof Character c) {
            return c.toString();
        }
        throw new IllegalArgumentException("Expected text, got " + value.getClass().getName());
    }

    private static long toLong(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number number) {
            return toBigDecimal(number).toBigInteger().longValueExact();
        }
        return Long.parseLong(text(value));
    }

    private static Long narrow(long value, long min, long max) {
        if (value < min || value > max) {
            throw new ArithmeticException(value + " is out of range [" + min + ", " + max + "]");
        }
        return value;
    }

    private static double toDouble(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return Double.parseDouble(text(value));
    }

    private static BigDecimal toBigDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new ArithmeticException("Cannot convert " + d + " to a decimal");
            }
            return BigDecimal.valueOf(d);
        }
        if (value instanceof Number || value instanceof Boolean) {
            return BigDecimal.valueOf(toLong(value));
        }
        return new BigDecimal(text(value));
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        String text = text(value);
        if (text.equalsIgnoreCase("true")) {
            return Boolean.TRUE;
        }
        if (text.equalsIgnoreCase("false")) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Not a boolean: '" + text + "'");
    }

    private static Character toCharacter(Object value) {
        if (value instanceof String s && s.length() == 1) {
            return s.charAt(0);
        }
        throw new IllegalArgumentException("Expected a single character, got " + value);
    }

    private static ArrayList<Object> toList(Object value) {
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value instanceof Tuple tuple) {
            return new ArrayList<>(tuple.toList());
        }
        if (value instanceof Object[] array) {
            return new ArrayList<>(Arrays.asList(array));
        }
        throw new IllegalArgumentException("Expected a collection, got " + value.getClass().getName());
    }

    private static LinkedHashMap<String, Object> toMap(Object value) {
        return new LinkedHashMap<>(mapping(value));
    }

    private static Map<String, Object> mapping(Object value) {
        if (value instanceof BaseObject record) {
            return record.toMapping();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((key, entry) -> result.put(String.valueOf(key), entry));
            return result;
        }
        throw new IllegalArgumentException("Expected a mapping, got " + value.getClass().getName());
    }
}
