package io.github.cyfko.querier.core.utils;

import io.github.cyfko.querier.core.config.EnumMatchMode;

import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.*;

/**
 * Type conversion utility turning raw filter values into the type of the targeted field.
 * <p>
 * Raw values reach the engine as strings. Before a clause can be compiled its value must be
 * coerced into the declared type of the field accessor; this class centralizes those rules so
 * that every {@link io.github.cyfko.querier.core.spi.QuerySource} implementation sees the same
 * typed literals.
 * </p>
 *
 * <h2>Supported Type Categories</h2>
 * <dl>
 *   <dt><strong>Numeric Types</strong></dt>
 *   <dd>Primitives and wrappers (int, long, short, byte, double, float), BigDecimal, BigInteger.</dd>
 *
 *   <dt><strong>Date/Time Types</strong></dt>
 *   <dd>
 *     LocalDate, LocalDateTime, LocalTime, Instant, OffsetDateTime, ZonedDateTime,
 *     java.util.Date. ISO-8601 input; values carrying an offset are normalized to UTC and values
 *     without one are read as UTC.
 *   </dd>
 *
 *   <dt><strong>Enum Types</strong></dt>
 *   <dd>Case-sensitive or case-insensitive matching via {@link EnumMatchMode}.</dd>
 *
 *   <dt><strong>Other Types</strong></dt>
 *   <dd>
 *     Boolean ({@code true/false}, any case), UUID, String, and any type exposing a
 *     public {@code String} constructor or a static {@code valueOf(String)} factory.
 *   </dd>
 * </dl>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * // Throwing conversion
 * Integer age = (Integer) TypeConversionUtils.convertValue(Integer.class, "25", EnumMatchMode.CASE_INSENSITIVE);
 *
 * // Non-throwing conversion used by the predicate compiler
 * Optional<Object> status = TypeConversionUtils.tryConvert(Status.class, "active", EnumMatchMode.CASE_INSENSITIVE);
 * }</pre>
 *
 * <p>All methods are stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see EnumMatchMode
 */
public final class TypeConversionUtils {

    private TypeConversionUtils() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    // ========================================
    // PUBLIC API
    // ========================================

    /**
     * Attempts to convert a raw value into the target type.
     *
     * @param targetType    the type of the field the value is compared with
     * @param raw           the raw client value
     * @param enumMatchMode the enum matching strategy
     * @return the converted value, or empty when the value cannot be represented in the target type
     */
    public static Optional<Object> tryConvert(Class<?> targetType, String raw, EnumMatchMode enumMatchMode) {
        if (targetType == null || raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(convertValue(targetType, raw, enumMatchMode));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Converts a value to the specified target type.
     *
     * @param targetType    the target class to convert to
     * @param value         the value to convert
     * @param enumMatchMode the enum matching strategy
     * @return the converted value, {@code null} when {@code value} is null
     * @throws IllegalArgumentException if conversion is not possible
     */
    public static Object convertValue(Class<?> targetType, Object value, EnumMatchMode enumMatchMode) {
        if (value == null) {
            return null;
        }
        Class<?> type = box(targetType);

        if (type.isInstance(value)) {
            return value;
        }

        try {
            if (type == String.class) return value.toString();

            // BigDecimal/BigInteger before the generic numeric branch
            if (type == BigDecimal.class) return new BigDecimal(value.toString().trim());
            if (type == BigInteger.class) return new BigInteger(value.toString().trim());
            if (Number.class.isAssignableFrom(type)) return convertToNumeric(type, value);

            if (type.isEnum()) return convertToEnum(type, value, enumMatchMode);
            if (type == Boolean.class) return convertToBoolean(value);

            if (type == LocalDate.class) return convertToLocalDate(value);
            if (type == LocalDateTime.class) return convertToLocalDateTime(value);
            if (type == LocalTime.class) return LocalTime.parse(value.toString().trim());
            if (type == Instant.class) return convertToInstant(value);
            if (type == OffsetDateTime.class) return convertToInstant(value).atOffset(ZoneOffset.UTC);
            if (type == ZonedDateTime.class) return convertToInstant(value).atZone(ZoneOffset.UTC);
            if (type == Date.class) return Date.from(convertToInstant(value));

            if (type == UUID.class) return UUID.fromString(value.toString().trim());

            Object fallback = convertThroughFactory(type, value.toString());
            if (fallback != null) {
                return fallback;
            }

            throw new IllegalArgumentException(
                    String.format("Cannot convert value '%s' (type: %s) to target type %s",
                            value, value.getClass().getName(), type.getName())
            );
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IllegalArgumentException(
                    String.format("Error converting value '%s' to type %s: %s",
                            value, type.getName(), e.getMessage()), e
            );
        }
    }

    /**
     * Returns the wrapper type of a primitive type, or the type itself.
     *
     * @param type any type, possibly primitive
     * @return the boxed type
     */
    public static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == double.class) return Double.class;
        if (type == float.class) return Float.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        if (type == boolean.class) return Boolean.class;
        if (type == char.class) return Character.class;
        return Void.class;
    }

    // ========================================
    // INTERNAL: Numeric Conversions
    // ========================================

    private static Object convertToNumeric(Class<?> targetType, Object value) {
        if (value instanceof Number num) {
            if (targetType == Integer.class) return num.intValue();
            if (targetType == Long.class) return num.longValue();
            if (targetType == Double.class) return num.doubleValue();
            if (targetType == Float.class) return num.floatValue();
            if (targetType == Short.class) return num.shortValue();
            if (targetType == Byte.class) return num.byteValue();
        }

        String str = value.toString().trim();
        if (targetType == Integer.class) return Integer.valueOf(str);
        if (targetType == Long.class) return Long.valueOf(str);
        if (targetType == Double.class) return Double.valueOf(str);
        if (targetType == Float.class) return Float.valueOf(str);
        if (targetType == Short.class) return Short.valueOf(str);
        if (targetType == Byte.class) return Byte.valueOf(str);

        throw new IllegalArgumentException("Unsupported numeric type: " + targetType);
    }

    // ========================================
    // INTERNAL: Enum Conversion
    // ========================================

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object convertToEnum(Class<?> targetType, Object value, EnumMatchMode enumMatchMode) {
        Class<? extends Enum> enumClass = (Class<? extends Enum>) targetType;
        String stringValue = value.toString().trim();

        for (Enum constant : enumClass.getEnumConstants()) {
            if (constant.name().equals(stringValue)) {
                return constant;
            }
        }
        if (enumMatchMode != EnumMatchMode.CASE_SENSITIVE) {
            for (Enum constant : enumClass.getEnumConstants()) {
                if (constant.name().equalsIgnoreCase(stringValue)) {
                    return constant;
                }
            }
        }

        throw new IllegalArgumentException(
                String.format("Invalid value '%s' for enum %s (mode: %s)",
                        stringValue, enumClass.getSimpleName(), enumMatchMode)
        );
    }

    // ========================================
    // INTERNAL: Boolean Conversion
    // ========================================

    private static Boolean convertToBoolean(Object value) {
        String normalized = value.toString().trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "true" -> Boolean.TRUE;
            case "false" -> Boolean.FALSE;
            default -> throw new IllegalArgumentException("Invalid boolean value: '" + value + "'");
        };
    }

    // ========================================
    // INTERNAL: Date/Time Conversions
    // ========================================

    private static LocalDate convertToLocalDate(Object value) {
        String str = value.toString().trim();
        if (str.length() == 10) {
            return LocalDate.parse(str);
        }
        return convertToLocalDateTime(str).toLocalDate();
    }

    private static LocalDateTime convertToLocalDateTime(Object value) {
        String str = value.toString().trim();
        if (str.length() == 10) {
            return LocalDate.parse(str).atStartOfDay();
        }
        return LocalDateTime.ofInstant(convertToInstant(str), ZoneOffset.UTC);
    }

    private static Instant convertToInstant(Object value) {
        String str = value.toString().trim();
        if (str.length() == 10) {
            return LocalDate.parse(str).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        TemporalAccessor parsed;
        try {
            parsed = DateTimeFormatter.ISO_DATE_TIME.parse(str);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date/time value: '" + str + "'", e);
        }
        LocalDateTime local = LocalDateTime.from(parsed);
        if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
            return local.toInstant(ZoneOffset.ofTotalSeconds(
                    parsed.get(ChronoField.OFFSET_SECONDS)));
        }
        return local.toInstant(ZoneOffset.UTC);
    }

    // ========================================
    // INTERNAL: Generic Fallback
    // ========================================

    private static Object convertThroughFactory(Class<?> type, String raw) {
        try {
            Constructor<?> constructor = type.getConstructor(String.class);
            return constructor.newInstance(raw);
        } catch (NoSuchMethodException e) {
            // fall through to valueOf
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Cannot build " + type.getName() + " from '" + raw + "'", e);
        }

        try {
            Method valueOf = type.getMethod("valueOf", String.class);
            if (Modifier.isStatic(valueOf.getModifiers()) && type.isAssignableFrom(valueOf.getReturnType())) {
                return valueOf.invoke(null, raw);
            }
        } catch (NoSuchMethodException e) {
            return null;
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Cannot build " + type.getName() + " from '" + raw + "'", e);
        }
        return null;
    }
}
