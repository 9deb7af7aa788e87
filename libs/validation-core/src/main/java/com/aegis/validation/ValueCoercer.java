package com.aegis.validation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Coerces raw scalar values to the Java type of their {@link SemanticType}.
 *
 * <p>Record-valued types are not handled here; the field validator runs the nested pipeline for
 * them. Enum tags are coerced to their tag text so that {@link SetMembership} can report unknown
 * tags as {@link ViolationKind#ENUM_ERROR}.
 */
final class ValueCoercer {

    private static final Set<String> TRUE_TEXT = Set.of("true", "yes", "on", "1", "t", "y");
    private static final Set<String> FALSE_TEXT = Set.of("false", "no", "off", "0", "f", "n");

    /** Plain decimal integer text, optionally followed by a zero fraction ("42", "-7", "42.00"). */
    private static final Pattern INTEGER_TEXT = Pattern.compile("[+-]?\\d+(\\.0*)?");

    /** Plain decimal number text with an optional exponent; no hex, no type suffixes. */
    private static final Pattern DECIMAL_TEXT =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    /** ISO-8601 date, optionally followed by a time and an offset ({@code Z} or {@code +hh:mm}). */
    private static final DateTimeFormatter ISO_TIMESTAMP = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    /**
     * Result of one coercion.
     *
     * @param value the coerced value (null on failure)
     * @param error the type-error message (null on success)
     */
    record Coercion(Object value, String error) {

        static Coercion ok(Object value) {
            return new Coercion(value, null);
        }

        static Coercion failed(String error) {
            return new Coercion(null, error);
        }

        boolean succeeded() {
            return error == null;
        }
    }

    private final CoercionMode mode;

    ValueCoercer(CoercionMode mode) {
        this.mode = mode;
    }

    CoercionMode mode() {
        return mode;
    }

    Coercion coerce(FieldDeclaration field, Object raw) {
        return switch (field.type()) {
            case STRING -> toText(raw);
            case INTEGER -> toInteger(raw);
            case FLOAT -> toFloat(raw);
            case BOOLEAN -> toBoolean(raw);
            case TIMESTAMP -> toTimestamp(raw);
            case ENUM_TAG -> toTag(field, raw);
            case NESTED_RECORD, COLLECTION_OF_RECORD -> throw new IllegalArgumentException(
                    "record-valued field '" + field.name() + "' is not a scalar");
        };
    }

    private Coercion toText(Object raw) {
        if (raw instanceof String text) {
            return Coercion.ok(text);
        }
        if (raw instanceof Character c && mode == CoercionMode.LAX) {
            return Coercion.ok(c.toString());
        }
        return Coercion.failed("Input should be a valid string");
    }

    private Coercion toInteger(Object raw) {
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return Coercion.ok(((Number) raw).longValue());
        }
        if (raw instanceof BigInteger big) {
            return fitsInLong(big)
                    ? Coercion.ok(big.longValue())
                    : Coercion.failed("Input should be a valid integer, the number is out of range");
        }
        if (mode == CoercionMode.STRICT) {
            return Coercion.failed("Input should be a valid integer");
        }
        if (raw instanceof Double || raw instanceof Float) {
            double number = ((Number) raw).doubleValue();
            if (!Double.isFinite(number)) {
                return Coercion.failed("Input should be a finite number");
            }
            return integralValue(BigDecimal.valueOf(number));
        }
        if (raw instanceof BigDecimal decimal) {
            return integralValue(decimal);
        }
        if (raw instanceof String text) {
            String stripped = text.strip();
            if (!INTEGER_TEXT.matcher(stripped).matches()) {
                return Coercion.failed("Input should be a valid integer, unable to parse string as an integer");
            }
            return integralValue(new BigDecimal(stripped));
        }
        return Coercion.failed("Input should be a valid integer");
    }

    private Coercion integralValue(BigDecimal decimal) {
        BigDecimal stripped = decimal.stripTrailingZeros();
        if (stripped.scale() > 0) {
            return Coercion.failed("Input should be a valid integer, got a number with a fractional part");
        }
        // more than 19 integer digits never fits in a long
        if ((long) stripped.precision() - stripped.scale() > 19) {
            return Coercion.failed("Input should be a valid integer, the number is out of range");
        }
        BigInteger big = stripped.toBigInteger();
        return fitsInLong(big)
                ? Coercion.ok(big.longValue())
                : Coercion.failed("Input should be a valid integer, the number is out of range");
    }

    private static boolean fitsInLong(BigInteger big) {
        return big.compareTo(LONG_MIN) >= 0 && big.compareTo(LONG_MAX) <= 0;
    }

    private Coercion toFloat(Object raw) {
        if (raw instanceof Number number) {
            return Coercion.ok(number.doubleValue());
        }
        if (raw instanceof String text && mode == CoercionMode.LAX) {
            String stripped = text.strip();
            if (!DECIMAL_TEXT.matcher(stripped).matches()) {
                return Coercion.failed("Input should be a valid number, unable to parse string as a number");
            }
            return Coercion.ok(Double.parseDouble(stripped));
        }
        return Coercion.failed("Input should be a valid number");
    }

    private Coercion toBoolean(Object raw) {
        if (raw instanceof Boolean flag) {
            return Coercion.ok(flag);
        }
        if (mode == CoercionMode.LAX) {
            if (raw instanceof String text) {
                String normalized = text.strip().toLowerCase(Locale.ROOT);
                if (TRUE_TEXT.contains(normalized)) {
                    return Coercion.ok(Boolean.TRUE);
                }
                if (FALSE_TEXT.contains(normalized)) {
                    return Coercion.ok(Boolean.FALSE);
                }
                return Coercion.failed("Input should be a valid boolean, unable to interpret input");
            }
            if (raw instanceof Integer || raw instanceof Long) {
                long n = ((Number) raw).longValue();
                if (n == 0 || n == 1) {
                    return Coercion.ok(n == 1);
                }
            }
        }
        return Coercion.failed("Input should be a valid boolean");
    }

    private Coercion toTimestamp(Object raw) {
        if (raw instanceof OffsetDateTime odt) {
            return Coercion.ok(odt.withOffsetSameInstant(ZoneOffset.UTC));
        }
        if (raw instanceof ZonedDateTime zdt) {
            return Coercion.ok(zdt.toOffsetDateTime().withOffsetSameInstant(ZoneOffset.UTC));
        }
        if (raw instanceof Instant instant) {
            return Coercion.ok(instant.atOffset(ZoneOffset.UTC));
        }
        if (raw instanceof LocalDateTime ldt) {
            return Coercion.ok(ldt.atOffset(ZoneOffset.UTC));
        }
        if (raw instanceof LocalDate date) {
            return Coercion.ok(date.atStartOfDay().atOffset(ZoneOffset.UTC));
        }
        if (raw instanceof String text) {
            return parseTimestamp(text.strip());
        }
        return Coercion.failed("Input should be a valid datetime");
    }

    private static Coercion parseTimestamp(String text) {
        String normalized = text.length() > 10 && text.charAt(10) == ' '
                ? text.substring(0, 10) + 'T' + text.substring(11)
                : text;
        try {
            TemporalAccessor parsed = ISO_TIMESTAMP.parseBest(
                    normalized, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime odt) {
                return Coercion.ok(odt.withOffsetSameInstant(ZoneOffset.UTC));
            }
            if (parsed instanceof LocalDateTime ldt) {
                return Coercion.ok(ldt.atOffset(ZoneOffset.UTC));
            }
            return Coercion.ok(((LocalDate) parsed).atStartOfDay().atOffset(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Coercion.failed("Input should be a valid datetime, unable to parse '" + text + "' as ISO-8601");
        }
    }

    private Coercion toTag(FieldDeclaration field, Object raw) {
        if (raw instanceof Tagged tagged && field.enumType().isInstance(raw)) {
            return Coercion.ok(tagged.tag());
        }
        if (raw instanceof String text) {
            return Coercion.ok(text);
        }
        return Coercion.failed("Input should be a valid enumeration member");
    }

    /** Maps a tag that already passed set-membership to its enum constant. */
    static Object resolveTag(FieldDeclaration field, String tag) {
        for (Enum<?> constant : field.enumType().getEnumConstants()) {
            if (((Tagged) constant).tag().equals(tag)) {
                return constant;
            }
        }
        throw new IllegalStateException("tag '" + tag + "' passed membership but matches no constant");
    }
}
