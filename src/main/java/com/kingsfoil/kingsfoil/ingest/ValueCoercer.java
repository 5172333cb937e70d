package com.kingsfoil.kingsfoil.ingest;

import com.kingsfoil.kingsfoil.source.SemanticType;
import com.kingsfoil.kingsfoil.source.SourceConstants;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Converts cleaned cell text into the Java value of a semantic type.
 */
public final class ValueCoercer {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            strict("uuuuMMdd"),
            strict("M/d/uuuu"),
            strict("uuuu-MM-dd"),
            strict("uuuu/MM/dd"),
            strict("M-d-uuuu")
    );
    private static final Set<String> TRUE_VALUES = Set.of("1", "TRUE", "YES", "Y", IngestConstants.STAR);
    private static final Set<String> FALSE_VALUES = Set.of("0", "FALSE", "NO", "N");

    private ValueCoercer() {
    }

    /**
     * Returns null for null input. Throws {@link CoercionException} when the text does not fit the type.
     */
    public static Object coerce(String text, SemanticType type) {
        if (text == null) {
            return null;
        }
        String value = text.strip();
        return switch (type) {
            case TEXT -> value;
            case INTEGER -> toInteger(value);
            case NUMERIC -> toBoundedDecimal(value);
            case DATE -> toDate(value);
            case BOOLEAN -> toBoolean(value);
        };
    }

    /**
     * Text form of a typed value, used when a derived column is built from other columns.
     */
    public static String asText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return value.toString();
    }

    private static Long toInteger(String value) {
        BigDecimal decimal = toDecimal(value);
        try {
            return decimal.stripTrailingZeros().longValueExact();
        } catch (ArithmeticException ex) {
            throw new CoercionException("'" + value + "' is not a whole number");
        }
    }

    /**
     * Decimal that fits the data table's {@code NUMERIC} column without overflow or rounding.
     */
    private static BigDecimal toBoundedDecimal(String value) {
        BigDecimal decimal = toDecimal(value);
        BigDecimal stripped = decimal.stripTrailingZeros();
        if (stripped.scale() > SourceConstants.NUMERIC_SCALE) {
            throw new CoercionException("'" + value + "' has more than "
                    + SourceConstants.NUMERIC_SCALE + " decimal places");
        }
        int integerDigits = stripped.precision() - stripped.scale();
        if (integerDigits > SourceConstants.NUMERIC_PRECISION - SourceConstants.NUMERIC_SCALE) {
            throw new CoercionException("'" + value + "' is out of range for a numeric column");
        }
        return decimal;
    }

    private static BigDecimal toDecimal(String value) {
        String cleaned = value.replace(",", "");
        if (cleaned.startsWith("$")) {
            cleaned = cleaned.substring(1);
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException ex) {
            throw new CoercionException("'" + value + "' is not a number");
        }
    }

    private static LocalDate toDate(String value) {
        DateTimeParseException lastFailure = null;
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(value, format);
            } catch (DateTimeParseException ex) {
                lastFailure = ex;
            }
        }
        throw new CoercionException("'" + value + "' is not a date in a supported format", lastFailure);
    }

    private static Boolean toBoolean(String value) {
        String upper = value.toUpperCase(Locale.ROOT);
        if (TRUE_VALUES.contains(upper)) {
            return Boolean.TRUE;
        }
        if (FALSE_VALUES.contains(upper)) {
            return Boolean.FALSE;
        }
        throw new CoercionException("'" + value + "' is not a boolean");
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    }
}
