package org.sheetcalc.engine.value;

import org.sheetcalc.formula.reference.Reference;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A typed value held by a cell or produced by evaluating a formula.
 * The payload type always matches the tag:
 * TEXT is a String, NUMBER a Double, LOGICAL a Boolean, DATE a LocalDateTime,
 * ERROR a FormulaError, ARRAY a CellValue[][], SEQUENCE a CellValue[],
 * REFERENCE a Reference and EMPTY is null.
 *
 * Two error values are equal when their error types are equal; the diagnostic
 * message is ignored.
 *
 * @param value The payload
 * @param type  The tag
 */
public record CellValue(Object value, CellValueType type) {

    private static final Pattern NUMBER_PATTERN = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    public static final CellValue EMPTY = new CellValue(null, CellValueType.EMPTY);

    public CellValue {
        Objects.requireNonNull(type, "Cell value type cannot be null");

        switch (type) {
            case EMPTY -> {
                if (value != null) {
                    throw new IllegalArgumentException("EMPTY value cannot have a payload");
                }
            }
            case TEXT -> requirePayload(value, String.class, type);
            case NUMBER -> requirePayload(value, Double.class, type);
            case LOGICAL -> requirePayload(value, Boolean.class, type);
            case DATE -> requirePayload(value, LocalDateTime.class, type);
            case ERROR -> requirePayload(value, FormulaError.class, type);
            case ARRAY -> requirePayload(value, CellValue[][].class, type);
            case SEQUENCE -> requirePayload(value, CellValue[].class, type);
            case REFERENCE -> requirePayload(value, Reference.class, type);
        }
    }

    private static void requirePayload(Object value, Class<?> expected, CellValueType type) {
        if (!expected.isInstance(value)) {
            throw new IllegalArgumentException(type + " value must have a " + expected.getSimpleName() + " payload");
        }
    }

    // ==================== Factories ====================

    public static CellValue empty() {
        return EMPTY;
    }

    public static CellValue text(String text) {
        return new CellValue(text, CellValueType.TEXT);
    }

    public static CellValue number(double number) {
        return new CellValue(number, CellValueType.NUMBER);
    }

    public static CellValue logical(boolean logical) {
        return new CellValue(logical, CellValueType.LOGICAL);
    }

    public static CellValue date(LocalDateTime date) {
        return new CellValue(date, CellValueType.DATE);
    }

    public static CellValue date(LocalDate date) {
        return date(date.atStartOfDay());
    }

    public static CellValue error(ErrorType type) {
        return new CellValue(new FormulaError(type), CellValueType.ERROR);
    }

    public static CellValue error(ErrorType type, String message) {
        return new CellValue(new FormulaError(type, message), CellValueType.ERROR);
    }

    public static CellValue error(FormulaError error) {
        return new CellValue(error, CellValueType.ERROR);
    }

    public static CellValue array(CellValue[][] rows) {
        return new CellValue(rows, CellValueType.ARRAY);
    }

    public static CellValue sequence(CellValue[] values) {
        return new CellValue(values, CellValueType.SEQUENCE);
    }

    public static CellValue reference(Reference reference) {
        return new CellValue(reference, CellValueType.REFERENCE);
    }

    /**
     * Builds a cell value from a raw object, inferring its type.
     * Strings are parsed in order: number, logical, ISO date or date-time; anything else is text.
     */
    public static CellValue of(Object raw) {
        if (raw == null) {
            return EMPTY;
        }
        if (raw instanceof CellValue cellValue) {
            return cellValue;
        }
        if (raw instanceof String s) {
            return fromString(s);
        }
        if (raw instanceof Number n) {
            return number(n.doubleValue());
        }
        if (raw instanceof Boolean b) {
            return logical(b);
        }
        if (raw instanceof LocalDateTime dt) {
            return date(dt);
        }
        if (raw instanceof LocalDate d) {
            return date(d);
        }
        if (raw instanceof FormulaError e) {
            return error(e);
        }
        if (raw instanceof Reference r) {
            return reference(r);
        }
        return text(raw.toString());
    }

    private static CellValue fromString(String s) {
        String trimmed = s.trim();
        Double number = tryParseNumber(trimmed);
        if (number != null) {
            return number(number);
        }
        if ("true".equalsIgnoreCase(trimmed) || "false".equalsIgnoreCase(trimmed)) {
            return logical(Boolean.parseBoolean(trimmed.toLowerCase()));
        }
        LocalDateTime date = tryParseDate(trimmed);
        if (date != null) {
            return date(date);
        }
        return text(s);
    }

    /**
     * Parses invariant number text ({@code 12}, {@code -1.5}, {@code 2E3}).
     *
     * @return the number, or null if the text is not numeric
     */
    public static Double tryParseNumber(String text) {
        if (text == null || !NUMBER_PATTERN.matcher(text).matches()) {
            return null;
        }
        return Double.parseDouble(text);
    }

    /**
     * Parses an ISO date ({@code 2024-01-15}) or date-time ({@code 2024-01-15T10:30}).
     *
     * @return the date, or null if the text is not a date
     */
    public static LocalDateTime tryParseDate(String text) {
        if (text == null || text.length() < 10 || !Character.isDigit(text.charAt(0))) {
            return null;
        }
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay();
            }
            return LocalDateTime.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    // ==================== Accessors ====================

    public boolean isEmpty() {
        return type == CellValueType.EMPTY;
    }

    public boolean isError() {
        return type == CellValueType.ERROR;
    }

    public boolean isError(ErrorType errorType) {
        return type == CellValueType.ERROR && ((FormulaError) value).type() == errorType;
    }

    public boolean isReference() {
        return type == CellValueType.REFERENCE;
    }

    public double asNumber() {
        return (Double) value;
    }

    public String asText() {
        return (String) value;
    }

    public boolean asLogical() {
        return (Boolean) value;
    }

    public LocalDateTime asDate() {
        return (LocalDateTime) value;
    }

    public FormulaError asError() {
        return (FormulaError) value;
    }

    public CellValue[][] asArray() {
        return (CellValue[][]) value;
    }

    public CellValue[] asSequence() {
        return (CellValue[]) value;
    }

    public Reference asReference() {
        return (Reference) value;
    }

    /**
     * Strict equality by type and value, used by the {@code =} and {@code <>} operators.
     * Text compares case-insensitively.
     */
    public boolean isEqualTo(CellValue other) {
        if (type != other.type) {
            return false;
        }
        if (type == CellValueType.TEXT) {
            return asText().equalsIgnoreCase(other.asText());
        }
        return equals(other);
    }

    /**
     * Whether {@link #compareTo(CellValue)} is defined for these two values.
     */
    public boolean isComparableWith(CellValue other) {
        if (type != other.type) {
            return false;
        }
        return switch (type) {
            case TEXT, NUMBER, LOGICAL, DATE, EMPTY -> true;
            default -> false;
        };
    }

    /**
     * Orders two values of the same comparable type.
     *
     * @throws IllegalArgumentException if the values are not comparable
     */
    public int compareTo(CellValue other) {
        if (!isComparableWith(other)) {
            throw new IllegalArgumentException("Cannot compare " + type + " with " + other.type);
        }
        return switch (type) {
            case TEXT -> asText().compareToIgnoreCase(other.asText());
            case NUMBER -> Double.compare(asNumber(), other.asNumber());
            case LOGICAL -> Boolean.compare(asLogical(), other.asLogical());
            case DATE -> asDate().compareTo(other.asDate());
            default -> 0;
        };
    }

    /**
     * The text shown in a cell for this value; errors show their canonical token.
     */
    public String toDisplayText() {
        return switch (type) {
            case EMPTY -> "";
            case TEXT -> asText();
            case NUMBER -> formatNumber(asNumber());
            case LOGICAL -> asLogical() ? "TRUE" : "FALSE";
            case DATE -> asDate().toLocalTime().equals(java.time.LocalTime.MIDNIGHT)
                    ? asDate().toLocalDate().toString()
                    : asDate().toString();
            case ERROR -> asError().type().text();
            case ARRAY -> Arrays.deepToString(asArray());
            case SEQUENCE -> Arrays.toString(asSequence());
            case REFERENCE -> asReference().toAddressText();
        };
    }

    /**
     * Formats a number without a trailing ".0" and without exponent notation.
     */
    public static String formatNumber(double number) {
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            return Double.toString(number);
        }
        if (number == Math.rint(number) && Math.abs(number) < 1e15) {
            return Long.toString((long) number);
        }
        return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue other) || type != other.type) {
            return false;
        }
        return switch (type) {
            case ERROR -> asError().type() == other.asError().type();
            case ARRAY -> Arrays.deepEquals(asArray(), other.asArray());
            case SEQUENCE -> Arrays.equals(asSequence(), other.asSequence());
            default -> Objects.equals(value, other.value);
        };
    }

    @Override
    public int hashCode() {
        return switch (type) {
            case ERROR -> Objects.hash(type, asError().type());
            case ARRAY -> Objects.hash(type, Arrays.deepHashCode(asArray()));
            case SEQUENCE -> Objects.hash(type, Arrays.hashCode(asSequence()));
            default -> Objects.hash(type, value);
        };
    }

    @Override
    public String toString() {
        return type + "(" + toDisplayText() + ")";
    }
}
