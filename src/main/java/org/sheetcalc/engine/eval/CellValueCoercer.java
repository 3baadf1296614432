package org.sheetcalc.engine.eval;

import org.sheetcalc.engine.value.CellValue;
import org.sheetcalc.engine.value.ErrorType;
import org.sheetcalc.formula.reference.NamedReference;
import org.sheetcalc.formula.reference.Reference;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Objects;

/**
 * Converts values to the type an operator or function parameter needs.
 * Every conversion either succeeds or yields an error value; none throws.
 */
public final class CellValueCoercer {

    /** Day zero of the serial date system. */
    public static final LocalDate SERIAL_EPOCH = LocalDate.of(1899, 12, 30);

    private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final Environment environment;

    public CellValueCoercer(Environment environment) {
        this.environment = Objects.requireNonNull(environment, "Environment cannot be null");
    }

    // ==================== References ====================

    /**
     * Replaces a reference by what it points to: a cell by its value, anything larger by an ARRAY.
     * Other values are returned unchanged.
     */
    public CellValue resolve(CellValue value) {
        if (!value.isReference()) {
            return value;
        }
        Reference reference = value.asReference();
        return switch (reference.kind()) {
            case CELL -> environment.getCellValue(
                    reference.region().top(), reference.region().left(), reference.sheetName());
            case RANGE, ROW, COLUMN -> environment.getRangeValues(reference);
            case NAMED -> resolveName((NamedReference) reference);
        };
    }

    private CellValue resolveName(NamedReference reference) {
        CellValue bound = environment.getVariable(reference.name());
        if (bound == null) {
            return CellValue.error(ErrorType.NAME, "Unknown name " + reference.name());
        }
        if (bound.isReference() && bound.asReference() instanceof NamedReference) {
            return CellValue.error(ErrorType.REF, "Name " + reference.name() + " refers to another name");
        }
        return resolve(bound);
    }

    /**
     * Resolves a value and reduces ranges and arrays to their top-left cell.
     */
    public CellValue resolveScalar(CellValue value) {
        CellValue resolved = resolve(value);
        return switch (resolved.type()) {
            case ARRAY -> {
                CellValue[][] rows = resolved.asArray();
                yield rows.length == 0 || rows[0].length == 0 ? CellValue.EMPTY : rows[0][0];
            }
            case SEQUENCE -> {
                CellValue[] values = resolved.asSequence();
                yield values.length == 0 ? CellValue.EMPTY : values[0];
            }
            default -> resolved;
        };
    }

    // ==================== Scalar coercion ====================

    /**
     * Coerces a resolved scalar to NUMBER. Errors pass through.
     */
    public CellValue toNumber(CellValue value) {
        return switch (value.type()) {
            case NUMBER, ERROR -> value;
            case EMPTY -> CellValue.number(0);
            case LOGICAL -> CellValue.number(value.asLogical() ? 1 : 0);
            case DATE -> CellValue.number(toSerial(value.asDate()));
            case TEXT -> {
                Double parsed = CellValue.tryParseNumber(value.asText().trim());
                yield parsed != null
                        ? CellValue.number(parsed)
                        : CellValue.error(ErrorType.VALUE, "Cannot convert '" + value.asText() + "' to a number");
            }
            default -> CellValue.error(ErrorType.VALUE, "Expected a single value but got " + value.type());
        };
    }

    /**
     * Coerces a resolved scalar to LOGICAL. Errors pass through.
     */
    public CellValue toLogical(CellValue value) {
        return switch (value.type()) {
            case LOGICAL, ERROR -> value;
            case EMPTY -> CellValue.logical(false);
            case NUMBER -> CellValue.logical(value.asNumber() != 0);
            case TEXT -> {
                String text = value.asText().trim().toLowerCase(Locale.ROOT);
                if (text.equals("true") || text.equals("false")) {
                    yield CellValue.logical(text.equals("true"));
                }
                yield CellValue.error(ErrorType.VALUE, "Cannot convert '" + value.asText() + "' to a logical");
            }
            default -> CellValue.error(ErrorType.VALUE, "Cannot convert " + value.type() + " to a logical");
        };
    }

    /**
     * Coerces a resolved scalar to TEXT. Errors pass through.
     */
    public CellValue toText(CellValue value) {
        return switch (value.type()) {
            case TEXT, ERROR -> value;
            case EMPTY, NUMBER, LOGICAL, DATE -> CellValue.text(value.toDisplayText());
            default -> CellValue.error(ErrorType.VALUE, "Expected a single value but got " + value.type());
        };
    }

    /**
     * Coerces a resolved scalar to DATE. Errors pass through.
     */
    public CellValue toDate(CellValue value) {
        return switch (value.type()) {
            case DATE, ERROR -> value;
            case EMPTY -> CellValue.date(fromSerial(0));
            case NUMBER -> CellValue.date(fromSerial(value.asNumber()));
            case TEXT -> {
                LocalDateTime parsed = CellValue.tryParseDate(value.asText().trim());
                yield parsed != null
                        ? CellValue.date(parsed)
                        : CellValue.error(ErrorType.VALUE, "Cannot convert '" + value.asText() + "' to a date");
            }
            default -> CellValue.error(ErrorType.VALUE, "Cannot convert " + value.type() + " to a date");
        };
    }

    // ==================== Serial dates ====================

    /**
     * Days since 1899-12-30, with the time of day as fraction.
     */
    public static double toSerial(LocalDateTime date) {
        long millis = ChronoUnit.MILLIS.between(SERIAL_EPOCH.atStartOfDay(), date);
        return (double) millis / MILLIS_PER_DAY;
    }

    public static LocalDateTime fromSerial(double serial) {
        long millis = Math.round(serial * MILLIS_PER_DAY);
        return SERIAL_EPOCH.atStartOfDay().plus(millis, ChronoUnit.MILLIS);
    }
}
