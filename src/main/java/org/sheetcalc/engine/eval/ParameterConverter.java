package org.sheetcalc.engine.eval;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.MutableList;
import org.sheetcalc.engine.function.ParameterDefinition;
import org.sheetcalc.engine.function.ParameterType;
import org.sheetcalc.engine.value.CellValue;
import org.sheetcalc.engine.value.CellValueType;
import org.sheetcalc.formula.reference.ReferenceKind;

import java.util.Arrays;
import java.util.Objects;

/**
 * Converts an evaluated argument to the type its parameter declares.
 * <p>
 * The parameter's dimensionality picks the path. Scalar parameters reduce ranges to their
 * top-left cell and coerce it; {@code ANY} passes the resolved value through.
 * Range parameters gather matching values from ranges and arrays, skipping
 * cells of other types, while a directly written scalar is coerced.
 */
public final class ParameterConverter {

    private static final CellValue EMPTY_ARRAY = CellValue.array(new CellValue[0][0]);

    private final CellValueCoercer coercer;

    public ParameterConverter(CellValueCoercer coercer) {
        this.coercer = Objects.requireNonNull(coercer, "Coercer cannot be null");
    }

    public CellValue convert(CellValue argument, ParameterDefinition parameter) {
        return switch (parameter.dimensionality()) {
            case SCALAR -> toScalar(argument, parameter.type());
            case RANGE -> toBlock(argument, parameter.type());
        };
    }

    private CellValue toScalar(CellValue argument, ParameterType type) {
        if (type == ParameterType.ANY) {
            return coercer.resolve(argument);
        }
        CellValue value = coercer.resolveScalar(argument);
        return switch (type) {
            case NUMBER -> coercer.toNumber(value);
            case TEXT -> coercer.toText(value);
            case LOGICAL -> coercer.toLogical(value);
            case DATE -> coercer.toDate(value);
            default -> throw new IllegalArgumentException("Not a scalar parameter type: " + type);
        };
    }

    private CellValue toBlock(CellValue argument, ParameterType type) {
        return switch (type) {
            case NUMBER_SEQUENCE -> toNumberSequence(argument);
            case LOGICAL_SEQUENCE -> toLogicalSequence(argument);
            case ARRAY -> toArray(argument);
            default -> throw new IllegalArgumentException("Not a range parameter type: " + type);
        };
    }

    private CellValue toNumberSequence(CellValue argument) {
        if (!isMultiValued(argument)) {
            return CellValue.sequence(new CellValue[]{coercer.toNumber(coercer.resolveScalar(argument))});
        }
        MutableList<CellValue> values = Lists.mutable.empty();
        for (CellValue cell : flatten(coercer.resolve(argument))) {
            if (cell.type() == CellValueType.NUMBER || cell.isError()) {
                values.add(cell);
            }
        }
        return CellValue.sequence(values.toArray(new CellValue[0]));
    }

    private CellValue toLogicalSequence(CellValue argument) {
        if (!isMultiValued(argument)) {
            return CellValue.sequence(new CellValue[]{coercer.toLogical(coercer.resolveScalar(argument))});
        }
        MutableList<CellValue> values = Lists.mutable.empty();
        for (CellValue cell : flatten(coercer.resolve(argument))) {
            if (cell.type() == CellValueType.LOGICAL || cell.isError()) {
                values.add(cell);
            } else if (cell.type() == CellValueType.NUMBER) {
                values.add(coercer.toLogical(cell));
            }
        }
        return CellValue.sequence(values.toArray(new CellValue[0]));
    }

    private CellValue toArray(CellValue argument) {
        if (argument.isEmpty()) {
            return EMPTY_ARRAY;
        }
        CellValue resolved = coercer.resolve(argument);
        return switch (resolved.type()) {
            case ARRAY -> resolved;
            case SEQUENCE -> CellValue.array(new CellValue[][]{resolved.asSequence()});
            default -> CellValue.array(new CellValue[][]{{resolved}});
        };
    }

    /**
     * Whether the argument stands for several cells: a reference or an array.
     * A single cell reference counts, so text in a referenced cell is skipped rather than coerced.
     */
    private static boolean isMultiValued(CellValue argument) {
        if (argument.isReference()) {
            return argument.asReference().kind() != ReferenceKind.NAMED;
        }
        return argument.type() == CellValueType.ARRAY || argument.type() == CellValueType.SEQUENCE;
    }

    private static MutableList<CellValue> flatten(CellValue value) {
        MutableList<CellValue> cells = Lists.mutable.empty();
        switch (value.type()) {
            case ARRAY -> {
                for (CellValue[] row : value.asArray()) {
                    cells.addAll(Arrays.asList(row));
                }
            }
            case SEQUENCE -> cells.addAll(Arrays.asList(value.asSequence()));
            default -> cells.add(value);
        }
        return cells;
    }
}
