package org.sheetcalc.formula.dsl;

import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Locale dependent separator characters used when reading and writing formulas.
 *
 * @param decimalSeparator   Decimal point in number literals
 * @param argumentSeparator  Separates function arguments
 * @param columnSeparator    Separates columns inside an array constant
 * @param rowSeparator       Separates rows inside an array constant
 */
public record SeparatorSettings(
        char decimalSeparator,
        char argumentSeparator,
        char columnSeparator,
        char rowSeparator) {

    private static final SeparatorSettings DEFAULTS = new SeparatorSettings('.', ',', ',', ';');
    private static final SeparatorSettings COMMA_DECIMAL = new SeparatorSettings(',', ';', '\\', ';');

    public SeparatorSettings {
        if (decimalSeparator == argumentSeparator) {
            throw new IllegalArgumentException(
                    "Decimal and argument separators must differ: '" + decimalSeparator + "'");
        }
        if (columnSeparator == rowSeparator) {
            throw new IllegalArgumentException(
                    "Array column and row separators must differ: '" + columnSeparator + "'");
        }
    }

    /**
     * Separators for the invariant culture: {@code 1.5}, {@code SUM(1,2)}, {@code {1,2;3,4}}.
     */
    public static SeparatorSettings defaults() {
        return DEFAULTS;
    }

    /**
     * Separators for cultures that write a comma as decimal point:
     * {@code 1,5}, {@code SUM(1;2)}, <code>{1\2;3\4}</code>.
     */
    public static SeparatorSettings commaDecimal() {
        return COMMA_DECIMAL;
    }

    public static SeparatorSettings forLocale(Locale locale) {
        char decimal = DecimalFormatSymbols.getInstance(locale).getDecimalSeparator();
        return decimal == ',' ? COMMA_DECIMAL : DEFAULTS;
    }

    /**
     * Whether {@code c} is one of the separator characters.
     */
    public boolean isSeparator(char c) {
        return c == argumentSeparator || c == columnSeparator || c == rowSeparator;
    }
}
