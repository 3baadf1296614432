package org.sheetcalc.engine.function.builtin;

import org.sheetcalc.engine.value.CellValue;
import org.sheetcalc.engine.value.CellValueType;
import org.sheetcalc.engine.value.ErrorType;

import java.util.function.ToDoubleFunction;

/**
 * Least squares fit of a straight line through paired observations.
 * Only pairs where both cells hold numbers take part in the fit.
 *
 * @param slope     Slope of the fitted line
 * @param intercept Value of the fitted line at x = 0
 */
record LinearRegression(double slope, double intercept) {

    /**
     * Fits a line through {@code ys} against {@code xs} and reads one coefficient off it.
     *
     * @return the coefficient, or an error value when the inputs are empty, differ in shape
     *         or hold fewer than two usable pairs
     */
    static CellValue fit(CellValue[][] ys, CellValue[][] xs, ToDoubleFunction<LinearRegression> coefficient) {
        if (ys.length == 0 || xs.length == 0) {
            return CellValue.error(ErrorType.NA, "Empty data set");
        }
        if (ys.length != xs.length || ys[0].length != xs[0].length) {
            return CellValue.error(ErrorType.NA, "known_y's and known_x's differ in size");
        }

        int count = 0;
        double sumX = 0;
        double sumY = 0;
        for (int row = 0; row < ys.length; row++) {
            for (int col = 0; col < ys[row].length; col++) {
                if (isNumberPair(ys[row][col], xs[row][col])) {
                    sumX += xs[row][col].asNumber();
                    sumY += ys[row][col].asNumber();
                    count++;
                }
            }
        }
        if (count <= 1) {
            return CellValue.error(ErrorType.DIV0, "At least two data points are required");
        }

        double meanX = sumX / count;
        double meanY = sumY / count;
        double covariance = 0;
        double varianceX = 0;
        for (int row = 0; row < ys.length; row++) {
            for (int col = 0; col < ys[row].length; col++) {
                if (isNumberPair(ys[row][col], xs[row][col])) {
                    double dx = xs[row][col].asNumber() - meanX;
                    covariance += dx * (ys[row][col].asNumber() - meanY);
                    varianceX += dx * dx;
                }
            }
        }
        if (varianceX == 0) {
            return CellValue.error(ErrorType.DIV0, "All x values are equal");
        }

        double slope = covariance / varianceX;
        return CellValue.number(coefficient.applyAsDouble(new LinearRegression(slope, meanY - slope * meanX)));
    }

    private static boolean isNumberPair(CellValue y, CellValue x) {
        return y.type() == CellValueType.NUMBER && x.type() == CellValueType.NUMBER;
    }
}
