package org.sheetcalc.formula.reference;

/**
 * Conversions between address text ("$A$1", "B:C", "3:5") and zero based indices.
 */
public final class RangeText {

    public static final int MAX_ROWS = 1_048_576;
    public static final int MAX_COLS = 16_384;

    private RangeText() {
        // Static utility class
    }

    /**
     * A single row or column coordinate parsed from address text.
     *
     * @param index Zero based row or column index
     * @param fixed Whether the coordinate was prefixed with '$'
     */
    public record AxisAddress(int index, boolean fixed) {
    }

    /**
     * Parses a cell address such as {@code A1}, {@code $B$7} or {@code c$3}.
     *
     * @return the reference, or null if the text is not a cell address inside the sheet bounds
     */
    public static CellReference parseCell(String text, String sheetName) {
        if (text == null || text.length() < 2) {
            return null;
        }

        int pos = 0;
        boolean colFixed = false;
        if (text.charAt(pos) == '$') {
            colFixed = true;
            pos++;
        }

        int colStart = pos;
        while (pos < text.length() && isAsciiLetter(text.charAt(pos))) {
            pos++;
        }
        if (pos == colStart || pos - colStart > 3) {
            return null;
        }
        String letters = text.substring(colStart, pos);

        boolean rowFixed = false;
        if (pos < text.length() && text.charAt(pos) == '$') {
            rowFixed = true;
            pos++;
        }

        int rowStart = pos;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
        if (pos == rowStart || pos != text.length() || pos - rowStart > 7) {
            return null;
        }

        int row = Integer.parseInt(text.substring(rowStart, pos)) - 1;
        int col = lettersToColumn(letters);
        if (row < 0 || row >= MAX_ROWS || col >= MAX_COLS) {
            return null;
        }
        return new CellReference(row, col, rowFixed, colFixed, sheetName);
    }

    /**
     * Parses the column part of a column span, e.g. {@code A} or {@code $AB}.
     */
    public static AxisAddress parseColumn(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        boolean fixed = text.charAt(0) == '$';
        String letters = fixed ? text.substring(1) : text;
        if (letters.isEmpty() || letters.length() > 3) {
            return null;
        }
        for (int i = 0; i < letters.length(); i++) {
            if (!isAsciiLetter(letters.charAt(i))) {
                return null;
            }
        }
        int col = lettersToColumn(letters);
        return col < MAX_COLS ? new AxisAddress(col, fixed) : null;
    }

    /**
     * Parses the row part of a row span, e.g. {@code 3} or {@code $12}.
     */
    public static AxisAddress parseRow(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        boolean fixed = text.charAt(0) == '$';
        String digits = fixed ? text.substring(1) : text;
        if (digits.isEmpty() || digits.length() > 7) {
            return null;
        }
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i))) {
                return null;
            }
        }
        int row = Integer.parseInt(digits) - 1;
        return row >= 0 && row < MAX_ROWS ? new AxisAddress(row, fixed) : null;
    }

    /**
     * Converts column letters to a zero based index: A is 0, Z is 25, AA is 26.
     */
    public static int lettersToColumn(String letters) {
        int result = 0;
        for (int i = 0; i < letters.length(); i++) {
            result = result * 26 + (Character.toUpperCase(letters.charAt(i)) - 'A' + 1);
        }
        return result - 1;
    }

    /**
     * Converts a zero based column index to its letters.
     */
    public static String columnToLetters(int col) {
        StringBuilder sb = new StringBuilder();
        int n = col + 1;
        while (n > 0) {
            int m = (n - 1) % 26;
            sb.append((char) ('A' + m));
            n = (n - m - 1) / 26;
        }
        return sb.reverse().toString();
    }

    public static String cellText(int row, int col) {
        return columnToLetters(col) + (row + 1);
    }

    /**
     * Canonical text of a region, used as the stable key of dependency vertices.
     * Full-row regions render as {@code 2:4}, full-column regions as {@code B:D}.
     */
    public static String regionToText(Region region) {
        if (region.isSingleCell()) {
            return cellText(region.top(), region.left());
        }
        if (region.isFullRows() && !region.isFullColumns()) {
            return (region.top() + 1) + ":" + (region.bottom() + 1);
        }
        if (region.isFullColumns() && !region.isFullRows()) {
            return columnToLetters(region.left()) + ":" + columnToLetters(region.right());
        }
        return cellText(region.top(), region.left()) + ":" + cellText(region.bottom(), region.right());
    }

    public static boolean isValidNameStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    public static boolean isValidNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '?' || c == '\\';
    }

    /**
     * Whether the text is acceptable as a defined name: it must start with a letter or underscore,
     * use only name characters, and must not be mistaken for a cell address.
     */
    public static boolean isValidName(String name) {
        if (name == null || name.isEmpty() || !isValidNameStart(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!isValidNameChar(name.charAt(i))) {
                return false;
            }
        }
        if ("TRUE".equalsIgnoreCase(name) || "FALSE".equalsIgnoreCase(name)) {
            return false;
        }
        return parseCell(name, null) == null;
    }

    /**
     * Renders a sheet qualifier, quoting the name when it is not a plain identifier.
     */
    public static String sheetPrefix(String sheetName) {
        if (sheetName == null) {
            return "";
        }
        return (needsQuoting(sheetName) ? "'" + sheetName.replace("'", "''") + "'" : sheetName) + "!";
    }

    private static boolean needsQuoting(String sheetName) {
        if (sheetName.isEmpty() || !isValidNameStart(sheetName.charAt(0))) {
            return true;
        }
        for (int i = 0; i < sheetName.length(); i++) {
            char c = sheetName.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return true;
            }
        }
        return parseCell(sheetName, null) != null;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    static String fixed(boolean isFixed) {
        return isFixed ? "$" : "";
    }
}
