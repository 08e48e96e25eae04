package dk.trustworks.documentassembly.spreadsheet;

import org.apache.poi.ss.util.CellReference;

/**
 * Column arithmetic for A1-style cell references.
 */
public final class SpreadsheetColumns {

    private SpreadsheetColumns() {
    }

    /**
     * Decodes the column of a cell reference, 1-based: {@code A1} is 1, {@code Z1} is 26,
     * {@code AA1} is 27. Row digits and {@code $} markers are ignored.
     *
     * @return the column, or 0 when the reference has no column letters
     */
    public static int columnIndex(String cellReference) {
        if (cellReference == null) {
            return 0;
        }
        StringBuilder letters = new StringBuilder();
        for (int i = 0; i < cellReference.length(); i++) {
            char c = cellReference.charAt(i);
            if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z')) {
                letters.append(Character.toUpperCase(c));
            }
        }
        if (letters.length() == 0) {
            return 0;
        }
        return CellReference.convertColStringToIndex(letters.toString()) + 1;
    }
}
