package dk.trustworks.documentassembly.spreadsheet.model;

import java.util.List;

/**
 * One worksheet row as strings, one per column. Gaps before the last filled column are empty strings.
 *
 * @param cells cell values; index 0 holds column A
 */
public record TabularRow(List<String> cells) {

    public TabularRow {
        cells = List.copyOf(cells);
    }

    /**
     * @param column 1-based column index
     * @return the cell value, or the empty string beyond the end of the row
     */
    public String cell(int column) {
        if (column < 1 || column > cells.size()) {
            return "";
        }
        return cells.get(column - 1);
    }

    public int size() {
        return cells.size();
    }
}
