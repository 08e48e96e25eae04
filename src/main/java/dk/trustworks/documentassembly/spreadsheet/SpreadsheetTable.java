package dk.trustworks.documentassembly.spreadsheet;

import dk.trustworks.documentassembly.spreadsheet.model.TabularRow;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * A worksheet read as a header row followed by data rows.
 *
 * <p>Header names are matched trimmed and case-insensitively. When a name repeats, the
 * rightmost column wins.
 */
public final class SpreadsheetTable {

    private final TabularRow header;
    private final Map<String, Integer> columns;
    private final List<TabularRow> dataRows;

    private SpreadsheetTable(TabularRow header, Map<String, Integer> columns, List<TabularRow> dataRows) {
        this.header = header;
        this.columns = columns;
        this.dataRows = dataRows;
    }

    public static SpreadsheetTable of(List<TabularRow> rows) {
        if (rows.isEmpty()) {
            return new SpreadsheetTable(new TabularRow(List.of()), Map.of(), List.of());
        }
        TabularRow header = rows.get(0);
        Map<String, Integer> columns = new HashMap<>();
        for (int column = 1; column <= header.size(); column++) {
            String key = normalize(header.cell(column));
            if (!key.isEmpty()) {
                columns.put(key, column);
            }
        }
        return new SpreadsheetTable(header, Map.copyOf(columns), List.copyOf(rows.subList(1, rows.size())));
    }

    public TabularRow header() {
        return header;
    }

    public List<TabularRow> dataRows() {
        return dataRows;
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(normalize(name));
    }

    /**
     * Returns the required column names that the header row does not contain, in the given order.
     */
    public Set<String> missingColumns(Collection<String> required) {
        Set<String> missing = new LinkedHashSet<>();
        for (String name : required) {
            if (!hasColumn(name)) {
                missing.add(name);
            }
        }
        return missing;
    }

    /**
     * @return the row's value in the named column, or the empty string when the column is unknown
     */
    public String value(TabularRow row, String column) {
        Integer index = columns.get(normalize(column));
        return index != null ? row.cell(index) : "";
    }

    /**
     * Maps each normalised header name to the row's value in that column. Columns the row does
     * not reach are left out.
     */
    public Map<String, String> rowAsMap(TabularRow row) {
        Map<String, String> values = new LinkedHashMap<>();
        columns.entrySet().stream()
                .sorted(Map.Entry.comparingByValue())
                .filter(e -> e.getValue() <= row.size())
                .forEach(e -> values.put(e.getKey(), row.cell(e.getValue())));
        return values;
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
