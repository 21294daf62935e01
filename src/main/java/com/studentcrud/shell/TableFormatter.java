package com.studentcrud.shell;

import com.studentcrud.model.Student;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Renders rows as a fixed-width text table.
 *
 * Each column is as wide as its header or its longest value, whichever is longer.
 * Values are rendered with {@link String#valueOf(Object)} before measuring.
 */
public class TableFormatter<T> {

    static final String NO_RECORDS = "No records found";
    private static final String CELL_SEPARATOR = " | ";

    public record Column<T>(String header, Function<T, ?> extractor) {}

    private final List<Column<T>> columns;

    public TableFormatter(List<Column<T>> columns) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("A table needs at least one column");
        }
        this.columns = List.copyOf(columns);
    }

    /**
     * The students table: id, name, email, created_at.
     */
    public static TableFormatter<Student> forStudents() {
        return new TableFormatter<>(List.of(
                new Column<>("id", Student::id),
                new Column<>("name", Student::name),
                new Column<>("email", Student::email),
                new Column<>("created_at", Student::createdAt)
        ));
    }

    /**
     * @return header, separator and one line per row; or a single notice if there are no rows
     */
    public List<String> format(List<T> rows) {
        if (rows.isEmpty()) {
            return List.of(NO_RECORDS);
        }

        List<List<String>> cells = new ArrayList<>(rows.size());
        int[] widths = new int[columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            widths[c] = columns.get(c).header().length();
        }
        for (T row : rows) {
            List<String> rendered = new ArrayList<>(columns.size());
            for (int c = 0; c < columns.size(); c++) {
                String text = String.valueOf(columns.get(c).extractor().apply(row));
                widths[c] = Math.max(widths[c], text.length());
                rendered.add(text);
            }
            cells.add(rendered);
        }

        List<String> lines = new ArrayList<>(rows.size() + 2);
        String header = joinPadded(columns.stream().map(Column::header).toList(), widths);
        lines.add(header);
        lines.add("-".repeat(header.length()));
        for (List<String> rendered : cells) {
            lines.add(joinPadded(rendered, widths));
        }
        return lines;
    }

    private static String joinPadded(List<String> values, int[] widths) {
        StringBuilder sb = new StringBuilder();
        for (int c = 0; c < values.size(); c++) {
            if (c > 0) {
                sb.append(CELL_SEPARATOR);
            }
            String value = values.get(c);
            sb.append(value).append(" ".repeat(widths[c] - value.length()));
        }
        return sb.toString();
    }
}
