package io.github.samzhu.monitor.export;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import io.github.samzhu.monitor.table.NormalizedTable;

/**
 * Markdown pipe table。數值欄位靠右，其餘靠左，缺值輸出為空白。
 *
 * <pre>
 * | date       | location    | token_count |
 * |:-----------|:------------|------------:|
 * | 2025-01-01 | us-central1 |         120 |
 * </pre>
 */
@Component
public class MarkdownTableFormatter implements TableFormatter {

    @Override
    public OutputFormat format() {
        return OutputFormat.MARKDOWN;
    }

    @Override
    public String render(NormalizedTable table) {
        List<String> columns = table.columns();
        if (columns.isEmpty()) {
            return "";
        }

        List<Map<String, Object>> records = table.toRecords();
        List<List<String>> cells = new ArrayList<>(records.size());
        int[] widths = new int[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            widths[i] = columns.get(i).length();
        }
        for (Map<String, Object> values : records) {
            List<String> line = new ArrayList<>(columns.size());
            for (int i = 0; i < columns.size(); i++) {
                Object value = values.get(columns.get(i));
                String text = value == null ? "" : value.toString();
                widths[i] = Math.max(widths[i], text.length());
                line.add(text);
            }
            cells.add(line);
        }

        int valueIndex = columns.indexOf(table.valueColumn());
        StringBuilder out = new StringBuilder();
        appendLine(out, columns, widths, valueIndex);

        out.append('|');
        for (int i = 0; i < columns.size(); i++) {
            String dashes = "-".repeat(widths[i] + 1);
            out.append(i == valueIndex ? dashes + ":" : ":" + dashes).append('|');
        }
        out.append('\n');

        for (List<String> line : cells) {
            appendLine(out, line, widths, valueIndex);
        }
        return out.toString();
    }

    private static void appendLine(StringBuilder out, List<String> values, int[] widths, int rightAligned) {
        out.append('|');
        for (int i = 0; i < values.size(); i++) {
            String padded = i == rightAligned
                ? " ".repeat(widths[i] - values.get(i).length()) + values.get(i)
                : values.get(i) + " ".repeat(widths[i] - values.get(i).length());
            out.append(' ').append(padded).append(" |");
        }
        out.append('\n');
    }
}
