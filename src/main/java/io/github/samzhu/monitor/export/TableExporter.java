package io.github.samzhu.monitor.export;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import io.github.samzhu.monitor.table.NormalizedTable;

/**
 * 依輸出格式選擇對應的 {@link TableFormatter}。
 */
@Component
public class TableExporter {

    private final Map<OutputFormat, TableFormatter> formatters = new EnumMap<>(OutputFormat.class);

    public TableExporter(List<TableFormatter> formatters) {
        for (TableFormatter formatter : formatters) {
            this.formatters.put(formatter.format(), formatter);
        }
    }

    public String export(NormalizedTable table, OutputFormat format) {
        TableFormatter formatter = formatters.get(format);
        if (formatter == null) {
            throw new IllegalArgumentException("No formatter registered for " + format);
        }
        return formatter.render(table);
    }
}
