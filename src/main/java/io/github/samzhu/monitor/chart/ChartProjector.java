package io.github.samzhu.monitor.chart;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.github.samzhu.monitor.table.NormalizedRow;
import io.github.samzhu.monitor.table.NormalizedTable;

/**
 * 將正規化表格投影為依日期排列的圖表序列。
 *
 * <ul>
 *   <li>沒有有效分組欄位：一條依日期加總的彙總線</li>
 *   <li>有分組欄位：每個分組值組合一條線，鍵為所有分組欄位值的 tuple</li>
 * </ul>
 *
 * <p>表格中不存在的分組欄位直接忽略（每個指標的圖表設定可能帶有打錯的欄位名）。
 * 分組投影失敗時退回單一彙總線，不讓整份報表失敗。缺值的數值視為 0，
 * 缺值的分組 label 以 {@link #ABSENT_KEY} 作為自己的一組。
 */
@Component
public class ChartProjector {

    private static final Logger log = LoggerFactory.getLogger(ChartProjector.class);

    public static final String ABSENT_KEY = "(none)";

    private static final Comparator<List<String>> KEY_ORDER = (a, b) -> {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int cmp = a.get(i).compareTo(b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    };

    public ChartProjection project(NormalizedTable table, String metricName, String valueColumn,
                                   List<String> groupBy) {
        List<String> validGroupBy = validGroupColumns(table, groupBy);
        if (table.isEmpty()) {
            return new ChartProjection(metricName, valueColumn, List.of(), List.of());
        }
        if (validGroupBy.isEmpty()) {
            return aggregate(table, metricName, valueColumn);
        }
        try {
            return new ChartProjection(metricName, valueColumn, validGroupBy,
                pivot(table, valueColumn, validGroupBy));
        } catch (RuntimeException e) {
            log.error("Could not build grouped series for {}, possibly due to data structure: {}",
                metricName, e.getMessage(), e);
            log.info("Falling back to a single total line chart.");
            return aggregate(table, metricName, valueColumn);
        }
    }

    private static List<String> validGroupColumns(NormalizedTable table, List<String> groupBy) {
        if (groupBy == null) {
            return List.of();
        }
        List<String> labelColumns = table.labelColumns();
        return groupBy.stream()
            .map(String::trim)
            .filter(labelColumns::contains)
            .distinct()
            .toList();
    }

    private ChartProjection aggregate(NormalizedTable table, String metricName, String valueColumn) {
        TreeMap<LocalDate, Long> totals = new TreeMap<>();
        for (NormalizedRow row : table.rows()) {
            totals.merge(row.date(), valueOf(row, valueColumn), Long::sum);
        }
        return new ChartProjection(metricName, valueColumn, List.of(),
            List.of(new ChartSeries(List.of(), totals)));
    }

    private List<ChartSeries> pivot(NormalizedTable table, String valueColumn, List<String> groupBy) {
        Map<List<String>, TreeMap<LocalDate, Long>> grouped = new TreeMap<>(KEY_ORDER);
        for (NormalizedRow row : table.rows()) {
            List<String> key = new ArrayList<>(groupBy.size());
            for (String column : groupBy) {
                String value = row.label(column);
                key.add(value == null ? ABSENT_KEY : value);
            }
            grouped.computeIfAbsent(List.copyOf(key), k -> new TreeMap<>())
                .merge(row.date(), valueOf(row, valueColumn), Long::sum);
        }

        List<ChartSeries> series = new ArrayList<>(grouped.size());
        grouped.forEach((key, points) -> series.add(new ChartSeries(key, points)));
        return series;
    }

    private static long valueOf(NormalizedRow row, String valueColumn) {
        Object value = row.get(valueColumn);
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        throw new IllegalStateException("Column " + valueColumn + " is not numeric: " + value);
    }
}
