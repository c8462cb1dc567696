package io.github.samzhu.monitor.table;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 單一指標查詢的正規化結果表格（不可變）。
 *
 * <p>欄位依 {@link ColumnOrder} 排列；列依 {@code date}、再依所有 label 欄位遞增排序，
 * 全部相同時保持原本的產生順序。空結果回傳沒有欄位、沒有列的表格。
 *
 * @param columns 欄位順序
 * @param valueColumn 數值欄位名稱
 * @param rows 已排序的列
 */
public record NormalizedTable(
    List<String> columns,
    String valueColumn,
    List<NormalizedRow> rows
) {
    public static final String DATE_COLUMN = "date";

    public NormalizedTable {
        Objects.requireNonNull(valueColumn, "valueColumn");
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    /**
     * 建立空表格。
     *
     * @param valueColumn 數值欄位名稱
     */
    public static NormalizedTable empty(String valueColumn) {
        return new NormalizedTable(List.of(), valueColumn, List.of());
    }

    /**
     * 由各列的欄位對應建立表格：補齊缺值欄位並依欄位順序排序。
     *
     * @param labelColumns 已排列的 label 欄位
     * @param valueColumn 數值欄位名稱
     * @param records 依產生順序排列的欄位對應（可缺少部分 label）
     * @return 排序後的表格
     */
    public static NormalizedTable of(List<String> labelColumns, String valueColumn,
                                     List<Map<String, Object>> records) {
        if (records.isEmpty()) {
            return empty(valueColumn);
        }
        List<String> columns = ColumnOrder.tableColumns(labelColumns, valueColumn);
        List<NormalizedRow> rows = new ArrayList<>(records.size());
        for (Map<String, Object> values : records) {
            Map<String, Object> ordered = new LinkedHashMap<>();
            for (String column : columns) {
                ordered.put(column, values.get(column));
            }
            rows.add(new NormalizedRow(ordered));
        }
        // List.sort 為穩定排序，鍵完全相同時保留產生順序
        rows.sort(rowOrder(labelColumns));
        return new NormalizedTable(columns, valueColumn, rows);
    }

    private static Comparator<NormalizedRow> rowOrder(List<String> labelColumns) {
        Comparator<NormalizedRow> order = Comparator.comparing(NormalizedRow::date);
        for (String column : labelColumns) {
            order = order.thenComparing(row -> row.label(column),
                Comparator.nullsLast(Comparator.<String>naturalOrder()));
        }
        return order;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * 取得 label 欄位（不含 {@code date} 與數值欄位）。
     */
    public List<String> labelColumns() {
        return columns.stream()
            .filter(column -> !DATE_COLUMN.equals(column) && !valueColumn.equals(column))
            .toList();
    }

    /**
     * 只保留指定欄位等於指定值的列，欄位與排序不變。
     *
     * @param column 欄位名稱
     * @param value 要保留的值
     * @return 過濾後的新表格
     */
    public NormalizedTable filter(String column, String value) {
        List<NormalizedRow> kept = rows.stream()
            .filter(row -> Objects.equals(row.label(column), value))
            .toList();
        return new NormalizedTable(columns, valueColumn, kept);
    }

    /**
     * 轉成 record 形式的輸出資料，日期以 ISO-8601 字串表示。
     */
    public List<Map<String, Object>> toRecords() {
        List<Map<String, Object>> records = new ArrayList<>(rows.size());
        for (NormalizedRow row : rows) {
            Map<String, Object> values = new LinkedHashMap<>(row.asMap());
            values.put(DATE_COLUMN, row.date().toString());
            records.add(values);
        }
        return records;
    }
}
