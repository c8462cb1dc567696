package io.github.samzhu.monitor.table;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 正規化表格中的一列：欄位名稱到值的有序對應。
 *
 * <p>欄位順序與所屬表格的 {@link NormalizedTable#columns()} 相同。
 * 某條 series 沒有帶到的 label 仍保留鍵，值為 {@code null}（以 {@link #isAbsent(String)} 判斷），
 * 因此同一張表的每一列欄位集合完全一致。
 */
public final class NormalizedRow {

    private final Map<String, Object> values;

    NormalizedRow(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public LocalDate date() {
        return (LocalDate) values.get(NormalizedTable.DATE_COLUMN);
    }

    /**
     * 取得 label 欄位的值。
     *
     * @param column 欄位名稱
     * @return label 值，缺值時為 null
     */
    public String label(String column) {
        Object value = values.get(column);
        return value == null ? null : value.toString();
    }

    public Object get(String column) {
        return values.get(column);
    }

    /**
     * 判斷欄位在此列是否缺值。欄位必須屬於此列所在的表格。
     */
    public boolean isAbsent(String column) {
        if (!values.containsKey(column)) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return values.get(column) == null;
    }

    public boolean hasColumn(String column) {
        return values.containsKey(column);
    }

    /**
     * 依欄位順序回傳唯讀的欄位對應。
     */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NormalizedRow other)) {
            return false;
        }
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
