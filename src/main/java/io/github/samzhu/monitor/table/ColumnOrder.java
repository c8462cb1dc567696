package io.github.samzhu.monitor.table;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

import io.github.samzhu.monitor.catalog.ResourceLabels;

/**
 * 正規化表格的欄位排列規則。
 *
 * <p>{@code date} 在最前，接著是 label 欄位，數值欄位在最後。
 * label 欄位先放最常用來過濾的幾個（{@link #PREFERRED}，只取實際出現者），
 * 其餘依字母排序。排序列時也使用同一個順序。
 */
public final class ColumnOrder {

    public static final List<String> PREFERRED = List.of(
        ResourceLabels.LOCATION,
        ResourceLabels.PROJECT_ID,
        ResourceLabels.MODEL_USER_ID,
        ResourceLabels.MODEL_VERSION_ID);

    private ColumnOrder() {
    }

    /**
     * 排列 label 欄位。
     *
     * @param labels 回應中實際出現的 label 鍵
     * @return 偏好欄位在前、其餘依字母排序的欄位清單
     */
    public static List<String> labelColumns(Collection<String> labels) {
        List<String> ordered = new ArrayList<>();
        for (String preferred : PREFERRED) {
            if (labels.contains(preferred)) {
                ordered.add(preferred);
            }
        }
        TreeSet<String> remaining = new TreeSet<>(labels);
        remaining.removeAll(PREFERRED);
        ordered.addAll(remaining);
        return ordered;
    }

    /**
     * 組出完整欄位順序：{@code date}、label 欄位、數值欄位。
     */
    public static List<String> tableColumns(List<String> labelColumns, String valueColumn) {
        List<String> columns = new ArrayList<>(labelColumns.size() + 2);
        columns.add(NormalizedTable.DATE_COLUMN);
        columns.addAll(labelColumns);
        columns.add(valueColumn);
        return columns;
    }
}
