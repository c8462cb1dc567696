package io.github.samzhu.monitor.chart;

import java.util.List;

/**
 * 交給繪圖器的時間序列集合。
 *
 * @param metricName 指標名稱，決定標題與檔名
 * @param valueColumn 加總的數值欄位
 * @param groupColumns 實際使用的分組欄位，空清單表示單一彙總線
 * @param series 各條線，依分組值排序
 */
public record ChartProjection(
    String metricName,
    String valueColumn,
    List<String> groupColumns,
    List<ChartSeries> series
) {
    public ChartProjection {
        groupColumns = List.copyOf(groupColumns);
        series = List.copyOf(series);
    }

    public boolean isGrouped() {
        return !groupColumns.isEmpty();
    }

    public boolean isEmpty() {
        return series.isEmpty();
    }

    public String title() {
        String title = "Daily " + metricName + " Over Time";
        return isGrouped() ? title + " by " + groupLabel() : title;
    }

    public String groupLabel() {
        return String.join(" & ", groupColumns);
    }
}
