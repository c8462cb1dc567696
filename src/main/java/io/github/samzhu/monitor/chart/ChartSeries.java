package io.github.samzhu.monitor.chart;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 圖表中的一條線：分組值組合與依日期排序的加總值。
 *
 * @param key 分組欄位值（依分組欄位順序），彙總線為空清單
 * @param points 日期到加總值
 */
public record ChartSeries(
    List<String> key,
    SortedMap<LocalDate, Long> points
) {
    public ChartSeries {
        key = List.copyOf(key);
        points = Collections.unmodifiableSortedMap(new TreeMap<>(points));
    }

    /**
     * 圖例使用的名稱。
     *
     * @param fallback 彙總線使用的名稱
     */
    public String label(String fallback) {
        return key.isEmpty() ? fallback : String.join(", ", key);
    }
}
