package io.github.samzhu.monitor.dto;

import java.util.List;
import java.util.Map;

/**
 * 後端回傳的一條時間序列：固定的 label 組合與依序排列的資料點。
 *
 * @param resourceLabels 資源 label
 * @param metricLabels 指標 label，與資源 label 的鍵不會重疊
 * @param points 資料點
 */
public record RawSeries(
    Map<String, String> resourceLabels,
    Map<String, String> metricLabels,
    List<RawPoint> points
) {
    public RawSeries {
        resourceLabels = resourceLabels == null ? Map.of() : Map.copyOf(resourceLabels);
        metricLabels = metricLabels == null ? Map.of() : Map.copyOf(metricLabels);
        points = points == null ? List.of() : List.copyOf(points);
    }
}
