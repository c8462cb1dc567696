package io.github.samzhu.monitor.dto;

import java.util.List;
import java.util.Map;

import io.github.samzhu.monitor.catalog.MetricDefinition;

/**
 * 批次查詢請求。
 *
 * <p>單一指標、全部指標與標準報表三種模式都使用同一個請求；報表模式透過
 * {@code chartGroupBy} 帶入每個指標的預設分組欄位。
 *
 * @param metrics 要依序查詢的指標
 * @param window 時間窗
 * @param projectId 查詢的 GCP 專案
 * @param identityFilter 身分過濾值（比對 identity 欄位），null 表示不過濾
 * @param chartGroupBy 指標名稱到圖表分組欄位的對應，可為空
 */
public record BatchRequest(
    List<MetricDefinition> metrics,
    QueryWindow window,
    String projectId,
    String identityFilter,
    Map<String, List<String>> chartGroupBy
) {
    public BatchRequest {
        metrics = List.copyOf(metrics);
        chartGroupBy = chartGroupBy == null ? Map.of() : Map.copyOf(chartGroupBy);
    }

    public BatchRequest(List<MetricDefinition> metrics, QueryWindow window, String projectId, String identityFilter) {
        this(metrics, window, projectId, identityFilter, Map.of());
    }

    public boolean hasIdentityFilter() {
        return identityFilter != null && !identityFilter.isBlank();
    }

    public List<String> groupByFor(String metricName) {
        return chartGroupBy.getOrDefault(metricName, List.of());
    }
}
