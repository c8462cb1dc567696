package io.github.samzhu.monitor.dto;

import java.util.List;

/**
 * 批次查詢的結果，依查詢順序保存每個指標的結果。
 *
 * @param results 每個指標的查詢結果
 */
public record BatchReport(
    List<MetricQueryResult> results
) {
    public BatchReport {
        results = List.copyOf(results);
    }

    /**
     * 至少產出一列資料的指標。
     */
    public List<String> metricsWithData() {
        return results.stream()
            .filter(MetricQueryResult::hasData)
            .map(MetricQueryResult::metricName)
            .toList();
    }

    /**
     * 沒有資料的指標，包含查詢失敗與過濾後為空者。
     */
    public List<String> metricsWithoutData() {
        return results.stream()
            .filter(result -> !result.hasData())
            .map(MetricQueryResult::metricName)
            .toList();
    }

    public int size() {
        return results.size();
    }
}
