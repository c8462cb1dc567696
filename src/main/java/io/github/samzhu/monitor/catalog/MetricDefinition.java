package io.github.samzhu.monitor.catalog;

import java.util.List;

/**
 * 單一指標的完整查詢定義（不可變）。
 *
 * @param name 唯一識別名稱，同時作為目錄鍵與輸出標籤
 * @param metricType 後端完整 metric type，例如
 *                   {@code aiplatform.googleapis.com/publisher/online_serving/token_count}
 * @param valueField 要讀取的值型別
 * @param valueName 輸出表格中數值欄位的名稱
 * @param metricLabels 此指標額外的分組維度（資源維度以外）
 * @param aligner 單一 series 的時間對齊方式
 * @param reducer 跨 series 的合併方式
 */
public record MetricDefinition(
    String name,
    String metricType,
    ValueField valueField,
    String valueName,
    List<String> metricLabels,
    Aligner aligner,
    Reducer reducer
) {
    public MetricDefinition {
        metricLabels = metricLabels == null ? List.of() : List.copyOf(metricLabels);
    }
}
