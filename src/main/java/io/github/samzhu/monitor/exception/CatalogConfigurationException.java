package io.github.samzhu.monitor.exception;

/**
 * 指標目錄設定錯誤。
 *
 * <p>於啟動時建立 {@link io.github.samzhu.monitor.catalog.MetricCatalog} 時拋出，
 * 例如 metric type 為空、aligner/reducer 無法辨識、value field 不在
 * {@code int64}/{@code distribution} 之內。
 *
 * <p>這是唯一允許中止整個程序的錯誤類型。
 */
public class CatalogConfigurationException extends RuntimeException {

    private final String metricName;

    public CatalogConfigurationException(String metricName, String reason) {
        super(String.format("Invalid metric catalog entry '%s': %s", metricName, reason));
        this.metricName = metricName;
    }

    public String getMetricName() {
        return metricName;
    }
}
