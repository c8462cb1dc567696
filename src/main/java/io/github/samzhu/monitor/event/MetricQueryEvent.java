package io.github.samzhu.monitor.event;

import io.github.samzhu.monitor.dto.QueryWindow;

/**
 * 指標查詢過程中的狀態事件。
 *
 * <p>查詢與批次服務透過 {@link org.springframework.context.ApplicationEventPublisher}
 * 發布此事件，由 {@link MetricQueryEventLogger} 轉為日誌；服務本身不直接輸出查詢結果日誌，
 * 測試可以直接收集事件驗證。
 *
 * @param type 事件類型
 * @param metricName 指標名稱
 * @param metricType 後端 metric type
 * @param projectId 查詢的 GCP 專案
 * @param window 時間窗
 * @param rowCount 事件發生時的列數（過濾事件為過濾後列數）
 * @param totalRows 過濾前列數，其他事件與 rowCount 相同
 * @param detail 失敗訊息或附加說明，可為 null
 */
public record MetricQueryEvent(
    Type type,
    String metricName,
    String metricType,
    String projectId,
    QueryWindow window,
    int rowCount,
    int totalRows,
    String detail
) {
    public enum Type {
        STARTED,
        COMPLETED,
        EMPTY,
        FILTERED,
        FILTER_SKIPPED,
        FILTERED_OUT,
        AUTHORIZATION_FAILED,
        CALL_FAILED
    }

    public static MetricQueryEvent of(Type type, String metricName, String metricType,
                                      String projectId, QueryWindow window) {
        return new MetricQueryEvent(type, metricName, metricType, projectId, window, 0, 0, null);
    }

    public MetricQueryEvent withRows(int rows) {
        return new MetricQueryEvent(type, metricName, metricType, projectId, window, rows, rows, detail);
    }

    public MetricQueryEvent withRows(int rows, int total) {
        return new MetricQueryEvent(type, metricName, metricType, projectId, window, rows, total, detail);
    }

    public MetricQueryEvent withDetail(String message) {
        return new MetricQueryEvent(type, metricName, metricType, projectId, window, rowCount, totalRows, message);
    }
}
