package io.github.samzhu.monitor.dto;

import io.github.samzhu.monitor.table.NormalizedTable;

/**
 * 單一指標查詢的結果。
 *
 * <p>所有失敗在下游都等同「沒有資料」，但 {@link Status} 保留了失敗原因，
 * 呼叫端與測試可以區分授權失敗、呼叫失敗與真正的空結果。
 *
 * @param metricName 指標名稱
 * @param status 結果狀態
 * @param table 正規化表格；非 {@link Status#DATA} 時可能為空表格
 * @param detail 失敗訊息或過濾說明，可為 null
 */
public record MetricQueryResult(
    String metricName,
    Status status,
    NormalizedTable table,
    String detail
) {
    public enum Status {
        /** 查詢成功且有資料。 */
        DATA,
        /** 查詢成功但時間窗內沒有資料。 */
        EMPTY,
        /** 查詢成功，但身分過濾後沒有剩下任何列。 */
        FILTERED_OUT,
        /** 沒有 scope 的查詢權限。 */
        AUTHORIZATION_FAILED,
        /** 網路、配額或後端錯誤。 */
        CALL_FAILED
    }

    public static MetricQueryResult data(String metricName, NormalizedTable table) {
        return new MetricQueryResult(metricName, Status.DATA, table, null);
    }

    public static MetricQueryResult empty(String metricName, String valueColumn) {
        return new MetricQueryResult(metricName, Status.EMPTY, NormalizedTable.empty(valueColumn), null);
    }

    public static MetricQueryResult filteredOut(String metricName, NormalizedTable table, String detail) {
        return new MetricQueryResult(metricName, Status.FILTERED_OUT, table, detail);
    }

    public static MetricQueryResult failed(String metricName, Status status, String valueColumn, String detail) {
        return new MetricQueryResult(metricName, status, NormalizedTable.empty(valueColumn), detail);
    }

    public boolean hasData() {
        return status == Status.DATA && !table.isEmpty();
    }
}
