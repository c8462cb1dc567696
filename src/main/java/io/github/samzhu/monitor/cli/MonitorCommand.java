package io.github.samzhu.monitor.cli;

import java.util.List;

import io.github.samzhu.monitor.export.OutputFormat;

/**
 * 解析後的命令列參數。
 *
 * @param mode 執行模式
 * @param metricName 單一指標模式的指標名稱
 * @param projectId GCP 專案
 * @param daysAgoStart 時間窗起點（天前）
 * @param daysAgoEnd 時間窗終點（天前），0 表示現在
 * @param outputFormat 表格輸出格式
 * @param generateGraph 單一指標模式是否同時繪圖
 * @param graphGroupBy 單一指標圖表的分組欄位
 * @param filterModelId 模型身分過濾值，可為 null
 */
public record MonitorCommand(
    Mode mode,
    String metricName,
    String projectId,
    int daysAgoStart,
    int daysAgoEnd,
    OutputFormat outputFormat,
    boolean generateGraph,
    List<String> graphGroupBy,
    String filterModelId
) {
    public MonitorCommand {
        graphGroupBy = graphGroupBy == null ? List.of() : List.copyOf(graphGroupBy);
    }

    public enum Mode {
        /** {@code --metric=<name>}：查詢單一指標並輸出表格。 */
        SINGLE_METRIC,
        /** {@code --all-metrics}：依序查詢目錄中所有指標並輸出表格。 */
        ALL_METRICS,
        /** {@code --generate-report-charts}：為標準報表指標繪圖。 */
        REPORT
    }
}
