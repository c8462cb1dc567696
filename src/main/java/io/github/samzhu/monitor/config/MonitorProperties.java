package io.github.samzhu.monitor.config;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import io.github.samzhu.monitor.catalog.ResourceLabels;
import io.github.samzhu.monitor.export.OutputFormat;

/**
 * Monitor 的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link WindowConfig} - 預設查詢時間窗（以「幾天前」表示）</li>
 *   <li>{@link OutputConfig} - 表格輸出格式與圖表輸出位置</li>
 *   <li>{@link MetricEntry} - 指標目錄，啟動時轉為 {@link io.github.samzhu.monitor.catalog.MetricCatalog}</li>
 *   <li>{@link ReportChart} - 標準報表包含的指標與預設分組欄位</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * monitor:
 *   project-id: my-project
 *   zone: Asia/Taipei
 *   window:
 *     start-days-ago: 30
 *     end-days-ago: 0
 *   catalog:
 *     - name: token_count
 *       metric-type: aiplatform.googleapis.com/publisher/online_serving/token_count
 *       value-field: int64
 *       value-name: token_count
 *       metric-labels: [type, request_type]
 *   report:
 *     - metric: token_count
 *       group-by: [type]
 * </pre>
 *
 * @param projectId 預設查詢的 GCP 專案（scope），可被 {@code --project-id} 覆寫
 * @param window 預設時間窗
 * @param zone 將 bucket 結束時間轉為日期所用的時區，未設定時使用系統時區
 * @param identityColumn 模型身分過濾所比對的欄位，預設 {@code model_user_id}
 * @param output 輸出設定
 * @param catalog 指標目錄
 * @param report 標準報表指標
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@ConfigurationProperties(prefix = "monitor")
public record MonitorProperties(
    String projectId,
    WindowConfig window,
    String zone,
    String identityColumn,
    OutputConfig output,
    List<MetricEntry> catalog,
    List<ReportChart> report
) {
    public MonitorProperties {
        if (window == null) {
            window = WindowConfig.defaults();
        }
        if (identityColumn == null || identityColumn.isBlank()) {
            identityColumn = ResourceLabels.MODEL_USER_ID;
        }
        if (output == null) {
            output = OutputConfig.defaults();
        }
        if (catalog == null) {
            catalog = List.of();
        }
        if (report == null) {
            report = List.of();
        }
    }

    /**
     * 取得日期換算所用的時區。
     */
    public ZoneId zoneId() {
        return zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
    }

    /**
     * 預設查詢時間窗。
     *
     * <p>兩者皆為相對於現在的天數，{@code endDaysAgo = 0} 表示現在。
     *
     * @param startDaysAgo 起點，預設 90
     * @param endDaysAgo 終點，預設 0
     */
    public record WindowConfig(
        Integer startDaysAgo,
        Integer endDaysAgo
    ) {
        public WindowConfig {
            if (startDaysAgo == null) {
                startDaysAgo = 90;
            }
            if (endDaysAgo == null) {
                endDaysAgo = 0;
            }
        }

        public static WindowConfig defaults() {
            return new WindowConfig(90, 0);
        }
    }

    /**
     * 輸出設定。
     *
     * @param format 預設表格格式，預設 MARKDOWN
     * @param chartDirectory 圖表 PNG 的輸出目錄，預設目前目錄
     * @param chartWidth 圖表寬度 (px)
     * @param chartHeight 圖表高度 (px)
     */
    public record OutputConfig(
        OutputFormat format,
        String chartDirectory,
        int chartWidth,
        int chartHeight
    ) {
        public OutputConfig {
            if (format == null) {
                format = OutputFormat.MARKDOWN;
            }
            if (chartDirectory == null || chartDirectory.isBlank()) {
                chartDirectory = ".";
            }
            if (chartWidth <= 0) {
                chartWidth = 1400;
            }
            if (chartHeight <= 0) {
                chartHeight = 800;
            }
        }

        public Path chartPath() {
            return Path.of(chartDirectory);
        }

        public static OutputConfig defaults() {
            return new OutputConfig(OutputFormat.MARKDOWN, ".", 1400, 800);
        }
    }

    /**
     * 指標目錄的單一項目（尚未驗證的原始設定值）。
     *
     * <p>aligner 預設 {@code ALIGN_DELTA}、reducer 預設 {@code REDUCE_SUM}，
     * 適用於 delta 類指標；gauge 類指標需明確指定 {@code ALIGN_MEAN}/{@code REDUCE_MEAN}。
     *
     * @param name 指標名稱
     * @param metricType 後端 metric type
     * @param valueField {@code int64} 或 {@code distribution}
     * @param valueName 輸出數值欄位名稱
     * @param metricLabels 額外分組 label
     * @param aligner 對齊方式
     * @param reducer 合併方式
     */
    public record MetricEntry(
        String name,
        String metricType,
        String valueField,
        String valueName,
        List<String> metricLabels,
        String aligner,
        String reducer
    ) {
        public MetricEntry {
            if (metricLabels == null) {
                metricLabels = List.of();
            }
            if (aligner == null || aligner.isBlank()) {
                aligner = "ALIGN_DELTA";
            }
            if (reducer == null || reducer.isBlank()) {
                reducer = "REDUCE_SUM";
            }
        }
    }

    /**
     * 標準報表中的一張圖。
     *
     * @param metric 指標名稱
     * @param groupBy 預設分組欄位
     */
    public record ReportChart(
        String metric,
        List<String> groupBy
    ) {
        public ReportChart {
            if (groupBy == null) {
                groupBy = List.of();
            }
        }
    }
}
