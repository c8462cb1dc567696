package io.github.samzhu.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Model Usage Monitor - AI 模型服務用量與效能報表工具。
 *
 * <p>從 Cloud Monitoring 讀取 Vertex AI 模型服務的遙測資料，負責：
 * <ul>
 *   <li>依指標目錄組出 time series 查詢（一天對齊、固定資源維度分組）</li>
 *   <li>將巢狀的 series/point 回應攤平成欄位順序固定的表格</li>
 *   <li>以 Markdown、CSV 或 JSON 輸出表格</li>
 *   <li>繪製每日時間序列圖表</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * MetricCatalog → QueryTranslator → Cloud Monitoring (timeSeries.list)
 *                                          ↓
 *                                  ResponseNormalizer → NormalizedTable
 *                                          ↓
 *                  MetricBatchService → TableExporter (stdout) / ChartRenderer (PNG)
 * </pre>
 *
 * @see <a href="https://cloud.google.com/vertex-ai/docs/general/monitoring-metrics">Vertex AI monitoring metrics</a>
 */
@SpringBootApplication
public class MonitorApplication {

    private static final Logger log = LoggerFactory.getLogger(MonitorApplication.class);

    public static void main(String[] args) {
        log.info("Starting Model Usage Monitor");
        System.exit(SpringApplication.exit(SpringApplication.run(MonitorApplication.class, args)));
    }
}
