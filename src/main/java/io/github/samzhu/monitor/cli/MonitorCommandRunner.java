package io.github.samzhu.monitor.cli;

import java.io.PrintStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import io.github.samzhu.monitor.backend.CredentialsReporter;
import io.github.samzhu.monitor.catalog.MetricCatalog;
import io.github.samzhu.monitor.catalog.MetricDefinition;
import io.github.samzhu.monitor.chart.ChartProjection;
import io.github.samzhu.monitor.chart.ChartProjector;
import io.github.samzhu.monitor.chart.ChartRenderer;
import io.github.samzhu.monitor.config.MonitorProperties;
import io.github.samzhu.monitor.config.MonitorProperties.ReportChart;
import io.github.samzhu.monitor.dto.BatchReport;
import io.github.samzhu.monitor.dto.BatchRequest;
import io.github.samzhu.monitor.dto.MetricQueryResult;
import io.github.samzhu.monitor.dto.QueryWindow;
import io.github.samzhu.monitor.export.OutputFormat;
import io.github.samzhu.monitor.export.TableExporter;
import io.github.samzhu.monitor.service.MetricBatchService;

/**
 * 命令列進入點。
 *
 * <p>三種模式都組成一個 {@link BatchRequest} 交給 {@link MetricBatchService}：
 * <ul>
 *   <li>單一指標：輸出表格，可選擇同時繪圖</li>
 *   <li>全部指標：依目錄順序逐一輸出表格，每個表格前加上指標標題</li>
 *   <li>標準報表：依 {@code monitor.report} 為每個有資料的指標繪圖</li>
 * </ul>
 *
 * <p>表格寫到 stdout，日誌寫到 stderr。處理超過一個指標時，最後記錄有資料與無資料的指標清單。
 */
@Component
public class MonitorCommandRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(MonitorCommandRunner.class);

    private final MonitorCommandParser parser;
    private final MetricCatalog catalog;
    private final MetricBatchService batchService;
    private final TableExporter exporter;
    private final ChartProjector projector;
    private final ChartRenderer renderer;
    private final CredentialsReporter credentialsReporter;
    private final MonitorProperties properties;
    private final Clock clock;
    private final PrintStream out;

    @Autowired
    public MonitorCommandRunner(
            MonitorCommandParser parser,
            MetricCatalog catalog,
            MetricBatchService batchService,
            TableExporter exporter,
            ChartProjector projector,
            ChartRenderer renderer,
            CredentialsReporter credentialsReporter,
            MonitorProperties properties,
            Clock clock) {
        this(parser, catalog, batchService, exporter, projector, renderer, credentialsReporter,
            properties, clock, System.out);
    }

    MonitorCommandRunner(
            MonitorCommandParser parser,
            MetricCatalog catalog,
            MetricBatchService batchService,
            TableExporter exporter,
            ChartProjector projector,
            ChartRenderer renderer,
            CredentialsReporter credentialsReporter,
            MonitorProperties properties,
            Clock clock,
            PrintStream out) {
        this.parser = parser;
        this.catalog = catalog;
        this.batchService = batchService;
        this.exporter = exporter;
        this.projector = projector;
        this.renderer = renderer;
        this.credentialsReporter = credentialsReporter;
        this.properties = properties;
        this.clock = clock;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        credentialsReporter.logActiveCredentials();

        MonitorCommand command = parser.parse(args);
        QueryWindow window = QueryWindow.ofDaysAgo(command.daysAgoStart(), command.daysAgoEnd(), clock);

        BatchReport report = switch (command.mode()) {
            case SINGLE_METRIC -> runSingleMetric(command, window);
            case ALL_METRICS -> runAllMetrics(command, window);
            case REPORT -> runReport(command, window);
        };
        logSummary(report);
    }

    private BatchReport runSingleMetric(MonitorCommand command, QueryWindow window) {
        MetricDefinition definition = catalog.require(command.metricName());
        BatchRequest request = new BatchRequest(List.of(definition), window, command.projectId(),
            command.filterModelId());

        BatchReport report = batchService.run(request, result -> {
            if (result.hasData()) {
                printTable(result, command.outputFormat());
            }
        });

        if (command.generateGraph()) {
            MetricQueryResult result = report.results().get(0);
            renderChart(result, definition, command.graphGroupBy());
        }
        return report;
    }

    private BatchReport runAllMetrics(MonitorCommand command, QueryWindow window) {
        BatchRequest request = new BatchRequest(catalog.all(), window, command.projectId(),
            command.filterModelId());
        return batchService.run(request, result -> {
            if (result.hasData()) {
                out.println();
                out.println("--- Metric: " + result.metricName() + " ---");
                printTable(result, command.outputFormat());
            }
            log.info("--- End of Metric: {} ---", result.metricName());
        });
    }

    private BatchReport runReport(MonitorCommand command, QueryWindow window) {
        log.info("--- Starting Standard Chart Generation ---");
        List<MetricDefinition> definitions = new ArrayList<>();
        Map<String, List<String>> groupBy = new LinkedHashMap<>();
        for (ReportChart chart : properties.report()) {
            Optional<MetricDefinition> definition = catalog.lookup(chart.metric());
            if (definition.isEmpty()) {
                log.warn("Metric '{}' not found in configurations. Skipping.", chart.metric());
                continue;
            }
            definitions.add(definition.get());
            groupBy.put(chart.metric(), chart.groupBy());
        }

        BatchRequest request = new BatchRequest(definitions, window, command.projectId(),
            command.filterModelId(), groupBy);
        BatchReport report = batchService.run(request, result -> {
            if (result.hasData()) {
                renderChart(result, catalog.require(result.metricName()), request.groupByFor(result.metricName()));
            } else {
                log.warn("No data returned for {}. Skipping chart generation.", result.metricName());
            }
        });
        log.info("--- Standard Chart Generation Complete ---");
        return report;
    }

    private void printTable(MetricQueryResult result, OutputFormat format) {
        out.println(exporter.export(result.table(), format));
    }

    private void renderChart(MetricQueryResult result, MetricDefinition definition, List<String> groupBy) {
        ChartProjection projection = projector.project(result.table(), definition.name(),
            definition.valueName(), groupBy);
        renderer.render(projection);
    }

    private void logSummary(BatchReport report) {
        if (report.size() <= 1) {
            return;
        }
        log.info("--- Query Summary ---");
        List<String> withData = report.metricsWithData().stream().sorted().toList();
        List<String> withoutData = report.metricsWithoutData().stream().sorted().toList();
        if (!withData.isEmpty()) {
            log.info("Metrics with data found:");
            withData.forEach(metric -> log.info("  - {}", metric));
        }
        if (!withoutData.isEmpty()) {
            log.info("Metrics with no data:");
            withoutData.forEach(metric -> log.info("  - {}", metric));
        }
        log.info("--- End of Summary ---");
    }
}
