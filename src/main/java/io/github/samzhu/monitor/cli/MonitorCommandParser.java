package io.github.samzhu.monitor.cli;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;

import io.github.samzhu.monitor.catalog.MetricCatalog;
import io.github.samzhu.monitor.cli.MonitorCommand.Mode;
import io.github.samzhu.monitor.config.MonitorProperties;
import io.github.samzhu.monitor.exception.InvalidCommandLineException;
import io.github.samzhu.monitor.export.OutputFormat;

/**
 * 解析並驗證命令列參數。
 *
 * <p>支援的選項：
 * <pre>
 * --project-id=&lt;id&gt;            GCP 專案（未指定時使用 monitor.project-id）
 * --metric=&lt;name&gt;              查詢單一指標
 * --all-metrics                 查詢所有指標
 * --generate-report-charts      產生標準報表圖表
 * --days-ago-start=&lt;n&gt;         時間窗起點，預設 90
 * --days-ago-end=&lt;n&gt;           時間窗終點，預設 0（現在）
 * --output=markdown|csv|json    表格格式
 * --generate-graph              單一指標同時繪圖（僅限 --metric）
 * --graph-group-by=a,b          圖表分組欄位（僅限 --generate-graph）
 * --filter-model-id=&lt;id&gt;       只保留 model_user_id 等於此值的列
 * </pre>
 *
 * <p>三種模式互斥且必須擇一。以 {@code spring.}、{@code monitor.}、{@code logging.}
 * 開頭的選項保留給 Spring 組態，不在此檢查。
 */
@Component
public class MonitorCommandParser {

    static final String PROJECT_ID = "project-id";
    static final String METRIC = "metric";
    static final String ALL_METRICS = "all-metrics";
    static final String REPORT = "generate-report-charts";
    static final String DAYS_AGO_START = "days-ago-start";
    static final String DAYS_AGO_END = "days-ago-end";
    static final String OUTPUT = "output";
    static final String GENERATE_GRAPH = "generate-graph";
    static final String GRAPH_GROUP_BY = "graph-group-by";
    static final String FILTER_MODEL_ID = "filter-model-id";

    private static final Set<String> KNOWN_OPTIONS = Set.of(PROJECT_ID, METRIC, ALL_METRICS, REPORT,
        DAYS_AGO_START, DAYS_AGO_END, OUTPUT, GENERATE_GRAPH, GRAPH_GROUP_BY, FILTER_MODEL_ID);
    private static final List<String> CONFIG_PREFIXES = List.of("spring.", "monitor.", "logging.", "debug", "trace");

    private final MetricCatalog catalog;
    private final MonitorProperties properties;

    public MonitorCommandParser(MetricCatalog catalog, MonitorProperties properties) {
        this.catalog = catalog;
        this.properties = properties;
    }

    public MonitorCommand parse(ApplicationArguments args) {
        for (String option : args.getOptionNames()) {
            if (!KNOWN_OPTIONS.contains(option) && CONFIG_PREFIXES.stream().noneMatch(option::startsWith)) {
                throw new InvalidCommandLineException("Unrecognized option --" + option);
            }
        }
        if (!args.getNonOptionArgs().isEmpty()) {
            throw new InvalidCommandLineException("Unexpected arguments: " + args.getNonOptionArgs());
        }

        Mode mode = resolveMode(args);
        String metricName = null;
        if (mode == Mode.SINGLE_METRIC) {
            metricName = value(args, METRIC);
            if (metricName == null || catalog.lookup(metricName).isEmpty()) {
                throw new InvalidCommandLineException(String.format(
                    "--metric: invalid choice '%s' (choose from %s)", metricName, catalog.names()));
            }
        }

        String projectId = value(args, PROJECT_ID);
        if (projectId == null || projectId.isBlank()) {
            projectId = properties.projectId();
        }
        if (projectId == null || projectId.isBlank()) {
            throw new InvalidCommandLineException("--project-id is required");
        }

        int daysAgoStart = intValue(args, DAYS_AGO_START, properties.window().startDaysAgo());
        int daysAgoEnd = intValue(args, DAYS_AGO_END, properties.window().endDaysAgo());
        if (daysAgoEnd < 0 || daysAgoStart <= daysAgoEnd) {
            throw new InvalidCommandLineException(String.format(
                "--days-ago-start (%d) must be greater than --days-ago-end (%d), and both must be >= 0",
                daysAgoStart, daysAgoEnd));
        }

        OutputFormat format = properties.output().format();
        String output = value(args, OUTPUT);
        if (output != null) {
            format = OutputFormat.parse(output).orElseThrow(() -> new InvalidCommandLineException(
                "--output: invalid choice '" + output + "' (choose from markdown, csv, json)"));
        }

        boolean generateGraph = args.containsOption(GENERATE_GRAPH);
        if (generateGraph && mode != Mode.SINGLE_METRIC) {
            throw new InvalidCommandLineException("--generate-graph can only be used with the --metric flag.");
        }
        List<String> groupBy = splitColumns(value(args, GRAPH_GROUP_BY));
        if (args.containsOption(GRAPH_GROUP_BY) && !generateGraph) {
            throw new InvalidCommandLineException("--graph-group-by can only be used with --generate-graph.");
        }

        String filterModelId = value(args, FILTER_MODEL_ID);
        if (args.containsOption(FILTER_MODEL_ID) && (filterModelId == null || filterModelId.isBlank())) {
            throw new InvalidCommandLineException("--filter-model-id requires a value");
        }

        return new MonitorCommand(mode, metricName, projectId, daysAgoStart, daysAgoEnd, format,
            generateGraph, groupBy, filterModelId);
    }

    private static Mode resolveMode(ApplicationArguments args) {
        List<Mode> modes = new ArrayList<>();
        if (args.containsOption(METRIC)) {
            modes.add(Mode.SINGLE_METRIC);
        }
        if (args.containsOption(ALL_METRICS)) {
            modes.add(Mode.ALL_METRICS);
        }
        if (args.containsOption(REPORT)) {
            modes.add(Mode.REPORT);
        }
        if (modes.size() != 1) {
            throw new InvalidCommandLineException(
                "Exactly one of --metric, --all-metrics or --generate-report-charts is required");
        }
        return modes.get(0);
    }

    private static String value(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }

    private static int intValue(ApplicationArguments args, String name, int defaultValue) {
        String value = value(args, name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidCommandLineException("--" + name + ": invalid int value '" + value + "'");
        }
    }

    private static List<String> splitColumns(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(column -> !column.isEmpty())
            .toList();
    }
}
