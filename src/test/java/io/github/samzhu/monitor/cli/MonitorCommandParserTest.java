package io.github.samzhu.monitor.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import io.github.samzhu.monitor.catalog.MetricCatalog;
import io.github.samzhu.monitor.cli.MonitorCommand.Mode;
import io.github.samzhu.monitor.config.MonitorProperties;
import io.github.samzhu.monitor.config.MonitorProperties.MetricEntry;
import io.github.samzhu.monitor.exception.InvalidCommandLineException;
import io.github.samzhu.monitor.export.OutputFormat;

class MonitorCommandParserTest {

    private MetricCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = MetricCatalog.fromEntries(List.of(
            new MetricEntry("token_count", "aiplatform.googleapis.com/publisher/online_serving/token_count",
                "int64", "token_count", List.of("type"), null, null),
            new MetricEntry("model_invocation_count",
                "aiplatform.googleapis.com/publisher/online_serving/model_invocation_count",
                "int64", "invocation_count", List.of("response_code"), null, null)));
    }

    @Test
    void shouldParseSingleMetricWithDefaults() {
        // When
        MonitorCommand command = parse(null, "--project-id=my-project", "--metric=token_count");

        // Then
        assertThat(command.mode()).isEqualTo(Mode.SINGLE_METRIC);
        assertThat(command.metricName()).isEqualTo("token_count");
        assertThat(command.projectId()).isEqualTo("my-project");
        assertThat(command.daysAgoStart()).isEqualTo(90);
        assertThat(command.daysAgoEnd()).isZero();
        assertThat(command.outputFormat()).isEqualTo(OutputFormat.MARKDOWN);
        assertThat(command.generateGraph()).isFalse();
        assertThat(command.filterModelId()).isNull();
    }

    @Test
    void shouldParseGraphOptions() {
        MonitorCommand command = parse(null, "--project-id=my-project", "--metric=token_count",
            "--generate-graph", "--graph-group-by=type, location", "--output=csv",
            "--days-ago-start=30", "--days-ago-end=7", "--filter-model-id=gemini-2.0-flash");

        assertThat(command.generateGraph()).isTrue();
        assertThat(command.graphGroupBy()).containsExactly("type", "location");
        assertThat(command.outputFormat()).isEqualTo(OutputFormat.CSV);
        assertThat(command.daysAgoStart()).isEqualTo(30);
        assertThat(command.daysAgoEnd()).isEqualTo(7);
        assertThat(command.filterModelId()).isEqualTo("gemini-2.0-flash");
    }

    @Test
    void shouldFallBackToConfiguredProject() {
        // Given: 未指定 --project-id，使用 monitor.project-id
        MonitorCommand command = parse("configured-project", "--all-metrics");

        assertThat(command.mode()).isEqualTo(Mode.ALL_METRICS);
        assertThat(command.projectId()).isEqualTo("configured-project");
    }

    @Test
    void shouldParseReportMode() {
        MonitorCommand command = parse(null, "--project-id=p", "--generate-report-charts",
            "--filter-model-id=gemini-1.5-pro");

        assertThat(command.mode()).isEqualTo(Mode.REPORT);
        assertThat(command.filterModelId()).isEqualTo("gemini-1.5-pro");
    }

    @Test
    void shouldRequireExactlyOneMode() {
        assertThatThrownBy(() -> parse(null, "--project-id=p"))
            .isInstanceOf(InvalidCommandLineException.class)
            .hasMessageContaining("Exactly one of");
        assertThatThrownBy(() -> parse(null, "--project-id=p", "--all-metrics", "--generate-report-charts"))
            .isInstanceOf(InvalidCommandLineException.class);
    }

    @Test
    void shouldRejectUnknownMetric() {
        assertThatThrownBy(() -> parse(null, "--project-id=p", "--metric=characters"))
            .isInstanceOf(InvalidCommandLineException.class)
            .hasMessageContaining("invalid choice 'characters'");
    }

    @Test
    void shouldRequireProjectId() {
        assertThatThrownBy(() -> parse(null, "--metric=token_count"))
            .isInstanceOf(InvalidCommandLineException.class)
            .hasMessageContaining("--project-id is required");
    }

    @Test
    void shouldRejectGraphWithoutSingleMetric() {
        assertThatThrownBy(() -> parse(null, "--project-id=p", "--all-metrics", "--generate-graph"))
            .isInstanceOf(InvalidCommandLineException.class)
            .hasMessageContaining("--generate-graph can only be used with the --metric flag");
    }

    @Test
    void shouldRejectGroupByWithoutGraph() {
        assertThatThrownBy(() -> parse(null, "--project-id=p", "--metric=token_count", "--graph-group-by=type"))
            .isInstanceOf(InvalidCommandLineException.class)
            .hasMessageContaining("--graph-group-by can only be used with --generate-graph");
    }

    @Test
    void shouldRejectInvalidWindow() {
        assertThatThrownBy(() -> parse(null, "--project-id=p", "--all-metrics",
                "--days-ago-start=5", "--days-ago-end=5"))
            .isInstanceOf(InvalidCommandLineException.class)
            .hasMessageContaining("must be greater than");
        assertThatThrownBy(() -> parse(null, "--project-id=p", "--all-metrics", "--days-ago-start=ten"))
            .isInstanceOf(InvalidCommandLineException.class)
            .hasMessageContaining("invalid int value 'ten'");
    }

    @Test
    void shouldRejectUnknownOptionAndFormat() {
        assertThatThrownBy(() -> parse(null, "--project-id=p", "--all-metrics", "--verbose"))
            .isInstanceOf(InvalidCommandLineException.class)
            .hasMessageContaining("--verbose");
        assertThatThrownBy(() -> parse(null, "--project-id=p", "--all-metrics", "--output=xml"))
            .isInstanceOf(InvalidCommandLineException.class)
            .hasMessageContaining("invalid choice 'xml'");
    }

    @Test
    void shouldIgnoreSpringConfigurationOptions() {
        MonitorCommand command = parse(null, "--project-id=p", "--all-metrics", "--monitor.zone=UTC",
            "--spring.main.banner-mode=off");

        assertThat(command.mode()).isEqualTo(Mode.ALL_METRICS);
    }

    private MonitorCommand parse(String configuredProject, String... args) {
        MonitorProperties properties = new MonitorProperties(configuredProject, null, null, null, null, null, null);
        return new MonitorCommandParser(catalog, properties).parse(new DefaultApplicationArguments(args));
    }
}
