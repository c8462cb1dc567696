package io.github.samzhu.monitor.chart;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.jfree.chart.JFreeChart;
import org.jfree.data.time.TimeSeriesCollection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.github.samzhu.monitor.config.MonitorProperties.OutputConfig;
import io.github.samzhu.monitor.export.OutputFormat;

class JFreeChartRendererTest {

    @TempDir
    Path chartDirectory;

    @Test
    void shouldBuildGroupedChart() {
        // Given
        JFreeChartRenderer renderer = rendererFor(chartDirectory);
        ChartProjection projection = new ChartProjection("token_count", "token_count", List.of("type"), List.of(
            new ChartSeries(List.of("input"), points(Map.of(LocalDate.of(2025, 1, 1), 15L))),
            new ChartSeries(List.of("output"), points(Map.of(LocalDate.of(2025, 1, 1), 1L)))));

        // When
        JFreeChart chart = renderer.createChart(projection);

        // Then
        assertThat(chart.getTitle().getText()).isEqualTo("Daily token_count Over Time by type");
        assertThat(chart.getXYPlot().getRangeAxis().getLabel()).isEqualTo("Total token_count");
        assertThat(chart.getXYPlot().getDomainAxis().getLabel()).isEqualTo("Date");
        assertThat(chart.getLegend()).isNotNull();
        TimeSeriesCollection dataset = (TimeSeriesCollection) chart.getXYPlot().getDataset();
        assertThat(dataset.getSeriesCount()).isEqualTo(2);
        assertThat(dataset.getSeries(0).getKey()).isEqualTo("input");
    }

    @Test
    void shouldOmitLegendForSingleLine() {
        JFreeChartRenderer renderer = rendererFor(chartDirectory);
        ChartProjection projection = new ChartProjection("token_count", "token_count", List.of(), List.of(
            new ChartSeries(List.of(), points(Map.of(LocalDate.of(2025, 1, 1), 16L)))));

        JFreeChart chart = renderer.createChart(projection);

        assertThat(chart.getLegend()).isNull();
        assertThat(((TimeSeriesCollection) chart.getXYPlot().getDataset()).getSeries(0).getKey())
            .isEqualTo("token_count");
    }

    @Test
    void shouldSkipEmptyProjection() {
        JFreeChartRenderer renderer = rendererFor(chartDirectory);

        assertThat(renderer.render(new ChartProjection("token_count", "token_count", List.of(), List.of())))
            .isEmpty();
        assertThat(chartDirectory.toFile().list()).isEmpty();
    }

    @Test
    void shouldNameChartFileAfterMetric() {
        assertThat(JFreeChartRenderer.fileName("model_invocation_count")).isEqualTo("model_invocation_count_chart.png");
    }

    private static JFreeChartRenderer rendererFor(Path directory) {
        return new JFreeChartRenderer(new OutputConfig(OutputFormat.MARKDOWN, directory.toString(), 800, 600));
    }

    private static TreeMap<LocalDate, Long> points(Map<LocalDate, Long> values) {
        return new TreeMap<>(values);
    }
}
