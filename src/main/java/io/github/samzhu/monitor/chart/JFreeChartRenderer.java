package io.github.samzhu.monitor.chart;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.chart.title.LegendTitle;
import org.jfree.chart.title.TextTitle;
import org.jfree.chart.ui.RectangleEdge;
import org.jfree.data.time.Day;
import org.jfree.data.time.TimeSeries;
import org.jfree.data.time.TimeSeriesCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.samzhu.monitor.config.MonitorProperties.OutputConfig;

/**
 * 以 JFreeChart 繪製帶標記點的時間序列折線圖，輸出為 {@code <metric>_chart.png}。
 *
 * <p>多條線時右側顯示圖例，並以分組欄位作為副標題。
 *
 * @see <a href="https://www.jfree.org/jfreechart/">JFreeChart</a>
 */
public class JFreeChartRenderer implements ChartRenderer {

    private static final Logger log = LoggerFactory.getLogger(JFreeChartRenderer.class);

    private final Path directory;
    private final int width;
    private final int height;

    public JFreeChartRenderer(OutputConfig output) {
        this.directory = output.chartPath();
        this.width = output.chartWidth();
        this.height = output.chartHeight();
    }

    @Override
    public Optional<Path> render(ChartProjection projection) {
        if (projection.isEmpty()) {
            log.warn("No data available to generate a chart for {}.", projection.metricName());
            return Optional.empty();
        }

        JFreeChart chart = createChart(projection);
        Path file = directory.resolve(fileName(projection.metricName()));
        try {
            Files.createDirectories(directory);
            ChartUtils.saveChartAsPNG(file.toFile(), chart, width, height);
        } catch (IOException e) {
            log.error("Failed to write chart for {} to {}: {}", projection.metricName(), file, e.getMessage(), e);
            return Optional.empty();
        }
        log.info("Chart saved to {}", file);
        return Optional.of(file);
    }

    JFreeChart createChart(ChartProjection projection) {
        TimeSeriesCollection dataset = new TimeSeriesCollection();
        for (ChartSeries series : projection.series()) {
            TimeSeries line = new TimeSeries(series.label(projection.valueColumn()));
            for (Map.Entry<LocalDate, Long> point : series.points().entrySet()) {
                LocalDate date = point.getKey();
                line.add(new Day(date.getDayOfMonth(), date.getMonthValue(), date.getYear()), point.getValue());
            }
            dataset.addSeries(line);
        }

        boolean legend = projection.series().size() > 1;
        JFreeChart chart = ChartFactory.createTimeSeriesChart(
            projection.title(),
            "Date",
            "Total " + projection.valueColumn(),
            dataset,
            legend,
            false,
            false);

        XYPlot plot = chart.getXYPlot();
        XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer(true, true);
        plot.setRenderer(renderer);
        plot.setDomainGridlinesVisible(true);
        plot.setRangeGridlinesVisible(true);

        if (legend) {
            LegendTitle legendTitle = chart.getLegend();
            legendTitle.setPosition(RectangleEdge.RIGHT);
            if (projection.isGrouped()) {
                chart.addSubtitle(new TextTitle(projection.groupLabel()));
            }
        }
        return chart;
    }

    static String fileName(String metricName) {
        return metricName + "_chart.png";
    }
}
