package io.github.samzhu.monitor.chart;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.github.samzhu.monitor.catalog.Aligner;
import io.github.samzhu.monitor.catalog.MetricDefinition;
import io.github.samzhu.monitor.catalog.Reducer;
import io.github.samzhu.monitor.catalog.ValueField;
import io.github.samzhu.monitor.dto.PointValue;
import io.github.samzhu.monitor.dto.RawPoint;
import io.github.samzhu.monitor.dto.RawSeries;
import io.github.samzhu.monitor.service.ResponseNormalizer;
import io.github.samzhu.monitor.table.NormalizedTable;

class ChartProjectorTest {

    private static final Instant DAY_1 = Instant.parse("2025-01-01T00:00:00Z");
    private static final Instant DAY_2 = Instant.parse("2025-01-02T00:00:00Z");

    private final ChartProjector projector = new ChartProjector();

    private final MetricDefinition tokenCount = new MetricDefinition("token_count", "example.com/token_count",
        ValueField.INT64, "token_count", List.of("type"), Aligner.ALIGN_DELTA, Reducer.REDUCE_SUM);

    private final NormalizedTable table = new ResponseNormalizer(ZoneOffset.UTC).normalize(List.of(
        series("us-central1", "input", point(DAY_1, 10), point(DAY_2, 20)),
        series("us-central1", "output", point(DAY_1, 1)),
        series("europe-west4", "input", point(DAY_1, 5))), tokenCount);

    @Test
    void shouldAggregateByDateWithoutGrouping() {
        // When
        ChartProjection projection = projector.project(table, "token_count", "token_count", List.of());

        // Then
        assertThat(projection.isGrouped()).isFalse();
        assertThat(projection.title()).isEqualTo("Daily token_count Over Time");
        assertThat(projection.series()).singleElement().satisfies(series ->
            assertThat(series.points()).containsExactly(
                Map.entry(LocalDate.of(2025, 1, 1), 16L),
                Map.entry(LocalDate.of(2025, 1, 2), 20L)));
    }

    @Test
    void shouldPivotBySingleColumn() {
        // When
        ChartProjection projection = projector.project(table, "token_count", "token_count", List.of("type"));

        // Then
        assertThat(projection.title()).isEqualTo("Daily token_count Over Time by type");
        assertThat(projection.series()).extracting(ChartSeries::key)
            .containsExactly(List.of("input"), List.of("output"));
        assertThat(projection.series().get(0).points()).containsExactly(
            Map.entry(LocalDate.of(2025, 1, 1), 15L),
            Map.entry(LocalDate.of(2025, 1, 2), 20L));
    }

    @Test
    void shouldUseTupleKeysForMultipleColumns() {
        // When
        ChartProjection projection = projector.project(table, "token_count", "token_count",
            List.of("location", "type"));

        // Then
        assertThat(projection.groupLabel()).isEqualTo("location & type");
        assertThat(projection.series()).extracting(series -> series.label("token_count"))
            .containsExactly("europe-west4, input", "us-central1, input", "us-central1, output");
    }

    @Test
    void shouldFallBackToAggregateForMissingGroupColumn() {
        // When
        ChartProjection withMissing = projector.project(table, "token_count", "token_count",
            List.of("latency_type"));
        ChartProjection aggregate = projector.project(table, "token_count", "token_count", List.of());

        // Then
        assertThat(withMissing).isEqualTo(aggregate);
    }

    @Test
    void shouldIgnoreOnlyTheMissingColumns() {
        ChartProjection projection = projector.project(table, "token_count", "token_count",
            List.of("latency_type", " type "));

        assertThat(projection.groupColumns()).containsExactly("type");
        assertThat(projection.series()).hasSize(2);
    }

    @Test
    void shouldGroupAbsentLabelsUnderOwnKey() {
        // Given: 一條 series 沒有 type label
        NormalizedTable partial = new ResponseNormalizer(ZoneOffset.UTC).normalize(List.of(
            series("us-central1", "input", point(DAY_1, 2)),
            new RawSeries(Map.of("location", "us-central1"), Map.of(), List.of(point(DAY_1, 7)))), tokenCount);

        // When
        ChartProjection projection = projector.project(partial, "token_count", "token_count", List.of("type"));

        // Then
        assertThat(projection.series()).extracting(ChartSeries::key)
            .containsExactlyInAnyOrder(List.of("input"), List.of(ChartProjector.ABSENT_KEY));
    }

    @Test
    void shouldReturnEmptyProjectionForEmptyTable() {
        ChartProjection projection = projector.project(NormalizedTable.empty("token_count"),
            "token_count", "token_count", List.of("type"));

        assertThat(projection.isEmpty()).isTrue();
    }

    private static RawSeries series(String location, String type, RawPoint... points) {
        return new RawSeries(Map.of("location", location), Map.of("type", type), List.of(points));
    }

    private static RawPoint point(Instant endTime, long value) {
        return new RawPoint(endTime, PointValue.ofInt64(value));
    }
}
