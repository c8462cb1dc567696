package io.github.samzhu.monitor.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import io.github.samzhu.monitor.backend.TimeSeriesBackend;
import io.github.samzhu.monitor.catalog.Aligner;
import io.github.samzhu.monitor.catalog.MetricDefinition;
import io.github.samzhu.monitor.catalog.Reducer;
import io.github.samzhu.monitor.catalog.ValueField;
import io.github.samzhu.monitor.config.MonitorProperties;
import io.github.samzhu.monitor.dto.BatchReport;
import io.github.samzhu.monitor.dto.BatchRequest;
import io.github.samzhu.monitor.dto.MetricQueryResult;
import io.github.samzhu.monitor.dto.MetricQueryResult.Status;
import io.github.samzhu.monitor.dto.PointValue;
import io.github.samzhu.monitor.dto.QueryWindow;
import io.github.samzhu.monitor.dto.RawPoint;
import io.github.samzhu.monitor.dto.RawSeries;
import io.github.samzhu.monitor.event.MetricQueryEvent;
import io.github.samzhu.monitor.event.MetricQueryEvent.Type;
import io.github.samzhu.monitor.exception.BackendAuthorizationException;
import io.github.samzhu.monitor.exception.BackendCallException;

class MetricBatchServiceTest {

    private static final Instant DAY_1 = Instant.parse("2025-01-01T00:00:00Z");

    private final QueryWindow window = new QueryWindow(DAY_1, Instant.parse("2025-01-08T00:00:00Z"));

    private final MetricDefinition tokenCount = definition("token_count");
    private final MetricDefinition characterCount = definition("character_count");
    private final MetricDefinition invocationCount = definition("model_invocation_count");

    private List<MetricQueryEvent> events;
    private ApplicationEventPublisher publisher;

    @BeforeEach
    void setUp() {
        events = new ArrayList<>();
        publisher = event -> events.add((MetricQueryEvent) event);
    }

    @Test
    void shouldContinueAfterFailures() {
        // Given: 第一個指標授權失敗、第二個呼叫失敗、第三個有資料
        MetricBatchService service = serviceWith(query -> {
            if (query.filter().contains("token_count")) {
                throw new BackendAuthorizationException(query.scopeName(), query.filter(),
                    new IllegalStateException("denied"));
            }
            if (query.filter().contains("character_count")) {
                throw new BackendCallException(query.scopeName(), query.filter(),
                    new IllegalStateException("unavailable"));
            }
            return List.of(series("gemini-2.0-flash", 3));
        });
        BatchRequest request = new BatchRequest(List.of(tokenCount, characterCount, invocationCount),
            window, "my-project", null);

        // When
        BatchReport report = service.run(request);

        // Then
        assertThat(report.results()).extracting(MetricQueryResult::status)
            .containsExactly(Status.AUTHORIZATION_FAILED, Status.CALL_FAILED, Status.DATA);
        assertThat(report.metricsWithData()).containsExactly("model_invocation_count");
        assertThat(report.metricsWithoutData()).containsExactly("token_count", "character_count");
    }

    @Test
    void shouldNotifyConsumerInProcessingOrder() {
        // Given
        MetricBatchService service = serviceWith(query -> List.of());
        List<String> seen = new ArrayList<>();
        BatchRequest request = new BatchRequest(List.of(invocationCount, tokenCount), window, "my-project", null);

        // When
        service.run(request, result -> seen.add(result.metricName()));

        // Then
        assertThat(seen).containsExactly("model_invocation_count", "token_count");
    }

    @Test
    void shouldKeepOnlyMatchingIdentityRows() {
        // Given
        MetricBatchService service = serviceWith(query ->
            List.of(series("gemini-2.0-flash", 3), series("gemini-1.5-pro", 4)));
        BatchRequest request = new BatchRequest(List.of(tokenCount), window, "my-project", "gemini-1.5-pro");

        // When
        BatchReport report = service.run(request);

        // Then
        MetricQueryResult result = report.results().get(0);
        assertThat(result.status()).isEqualTo(Status.DATA);
        assertThat(result.table().rows()).singleElement()
            .satisfies(row -> assertThat(row.label("model_user_id")).isEqualTo("gemini-1.5-pro"));
        assertThat(events).filteredOn(event -> event.type() == Type.FILTERED).singleElement()
            .satisfies(event -> {
                assertThat(event.rowCount()).isEqualTo(1);
                assertThat(event.totalRows()).isEqualTo(2);
            });
    }

    @Test
    void shouldReclassifyAsNoDataWhenFilterRemovesAllRows() {
        // Given: 過濾前有資料
        MetricBatchService service = serviceWith(query -> List.of(series("gemini-2.0-flash", 3)));
        BatchRequest request = new BatchRequest(List.of(tokenCount), window, "my-project", "claude-3-haiku");

        // When
        BatchReport report = service.run(request);

        // Then
        MetricQueryResult result = report.results().get(0);
        assertThat(result.status()).isEqualTo(Status.FILTERED_OUT);
        assertThat(result.hasData()).isFalse();
        assertThat(result.table().isEmpty()).isTrue();
        assertThat(report.metricsWithoutData()).containsExactly("token_count");
        assertThat(events).extracting(MetricQueryEvent::type).contains(Type.FILTERED, Type.FILTERED_OUT);
    }

    @Test
    void shouldSkipFilterWhenIdentityColumnMissing() {
        // Given: 回應沒有 model_user_id label
        MetricBatchService service = serviceWith(query -> List.of(new RawSeries(
            Map.of("location", "us-central1"), Map.of(), List.of(new RawPoint(DAY_1, PointValue.ofInt64(5))))));
        BatchRequest request = new BatchRequest(List.of(tokenCount), window, "my-project", "gemini-1.5-pro");

        // When
        BatchReport report = service.run(request);

        // Then
        assertThat(report.results().get(0).status()).isEqualTo(Status.DATA);
        assertThat(report.results().get(0).table().size()).isEqualTo(1);
        assertThat(events).extracting(MetricQueryEvent::type).contains(Type.FILTER_SKIPPED)
            .doesNotContain(Type.FILTERED);
    }

    private MetricBatchService serviceWith(TimeSeriesBackend backend) {
        MetricQueryService queryService = new MetricQueryService(backend, new QueryTranslator(),
            new ResponseNormalizer(ZoneOffset.UTC), publisher);
        MonitorProperties properties = new MonitorProperties("my-project", null, null, null, null, null, null);
        return new MetricBatchService(queryService, publisher, properties);
    }

    private static RawSeries series(String modelUserId, long value) {
        return new RawSeries(Map.of("location", "us-central1", "model_user_id", modelUserId), Map.of(),
            List.of(new RawPoint(DAY_1, PointValue.ofInt64(value))));
    }

    private static MetricDefinition definition(String name) {
        return new MetricDefinition(name, "aiplatform.googleapis.com/publisher/online_serving/" + name,
            ValueField.INT64, name, List.of(), Aligner.ALIGN_DELTA, Reducer.REDUCE_SUM);
    }
}
