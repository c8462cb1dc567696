package io.github.samzhu.monitor.service;

import java.util.List;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import io.github.samzhu.monitor.backend.TimeSeriesBackend;
import io.github.samzhu.monitor.catalog.MetricDefinition;
import io.github.samzhu.monitor.dto.MetricQueryResult;
import io.github.samzhu.monitor.dto.MetricQueryResult.Status;
import io.github.samzhu.monitor.dto.QueryWindow;
import io.github.samzhu.monitor.dto.RawSeries;
import io.github.samzhu.monitor.dto.TimeSeriesQuery;
import io.github.samzhu.monitor.event.MetricQueryEvent;
import io.github.samzhu.monitor.event.MetricQueryEvent.Type;
import io.github.samzhu.monitor.exception.BackendAuthorizationException;
import io.github.samzhu.monitor.exception.BackendCallException;
import io.github.samzhu.monitor.table.NormalizedTable;

/**
 * 單一指標查詢服務：轉換查詢、呼叫後端、正規化回應。
 *
 * <p>授權失敗與呼叫失敗都在這一層攔截，轉為帶有 {@link Status} 的空結果，
 * 不會往上拋出；過程中的狀態以 {@link MetricQueryEvent} 發布。
 */
@Service
public class MetricQueryService {

    private final TimeSeriesBackend backend;
    private final QueryTranslator translator;
    private final ResponseNormalizer normalizer;
    private final ApplicationEventPublisher eventPublisher;

    public MetricQueryService(
            TimeSeriesBackend backend,
            QueryTranslator translator,
            ResponseNormalizer normalizer,
            ApplicationEventPublisher eventPublisher) {
        this.backend = backend;
        this.translator = translator;
        this.normalizer = normalizer;
        this.eventPublisher = eventPublisher;
    }

    /**
     * 查詢單一指標。
     *
     * @param definition 指標定義
     * @param window 時間窗
     * @param projectId GCP 專案
     * @return 查詢結果，不會是 null
     */
    public MetricQueryResult query(MetricDefinition definition, QueryWindow window, String projectId) {
        TimeSeriesQuery query = translator.translate(definition, window, projectId);
        MetricQueryEvent event = MetricQueryEvent.of(Type.STARTED, definition.name(),
            definition.metricType(), projectId, window);
        eventPublisher.publishEvent(event);

        List<RawSeries> series;
        try {
            series = backend.listTimeSeries(query);
        } catch (BackendAuthorizationException e) {
            eventPublisher.publishEvent(retype(event, Type.AUTHORIZATION_FAILED).withDetail(e.getMessage()));
            return MetricQueryResult.failed(definition.name(), Status.AUTHORIZATION_FAILED,
                definition.valueName(), e.getMessage());
        } catch (BackendCallException e) {
            eventPublisher.publishEvent(retype(event, Type.CALL_FAILED).withDetail(e.getMessage()));
            return MetricQueryResult.failed(definition.name(), Status.CALL_FAILED,
                definition.valueName(), e.getMessage());
        }

        NormalizedTable table = normalizer.normalize(series, definition);
        if (table.isEmpty()) {
            eventPublisher.publishEvent(retype(event, Type.EMPTY));
            return MetricQueryResult.empty(definition.name(), definition.valueName());
        }

        eventPublisher.publishEvent(retype(event, Type.COMPLETED).withRows(table.size()));
        return MetricQueryResult.data(definition.name(), table);
    }

    private static MetricQueryEvent retype(MetricQueryEvent event, Type type) {
        return MetricQueryEvent.of(type, event.metricName(), event.metricType(), event.projectId(), event.window());
    }
}
