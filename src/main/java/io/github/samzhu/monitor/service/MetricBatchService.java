package io.github.samzhu.monitor.service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import io.github.samzhu.monitor.catalog.MetricDefinition;
import io.github.samzhu.monitor.config.MonitorProperties;
import io.github.samzhu.monitor.dto.BatchReport;
import io.github.samzhu.monitor.dto.BatchRequest;
import io.github.samzhu.monitor.dto.MetricQueryResult;
import io.github.samzhu.monitor.event.MetricQueryEvent;
import io.github.samzhu.monitor.event.MetricQueryEvent.Type;
import io.github.samzhu.monitor.table.NormalizedTable;

/**
 * 批次查詢服務。
 *
 * <p>依序查詢每個指標（不平行處理、不重試），單一指標的失敗或空結果不會中止批次。
 * 單一指標、全部指標與標準報表三種模式都經由 {@link #run(BatchRequest, Consumer)}。
 *
 * <p>身分過濾在正規化之後、輸出或繪圖之前套用：只保留 identity 欄位等於指定值的列；
 * 過濾後為空的指標改列為「沒有資料」。表格沒有 identity 欄位時不過濾。
 */
@Service
public class MetricBatchService {

    private final MetricQueryService queryService;
    private final ApplicationEventPublisher eventPublisher;
    private final String identityColumn;

    public MetricBatchService(
            MetricQueryService queryService,
            ApplicationEventPublisher eventPublisher,
            MonitorProperties properties) {
        this.queryService = queryService;
        this.eventPublisher = eventPublisher;
        this.identityColumn = properties.identityColumn();
    }

    public BatchReport run(BatchRequest request) {
        return run(request, result -> { });
    }

    /**
     * 執行批次查詢。
     *
     * @param request 批次請求
     * @param onResult 每個指標完成後立即呼叫，讓呼叫端逐一輸出
     * @return 所有指標的結果
     */
    public BatchReport run(BatchRequest request, Consumer<MetricQueryResult> onResult) {
        List<MetricQueryResult> results = new ArrayList<>(request.metrics().size());
        for (MetricDefinition definition : request.metrics()) {
            MetricQueryResult result = queryService.query(definition, request.window(), request.projectId());
            if (result.hasData() && request.hasIdentityFilter()) {
                result = applyIdentityFilter(result, definition, request);
            }
            results.add(result);
            onResult.accept(result);
        }
        return new BatchReport(results);
    }

    private MetricQueryResult applyIdentityFilter(MetricQueryResult result, MetricDefinition definition,
                                                  BatchRequest request) {
        NormalizedTable table = result.table();
        MetricQueryEvent event = MetricQueryEvent.of(Type.FILTER_SKIPPED, definition.name(),
            definition.metricType(), request.projectId(), request.window());
        if (!table.hasColumn(identityColumn)) {
            eventPublisher.publishEvent(event.withDetail(identityColumn).withRows(table.size()));
            return result;
        }

        NormalizedTable filtered = table.filter(identityColumn, request.identityFilter());
        String detail = identityColumn + " '" + request.identityFilter() + "'";
        eventPublisher.publishEvent(MetricQueryEvent.of(Type.FILTERED, definition.name(), definition.metricType(),
                request.projectId(), request.window())
            .withDetail(detail)
            .withRows(filtered.size(), table.size()));

        if (filtered.isEmpty()) {
            eventPublisher.publishEvent(MetricQueryEvent.of(Type.FILTERED_OUT, definition.name(),
                definition.metricType(), request.projectId(), request.window()).withDetail(detail));
            return MetricQueryResult.filteredOut(definition.name(), filtered, detail);
        }
        return MetricQueryResult.data(definition.name(), filtered);
    }
}
