package io.github.samzhu.monitor.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import io.github.samzhu.monitor.catalog.MetricDefinition;
import io.github.samzhu.monitor.catalog.ResourceLabels;
import io.github.samzhu.monitor.dto.QueryWindow;
import io.github.samzhu.monitor.dto.TimeSeriesQuery;

/**
 * 將指標定義與時間窗轉為時間序列查詢描述。
 *
 * <p>後端只會回傳 group-by 清單中明列的 label，未列出的 label 會被直接丟棄，
 * 因此分組欄位固定包含五個資源維度，再加上指標自身的 metric label：
 * <pre>
 * resource.label.project_id, resource.label.location, resource.label.publisher,
 * resource.label.model_user_id, resource.label.model_version_id,
 * metric.label.&lt;label&gt; ...
 * </pre>
 *
 * <p>定義已在目錄載入時驗證過，轉換本身不會失敗。
 */
@Component
public class QueryTranslator {

    /** 對齊區間固定為一天。 */
    public static final Duration ALIGNMENT_PERIOD = Duration.ofDays(1);

    static final String RESOURCE_LABEL_PREFIX = "resource.label.";
    static final String METRIC_LABEL_PREFIX = "metric.label.";

    public TimeSeriesQuery translate(MetricDefinition definition, QueryWindow window, String projectId) {
        List<String> groupByFields = new ArrayList<>();
        for (String label : ResourceLabels.ALL) {
            groupByFields.add(RESOURCE_LABEL_PREFIX + label);
        }
        for (String label : definition.metricLabels()) {
            groupByFields.add(METRIC_LABEL_PREFIX + label);
        }

        return new TimeSeriesQuery(
            "projects/" + projectId,
            String.format("metric.type = \"%s\"", definition.metricType()),
            window,
            ALIGNMENT_PERIOD,
            definition.aligner(),
            definition.reducer(),
            groupByFields
        );
    }
}
