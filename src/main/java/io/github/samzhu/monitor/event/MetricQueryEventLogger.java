package io.github.samzhu.monitor.event;

import java.time.ZoneId;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import io.github.samzhu.monitor.config.MonitorProperties;
import io.github.samzhu.monitor.util.PeriodUtils;

/**
 * 將 {@link MetricQueryEvent} 轉為日誌輸出。
 *
 * <p>同步處理，日誌順序與查詢順序一致。
 */
@Component
public class MetricQueryEventLogger {

    private static final Logger log = LoggerFactory.getLogger(MetricQueryEventLogger.class);

    private final ZoneId zone;

    public MetricQueryEventLogger(MonitorProperties properties) {
        this.zone = properties.zoneId();
    }

    @EventListener
    public void onMetricQueryEvent(MetricQueryEvent event) {
        switch (event.type()) {
            case STARTED -> log.info("Querying metric: {} from {}...", event.metricType(),
                PeriodUtils.formatPeriod(event.window().start(), event.window().end(), zone));
            case COMPLETED -> log.info("Metric {}: {} rows returned", event.metricName(), event.rowCount());
            case EMPTY -> log.warn("No data found for the specified period: metric={}", event.metricName());
            case FILTERED -> log.info("Filtered {} by {}. Kept {} of {} rows.",
                event.metricName(), event.detail(), event.rowCount(), event.totalRows());
            case FILTER_SKIPPED -> log.info("Metric {} has no column for {}, identity filter not applied",
                event.metricName(), event.detail());
            case FILTERED_OUT -> log.warn("No data remains for {} after filtering by {}",
                event.metricName(), event.detail());
            case AUTHORIZATION_FAILED -> {
                log.error("Permission denied for project '{}'. Check your authentication and IAM roles.",
                    event.projectId());
                log.error("Details: metric={}, {}", event.metricType(), event.detail());
            }
            case CALL_FAILED -> log.error("An API error occurred: metric={}, project={}, window={}, error={}",
                event.metricType(), event.projectId(),
                PeriodUtils.formatPeriod(event.window().start(), event.window().end(), zone), event.detail());
        }
    }
}
