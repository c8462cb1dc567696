package io.github.samzhu.monitor.exception;

import java.util.Collection;

/**
 * 指標名稱不存在於目錄中。
 */
public class UnknownMetricException extends RuntimeException {

    private final String metricName;

    public UnknownMetricException(String metricName, Collection<String> knownNames) {
        super(String.format("Unknown metric '%s'. Available metrics: %s", metricName, knownNames));
        this.metricName = metricName;
    }

    public String getMetricName() {
        return metricName;
    }
}
