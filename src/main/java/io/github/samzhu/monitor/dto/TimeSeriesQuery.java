package io.github.samzhu.monitor.dto;

import java.time.Duration;
import java.util.List;

import io.github.samzhu.monitor.catalog.Aligner;
import io.github.samzhu.monitor.catalog.Reducer;

/**
 * 與後端無關的時間序列查詢描述。
 *
 * @param scopeName 查詢範圍，格式 {@code projects/<project-id>}
 * @param filter 過濾條件，格式 {@code metric.type = "<metric_type>"}
 * @param window 時間窗
 * @param alignmentPeriod 對齊區間，固定一天
 * @param aligner 單一 series 對齊方式
 * @param reducer 跨 series 合併方式
 * @param groupByFields 分組欄位：五個資源 label 加上指標自身的 metric label
 */
public record TimeSeriesQuery(
    String scopeName,
    String filter,
    QueryWindow window,
    Duration alignmentPeriod,
    Aligner aligner,
    Reducer reducer,
    List<String> groupByFields
) {
    public TimeSeriesQuery {
        groupByFields = List.copyOf(groupByFields);
    }
}
