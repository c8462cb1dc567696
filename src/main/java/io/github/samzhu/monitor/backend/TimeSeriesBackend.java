package io.github.samzhu.monitor.backend;

import java.util.List;

import io.github.samzhu.monitor.dto.RawSeries;
import io.github.samzhu.monitor.dto.TimeSeriesQuery;
import io.github.samzhu.monitor.exception.BackendAuthorizationException;
import io.github.samzhu.monitor.exception.BackendCallException;

/**
 * 時間序列後端的 list-time-series 呼叫。
 */
@FunctionalInterface
public interface TimeSeriesBackend {

    /**
     * 執行查詢並回傳所有 series（已處理分頁）。
     *
     * @param query 查詢描述
     * @return 依後端順序排列的 series，沒有符合者時為空清單
     * @throws BackendAuthorizationException 沒有 scope 的查詢權限
     * @throws BackendCallException 其他呼叫失敗
     */
    List<RawSeries> listTimeSeries(TimeSeriesQuery query);
}
