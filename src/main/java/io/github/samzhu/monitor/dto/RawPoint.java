package io.github.samzhu.monitor.dto;

import java.time.Instant;

/**
 * 後端回傳的單一資料點。
 *
 * @param endTime 所屬對齊 bucket 的結束時間
 * @param value 資料點的值
 */
public record RawPoint(
    Instant endTime,
    PointValue value
) {}
