package io.github.samzhu.monitor.dto;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

import io.github.samzhu.monitor.exception.InvalidQueryWindowException;
import io.github.samzhu.monitor.util.PeriodUtils;

/**
 * 查詢時間窗。
 *
 * <p>{@code start} 必須嚴格早於 {@code end}；長度為零或顛倒的時間窗視為使用錯誤，
 * 而不是「沒有資料」。時間窗不需對齊 bucket 邊界，由後端自行截斷。
 *
 * @param start 起點（含）
 * @param end 終點
 */
public record QueryWindow(
    Instant start,
    Instant end
) {
    public QueryWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new InvalidQueryWindowException(
                String.format("Query window start %s must be before end %s", start, end));
        }
    }

    /**
     * 以「幾天前」建立時間窗。
     *
     * @param startDaysAgo 起點天數，必須大於 {@code endDaysAgo}
     * @param endDaysAgo 終點天數，0 表示現在，不可為負
     * @param clock 時鐘
     * @return 時間窗
     * @throws InvalidQueryWindowException 當 {@code startDaysAgo > endDaysAgo >= 0} 不成立
     */
    public static QueryWindow ofDaysAgo(int startDaysAgo, int endDaysAgo, Clock clock) {
        if (endDaysAgo < 0) {
            throw new InvalidQueryWindowException(
                "days-ago-end must be >= 0, got " + endDaysAgo);
        }
        if (startDaysAgo <= endDaysAgo) {
            throw new InvalidQueryWindowException(String.format(
                "days-ago-start (%d) must be greater than days-ago-end (%d)", startDaysAgo, endDaysAgo));
        }
        return new QueryWindow(PeriodUtils.daysAgo(clock, startDaysAgo), PeriodUtils.daysAgo(clock, endDaysAgo));
    }
}
