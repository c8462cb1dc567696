package io.github.samzhu.monitor.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * 時間窗與日期換算工具類。
 *
 * <p>後端以一天為對齊區間，資料點的時間戳記為 bucket 的結束時間。
 * 日期一律以呼叫端指定的時區換算，捨棄一天以內的精度。
 */
public final class PeriodUtils {

    private PeriodUtils() {
        // 工具類不允許實例化
    }

    /**
     * 取得相對於現在 N 天前的時間點。
     *
     * @param clock 時鐘
     * @param days 天數，0 表示現在
     * @return 時間點
     */
    public static Instant daysAgo(Clock clock, int days) {
        return clock.instant().minus(Duration.ofDays(days));
    }

    /**
     * 將 bucket 結束時間換算為日曆日期。
     *
     * @param bucketEnd bucket 結束時間
     * @param zone 時區
     * @return 日期
     */
    public static LocalDate toBucketDate(Instant bucketEnd, ZoneId zone) {
        return LocalDate.ofInstant(bucketEnd, zone);
    }

    /**
     * 取得時間窗的格式化字串。
     *
     * @param start 起點
     * @param end 終點
     * @param zone 時區
     * @return 格式如 "2025-07-01 to 2025-09-29"
     */
    public static String formatPeriod(Instant start, Instant end, ZoneId zone) {
        return toBucketDate(start, zone) + " to " + toBucketDate(end, zone);
    }
}
