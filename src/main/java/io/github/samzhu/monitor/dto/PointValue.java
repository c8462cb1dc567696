package io.github.samzhu.monitor.dto;

import io.github.samzhu.monitor.catalog.ValueField;

/**
 * 資料點的值，後端只會填入其中一種型別。
 *
 * @param kind 實際填入的型別，後端回傳其他型別（如 double）時為 null
 * @param int64Value 整數值
 * @param distribution distribution 摘要
 */
public record PointValue(
    ValueField kind,
    long int64Value,
    DistributionSummary distribution
) {
    public static PointValue ofInt64(long value) {
        return new PointValue(ValueField.INT64, value, null);
    }

    public static PointValue ofDistribution(long count, double mean) {
        return new PointValue(ValueField.DISTRIBUTION, 0L, new DistributionSummary(count, mean));
    }

    public static PointValue unsupported() {
        return new PointValue(null, 0L, null);
    }

    /**
     * Distribution 值的摘要。只有 {@code count} 會進入輸出表格。
     *
     * @param count 落在此 bucket 的樣本數
     * @param mean 樣本平均
     */
    public record DistributionSummary(
        long count,
        double mean
    ) {}
}
