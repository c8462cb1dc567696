package io.github.samzhu.monitor.service;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.samzhu.monitor.catalog.MetricDefinition;
import io.github.samzhu.monitor.catalog.ValueField;
import io.github.samzhu.monitor.dto.PointValue;
import io.github.samzhu.monitor.dto.RawPoint;
import io.github.samzhu.monitor.dto.RawSeries;
import io.github.samzhu.monitor.table.ColumnOrder;
import io.github.samzhu.monitor.table.NormalizedTable;
import io.github.samzhu.monitor.util.PeriodUtils;

/**
 * 將後端的巢狀 series/point 回應攤平成單一表格。
 *
 * <p>處理流程：
 * <ol>
 *   <li>每條 series 合併資源 label 與 metric label</li>
 *   <li>每個資料點以 bucket 結束時間換算日期（捨棄一天以內的精度）</li>
 *   <li>依 {@link ValueField} 取值：{@code int64} 直接取值，{@code distribution} 只取 count</li>
 *   <li>每個 (series, point) 產生一列</li>
 *   <li>欄位集合為回應中實際出現的 label 鍵聯集，排列規則見 {@link ColumnOrder}</li>
 *   <li>依 {@code date} 與所有 label 欄位穩定排序</li>
 * </ol>
 *
 * <p>沒有任何資料點時回傳空表格，不視為錯誤。
 */
public class ResponseNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ResponseNormalizer.class);

    private final ZoneId zone;

    public ResponseNormalizer(ZoneId zone) {
        this.zone = zone;
    }

    public NormalizedTable normalize(List<RawSeries> series, MetricDefinition definition) {
        String valueColumn = definition.valueName();
        Set<String> labelKeys = new LinkedHashSet<>();
        List<Map<String, Object>> records = new ArrayList<>();

        for (RawSeries s : series) {
            Map<String, String> labels = new HashMap<>(s.resourceLabels());
            labels.putAll(s.metricLabels());
            // date 與數值欄位保留給表格本身
            labels.remove(NormalizedTable.DATE_COLUMN);
            labels.remove(valueColumn);

            for (RawPoint point : s.points()) {
                Map<String, Object> row = new HashMap<>(labels);
                row.put(NormalizedTable.DATE_COLUMN, PeriodUtils.toBucketDate(point.endTime(), zone));
                row.put(valueColumn, extractValue(point.value(), definition.valueField()));
                records.add(row);
                labelKeys.addAll(labels.keySet());
            }
        }

        if (records.isEmpty()) {
            return NormalizedTable.empty(valueColumn);
        }

        List<String> labelColumns = ColumnOrder.labelColumns(labelKeys);
        log.debug("Normalized {} rows for metric {}: columns={}", records.size(), definition.name(), labelColumns);
        return NormalizedTable.of(labelColumns, valueColumn, records);
    }

    /**
     * 依值型別取出純量。
     *
     * @param value 資料點的值
     * @param field 指標定義要求的值型別
     * @return 取得的值；資料點型別與定義不符時為 null
     */
    public static Long extractValue(PointValue value, ValueField field) {
        if (value == null || value.kind() != field) {
            return null;
        }
        return switch (field) {
            case INT64 -> value.int64Value();
            case DISTRIBUTION -> value.distribution().count();
        };
    }
}
