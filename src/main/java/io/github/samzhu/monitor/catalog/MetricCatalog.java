package io.github.samzhu.monitor.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.github.samzhu.monitor.config.MonitorProperties.MetricEntry;
import io.github.samzhu.monitor.exception.CatalogConfigurationException;
import io.github.samzhu.monitor.exception.UnknownMetricException;
import io.github.samzhu.monitor.table.NormalizedTable;

/**
 * 唯讀的指標目錄。
 *
 * <p>目錄內容為資料而非程式分支：每個指標的後端行為（值型別、分組 label、
 * aligner/reducer）都記錄在 {@link MetricDefinition} 中。建立時即完成所有驗證，
 * 任何錯誤都會以 {@link CatalogConfigurationException} 在啟動階段中止程序：
 * <ul>
 *   <li>名稱為空或重複</li>
 *   <li>metric type 為空</li>
 *   <li>value field、aligner 或 reducer 無法辨識</li>
 *   <li>metric label 為空或重複</li>
 *   <li>value name 與 {@code date}、資源 label 或 metric label 同名</li>
 * </ul>
 *
 * <p>迭代順序即宣告順序。
 */
public final class MetricCatalog {

    private final Map<String, MetricDefinition> definitions;

    public MetricCatalog(List<MetricDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new CatalogConfigurationException("<catalog>", "catalog contains no metrics");
        }
        Map<String, MetricDefinition> byName = new LinkedHashMap<>();
        for (MetricDefinition definition : definitions) {
            validate(definition);
            if (byName.putIfAbsent(definition.name(), definition) != null) {
                throw new CatalogConfigurationException(definition.name(), "duplicate metric name");
            }
        }
        this.definitions = Collections.unmodifiableMap(byName);
    }

    /**
     * 從組態項目建立目錄，解析 value field、aligner 與 reducer token。
     *
     * @param entries {@code monitor.catalog} 下的項目
     * @return 驗證完成的目錄
     * @throws CatalogConfigurationException 任一項目不合法時
     */
    public static MetricCatalog fromEntries(List<MetricEntry> entries) {
        List<MetricDefinition> definitions = new ArrayList<>();
        if (entries != null) {
            for (MetricEntry entry : entries) {
                definitions.add(toDefinition(entry));
            }
        }
        return new MetricCatalog(definitions);
    }

    private static MetricDefinition toDefinition(MetricEntry entry) {
        String name = entry.name();
        if (name == null || name.isBlank()) {
            throw new CatalogConfigurationException(String.valueOf(name), "name must not be empty");
        }
        ValueField valueField = ValueField.parse(entry.valueField())
            .orElseThrow(() -> new CatalogConfigurationException(name,
                "value-field '" + entry.valueField() + "' is not one of [int64, distribution]"));
        Aligner aligner = Aligner.parse(entry.aligner())
            .orElseThrow(() -> new CatalogConfigurationException(name,
                "unrecognized aligner '" + entry.aligner() + "'"));
        Reducer reducer = Reducer.parse(entry.reducer())
            .orElseThrow(() -> new CatalogConfigurationException(name,
                "unrecognized reducer '" + entry.reducer() + "'"));
        return new MetricDefinition(name, entry.metricType(), valueField, entry.valueName(),
            entry.metricLabels(), aligner, reducer);
    }

    private static void validate(MetricDefinition definition) {
        String name = definition.name();
        if (name == null || name.isBlank()) {
            throw new CatalogConfigurationException(String.valueOf(name), "name must not be empty");
        }
        if (definition.metricType() == null || definition.metricType().isBlank()) {
            throw new CatalogConfigurationException(name, "metric-type must not be empty");
        }
        if (definition.valueField() == null) {
            throw new CatalogConfigurationException(name, "value-field is required");
        }
        if (definition.aligner() == null || definition.reducer() == null) {
            throw new CatalogConfigurationException(name, "aligner and reducer are required");
        }
        String valueName = definition.valueName();
        if (valueName == null || valueName.isBlank()) {
            throw new CatalogConfigurationException(name, "value-name must not be empty");
        }

        Set<String> labels = new HashSet<>(ResourceLabels.ALL);
        labels.add(NormalizedTable.DATE_COLUMN);
        for (String label : definition.metricLabels()) {
            if (label == null || label.isBlank()) {
                throw new CatalogConfigurationException(name, "metric-labels must not contain empty names");
            }
            if (!labels.add(label)) {
                throw new CatalogConfigurationException(name,
                    "metric label '" + label + "' is duplicated or shadows a reserved column");
            }
        }
        if (labels.contains(valueName)) {
            throw new CatalogConfigurationException(name,
                "value-name '" + valueName + "' collides with a label column");
        }
    }

    /**
     * 依名稱查詢指標定義。
     *
     * @param name 指標名稱
     * @return 指標定義，不存在時為空
     */
    public Optional<MetricDefinition> lookup(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    /**
     * 依名稱取得指標定義，不存在時拋出例外。
     *
     * @throws UnknownMetricException 名稱不在目錄中
     */
    public MetricDefinition require(String name) {
        return lookup(name).orElseThrow(() -> new UnknownMetricException(name, names()));
    }

    /**
     * 依宣告順序回傳所有指標。
     */
    public List<MetricDefinition> all() {
        return List.copyOf(definitions.values());
    }

    public List<String> names() {
        return List.copyOf(definitions.keySet());
    }

    public int size() {
        return definitions.size();
    }
}
