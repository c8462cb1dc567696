package io.github.samzhu.monitor.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.github.samzhu.monitor.catalog.MetricCatalog;
import io.github.samzhu.monitor.chart.JFreeChartRenderer;
import io.github.samzhu.monitor.service.ResponseNormalizer;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link MonitorProperties} 的型別安全配置綁定，並建立依賴組態值的元件。
 * {@link MetricCatalog} 在 context 啟動時就建立，目錄設定錯誤會讓啟動直接失敗。
 *
 * @see MonitorProperties
 */
@Configuration
@EnableConfigurationProperties(MonitorProperties.class)
public class AppConfig {

    @Bean
    public MetricCatalog metricCatalog(MonitorProperties properties) {
        return MetricCatalog.fromEntries(properties.catalog());
    }

    @Bean
    public ResponseNormalizer responseNormalizer(MonitorProperties properties) {
        return new ResponseNormalizer(properties.zoneId());
    }

    @Bean
    public JFreeChartRenderer chartRenderer(MonitorProperties properties) {
        return new JFreeChartRenderer(properties.output());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
