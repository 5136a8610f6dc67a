package xyz.firestige.toolkit.spring.autoconfigure;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import xyz.firestige.toolkit.jobticker.JobTicker;
import xyz.firestige.toolkit.jobticker.JobTickerFactory;
import xyz.firestige.toolkit.metrics.CompositeTickerMetrics;
import xyz.firestige.toolkit.metrics.MicrometerTickerMetrics;
import xyz.firestige.toolkit.metrics.TickerMetrics;
import xyz.firestige.toolkit.metrics.TickerMetricsCollector;
import xyz.firestige.toolkit.metrics.TickerMetricsReporter;
import xyz.firestige.toolkit.spring.metric.TickerHealthIndicator;
import xyz.firestige.toolkit.ttlcounter.TtlCounter;

import java.util.ArrayList;
import java.util.List;

/**
 * JobTicker / TtlCounter 自动配置
 */
@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(JobTicker.class)
@ConditionalOnProperty(prefix = "toolkit", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ToolkitProperties.class)
public class ToolkitAutoConfiguration {

    /**
     * 指标收集器
     */
    @Bean
    @ConditionalOnMissingBean
    public TickerMetricsCollector tickerMetricsCollector() {
        return new TickerMetricsCollector();
    }

    /**
     * ticker 工厂，所有 ticker 的观测同时写入收集器与 Micrometer（如可用）
     */
    @Bean(destroyMethod = "stopAll")
    @ConditionalOnMissingBean
    public JobTickerFactory jobTickerFactory(
            ToolkitProperties properties,
            TickerMetricsCollector collector,
            ObjectProvider<MicrometerTickerMetrics> micrometerMetrics) {
        List<TickerMetrics> sinks = new ArrayList<>();
        sinks.add(collector);
        micrometerMetrics.orderedStream().forEach(sinks::add);
        return new JobTickerFactory(
            properties.getTicker().getStopTimeout(),
            new CompositeTickerMetrics(sinks)
        );
    }

    /**
     * TTL 计数器
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public TtlCounter ttlCounter(ToolkitProperties properties) {
        return new TtlCounter(
            properties.getCounter().getTtl(),
            properties.getCounter().getVacuumInterval()
        );
    }

    /**
     * 指标报告器
     */
    @Bean(destroyMethod = "stop")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "toolkit.metrics", name = "report-interval")
    public TickerMetricsReporter tickerMetricsReporter(
            TickerMetricsCollector collector,
            ToolkitProperties properties) {
        TickerMetricsReporter reporter = new TickerMetricsReporter(
            collector,
            properties.getMetrics().getReportInterval()
        );
        reporter.start();
        return reporter;
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    static class MicrometerMetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public MicrometerTickerMetrics micrometerTickerMetrics(MeterRegistry registry) {
            return new MicrometerTickerMetrics(registry);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
    static class HealthConfiguration {

        /**
         * 健康检查指示器
         */
        @Bean
        @ConditionalOnMissingBean
        public TickerHealthIndicator tickerHealthIndicator(
                JobTickerFactory factory,
                TickerMetricsCollector collector) {
            return new TickerHealthIndicator(factory, collector);
        }
    }
}
