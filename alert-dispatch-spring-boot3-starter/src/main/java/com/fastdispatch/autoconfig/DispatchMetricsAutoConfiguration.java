package com.fastdispatch.autoconfig;

import com.fastdispatch.core.metric.DispatchMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
public class DispatchMetricsAutoConfiguration {

    /**
     * 指标注册到宿主的 MeterRegistry (多个时为 Boot 的主 CompositeMeterRegistry)
     * 未接入监控时退回进程内 SimpleMeterRegistry, 计数依然可读
     */
    @Bean
    public DispatchMetrics dispatchMetrics(ObjectProvider<MeterRegistry> registry) {
        return DispatchMetrics.create(registry.getIfAvailable(SimpleMeterRegistry::new));
    }
}
