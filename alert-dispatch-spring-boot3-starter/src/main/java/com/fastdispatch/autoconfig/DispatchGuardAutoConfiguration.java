package com.fastdispatch.autoconfig;

import com.fastdispatch.config.DispatchGuardProperties;
import com.fastdispatch.core.handler.GuardedNotifierExecutor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties({
        DispatchGuardProperties.class
})
public class DispatchGuardAutoConfiguration {

    /**
     * 通知渠道统一保护入口
     */
    @Bean
    @ConditionalOnMissingBean
    public GuardedNotifierExecutor guard(DispatchGuardProperties props) {
        return new GuardedNotifierExecutor(props);
    }
}
