package com.fastdispatch.autoconfig;

import com.baomidou.mybatisplus.extension.spring.MybatisSqlSessionFactoryBean;
import com.fastdispatch.core.spi.EventStore;
import com.fastdispatch.core.spi.PayloadSerializer;
import com.fastdispatch.core.store.MybatisEventStore;
import com.fastdispatch.mapper.AlertEventMapper;
import org.apache.ibatis.session.SqlSessionFactory;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * 有数据源时事件落库, 先于内存实现装配
 */
@AutoConfiguration(
        afterName = "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration",
        before = AlertDispatchAutoConfiguration.class)
@ConditionalOnClass({
        SqlSessionFactory.class,
        MybatisSqlSessionFactoryBean.class
})
@ConditionalOnBean(DataSource.class)
@MapperScan(basePackages = "com.fastdispatch.mapper")
public class EventStoreMybatisAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(EventStore.class)
    public EventStore mybatisEventStore(AlertEventMapper mapper, PayloadSerializer serializer) {
        return new MybatisEventStore(mapper, serializer);
    }
}
