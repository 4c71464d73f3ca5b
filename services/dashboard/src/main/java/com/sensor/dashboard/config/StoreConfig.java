package com.sensor.dashboard.config;

import com.sensor.common.aggregate.KpiAggregator;
import com.sensor.common.config.StoreProperties;
import com.sensor.common.store.SensorStore;
import com.sensor.common.store.SensorStoreFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@EnableConfigurationProperties(DashboardProperties.class)
public class StoreConfig {

    @Bean
    @Validated
    @ConfigurationProperties(prefix = "sensor.store")
    public StoreProperties storeProperties() {
        return new StoreProperties();
    }

    @Bean(destroyMethod = "close")
    public SensorStore sensorStore(StoreProperties properties) {
        return SensorStoreFactory.open(properties.toTarget(), properties.toSettings());
    }

    @Bean
    public KpiAggregator kpiAggregator() {
        return new KpiAggregator();
    }
}
