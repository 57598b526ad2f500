package com.lineage.core.persistence;

import com.lineage.core.metrics.LineageMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Spring {@link Configuration} for the durable timeline store.
 * <p>
 * The store is initialized on startup: tables are created and pending
 * migrations run before any other bean can read or write history.
 */
@Configuration
@EnableConfigurationProperties(StorageProperties.class)
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DurableTimelineStore durableTimelineStore(DataSource dataSource,
                                                     StorageProperties properties,
                                                     Clock clock,
                                                     @Autowired(required = false) LineageMetrics metrics) {
        log.info("Configuring durable timeline store (table prefix '{}', storage limit {})",
                properties.getTablePrefix(), properties.getStorageLimit());
        var store = new DurableTimelineStore(dataSource, properties, clock, metrics);
        store.initialize();
        return store;
    }
}
