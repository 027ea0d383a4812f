package com.racelisting.common.config;

import com.racelisting.common.catalog.ColumnCatalog;
import com.racelisting.common.catalog.JdbcMetadataColumnCatalog;
import com.racelisting.common.catalog.SqliteColumnCatalog;
import com.racelisting.common.query.OrderCompiler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Beans shared by the listing services.
 */
@Configuration
@EnableConfigurationProperties(ListingProperties.class)
@Slf4j
public class ListingConfig {

    @Bean
    public Clock listingClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ColumnCatalog columnCatalog(ListingDatabase database, ListingProperties properties) {
        log.info("Column catalog source: {}", properties.getCatalog().getSource());
        switch (properties.getCatalog().getSource()) {
            case JDBC_METADATA:
                return new JdbcMetadataColumnCatalog(database);
            case PRAGMA:
            default:
                return new SqliteColumnCatalog(database);
        }
    }

    /**
     * Order compiler for {@code table}, configured from listing.order.*.
     */
    public static OrderCompiler orderCompiler(ColumnCatalog catalog, String table, ListingProperties properties) {
        ListingProperties.Order order = properties.getOrder();
        return new OrderCompiler(catalog, table, order.getDefaultField(), order.getMissingFieldPolicy());
    }
}
