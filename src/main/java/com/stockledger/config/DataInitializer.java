package com.stockledger.config;

import com.stockledger.persistence.StoreDatabase;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

@Configuration
public class DataInitializer {

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(DataInitializer.class);

    // Runs before the shell so the tables exist when the menu comes up
    @Bean
    @Order(0)
    CommandLineRunner init(StoreDatabase storeDatabase) {
        return args -> {
            if (!storeDatabase.initialize()) {
                logger.warn("Database schema could not be prepared; continuing in degraded mode");
            }
        };
    }
}
