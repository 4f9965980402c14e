package com.stockledger.persistence;

import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.util.List;
import java.util.Optional;

/**
 * Raw statement access to the inventory database.
 * <p>
 * Every method reports failure through its return value: backend errors are
 * logged and turned into {@code false}, an empty list or an empty optional.
 * Statements always take {@code ?} placeholders; callers never splice input
 * into the SQL text.
 */
@Component
public class StoreDatabase {

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(StoreDatabase.class);

    static final String SCHEMA_SCRIPT = "db/schema.sql";

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;

    public StoreDatabase(DataSource dataSource, JdbcTemplate jdbcTemplate) {
        this.dataSource = dataSource;
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Checks the connection and creates the four inventory tables if they do
     * not exist yet. Safe to call repeatedly.
     *
     * @return whether the schema is ready
     */
    public boolean initialize() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_SCRIPT));
            populator.execute(dataSource);
            logger.info("Inventory schema ready (products, customers, purchases, purchase_items)");
            return true;
        } catch (DataAccessException e) {
            logger.error("Error preparing inventory database: {}", e.getMessage(), e);
            return false;
        }
    }

    public boolean execute(String sql, Object... params) {
        try {
            jdbcTemplate.update(sql, params);
            return true;
        } catch (DataAccessException e) {
            logger.error("Error executing statement: {}", e.getMessage());
            return false;
        }
    }

    public <T> List<T> fetchAll(String sql, RowMapper<T> rowMapper, Object... params) {
        try {
            return jdbcTemplate.query(sql, rowMapper, params);
        } catch (DataAccessException e) {
            logger.error("Error fetching data: {}", e.getMessage());
            return List.of();
        }
    }

    public <T> Optional<T> fetchOne(String sql, RowMapper<T> rowMapper, Object... params) {
        return fetchAll(sql, rowMapper, params).stream().findFirst();
    }
}
