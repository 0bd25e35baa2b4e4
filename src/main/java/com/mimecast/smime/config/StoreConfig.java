package com.mimecast.smime.config;

import java.util.Map;

/**
 * Certificate store configuration.
 *
 * <p>This class provides type safe access to the JDBC connection and scan paging settings.
 */
public class StoreConfig extends ConfigFoundation {

    /**
     * Constructs a new StoreConfig instance.
     *
     * @param map Configuration map.
     */
    public StoreConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets JDBC URL.
     *
     * @return JDBC URL string.
     */
    public String getJdbcUrl() {
        return getStringProperty("jdbcUrl", "jdbc:postgresql://localhost:5432/smime");
    }

    /**
     * Gets database username.
     *
     * @return Username.
     */
    public String getUser() {
        return getStringProperty("user", "smime");
    }

    /**
     * Gets database password.
     *
     * @return Password.
     */
    public String getPassword() {
        return getStringProperty("password", "");
    }

    /**
     * Gets connection pool size.
     *
     * @return Maximum pool size (default: 8).
     */
    public int getMaximumPoolSize() {
        return Math.toIntExact(getLongProperty("maximumPoolSize", 8L));
    }

    /**
     * Gets number of certificates read per page when scanning the store.
     *
     * @return Batch size (default: 100).
     */
    public int getBatchSize() {
        return Math.toIntExact(getLongProperty("batchSize", 100L));
    }
}
