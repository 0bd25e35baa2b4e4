package com.mimecast.smime.db;

import com.mimecast.smime.config.StoreConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * SharedDataSource provides a lazily-initialized HikariDataSource singleton based on
 * the <code>store</code> section of the configuration.
 *
 * <p>Usage: call SharedDataSource.getDataSource(config) to obtain the shared HikariDataSource.
 * Call SharedDataSource.close() on shutdown to release resources.
 */
public final class SharedDataSource {
    private static final Logger log = LogManager.getLogger(SharedDataSource.class);
    private static volatile HikariDataSource ds;

    private SharedDataSource() {
        // static utility
    }

    public static synchronized HikariDataSource getDataSource(StoreConfig store) {
        if (ds == null) {
            try {
                HikariConfig cfg = new HikariConfig();
                cfg.setJdbcUrl(store.getJdbcUrl());
                cfg.setUsername(store.getUser());
                cfg.setPassword(store.getPassword());
                cfg.setMaximumPoolSize(store.getMaximumPoolSize());
                cfg.setPoolName("SmimeSharedPool");

                ds = new HikariDataSource(cfg);
                log.info("Initialized shared HikariDataSource for certificate store: {}", store.getJdbcUrl());
            } catch (Exception e) {
                log.error("Failed to initialize shared datasource: {}", e.getMessage());
                throw e;
            }
        }
        return ds;
    }

    public static synchronized void close() {
        if (ds != null) {
            try {
                ds.close();
                log.info("Closed shared HikariDataSource");
            } catch (Exception e) {
                log.warn("Error closing shared DataSource: {}", e.getMessage());
            } finally {
                ds = null;
            }
        }
    }
}
