package com.mimecast.smime.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Applies the bundled {@code smime_certificates} DDL.
 *
 * <p>Statements use {@code IF NOT EXISTS} so applying twice is harmless.
 */
public final class SchemaInitializer {
    private static final Logger log = LogManager.getLogger(SchemaInitializer.class);

    /**
     * Classpath location of the schema script.
     */
    public static final String SCHEMA_RESOURCE = "db/smime_certificates.sql";

    private SchemaInitializer() {
        // static utility
    }

    /**
     * Creates the certificate table and its indexes.
     *
     * @param dataSource DataSource instance.
     */
    public static void apply(DataSource dataSource) {
        String script = readScript();
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            for (String sql : script.split(";")) {
                if (!sql.isBlank()) {
                    stmt.execute(sql.trim());
                }
            }
            log.info("Applied schema {}", SCHEMA_RESOURCE);
        } catch (SQLException e) {
            log.error("Schema initialization failed: {}", e.getMessage());
            throw new IllegalStateException("Failed to apply S/MIME certificate schema", e);
        }
    }

    private static String readScript() {
        try (InputStream is = SchemaInitializer.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException("Missing schema resource: " + SCHEMA_RESOURCE);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read schema resource: " + SCHEMA_RESOURCE, e);
        }
    }
}
