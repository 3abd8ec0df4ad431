package io.queueflow.jdbc;

import io.queueflow.jdbc.store.AbstractJdbcQueueStore;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the queue tables from the DDL bundled for a store's dialect.
 *
 * <p>The bundled scripts use the default {@code queueflow} prefix; it is replaced
 * with the store's prefix. All statements are {@code CREATE ... IF NOT EXISTS}, so
 * running the initializer against an existing schema is harmless.
 */
public final class SchemaInitializer {
    private static final Logger logger = Logger.getLogger(SchemaInitializer.class.getName());

    private SchemaInitializer() {
    }

    /**
     * Executes the DDL for {@code store} on {@code dataSource}.
     *
     * @throws QueueStoreException if the script is missing or a statement fails
     */
    public static void initialize(DataSource dataSource, AbstractJdbcQueueStore store) {
        Objects.requireNonNull(dataSource, "dataSource");
        Objects.requireNonNull(store, "store");
        List<String> statements = statements(store);
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        } catch (SQLException e) {
            throw new QueueStoreException("Failed to create queue tables for " + store.name(), e);
        }
        logger.log(Level.INFO, "Queue tables {0}_job and {0}_recurring ready", store.tablePrefix());
    }

    static List<String> statements(AbstractJdbcQueueStore store) {
        String script = read(store.schemaResource())
                .replace(AbstractJdbcQueueStore.DEFAULT_TABLE_PREFIX + "_", store.tablePrefix() + "_");
        List<String> statements = new ArrayList<>();
        for (String part : script.split(";")) {
            String sql = part.trim();
            if (!sql.isEmpty()) {
                statements.add(sql);
            }
        }
        return statements;
    }

    private static String read(String resource) {
        try (InputStream in = SchemaInitializer.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new QueueStoreException("Schema resource not found: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new QueueStoreException("Failed to read schema resource " + resource, e);
        }
    }
}
