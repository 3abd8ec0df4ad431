package io.queueflow.jdbc.store;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcQueueStoresTest {

    @Test
    void allReturnsBuiltInStores() {
        List<AbstractJdbcQueueStore> stores = JdbcQueueStores.all();

        assertEquals(3, stores.size());
        assertTrue(stores.stream().anyMatch(s -> s.name().equals("mysql")));
        assertTrue(stores.stream().anyMatch(s -> s.name().equals("postgresql")));
        assertTrue(stores.stream().anyMatch(s -> s.name().equals("h2")));
    }

    @Test
    void getByNameIsCaseInsensitive() {
        assertEquals("mysql", JdbcQueueStores.get("MySQL").name());
        assertEquals("postgresql", JdbcQueueStores.get("POSTGRESQL").name());
        assertEquals("h2", JdbcQueueStores.get("h2").name());
    }

    @Test
    void getByNameThrowsForUnknown() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> JdbcQueueStores.get("oracle"));
        assertTrue(ex.getMessage().contains("Unknown queue store: oracle"));
    }

    @Test
    void detectFromJdbcUrl() {
        assertEquals("mysql", JdbcQueueStores.detect("jdbc:mysql://localhost:3306/app").name());
        assertEquals("mysql", JdbcQueueStores.detect("jdbc:tidb://localhost:4000/app").name());
        assertEquals("postgresql", JdbcQueueStores.detect("jdbc:postgresql://localhost:5432/app").name());
        assertEquals("h2", JdbcQueueStores.detect("JDBC:H2:mem:test").name());
    }

    @Test
    void detectFromJdbcUrlThrowsForUnknownOrEmpty() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> JdbcQueueStores.detect("jdbc:oracle:thin:@localhost:1521:xe"));
        assertTrue(ex.getMessage().contains("No queue store found"));
        assertThrows(IllegalArgumentException.class, () -> JdbcQueueStores.detect(""));
    }

    @Test
    void detectFromDataSource() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:detect;DB_CLOSE_DELAY=-1");
        assertEquals("h2", JdbcQueueStores.detect(ds).name());
    }

    @Test
    void withTablePrefixKeepsDialect() {
        AbstractJdbcQueueStore store = JdbcQueueStores.get("postgresql").withTablePrefix("jobs");
        assertInstanceOf(PostgresQueueStore.class, store);
        assertEquals("jobs", store.tablePrefix());
        assertEquals(AbstractJdbcQueueStore.DEFAULT_TABLE_PREFIX, JdbcQueueStores.get("postgresql").tablePrefix());
    }

    @Test
    void rejectsUnsafeTablePrefix() {
        assertThrows(IllegalArgumentException.class, () -> new H2QueueStore("jobs; DROP TABLE x"));
        assertThrows(IllegalArgumentException.class, () -> new MySqlQueueStore(""));
    }

    @Test
    void schemaResourceFollowsName() {
        assertEquals("schema/mysql.sql", new MySqlQueueStore().schemaResource());
        assertEquals("schema/h2.sql", new H2QueueStore().schemaResource());
    }
}
