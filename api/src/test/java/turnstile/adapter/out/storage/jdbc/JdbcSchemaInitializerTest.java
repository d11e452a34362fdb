package turnstile.adapter.out.storage.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.sql.Connection;
import java.sql.ResultSet;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JdbcSchemaInitializer")
class JdbcSchemaInitializerTest {

    @Test
    @DisplayName("should create the table and its indexes")
    void shouldCreateTableAndIndexes() throws Exception {
        var dataSource = JdbcTokenStoreContractTest.newDataSource();

        int executed = new JdbcSchemaInitializer(dataSource, "tokens_cache").createTable();

        assertEquals(3, executed);
        try (Connection connection = dataSource.getConnection();
                ResultSet rs = connection.getMetaData().getTables(null, null, "TOKENS_CACHE", null)) {
            assertTrue(rs.next());
        }
    }

    @Test
    @DisplayName("should be safe to run repeatedly")
    void shouldBeIdempotent() throws Exception {
        var dataSource = JdbcTokenStoreContractTest.newDataSource();
        var initializer = new JdbcSchemaInitializer(dataSource, "tokens_cache");

        initializer.createTable();

        assertEquals(3, initializer.createTable());
    }
}
