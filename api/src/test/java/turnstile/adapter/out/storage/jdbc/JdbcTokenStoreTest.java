package turnstile.adapter.out.storage.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;

import javax.sql.DataSource;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import turnstile.core.model.token.TokenRecord;
import turnstile.core.port.out.TokenConflictException;
import turnstile.core.port.out.TokenStoreException;

@DisplayName("JdbcTokenStore")
class JdbcTokenStoreTest {

    @Nested
    @DisplayName("Table name validation")
    class TableNameTests {

        @ParameterizedTest
        @ValueSource(strings = {"tokens_cache", "auth.tokens_cache", "T1"})
        @DisplayName("should accept plain and schema-qualified names")
        void shouldAcceptValidNames(String table) {
            new JdbcTokenStore(mock(DataSource.class), new ObjectMapper(), table);
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "1tokens", "tokens; DROP TABLE x", "a.b.c", "tokens-cache"})
        @DisplayName("should reject names that are not plain identifiers")
        void shouldRejectInvalidNames(String table) {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new JdbcTokenStore(mock(DataSource.class), new ObjectMapper(), table));
        }
    }

    @Nested
    @DisplayName("Schema-qualified table")
    class SchemaQualifiedTests {

        @Test
        @DisplayName("should create and use a table in a named schema")
        void shouldUseSchemaQualifiedTable() throws Exception {
            JdbcDataSource dataSource = JdbcTokenStoreContractTest.newDataSource();
            try (Connection connection = dataSource.getConnection()) {
                connection.createStatement().execute("CREATE SCHEMA auth");
            }
            new JdbcSchemaInitializer(dataSource, "auth.tokens_cache").createTable();
            var store = new JdbcTokenStore(dataSource, new ObjectMapper(), "auth.tokens_cache");

            store.insert(new TokenRecord("tok", Map.of("user_id", "user-1"), 1000)).await().indefinitely();

            assertTrue(store.findByToken("tok").await().indefinitely().isPresent());
            assertEquals(1L, store.deleteByUserId("user-1").await().indefinitely());
        }
    }

    @Nested
    @DisplayName("Error mapping")
    class ErrorMappingTests {

        @Test
        @DisplayName("should map a unique violation to a conflict")
        void shouldMapUniqueViolation() {
            var store = new JdbcTokenStore(
                    JdbcTokenStoreContractTest.newDataSourceWithSchema(), new ObjectMapper(), "tokens_cache");
            store.insert(new TokenRecord("tok", Map.of(), 1000)).await().indefinitely();

            var duplicate = new TokenRecord("tok", Map.of(), 1000);
            assertThrows(TokenConflictException.class, () -> store.insert(duplicate).await().indefinitely());
        }

        @Test
        @DisplayName("should wrap connection failures in TokenStoreException")
        void shouldWrapConnectionFailures() throws SQLException {
            DataSource dataSource = mock(DataSource.class);
            when(dataSource.getConnection()).thenThrow(new SQLException("connection refused", "08001"));
            var store = new JdbcTokenStore(dataSource, new ObjectMapper(), "tokens_cache");

            var thrown = assertThrows(
                    TokenStoreException.class, () -> store.findByToken("tok").await().indefinitely());

            assertTrue(thrown.getMessage().contains("findByToken"));
            assertTrue(thrown.getCause() instanceof SQLException);
        }

        @Test
        @DisplayName("should fail with TokenStoreException on a corrupt payload")
        void shouldFailOnCorruptPayload() throws SQLException {
            JdbcDataSource dataSource = JdbcTokenStoreContractTest.newDataSourceWithSchema();
            try (Connection connection = dataSource.getConnection()) {
                connection.createStatement()
                        .execute("INSERT INTO tokens_cache (token, payload, modified_at) VALUES ('tok', 'not json', 1)");
            }
            var store = new JdbcTokenStore(dataSource, new ObjectMapper(), "tokens_cache");

            assertThrows(TokenStoreException.class, () -> store.findByToken("tok").await().indefinitely());
        }
    }

    @Test
    @DisplayName("should store the payload user_id in its own column")
    void shouldDenormalizeUserId() throws SQLException {
        JdbcDataSource dataSource = JdbcTokenStoreContractTest.newDataSourceWithSchema();
        var store = new JdbcTokenStore(dataSource, new ObjectMapper(), "tokens_cache");

        store.insert(new TokenRecord("tok", Map.of("user_id", 42), 1000)).await().indefinitely();

        try (Connection connection = dataSource.getConnection();
                var stmt = connection.prepareStatement("SELECT user_id FROM tokens_cache WHERE token = ?")) {
            stmt.setString(1, "tok");
            try (ResultSet rs = stmt.executeQuery()) {
                assertTrue(rs.next());
                assertEquals("42", rs.getString(1));
            }
        }
    }

    @Test
    @DisplayName("should leave the row unchanged when the compare-and-set is stale")
    void shouldLeaveRowOnStaleCompareAndSet() {
        var store = new JdbcTokenStore(
                JdbcTokenStoreContractTest.newDataSourceWithSchema(), new ObjectMapper(), "tokens_cache");
        store.insert(new TokenRecord("tok", Map.of(), 1000)).await().indefinitely();

        var result = store.compareAndSetModifiedAt("tok", 999, 2000).await().indefinitely();

        assertTrue(result.isEmpty());
        assertEquals(1000, store.findByToken("tok").await().indefinitely().orElseThrow().modifiedAt());
    }
}
