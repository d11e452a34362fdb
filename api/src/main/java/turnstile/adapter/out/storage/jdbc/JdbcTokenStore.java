package turnstile.adapter.out.storage.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import javax.sql.DataSource;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import turnstile.core.model.token.TokenRecord;
import turnstile.core.port.out.TokenConflictException;
import turnstile.core.port.out.TokenStore;
import turnstile.core.port.out.TokenStoreException;
import turnstile.core.util.SecureHash;

/**
 * JDBC implementation of TokenStore.
 *
 * <p>Connections come from a pooled {@link DataSource}; each operation borrows
 * one connection and returns it. JDBC calls block, so every operation is
 * subscribed on the Mutiny worker pool.
 *
 * <h2>Schema</h2>
 * <pre>
 * CREATE TABLE IF NOT EXISTS tokens_cache (
 *     token VARCHAR(128) PRIMARY KEY,
 *     payload TEXT NOT NULL,
 *     user_id VARCHAR(255),
 *     modified_at BIGINT NOT NULL
 * );
 * </pre>
 *
 * <p>{@code user_id} duplicates the payload's {@code user_id} field at insert
 * time so bulk revocation is a plain indexed equality match on any database.
 */
public class JdbcTokenStore implements TokenStore {

    private static final Logger LOG = Logger.getLogger(JdbcTokenStore.class);
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");
    private static final String UNIQUE_VIOLATION = "23505";
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    private final String insertSql;
    private final String selectSql;
    private final String compareAndSetSql;
    private final String deleteSql;
    private final String deleteByUserSql;
    private final String deleteOlderThanSql;

    public JdbcTokenStore(DataSource dataSource, ObjectMapper objectMapper, String table) {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid token table name: " + table);
        }
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
        this.insertSql = "INSERT INTO %s (token, payload, user_id, modified_at) VALUES (?, ?, ?, ?)".formatted(table);
        this.selectSql = "SELECT token, payload, modified_at FROM %s WHERE token = ?".formatted(table);
        this.compareAndSetSql = "UPDATE %s SET modified_at = ? WHERE token = ? AND modified_at = ?".formatted(table);
        this.deleteSql = "DELETE FROM %s WHERE token = ?".formatted(table);
        this.deleteByUserSql = "DELETE FROM %s WHERE user_id = ?".formatted(table);
        this.deleteOlderThanSql = "DELETE FROM %s WHERE modified_at < ?".formatted(table);
    }

    @Override
    public Uni<Void> insert(TokenRecord record) {
        return blocking("insert", connection -> {
            String json = serialize(record.payload());
            try (PreparedStatement stmt = connection.prepareStatement(insertSql)) {
                stmt.setString(1, record.token());
                stmt.setString(2, json);
                Optional<String> userId = record.userId();
                if (userId.isPresent()) {
                    stmt.setString(3, userId.get());
                } else {
                    stmt.setNull(3, Types.VARCHAR);
                }
                stmt.setLong(4, record.modifiedAt());
                stmt.executeUpdate();
                return null;
            } catch (SQLException e) {
                if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    throw new TokenConflictException(
                            "Token already exists: " + SecureHash.fingerprint(record.token()), e);
                }
                throw e;
            }
        });
    }

    @Override
    public Uni<Optional<TokenRecord>> findByToken(String token) {
        return blocking("findByToken", connection -> select(connection, token));
    }

    /**
     * Conditional update followed by a read of the row it touched.
     *
     * <p>The UPDATE is the compare-and-set; the store serializes concurrent
     * updates of one row, so at most one caller sees an update count of 1
     * for a given expected value. The read runs in the same transaction so it
     * observes exactly the row this caller wrote.
     */
    @Override
    public Uni<Optional<TokenRecord>> compareAndSetModifiedAt(String token, long expectedModifiedAt, long newModifiedAt) {
        return blocking("compareAndSetModifiedAt", connection -> {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                int updated;
                try (PreparedStatement stmt = connection.prepareStatement(compareAndSetSql)) {
                    stmt.setLong(1, newModifiedAt);
                    stmt.setString(2, token);
                    stmt.setLong(3, expectedModifiedAt);
                    updated = stmt.executeUpdate();
                }
                Optional<TokenRecord> result = updated == 1 ? select(connection, token) : Optional.empty();
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(connection, e);
                throw e;
            } finally {
                connection.setAutoCommit(autoCommit);
            }
        });
    }

    @Override
    public Uni<Boolean> delete(String token) {
        return blocking("delete", connection -> {
            try (PreparedStatement stmt = connection.prepareStatement(deleteSql)) {
                stmt.setString(1, token);
                return stmt.executeUpdate() > 0;
            }
        });
    }

    @Override
    public Uni<Long> deleteByUserId(String userId) {
        return blocking("deleteByUserId", connection -> {
            try (PreparedStatement stmt = connection.prepareStatement(deleteByUserSql)) {
                stmt.setString(1, userId);
                return (long) stmt.executeUpdate();
            }
        });
    }

    @Override
    public Uni<Long> deleteOlderThan(long cutoffEpochSeconds) {
        return blocking("deleteOlderThan", connection -> {
            try (PreparedStatement stmt = connection.prepareStatement(deleteOlderThanSql)) {
                stmt.setLong(1, cutoffEpochSeconds);
                return (long) stmt.executeUpdate();
            }
        });
    }

    private Optional<TokenRecord> select(Connection connection, String token) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(selectSql)) {
            stmt.setString(1, token);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(
                        new TokenRecord(rs.getString("token"), deserialize(rs.getString("payload")), rs.getLong("modified_at")));
            }
        }
    }

    private <T> Uni<T> blocking(String operationName, SqlWork<T> work) {
        return Uni.createFrom()
                .item(() -> {
                    try (Connection connection = dataSource.getConnection()) {
                        return work.execute(connection);
                    } catch (SQLException e) {
                        LOG.warnv("Token store operation failed: {0}: {1}", operationName, e.getMessage());
                        throw new TokenStoreException("Token store operation failed: " + operationName, e);
                    }
                })
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    private void rollbackQuietly(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private String serialize(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new TokenStoreException("Failed to serialize token payload", e);
        }
    }

    private Map<String, Object> deserialize(String json) {
        try {
            return objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new TokenStoreException("Failed to deserialize token payload", e);
        }
    }

    @FunctionalInterface
    interface SqlWork<T> {
        T execute(Connection connection) throws SQLException;
    }
}
