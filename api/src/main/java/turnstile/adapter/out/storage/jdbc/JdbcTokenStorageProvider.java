package turnstile.adapter.out.storage.jdbc;

import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

import javax.sql.DataSource;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import turnstile.core.config.TokenConfig;
import turnstile.core.port.out.TokenStore;
import turnstile.spi.StorageProviderException;
import turnstile.spi.TokenStorageProvider;

/**
 * Relational token storage provider backed by the default datasource.
 *
 * <p>This is the recommended provider for production deployments. The
 * datasource is the pooled Agroal datasource configured through
 * {@code quarkus.datasource.*}.
 */
@ApplicationScoped
public class JdbcTokenStorageProvider implements TokenStorageProvider {

    private static final Logger LOG = Logger.getLogger(JdbcTokenStorageProvider.class);
    private static final int PRIORITY = 100;
    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    private final Instance<DataSource> dataSources;
    private final Instance<ObjectMapper> objectMappers;
    private final TokenConfig config;

    private JdbcTokenStore store;

    @Inject
    public JdbcTokenStorageProvider(
            Instance<DataSource> dataSources, Instance<ObjectMapper> objectMappers, TokenConfig config) {
        this.dataSources = dataSources;
        this.objectMappers = objectMappers;
        this.config = config;
    }

    @Override
    public String name() {
        return "jdbc";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        if (!dataSources.isResolvable()) {
            LOG.debug("No datasource configured, JDBC token storage unavailable");
            return false;
        }
        try {
            return ping();
        } catch (SQLException | RuntimeException e) {
            LOG.warnf("JDBC token storage is not available: %s", e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized TokenStore createStore() {
        if (store != null) {
            return store;
        }
        if (!dataSources.isResolvable()) {
            throw new StorageProviderException(name(), "No datasource configured");
        }

        DataSource dataSource = dataSources.get();
        String table = config.storage().jdbc().table();

        ObjectMapper objectMapper = objectMappers.isResolvable() ? objectMappers.get() : new ObjectMapper();
        // Validates the table name before it reaches any DDL
        JdbcTokenStore created = new JdbcTokenStore(dataSource, objectMapper, table);

        if (config.storage().jdbc().createTable()) {
            try {
                new JdbcSchemaInitializer(dataSource, table).createTable();
            } catch (IOException | SQLException e) {
                throw new StorageProviderException(name(), "Failed to create token table " + table, e);
            }
        }

        store = created;
        LOG.infof("Created JDBC token store on table: %s", table);
        return store;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        String table = config.storage().jdbc().table();
        try {
            if (ping()) {
                return Optional.of(HealthCheckResponse.named("token-storage-jdbc")
                        .up()
                        .withData("type", "jdbc")
                        .withData("table", table)
                        .build());
            }
            return Optional.of(down(table, "Connection validation failed"));
        } catch (SQLException | RuntimeException e) {
            return Optional.of(down(table, e.getMessage()));
        }
    }

    private boolean ping() throws SQLException {
        try (Connection connection = dataSources.get().getConnection()) {
            return connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        }
    }

    private HealthCheckResponse down(String table, String error) {
        return HealthCheckResponse.named("token-storage-jdbc")
                .down()
                .withData("type", "jdbc")
                .withData("table", table)
                .withData("error", error == null ? "unknown" : error)
                .build();
    }
}
