package turnstile.adapter.out.storage.jdbc;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import javax.sql.DataSource;

import org.jboss.logging.Logger;

/**
 * Creates the token table on startup.
 *
 * <p>The DDL is read from the classpath at {@value #SCRIPT_PATH}. The script
 * uses {@code ${table}} as a placeholder for the configured table name and
 * {@code ${index}} for an index-name prefix derived from it. It must be
 * idempotent ({@code IF NOT EXISTS}), since it runs on every start.
 */
public class JdbcSchemaInitializer {

    private static final Logger LOG = Logger.getLogger(JdbcSchemaInitializer.class);
    static final String SCRIPT_PATH = "db/jdbc/V1__create_tokens_table.sql";

    private final DataSource dataSource;
    private final String table;

    public JdbcSchemaInitializer(DataSource dataSource, String table) {
        this.dataSource = dataSource;
        this.table = table;
    }

    /**
     * Run the schema script.
     *
     * @return the number of statements executed
     * @throws IOException if the script cannot be read
     * @throws SQLException if a statement fails
     */
    public int createTable() throws IOException, SQLException {
        String script = readScript().replace("${table}", table).replace("${index}", table.replace('.', '_'));
        int executed = 0;
        try (Connection connection = dataSource.getConnection();
                Statement statement = connection.createStatement()) {
            for (String sql : script.split(";")) {
                String trimmed = stripComments(sql).trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                statement.execute(trimmed);
                executed++;
            }
        }
        LOG.infov("Ensured token table {0} exists ({1} statements)", table, executed);
        return executed;
    }

    private String readScript() throws IOException {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = JdbcSchemaInitializer.class.getClassLoader();
        }
        try (InputStream is = loader.getResourceAsStream(SCRIPT_PATH)) {
            if (is == null) {
                throw new IOException("Schema script not found on classpath: " + SCRIPT_PATH);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String stripComments(String sql) {
        StringBuilder sb = new StringBuilder();
        for (String line : sql.split("\n")) {
            if (!line.trim().startsWith("--")) {
                sb.append(line).append('\n');
            }
        }
        return sb.toString();
    }
}
