package gr.imsi.athenarc.pipeline.datasource.connection;

import java.sql.Connection;
import java.sql.SQLException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import gr.imsi.athenarc.pipeline.datasource.DatasourceException;

/**
 * Pooled JDBC access to one database. Connections are borrowed per statement
 * and returned on close, so a single instance serves concurrent queries.
 */
public class JDBCConnection implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(JDBCConnection.class);

    private final String host;
    private final String user;
    private final String password;
    private final int maxPoolSize;
    private HikariDataSource dataSource;

    public JDBCConnection(String host, String user, String password, int maxPoolSize) {
        this.host = host;
        this.user = user;
        this.password = password;
        this.maxPoolSize = maxPoolSize;
    }

    public JDBCConnection connect(String poolName) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(host);
        config.setUsername(user);
        config.setPassword(password);
        config.setMaximumPoolSize(maxPoolSize);
        config.setMinimumIdle(0);
        config.setPoolName(poolName);
        // fail on first use rather than at construction when the backend is down
        config.setInitializationFailTimeout(-1);
        config.setReadOnly(true);
        try {
            dataSource = new HikariDataSource(config);
        } catch (RuntimeException e) {
            throw new DatasourceException("Could not create connection pool for " + host, e);
        }
        LOG.info("Initialized JDBC connection pool {} for {}", poolName, host);
        return this;
    }

    public Connection getConnection() throws SQLException {
        if (dataSource == null) {
            throw new IllegalStateException("JDBC connection to " + host + " is not connected");
        }
        return dataSource.getConnection();
    }

    public String getHost() {
        return host;
    }

    public String getUser() {
        return user;
    }

    @Override
    public void close() {
        if (dataSource != null) {
            dataSource.close();
            LOG.info("Closed JDBC connection pool for {}", host);
        }
    }
}
