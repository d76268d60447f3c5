package gr.imsi.athenarc.pipeline.datasource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.pipeline.datasource.config.DatasourceConfiguration;
import gr.imsi.athenarc.pipeline.datasource.config.SQLConfiguration;
import gr.imsi.athenarc.pipeline.datasource.config.TrinoConfiguration;
import gr.imsi.athenarc.pipeline.datasource.connection.JDBCConnection;
import gr.imsi.athenarc.pipeline.datasource.dialect.PostgresDialect;
import gr.imsi.athenarc.pipeline.datasource.dialect.TrinoDialect;
import gr.imsi.athenarc.pipeline.datasource.executor.SQLQueryExecutor;

public class DatasourceFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DatasourceFactory.class);

    private DatasourceFactory() {}

    public static DatasourceAdapter createAdapter(DatasourceConfiguration config) {
        // Trino first, it is also an SQLConfiguration
        if (config instanceof TrinoConfiguration) {
            return createTrinoAdapter((TrinoConfiguration) config);
        } else if (config instanceof SQLConfiguration) {
            return createSQLAdapter((SQLConfiguration) config);
        }
        throw new IllegalArgumentException("Unsupported datasource configuration: " + config);
    }

    private static DatasourceAdapter createSQLAdapter(SQLConfiguration config) {
        JDBCConnection connection = new JDBCConnection(config.getUrl(), config.getUsername(), config.getPassword(),
            config.getMaxPoolSize()).connect("pipeline-" + config.getId());
        LOG.info("Created SQL datasource adapter: {}", config);
        return new JdbcDatasourceAdapter(config, new SQLQueryExecutor(connection), new PostgresDialect());
    }

    private static DatasourceAdapter createTrinoAdapter(TrinoConfiguration config) {
        JDBCConnection connection = new JDBCConnection(config.getUrl(), config.getUsername(), config.getPassword(),
            config.getMaxPoolSize()).connect("pipeline-" + config.getId());
        LOG.info("Created Trino datasource adapter: {}", config);
        return new JdbcDatasourceAdapter(config, new SQLQueryExecutor(connection), new TrinoDialect());
    }
}
