package gr.imsi.athenarc.pipeline.datasource;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Suppliers;

import gr.imsi.athenarc.pipeline.compiler.NativeQuery;
import gr.imsi.athenarc.pipeline.datasource.config.SQLConfiguration;
import gr.imsi.athenarc.pipeline.datasource.config.TrinoConfiguration;
import gr.imsi.athenarc.pipeline.datasource.dialect.SqlDialect;
import gr.imsi.athenarc.pipeline.datasource.executor.SQLQueryExecutor;
import gr.imsi.athenarc.pipeline.domain.ColumnType;
import gr.imsi.athenarc.pipeline.domain.TabularResult;

/**
 * Adapter over one table reachable through JDBC. The schema is read once from the
 * driver's metadata and memoized; saved metrics come from the configuration.
 */
public class JdbcDatasourceAdapter implements DatasourceAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcDatasourceAdapter.class);

    private final SQLConfiguration config;
    private final SQLQueryExecutor executor;
    private final SqlDialect dialect;
    private final Supplier<DatasourceSchema> schema;

    public JdbcDatasourceAdapter(SQLConfiguration config, SQLQueryExecutor executor, SqlDialect dialect) {
        this.config = config;
        this.executor = executor;
        this.dialect = dialect;
        this.schema = Suppliers.memoize(this::readSchema);
    }

    @Override
    public TabularResult execute(NativeQuery query, Duration timeout) {
        if (!config.getId().equals(query.getDatasourceId())) {
            throw new DatasourceException("Query for " + query.getDatasourceId() + " sent to datasource " + config.getId());
        }
        TabularResult result = executor.executeDbQuery(query.getText(), timeout);
        LOG.debug("Datasource {} returned {} rows", config.getId(), result.getRowCount());
        return result;
    }

    @Override
    public DatasourceSchema describeSchema(String datasourceId) {
        if (!config.getId().equals(datasourceId)) {
            throw new DatasourceException("Unknown datasource " + datasourceId);
        }
        return schema.get();
    }

    @Override
    public SqlDialect getDialect() {
        return dialect;
    }

    @Override
    public void close() {
        executor.getConnection().close();
    }

    private DatasourceSchema readSchema() {
        String catalog = config instanceof TrinoConfiguration ? ((TrinoConfiguration) config).getCatalog() : null;
        DatasourceSchema.Builder builder = DatasourceSchema.builder(config.getId())
            .source(sourceExpression(catalog));
        try (Connection connection = executor.getConnection().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            int columns = 0;
            try (ResultSet resultSet = metaData.getColumns(catalog, config.getSchemaName(), config.getTableName(), null)) {
                while (resultSet.next()) {
                    builder.column(resultSet.getString("COLUMN_NAME"), ColumnType.fromSqlType(resultSet.getInt("DATA_TYPE")));
                    columns++;
                }
            }
            if (columns == 0) {
                throw new DatasourceException("Table " + config.getTableName() + " of datasource " + config.getId() + " has no visible columns");
            }
        } catch (SQLException e) {
            throw new DatasourceException("Failed to read schema of datasource " + config.getId(), e);
        }
        for (Map.Entry<String, String> metric : config.getMetrics().entrySet()) {
            builder.metric(metric.getKey(), metric.getValue());
        }
        if (config.getTimestampColumn() != null) {
            builder.mainTemporalColumn(config.getTimestampColumn());
        }
        DatasourceSchema described = builder.build();
        LOG.info("Described datasource schema: {}", described);
        return described;
    }

    private String sourceExpression(String catalog) {
        StringBuilder source = new StringBuilder();
        if (catalog != null) {
            source.append(dialect.quoteIdentifier(catalog)).append('.');
        }
        if (config.getSchemaName() != null) {
            source.append(dialect.quoteIdentifier(config.getSchemaName())).append('.');
        }
        return source.append(dialect.quoteIdentifier(config.getTableName())).toString();
    }
}
