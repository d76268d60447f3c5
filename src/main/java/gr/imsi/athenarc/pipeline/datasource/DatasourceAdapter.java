package gr.imsi.athenarc.pipeline.datasource;

import java.time.Duration;

import gr.imsi.athenarc.pipeline.compiler.NativeQuery;
import gr.imsi.athenarc.pipeline.datasource.dialect.SqlDialect;
import gr.imsi.athenarc.pipeline.domain.TabularResult;

/**
 * Capability interface of one backend. Implementations must be safe to call from
 * several pipeline threads at once and should honour thread interruption where
 * the driver allows it.
 */
public interface DatasourceAdapter {

    /**
     * Runs a compiled query.
     *
     * @throws DatasourceTimeoutException if the backend exceeded {@code timeout}
     * @throws DatasourceException on any other backend failure
     */
    TabularResult execute(NativeQuery query, Duration timeout);

    DatasourceSchema describeSchema(String datasourceId);

    SqlDialect getDialect();

    default void close() {
    }
}
