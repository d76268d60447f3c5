package gr.imsi.athenarc.pipeline.datasource.config;

/**
 * Connection settings of one datasource; the concrete type selects the backend.
 */
public interface DatasourceConfiguration {

    String getId();
}
