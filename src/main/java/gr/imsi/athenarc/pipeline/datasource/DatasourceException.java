package gr.imsi.athenarc.pipeline.datasource;

/**
 * Failure reported by a datasource backend. Messages may contain backend detail
 * and are never returned to pipeline callers as is.
 */
public class DatasourceException extends RuntimeException {

    public DatasourceException(String message) {
        super(message);
    }

    public DatasourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
