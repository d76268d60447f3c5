package gr.imsi.athenarc.pipeline.datasource;

/**
 * The backend gave up on a statement because it exceeded its timeout.
 */
public class DatasourceTimeoutException extends DatasourceException {

    public DatasourceTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
