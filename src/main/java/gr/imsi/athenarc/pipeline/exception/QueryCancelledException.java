package gr.imsi.athenarc.pipeline.exception;

/**
 * The caller interrupted the request while it was waiting on the cache store or
 * the datasource adapter.
 */
public class QueryCancelledException extends QueryExecutionException {

    public QueryCancelledException(PipelineStage stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
