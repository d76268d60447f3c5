package gr.imsi.athenarc.pipeline.exception;

/**
 * Adapter failure, timeout or any backend fault. The message is sanitized: the
 * native query is logged for diagnostics but never part of the message.
 */
public class QueryExecutionException extends PipelineException {

    public QueryExecutionException(PipelineStage stage, String message) {
        super(stage, message);
    }

    public QueryExecutionException(PipelineStage stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
