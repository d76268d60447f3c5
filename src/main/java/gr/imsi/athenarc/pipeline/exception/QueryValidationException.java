package gr.imsi.athenarc.pipeline.exception;

/**
 * A malformed descriptor: unknown column, bad operator, non-monotonic time range.
 * Never retried.
 */
public class QueryValidationException extends PipelineException {

    public QueryValidationException(String message) {
        this(PipelineStage.RECEIVED, message);
    }

    public QueryValidationException(PipelineStage stage, String message) {
        super(stage, message);
    }

    public QueryValidationException(PipelineStage stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
