package gr.imsi.athenarc.pipeline.exception;

/**
 * Raised when the principal may not read a referenced resource or when a
 * row-level policy cannot be resolved for the principal. Messages name
 * resources only, never predicate values.
 */
public class QueryForbiddenException extends PipelineException {

    private final String resource;

    public QueryForbiddenException(PipelineStage stage, String resource, String message) {
        super(stage, message);
        this.resource = resource;
    }

    public QueryForbiddenException(PipelineStage stage, String resource, String message, Throwable cause) {
        super(stage, message, cause);
        this.resource = resource;
    }

    /**
     * @return the name of the first resource that failed the check
     */
    public String getResource() {
        return resource;
    }
}
