package gr.imsi.athenarc.pipeline.exception;

/**
 * Base class of every error surfaced by the query pipeline. Carries the stage
 * at which the request failed.
 */
public abstract class PipelineException extends RuntimeException {

    private final PipelineStage stage;

    protected PipelineException(PipelineStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    protected PipelineException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{stage=" + stage + ", reason=" + getMessage() + '}';
    }
}
