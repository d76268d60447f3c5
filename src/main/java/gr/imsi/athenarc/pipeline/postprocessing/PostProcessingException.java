package gr.imsi.athenarc.pipeline.postprocessing;

import gr.imsi.athenarc.pipeline.exception.PipelineStage;
import gr.imsi.athenarc.pipeline.exception.QueryValidationException;

/**
 * A post-processing operation received options it cannot apply to the result at hand.
 */
public class PostProcessingException extends QueryValidationException {

    public PostProcessingException(String message) {
        super(PipelineStage.POST_PROCESSED, message);
    }

    public PostProcessingException(String message, Throwable cause) {
        super(PipelineStage.POST_PROCESSED, message, cause);
    }
}
