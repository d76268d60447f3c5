package gr.imsi.athenarc.pipeline.postprocessing;

import gr.imsi.athenarc.pipeline.domain.TabularResult;

/**
 * One kind of post-processing operation. Implementations are stateless and
 * return a new result; the input is never modified.
 */
public interface PostProcessor {

    /**
     * @return the operation name requests use, e.g. {@code pivot}
     */
    String getKind();

    /**
     * @throws PostProcessingException if the options are malformed or reference unknown columns
     */
    TabularResult apply(TabularResult input, OperationOptions options);
}
