package gr.imsi.athenarc.pipeline.postprocessing;

import java.util.List;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.pipeline.domain.TabularResult;

/**
 * The transformed result together with the warnings raised on the way.
 */
public final class PostProcessingResult {

    private final TabularResult result;
    private final List<String> warnings;

    public PostProcessingResult(TabularResult result, List<String> warnings) {
        this.result = result;
        this.warnings = ImmutableList.copyOf(warnings);
    }

    public TabularResult getResult() {
        return result;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
