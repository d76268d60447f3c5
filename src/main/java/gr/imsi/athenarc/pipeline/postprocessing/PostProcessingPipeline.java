package gr.imsi.athenarc.pipeline.postprocessing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;

import gr.imsi.athenarc.pipeline.domain.TabularResult;
import gr.imsi.athenarc.pipeline.postprocessing.operations.AggregateOperation;
import gr.imsi.athenarc.pipeline.postprocessing.operations.CompareOperation;
import gr.imsi.athenarc.pipeline.postprocessing.operations.ContributionOperation;
import gr.imsi.athenarc.pipeline.postprocessing.operations.CumulativeOperation;
import gr.imsi.athenarc.pipeline.postprocessing.operations.DiffOperation;
import gr.imsi.athenarc.pipeline.postprocessing.operations.PivotOperation;
import gr.imsi.athenarc.pipeline.postprocessing.operations.RollingOperation;
import gr.imsi.athenarc.pipeline.postprocessing.operations.SelectOperation;
import gr.imsi.athenarc.pipeline.postprocessing.operations.SortOperation;
import gr.imsi.athenarc.pipeline.query.PostProcessingOperation;

/**
 * Applies a descriptor's post-processing operations strictly in order, each to
 * the output of the previous one. An operation whose kind has no registered
 * processor is skipped and reported as a warning; any other failure aborts.
 */
public class PostProcessingPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(PostProcessingPipeline.class);

    private final Map<String, PostProcessor> processors = new LinkedHashMap<>();

    public PostProcessingPipeline(List<? extends PostProcessor> processors) {
        for (PostProcessor processor : processors) {
            if (this.processors.put(processor.getKind(), processor) != null) {
                throw new IllegalArgumentException("Duplicate post-processor for " + processor.getKind());
            }
        }
    }

    public static PostProcessingPipeline withDefaultOperations() {
        return new PostProcessingPipeline(List.of(
            new PivotOperation(),
            new AggregateOperation(),
            new SortOperation(),
            new RollingOperation(),
            new CompareOperation(),
            new CumulativeOperation(),
            new DiffOperation(),
            new ContributionOperation(),
            new SelectOperation()));
    }

    public Set<String> getSupportedKinds() {
        return processors.keySet();
    }

    public PostProcessingResult apply(TabularResult input, List<PostProcessingOperation> operations) {
        List<String> warnings = new ArrayList<>();
        TabularResult current = input;
        for (int i = 0; i < operations.size(); i++) {
            PostProcessingOperation operation = operations.get(i);
            PostProcessor processor = processors.get(operation.getOperation());
            if (processor == null) {
                String warning = "Unknown post-processing operation '" + operation.getOperation() + "' at position " + i + " was skipped";
                LOG.warn(warning);
                warnings.add(warning);
                continue;
            }
            Stopwatch stopwatch = Stopwatch.createStarted();
            try {
                current = processor.apply(current, new OperationOptions(operation.getOperation(), operation.getOptions()));
            } catch (PostProcessingException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new PostProcessingException("Post-processing operation " + operation.getOperation()
                    + " failed: " + e.getMessage(), e);
            }
            LOG.debug("Applied {} in {}, {} rows x {} columns", operation.getOperation(), stopwatch.stop(),
                current.getRowCount(), current.getColumnCount());
        }
        return new PostProcessingResult(current, warnings);
    }
}
