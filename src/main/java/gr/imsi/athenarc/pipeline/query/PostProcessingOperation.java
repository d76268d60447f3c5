package gr.imsi.athenarc.pipeline.query;

import java.util.Map;
import java.util.Objects;

import gr.imsi.athenarc.pipeline.exception.QueryValidationException;

/**
 * One typed step of the post-processing directive list: an operation kind
 * (for example "pivot" or "rolling") and its options.
 */
public final class PostProcessingOperation {

    private final String operation;
    private final Map<String, Object> options;

    public PostProcessingOperation(String operation, Map<String, ?> options) {
        if (operation == null || operation.isBlank()) {
            throw new QueryValidationException("Post-processing operation kind is required");
        }
        this.operation = operation;
        this.options = ImmutableValues.copyOfMap(options);
    }

    public static PostProcessingOperation of(String operation, Map<String, ?> options) {
        return new PostProcessingOperation(operation, options);
    }

    public String getOperation() {
        return operation;
    }

    /**
     * @return unmodifiable options, in the order they were given
     */
    public Map<String, Object> getOptions() {
        return options;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PostProcessingOperation)) return false;
        PostProcessingOperation that = (PostProcessingOperation) o;
        return operation.equals(that.operation) && options.equals(that.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operation, options);
    }

    @Override
    public String toString() {
        return operation + options;
    }
}
