package gr.imsi.athenarc.pipeline.postprocessing;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed access to the loosely typed options of one operation. Every accessor
 * reports a malformed or missing value as a {@link PostProcessingException}
 * naming the operation and the option.
 */
public final class OperationOptions {

    private final String operation;
    private final Map<String, Object> options;

    public OperationOptions(String operation, Map<String, Object> options) {
        this.operation = operation;
        this.options = options == null ? Map.of() : options;
    }

    public String getOperation() {
        return operation;
    }

    public boolean has(String key) {
        return options.get(key) != null;
    }

    public String getString(String key) {
        return getOptionalString(key).orElseThrow(() -> missing(key));
    }

    public Optional<String> getOptionalString(String key) {
        Object value = options.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!(value instanceof String)) {
            throw malformed(key, "a string");
        }
        return Optional.of((String) value);
    }

    /**
     * Reads a list of column names. A single string is accepted as a one-element list.
     */
    public List<String> getStringList(String key) {
        return getOptionalStringList(key).orElseThrow(() -> missing(key));
    }

    public Optional<List<String>> getOptionalStringList(String key) {
        Object value = options.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof String) {
            return Optional.of(List.of((String) value));
        }
        if (!(value instanceof Collection)) {
            throw malformed(key, "a list of strings");
        }
        List<String> strings = new ArrayList<>();
        for (Object element : (Collection<?>) value) {
            if (!(element instanceof String)) {
                throw malformed(key, "a list of strings");
            }
            strings.add((String) element);
        }
        return Optional.of(strings);
    }

    public Map<String, Object> getMap(String key) {
        return getOptionalMap(key).orElseThrow(() -> missing(key));
    }

    public Optional<Map<String, Object>> getOptionalMap(String key) {
        Object value = options.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!(value instanceof Map)) {
            throw malformed(key, "an object");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        ((Map<?, ?>) value).forEach((k, v) -> copy.put(String.valueOf(k), v));
        return Optional.of(copy);
    }

    /**
     * Reads a {@code {source: destination}} column mapping, keeping its order.
     */
    public Map<String, String> getColumnMapping(String key) {
        Map<String, String> mapping = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : getMap(key).entrySet()) {
            if (!(entry.getValue() instanceof String)) {
                throw malformed(key, "a mapping of column names");
            }
            mapping.put(entry.getKey(), (String) entry.getValue());
        }
        if (mapping.isEmpty()) {
            throw malformed(key, "a non-empty mapping of column names");
        }
        return mapping;
    }

    public int getInt(String key) {
        if (!has(key)) {
            throw missing(key);
        }
        return getInt(key, 0);
    }

    public int getInt(String key, int defaultValue) {
        Object value = options.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Number) || ((Number) value).doubleValue() != Math.rint(((Number) value).doubleValue())) {
            throw malformed(key, "an integer");
        }
        return ((Number) value).intValue();
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = options.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Boolean)) {
            throw malformed(key, "a boolean");
        }
        return (Boolean) value;
    }

    public PostProcessingException malformed(String key, String expected) {
        return new PostProcessingException("Option '" + key + "' of operation " + operation + " must be " + expected);
    }

    private PostProcessingException missing(String key) {
        return new PostProcessingException("Operation " + operation + " requires option '" + key + "'");
    }

    @Override
    public String toString() {
        return operation + options;
    }
}
