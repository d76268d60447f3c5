package gr.imsi.athenarc.pipeline.query;

import java.util.Locale;

import gr.imsi.athenarc.pipeline.exception.QueryValidationException;

/**
 * What the caller wants back: the data, or only the compiled native query.
 */
public enum ResultType {
    FULL,
    QUERY;

    public static ResultType fromName(String name) {
        if (name == null) {
            return FULL;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new QueryValidationException("Unsupported result type: " + name);
        }
    }
}
