package gr.imsi.athenarc.pipeline.query;

import java.util.Locale;

import gr.imsi.athenarc.pipeline.exception.QueryValidationException;

/**
 * Output representation requested by the caller.
 */
public enum ResultFormat {
    JSON,
    CSV,
    XLSX;

    public static ResultFormat fromName(String name) {
        if (name == null) {
            return JSON;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new QueryValidationException("Unsupported result format: " + name);
        }
    }
}
