package gr.imsi.athenarc.pipeline.query;

import java.util.Locale;

import gr.imsi.athenarc.pipeline.exception.QueryValidationException;

/** Aggregation kinds an ad-hoc metric can request **/
public enum AggregationType {
    COUNT,            // COUNT(col)
    COUNT_DISTINCT,   // COUNT(DISTINCT col)
    SUM,
    AVG,
    MIN,
    MAX;

    public static AggregationType fromName(String name) {
        if (name == null) {
            throw new QueryValidationException("Missing aggregation type");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT).replace(' ', '_'));
        } catch (IllegalArgumentException e) {
            throw new QueryValidationException("Unsupported aggregation type: " + name);
        }
    }
}
