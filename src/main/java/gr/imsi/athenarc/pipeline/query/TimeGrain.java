package gr.imsi.athenarc.pipeline.query;

import java.util.Locale;

import gr.imsi.athenarc.pipeline.exception.QueryValidationException;

/**
 * Time bucket granularity, named by its ISO-8601 duration.
 */
public enum TimeGrain {
    MINUTE("PT1M", "minute"),
    HOUR("PT1H", "hour"),
    DAY("P1D", "day"),
    WEEK("P1W", "week"),
    MONTH("P1M", "month"),
    QUARTER("P3M", "quarter"),
    YEAR("P1Y", "year");

    private final String isoDuration;
    private final String unit;

    TimeGrain(String isoDuration, String unit) {
        this.isoDuration = isoDuration;
        this.unit = unit;
    }

    public String getIsoDuration() {
        return isoDuration;
    }

    /**
     * @return the unit name understood by DATE_TRUNC style functions
     */
    public String getUnit() {
        return unit;
    }

    public static TimeGrain fromName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (TimeGrain grain : values()) {
            if (grain.isoDuration.equals(normalized) || grain.name().equals(normalized)) {
                return grain;
            }
        }
        throw new QueryValidationException("Unsupported time grain: " + name);
    }
}
