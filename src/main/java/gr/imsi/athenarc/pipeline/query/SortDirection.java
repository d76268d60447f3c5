package gr.imsi.athenarc.pipeline.query;

import java.util.Locale;

import gr.imsi.athenarc.pipeline.exception.QueryValidationException;

public enum SortDirection {
    ASC,
    DESC;

    public static SortDirection fromName(String name) {
        if (name == null) {
            return ASC;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "asc":
            case "ascending":
                return ASC;
            case "desc":
            case "descending":
                return DESC;
            default:
                throw new QueryValidationException("Unsupported sort direction: " + name);
        }
    }
}
