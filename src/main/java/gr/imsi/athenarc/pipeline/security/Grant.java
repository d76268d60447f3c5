package gr.imsi.athenarc.pipeline.security;

import java.util.Objects;

/**
 * A read permission held by a role. A grant targets a whole datasource, one of
 * its columns or one of its saved metrics; {@link #ANY} matches every datasource.
 */
public final class Grant {

    public static final String ANY = "*";

    public enum Scope {
        DATASOURCE,
        COLUMN,
        METRIC
    }

    private final String datasourceId;
    private final Scope scope;
    private final String resource;

    private Grant(String datasourceId, Scope scope, String resource) {
        this.datasourceId = Objects.requireNonNull(datasourceId, "datasourceId");
        this.scope = scope;
        this.resource = resource;
    }

    public static Grant datasource(String datasourceId) {
        return new Grant(datasourceId, Scope.DATASOURCE, null);
    }

    public static Grant column(String datasourceId, String column) {
        return new Grant(datasourceId, Scope.COLUMN, Objects.requireNonNull(column, "column"));
    }

    public static Grant metric(String datasourceId, String metric) {
        return new Grant(datasourceId, Scope.METRIC, Objects.requireNonNull(metric, "metric"));
    }

    public static Grant all() {
        return new Grant(ANY, Scope.DATASOURCE, null);
    }

    public String getDatasourceId() {
        return datasourceId;
    }

    public Scope getScope() {
        return scope;
    }

    public String getResource() {
        return resource;
    }

    boolean appliesTo(String datasource) {
        return ANY.equals(datasourceId) || datasourceId.equals(datasource);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Grant)) return false;
        Grant grant = (Grant) o;
        return datasourceId.equals(grant.datasourceId) && scope == grant.scope && Objects.equals(resource, grant.resource);
    }

    @Override
    public int hashCode() {
        return Objects.hash(datasourceId, scope, resource);
    }

    @Override
    public String toString() {
        return scope + ":" + datasourceId + (resource == null ? "" : "." + resource);
    }
}
