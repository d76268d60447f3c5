package gr.imsi.athenarc.pipeline.query;

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * Opaque reference to a datasource: an identifier plus a kind tag
 * (for example "table" or "query").
 */
public final class DatasourceRef {

    public static final String DEFAULT_KIND = "table";

    private final String id;
    private final String kind;

    public DatasourceRef(String id, String kind) {
        Preconditions.checkArgument(id != null && !id.isBlank(), "Datasource id is required");
        this.id = id;
        this.kind = kind == null || kind.isBlank() ? DEFAULT_KIND : kind;
    }

    public static DatasourceRef of(String id) {
        return new DatasourceRef(id, DEFAULT_KIND);
    }

    public String getId() {
        return id;
    }

    public String getKind() {
        return kind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DatasourceRef)) return false;
        DatasourceRef that = (DatasourceRef) o;
        return id.equals(that.id) && kind.equals(that.kind);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind);
    }

    @Override
    public String toString() {
        return kind + ":" + id;
    }
}
