package gr.imsi.athenarc.pipeline.datasource.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings of a PostgreSQL-compatible datasource backed by one table.
 */
public class SQLConfiguration implements DatasourceConfiguration {

    private String id;
    private String url;
    private String username;
    private String password;
    private String schemaName;
    private String tableName;
    private String timestampColumn;
    private int maxPoolSize = 10;
    private Map<String, String> metrics = new LinkedHashMap<>();

    protected SQLConfiguration() {}

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends AbstractBuilder<SQLConfiguration, Builder> {

        @Override
        protected SQLConfiguration create() {
            return new SQLConfiguration();
        }

        @Override
        protected Builder self() {
            return this;
        }
    }

    /**
     * Shared fluent setters, so that subclasses extend the builder instead of duplicating it.
     */
    public abstract static class AbstractBuilder<C extends SQLConfiguration, B extends AbstractBuilder<C, B>> {
        private String id;
        private String url;
        private String username;
        private String password;
        private String schemaName;
        private String tableName;
        private String timestampColumn;
        private int maxPoolSize = 10;
        private final Map<String, String> metrics = new LinkedHashMap<>();

        protected abstract C create();

        protected abstract B self();

        public B id(String id) {
            this.id = id;
            return self();
        }

        public B url(String url) {
            this.url = url;
            return self();
        }

        public B username(String username) {
            this.username = username;
            return self();
        }

        public B password(String password) {
            this.password = password;
            return self();
        }

        public B schemaName(String schemaName) {
            this.schemaName = schemaName;
            return self();
        }

        public B tableName(String tableName) {
            this.tableName = tableName;
            return self();
        }

        public B timestampColumn(String timestampColumn) {
            this.timestampColumn = timestampColumn;
            return self();
        }

        public B maxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
            return self();
        }

        /**
         * Declares a saved metric, e.g. {@code metric("revenue", "SUM(amount)")}.
         */
        public B metric(String name, String expression) {
            this.metrics.put(name, expression);
            return self();
        }

        public C build() {
            if (id == null || url == null || tableName == null) {
                throw new IllegalStateException("Datasource configuration requires an id, a url and a table name");
            }
            C config = create();
            SQLConfiguration target = config;
            target.id = this.id;
            target.url = this.url;
            target.username = this.username;
            target.password = this.password;
            target.schemaName = this.schemaName;
            target.tableName = this.tableName;
            target.timestampColumn = this.timestampColumn;
            target.maxPoolSize = this.maxPoolSize;
            target.metrics = new LinkedHashMap<>(this.metrics);
            return config;
        }
    }

    @Override
    public String getId() { return id; }
    public String getUrl() { return url; }
    public String getUsername() { return username; }
    public String getPassword() { return password; }
    public String getSchemaName() { return schemaName; }
    public String getTableName() { return tableName; }
    public String getTimestampColumn() { return timestampColumn; }
    public int getMaxPoolSize() { return maxPoolSize; }
    public Map<String, String> getMetrics() { return metrics; }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + ", url=" + url + ", schema=" + schemaName + ", table=" + tableName + '}';
    }
}
