package gr.imsi.athenarc.pipeline.datasource.config;

/**
 * Settings of a Trino datasource; the table is addressed as catalog.schema.table.
 */
public class TrinoConfiguration extends SQLConfiguration {

    private String catalog;

    private TrinoConfiguration() {}

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends AbstractBuilder<TrinoConfiguration, Builder> {
        private String catalog;

        public Builder catalog(String catalog) {
            this.catalog = catalog;
            return this;
        }

        @Override
        protected TrinoConfiguration create() {
            TrinoConfiguration config = new TrinoConfiguration();
            config.catalog = catalog;
            return config;
        }

        @Override
        protected Builder self() {
            return this;
        }
    }

    public String getCatalog() { return catalog; }
}
