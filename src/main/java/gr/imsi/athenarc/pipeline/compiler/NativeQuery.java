package gr.imsi.athenarc.pipeline.compiler;

import java.util.Objects;

/**
 * A query compiled for one backend: the statement text and the language it is written in.
 */
public final class NativeQuery {

    private final String datasourceId;
    private final String text;
    private final String language;

    public NativeQuery(String datasourceId, String text, String language) {
        this.datasourceId = Objects.requireNonNull(datasourceId, "datasourceId");
        this.text = Objects.requireNonNull(text, "text");
        this.language = Objects.requireNonNull(language, "language");
    }

    public String getDatasourceId() {
        return datasourceId;
    }

    public String getText() {
        return text;
    }

    public String getLanguage() {
        return language;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NativeQuery)) return false;
        NativeQuery that = (NativeQuery) o;
        return datasourceId.equals(that.datasourceId) && text.equals(that.text) && language.equals(that.language);
    }

    @Override
    public int hashCode() {
        return Objects.hash(datasourceId, text, language);
    }

    @Override
    public String toString() {
        return language + " query on " + datasourceId + ": " + text;
    }
}
