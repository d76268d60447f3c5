package gr.imsi.athenarc.pipeline.format;

import java.nio.charset.StandardCharsets;
import java.util.List;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.pipeline.query.ResultFormat;

/**
 * Serialized response body plus what a transport layer needs to send it.
 */
public final class FormattedPayload {

    private final ResultFormat format;
    private final String contentType;
    private final byte[] body;
    private final int rowCount;
    private final List<String> columns;

    public FormattedPayload(ResultFormat format, String contentType, byte[] body, int rowCount, List<String> columns) {
        this.format = format;
        this.contentType = contentType;
        this.body = body.clone();
        this.rowCount = rowCount;
        this.columns = ImmutableList.copyOf(columns);
    }

    public ResultFormat getFormat() {
        return format;
    }

    public String getContentType() {
        return contentType;
    }

    public byte[] getBody() {
        return body.clone();
    }

    /**
     * @return the body decoded as UTF-8; meaningful for the text formats only
     */
    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public int getSize() {
        return body.length;
    }

    public int getRowCount() {
        return rowCount;
    }

    public List<String> getColumns() {
        return columns;
    }

    @Override
    public String toString() {
        return "FormattedPayload{" + format + ", " + body.length + " bytes, " + rowCount + " rows}";
    }
}
