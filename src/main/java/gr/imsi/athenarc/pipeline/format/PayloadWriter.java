package gr.imsi.athenarc.pipeline.format;

import java.io.IOException;
import java.io.OutputStream;

import gr.imsi.athenarc.pipeline.domain.TabularResult;
import gr.imsi.athenarc.pipeline.query.ResultFormat;

/**
 * Serializer for one result format. Writers emit every row of the result
 * unchanged, in order.
 */
public interface PayloadWriter {

    ResultFormat getFormat();

    String getContentType();

    void write(TabularResult result, ResultMetadata metadata, OutputStream output) throws IOException;
}
