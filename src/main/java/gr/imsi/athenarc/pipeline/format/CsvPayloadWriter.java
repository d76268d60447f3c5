package gr.imsi.athenarc.pipeline.format;

import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;

import gr.imsi.athenarc.pipeline.domain.TabularResult;
import gr.imsi.athenarc.pipeline.query.ResultFormat;

/**
 * Header row followed by one line per result row. Nulls become empty fields.
 */
public class CsvPayloadWriter implements PayloadWriter {

    public static final String CONTENT_TYPE = "text/csv; charset=utf-8";

    @Override
    public ResultFormat getFormat() {
        return ResultFormat.CSV;
    }

    @Override
    public String getContentType() {
        return CONTENT_TYPE;
    }

    @Override
    public void write(TabularResult result, ResultMetadata metadata, OutputStream output) {
        CsvWriter csvWriter = new CsvWriter(output, StandardCharsets.UTF_8, new CsvWriterSettings());
        csvWriter.writeHeaders(result.getColumns());
        for (List<Object> row : result.getRows()) {
            for (Object value : row) {
                csvWriter.addValue(csvValue(value));
            }
            csvWriter.writeValuesToRow();
        }
        csvWriter.flush();
    }

    static String csvValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        return value.toString();
    }
}
