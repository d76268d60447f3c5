package gr.imsi.athenarc.pipeline.format;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import gr.imsi.athenarc.pipeline.domain.TabularResult;
import gr.imsi.athenarc.pipeline.query.ResultFormat;

/**
 * Single-sheet workbook: a bold header row, then one spreadsheet row per result
 * row. Timestamps are written as UTC date cells.
 *
 * <p>Cell text is written unabridged, so a result with more rows than a
 * worksheet holds, or with a string longer than a cell holds (32767
 * characters), is rejected before the workbook is built.
 */
public class XlsxPayloadWriter implements PayloadWriter {

    public static final String CONTENT_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    public static final String SHEET_NAME = "result";

    private static final String TIMESTAMP_FORMAT = "yyyy-mm-dd hh:mm:ss";

    @Override
    public ResultFormat getFormat() {
        return ResultFormat.XLSX;
    }

    @Override
    public String getContentType() {
        return CONTENT_TYPE;
    }

    @Override
    public void write(TabularResult result, ResultMetadata metadata, OutputStream output) throws IOException {
        int maxRows = SpreadsheetVersion.EXCEL2007.getMaxRows();
        if (result.getRowCount() + 1 > maxRows) {
            throw new IOException("Result has " + result.getRowCount() + " rows, a worksheet holds at most " + (maxRows - 1));
        }
        checkTextLengths(result);
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(SHEET_NAME);

            CellStyle headerStyle = workbook.createCellStyle();
            Font bold = workbook.createFont();
            bold.setBold(true);
            headerStyle.setFont(bold);

            CellStyle timestampStyle = workbook.createCellStyle();
            timestampStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat(TIMESTAMP_FORMAT));

            Row header = sheet.createRow(0);
            List<String> columns = result.getColumns();
            for (int i = 0; i < columns.size(); i++) {
                Cell cell = header.createCell(i);
                cell.setCellValue(columns.get(i));
                cell.setCellStyle(headerStyle);
            }

            int rowIndex = 1;
            for (List<Object> values : result.getRows()) {
                Row row = sheet.createRow(rowIndex++);
                for (int i = 0; i < values.size(); i++) {
                    Object value = values.get(i);
                    if (value == null) {
                        continue;
                    }
                    Cell cell = row.createCell(i);
                    if (value instanceof Instant) {
                        cell.setCellValue(LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC));
                        cell.setCellStyle(timestampStyle);
                    } else if (value instanceof BigDecimal) {
                        cell.setCellValue(((BigDecimal) value).doubleValue());
                    } else if (value instanceof Number) {
                        cell.setCellValue(((Number) value).doubleValue());
                    } else if (value instanceof Boolean) {
                        cell.setCellValue((Boolean) value);
                    } else {
                        cell.setCellValue(value.toString());
                    }
                }
            }
            workbook.write(output);
        }
    }

    private static void checkTextLengths(TabularResult result) throws IOException {
        int maxLength = SpreadsheetVersion.EXCEL2007.getMaxTextLength();
        List<String> columns = result.getColumns();
        int rowIndex = 0;
        for (List<Object> values : result.getRows()) {
            for (int i = 0; i < values.size(); i++) {
                Object value = values.get(i);
                if (value instanceof String && ((String) value).length() > maxLength) {
                    throw new IOException("Value of column " + columns.get(i) + " in row " + rowIndex + " has "
                        + ((String) value).length() + " characters, a cell holds at most " + maxLength);
                }
            }
            rowIndex++;
        }
    }
}
