package com.stravatalk.activity.output;

import com.opencsv.CSVWriter;
import com.stravatalk.activity.model.QueryResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * Renders a successful query result as CSV with a header row of column names.
 */
@Component
@Slf4j
public class QueryResultCsvWriter {

    public String write(QueryResult result) {
        List<String> columns = result.columnNames() == null ? List.of() : result.columnNames();
        StringWriter out = new StringWriter();

        try (CSVWriter writer = new CSVWriter(
                out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            writer.writeNext(columns.toArray(String[]::new));
            if (result.rows() != null) {
                for (Map<String, Object> row : result.rows()) {
                    writer.writeNext(toRow(columns, row));
                }
            }
        } catch (IOException e) {
            log.error("Failed to render query result as CSV: {}", e.getMessage(), e);
            throw new UncheckedIOException("CSV rendering failed", e);
        }

        log.debug("Rendered {} rows as CSV", result.rowCount());
        return out.toString();
    }

    private String[] toRow(List<String> columns, Map<String, Object> row) {
        String[] values = new String[columns.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = str(row.get(columns.get(i)));
        }
        return values;
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
