package com.stravatalk.activity.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Outcome handed to the response-generation layer: the rows, or a message saying why not.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResult(
        boolean success,
        @JsonProperty("column_names") List<String> columnNames,
        List<Map<String, Object>> rows,
        @JsonProperty("row_count") int rowCount,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("timed_out") boolean timedOut,
        String shape) {

    public static QueryResult of(List<String> columns, List<Map<String, Object>> rows, String shape) {
        return new QueryResult(true, columns, rows, rows.size(), null, false, shape);
    }

    public static QueryResult failure(String errorMessage) {
        return new QueryResult(false, null, null, 0, errorMessage, false, null);
    }

    public static QueryResult timeout(String errorMessage) {
        return new QueryResult(false, null, null, 0, errorMessage, true, null);
    }
}
