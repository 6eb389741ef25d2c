package com.stravatalk.activity.gateway;

import java.util.List;
import java.util.Map;

/**
 * Columns in select order and every row the statement produced, as ordered maps.
 */
public record TabularResult(List<String> columns, List<Map<String, Object>> rows) {

    public int rowCount() {
        return rows.size();
    }
}
