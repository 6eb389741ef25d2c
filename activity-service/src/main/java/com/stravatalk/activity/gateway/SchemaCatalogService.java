package com.stravatalk.activity.gateway;

import com.stravatalk.activity.config.ActivityServiceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Describes the queryable tables to the SQL-producing layer. The tenant column is
 * left out so it is never invited to write its own tenant filter.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SchemaCatalogService {

    private static final Map<String, String> TABLE_DESCRIPTIONS = Map.of(
            "activities", "Table containing a user's Strava activity records");

    private static final Map<String, String> COLUMN_DESCRIPTIONS = Map.of(
            "id", "unique identifier for each activity",
            "name", "name of the activity",
            "distance", "total distance covered in meters",
            "moving_time", "time spent moving in seconds",
            "elapsed_time", "total elapsed time in seconds",
            "total_elevation_gain", "total elevation gain in meters",
            "type", "type of activity (e.g., Run, Ride, Swim)",
            "start_date", "when the activity started");

    public record ColumnDefinition(String name, String type, String description) {}

    public record TableDefinition(String name, String description, List<ColumnDefinition> columns) {}

    private final JdbcTemplate jdbcTemplate;
    private final ActivityServiceProperties properties;

    public List<TableDefinition> tableDefinitions() {
        String tenantColumn = properties.getGateway().getTenantColumn();
        return properties.getGateway().getTenantScopedTables().stream()
                .map(table -> new TableDefinition(table,
                        TABLE_DESCRIPTIONS.getOrDefault(table, ""),
                        columnsOf(table, tenantColumn)))
                .toList();
    }

    private List<ColumnDefinition> columnsOf(String table, String tenantColumn) {
        List<ColumnDefinition> columns = jdbcTemplate.query("""
                SELECT column_name, data_type
                FROM information_schema.columns
                WHERE table_schema = current_schema()
                  AND table_name = ?
                  AND column_name <> ?
                ORDER BY ordinal_position
                """,
                (rs, i) -> new ColumnDefinition(
                        rs.getString("column_name"),
                        rs.getString("data_type"),
                        COLUMN_DESCRIPTIONS.getOrDefault(rs.getString("column_name"), "")),
                table, tenantColumn);
        log.debug("Table {} exposes {} columns", table, columns.size());
        return columns;
    }
}
