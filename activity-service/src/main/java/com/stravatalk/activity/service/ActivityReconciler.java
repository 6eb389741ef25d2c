package com.stravatalk.activity.service;

import com.stravatalk.activity.error.DatabaseException;
import com.stravatalk.activity.model.Activity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies activity create/update/delete to the shared table.
 *
 * Every write is keyed by the immutable activity id and scoped by the owning tenant,
 * so any redelivery or reordering of the same event converges on the same row.
 * A row is never moved from one tenant to another.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ActivityReconciler {

    /** Columns an update event may touch. */
    private static final Set<String> PATCHABLE_COLUMNS = Set.of("name", "type");

    private final JdbcTemplate jdbcTemplate;

    /**
     * Insert the activity, or replace every field of the existing row for the same
     * tenant.
     *
     * @return false if the id already belongs to another tenant; that row is left untouched
     */
    public boolean upsert(Activity activity, long ownerTenantId) {
        try {
            int rows = jdbcTemplate.update("""
                    INSERT INTO activities
                        (id, tenant_id, name, distance, moving_time, elapsed_time,
                         total_elevation_gain, type, start_date, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, NOW())
                    ON CONFLICT (id) DO UPDATE SET
                        name                 = EXCLUDED.name,
                        distance             = EXCLUDED.distance,
                        moving_time          = EXCLUDED.moving_time,
                        elapsed_time         = EXCLUDED.elapsed_time,
                        total_elevation_gain = EXCLUDED.total_elevation_gain,
                        type                 = EXCLUDED.type,
                        start_date           = EXCLUDED.start_date,
                        updated_at           = NOW()
                    WHERE activities.tenant_id = EXCLUDED.tenant_id
                    """,
                    activity.getId(),
                    ownerTenantId,
                    activity.getName(),
                    activity.getDistance(),
                    activity.getMovingTime(),
                    activity.getElapsedTime(),
                    activity.getTotalElevationGain(),
                    activity.getType(),
                    activity.getStartDate() == null ? null : Timestamp.from(activity.getStartDate().toInstant()));
            if (rows == 0) {
                log.warn("Activity {} belongs to another tenant; ignoring write for tenant {}",
                        activity.getId(), ownerTenantId);
                return false;
            }
            log.debug("Upserted activity {} for tenant {}", activity.getId(), ownerTenantId);
            return true;
        } catch (DataAccessException e) {
            throw translate("upsert activity " + activity.getId(), e);
        }
    }

    /**
     * Set only the supplied columns of an existing row.
     *
     * @param columns column → value; keys outside the patchable set are refused
     * @return true if a row changed, false if the tenant has no such activity
     */
    public boolean patch(long activityId, long tenantId, Map<String, Object> columns) {
        if (columns.isEmpty()) {
            return false;
        }
        List<String> assignments = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        for (Map.Entry<String, Object> entry : columns.entrySet()) {
            if (!PATCHABLE_COLUMNS.contains(entry.getKey())) {
                throw new IllegalArgumentException("Column cannot be patched: " + entry.getKey());
            }
            assignments.add(entry.getKey() + " = ?");
            args.add(entry.getValue());
        }
        args.add(activityId);
        args.add(tenantId);

        String sql = "UPDATE activities SET " + String.join(", ", assignments)
                + ", updated_at = NOW() WHERE id = ? AND tenant_id = ?";
        try {
            return jdbcTemplate.update(sql, args.toArray()) > 0;
        } catch (DataAccessException e) {
            throw translate("patch activity " + activityId, e);
        }
    }

    /** Remove the tenant's row; a missing row is not an error. */
    public boolean delete(long activityId, long tenantId) {
        try {
            return jdbcTemplate.update("DELETE FROM activities WHERE id = ? AND tenant_id = ?",
                    activityId, tenantId) > 0;
        } catch (DataAccessException e) {
            throw translate("delete activity " + activityId, e);
        }
    }

    public long countForTenant(long tenantId) {
        try {
            Long count = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM activities WHERE tenant_id = ?", Long.class, tenantId);
            return count == null ? 0 : count;
        } catch (DataAccessException e) {
            throw translate("count activities", e);
        }
    }

    private DatabaseException translate(String operation, DataAccessException e) {
        log.error("Failed to {}: {}", operation, e.getMostSpecificCause().getMessage());
        return new DatabaseException("Failed to " + operation, e);
    }
}
