package com.stravatalk.activity.store;

import com.stravatalk.activity.model.SyncStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class SyncStatusRepository {

    private static final RowMapper<SyncStatus> MAPPER = (rs, i) -> SyncStatus.builder()
            .tenantId(rs.getLong("tenant_id"))
            .syncStarted(rs.getObject("sync_started", OffsetDateTime.class))
            .syncCompleted(rs.getBoolean("sync_completed"))
            .lastSyncDate(rs.getObject("last_sync_date", OffsetDateTime.class))
            .totalActivitiesSynced(rs.getInt("total_activities_synced"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public Optional<SyncStatus> find(long tenantId) {
        List<SyncStatus> rows = jdbcTemplate.query("""
                SELECT tenant_id, sync_started, sync_completed, last_sync_date, total_activities_synced
                FROM tenant_sync_status
                WHERE tenant_id = ?
                """, MAPPER, tenantId);
        return rows.stream().findFirst();
    }

    public void markStarted(long tenantId) {
        jdbcTemplate.update("""
                INSERT INTO tenant_sync_status (tenant_id, sync_started, sync_completed)
                VALUES (?, NOW(), FALSE)
                ON CONFLICT (tenant_id) DO UPDATE SET
                    sync_started   = NOW(),
                    sync_completed = FALSE
                """, tenantId);
    }

    public void markCompleted(long tenantId, int activitiesSynced) {
        jdbcTemplate.update("""
                UPDATE tenant_sync_status
                SET sync_completed          = TRUE,
                    last_sync_date          = NOW(),
                    total_activities_synced = ?
                WHERE tenant_id = ?
                """, activitiesSynced, tenantId);
    }
}
