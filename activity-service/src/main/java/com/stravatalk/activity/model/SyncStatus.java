package com.stravatalk.activity.model;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

/**
 * Historical sync progress for one tenant.
 * Stored in the tenant_sync_status table.
 */
@Data
@Builder
public class SyncStatus {

    private Long tenantId;
    private OffsetDateTime syncStarted;
    private boolean syncCompleted;
    private OffsetDateTime lastSyncDate;
    private int totalActivitiesSynced;
    /** Rows currently stored for the tenant, filled in when reporting. */
    private long activityCount;
}
