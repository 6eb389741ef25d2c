package com.stravatalk.activity.service;

import com.stravatalk.activity.config.ActivityServiceProperties;
import com.stravatalk.activity.model.StravaActivity;
import com.stravatalk.activity.model.SyncStatus;
import com.stravatalk.activity.store.SyncStatusRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Pulls a tenant's full activity history through the paged list endpoint.
 *
 * Used once after an athlete connects; webhooks keep the table current afterwards.
 * Rows go through the same reconciler as webhook events, so a sync overlapping
 * with live deliveries converges on the same state.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ActivitySyncService {

    private final StravaApiClient stravaApiClient;
    private final TokenLifecycleManager tokenManager;
    private final ActivityMapper mapper;
    private final ActivityReconciler reconciler;
    private final SyncStatusRepository syncStatusRepository;
    private final ActivityServiceProperties properties;

    /**
     * @return number of activities stored for the tenant by this run
     */
    public int sync(long tenantId) {
        log.info("Starting historical sync for tenant {}", tenantId);
        syncStatusRepository.markStarted(tenantId);

        int pageSize = Math.min(Math.max(properties.getSync().getPageSize(), 1), 200);
        int stored = 0;
        int page = 1;
        while (true) {
            String token = tokenManager.getValidToken(tenantId);
            List<StravaActivity> activities = stravaApiClient.fetchActivitiesPage(token, page, pageSize);
            for (StravaActivity raw : activities) {
                if (raw.getId() != null && reconciler.upsert(mapper.map(raw, tenantId), tenantId)) {
                    stored++;
                }
            }
            log.debug("Tenant {} page {}: {} activities", tenantId, page, activities.size());
            if (activities.size() < pageSize) {
                break;
            }
            page++;
        }

        syncStatusRepository.markCompleted(tenantId, stored);
        log.info("Historical sync complete for tenant {}: {} activities over {} page(s)", tenantId, stored, page);
        return stored;
    }

    /** Background variant for the manual trigger; failures are logged, status stays incomplete. */
    public void syncQuietly(long tenantId) {
        try {
            sync(tenantId);
        } catch (Exception e) {
            log.error("Historical sync failed for tenant {}: {}", tenantId, e.getMessage(), e);
        }
    }

    public SyncStatus status(long tenantId) {
        SyncStatus status = syncStatusRepository.find(tenantId)
                .orElseGet(() -> SyncStatus.builder().tenantId(tenantId).build());
        status.setActivityCount(reconciler.countForTenant(tenantId));
        return status;
    }
}
