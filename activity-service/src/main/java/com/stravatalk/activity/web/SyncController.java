package com.stravatalk.activity.web;

import com.stravatalk.activity.model.SyncStatus;
import com.stravatalk.activity.service.ActivitySyncService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class SyncController {

    private final ActivitySyncService syncService;

    @PostMapping("/sync/{tenantId}")
    public ResponseEntity<Map<String, String>> trigger(@PathVariable long tenantId) {
        new Thread(() -> syncService.syncQuietly(tenantId), "manual-sync-" + tenantId).start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "tenant_id", String.valueOf(tenantId)));
    }

    @GetMapping("/sync/{tenantId}")
    public ResponseEntity<SyncStatus> status(@PathVariable long tenantId) {
        return ResponseEntity.ok(syncService.status(tenantId));
    }
}
