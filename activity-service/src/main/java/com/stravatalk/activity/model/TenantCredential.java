package com.stravatalk.activity.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * OAuth material for one tenant. Exactly one live row per tenant.
 */
@Data
@Builder(toBuilder = true)
public class TenantCredential {

    private Long tenantId;
    private String accessToken;
    private String refreshToken;
    private Instant expiresAt;
    private String scope;

    public boolean isValidAt(Instant instant) {
        return expiresAt != null && expiresAt.isAfter(instant);
    }

    @Override
    public String toString() {
        return "TenantCredential(tenantId=" + tenantId + ", expiresAt=" + expiresAt + ", scope=" + scope + ")";
    }
}
