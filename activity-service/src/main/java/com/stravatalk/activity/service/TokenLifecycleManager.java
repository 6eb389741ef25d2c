package com.stravatalk.activity.service;

import com.stravatalk.activity.config.ActivityServiceProperties;
import com.stravatalk.activity.error.AuthorizationException;
import com.stravatalk.activity.error.UpstreamException;
import com.stravatalk.activity.model.StravaTokenResponse;
import com.stravatalk.activity.model.TenantCredential;
import com.stravatalk.activity.store.TenantCredentialRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands out usable access tokens per tenant, refreshing them shortly before expiry.
 *
 * Within this process refreshes for one tenant are serialised by a lock, and the
 * credential is re-read after acquiring it, so concurrent callers share one refresh.
 * Across processes the rotation is a compare-and-swap on the previous expiry: the
 * loser discards its result and uses the stored one.
 */
@Service
@Slf4j
public class TokenLifecycleManager {

    public static final String SCOPE_READ = "read";
    public static final String SCOPE_READ_ALL = "read,activity:read_all";

    private final TenantCredentialRepository repository;
    private final StravaApiClient stravaApiClient;
    private final ActivityServiceProperties properties;
    private final Clock clock;

    private final ConcurrentMap<Long, ReentrantLock> refreshLocks = new ConcurrentHashMap<>();

    public TokenLifecycleManager(TenantCredentialRepository repository,
                                 StravaApiClient stravaApiClient,
                                 ActivityServiceProperties properties,
                                 Clock clock) {
        this.repository = repository;
        this.stravaApiClient = stravaApiClient;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @return an access token valid for at least the configured skew
     * @throws AuthorizationException if the tenant never connected, revoked access,
     *                                or the provider refused the refresh token
     * @throws UpstreamException      if the provider failed for another reason
     */
    public String getValidToken(long tenantId) {
        TenantCredential credential = load(tenantId);
        if (isFresh(credential)) {
            return credential.getAccessToken();
        }

        ReentrantLock lock = refreshLock(tenantId);
        lock.lock();
        try {
            // another caller may have refreshed while we waited
            TenantCredential current = load(tenantId);
            if (isFresh(current)) {
                return current.getAccessToken();
            }
            return refresh(current);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Complete the OAuth flow: exchange the callback code and store the credential
     * under the athlete it was issued for.
     *
     * @return the stored credential
     */
    public TenantCredential connect(String code, String scope) {
        StravaTokenResponse response;
        try {
            response = stravaApiClient.exchangeCode(code);
        } catch (UpstreamException e) {
            if (e.getStatus() == 400 || e.getStatus() == 401) {
                throw new AuthorizationException("Authorization code was rejected by Strava", e);
            }
            throw e;
        }
        if (response.getAthlete() == null || response.getAthlete().getId() == null) {
            throw new UpstreamException(200, "Token exchange did not identify the athlete");
        }
        TenantCredential credential = TenantCredential.builder()
                .tenantId(response.getAthlete().getId())
                .accessToken(response.getAccessToken())
                .refreshToken(response.getRefreshToken())
                .expiresAt(Instant.ofEpochSecond(response.getExpiresAt()))
                .scope(scope == null || scope.isBlank() ? SCOPE_READ : scope)
                .build();
        repository.upsert(credential);
        log.info("Tenant {} connected with scope {}", credential.getTenantId(), credential.getScope());
        return credential;
    }

    /**
     * Forget the tenant's credential. Safe to call repeatedly. The tenant's refresh
     * lock stays registered so a refresh in flight and any later caller share it.
     */
    public void revoke(long tenantId) {
        if (repository.delete(tenantId)) {
            log.info("Revoked credential for tenant {}", tenantId);
        } else {
            log.debug("No credential to revoke for tenant {}", tenantId);
        }
    }

    /** Provider consent URL for the requested scope. */
    public String authorizationUrl(String scope) {
        ActivityServiceProperties.Strava strava = properties.getStrava();
        return UriComponentsBuilder.fromHttpUrl(strava.getOauthBaseUrl() + "/authorize")
                .queryParam("client_id", strava.getClientId())
                .queryParam("response_type", "code")
                .queryParam("redirect_uri", strava.getRedirectUri())
                .queryParam("approval_prompt", "auto")
                .queryParam("scope", scope)
                .encode()
                .toUriString();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    ReentrantLock refreshLock(long tenantId) {
        return refreshLocks.computeIfAbsent(tenantId, id -> new ReentrantLock());
    }

    private TenantCredential load(long tenantId) {
        return repository.findByTenantId(tenantId)
                .orElseThrow(() -> new AuthorizationException("No Strava credential for tenant " + tenantId));
    }

    private boolean isFresh(TenantCredential credential) {
        return credential.isValidAt(clock.instant().plus(properties.getToken().getRefreshSkew()));
    }

    private String refresh(TenantCredential current) {
        long tenantId = current.getTenantId();
        log.info("Refreshing access token for tenant {} (expires {})", tenantId, current.getExpiresAt());

        StravaTokenResponse response;
        try {
            response = stravaApiClient.refreshToken(current.getRefreshToken());
        } catch (UpstreamException e) {
            if (e.getStatus() == 400 || e.getStatus() == 401) {
                log.warn("Refresh token rejected for tenant {}; re-authorization required", tenantId);
                throw new AuthorizationException("Strava refused the refresh token for tenant " + tenantId
                        + "; the athlete must reconnect", e);
            }
            throw e;
        }

        String refreshToken = response.getRefreshToken() != null ? response.getRefreshToken() : current.getRefreshToken();
        Instant expiresAt = Instant.ofEpochSecond(response.getExpiresAt());
        if (repository.rotate(tenantId, current.getExpiresAt(), response.getAccessToken(), refreshToken, expiresAt)) {
            log.info("Access token refreshed for tenant {} (expires {})", tenantId, expiresAt);
            return response.getAccessToken();
        }

        log.info("Credential for tenant {} was rotated concurrently; using stored token", tenantId);
        return load(tenantId).getAccessToken();
    }
}
