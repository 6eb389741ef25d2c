package com.stravatalk.activity.store;

import com.stravatalk.activity.model.TenantCredential;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persists one OAuth credential per tenant. Every mutation is a single statement,
 * so a credential is never seen half-rotated.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class TenantCredentialRepository {

    private static final RowMapper<TenantCredential> MAPPER = (rs, i) -> TenantCredential.builder()
            .tenantId(rs.getLong("tenant_id"))
            .accessToken(rs.getString("access_token"))
            .refreshToken(rs.getString("refresh_token"))
            .expiresAt(rs.getTimestamp("expires_at").toInstant())
            .scope(rs.getString("scope"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public Optional<TenantCredential> findByTenantId(long tenantId) {
        List<TenantCredential> rows = jdbcTemplate.query("""
                SELECT tenant_id, access_token, refresh_token, expires_at, scope
                FROM tenant_credentials
                WHERE tenant_id = ?
                """, MAPPER, tenantId);
        return rows.stream().findFirst();
    }

    /** Insert, or replace the existing credential for the same tenant. */
    public void upsert(TenantCredential credential) {
        jdbcTemplate.update("""
                INSERT INTO tenant_credentials (tenant_id, access_token, refresh_token, expires_at, scope)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT (tenant_id) DO UPDATE SET
                    access_token  = EXCLUDED.access_token,
                    refresh_token = EXCLUDED.refresh_token,
                    expires_at    = EXCLUDED.expires_at,
                    scope         = EXCLUDED.scope,
                    updated_at    = NOW()
                """,
                credential.getTenantId(),
                credential.getAccessToken(),
                credential.getRefreshToken(),
                Timestamp.from(credential.getExpiresAt()),
                credential.getScope() == null ? "read" : credential.getScope());
        log.info("Stored credential for tenant {} (expires {})", credential.getTenantId(), credential.getExpiresAt());
    }

    /**
     * Replaces access token, refresh token and expiry together, but only if the stored
     * expiry is still the one the caller refreshed from.
     *
     * @return false when another writer rotated the credential first
     */
    public boolean rotate(long tenantId, Instant previousExpiry,
                          String accessToken, String refreshToken, Instant expiresAt) {
        int updated = jdbcTemplate.update("""
                UPDATE tenant_credentials
                SET access_token  = ?,
                    refresh_token = ?,
                    expires_at    = ?,
                    updated_at    = NOW()
                WHERE tenant_id = ?
                  AND expires_at = ?
                """,
                accessToken, refreshToken, Timestamp.from(expiresAt), tenantId, Timestamp.from(previousExpiry));
        return updated == 1;
    }

    /** @return true if a credential was removed */
    public boolean delete(long tenantId) {
        return jdbcTemplate.update("DELETE FROM tenant_credentials WHERE tenant_id = ?", tenantId) > 0;
    }
}
