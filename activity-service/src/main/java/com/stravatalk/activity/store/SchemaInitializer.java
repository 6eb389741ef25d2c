package com.stravatalk.activity.store;

import com.stravatalk.activity.config.ActivityServiceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class SchemaInitializer {

    private final JdbcTemplate jdbcTemplate;
    private final ActivityServiceProperties properties;

    public void ensureSchema() {
        log.info("Ensuring PostgreSQL schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS activities
            (
                id                    BIGINT PRIMARY KEY,
                tenant_id             BIGINT NOT NULL,
                name                  TEXT,
                distance              DOUBLE PRECISION,
                moving_time           INTEGER,
                elapsed_time          INTEGER,
                total_elevation_gain  DOUBLE PRECISION,
                type                  TEXT,
                start_date            TIMESTAMPTZ,
                updated_at            TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
        """);

        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_activities_tenant_id ON activities (tenant_id)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS tenant_credentials
            (
                tenant_id       BIGINT PRIMARY KEY,
                access_token    TEXT NOT NULL,
                refresh_token   TEXT NOT NULL,
                expires_at      TIMESTAMPTZ NOT NULL,
                scope           TEXT NOT NULL DEFAULT 'read',
                connected_at    TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                updated_at      TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS tenant_sync_status
            (
                tenant_id                BIGINT PRIMARY KEY,
                sync_started             TIMESTAMPTZ,
                sync_completed           BOOLEAN NOT NULL DEFAULT FALSE,
                last_sync_date           TIMESTAMPTZ,
                total_activities_synced  INTEGER NOT NULL DEFAULT 0
            )
        """);

        if (properties.getSchema().isRowLevelSecurity()) {
            enableRowLevelSecurity();
        }

        log.info("PostgreSQL schema ready.");
    }

    /**
     * Second line of defence behind the rewriter: rows are only visible when their
     * tenant matches the transaction-local setting the executor writes. Only binds
     * roles that do not own the table.
     */
    private void enableRowLevelSecurity() {
        String setting = properties.getGateway().getTenantSetting();
        if (!setting.matches("[A-Za-z_][A-Za-z0-9_]*\\.[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalStateException("Invalid tenant setting name: " + setting);
        }
        jdbcTemplate.execute("ALTER TABLE activities ENABLE ROW LEVEL SECURITY");
        jdbcTemplate.execute("DROP POLICY IF EXISTS tenant_activities_policy ON activities");
        jdbcTemplate.execute("""
            CREATE POLICY tenant_activities_policy ON activities
                FOR SELECT
                USING (tenant_id = NULLIF(current_setting('%s', true), '')::BIGINT)
        """.formatted(setting));
        log.info("Row-level security enabled on activities (setting {})", setting);
    }
}
