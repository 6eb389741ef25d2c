package com.stravatalk.activity.gateway;

import com.stravatalk.activity.config.ActivityServiceProperties;
import com.stravatalk.activity.error.DatabaseException;
import com.stravatalk.activity.error.OperationTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs rewritten statements inside a read-only transaction with a hard timeout.
 *
 * Each call sets, local to its own transaction:
 *  - statement_timeout, so the server cancels a runaway statement
 *  - the tenant session setting read by the optional row-level-security policy
 *
 * No row cap is applied here; trimming results is a display concern.
 */
@Component
@Slf4j
public class QueryExecutor {

    private static final String QUERY_CANCELED = "57014";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate readOnlyTx;
    private final ActivityServiceProperties.Gateway config;

    public QueryExecutor(JdbcTemplate jdbcTemplate,
                         PlatformTransactionManager transactionManager,
                         ActivityServiceProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.config = properties.getGateway();
        this.readOnlyTx = new TransactionTemplate(transactionManager);
        this.readOnlyTx.setReadOnly(true);
        this.readOnlyTx.setTimeout((int) Math.max(1, config.getStatementTimeout().toSeconds()));
        this.readOnlyTx.setName("tenant-query");
    }

    public TabularResult execute(SafeQuery query) {
        return execute(query, List.of());
    }

    /**
     * @param query               statement produced by {@link SqlRewriter}
     * @param candidateParameters values for the candidate's own placeholders, in original order
     * @throws OperationTimeoutException if the statement or transaction ran past the deadline
     * @throws DatabaseException         for any other storage failure
     */
    public TabularResult execute(SafeQuery query, List<?> candidateParameters) {
        Object[] parameters = query.bind(candidateParameters).toArray();
        long startedAt = System.nanoTime();
        try {
            TabularResult result = readOnlyTx.execute(status -> {
                jdbcTemplate.queryForObject("SELECT set_config('statement_timeout', ?, true)", String.class,
                        String.valueOf(config.getStatementTimeout().toMillis()));
                jdbcTemplate.queryForObject("SELECT set_config(?, ?, true)", String.class,
                        config.getTenantSetting(), String.valueOf(query.tenantId()));
                return jdbcTemplate.query(query.sql(), ROWS, parameters);
            });
            log.debug("Tenant {} query returned {} rows in {} ms", query.tenantId(),
                    result == null ? 0 : result.rowCount(), (System.nanoTime() - startedAt) / 1_000_000);
            return result;
        } catch (QueryTimeoutException | TransactionTimedOutException e) {
            throw timeout(query, e);
        } catch (DataAccessException e) {
            if (QUERY_CANCELED.equals(sqlState(e))) {
                throw timeout(query, e);
            }
            log.error("Query failed for tenant {}: {}", query.tenantId(), e.getMostSpecificCause().getMessage());
            throw new DatabaseException("Database error: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private static final ResultSetExtractor<TabularResult> ROWS = rs -> {
        ResultSetMetaData meta = rs.getMetaData();
        int count = meta.getColumnCount();
        List<String> columns = new ArrayList<>(count);
        Set<String> seen = new HashSet<>();
        for (int i = 1; i <= count; i++) {
            String label = JdbcUtils.lookupColumnName(meta, i);
            String unique = label;
            for (int n = 2; !seen.add(unique); n++) {
                unique = label + "_" + n;
            }
            columns.add(unique);
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>(count * 2);
            for (int i = 1; i <= count; i++) {
                row.put(columns.get(i - 1), JdbcUtils.getResultSetValue(rs, i));
            }
            rows.add(row);
        }
        return new TabularResult(List.copyOf(columns), rows);
    };

    private OperationTimeoutException timeout(SafeQuery query, Exception cause) {
        log.warn("Query for tenant {} exceeded {}", query.tenantId(), config.getStatementTimeout());
        return new OperationTimeoutException("Query exceeded the " + config.getStatementTimeout().toSeconds()
                + "s time limit", cause);
    }

    private static String sqlState(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql && sql.getSQLState() != null) {
                return sql.getSQLState();
            }
        }
        return null;
    }
}
