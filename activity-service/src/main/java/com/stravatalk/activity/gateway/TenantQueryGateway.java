package com.stravatalk.activity.gateway;

import com.stravatalk.activity.error.DatabaseException;
import com.stravatalk.activity.error.OperationTimeoutException;
import com.stravatalk.activity.error.SqlValidationException;
import com.stravatalk.activity.model.CandidateQuery;
import com.stravatalk.activity.model.QueryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for candidate SQL: rewrite, then execute, then report.
 *
 * Failures never escape as exceptions; the caller gets a QueryResult with
 * success=false and a message it may show to the user. Validation messages are
 * passed through verbatim, driver messages are prefixed and timeouts flagged so
 * the caller can retry with a narrower question.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TenantQueryGateway {

    private final SqlRewriter rewriter;
    private final QueryExecutor executor;

    public QueryResult run(CandidateQuery candidate) {
        SafeQuery safe;
        try {
            safe = rewriter.rewrite(candidate);
        } catch (SqlValidationException e) {
            log.info("Rejected candidate query for tenant {}: {}", candidate.tenantId(), e.getMessage());
            return QueryResult.failure(e.getMessage());
        }

        try {
            TabularResult result = executor.execute(safe, candidate.parameters());
            return QueryResult.of(result.columns(), result.rows(), safe.shape().name());
        } catch (IllegalArgumentException e) {
            return QueryResult.failure(e.getMessage());
        } catch (OperationTimeoutException e) {
            return QueryResult.timeout(e.getMessage());
        } catch (DatabaseException e) {
            return QueryResult.failure(e.getMessage());
        }
    }
}
