package com.stravatalk.activity.gateway;

import com.stravatalk.activity.config.ActivityServiceProperties;
import com.stravatalk.activity.error.SqlValidationException;
import com.stravatalk.activity.model.CandidateQuery;
import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Select;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns untrusted candidate SQL plus a session tenant into a {@link SafeQuery}.
 *
 * <p>By the time a SafeQuery exists the following hold:</p>
 * <ul>
 *   <li><b>Single SELECT</b> - one statement, no DDL/DML, no SELECT INTO</li>
 *   <li><b>Known tables only</b> - every base table is in the tenant-scoped set</li>
 *   <li><b>Known functions only</b> - every function call is on the allow-list</li>
 *   <li><b>Tenant bound</b> - every select reading a scoped table carries
 *       {@code tenant_id = ?} in its own WHERE, with the id supplied as a parameter</li>
 * </ul>
 *
 * <p>Rewriting works on the JSqlParser AST, so string literals, comments and
 * unusual formatting cannot move the predicate into the wrong clause.</p>
 */
@Component
@Slf4j
public class SqlRewriter {

    private static final String MARKER_TEXT = ":" + TenantScopeInjector.TENANT_MARKER;

    private final ActivityServiceProperties.Gateway config;
    private final Set<String> scopedTables;
    private final Set<String> allowedFunctions;

    public SqlRewriter(ActivityServiceProperties properties) {
        this.config = properties.getGateway();
        this.scopedTables = lowerCased(config.getTenantScopedTables());
        this.allowedFunctions = lowerCased(config.getAllowedFunctions());
    }

    public SafeQuery rewrite(CandidateQuery candidate) {
        return rewrite(candidate.sql(), candidate.tenantId());
    }

    /**
     * @param candidateSql untrusted SELECT text
     * @param tenantId     tenant from the authenticated session
     * @return rewritten statement and its placeholder layout
     * @throws SqlValidationException if the statement shape is not allowed
     */
    public SafeQuery rewrite(String candidateSql, long tenantId) {
        if (candidateSql == null || candidateSql.isBlank()) {
            throw new SqlValidationException("SQL string cannot be null or blank");
        }

        String body = SqlLexer.stripTerminator(candidateSql);

        Statement statement;
        try {
            statement = CCJSqlParserUtil.parse(body);
        } catch (JSQLParserException e) {
            throw new SqlValidationException("Invalid SQL syntax: " + rootMessage(e), e);
        }
        if (!(statement instanceof Select select)) {
            throw new SqlValidationException(
                    "Only SELECT statements are allowed, got: " + statement.getClass().getSimpleName());
        }

        TenantScopeInjector injector = new TenantScopeInjector(
                config.getTenantColumn(), scopedTables, allowedFunctions, config.getTenantPredicatePolicy());
        injector.apply(select);

        if (injector.strippedPredicates() > 0) {
            log.warn("Removed {} literal {} predicate(s) from candidate query for tenant {}",
                    injector.strippedPredicates(), config.getTenantColumn(), tenantId);
        }

        SafeQuery safe = layoutPlaceholders(select.toString(), tenantId,
                injector.isAggregate() ? QueryShape.AGGREGATE : QueryShape.ROW_LEVEL);

        if (safe.tenantPlaceholderCount() != injector.injectedPredicates()) {
            throw new SqlValidationException("Could not bind tenant scope to every table reference");
        }
        log.debug("Rewrote {} query for tenant {}: {}", safe.shape(), tenantId, safe.sql());
        return safe;
    }

    /**
     * Replaces tenant markers with {@code ?} and records which placeholder is which,
     * in the order they appear in the final text.
     */
    private static SafeQuery layoutPlaceholders(String deparsed, long tenantId, QueryShape shape) {
        byte[] kinds = SqlLexer.classify(deparsed);
        StringBuilder sql = new StringBuilder(deparsed.length());
        List<SafeQuery.Slot> slots = new ArrayList<>();
        int candidateIndex = 0;

        int i = 0;
        while (i < deparsed.length()) {
            char c = deparsed.charAt(i);
            if (kinds[i] == SqlLexer.CODE && c == ':' && deparsed.startsWith(MARKER_TEXT, i)) {
                sql.append('?');
                slots.add(SafeQuery.Slot.TENANT);
                i += MARKER_TEXT.length();
                continue;
            }
            if (kinds[i] == SqlLexer.CODE && c == '?') {
                slots.add(new SafeQuery.Slot(candidateIndex++));
            }
            sql.append(c);
            i++;
        }
        return new SafeQuery(sql.toString(), tenantId, shape, slots);
    }

    private static Set<String> lowerCased(List<String> names) {
        return names.stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage() == null ? e.getMessage() : root.getMessage();
        return message == null ? "unparseable statement" : message.lines().findFirst().orElse(message);
    }
}
