package com.stravatalk.activity.gateway;

import com.stravatalk.activity.config.ActivityServiceProperties;
import com.stravatalk.activity.config.ActivityServiceProperties.Gateway.TenantPredicatePolicy;
import com.stravatalk.activity.error.SqlValidationException;
import com.stravatalk.activity.model.CandidateQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SqlRewriter")
class SqlRewriterTest {

    private static final long TENANT = 42L;

    private SqlRewriter rewriter;

    @BeforeEach
    void setUp() {
        rewriter = new SqlRewriter(new ActivityServiceProperties());
    }

    @Nested
    @DisplayName("tenant predicate injection")
    class Injection {

        @Test
        void mergesPredicateIntoExistingWhere() {
            SafeQuery safe = rewriter.rewrite(new CandidateQuery("SELECT COUNT(*) FROM activities WHERE type='Run'", TENANT));

            assertThat(safe.sql()).isEqualTo("SELECT COUNT(*) FROM activities WHERE tenant_id = ? AND type = 'Run'");
            assertThat(safe.parameters()).containsExactly(TENANT);
            assertThat(safe.shape()).isEqualTo(QueryShape.AGGREGATE);
        }

        @Test
        void createsWhereBeforeGroupOrderAndLimit() {
            SafeQuery safe = rewriter.rewrite(
                    "SELECT type, SUM(distance) FROM activities GROUP BY type ORDER BY type LIMIT 5", TENANT);

            String sql = safe.sql();
            assertThat(sql).contains("FROM activities WHERE tenant_id = ?");
            assertThat(sql.indexOf("WHERE")).isLessThan(sql.indexOf("GROUP BY"));
            assertThat(sql.indexOf("GROUP BY")).isLessThan(sql.indexOf("ORDER BY"));
            assertThat(sql.indexOf("ORDER BY")).isLessThan(sql.indexOf("LIMIT"));
            assertThat(safe.parameters()).containsExactly(TENANT);
        }

        @Test
        void parenthesisesDisjunctionBeforeMerging() {
            SafeQuery safe = rewriter.rewrite(
                    "SELECT name FROM activities WHERE type = 'Run' OR type = 'Ride'", TENANT);

            assertThat(safe.sql()).isEqualTo(
                    "SELECT name FROM activities WHERE tenant_id = ? AND (type = 'Run' OR type = 'Ride')");
            assertThat(safe.shape()).isEqualTo(QueryShape.ROW_LEVEL);
        }

        @Test
        void scopesEverySubquery() {
            SafeQuery safe = rewriter.rewrite(
                    "SELECT name FROM activities WHERE distance > (SELECT AVG(distance) FROM activities)", TENANT);

            assertThat(safe.tenantPlaceholderCount()).isEqualTo(2);
            assertThat(safe.sql()).contains("(SELECT AVG(distance) FROM activities WHERE tenant_id = ?)");
            assertThat(safe.parameters()).containsExactly(TENANT, TENANT);
        }

        @Test
        void qualifiesPredicateByAliasOnJoins() {
            SafeQuery safe = rewriter.rewrite(
                    "SELECT a.name FROM activities a JOIN activities b ON a.id = b.id", TENANT);

            assertThat(safe.sql()).contains("a.tenant_id = ?").contains("b.tenant_id = ?");
            assertThat(safe.tenantPlaceholderCount()).isEqualTo(2);
        }

        @Test
        void scopesCommonTableExpressionBody() {
            SafeQuery safe = rewriter.rewrite(
                    "WITH runs AS (SELECT * FROM activities WHERE type = 'Run') SELECT COUNT(*) FROM runs", TENANT);

            assertThat(safe.tenantPlaceholderCount()).isEqualTo(1);
            assertThat(safe.sql()).contains("FROM activities WHERE tenant_id = ? AND type = 'Run'");
        }

        @Test
        void scopesParenthesisedTable() {
            SafeQuery safe = rewriter.rewrite("SELECT * FROM (activities)", TENANT);

            assertThat(safe.tenantPlaceholderCount()).isEqualTo(1);
            assertThat(safe.sql()).endsWith("WHERE tenant_id = ?");
            assertThat(safe.parameters()).containsExactly(TENANT);
        }

        @Test
        void scopesEveryTableOfParenthesisedJoin() {
            SafeQuery safe = rewriter.rewrite(
                    "SELECT a.name FROM (activities a JOIN activities b ON a.id = b.id)", TENANT);

            assertThat(safe.sql()).contains("a.tenant_id = ?").contains("b.tenant_id = ?");
            assertThat(safe.tenantPlaceholderCount()).isEqualTo(2);
        }

        @Test
        void acceptsAllowListedFunctions() {
            SafeQuery safe = rewriter.rewrite(
                    "SELECT date_trunc('month', start_date) AS month, ROUND(SUM(distance)) FROM activities GROUP BY 1",
                    TENANT);

            assertThat(safe.tenantPlaceholderCount()).isEqualTo(1);
            assertThat(safe.shape()).isEqualTo(QueryShape.AGGREGATE);
            assertThat(rewriter.rewrite(
                    "SELECT name, rank() OVER (ORDER BY distance DESC) FROM activities", TENANT).tenantPlaceholderCount())
                    .isEqualTo(1);
        }

        @Test
        void neverInterpolatesTenantId() {
            SafeQuery safe = rewriter.rewrite("SELECT name FROM activities", 987654321L);

            assertThat(safe.sql()).doesNotContain("987654321");
            assertThat(safe.parameters()).containsExactly(987654321L);
        }

        @Test
        void acceptsSingleTrailingSemicolon() {
            SafeQuery safe = rewriter.rewrite("SELECT name FROM activities WHERE name = 'a;b';", TENANT);

            assertThat(safe.sql()).isEqualTo("SELECT name FROM activities WHERE tenant_id = ? AND name = 'a;b'");
        }
    }

    @Nested
    @DisplayName("tenant column in candidate")
    class CandidateTenantColumn {

        @Test
        void enforcedTenantReplacesLiteralComparison() {
            SafeQuery safe = rewriter.rewrite(
                    "SELECT * FROM activities WHERE tenant_id = 7 AND type = 'Run'", TENANT);

            assertThat(safe.sql()).isEqualTo("SELECT * FROM activities WHERE tenant_id = ? AND type = 'Run'");
            assertThat(safe.parameters()).containsExactly(TENANT);
        }

        @Test
        void stripsReversedLiteralComparison() {
            SafeQuery safe = rewriter.rewrite("SELECT name FROM activities WHERE 7 = tenant_id", TENANT);

            assertThat(safe.sql()).isEqualTo("SELECT name FROM activities WHERE tenant_id = ?");
        }

        @Test
        void rejectPolicyRefusesAnyReference() {
            ActivityServiceProperties properties = new ActivityServiceProperties();
            properties.getGateway().setTenantPredicatePolicy(TenantPredicatePolicy.REJECT);
            SqlRewriter strict = new SqlRewriter(properties);

            assertThatThrownBy(() -> strict.rewrite("SELECT * FROM activities WHERE tenant_id = 7", TENANT))
                    .isInstanceOf(SqlValidationException.class)
                    .hasMessageContaining("tenant_id");
            assertThat(strict.rewrite("SELECT name FROM activities", TENANT).sql())
                    .isEqualTo("SELECT name FROM activities WHERE tenant_id = ?");
        }
    }

    @Nested
    @DisplayName("rejected statements")
    class Rejections {

        @Test
        void rejectsStackedStatements() {
            assertThatThrownBy(() -> rewriter.rewrite("SELECT 1; DROP TABLE activities;", TENANT))
                    .isInstanceOf(SqlValidationException.class)
                    .hasMessageContaining("single SELECT");
        }

        @Test
        void rejectsStatementsOtherThanSelect() {
            assertThatThrownBy(() -> rewriter.rewrite("DROP TABLE activities", TENANT))
                    .isInstanceOf(SqlValidationException.class)
                    .hasMessageContaining("Only SELECT");
            assertThatThrownBy(() -> rewriter.rewrite("DELETE FROM activities WHERE id = 1", TENANT))
                    .isInstanceOf(SqlValidationException.class);
        }

        @Test
        void rejectsSelectInto() {
            assertThatThrownBy(() -> rewriter.rewrite("SELECT * INTO stolen FROM activities", TENANT))
                    .isInstanceOf(SqlValidationException.class)
                    .hasMessageContaining("INTO");
        }

        @Test
        void rejectsTablesOutsideTheScopedSet() {
            assertThatThrownBy(() -> rewriter.rewrite("SELECT access_token FROM tenant_credentials", TENANT))
                    .isInstanceOf(SqlValidationException.class)
                    .hasMessageContaining("tenant_credentials");
        }

        @Test
        void rejectsSchemaQualifiedTables() {
            assertThatThrownBy(() -> rewriter.rewrite("SELECT * FROM public.activities", TENANT))
                    .isInstanceOf(SqlValidationException.class);
        }

        @Test
        void rejectsFunctionsOffTheAllowList() {
            assertThatThrownBy(() -> rewriter.rewrite("SELECT pg_sleep(10) FROM activities", TENANT))
                    .isInstanceOf(SqlValidationException.class)
                    .hasMessageContaining("pg_sleep");
        }

        @Test
        void rejectsFunctionsThatRunQueryText() {
            assertThatThrownBy(() -> rewriter.rewrite(
                    "SELECT query_to_xml('select * from activities', true, false, '')", TENANT))
                    .isInstanceOf(SqlValidationException.class)
                    .hasMessageContaining("query_to_xml");
        }

        @Test
        void rejectsFunctionsThatDumpTablesByName() {
            assertThatThrownBy(() -> rewriter.rewrite("SELECT table_to_xml('activities', true, false, '')", TENANT))
                    .isInstanceOf(SqlValidationException.class)
                    .hasMessageContaining("table_to_xml");
        }

        @Test
        void rejectsTableFunctionsInFrom() {
            assertThatThrownBy(() -> rewriter.rewrite("SELECT * FROM pg_read_file('/etc/passwd')", TENANT))
                    .isInstanceOf(SqlValidationException.class)
                    .hasMessageContaining("pg_read_file");
        }

        @Test
        void rejectsSchemaQualifiedFunctions() {
            assertThatThrownBy(() -> rewriter.rewrite("SELECT pg_catalog.lower(name) FROM activities", TENANT))
                    .isInstanceOf(SqlValidationException.class);
        }

        @Test
        void rejectsAliasedParenthesisedJoin() {
            assertThatThrownBy(() -> rewriter.rewrite(
                    "SELECT * FROM (activities a JOIN activities b ON a.id = b.id) AS pair", TENANT))
                    .isInstanceOf(SqlValidationException.class);
        }

        @Test
        void rejectsNamedPlaceholders() {
            assertThatThrownBy(() -> rewriter.rewrite("SELECT * FROM activities WHERE type = :type", TENANT))
                    .isInstanceOf(SqlValidationException.class);
        }

        @Test
        void rejectsGarbageAndBlankInput() {
            assertThatThrownBy(() -> rewriter.rewrite("SELEC name FRM activities", TENANT))
                    .isInstanceOf(SqlValidationException.class)
                    .hasMessageStartingWith("Invalid SQL syntax");
            assertThatThrownBy(() -> rewriter.rewrite("   ", TENANT))
                    .isInstanceOf(SqlValidationException.class);
        }
    }

    @Nested
    @DisplayName("candidate placeholders")
    class CandidatePlaceholders {

        @Test
        void bindsTenantAndCandidateValuesInTextualOrder() {
            SafeQuery safe = rewriter.rewrite(
                    "SELECT name FROM activities WHERE distance > (SELECT AVG(distance) FROM activities WHERE type = ?) AND type = ?",
                    TENANT);

            assertThat(safe.candidatePlaceholderCount()).isEqualTo(2);
            assertThat(safe.bind(List.of("Run", "Ride"))).containsExactly(TENANT, TENANT, "Run", "Ride");
        }
    }
}
