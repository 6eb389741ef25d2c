package com.stravatalk.activity.gateway;

import com.stravatalk.activity.config.ActivityServiceProperties.Gateway.TenantPredicatePolicy;
import com.stravatalk.activity.error.SqlValidationException;
import net.sf.jsqlparser.expression.AnalyticExpression;
import net.sf.jsqlparser.expression.CastExpression;
import net.sf.jsqlparser.expression.DoubleValue;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.JdbcNamedParameter;
import net.sf.jsqlparser.expression.JdbcParameter;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.Parenthesis;
import net.sf.jsqlparser.expression.SignedExpression;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.conditional.OrExpression;
import net.sf.jsqlparser.expression.operators.conditional.XorExpression;
import net.sf.jsqlparser.expression.operators.relational.EqualsTo;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.GroupByElement;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.ParenthesedFromItem;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.TableFunction;
import net.sf.jsqlparser.statement.select.WithItem;
import net.sf.jsqlparser.util.TablesNamesFinder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Walks a parsed SELECT and bounds every nested select that reads a tenant-scoped
 * table with {@code <tenant column> = :marker}, merged into that select's own WHERE.
 *
 * <p>The walk reuses {@link TablesNamesFinder}'s traversal so sub-selects in the select
 * list, FROM, joins, WHERE, HAVING, CTE bodies and set-operation branches are all
 * reached. Single use: create one per statement.</p>
 *
 * <p>Functions are checked against an allow-list: anything not named there, and any
 * schema-qualified function, is refused. After the walk every reference to a scoped
 * table must have received its own predicate, otherwise the statement is refused.</p>
 */
class TenantScopeInjector extends TablesNamesFinder {

    static final String TENANT_MARKER = "__tenant_scope__";

    private static final Set<String> AGGREGATES = Set.of("count", "sum", "avg", "min", "max");

    private final String tenantColumn;
    private final Set<String> scopedTables;
    private final Set<String> allowedFunctions;
    private final TenantPredicatePolicy policy;

    private final Set<String> cteNames = new HashSet<>();
    private final Set<Column> injectedColumns = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<PlainSelect> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<Table> scopedReferences = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<Table> boundReferences = Collections.newSetFromMap(new IdentityHashMap<>());

    private boolean aggregate;
    private int injectedPredicates;
    private int strippedPredicates;

    TenantScopeInjector(String tenantColumn, Set<String> scopedTables, Set<String> allowedFunctions,
                        TenantPredicatePolicy policy) {
        this.tenantColumn = tenantColumn.toLowerCase(Locale.ROOT);
        this.scopedTables = scopedTables;
        this.allowedFunctions = allowedFunctions;
        this.policy = policy;
    }

    void apply(Select select) {
        getTables((Statement) select);
        for (Table table : scopedReferences) {
            if (!boundReferences.contains(table)) {
                throw new SqlValidationException("Could not bind tenant scope to table reference "
                        + table.getName() + "; move it into a plain FROM or JOIN");
            }
        }
    }

    boolean isAggregate() {
        return aggregate;
    }

    int injectedPredicates() {
        return injectedPredicates;
    }

    int strippedPredicates() {
        return strippedPredicates;
    }

    @Override
    public void visit(PlainSelect plainSelect) {
        if (!visited.add(plainSelect)) {
            return;
        }
        if (plainSelect.getIntoTables() != null && !plainSelect.getIntoTables().isEmpty()) {
            throw new SqlValidationException("SELECT ... INTO is not allowed");
        }
        if (plainSelect.getGroupBy() != null) {
            aggregate = true;
        }

        List<Table> scoped = scopedTablesOf(plainSelect);
        if (!scoped.isEmpty()) {
            Expression where = plainSelect.getWhere();
            if (policy == TenantPredicatePolicy.OVERRIDE) {
                where = stripLiteralTenantPredicates(where);
            }
            boolean qualify = scoped.size() > 1
                    || (plainSelect.getJoins() != null && !plainSelect.getJoins().isEmpty())
                    || joinsInside(plainSelect.getFromItem());
            Expression bound = null;
            for (Table table : scoped) {
                Expression predicate = tenantPredicate(table, qualify);
                bound = bound == null ? predicate : new AndExpression(bound, predicate);
                boundReferences.add(table);
                injectedPredicates++;
            }
            plainSelect.setWhere(where == null ? bound : new AndExpression(bound, parenthesiseIfNeeded(where)));
        }

        super.visit(plainSelect);

        GroupByElement groupBy = plainSelect.getGroupBy();
        if (groupBy != null && groupBy.getGroupByExpressionList() != null) {
            for (Object expression : groupBy.getGroupByExpressionList()) {
                ((Expression) expression).accept(this);
            }
        }
        if (plainSelect.getOrderByElements() != null) {
            for (OrderByElement element : plainSelect.getOrderByElements()) {
                element.getExpression().accept(this);
            }
        }
    }

    @Override
    public void visit(WithItem withItem) {
        String name = withItem.getAlias() == null ? null : withItem.getAlias().getName();
        if (name != null) {
            String normalised = unquote(name);
            if (scopedTables.contains(normalised)) {
                throw new SqlValidationException("Common table expression may not shadow table " + name);
            }
            cteNames.add(normalised);
        }
        super.visit(withItem);
    }

    @Override
    public void visit(Table table) {
        String name = unquote(table.getName());
        if (!cteNames.contains(name)) {
            if (table.getSchemaName() != null) {
                throw new SqlValidationException("Schema-qualified table references are not allowed: "
                        + table.getFullyQualifiedName());
            }
            if (!scopedTables.contains(name)) {
                throw new SqlValidationException("Table is not available for queries: " + table.getName());
            }
            scopedReferences.add(table);
        }
        super.visit(table);
    }

    @Override
    public void visit(ParenthesedFromItem parenthesed) {
        if (parenthesed.getAlias() != null) {
            throw new SqlValidationException("Aliased parenthesised FROM items are not supported: "
                    + parenthesed.getAlias().getName());
        }
        super.visit(parenthesed);
    }

    @Override
    public void visit(TableFunction tableFunction) {
        tableFunction.getFunction().accept(this);
        super.visit(tableFunction);
    }

    @Override
    public void visit(Column column) {
        if (!injectedColumns.contains(column) && tenantColumn.equals(unquote(column.getColumnName()))
                && policy == TenantPredicatePolicy.REJECT) {
            throw new SqlValidationException("Query may not reference " + tenantColumn
                    + "; tenant scoping is applied by the gateway");
        }
        super.visit(column);
    }

    @Override
    public void visit(Function function) {
        String name = checkFunction(function.getName());
        if (AGGREGATES.contains(name)) {
            aggregate = true;
        }
        super.visit(function);
    }

    @Override
    public void visit(AnalyticExpression analytic) {
        checkFunction(analytic.getName());
        super.visit(analytic);
    }

    @Override
    public void visit(JdbcParameter parameter) {
        if (parameter.isUseFixedIndex()) {
            throw new SqlValidationException("Numbered placeholders are not supported; use ?");
        }
        super.visit(parameter);
    }

    @Override
    public void visit(JdbcNamedParameter parameter) {
        if (!TENANT_MARKER.equals(parameter.getName())) {
            throw new SqlValidationException("Named placeholders are not supported; use ?");
        }
        super.visit(parameter);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String checkFunction(String functionName) {
        String name = unquote(functionName);
        if (name.isEmpty() || name.contains(".") || !allowedFunctions.contains(name)) {
            throw new SqlValidationException("Function is not allowed: " + functionName);
        }
        return name;
    }

    /**
     * Scoped tables read directly by this select: its FROM item and joins, looking
     * through unaliased parentheses. Sub-selects are bound on their own visit.
     */
    private List<Table> scopedTablesOf(PlainSelect plainSelect) {
        List<Table> tables = new ArrayList<>();
        collectScoped(plainSelect.getFromItem(), plainSelect.getJoins(), tables);
        return tables;
    }

    private void collectScoped(FromItem fromItem, List<Join> joins, List<Table> tables) {
        collectScoped(fromItem, tables);
        if (joins != null) {
            for (Join join : joins) {
                collectScoped(join.getRightItem(), tables);
            }
        }
    }

    private void collectScoped(FromItem item, List<Table> tables) {
        if (item instanceof Table table && isScoped(table)) {
            tables.add(table);
        } else if (item instanceof ParenthesedFromItem parenthesed && parenthesed.getAlias() == null) {
            collectScoped(parenthesed.getFromItem(), parenthesed.getJoins(), tables);
        }
    }

    private static boolean joinsInside(FromItem item) {
        return item instanceof ParenthesedFromItem parenthesed
                && ((parenthesed.getJoins() != null && !parenthesed.getJoins().isEmpty())
                || joinsInside(parenthesed.getFromItem()));
    }

    private boolean isScoped(Table table) {
        String name = unquote(table.getName());
        return scopedTables.contains(name) && !cteNames.contains(name);
    }

    private Expression tenantPredicate(Table table, boolean qualify) {
        Column column;
        if (table.getAlias() != null) {
            column = new Column(new Table(table.getAlias().getName()), tenantColumn);
        } else if (qualify) {
            column = new Column(new Table(table.getName()), tenantColumn);
        } else {
            column = new Column(tenantColumn);
        }
        injectedColumns.add(column);
        return new EqualsTo(column, new JdbcNamedParameter(TENANT_MARKER));
    }

    /**
     * Drops {@code tenant = literal} conjuncts from the top-level AND chain so a value
     * supplied in the candidate can never stand in for the enforced one.
     */
    private Expression stripLiteralTenantPredicates(Expression expression) {
        if (expression == null) {
            return null;
        }
        if (expression instanceof AndExpression and) {
            Expression left = stripLiteralTenantPredicates(and.getLeftExpression());
            Expression right = stripLiteralTenantPredicates(and.getRightExpression());
            if (left == null) return right;
            if (right == null) return left;
            and.setLeftExpression(left);
            and.setRightExpression(right);
            return and;
        }
        if (expression instanceof Parenthesis parenthesis && parenthesis.getExpression() instanceof AndExpression) {
            Expression inner = stripLiteralTenantPredicates(parenthesis.getExpression());
            if (inner == null) return null;
            parenthesis.setExpression(inner);
            return parenthesis;
        }
        if (isLiteralTenantComparison(expression)) {
            strippedPredicates++;
            return null;
        }
        return expression;
    }

    private boolean isLiteralTenantComparison(Expression expression) {
        if (expression instanceof Parenthesis parenthesis) {
            return isLiteralTenantComparison(parenthesis.getExpression());
        }
        if (!(expression instanceof EqualsTo equalsTo)) {
            return false;
        }
        Expression left = equalsTo.getLeftExpression();
        Expression right = equalsTo.getRightExpression();
        return (isTenantColumn(left) && isLiteral(right)) || (isTenantColumn(right) && isLiteral(left));
    }

    private boolean isTenantColumn(Expression expression) {
        return expression instanceof Column column && tenantColumn.equals(unquote(column.getColumnName()));
    }

    private static boolean isLiteral(Expression expression) {
        if (expression instanceof LongValue || expression instanceof StringValue || expression instanceof DoubleValue) {
            return true;
        }
        if (expression instanceof SignedExpression signed) {
            return isLiteral(signed.getExpression());
        }
        if (expression instanceof CastExpression cast) {
            return isLiteral(cast.getLeftExpression());
        }
        if (expression instanceof Parenthesis parenthesis) {
            return isLiteral(parenthesis.getExpression());
        }
        return false;
    }

    private static Expression parenthesiseIfNeeded(Expression where) {
        if (where instanceof OrExpression || where instanceof XorExpression) {
            return new Parenthesis(where);
        }
        return where;
    }

    private static String unquote(String identifier) {
        if (identifier == null) {
            return "";
        }
        String name = identifier;
        if (name.length() >= 2 && name.startsWith("\"") && name.endsWith("\"")) {
            name = name.substring(1, name.length() - 1);
        }
        return name.toLowerCase(Locale.ROOT);
    }
}
