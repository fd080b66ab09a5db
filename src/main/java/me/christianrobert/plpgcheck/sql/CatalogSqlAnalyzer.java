package me.christianrobert.plpgcheck.sql;

import me.christianrobert.plpgcheck.catalog.BuiltinTypes;
import me.christianrobert.plpgcheck.catalog.CastContext;
import me.christianrobert.plpgcheck.catalog.CastRules;
import me.christianrobert.plpgcheck.catalog.Catalog;
import me.christianrobert.plpgcheck.catalog.ColumnInfo;
import me.christianrobert.plpgcheck.catalog.FunctionInfo;
import me.christianrobert.plpgcheck.catalog.OperatorInfo;
import me.christianrobert.plpgcheck.catalog.PgType;
import me.christianrobert.plpgcheck.catalog.QualifiedName;
import me.christianrobert.plpgcheck.catalog.RelationInfo;
import me.christianrobert.plpgcheck.catalog.RelationKind;
import me.christianrobert.plpgcheck.catalog.TypeCategory;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.AnalyticExpression;
import net.sf.jsqlparser.expression.ArrayConstructor;
import net.sf.jsqlparser.expression.ArrayExpression;
import net.sf.jsqlparser.expression.BinaryExpression;
import net.sf.jsqlparser.expression.CaseExpression;
import net.sf.jsqlparser.expression.CastExpression;
import net.sf.jsqlparser.expression.DateTimeLiteralExpression;
import net.sf.jsqlparser.expression.DoubleValue;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExtractExpression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.IntervalExpression;
import net.sf.jsqlparser.expression.JdbcParameter;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.NotExpression;
import net.sf.jsqlparser.expression.NullValue;
import net.sf.jsqlparser.expression.SignedExpression;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.TimeKeyExpression;
import net.sf.jsqlparser.expression.WhenClause;
import net.sf.jsqlparser.expression.operators.arithmetic.Addition;
import net.sf.jsqlparser.expression.operators.arithmetic.Concat;
import net.sf.jsqlparser.expression.operators.arithmetic.Division;
import net.sf.jsqlparser.expression.operators.arithmetic.Modulo;
import net.sf.jsqlparser.expression.operators.arithmetic.Multiplication;
import net.sf.jsqlparser.expression.operators.arithmetic.Subtraction;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.conditional.OrExpression;
import net.sf.jsqlparser.expression.operators.relational.Between;
import net.sf.jsqlparser.expression.operators.relational.ComparisonOperator;
import net.sf.jsqlparser.expression.operators.relational.ExistsExpression;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.expression.operators.relational.InExpression;
import net.sf.jsqlparser.expression.operators.relational.IsBooleanExpression;
import net.sf.jsqlparser.expression.operators.relational.IsDistinctExpression;
import net.sf.jsqlparser.expression.operators.relational.IsNullExpression;
import net.sf.jsqlparser.expression.operators.relational.LikeExpression;
import net.sf.jsqlparser.expression.operators.relational.ParenthesedExpressionList;
import net.sf.jsqlparser.expression.operators.relational.RegExpMatchOperator;
import net.sf.jsqlparser.expression.operators.relational.SimilarToExpression;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.select.AllColumns;
import net.sf.jsqlparser.statement.select.AllTableColumns;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.ParenthesedFromItem;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.TableFunction;
import net.sf.jsqlparser.statement.select.Values;
import net.sf.jsqlparser.statement.select.WithItem;
import net.sf.jsqlparser.statement.update.Update;
import net.sf.jsqlparser.statement.update.UpdateSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Analyzes embedded SQL against a {@link Catalog}: JSqlParser supplies the syntax tree,
 * names and types are resolved here following PostgreSQL's rules closely enough to
 * report the errors the server would raise at execution time.
 */
public class CatalogSqlAnalyzer implements SqlAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CatalogSqlAnalyzer.class);

    private static final Set<String> TRANSACTION_WORDS =
            Set.of("begin", "start", "commit", "rollback", "end", "abort", "savepoint", "release");
    private static final Set<String> UTILITY_WORDS = Set.of("create", "drop", "alter", "truncate", "grant",
            "revoke", "lock", "analyze", "vacuum", "notify", "listen", "unlisten", "set", "reset", "discard",
            "comment", "refresh", "cluster", "reindex", "copy", "do", "security", "import", "explain", "show",
            "prepare", "deallocate", "checkpoint", "load");
    private static final Set<String> ROW_RETURNING_UTILITIES = Set.of("explain", "show");
    private static final Set<String> SQL_VALUE_FUNCTIONS = Set.of("current_user", "session_user", "current_role",
            "user", "current_catalog", "current_schema");
    private static final Pattern PARSER_TOKEN = Pattern.compile("Encountered unexpected token: \"([^\"]*)\"");
    private static final Pattern PARSER_LOCATION = Pattern.compile("at line (\\d+), column (\\d+)");

    private static final String NO_OPERATOR_HINT =
            "No operator matches the given name and argument types. You might need to add explicit type casts.";
    private static final String NO_FUNCTION_HINT =
            "No function matches the given name and argument types. You might need to add explicit type casts.";

    private final Catalog catalog;

    public CatalogSqlAnalyzer(Catalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public ResolvedQuery analyze(String sql, ParamResolver params) throws SqlAnalysisException {
        String text = stripTrailingSemicolon(sql);
        String firstWord = QueryText.firstWord(text);

        if (TRANSACTION_WORDS.contains(firstWord)) {
            return new ResolvedQuery(CommandType.TRANSACTION, text);
        }
        if (UTILITY_WORDS.contains(firstWord)) {
            ResolvedQuery utility = new ResolvedQuery(CommandType.UTILITY, text);
            utility.setReturnsTuples(ROW_RETURNING_UTILITIES.contains(firstWord));
            utility.setOpaque(true);
            return utility;
        }
        if (firstWord.equals("merge")) {
            ResolvedQuery merge = new ResolvedQuery(CommandType.MERGE, text);
            merge.setOpaque(true);
            return merge;
        }
        return new Analysis(text, params).run();
    }

    @Override
    public ResolvedQuery analyzeCall(String callText, ParamResolver params) throws SqlAnalysisException {
        String text = stripTrailingSemicolon(callText);
        return new Analysis(text, params).runCall();
    }

    private static String stripTrailingSemicolon(String sql) {
        String text = sql.trim();
        while (text.endsWith(";")) {
            text = text.substring(0, text.length() - 1).trim();
        }
        return text;
    }

    static String normalize(String identifier) {
        return identifier == null ? null : QualifiedName.normalizeIdentifier(identifier);
    }

    // ------------------------------------------------------------------ scopes

    private static final class RangeEntry {
        final String name;
        final RelationInfo relation;
        final List<ResolvedColumn> columns;
        final boolean opaque;

        RangeEntry(String name, RelationInfo relation, List<ResolvedColumn> columns, boolean opaque) {
            this.name = name;
            this.relation = relation;
            this.columns = columns;
            this.opaque = opaque;
        }

        ResolvedColumn find(String column) {
            for (ResolvedColumn candidate : columns) {
                if (candidate.getName().equals(column)) {
                    return candidate;
                }
            }
            return null;
        }

        PgType rowType() {
            if (relation != null) {
                return relation.getRowType();
            }
            return BuiltinTypes.RECORD;
        }
    }

    private static final class Scope {
        final Scope parent;
        final List<RangeEntry> entries = new ArrayList<>();
        final Map<String, List<ResolvedColumn>> ctes = new HashMap<>();

        Scope(Scope parent) {
            this.parent = parent;
        }

        List<ResolvedColumn> findCte(String name) {
            for (Scope scope = this; scope != null; scope = scope.parent) {
                List<ResolvedColumn> cte = scope.ctes.get(name);
                if (cte != null) {
                    return cte;
                }
            }
            return null;
        }
    }

    // ------------------------------------------------------------------ analysis of one statement

    private final class Analysis {

        private final String sql;
        private final ParamResolver params;
        private ResolvedQuery query;

        Analysis(String sql, ParamResolver params) {
            this.sql = sql;
            this.params = params;
        }

        ResolvedQuery run() throws SqlAnalysisException {
            String text = sql;
            boolean forUpdate = false;
            int locking = QueryText.lockingClauseStart(text);
            if (locking > 0) {
                forUpdate = true;
                text = text.substring(0, locking);
            }
            String returning = null;
            String firstWord = QueryText.firstWord(text);
            if (firstWord.equals("insert") || firstWord.equals("update") || firstWord.equals("delete")) {
                int returningStart = QueryText.findTopLevelKeyword(text, "returning");
                if (returningStart > 0) {
                    returning = text.substring(returningStart + "returning".length()).trim();
                    text = text.substring(0, returningStart);
                }
            }
            boolean modifyingCte = QueryText.hasModifyingCte(text);

            Statement statement;
            try {
                statement = parse(text);
            } catch (SqlAnalysisException e) {
                if (modifyingCte) {
                    ResolvedQuery opaque = new ResolvedQuery(CommandType.SELECT, sql);
                    opaque.setModifyingCte(true);
                    opaque.setOpaque(true);
                    opaque.setReturnsTuples(true);
                    return opaque;
                }
                throw e;
            }

            if (statement instanceof Select) {
                query = new ResolvedQuery(CommandType.SELECT, sql);
                query.getTargetList().addAll(analyzeSelect((Select) statement, null));
                query.setReturnsTuples(true);
            } else if (statement instanceof Insert) {
                query = new ResolvedQuery(CommandType.INSERT, sql);
                Insert insert = (Insert) statement;
                RangeEntry target = analyzeInsert(insert);
                analyzeReturning(returning, insert.getTable(), target);
            } else if (statement instanceof Update) {
                query = new ResolvedQuery(CommandType.UPDATE, sql);
                Update update = (Update) statement;
                RangeEntry target = analyzeUpdate(update);
                analyzeReturning(returning, update.getTable(), target);
            } else if (statement instanceof Delete) {
                query = new ResolvedQuery(CommandType.DELETE, sql);
                Delete delete = (Delete) statement;
                RangeEntry target = analyzeDelete(delete);
                analyzeReturning(returning, delete.getTable(), target);
            } else {
                query = new ResolvedQuery(CommandType.UTILITY, sql);
                query.setOpaque(true);
            }
            query.setForUpdate(forUpdate);
            query.setModifyingCte(modifyingCte);
            return query;
        }

        ResolvedQuery runCall() throws SqlAnalysisException {
            query = new ResolvedQuery(CommandType.CALL, sql);
            Statement statement = parse("SELECT " + sql);
            Expression expression = null;
            if (statement instanceof PlainSelect && ((PlainSelect) statement).getSelectItems().size() == 1) {
                expression = ((PlainSelect) statement).getSelectItems().get(0).getExpression();
            }
            if (!(expression instanceof Function)) {
                throw new SqlAnalysisException("42601", "syntax error at or near \"CALL\"", 1);
            }
            Function function = (Function) expression;
            List<ResolvedExpr> args = resolveArguments(function.getParameters(), new Scope(null));
            QualifiedName name = QualifiedName.parse(function.getName());
            int location = QueryText.positionOf(sql, name.getName());
            List<FunctionInfo> candidates = catalog.findFunctions(name);
            List<FunctionInfo> procedures = new ArrayList<>();
            for (FunctionInfo candidate : candidates) {
                if (candidate.isProcedure()) {
                    procedures.add(candidate);
                }
            }
            FunctionInfo procedure = chooseCandidate(procedures, types(args));
            if (procedure == null) {
                if (!candidates.isEmpty() && chooseCandidate(candidates, types(args)) != null) {
                    throw new SqlAnalysisException("42809", name.getName() + signatureOf(types(args))
                            + " is not a procedure", null, "To call a function, use SELECT.", location);
                }
                throw new SqlAnalysisException("42883", "procedure " + name.getName() + signatureOf(types(args))
                        + " does not exist", null,
                        "No procedure matches the given name and argument types. You might need to add explicit "
                                + "type casts.", location);
            }
            ResolvedExpr call = ResolvedExpr.function(procedure, name.getName(), BuiltinTypes.VOID, location, args);
            query.addFunctionCall(call);
            return query;
        }

        private Statement parse(String text) throws SqlAnalysisException {
            try {
                return CCJSqlParserUtil.parse(QueryText.rewritePositionalParams(text));
            } catch (JSQLParserException e) {
                log.debug("Failed to parse query: {}", text, e);
                String message = e.getCause() != null && e.getCause().getMessage() != null
                        ? e.getCause().getMessage()
                        : String.valueOf(e.getMessage());
                Matcher token = PARSER_TOKEN.matcher(message);
                String error = token.find()
                        ? "syntax error at or near \"" + token.group(1) + "\""
                        : "syntax error";
                throw new SqlAnalysisException("42601", error, null, null, parserPosition(text, message));
            }
        }

        private int parserPosition(String text, String message) {
            Matcher location = PARSER_LOCATION.matcher(message);
            if (!location.find()) {
                return 0;
            }
            int line = Integer.parseInt(location.group(1));
            int column = Integer.parseInt(location.group(2));
            int offset = 0;
            for (int i = 1; i < line; i++) {
                int newline = text.indexOf('\n', offset);
                if (newline < 0) {
                    return 0;
                }
                offset = newline + 1;
            }
            return offset + column;
        }

        // ------------------------------------------------------------------ SELECT

        List<ResolvedColumn> analyzeSelect(Select select, Scope parent) throws SqlAnalysisException {
            Scope scope = parent;
            if (select.getWithItemsList() != null && !select.getWithItemsList().isEmpty()) {
                scope = new Scope(parent);
                for (WithItem item : select.getWithItemsList()) {
                    registerCte(item, scope);
                }
            }
            if (select instanceof PlainSelect) {
                return analyzePlainSelect((PlainSelect) select, scope);
            }
            if (select instanceof SetOperationList) {
                return analyzeSetOperation((SetOperationList) select, scope);
            }
            if (select instanceof ParenthesedSelect) {
                return analyzeSelect(((ParenthesedSelect) select).getSelect(), scope);
            }
            if (select instanceof Values) {
                return analyzeValues((Values) select, scope);
            }
            throw new SqlAnalysisException("0A000", "unsupported query form", 0);
        }

        private void registerCte(WithItem item, Scope scope) throws SqlAnalysisException {
            String name = normalize(item.getAlias().getName());
            Select body = item.getSelect();
            if (item.isRecursive() && body instanceof ParenthesedSelect
                    && ((ParenthesedSelect) body).getSelect() instanceof SetOperationList) {
                SetOperationList union = (SetOperationList) ((ParenthesedSelect) body).getSelect();
                scope.ctes.put(name, analyzeSelect(union.getSelects().get(0), scope));
            }
            scope.ctes.put(name, analyzeSelect(body, scope));
        }

        private List<ResolvedColumn> analyzePlainSelect(PlainSelect select, Scope parent) throws SqlAnalysisException {
            Scope scope = new Scope(parent);
            List<Expression> joinConditions = new ArrayList<>();
            if (select.getFromItem() != null) {
                addFromItem(select.getFromItem(), scope, joinConditions);
            }
            if (select.getJoins() != null) {
                for (Join join : select.getJoins()) {
                    addJoin(join, scope, joinConditions);
                }
            }
            for (Expression condition : joinConditions) {
                query.addCondition(requireBoolean(resolve(condition, scope), "JOIN/ON"));
            }
            if (select.getWhere() != null) {
                query.addCondition(requireBoolean(resolve(select.getWhere(), scope), "WHERE"));
            }

            List<ResolvedColumn> columns = new ArrayList<>();
            for (SelectItem<?> item : select.getSelectItems()) {
                Expression expression = item.getExpression();
                if (expression instanceof AllTableColumns) {
                    Table table = ((AllTableColumns) expression).getTable();
                    RangeEntry entry = findEntry(scope, normalize(table.getName()));
                    if (entry == null) {
                        throw new SqlAnalysisException("42P01", "missing FROM-clause entry for table \""
                                + normalize(table.getName()) + "\"", QueryText.positionOf(sql, table.getName()));
                    }
                    columns.addAll(entry.columns);
                } else if (expression instanceof AllColumns) {
                    if (scope.entries.isEmpty()) {
                        throw new SqlAnalysisException("42601", "SELECT * with no tables specified is not valid",
                                QueryText.positionOf(sql, "select"));
                    }
                    for (RangeEntry entry : scope.entries) {
                        columns.addAll(entry.columns);
                    }
                } else {
                    ResolvedExpr resolved = resolve(expression, scope);
                    String name = item.getAlias() != null
                            ? normalize(item.getAlias().getName())
                            : columnName(expression);
                    columns.add(new ResolvedColumn(name, resolved.getType(), resolved));
                }
            }

            if (select.getGroupBy() != null && select.getGroupBy().getGroupByExpressionList() != null) {
                for (Object grouping : select.getGroupBy().getGroupByExpressionList()) {
                    resolveAllowingOutputName((Expression) grouping, scope, columns);
                }
            }
            if (select.getHaving() != null) {
                query.addCondition(requireBoolean(resolve(select.getHaving(), scope), "HAVING"));
            }
            if (select.getOrderByElements() != null) {
                for (OrderByElement order : select.getOrderByElements()) {
                    resolveAllowingOutputName(order.getExpression(), scope, columns);
                }
            }
            return columns;
        }

        private void resolveAllowingOutputName(Expression expression, Scope scope, List<ResolvedColumn> output)
                throws SqlAnalysisException {
            try {
                resolve(expression, scope);
            } catch (SqlAnalysisException e) {
                if (expression instanceof Column && "42703".equals(e.getSqlState())) {
                    String name = normalize(((Column) expression).getColumnName());
                    for (ResolvedColumn column : output) {
                        if (column.getName().equals(name)) {
                            return;
                        }
                    }
                }
                throw e;
            }
        }

        private List<ResolvedColumn> analyzeSetOperation(SetOperationList setOperation, Scope scope)
                throws SqlAnalysisException {
            List<ResolvedColumn> result = null;
            for (Select branch : setOperation.getSelects()) {
                List<ResolvedColumn> columns = analyzeSelect(branch, scope);
                if (result == null) {
                    result = new ArrayList<>(columns);
                    continue;
                }
                if (columns.size() != result.size()) {
                    throw new SqlAnalysisException("42601", "each UNION query must have the same number of columns",
                            QueryText.positionOf(sql, "union"));
                }
                for (int i = 0; i < result.size(); i++) {
                    PgType left = result.get(i).getType();
                    PgType right = columns.get(i).getType();
                    PgType common = CastRules.commonType(left, right);
                    if (common == null) {
                        throw new SqlAnalysisException("42804", "UNION types " + left + " and " + right
                                + " cannot be matched", QueryText.positionOf(sql, "union"));
                    }
                    result.set(i, new ResolvedColumn(result.get(i).getName(), common,
                            result.get(i).getExpression()));
                }
            }
            return result != null ? result : new ArrayList<>();
        }

        private List<ResolvedColumn> analyzeValues(Values values, Scope scope) throws SqlAnalysisException {
            List<List<ResolvedExpr>> rows = valuesRows(values.getExpressions(), scope);
            List<ResolvedColumn> columns = new ArrayList<>();
            if (rows.isEmpty()) {
                return columns;
            }
            List<ResolvedExpr> first = rows.get(0);
            for (int i = 0; i < first.size(); i++) {
                PgType type = first.get(i).getType();
                for (List<ResolvedExpr> row : rows) {
                    if (row.size() != first.size()) {
                        throw new SqlAnalysisException("42601", "VALUES lists must all be the same length",
                                QueryText.positionOf(sql, "values"));
                    }
                    PgType common = CastRules.commonType(type, row.get(i).getType());
                    type = common != null ? common : type;
                }
                if (type.isUnknown()) {
                    type = BuiltinTypes.TEXT;
                }
                columns.add(new ResolvedColumn("column" + (i + 1), type, first.get(i)));
            }
            return columns;
        }

        private List<List<ResolvedExpr>> valuesRows(Collection<? extends Expression> expressions, Scope scope)
                throws SqlAnalysisException {
            List<List<ResolvedExpr>> rows = new ArrayList<>();
            if (expressions == null) {
                return rows;
            }
            boolean listOfRows = !expressions.isEmpty();
            for (Expression expression : expressions) {
                if (!(expression instanceof ExpressionList)) {
                    listOfRows = false;
                    break;
                }
            }
            if (listOfRows) {
                for (Expression expression : expressions) {
                    List<ResolvedExpr> row = new ArrayList<>();
                    for (Object item : (ExpressionList<?>) expression) {
                        row.add(resolve((Expression) item, scope));
                    }
                    rows.add(row);
                }
            } else {
                List<ResolvedExpr> row = new ArrayList<>();
                for (Expression expression : expressions) {
                    row.add(resolve(expression, scope));
                }
                rows.add(row);
            }
            return rows;
        }

        // ------------------------------------------------------------------ FROM

        private void addFromItem(FromItem item, Scope scope, List<Expression> joinConditions)
                throws SqlAnalysisException {
            String alias = item.getAlias() != null ? normalize(item.getAlias().getName()) : null;
            if (item instanceof Table) {
                scope.entries.add(tableEntry((Table) item, alias, scope));
            } else if (item instanceof ParenthesedSelect) {
                List<ResolvedColumn> columns = analyzeSelect(((ParenthesedSelect) item).getSelect(), scope.parent);
                scope.entries.add(new RangeEntry(alias != null ? alias : "unnamed_subquery", null, columns, false));
            } else if (item instanceof TableFunction) {
                Function function = ((TableFunction) item).getFunction();
                ResolvedExpr call = resolveFunction(function, scope);
                scope.entries.add(functionEntry(call, alias != null ? alias : normalize(function.getName())));
            } else if (item instanceof ParenthesedFromItem) {
                ParenthesedFromItem nested = (ParenthesedFromItem) item;
                addFromItem(nested.getFromItem(), scope, joinConditions);
                if (nested.getJoins() != null) {
                    for (Join join : nested.getJoins()) {
                        addJoin(join, scope, joinConditions);
                    }
                }
            } else {
                log.debug("Unsupported FROM item {}, columns are not checked", item.getClass().getSimpleName());
                scope.entries.add(new RangeEntry(alias, null, new ArrayList<>(), true));
            }
        }

        private void addJoin(Join join, Scope scope, List<Expression> joinConditions) throws SqlAnalysisException {
            addFromItem(join.getRightItem(), scope, joinConditions);
            if (join.getOnExpressions() != null) {
                joinConditions.addAll(join.getOnExpressions());
            }
        }

        private RangeEntry tableEntry(Table table, String alias, Scope scope) throws SqlAnalysisException {
            String name = normalize(table.getName());
            String schema = normalize(table.getSchemaName());
            if (schema == null) {
                List<ResolvedColumn> cte = scope != null ? scope.findCte(name) : null;
                if (cte != null) {
                    return new RangeEntry(alias != null ? alias : name, null, cte, false);
                }
            }
            RelationInfo relation = catalog.findRelation(new QualifiedName(schema, name));
            if (relation == null) {
                String display = schema != null ? schema + "." + name : name;
                throw new SqlAnalysisException("42P01", "relation \"" + display + "\" does not exist",
                        QueryText.positionOf(sql, table.getName()));
            }
            if (relation.getKind() == RelationKind.COMPOSITE_TYPE) {
                throw new SqlAnalysisException("42809", "\"" + name + "\" is a composite type",
                        QueryText.positionOf(sql, table.getName()));
            }
            query.addRelation(relation);
            List<ResolvedColumn> columns = new ArrayList<>();
            for (ColumnInfo column : relation.getColumns()) {
                columns.add(new ResolvedColumn(column.getName(), column.getType(), null));
            }
            return new RangeEntry(alias != null ? alias : name, relation, columns, false);
        }

        private RangeEntry functionEntry(ResolvedExpr call, String name) {
            PgType type = call.getType();
            List<ResolvedColumn> columns = new ArrayList<>();
            if (type.isComposite() && !type.getFields().isEmpty()) {
                for (ColumnInfo field : type.getFields()) {
                    columns.add(new ResolvedColumn(field.getName(), field.getType(), null));
                }
                return new RangeEntry(name, null, columns, false);
            }
            if (type.isRecord() || type.isUnknown()) {
                return new RangeEntry(name, null, columns, true);
            }
            columns.add(new ResolvedColumn(name, type, call));
            return new RangeEntry(name, null, columns, false);
        }

        private RangeEntry findEntry(Scope scope, String name) {
            for (Scope current = scope; current != null; current = current.parent) {
                for (RangeEntry entry : current.entries) {
                    if (name.equals(entry.name)) {
                        return entry;
                    }
                }
            }
            return null;
        }

        // ------------------------------------------------------------------ DML

        private RangeEntry analyzeInsert(Insert insert) throws SqlAnalysisException {
            Scope scope = new Scope(null);
            if (insert.getWithItemsList() != null) {
                for (WithItem item : insert.getWithItemsList()) {
                    registerCte(item, scope);
                }
            }
            String alias = insert.getTable().getAlias() != null
                    ? normalize(insert.getTable().getAlias().getName())
                    : null;
            RangeEntry target = tableEntry(insert.getTable(), alias, null);

            List<ResolvedColumn> targetColumns = new ArrayList<>();
            if (insert.getColumns() != null && !insert.getColumns().isEmpty()) {
                for (Column column : insert.getColumns()) {
                    targetColumns.add(targetColumn(target, column.getColumnName()));
                }
            } else {
                targetColumns.addAll(target.columns);
            }

            if (insert.getSelect() == null) {
                return target;
            }
            List<ResolvedColumn> source = analyzeSelect(insert.getSelect(), scope);
            if (source.size() > targetColumns.size()) {
                throw new SqlAnalysisException("42601", "INSERT has more expressions than target columns",
                        QueryText.positionOf(sql, "values"));
            }
            if (insert.getColumns() != null && !insert.getColumns().isEmpty() && source.size() < targetColumns.size()) {
                throw new SqlAnalysisException("42601", "INSERT has more target columns than expressions",
                        QueryText.positionOf(sql, targetColumns.get(source.size()).getName()));
            }
            for (int i = 0; i < source.size(); i++) {
                checkAssignable(targetColumns.get(i), source.get(i).getExpression(), source.get(i).getType());
            }
            return target;
        }

        private RangeEntry analyzeUpdate(Update update) throws SqlAnalysisException {
            Scope scope = new Scope(null);
            if (update.getWithItemsList() != null) {
                for (WithItem item : update.getWithItemsList()) {
                    registerCte(item, scope);
                }
            }
            Scope rangeScope = new Scope(scope);
            String alias = update.getTable().getAlias() != null
                    ? normalize(update.getTable().getAlias().getName())
                    : null;
            RangeEntry target = tableEntry(update.getTable(), alias, scope);
            rangeScope.entries.add(target);
            List<Expression> joinConditions = new ArrayList<>();
            if (update.getFromItem() != null) {
                addFromItem(update.getFromItem(), rangeScope, joinConditions);
            }
            if (update.getJoins() != null) {
                for (Join join : update.getJoins()) {
                    addJoin(join, rangeScope, joinConditions);
                }
            }
            for (Expression condition : joinConditions) {
                query.addCondition(requireBoolean(resolve(condition, rangeScope), "JOIN/ON"));
            }
            for (UpdateSet set : update.getUpdateSets()) {
                List<ResolvedColumn> columns = new ArrayList<>();
                for (Column column : set.getColumns()) {
                    columns.add(targetColumn(target, column.getColumnName()));
                }
                List<ResolvedExpr> values = new ArrayList<>();
                for (Object value : set.getValues()) {
                    Expression expression = (Expression) value;
                    if (expression instanceof ParenthesedSelect) {
                        for (ResolvedColumn column : analyzeSelect(((ParenthesedSelect) expression).getSelect(),
                                rangeScope)) {
                            values.add(column.getExpression() != null
                                    ? column.getExpression()
                                    : ResolvedExpr.column(null, column.getName(), column.getType(), 0));
                        }
                    } else {
                        values.add(resolve(expression, rangeScope));
                    }
                }
                if (values.size() == columns.size()) {
                    for (int i = 0; i < columns.size(); i++) {
                        checkAssignable(columns.get(i), values.get(i), values.get(i).getType());
                    }
                } else if (!(values.size() == 1 && values.get(0).getType().isComposite())) {
                    throw new SqlAnalysisException("42601", "number of columns does not match number of values",
                            QueryText.positionOf(sql, "set"));
                }
            }
            if (update.getWhere() != null) {
                query.addCondition(requireBoolean(resolve(update.getWhere(), rangeScope), "WHERE"));
            }
            return target;
        }

        private RangeEntry analyzeDelete(Delete delete) throws SqlAnalysisException {
            Scope scope = new Scope(null);
            if (delete.getWithItemsList() != null) {
                for (WithItem item : delete.getWithItemsList()) {
                    registerCte(item, scope);
                }
            }
            Scope rangeScope = new Scope(scope);
            String alias = delete.getTable().getAlias() != null
                    ? normalize(delete.getTable().getAlias().getName())
                    : null;
            RangeEntry target = tableEntry(delete.getTable(), alias, scope);
            rangeScope.entries.add(target);
            if (delete.getUsingList() != null) {
                for (Table using : delete.getUsingList()) {
                    String usingAlias = using.getAlias() != null ? normalize(using.getAlias().getName()) : null;
                    rangeScope.entries.add(tableEntry(using, usingAlias, scope));
                }
            }
            if (delete.getWhere() != null) {
                query.addCondition(requireBoolean(resolve(delete.getWhere(), rangeScope), "WHERE"));
            }
            return target;
        }

        private void analyzeReturning(String returning, Table table, RangeEntry target) throws SqlAnalysisException {
            if (returning == null) {
                query.setReturnsTuples(false);
                return;
            }
            Statement statement = parse("SELECT " + returning + " FROM " + table.getFullyQualifiedName()
                    + " AS " + target.name);
            if (!(statement instanceof Select)) {
                throw new SqlAnalysisException("42601", "syntax error at or near \"RETURNING\"",
                        QueryText.positionOf(sql, "returning"));
            }
            query.getTargetList().addAll(analyzeSelect((Select) statement, null));
            query.setReturnsTuples(true);
        }

        private ResolvedColumn targetColumn(RangeEntry target, String columnName) throws SqlAnalysisException {
            String name = normalize(columnName);
            ResolvedColumn column = target.find(name);
            if (column == null) {
                throw new SqlAnalysisException("42703", "column \"" + name + "\" of relation \"" + target.relation.getName()
                        + "\" does not exist", QueryText.positionOf(sql, columnName));
            }
            return column;
        }

        private void checkAssignable(ResolvedColumn column, ResolvedExpr value, PgType valueType)
                throws SqlAnalysisException {
            if (valueType == null || valueType.isUnknown() || column.getType().isUnknown()) {
                return;
            }
            if (!CastRules.castContext(valueType, column.getType()).allowsAssignment()) {
                int location = value != null ? value.getLocation() : QueryText.positionOf(sql, column.getName());
                throw new SqlAnalysisException("42804", "column \"" + column.getName() + "\" is of type "
                        + column.getType().getName() + " but expression is of type " + valueType.getName(), null,
                        "You will need to rewrite or cast the expression.", location);
            }
        }

        // ------------------------------------------------------------------ expressions

        ResolvedExpr resolve(Expression expression, Scope scope) throws SqlAnalysisException {
            if (expression instanceof Column) {
                return resolveColumn((Column) expression, scope);
            }
            if (expression instanceof JdbcParameter) {
                return resolvePositional((JdbcParameter) expression);
            }
            if (expression instanceof StringValue) {
                StringValue value = (StringValue) expression;
                String literal = value.getValue().replace("''", "'");
                return ResolvedExpr.constant(BuiltinTypes.UNKNOWN, literal, locationOfLiteral(value.getValue()));
            }
            if (expression instanceof LongValue) {
                LongValue value = (LongValue) expression;
                String digits = value.getStringValue();
                PgType type;
                try {
                    long number = Long.parseLong(digits);
                    type = number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE
                            ? BuiltinTypes.INT4
                            : BuiltinTypes.INT8;
                } catch (NumberFormatException e) {
                    type = BuiltinTypes.NUMERIC;
                }
                return ResolvedExpr.constant(type, digits, 0);
            }
            if (expression instanceof DoubleValue) {
                return ResolvedExpr.constant(BuiltinTypes.NUMERIC, expression.toString(), 0);
            }
            if (expression instanceof NullValue) {
                return ResolvedExpr.constant(BuiltinTypes.UNKNOWN, null, 0);
            }
            if (expression instanceof TimeKeyExpression) {
                return resolveTimeKey((TimeKeyExpression) expression);
            }
            if (expression instanceof IntervalExpression) {
                return ResolvedExpr.constant(BuiltinTypes.INTERVAL, expression.toString(), 0);
            }
            if (expression instanceof DateTimeLiteralExpression) {
                DateTimeLiteralExpression literal = (DateTimeLiteralExpression) expression;
                PgType type = BuiltinTypes.lookup(literal.getType().name().toLowerCase(Locale.ROOT));
                return ResolvedExpr.constant(type != null ? type : BuiltinTypes.TIMESTAMP, literal.getValue(), 0);
            }
            if (expression instanceof CastExpression) {
                return resolveCast((CastExpression) expression, scope);
            }
            if (expression instanceof SignedExpression) {
                ResolvedExpr operand = resolve(((SignedExpression) expression).getExpression(), scope);
                if (operand.getKind() == ResolvedExpr.Kind.CONST) {
                    return ResolvedExpr.constant(operand.getType(),
                            ((SignedExpression) expression).getSign() + operand.getText(), operand.getLocation());
                }
                return ResolvedExpr.operator(String.valueOf(((SignedExpression) expression).getSign()), null,
                        operand.getType(), operand.getLocation(), List.of(operand));
            }
            if (expression instanceof NotExpression) {
                ResolvedExpr operand = resolve(((NotExpression) expression).getExpression(), scope);
                requireBoolean(operand, "NOT");
                return new ResolvedExpr(ResolvedExpr.Kind.BOOL, BuiltinTypes.BOOL, operand.getLocation(),
                        List.of(operand));
            }
            if (expression instanceof AndExpression || expression instanceof OrExpression) {
                BinaryExpression binary = (BinaryExpression) expression;
                String name = expression instanceof AndExpression ? "AND" : "OR";
                ResolvedExpr left = requireBoolean(resolve(binary.getLeftExpression(), scope), name);
                ResolvedExpr right = requireBoolean(resolve(binary.getRightExpression(), scope), name);
                return new ResolvedExpr(ResolvedExpr.Kind.BOOL, BuiltinTypes.BOOL, left.getLocation(),
                        List.of(left, right));
            }
            if (expression instanceof ComparisonOperator || expression instanceof IsDistinctExpression) {
                BinaryExpression binary = (BinaryExpression) expression;
                return comparison(binary.getStringExpression(), resolve(binary.getLeftExpression(), scope),
                        resolve(binary.getRightExpression(), scope));
            }
            if (expression instanceof LikeExpression || expression instanceof SimilarToExpression
                    || expression instanceof RegExpMatchOperator) {
                List<ResolvedExpr> operands = new ArrayList<>();
                if (expression instanceof SimilarToExpression) {
                    SimilarToExpression similar = (SimilarToExpression) expression;
                    operands.add(resolve(similar.getLeftExpression(), scope));
                    operands.add(resolve(similar.getRightExpression(), scope));
                } else {
                    BinaryExpression binary = (BinaryExpression) expression;
                    operands.add(resolve(binary.getLeftExpression(), scope));
                    operands.add(resolve(binary.getRightExpression(), scope));
                }
                return ResolvedExpr.operator("~~", null, BuiltinTypes.BOOL, operands.get(0).getLocation(), operands);
            }
            if (expression instanceof Concat) {
                Concat concat = (Concat) expression;
                ResolvedExpr left = resolve(concat.getLeftExpression(), scope);
                ResolvedExpr right = resolve(concat.getRightExpression(), scope);
                PgType type = left.getType().isArray() ? left.getType()
                        : right.getType().isArray() ? right.getType() : BuiltinTypes.TEXT;
                return ResolvedExpr.operator("||", null, type, left.getLocation(), List.of(left, right));
            }
            if (expression instanceof Addition || expression instanceof Subtraction
                    || expression instanceof Multiplication || expression instanceof Division
                    || expression instanceof Modulo) {
                BinaryExpression binary = (BinaryExpression) expression;
                return arithmetic(binary.getStringExpression(), resolve(binary.getLeftExpression(), scope),
                        resolve(binary.getRightExpression(), scope));
            }
            if (expression instanceof IsNullExpression) {
                ResolvedExpr operand = resolve(((IsNullExpression) expression).getLeftExpression(), scope);
                return new ResolvedExpr(ResolvedExpr.Kind.NULL_TEST, BuiltinTypes.BOOL, operand.getLocation(),
                        List.of(operand));
            }
            if (expression instanceof IsBooleanExpression) {
                ResolvedExpr operand = requireBoolean(resolve(((IsBooleanExpression) expression).getLeftExpression(),
                        scope), "IS TRUE");
                return new ResolvedExpr(ResolvedExpr.Kind.BOOL, BuiltinTypes.BOOL, operand.getLocation(),
                        List.of(operand));
            }
            if (expression instanceof Between) {
                Between between = (Between) expression;
                ResolvedExpr value = resolve(between.getLeftExpression(), scope);
                ResolvedExpr low = comparison(">=", value, resolve(between.getBetweenExpressionStart(), scope));
                ResolvedExpr high = comparison("<=", value, resolve(between.getBetweenExpressionEnd(), scope));
                return new ResolvedExpr(ResolvedExpr.Kind.BOOL, BuiltinTypes.BOOL, value.getLocation(),
                        List.of(low, high));
            }
            if (expression instanceof InExpression) {
                return resolveIn((InExpression) expression, scope);
            }
            if (expression instanceof ExistsExpression) {
                Expression right = ((ExistsExpression) expression).getRightExpression();
                List<ResolvedExpr> children = new ArrayList<>();
                if (right instanceof Select) {
                    analyzeSelect((Select) right, scope);
                } else {
                    children.add(resolve(right, scope));
                }
                return new ResolvedExpr(ResolvedExpr.Kind.SUBLINK, BuiltinTypes.BOOL, 0, children);
            }
            if (expression instanceof Select) {
                List<ResolvedColumn> columns = analyzeSelect((Select) expression, scope);
                if (columns.size() != 1) {
                    throw new SqlAnalysisException("42601", "subquery must return only one column",
                            QueryText.positionOf(sql, "select"));
                }
                return new ResolvedExpr(ResolvedExpr.Kind.SUBLINK, columns.get(0).getType(), 0, null);
            }
            if (expression instanceof ParenthesedExpressionList) {
                ParenthesedExpressionList<?> list = (ParenthesedExpressionList<?>) expression;
                List<ResolvedExpr> items = new ArrayList<>();
                for (Object item : list) {
                    items.add(resolve((Expression) item, scope));
                }
                if (items.size() == 1) {
                    return items.get(0);
                }
                return new ResolvedExpr(ResolvedExpr.Kind.ROW, BuiltinTypes.RECORD,
                        items.isEmpty() ? 0 : items.get(0).getLocation(), items);
            }
            if (expression instanceof CaseExpression) {
                return resolveCase((CaseExpression) expression, scope);
            }
            if (expression instanceof Function) {
                return resolveFunction((Function) expression, scope);
            }
            if (expression instanceof AnalyticExpression) {
                return resolveAnalytic((AnalyticExpression) expression, scope);
            }
            if (expression instanceof ArrayConstructor) {
                List<ResolvedExpr> items = new ArrayList<>();
                PgType element = null;
                for (Expression item : ((ArrayConstructor) expression).getExpressions()) {
                    ResolvedExpr resolved = resolve(item, scope);
                    items.add(resolved);
                    PgType itemType = resolved.getType().isArray() ? resolved.getType().getElementType()
                            : resolved.getType();
                    element = element == null ? itemType : CastRules.commonType(element, itemType);
                }
                if (element == null || element.isUnknown()) {
                    element = BuiltinTypes.TEXT;
                }
                return new ResolvedExpr(ResolvedExpr.Kind.ARRAY, BuiltinTypes.arrayOf(element), 0, items);
            }
            if (expression instanceof ArrayExpression) {
                ArrayExpression subscript = (ArrayExpression) expression;
                ResolvedExpr array = resolve(subscript.getObjExpression(), scope);
                List<ResolvedExpr> children = new ArrayList<>();
                children.add(array);
                boolean slice = subscript.getIndexExpression() == null;
                for (Expression index : new Expression[]{subscript.getIndexExpression(),
                        subscript.getStartIndexExpression(), subscript.getStopIndexExpression()}) {
                    if (index != null) {
                        children.add(resolve(index, scope));
                    }
                }
                PgType type = array.getType();
                if (!slice && type.isArray()) {
                    type = type.getElementType();
                } else if (!type.isArray() && !type.isUnknown() && !"jsonb".equals(type.getInternalName())) {
                    throw new SqlAnalysisException("42804", "cannot subscript type " + type.getName()
                            + " because it does not support subscripting", array.getLocation());
                }
                return new ResolvedExpr(ResolvedExpr.Kind.OTHER, type, array.getLocation(), children);
            }
            if (expression instanceof ExtractExpression) {
                ResolvedExpr source = resolve(((ExtractExpression) expression).getExpression(), scope);
                return new ResolvedExpr(ResolvedExpr.Kind.FUNCTION, BuiltinTypes.NUMERIC, source.getLocation(),
                        List.of(source));
            }
            if (expression instanceof BinaryExpression) {
                BinaryExpression binary = (BinaryExpression) expression;
                ResolvedExpr left = resolve(binary.getLeftExpression(), scope);
                ResolvedExpr right = resolve(binary.getRightExpression(), scope);
                OperatorInfo operator = catalog.findOperator(binary.getStringExpression(), left.getType(),
                        right.getType());
                if (operator != null) {
                    query.addOperator(operator);
                    return ResolvedExpr.operator(binary.getStringExpression(), operator, operator.getResult(),
                            left.getLocation(), List.of(left, right));
                }
                return ResolvedExpr.operator(binary.getStringExpression(), null, BuiltinTypes.UNKNOWN,
                        left.getLocation(), List.of(left, right));
            }
            String text = expression.toString();
            if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                return ResolvedExpr.constant(BuiltinTypes.BOOL, text.toLowerCase(Locale.ROOT), 0);
            }
            log.debug("Expression {} of type {} is not analyzed", text, expression.getClass().getSimpleName());
            return new ResolvedExpr(ResolvedExpr.Kind.OTHER, BuiltinTypes.UNKNOWN, 0, null);
        }

        private int locationOfLiteral(String value) {
            int index = sql.indexOf("'" + value + "'");
            return index >= 0 ? index + 1 : 0;
        }

        private ResolvedExpr resolveColumn(Column column, Scope scope) throws SqlAnalysisException {
            String name = normalize(column.getColumnName());
            Table table = column.getTable();
            String tableName = table != null && table.getName() != null ? normalize(table.getName()) : null;
            String schemaName = table != null && table.getSchemaName() != null ? normalize(table.getSchemaName()) : null;
            List<String> parts = new ArrayList<>();
            if (schemaName != null) {
                parts.add(schemaName);
            }
            if (tableName != null) {
                parts.add(tableName);
            }
            parts.add(name);
            int location = QueryText.positionOf(sql, parts.get(0));

            ResolvedExpr fromRange = null;
            SqlAnalysisException rangeError = null;
            boolean entryExists = false;
            if (tableName == null) {
                fromRange = findUnqualified(name, scope, location);
            } else {
                RangeEntry entry = findEntry(scope, tableName);
                if (entry != null && (schemaName == null || entry.relation == null
                        || schemaName.equals(entry.relation.getSchema()))) {
                    entryExists = true;
                    ResolvedColumn found = entry.find(name);
                    if (found != null) {
                        fromRange = ResolvedExpr.column(entry.relation, name, found.getType(), location);
                    } else if (entry.opaque) {
                        fromRange = ResolvedExpr.column(null, name, BuiltinTypes.UNKNOWN, location);
                    } else {
                        rangeError = new SqlAnalysisException("42703", "column " + tableName + "." + name
                                + " does not exist", location);
                    }
                }
            }

            ParamRef ref = null;
            SqlAnalysisException paramError = null;
            try {
                ref = params.resolveName(parts);
            } catch (SqlAnalysisException e) {
                paramError = e;
            }

            if (fromRange != null && ref != null) {
                String display = String.join(".", parts);
                throw new SqlAnalysisException("42702", "column reference \"" + display + "\" is ambiguous",
                        "It could refer to either a PL/pgSQL variable or a table column.", null, location);
            }
            if (fromRange != null) {
                return fromRange;
            }
            if (ref != null) {
                query.addParamRef(ref);
                return ResolvedExpr.param(ref, location);
            }
            if (rangeError != null) {
                throw rangeError;
            }
            if (paramError != null && !entryExists) {
                throw paramError.getPosition() == 0 ? paramError.withPosition(location) : paramError;
            }
            if (tableName == null) {
                if (name.equals("true") || name.equals("false")) {
                    return ResolvedExpr.constant(BuiltinTypes.BOOL, name, location);
                }
                if (SQL_VALUE_FUNCTIONS.contains(name)) {
                    return sqlValueFunction(name, location);
                }
                RangeEntry wholeRow = findEntry(scope, name);
                if (wholeRow != null) {
                    return new ResolvedExpr(ResolvedExpr.Kind.ROW, wholeRow.rowType(), location, null);
                }
                throw new SqlAnalysisException("42703", "column \"" + name + "\" does not exist", location);
            }
            throw new SqlAnalysisException("42P01", "missing FROM-clause entry for table \"" + tableName + "\"",
                    location);
        }

        private ResolvedExpr findUnqualified(String name, Scope scope, int location) throws SqlAnalysisException {
            for (Scope current = scope; current != null; current = current.parent) {
                ResolvedExpr found = null;
                for (RangeEntry entry : current.entries) {
                    ResolvedColumn column = entry.find(name);
                    if (column == null) {
                        continue;
                    }
                    if (found != null) {
                        throw new SqlAnalysisException("42702", "column reference \"" + name + "\" is ambiguous",
                                location);
                    }
                    found = ResolvedExpr.column(entry.relation, name, column.getType(), location);
                }
                if (found != null) {
                    return found;
                }
            }
            return null;
        }

        private ResolvedExpr sqlValueFunction(String name, int location) throws SqlAnalysisException {
            String function = name.equals("user") ? "current_user"
                    : name.equals("current_catalog") ? "current_database" : name;
            List<FunctionInfo> candidates = catalog.findFunctions(new QualifiedName(null, function));
            if (candidates.isEmpty()) {
                return ResolvedExpr.constant(BuiltinTypes.NAME, null, location);
            }
            ResolvedExpr call = ResolvedExpr.function(candidates.get(0), function, candidates.get(0).getReturnType(),
                    location, new ArrayList<>());
            query.addFunctionCall(call);
            return call;
        }

        private ResolvedExpr resolvePositional(JdbcParameter parameter) throws SqlAnalysisException {
            Integer index = parameter.getIndex();
            int number = index != null ? index : 0;
            int location = QueryText.positionOf(sql, null);
            int dollar = sql.indexOf("$" + number);
            if (dollar >= 0) {
                location = dollar + 1;
            }
            ParamRef ref = params.resolveNumber(number);
            if (ref == null) {
                throw new SqlAnalysisException("42P02", "there is no parameter $" + number, location);
            }
            query.addParamRef(ref);
            return ResolvedExpr.param(ref, location);
        }

        private ResolvedExpr resolveTimeKey(TimeKeyExpression expression) throws SqlAnalysisException {
            String key = expression.getStringValue().toLowerCase(Locale.ROOT);
            PgType type;
            switch (key) {
                case "current_date":
                    type = BuiltinTypes.DATE;
                    break;
                case "current_time":
                    type = BuiltinTypes.TIMETZ;
                    break;
                case "localtime":
                    type = BuiltinTypes.TIME;
                    break;
                case "localtimestamp":
                    type = BuiltinTypes.TIMESTAMP;
                    break;
                default:
                    type = BuiltinTypes.TIMESTAMPTZ;
            }
            List<FunctionInfo> now = catalog.findFunctions(new QualifiedName(null, "now"));
            ResolvedExpr call = ResolvedExpr.function(now.isEmpty() ? null : now.get(0), key, type,
                    QueryText.positionOf(sql, key), new ArrayList<>());
            query.addFunctionCall(call);
            return call;
        }

        private ResolvedExpr resolveCast(CastExpression cast, Scope scope) throws SqlAnalysisException {
            ResolvedExpr source = resolve(cast.getLeftExpression(), scope);
            String typeName = cast.getColDataType().toString();
            PgType target = catalog.findType(typeName);
            if (target == null) {
                throw new SqlAnalysisException("42704", "type \"" + BuiltinTypes.normalize(typeName)
                        + "\" does not exist", QueryText.positionOf(sql, cast.getColDataType().getDataType()));
            }
            CastContext context = CastRules.castContext(source.getType(), target);
            if (context == CastContext.NONE) {
                throw new SqlAnalysisException("42846", "cannot cast type " + source.getType().getName() + " to "
                        + target.getName(), source.getLocation());
            }
            if (source.getKind() == ResolvedExpr.Kind.CONST && source.getType().isUnknown()) {
                return ResolvedExpr.constant(target, source.getText(), source.getLocation());
            }
            return ResolvedExpr.cast(source, target, false, !CastRules.isBinaryCoercible(source.getType(), target));
        }

        private ResolvedExpr resolveIn(InExpression in, Scope scope) throws SqlAnalysisException {
            ResolvedExpr left = resolve(in.getLeftExpression(), scope);
            List<ResolvedExpr> children = new ArrayList<>();
            children.add(left);
            Expression right = in.getRightExpression();
            if (right instanceof Select) {
                List<ResolvedColumn> columns = analyzeSelect((Select) right, scope);
                if (columns.size() != 1 && left.getKind() != ResolvedExpr.Kind.ROW) {
                    throw new SqlAnalysisException("42601", "subquery has too many columns",
                            QueryText.positionOf(sql, "select"));
                }
                if (columns.size() == 1) {
                    children.add(comparison("=", left,
                            new ResolvedExpr(ResolvedExpr.Kind.SUBLINK, columns.get(0).getType(), 0, null)));
                }
                return new ResolvedExpr(ResolvedExpr.Kind.SUBLINK, BuiltinTypes.BOOL, left.getLocation(), children);
            }
            if (right instanceof ExpressionList) {
                for (Object item : (ExpressionList<?>) right) {
                    children.add(comparison("=", left, resolve((Expression) item, scope)));
                }
            } else if (right != null) {
                children.add(resolve(right, scope));
            }
            return new ResolvedExpr(ResolvedExpr.Kind.BOOL, BuiltinTypes.BOOL, left.getLocation(), children);
        }

        private ResolvedExpr resolveCase(CaseExpression expression, Scope scope) throws SqlAnalysisException {
            List<ResolvedExpr> children = new ArrayList<>();
            ResolvedExpr test = expression.getSwitchExpression() != null
                    ? resolve(expression.getSwitchExpression(), scope)
                    : null;
            PgType resultType = null;
            for (WhenClause when : expression.getWhenClauses()) {
                ResolvedExpr condition = resolve(when.getWhenExpression(), scope);
                children.add(test != null ? comparison("=", test, condition) : requireBoolean(condition, "CASE/WHEN"));
                ResolvedExpr result = resolve(when.getThenExpression(), scope);
                children.add(result);
                resultType = mergeResultType(resultType, result, "CASE");
            }
            if (expression.getElseExpression() != null) {
                ResolvedExpr otherwise = resolve(expression.getElseExpression(), scope);
                children.add(otherwise);
                resultType = mergeResultType(resultType, otherwise, "CASE");
            }
            if (resultType == null || resultType.isUnknown()) {
                resultType = BuiltinTypes.TEXT;
            }
            return new ResolvedExpr(ResolvedExpr.Kind.CASE, resultType, QueryText.positionOf(sql, "case"), children);
        }

        private PgType mergeResultType(PgType current, ResolvedExpr next, String construct)
                throws SqlAnalysisException {
            if (current == null) {
                return next.getType();
            }
            PgType common = CastRules.commonType(current, next.getType());
            if (common == null) {
                throw new SqlAnalysisException("42804", construct + " types " + current.getName() + " and "
                        + next.getType().getName() + " cannot be matched", next.getLocation());
            }
            return common;
        }

        private ResolvedExpr comparison(String symbol, ResolvedExpr left, ResolvedExpr right)
                throws SqlAnalysisException {
            PgType leftType = left.getType();
            PgType rightType = right.getType();
            OperatorInfo operator = catalog.findOperator(symbol, leftType, rightType);
            if (operator != null) {
                query.addOperator(operator);
                return ResolvedExpr.operator(symbol, operator, operator.getResult(), left.getLocation(),
                        List.of(left, right));
            }
            if (leftType.isUnknown() || rightType.isUnknown() || leftType.isPolymorphic()
                    || rightType.isPolymorphic()) {
                return ResolvedExpr.operator(symbol, null, BuiltinTypes.BOOL, left.getLocation(), List.of(left, right));
            }
            if (leftType.isComposite() && rightType.isComposite()) {
                return ResolvedExpr.operator(symbol, null, BuiltinTypes.BOOL, left.getLocation(), List.of(left, right));
            }
            PgType common = CastRules.commonType(leftType, rightType);
            if (common == null) {
                throw new SqlAnalysisException("42883", "operator does not exist: " + leftType.getName() + " "
                        + symbol + " " + rightType.getName(), null, NO_OPERATOR_HINT, left.getLocation());
            }
            return ResolvedExpr.operator(symbol, null, BuiltinTypes.BOOL, left.getLocation(),
                    List.of(coerce(left, common), coerce(right, common)));
        }

        private ResolvedExpr arithmetic(String symbol, ResolvedExpr left, ResolvedExpr right)
                throws SqlAnalysisException {
            PgType leftType = left.getType();
            PgType rightType = right.getType();
            OperatorInfo operator = catalog.findOperator(symbol, leftType, rightType);
            if (operator != null) {
                query.addOperator(operator);
                return ResolvedExpr.operator(symbol, operator, operator.getResult(), left.getLocation(),
                        List.of(left, right));
            }
            PgType result = arithmeticResult(symbol, leftType, rightType);
            if (result == null) {
                throw new SqlAnalysisException("42883", "operator does not exist: " + leftType.getName() + " "
                        + symbol + " " + rightType.getName(), null, NO_OPERATOR_HINT, left.getLocation());
            }
            List<ResolvedExpr> operands = List.of(left, right);
            if (isNumeric(leftType) && isNumeric(rightType)) {
                operands = List.of(coerce(left, result), coerce(right, result));
            }
            return ResolvedExpr.operator(symbol, null, result, left.getLocation(), operands);
        }

        private PgType arithmeticResult(String symbol, PgType left, PgType right) {
            if (left.isUnknown() && right.isUnknown()) {
                return BuiltinTypes.UNKNOWN;
            }
            if (left.isUnknown()) {
                return right;
            }
            if (right.isUnknown()) {
                return left;
            }
            if (isNumeric(left) && isNumeric(right)) {
                return CastRules.commonType(left, right);
            }
            String l = left.getInternalName();
            String r = right.getInternalName();
            boolean additive = symbol.equals("+") || symbol.equals("-");
            if (l.equals("date") && additive && isInteger(right)) {
                return BuiltinTypes.DATE;
            }
            if (l.equals("date") && r.equals("date") && symbol.equals("-")) {
                return BuiltinTypes.INT4;
            }
            if (left.getCategory() == TypeCategory.DATETIME && r.equals("interval") && additive) {
                return l.equals("date") ? BuiltinTypes.TIMESTAMP : left;
            }
            if (l.equals("interval") && right.getCategory() == TypeCategory.DATETIME && symbol.equals("+")) {
                return r.equals("date") ? BuiltinTypes.TIMESTAMP : right;
            }
            if (left.getCategory() == TypeCategory.DATETIME && left.equals(right) && symbol.equals("-")) {
                return BuiltinTypes.INTERVAL;
            }
            if (l.equals("date") && (r.equals("time") || r.equals("timetz")) && symbol.equals("+")) {
                return BuiltinTypes.TIMESTAMP;
            }
            if (l.equals("interval") && r.equals("interval") && additive) {
                return BuiltinTypes.INTERVAL;
            }
            if (l.equals("interval") && isNumeric(right) && (symbol.equals("*") || symbol.equals("/"))) {
                return BuiltinTypes.INTERVAL;
            }
            if (isNumeric(left) && r.equals("interval") && symbol.equals("*")) {
                return BuiltinTypes.INTERVAL;
            }
            return null;
        }

        private boolean isNumeric(PgType type) {
            return type.getCategory() == TypeCategory.NUMERIC && !type.getInternalName().startsWith("reg")
                    && !type.getInternalName().equals("oid");
        }

        private boolean isInteger(PgType type) {
            return type.equals(BuiltinTypes.INT2) || type.equals(BuiltinTypes.INT4) || type.equals(BuiltinTypes.INT8);
        }

        private ResolvedExpr coerce(ResolvedExpr expr, PgType target) {
            PgType type = expr.getType();
            if (type.equals(target) || type.isUnknown() || target.isPolymorphic()) {
                return expr;
            }
            return ResolvedExpr.cast(expr, target, true, !CastRules.isBinaryCoercible(type, target));
        }

        private ResolvedExpr requireBoolean(ResolvedExpr expr, String construct) throws SqlAnalysisException {
            PgType type = expr.getType();
            if (!type.isUnknown() && !type.equals(BuiltinTypes.BOOL) && !type.isPolymorphic()) {
                throw new SqlAnalysisException("42804", "argument of " + construct + " must be type boolean, not type "
                        + type.getName(), expr.getLocation());
            }
            return expr;
        }

        // ------------------------------------------------------------------ functions

        private List<ResolvedExpr> resolveArguments(ExpressionList<?> parameters, Scope scope)
                throws SqlAnalysisException {
            List<ResolvedExpr> args = new ArrayList<>();
            if (parameters == null) {
                return args;
            }
            for (Object parameter : parameters) {
                if (parameter instanceof AllColumns) {
                    continue;
                }
                args.add(resolve((Expression) parameter, scope));
            }
            return args;
        }

        private ResolvedExpr resolveFunction(Function function, Scope scope) throws SqlAnalysisException {
            QualifiedName name = QualifiedName.parse(function.getName());
            int location = QueryText.positionOf(sql, name.getName());
            List<ResolvedExpr> args = resolveArguments(function.getParameters(), scope);
            if (function.getNamedParameters() != null) {
                for (Object parameter : function.getNamedParameters().getExpressions()) {
                    args.add(resolve((Expression) parameter, scope));
                }
                return resolveNamedCall(name, location, args);
            }

            if (!name.isQualified()) {
                switch (name.getName()) {
                    case "coalesce":
                    case "greatest":
                    case "least": {
                        PgType type = null;
                        for (ResolvedExpr arg : args) {
                            type = mergeResultType(type, arg, name.getName().toUpperCase(Locale.ROOT));
                        }
                        if (type == null || type.isUnknown()) {
                            type = BuiltinTypes.TEXT;
                        }
                        List<ResolvedExpr> coerced = new ArrayList<>();
                        for (ResolvedExpr arg : args) {
                            coerced.add(coerce(arg, type));
                        }
                        return ResolvedExpr.function(null, name.getName(), type, location, coerced);
                    }
                    case "nullif":
                        return ResolvedExpr.function(null, name.getName(),
                                args.isEmpty() ? BuiltinTypes.UNKNOWN : args.get(0).getType(), location, args);
                    case "row":
                        return new ResolvedExpr(ResolvedExpr.Kind.ROW, BuiltinTypes.RECORD, location, args);
                    default:
                        break;
                }
            }

            List<PgType> argTypes = types(args);
            List<FunctionInfo> candidates = catalog.findFunctions(name);
            List<FunctionInfo> functions = new ArrayList<>();
            for (FunctionInfo candidate : candidates) {
                if (!candidate.isProcedure()) {
                    functions.add(candidate);
                }
            }
            FunctionInfo chosen = chooseCandidate(functions, argTypes);
            if (chosen == null) {
                if (!candidates.isEmpty() && functions.isEmpty()) {
                    throw new SqlAnalysisException("42809", name.getName() + signatureOf(argTypes)
                            + " is a procedure", null, "To call a procedure, use CALL.", location);
                }
                throw new SqlAnalysisException("42883", "function " + name.getName() + signatureOf(argTypes)
                        + " does not exist", null, NO_FUNCTION_HINT, location);
            }
            List<PgType> expected = expectedTypes(chosen, args.size());
            List<ResolvedExpr> coerced = new ArrayList<>();
            for (int i = 0; i < args.size(); i++) {
                coerced.add(coerce(args.get(i), expected.get(i)));
            }
            PgType returnType = resolvePolymorphic(chosen.getReturnType(), expected, argTypes);
            ResolvedExpr call = ResolvedExpr.function(chosen, name.getName(), returnType, location, coerced);
            query.addFunctionCall(call);
            return call;
        }

        private ResolvedExpr resolveNamedCall(QualifiedName name, int location, List<ResolvedExpr> args)
                throws SqlAnalysisException {
            List<FunctionInfo> candidates = catalog.findFunctions(name);
            if (candidates.isEmpty()) {
                throw new SqlAnalysisException("42883", "function " + name.getName() + signatureOf(types(args))
                        + " does not exist", null, NO_FUNCTION_HINT, location);
            }
            FunctionInfo chosen = candidates.get(0);
            ResolvedExpr call = ResolvedExpr.function(chosen, name.getName(),
                    chosen.getReturnType().isPolymorphic() ? BuiltinTypes.UNKNOWN : chosen.getReturnType(),
                    location, args);
            query.addFunctionCall(call);
            return call;
        }

        private ResolvedExpr resolveAnalytic(AnalyticExpression analytic, Scope scope) throws SqlAnalysisException {
            List<ResolvedExpr> args = new ArrayList<>();
            for (Expression arg : new Expression[]{analytic.getExpression(), analytic.getOffset(),
                    analytic.getDefaultValue()}) {
                if (arg != null && !(arg instanceof AllColumns)) {
                    args.add(resolve(arg, scope));
                }
            }
            if (analytic.getPartitionExpressionList() != null) {
                for (Object partition : analytic.getPartitionExpressionList()) {
                    resolve((Expression) partition, scope);
                }
            }
            if (analytic.getOrderByElements() != null) {
                for (OrderByElement order : analytic.getOrderByElements()) {
                    resolve(order.getExpression(), scope);
                }
            }
            if (analytic.getFilterExpression() != null) {
                requireBoolean(resolve(analytic.getFilterExpression(), scope), "FILTER");
            }
            QualifiedName name = QualifiedName.parse(analytic.getName());
            int location = QueryText.positionOf(sql, name.getName());
            List<PgType> argTypes = types(args);
            FunctionInfo chosen = chooseCandidate(catalog.findFunctions(name), argTypes);
            if (chosen == null) {
                throw new SqlAnalysisException("42883", "function " + name.getName() + signatureOf(argTypes)
                        + " does not exist", null, NO_FUNCTION_HINT, location);
            }
            PgType returnType = resolvePolymorphic(chosen.getReturnType(), expectedTypes(chosen, args.size()),
                    argTypes);
            ResolvedExpr call = ResolvedExpr.function(chosen, name.getName(), returnType, location, args);
            query.addFunctionCall(call);
            return call;
        }
    }

    // ------------------------------------------------------------------ overload resolution

    /**
     * Picks the best candidate for the argument types: exact matches score highest, then
     * unknown literals and polymorphic parameters, then implicit casts.
     *
     * @return the candidate, or {@code null} when none accepts the arguments
     */
    static FunctionInfo chooseCandidate(List<FunctionInfo> candidates, List<PgType> argTypes) {
        FunctionInfo best = null;
        int bestScore = -1;
        for (FunctionInfo candidate : candidates) {
            List<PgType> expected = expectedTypes(candidate, argTypes.size());
            if (expected == null) {
                continue;
            }
            int score = 0;
            boolean accepted = true;
            for (int i = 0; i < argTypes.size(); i++) {
                PgType actual = argTypes.get(i);
                PgType declared = expected.get(i);
                if (actual.equals(declared)) {
                    score += 3;
                } else if (actual.isUnknown() || declared.isPolymorphic()) {
                    score += 1;
                } else if (declared.isArray() && declared.getElementType().isPolymorphic() && actual.isArray()) {
                    score += 1;
                } else if (!CastRules.castContext(actual, declared).allowsImplicit()) {
                    accepted = false;
                    break;
                }
            }
            if (accepted && score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return best;
    }

    /**
     * Declared types matched against {@code argCount} actual arguments, expanding a
     * variadic parameter; {@code null} when the count does not fit.
     */
    static List<PgType> expectedTypes(FunctionInfo function, int argCount) {
        List<PgType> declared = new ArrayList<>();
        for (int i = 0; i < function.getArgTypes().size(); i++) {
            String mode = i < function.getArgModes().size() ? function.getArgModes().get(i) : "i";
            if (function.isProcedure() || !("o".equals(mode) || "t".equals(mode))) {
                declared.add(function.getArgTypes().get(i));
            }
        }
        if (function.isVariadic() && !declared.isEmpty()) {
            int fixed = declared.size() - 1;
            if (argCount < fixed) {
                return null;
            }
            PgType variadic = declared.get(fixed);
            PgType element = variadic.isArray() ? variadic.getElementType() : variadic;
            List<PgType> expected = new ArrayList<>(declared.subList(0, fixed));
            while (expected.size() < argCount) {
                expected.add(element);
            }
            return expected;
        }
        int required = declared.size() - function.getDefaultCount();
        if (argCount < required || argCount > declared.size()) {
            return null;
        }
        return declared.subList(0, argCount);
    }

    /**
     * Resolves a polymorphic result type from the actual argument types.
     */
    static PgType resolvePolymorphic(PgType declaredReturn, List<PgType> expected, List<PgType> actual) {
        if (!declaredReturn.isPolymorphic()) {
            return declaredReturn;
        }
        PgType element = null;
        PgType range = null;
        for (int i = 0; i < expected.size() && i < actual.size(); i++) {
            PgType declared = expected.get(i);
            PgType type = actual.get(i);
            if (type.isUnknown() || !declared.isPolymorphic()) {
                continue;
            }
            switch (declared.getInternalName()) {
                case "anyarray":
                case "anycompatiblearray":
                    if (type.isArray() && element == null) {
                        element = type.getElementType();
                    }
                    break;
                case "anyrange":
                case "anycompatiblerange":
                    range = type;
                    break;
                case "any":
                    break;
                default:
                    if (element == null) {
                        element = type;
                    } else {
                        PgType common = CastRules.commonType(element, type);
                        element = common != null ? common : element;
                    }
            }
        }
        switch (declaredReturn.getInternalName()) {
            case "anyarray":
            case "anycompatiblearray":
                return element != null ? BuiltinTypes.arrayOf(element) : BuiltinTypes.UNKNOWN;
            case "anyrange":
            case "anycompatiblerange":
                return range != null ? range : BuiltinTypes.UNKNOWN;
            default:
                return element != null ? element : BuiltinTypes.UNKNOWN;
        }
    }

    private static List<PgType> types(List<ResolvedExpr> exprs) {
        List<PgType> types = new ArrayList<>();
        for (ResolvedExpr expr : exprs) {
            types.add(expr.getType());
        }
        return types;
    }

    private static String signatureOf(List<PgType> types) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < types.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(types.get(i).getName());
        }
        return sb.append(')').toString();
    }

    /**
     * Column name PostgreSQL derives for an unaliased target entry.
     */
    static String columnName(Expression expression) {
        if (expression instanceof Column) {
            return normalize(((Column) expression).getColumnName());
        }
        if (expression instanceof Function) {
            return QualifiedName.parse(((Function) expression).getName()).getName();
        }
        if (expression instanceof AnalyticExpression) {
            return QualifiedName.parse(((AnalyticExpression) expression).getName()).getName();
        }
        if (expression instanceof CastExpression) {
            Expression inner = ((CastExpression) expression).getLeftExpression();
            String innerName = columnName(inner);
            if (!"?column?".equals(innerName)) {
                return innerName;
            }
            PgType type = BuiltinTypes.lookup(((CastExpression) expression).getColDataType().toString());
            return type != null ? type.getInternalName() : "?column?";
        }
        if (expression instanceof CaseExpression) {
            return "case";
        }
        if (expression instanceof ArrayConstructor) {
            return "array";
        }
        if (expression instanceof ExistsExpression) {
            return "exists";
        }
        return "?column?";
    }
}
