package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.ast.Datum;
import me.christianrobert.plpgcheck.ast.PlExpression;
import me.christianrobert.plpgcheck.ast.RecordDatum;
import me.christianrobert.plpgcheck.ast.Variable;
import me.christianrobert.plpgcheck.catalog.BuiltinTypes;
import me.christianrobert.plpgcheck.catalog.CastRules;
import me.christianrobert.plpgcheck.catalog.FunctionInfo;
import me.christianrobert.plpgcheck.catalog.OperatorInfo;
import me.christianrobert.plpgcheck.catalog.PgType;
import me.christianrobert.plpgcheck.catalog.RelationInfo;
import me.christianrobert.plpgcheck.catalog.Volatility;
import me.christianrobert.plpgcheck.diagnostic.Diagnostic;
import me.christianrobert.plpgcheck.diagnostic.Severity;
import me.christianrobert.plpgcheck.pragma.PragmaProcessor;
import me.christianrobert.plpgcheck.sql.CommandType;
import me.christianrobert.plpgcheck.sql.ParamRef;
import me.christianrobert.plpgcheck.sql.ResolvedExpr;
import me.christianrobert.plpgcheck.sql.ResolvedQuery;
import me.christianrobert.plpgcheck.sql.SqlAnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Resolves the SQL and expressions embedded in a routine and turns what the analyzer
 * finds into diagnostics. Every successfully resolved query also feeds the volatility
 * estimate, the dependency collector and the cast, sequence and format heuristics.
 */
class ExpressionChecker {

    private static final Logger log = LoggerFactory.getLogger(ExpressionChecker.class);

    private static final String SELECT_PREFIX = "SELECT ";
    private static final Set<String> SEQUENCE_FUNCTIONS = Set.of("nextval", "currval", "setval");

    private final CheckState state;
    private final TargetAssigner targets;
    private final InjectionDetector injections;

    ExpressionChecker(CheckState state, TargetAssigner targets) {
        this.state = state;
        this.targets = targets;
        this.injections = new InjectionDetector(state);
    }

    // ------------------------------------------------------------------ analysis

    /**
     * Resolves a complete SQL statement in the namespace of the expression.
     *
     * @return the resolved query, or {@code null} when the analyzer reported an error
     */
    ResolvedQuery prepareQuery(PlExpression expr) {
        return prepare(expr.getQuery(), expr.getQuery(), 0, new VariableResolver(state, expr.getNamespace()));
    }

    /**
     * Resolves a PL/pgSQL expression, which is evaluated as the single column of a SELECT.
     */
    ResolvedQuery prepareExpression(PlExpression expr) {
        ResolvedQuery query = prepare(SELECT_PREFIX + expr.getQuery(), expr.getQuery(), SELECT_PREFIX.length(),
                new VariableResolver(state, expr.getNamespace()));
        if (query != null && query.getTargetList().size() != 1) {
            state.report(Diagnostic.builder(Severity.ERROR, "query \"" + expr.getQuery() + "\" returned "
                    + query.getTargetList().size() + " columns")
                    .sqlState(SqlStates.SYNTAX_ERROR));
            return null;
        }
        return query;
    }

    /**
     * Resolves the argument list of a CALL statement.
     */
    ResolvedQuery prepareCall(PlExpression expr) {
        VariableResolver resolver = new VariableResolver(state, expr.getNamespace());
        try {
            ResolvedQuery query = state.getAnalyzer().analyzeCall(expr.getQuery(), resolver);
            afterAnalysis(query, expr.getQuery(), 0);
            return query;
        } catch (SqlAnalysisException e) {
            state.report(e, expr.getQuery());
            return null;
        }
    }

    /**
     * Resolves the text of a constant EXECUTE string; {@code $n} refers to the USING values.
     */
    ResolvedQuery prepareDynamic(String sql, List<PgType> usingTypes) {
        return prepare(sql, sql, 0, new VariableResolver(state, null, usingTypes));
    }

    private ResolvedQuery prepare(String sql, String displayed, int offset, VariableResolver resolver) {
        try {
            ResolvedQuery query = state.getAnalyzer().analyze(sql, resolver);
            afterAnalysis(query, displayed, offset);
            return query;
        } catch (SqlAnalysisException e) {
            log.debug("Analysis of \"{}\" failed: {}", displayed, e.getMessage());
            state.report(e.withPosition(shift(e.getPosition(), offset)), displayed);
            return null;
        }
    }

    private static int shift(int position, int offset) {
        return position > offset ? position - offset : 0;
    }

    private void afterAnalysis(ResolvedQuery query, String displayed, int offset) {
        for (ParamRef ref : query.getParamRefs()) {
            if (!ref.isPositional()) {
                state.markRead(ref.getParamId());
            }
        }

        if (query.getCommandType() == CommandType.TRANSACTION) {
            state.report(Diagnostic.builder(Severity.ERROR, "cannot begin/end transactions in PL/pgSQL")
                    .sqlState(SqlStates.FEATURE_NOT_SUPPORTED)
                    .hint("Use a BEGIN block with an EXCEPTION clause instead.")
                    .query(displayed, 0));
            return;
        }

        foldVolatility(query);

        boolean modifying = query.isDataModifying() || query.hasModifyingCte();
        if (modifying && state.getRoutine().getVolatility() != Volatility.VOLATILE) {
            state.report(Diagnostic.builder(Severity.ERROR,
                    query.getCommandType().name() + " is not allowed in a non volatile function")
                    .sqlState(SqlStates.FEATURE_NOT_SUPPORTED)
                    .query(displayed, 0));
        }

        if (state.getOptions().isShowDependencies()) {
            state.getDependencies().collect(query);
        }
        if (state.getOptions().isFishyCastCheckEnabled()) {
            checkFishyCasts(query, displayed, offset);
        }
        for (ResolvedExpr call : query.getFunctionCalls()) {
            checkFunctionCall(call, displayed, offset);
        }
    }

    private void foldVolatility(ResolvedQuery query) {
        if (query.getCommandType() != CommandType.SELECT || query.isForUpdate() || query.hasModifyingCte()
                || query.isOpaque()) {
            state.foldVolatility(Volatility.VOLATILE);
        }
        for (FunctionInfo function : query.getFunctions()) {
            state.foldVolatility(function.getVolatility());
        }
        for (OperatorInfo operator : query.getOperators()) {
            state.foldVolatility(operator.getVolatility());
        }
        if (!query.getRelations().isEmpty()) {
            state.foldVolatility(Volatility.STABLE);
        }
    }

    // ------------------------------------------------------------------ heuristics

    /**
     * A comparison of a column with a variable of another type casts the column, which
     * keeps an index on it from being used.
     */
    private void checkFishyCasts(ResolvedQuery query, String displayed, int offset) {
        for (ResolvedExpr condition : query.getConditions()) {
            condition.walk(node -> {
                if (node.getKind() != ResolvedExpr.Kind.OPERATOR || node.getChildren().size() != 2
                        || !BuiltinTypes.BOOL.equals(node.getType())) {
                    return;
                }
                ResolvedExpr left = node.getChildren().get(0);
                ResolvedExpr right = node.getChildren().get(1);
                ResolvedExpr param = isVariable(left) ? left : isVariable(right) ? right : null;
                ResolvedExpr other = param == left ? right : left;
                if (param == null || !isCastColumn(other, param.getType())) {
                    return;
                }
                state.report(Diagnostic.builder(Severity.WARNING_PERFORMANCE,
                        "implicit cast of attribute caused by different PLpgSQL variable type in WHERE clause")
                        .sqlState(SqlStates.DATATYPE_MISMATCH)
                        .detail("An index of some attribute cannot be used, when variable, used in predicate, "
                                + "has not right type like a attribute")
                        .hint("Check a variable type - int versus numeric")
                        .query(displayed, shift(param.getLocation(), offset)));
            });
        }
    }

    private static boolean isVariable(ResolvedExpr expr) {
        return expr.getKind() == ResolvedExpr.Kind.PARAM && expr.getParam() != null
                && !expr.getParam().isPositional();
    }

    private static boolean isCastColumn(ResolvedExpr expr, PgType paramType) {
        return expr.getKind() == ResolvedExpr.Kind.CAST && expr.isImplicitCast() && expr.isFunctionCast()
                && expr.getType().equals(paramType)
                && !expr.getChildren().isEmpty()
                && expr.getChildren().get(0).getKind() == ResolvedExpr.Kind.COLUMN;
    }

    private void checkFunctionCall(ResolvedExpr call, String displayed, int offset) {
        String name = call.getText();
        FunctionInfo function = call.getFunction();
        if (function == null || !function.isBuiltin() || call.getChildren().isEmpty()) {
            return;
        }
        ResolvedExpr first = call.getChildren().get(0).unwrapCasts();
        if (first.getKind() != ResolvedExpr.Kind.CONST || first.isNullConstant()) {
            return;
        }
        int location = shift(first.getLocation(), offset);
        if (SEQUENCE_FUNCTIONS.contains(name)) {
            RelationInfo relation = state.getCatalog().findRelation(first.getText());
            if (relation == null) {
                state.report(Diagnostic.builder(Severity.ERROR, "relation \"" + first.getText() + "\" does not exist")
                        .sqlState(SqlStates.UNDEFINED_TABLE)
                        .query(displayed, location));
            } else if (!relation.isSequence()) {
                state.report(Diagnostic.builder(Severity.ERROR, "\"" + relation.getName() + "\" is not a sequence")
                        .sqlState(SqlStates.WRONG_OBJECT_TYPE)
                        .query(displayed, location));
            }
        } else if ("format".equals(name)) {
            int valueArgs = call.getChildren().size() - 1;
            FormatStrings.FormatCheck check = FormatStrings.checkFormat(first.getText(), valueArgs);
            if (check.getError() != null) {
                state.report(Diagnostic.builder(Severity.ERROR, check.getError())
                        .sqlState(SqlStates.INVALID_PARAMETER_VALUE)
                        .query(displayed, location));
            } else if (check.getRequiredArgs() != -1 && check.getRequiredArgs() != valueArgs) {
                state.report(Diagnostic.builder(Severity.WARNING_OTHERS, "unused parameters of function \"format\"")
                        .query(displayed, location));
            }
        }
    }

    // ------------------------------------------------------------------ expressions

    /**
     * Checks an expression used as a value.
     *
     * @return its type, or {@code null} when it could not be resolved
     */
    PgType checkExpr(PlExpression expr) {
        if (expr == null) {
            return null;
        }
        ResolvedQuery query = prepareExpression(expr);
        return query != null ? query.getTargetList().get(0).getType() : null;
    }

    /**
     * Checks an expression whose value is stored into a slot of the given type, such as
     * an IF condition ({@code boolean}) or a FOR bound ({@code integer}).
     */
    void checkExprWithExpectedType(PlExpression expr, PgType expected) {
        if (expr == null) {
            return;
        }
        ResolvedQuery query = prepareExpression(expr);
        if (query != null) {
            targets.checkTypes(expected, query.getTargetList().get(0).getType(), isNullConstant(query));
        }
    }

    /**
     * Checks {@code target := expr}.
     */
    void checkAssignment(PlExpression expr, int targetVarno) {
        ResolvedQuery query = prepareExpression(expr);
        if (query == null) {
            targets.markTarget(targetVarno);
            return;
        }
        if (isPragmaCall(query)) {
            state.markRead(targetVarno);
        }
        targets.assignColumns(targetVarno, query.getTargetList(), isNullConstant(query));
        trackSanitizing(targetVarno, query.getTargetList().get(0).getExpression());
    }

    /**
     * A string variable assigned from a sanitized expression stays safe for EXECUTE.
     */
    private void trackSanitizing(int targetVarno, ResolvedExpr value) {
        if (!state.getFlags().isSecurityWarnings() || value == null) {
            return;
        }
        Datum datum = state.getCompiled().getDatum(targetVarno);
        if (datum instanceof Variable && CastRules.isStringType(((Variable) datum).getType())) {
            state.setSanitized(targetVarno, injections.findUnsafe(value) < 0);
        }
    }

    private static boolean isPragmaCall(ResolvedQuery query) {
        ResolvedExpr value = query.getTargetList().get(0).getExpression();
        return value != null && value.getKind() == ResolvedExpr.Kind.FUNCTION
                && PragmaProcessor.PRAGMA_FUNCTION.equals(value.getText());
    }

    static boolean isNullConstant(ResolvedQuery query) {
        if (query.getTargetList().size() != 1) {
            return false;
        }
        ResolvedExpr value = query.getTargetList().get(0).getExpression();
        return value != null && value.unwrapCasts().isNullConstant();
    }

    // ------------------------------------------------------------------ SQL statements

    /**
     * Checks an embedded SQL statement with optional INTO target.
     */
    void checkSqlStatement(PlExpression expr, boolean into, int targetVarno) {
        ResolvedQuery query = prepareQuery(expr);
        if (query == null) {
            if (into) {
                targets.markTarget(targetVarno);
            }
            return;
        }
        if (query.getCommandType() == CommandType.TRANSACTION) {
            return;
        }
        if (into) {
            if (!query.isReturnsTuples()) {
                state.report(Diagnostic.builder(Severity.ERROR, "INTO used with a command that cannot return data")
                        .sqlState(SqlStates.SYNTAX_ERROR));
                targets.markTarget(targetVarno);
                return;
            }
            if (query.isOpaque()) {
                targets.markTarget(targetVarno);
                degradeRecord(targetVarno);
                return;
            }
            targets.assignColumns(targetVarno, query.getTargetList(), false);
        } else if (query.isReturnsTuples() && query.getCommandType() == CommandType.SELECT) {
            state.report(Diagnostic.builder(Severity.ERROR, "query has no destination for result data")
                    .sqlState(SqlStates.SYNTAX_ERROR)
                    .hint("If you want to discard the results of a SELECT, use PERFORM instead.")
                    .query(expr.getQuery(), 0));
        }
    }

    /**
     * Checks a query that has to produce rows (FOR over a query, RETURN QUERY, OPEN FOR,
     * a cursor declaration).
     *
     * @return the resolved query, or {@code null}
     */
    ResolvedQuery checkDataQuery(PlExpression expr) {
        ResolvedQuery query = prepareQuery(expr);
        if (query != null && !query.isReturnsTuples()) {
            state.report(Diagnostic.builder(Severity.ERROR, "query does not return data")
                    .sqlState(SqlStates.SYNTAX_ERROR)
                    .query(expr.getQuery(), 0));
            return null;
        }
        return query;
    }

    // ------------------------------------------------------------------ dynamic SQL

    /**
     * Checks the query string and the USING values of a dynamic SQL statement.
     *
     * @return the resolved query when the string is a constant that resolves, otherwise {@code null}
     */
    ResolvedQuery checkDynamicQuery(PlExpression queryExpr, List<PlExpression> params) {
        List<PgType> usingTypes = new ArrayList<>();
        for (PlExpression param : params) {
            PgType type = checkExpr(param);
            usingTypes.add(type != null ? type : BuiltinTypes.UNKNOWN);
        }
        ResolvedQuery queryValue = prepareExpression(queryExpr);
        if (queryValue == null) {
            state.setUsesDynamicSql(true);
            return null;
        }
        ResolvedExpr value = queryValue.getTargetList().get(0).getExpression();
        ResolvedExpr constant = value != null ? value.unwrapCasts() : null;
        if (constant == null || constant.getKind() != ResolvedExpr.Kind.CONST || constant.isNullConstant()) {
            state.setUsesDynamicSql(true);
            checkInjection(queryExpr, value);
            return null;
        }

        String sql = constant.getText();
        ResolvedQuery query = prepareDynamic(sql, usingTypes);
        if (query == null) {
            return null;
        }
        boolean usesParams = false;
        for (ParamRef ref : query.getParamRefs()) {
            if (ref.isPositional()) {
                usesParams = true;
                break;
            }
        }
        boolean modifying = query.getCommandType() != CommandType.SELECT || query.hasModifyingCte();
        if (!modifying && !usesParams) {
            state.report(Diagnostic.builder(Severity.WARNING_PERFORMANCE, "immutable expression without parameters found")
                    .detail("the EXECUTE command is not necessary probably")
                    .hint("Don't use dynamic SQL when you can use static SQL."));
        }
        if (!params.isEmpty() && !usesParams) {
            state.report(Diagnostic.builder(Severity.WARNING_OTHERS,
                    "values passed to EXECUTE statement by USING clause was not used"));
        }
        return query;
    }

    private void checkInjection(PlExpression queryExpr, ResolvedExpr value) {
        if (value == null || !state.getFlags().isSecurityWarnings() || !state.getOptions().isInjectionCheckEnabled()) {
            return;
        }
        int location = injections.findUnsafe(value);
        if (location > 0) {
            state.report(Diagnostic.builder(Severity.WARNING_SECURITY, "text type variable is not sanitized")
                    .detail("The EXECUTE expression is SQL injection vulnerable.")
                    .hint("Use quote_ident, quote_literal or format function to secure variable.")
                    .query(queryExpr.getQuery(), shift(location, SELECT_PREFIX.length())));
        } else if (location == 0) {
            state.report(Diagnostic.builder(Severity.WARNING_SECURITY, "the expression is not SQL injection safe")
                    .detail("Cannot ensure so dynamic EXECUTE statement is SQL injection secure.")
                    .hint("Use quote_ident, quote_literal or format function to secure variable.")
                    .query(queryExpr.getQuery(), 0));
        }
    }

    /**
     * Assigns the result of dynamic SQL. Without a known result a record target loses
     * its shape, unless a pragma fixed it.
     */
    void assignDynamicResult(ResolvedQuery query, int targetVarno) {
        if (query != null && query.isReturnsTuples() && !query.isOpaque()) {
            targets.assignColumns(targetVarno, query.getTargetList(), false);
            return;
        }
        targets.markTarget(targetVarno);
        Datum datum = state.getCompiled().getDatum(targetVarno);
        if (datum instanceof RecordDatum && !((RecordDatum) datum).isTyped()
                && !state.getRecords().isHinted(targetVarno)) {
            state.getRecords().degrade(targetVarno);
            state.report(Diagnostic.builder(Severity.WARNING_OTHERS, "cannot determinate a result of dynamic SQL")
                    .detail("There is a risk of related false alarms.")
                    .hint("Don't use dynamic SQL and record type together, when you would check function."));
        }
    }

    /**
     * A record filled from a source without known shape accepts any field.
     */
    void degradeRecord(int varno) {
        Datum datum = state.getCompiled().getDatum(varno);
        if (datum instanceof RecordDatum) {
            state.getRecords().degrade(varno);
        }
    }
}
