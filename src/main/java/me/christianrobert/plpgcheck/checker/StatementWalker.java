package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.ast.AssertStmt;
import me.christianrobert.plpgcheck.ast.AssignStmt;
import me.christianrobert.plpgcheck.ast.BlockStmt;
import me.christianrobert.plpgcheck.ast.CallStmt;
import me.christianrobert.plpgcheck.ast.CaseStmt;
import me.christianrobert.plpgcheck.ast.CloseStmt;
import me.christianrobert.plpgcheck.ast.CommitStmt;
import me.christianrobert.plpgcheck.ast.CompiledRoutine;
import me.christianrobert.plpgcheck.ast.Datum;
import me.christianrobert.plpgcheck.ast.DynExecuteStmt;
import me.christianrobert.plpgcheck.ast.ExceptionConditions;
import me.christianrobert.plpgcheck.ast.ExceptionHandler;
import me.christianrobert.plpgcheck.ast.ExecSqlStmt;
import me.christianrobert.plpgcheck.ast.ExitStmt;
import me.christianrobert.plpgcheck.ast.FetchStmt;
import me.christianrobert.plpgcheck.ast.ForCursorStmt;
import me.christianrobert.plpgcheck.ast.ForDynamicStmt;
import me.christianrobert.plpgcheck.ast.ForIntegerStmt;
import me.christianrobert.plpgcheck.ast.ForQueryStmt;
import me.christianrobert.plpgcheck.ast.ForeachStmt;
import me.christianrobert.plpgcheck.ast.GetDiagStmt;
import me.christianrobert.plpgcheck.ast.IfStmt;
import me.christianrobert.plpgcheck.ast.LoopStatement;
import me.christianrobert.plpgcheck.ast.LoopStmt;
import me.christianrobert.plpgcheck.ast.NullStmt;
import me.christianrobert.plpgcheck.ast.OpenStmt;
import me.christianrobert.plpgcheck.ast.PerformStmt;
import me.christianrobert.plpgcheck.ast.PlExpression;
import me.christianrobert.plpgcheck.ast.PlStatement;
import me.christianrobert.plpgcheck.ast.RaiseStmt;
import me.christianrobert.plpgcheck.ast.ReturnNextStmt;
import me.christianrobert.plpgcheck.ast.ReturnQueryStmt;
import me.christianrobert.plpgcheck.ast.ReturnStmt;
import me.christianrobert.plpgcheck.ast.RollbackStmt;
import me.christianrobert.plpgcheck.ast.RowDatum;
import me.christianrobert.plpgcheck.ast.StatementVisitor;
import me.christianrobert.plpgcheck.ast.Variable;
import me.christianrobert.plpgcheck.ast.WhileStmt;
import me.christianrobert.plpgcheck.catalog.BuiltinTypes;
import me.christianrobert.plpgcheck.catalog.ColumnInfo;
import me.christianrobert.plpgcheck.catalog.FunctionInfo;
import me.christianrobert.plpgcheck.catalog.PgType;
import me.christianrobert.plpgcheck.catalog.RelationInfo;
import me.christianrobert.plpgcheck.diagnostic.Diagnostic;
import me.christianrobert.plpgcheck.diagnostic.Severity;
import me.christianrobert.plpgcheck.parser.SqlText;
import me.christianrobert.plpgcheck.pragma.PragmaProcessor;
import me.christianrobert.plpgcheck.routine.TriggerType;
import me.christianrobert.plpgcheck.sql.ResolvedColumn;
import me.christianrobert.plpgcheck.sql.ResolvedExpr;
import me.christianrobert.plpgcheck.sql.ResolvedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Walks the statement tree of a compiled routine once, depth first. Loop bodies are
 * visited a single time. Each statement yields a {@link Flow} telling whether control
 * can fall through it; the verdict of the top block decides about a missing RETURN.
 */
class StatementWalker implements StatementVisitor<Flow> {

    private static final Logger log = LoggerFactory.getLogger(StatementWalker.class);

    private static final Set<String> RESERVED_KEYWORDS = Set.of(
            "all", "analyse", "analyze", "and", "any", "array", "as", "asc", "asymmetric", "both", "case",
            "cast", "check", "collate", "column", "constraint", "create", "current_catalog", "current_date",
            "current_role", "current_time", "current_timestamp", "current_user", "default", "deferrable",
            "desc", "distinct", "do", "else", "end", "except", "false", "fetch", "for", "foreign", "from",
            "grant", "group", "having", "in", "initially", "intersect", "into", "lateral", "leading", "limit",
            "localtime", "localtimestamp", "not", "null", "offset", "on", "only", "or", "order", "placing",
            "primary", "references", "returning", "select", "session_user", "some", "symmetric",
            "system_user", "table", "then", "to", "trailing", "true", "union", "unique", "user", "using",
            "variadic", "when", "where", "window", "with");

    private static final class LabelFrame {
        final String label;
        final boolean loop;
        boolean exited;

        LabelFrame(String label, boolean loop) {
            this.label = label;
            this.loop = loop;
        }
    }

    private final CheckState state;
    private final TargetAssigner targets;
    private final ExpressionChecker exprs;
    private final PragmaProcessor pragmas;
    private final Deque<LabelFrame> labels = new ArrayDeque<>();
    private final Map<Integer, ResolvedQuery> cursorQueries = new HashMap<>();
    private boolean foundReturnQuery;

    StatementWalker(CheckState state) {
        this.state = state;
        this.targets = new TargetAssigner(state);
        this.exprs = new ExpressionChecker(state, targets);
        this.pragmas = new PragmaProcessor(state);
    }

    /**
     * Walks the whole routine.
     *
     * @return the closing status of the routine body
     */
    ClosingStatus walk() {
        checkParameterNames();
        return checkStatement(state.getCompiled().getAction()).getStatus();
    }

    /**
     * Whether a static RETURN QUERY fills the result, so OUT variables need no assignment.
     */
    boolean isFoundReturnQuery() {
        return foundReturnQuery;
    }

    private void checkParameterNames() {
        CompiledRoutine routine = state.getCompiled();
        for (int varno : routine.getParamVarnos()) {
            String name = routine.getDatum(varno).getRefname();
            if (RESERVED_KEYWORDS.contains(name)) {
                state.report(Diagnostic.builder(Severity.WARNING_OTHERS,
                        "name of parameter \"" + name + "\" is reserved keyword")
                        .detail("The reserved keyword was used as parameter name."));
            }
        }
    }

    // ------------------------------------------------------------------ sequencing

    Flow checkStatements(List<PlStatement> statements) {
        Flow result = Flow.UNCLOSED;
        boolean deadCode = false;
        for (PlStatement stmt : statements) {
            if (state.isStopped()) {
                break;
            }
            Flow flow = checkStatement(stmt);
            if (deadCode && stmt.isVisible()) {
                reportAt(stmt, Diagnostic.builder(Severity.WARNING_EXTRA, "unreachable code"));
                deadCode = false;
            }
            switch (flow.getStatus()) {
                case CLOSED:
                    deadCode = true;
                    result = Flow.CLOSED;
                    break;
                case CLOSED_BY_EXCEPTIONS:
                    deadCode = true;
                    if (result.isRaising()) {
                        Set<String> codes = new LinkedHashSet<>(result.getExceptions());
                        codes.addAll(flow.getExceptions());
                        result = Flow.raising(codes);
                    } else if (result.getStatus() != ClosingStatus.CLOSED) {
                        result = flow;
                    }
                    break;
                case POSSIBLY_CLOSED:
                    if (result.getStatus() == ClosingStatus.UNCLOSED) {
                        result = flow;
                    }
                    break;
                default:
                    break;
            }
        }
        return result;
    }

    /**
     * Checks one statement. A fault inside becomes an error of that statement and the
     * walk goes on with the next one.
     */
    Flow checkStatement(PlStatement stmt) {
        if (state.isStopped()) {
            return Flow.UNCLOSED;
        }
        PlStatement parent = state.getCurrentStatement();
        state.setCurrentStatement(stmt);
        try {
            log.debug("Checking {} on line {}", stmt.getTypeName(), stmt.getLineno());
            return stmt.accept(this);
        } catch (RuntimeException e) {
            log.warn("Internal fault while checking {} on line {}", stmt.getTypeName(), stmt.getLineno(), e);
            state.report(Diagnostic.builder(Severity.ERROR,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .sqlState(SqlStates.INTERNAL_ERROR));
            return Flow.UNCLOSED;
        } finally {
            state.setCurrentStatement(parent);
        }
    }

    private void reportAt(PlStatement stmt, Diagnostic.Builder builder) {
        PlStatement current = state.getCurrentStatement();
        state.setCurrentStatement(stmt);
        try {
            state.report(builder);
        } finally {
            state.setCurrentStatement(current);
        }
    }

    // ------------------------------------------------------------------ blocks

    @Override
    public Flow visitBlock(BlockStmt stmt) {
        state.pushScope();
        labels.push(new LabelFrame(stmt.getLabel(), false));
        try {
            for (int varno : stmt.getDeclaredVarnos()) {
                declare(stmt, state.getCompiled().getDatum(varno));
            }
            Flow flow = checkStatements(stmt.getBody());
            if (stmt.hasExceptionSection()) {
                flow = checkHandlers(stmt, flow);
            }
            return flow;
        } finally {
            labels.pop();
            state.popScope();
        }
    }

    private void declare(BlockStmt block, Datum datum) {
        if (!datum.isInternal()) {
            checkDeclaredName(block, datum.getRefname());
        }
        PlExpression defaultValue = datum.getDefaultValue();
        if (defaultValue != null) {
            pragmas.processDeclaration(defaultValue.getQuery(), defaultValue.getNamespace(), defaultValue.getLineno());
            exprs.checkAssignment(defaultValue, datum.getVarno());
        }
        if (datum instanceof Variable && ((Variable) datum).isBoundCursor()) {
            ResolvedQuery query = exprs.checkDataQuery(((Variable) datum).getCursorQuery());
            if (query != null) {
                cursorQueries.put(datum.getVarno(), query);
            }
        }
    }

    private void checkDeclaredName(BlockStmt block, String name) {
        if (RESERVED_KEYWORDS.contains(name)) {
            state.report(Diagnostic.builder(Severity.WARNING_OTHERS,
                    "name of variable \"" + name + "\" is reserved keyword")
                    .detail("The reserved keyword was used as variable name."));
        }
        CompiledRoutine routine = state.getCompiled();
        for (int varno : routine.getParamVarnos()) {
            if (routine.getDatum(varno).getRefname().equals(name)) {
                state.report(Diagnostic.builder(Severity.WARNING_OTHERS, "parameter \"" + name + "\" is overlapped")
                        .detail("Local variable overlap function parameter."));
                break;
            }
        }
        if (block.getOuterNamespace() == null) {
            return;
        }
        int outer = block.getOuterNamespace().lookupVariable(name);
        if (outer >= 0 && !routine.getDatum(outer).isAutoVariable()) {
            state.report(Diagnostic.builder(Severity.WARNING_EXTRA,
                    "variable \"" + name + "\" shadows a previously defined variable")
                    .hint("SET plpgsql.extra_warnings TO 'shadowed_variables'"));
        }
    }

    /**
     * Handlers turn the exceptions they catch into their own flow. Codes no handler catches
     * leave the block only when the handlers themselves end by raising.
     */
    private Flow checkHandlers(BlockStmt block, Flow body) {
        state.markRead(block.getSqlStateVarno());
        state.markRead(block.getSqlErrmVarno());
        state.enterHandler();
        try {
            if (!body.isRaising()) {
                Flow result = body;
                for (ExceptionHandler handler : block.getHandlers()) {
                    result = Flow.merge(result, checkStatements(handler.getBody()), null);
                }
                return result;
            }
            Set<String> uncaught = new LinkedHashSet<>(body.getExceptions());
            Flow handled = null;
            for (ExceptionHandler handler : block.getHandlers()) {
                Flow handlerFlow = checkStatements(handler.getBody());
                List<String> conditions = conditionCodes(handler);
                Iterator<String> codes = uncaught.iterator();
                while (codes.hasNext()) {
                    String code = codes.next();
                    if (ExceptionConditions.catchesAny(conditions, code)) {
                        handled = Flow.merge(handled, handlerFlow, code);
                        codes.remove();
                    }
                }
            }
            if (handled == null) {
                return body;
            }
            if (!handled.isRaising() || uncaught.isEmpty()) {
                return handled;
            }
            return Flow.merge(handled, Flow.raising(uncaught), null);
        } finally {
            state.leaveHandler();
        }
    }

    private static List<String> conditionCodes(ExceptionHandler handler) {
        List<String> codes = new ArrayList<>();
        for (ExceptionHandler.Condition condition : handler.getConditions()) {
            codes.add(condition.getSqlState());
        }
        return codes;
    }

    // ------------------------------------------------------------------ assignment and branches

    @Override
    public Flow visitAssign(AssignStmt stmt) {
        if (stmt.getSubscripts().isEmpty()) {
            exprs.checkAssignment(stmt.getExpression(), stmt.getTargetVarno());
            return Flow.UNCLOSED;
        }
        for (PlExpression subscript : stmt.getSubscripts()) {
            exprs.checkExprWithExpectedType(subscript, BuiltinTypes.INT4);
        }
        targets.markTarget(stmt.getTargetVarno());
        Datum datum = state.getCompiled().getDatum(stmt.getTargetVarno());
        PgType arrayType = datum instanceof Variable ? ((Variable) datum).getType() : null;
        if (arrayType != null && !arrayType.isArray() && !arrayType.isUnknown()) {
            state.report(Diagnostic.builder(Severity.ERROR,
                    "subscripted object is not an array")
                    .sqlState(SqlStates.DATATYPE_MISMATCH));
            exprs.checkExpr(stmt.getExpression());
            return Flow.UNCLOSED;
        }
        ResolvedQuery query = exprs.prepareExpression(stmt.getExpression());
        if (query != null && arrayType != null && arrayType.getElementType() != null) {
            targets.checkTypes(arrayType.getElementType(), query.getTargetList().get(0).getType(),
                    ExpressionChecker.isNullConstant(query));
        }
        return Flow.UNCLOSED;
    }

    @Override
    public Flow visitIf(IfStmt stmt) {
        exprs.checkExprWithExpectedType(stmt.getCondition(), BuiltinTypes.BOOL);
        Flow paths = Flow.merge(null, checkStatements(stmt.getThenBody()), null);
        for (IfStmt.ElsifClause elsif : stmt.getElsifs()) {
            exprs.checkExprWithExpectedType(elsif.getCondition(), BuiltinTypes.BOOL);
            paths = Flow.merge(paths, checkStatements(elsif.getBody()), null);
        }
        if (stmt.getElseBody() != null) {
            return Flow.merge(paths, checkStatements(stmt.getElseBody()), null);
        }
        return Flow.merge(paths, Flow.UNCLOSED, null);
    }

    @Override
    public Flow visitCase(CaseStmt stmt) {
        PlExpression test = stmt.getTestExpression();
        if (test != null) {
            exprs.checkExpr(test);
        }
        Flow paths = null;
        for (CaseStmt.CaseWhen when : stmt.getWhens()) {
            if (test == null) {
                exprs.checkExprWithExpectedType(when.getExpression(), BuiltinTypes.BOOL);
            } else {
                PlExpression values = when.getExpression();
                for (String value : SqlText.splitTopLevel(values.getQuery(), ',')) {
                    exprs.checkExpr(new PlExpression(value, values.getLineno(), values.getNamespace()));
                }
            }
            paths = Flow.merge(paths, checkStatements(when.getBody()), null);
        }
        if (stmt.getElseBody() != null) {
            return Flow.merge(paths, checkStatements(stmt.getElseBody()), null);
        }
        // without ELSE an unmatched value raises case_not_found
        return Flow.merge(paths, Flow.raising(ExceptionConditions.CASE_NOT_FOUND), null);
    }

    // ------------------------------------------------------------------ loops

    private Flow checkLoopBody(LoopStatement loop) {
        LabelFrame frame = new LabelFrame(loop.getLabel(), true);
        labels.push(frame);
        try {
            Flow body = checkStatements(loop.getBody());
            return frame.exited ? body.possibly() : body;
        } finally {
            labels.pop();
        }
    }

    @Override
    public Flow visitLoop(LoopStmt stmt) {
        return checkLoopBody(stmt);
    }

    @Override
    public Flow visitWhile(WhileStmt stmt) {
        exprs.checkExprWithExpectedType(stmt.getCondition(), BuiltinTypes.BOOL);
        return checkLoopBody(stmt).possibly();
    }

    @Override
    public Flow visitForInteger(ForIntegerStmt stmt) {
        Datum counter = state.getCompiled().getDatum(stmt.getVarno());
        PgType type = counter instanceof Variable ? ((Variable) counter).getType() : BuiltinTypes.INT4;
        exprs.checkExprWithExpectedType(stmt.getLower(), type);
        exprs.checkExprWithExpectedType(stmt.getUpper(), type);
        exprs.checkExprWithExpectedType(stmt.getStep(), type);
        state.markWritten(stmt.getVarno());
        return checkLoopBody(stmt).possibly();
    }

    @Override
    public Flow visitForQuery(ForQueryStmt stmt) {
        ResolvedQuery query = exprs.checkDataQuery(stmt.getQuery());
        assignQueryResult(query, stmt.getTargetVarno());
        return checkLoopBody(stmt).possibly();
    }

    @Override
    public Flow visitForCursor(ForCursorStmt stmt) {
        Variable cursor = (Variable) state.getCompiled().getDatum(stmt.getCursorVarno());
        state.markRead(cursor.getVarno());
        if (!cursor.isBoundCursor()) {
            state.report(Diagnostic.builder(Severity.ERROR, "cursor FOR loop must use a bound cursor variable")
                    .sqlState(SqlStates.SYNTAX_ERROR));
            targets.markTarget(stmt.getTargetVarno());
            exprs.degradeRecord(stmt.getTargetVarno());
        } else {
            checkCursorArguments(cursor, stmt.getArguments());
            assignQueryResult(cursorQueries.get(cursor.getVarno()), stmt.getTargetVarno());
        }
        return checkLoopBody(stmt).possibly();
    }

    @Override
    public Flow visitForDynamic(ForDynamicStmt stmt) {
        ResolvedQuery query = exprs.checkDynamicQuery(stmt.getQuery(), stmt.getParams());
        exprs.assignDynamicResult(query, stmt.getTargetVarno());
        return checkLoopBody(stmt).possibly();
    }

    @Override
    public Flow visitForeach(ForeachStmt stmt) {
        PgType type = exprs.checkExpr(stmt.getExpression());
        if (type != null && !type.isArray() && !type.isUnknown() && !type.isPolymorphic()) {
            state.report(Diagnostic.builder(Severity.ERROR,
                    "FOREACH expression must yield an array, not type " + type.getName())
                    .sqlState(SqlStates.DATATYPE_MISMATCH));
            targets.markTarget(stmt.getTargetVarno());
        } else if (type == null || !type.isArray()) {
            targets.markTarget(stmt.getTargetVarno());
        } else if (stmt.getSlice() > 0) {
            targets.assignValue(stmt.getTargetVarno(), type, false);
        } else {
            targets.assignValue(stmt.getTargetVarno(), type.getElementType(), false);
        }
        return checkLoopBody(stmt).possibly();
    }

    private void assignQueryResult(ResolvedQuery query, int targetVarno) {
        if (query == null || query.isOpaque()) {
            targets.markTarget(targetVarno);
            exprs.degradeRecord(targetVarno);
            return;
        }
        targets.assignColumns(targetVarno, query.getTargetList(), false);
    }

    @Override
    public Flow visitExit(ExitStmt stmt) {
        exprs.checkExprWithExpectedType(stmt.getCondition(), BuiltinTypes.BOOL);
        String kind = stmt.isExit() ? "EXIT" : "CONTINUE";
        if (stmt.getLabel() != null) {
            LabelFrame target = findLabel(stmt.getLabel());
            if (target == null) {
                state.report(Diagnostic.builder(Severity.ERROR, "label \"" + stmt.getLabel() + "\" does not exist")
                        .sqlState(SqlStates.SYNTAX_ERROR));
            } else if (!target.loop && !stmt.isExit()) {
                state.report(Diagnostic.builder(Severity.ERROR,
                        "block label \"" + stmt.getLabel() + "\" cannot be used in CONTINUE")
                        .sqlState(SqlStates.SYNTAX_ERROR));
            } else if (stmt.isExit()) {
                target.exited = true;
            }
        } else {
            LabelFrame loop = nearestLoop();
            if (loop == null) {
                String message = stmt.isExit()
                        ? "EXIT cannot be used outside a loop, unless it has a label"
                        : "CONTINUE cannot be used outside a loop";
                state.report(Diagnostic.builder(Severity.ERROR, message).sqlState(SqlStates.SYNTAX_ERROR));
            } else if (stmt.isExit()) {
                loop.exited = true;
            }
        }
        log.debug("{} on line {} validated", kind, stmt.getLineno());
        return Flow.UNCLOSED;
    }

    private LabelFrame findLabel(String label) {
        for (LabelFrame frame : labels) {
            if (label.equals(frame.label)) {
                return frame;
            }
        }
        return null;
    }

    private LabelFrame nearestLoop() {
        for (LabelFrame frame : labels) {
            if (frame.loop) {
                return frame;
            }
        }
        return null;
    }

    // ------------------------------------------------------------------ returns

    @Override
    public Flow visitReturn(ReturnStmt stmt) {
        CompiledRoutine routine = state.getCompiled();
        PlExpression expression = stmt.getExpression();
        if (expression == null) {
            markResultRead();
            return Flow.CLOSED;
        }
        String problem = null;
        if (routine.isReturnsSet()) {
            problem = "RETURN cannot have a parameter in function returning set";
        } else if (routine.isProcedure()) {
            problem = "RETURN cannot have a parameter in a procedure";
        } else if (routine.hasOutParams()) {
            problem = "RETURN cannot have a parameter in function with OUT parameters";
        } else if (routine.getReturnType().isVoid()) {
            problem = "RETURN cannot have a parameter in function returning void";
        }
        if (problem != null) {
            Diagnostic.Builder builder = Diagnostic.builder(Severity.ERROR, problem)
                    .sqlState(SqlStates.DATATYPE_MISMATCH);
            if (routine.isReturnsSet()) {
                builder.hint("Use RETURN NEXT or RETURN QUERY.");
            }
            state.report(builder);
            exprs.checkExpr(expression);
        } else {
            checkReturnedValue(expression);
        }
        return Flow.CLOSED;
    }

    @Override
    public Flow visitReturnNext(ReturnNextStmt stmt) {
        if (!state.getCompiled().isReturnsSet()) {
            state.report(Diagnostic.builder(Severity.ERROR, "cannot use RETURN NEXT in a non-SETOF function")
                    .sqlState(SqlStates.DATATYPE_MISMATCH));
        }
        if (stmt.getExpression() == null) {
            markResultRead();
        } else if (state.getCompiled().hasOutParams()) {
            state.report(Diagnostic.builder(Severity.ERROR,
                    "RETURN NEXT cannot have a parameter in function with OUT parameters")
                    .sqlState(SqlStates.DATATYPE_MISMATCH));
            exprs.checkExpr(stmt.getExpression());
        } else {
            checkReturnedValue(stmt.getExpression());
        }
        return Flow.UNCLOSED;
    }

    @Override
    public Flow visitReturnQuery(ReturnQueryStmt stmt) {
        if (!state.getCompiled().isReturnsSet()) {
            state.report(Diagnostic.builder(Severity.ERROR, "cannot use RETURN QUERY in a non-SETOF function")
                    .sqlState(SqlStates.DATATYPE_MISMATCH));
        }
        ResolvedQuery query;
        if (stmt.getQuery() != null) {
            query = exprs.checkDataQuery(stmt.getQuery());
            foundReturnQuery = true;
        } else {
            query = exprs.checkDynamicQuery(stmt.getDynamicQuery(), stmt.getParams());
            if (query == null) {
                state.setResultFromDynamicSql(true);
            }
        }
        if (query != null && query.isReturnsTuples() && !query.isOpaque()) {
            checkResultShape(query.getTargetList());
        }
        return Flow.UNCLOSED;
    }

    /**
     * A bare RETURN or RETURN NEXT returns the OUT variables.
     */
    private void markResultRead() {
        CompiledRoutine routine = state.getCompiled();
        if (!routine.hasOutParams()) {
            return;
        }
        Datum out = routine.getDatum(routine.getOutVarno());
        state.markRead(out.getVarno());
        if (out instanceof RowDatum) {
            for (RowDatum.RowField field : ((RowDatum) out).getFields()) {
                state.markRead(field.getVarno());
            }
        }
    }

    /**
     * Columns a result row of the routine consists of, {@code null} when not known.
     */
    private List<ColumnInfo> resultColumns() {
        CompiledRoutine routine = state.getCompiled();
        List<ColumnInfo> columns = new ArrayList<>();
        if (routine.hasOutParams()) {
            Datum out = routine.getDatum(routine.getOutVarno());
            if (out instanceof RowDatum) {
                for (RowDatum.RowField field : ((RowDatum) out).getFields()) {
                    Datum datum = routine.getDatum(field.getVarno());
                    columns.add(new ColumnInfo(field.getName(),
                            datum instanceof Variable ? ((Variable) datum).getType() : null));
                }
                return columns;
            }
            if (out instanceof Variable) {
                columns.add(new ColumnInfo(out.getRefname(), ((Variable) out).getType()));
                return columns;
            }
            return null;
        }
        PgType type = routine.getReturnType();
        if (type.isComposite()) {
            return type.getFields().isEmpty() ? null : type.getFields();
        }
        if (type.isVoid() || type.isPolymorphic()) {
            return null;
        }
        columns.add(new ColumnInfo("?column?", type));
        return columns;
    }

    private void checkResultShape(List<ResolvedColumn> columns) {
        List<ColumnInfo> expected = resultColumns();
        if (expected == null) {
            return;
        }
        if (columns.size() != expected.size()) {
            state.report(Diagnostic.builder(Severity.ERROR, "structure of query does not match function result type")
                    .sqlState(SqlStates.DATATYPE_MISMATCH)
                    .detail("Number of returned columns (" + columns.size()
                            + ") does not match expected column count (" + expected.size() + ")."));
            return;
        }
        for (int i = 0; i < columns.size(); i++) {
            targets.checkTypes(expected.get(i).getType(), columns.get(i).getType(), false);
        }
    }

    private void checkReturnedValue(PlExpression expression) {
        ResolvedQuery query = exprs.prepareExpression(expression);
        if (query == null) {
            return;
        }
        PgType value = query.getTargetList().get(0).getType();
        boolean isNull = ExpressionChecker.isNullConstant(query);
        if (value == null || isNull) {
            return;
        }
        CompiledRoutine routine = state.getCompiled();
        PgType expected = routine.getReturnType();
        if (routine.getTriggerType() == TriggerType.DML) {
            checkTriggerResult(value);
            return;
        }
        if (routine.getTriggerType() == TriggerType.EVENT || expected.isPolymorphic()) {
            return;
        }
        if (expected.isComposite()) {
            if (!value.isComposite()) {
                if (!value.isUnknown()) {
                    state.report(Diagnostic.builder(Severity.ERROR,
                            "cannot return non-composite value from function returning composite type")
                            .sqlState(SqlStates.DATATYPE_MISMATCH));
                }
                return;
            }
            checkCompositeResult(expected.getFields(), value.getFields(),
                    "returned record type does not match expected record type");
            return;
        }
        targets.checkTypes(expected, value, false);
    }

    private void checkTriggerResult(PgType value) {
        if (!value.isComposite()) {
            if (!value.isUnknown()) {
                state.report(Diagnostic.builder(Severity.ERROR,
                        "cannot return non-composite value from function returning composite type")
                        .sqlState(SqlStates.DATATYPE_MISMATCH));
            }
            return;
        }
        RelationInfo relation = state.getTriggerRelation();
        if (relation != null) {
            checkCompositeResult(relation.getColumns(), value.getFields(),
                    "returned row structure does not match the structure of the triggering table");
        }
    }

    private void checkCompositeResult(List<ColumnInfo> expected, List<ColumnInfo> actual, String message) {
        if (expected.isEmpty() || actual.isEmpty()) {
            return;
        }
        if (expected.size() != actual.size()) {
            state.report(Diagnostic.builder(Severity.ERROR, message)
                    .sqlState(SqlStates.DATATYPE_MISMATCH)
                    .detail("Number of returned columns (" + actual.size()
                            + ") does not match expected column count (" + expected.size() + ")."));
            return;
        }
        for (int i = 0; i < expected.size(); i++) {
            targets.checkTypes(expected.get(i).getType(), actual.get(i).getType(), false);
        }
    }

    // ------------------------------------------------------------------ RAISE and ASSERT

    @Override
    public Flow visitRaise(RaiseStmt stmt) {
        if (stmt.isReraise()) {
            if (!state.isInHandler()) {
                state.report(Diagnostic.builder(Severity.ERROR,
                        "RAISE without parameters cannot be used outside an exception handler")
                        .sqlState(SqlStates.RERAISE_OUTSIDE_HANDLER));
            }
            return Flow.raising(ExceptionConditions.RERAISE);
        }
        for (PlExpression param : stmt.getParams()) {
            exprs.checkExpr(param);
        }
        String code = stmt.getSqlState();
        for (RaiseStmt.RaiseOption option : stmt.getOptions()) {
            exprs.checkExpr(option.getExpression());
            if ("errcode".equals(option.getName())) {
                code = errcodeOption(option.getExpression());
            }
        }
        if (stmt.getMessage() != null) {
            int placeholders = FormatStrings.countRaisePlaceholders(stmt.getMessage());
            if (placeholders > stmt.getParams().size()) {
                state.report(Diagnostic.builder(Severity.ERROR, "too few parameters specified for RAISE")
                        .sqlState(SqlStates.SYNTAX_ERROR));
            } else if (placeholders < stmt.getParams().size()) {
                state.report(Diagnostic.builder(Severity.ERROR, "too many parameters specified for RAISE")
                        .sqlState(SqlStates.SYNTAX_ERROR));
            }
        }
        if (!stmt.isException()) {
            return Flow.UNCLOSED;
        }
        return Flow.raising(code != null ? code : ExceptionConditions.RAISE_EXCEPTION);
    }

    /**
     * Code given by {@code USING ERRCODE = ...}; unknown unless it is a literal.
     */
    private static String errcodeOption(PlExpression expression) {
        String value = SqlText.literalValue(expression.getQuery());
        if (value == null) {
            return Flow.UNKNOWN_CODE;
        }
        if (ExceptionConditions.isValidSqlState(value)) {
            return value;
        }
        String code = ExceptionConditions.codeOf(value.toLowerCase(Locale.ROOT));
        return code != null ? code : Flow.UNKNOWN_CODE;
    }

    @Override
    public Flow visitAssert(AssertStmt stmt) {
        exprs.checkExprWithExpectedType(stmt.getCondition(), BuiltinTypes.BOOL);
        if (stmt.getMessage() != null) {
            exprs.checkExpr(stmt.getMessage());
        }
        return Flow.UNCLOSED;
    }

    // ------------------------------------------------------------------ SQL

    @Override
    public Flow visitExecSql(ExecSqlStmt stmt) {
        exprs.checkSqlStatement(stmt.getQuery(), stmt.isInto(), stmt.getTargetVarno());
        return Flow.UNCLOSED;
    }

    @Override
    public Flow visitDynExecute(DynExecuteStmt stmt) {
        ResolvedQuery query = exprs.checkDynamicQuery(stmt.getQuery(), stmt.getParams());
        if (stmt.isInto()) {
            if (query == null && isOutTarget(stmt.getTargetVarno())) {
                state.setResultFromDynamicSql(true);
            }
            exprs.assignDynamicResult(query, stmt.getTargetVarno());
        }
        return Flow.UNCLOSED;
    }

    private boolean isOutTarget(int varno) {
        CompiledRoutine routine = state.getCompiled();
        return routine.hasOutParams() && routine.getOutVarno() == varno
                || routine.getDatum(varno).getParamMode() != null && routine.getDatum(varno).getParamMode().isOutput();
    }

    @Override
    public Flow visitPerform(PerformStmt stmt) {
        PlExpression expression = stmt.getExpression();
        pragmas.process(expression.getQuery(), expression.getNamespace(), stmt.getLineno());
        exprs.prepareQuery(expression);
        return Flow.UNCLOSED;
    }

    @Override
    public Flow visitCall(CallStmt stmt) {
        ResolvedQuery query = exprs.prepareCall(stmt.getExpression());
        if (query == null || query.getFunctionCalls().isEmpty()) {
            return Flow.UNCLOSED;
        }
        ResolvedExpr call = query.getFunctionCalls().get(0);
        FunctionInfo procedure = call.getFunction();
        List<ResolvedExpr> args = call.getChildren();
        for (int i = 0; i < args.size(); i++) {
            if (procedure == null || !procedure.isOutputArgument(i)) {
                continue;
            }
            ResolvedExpr arg = args.get(i).unwrapCasts();
            if (arg.getKind() != ResolvedExpr.Kind.PARAM || arg.getParam() == null || arg.getParam().isPositional()) {
                state.report(Diagnostic.builder(Severity.ERROR, "procedure parameter \"$" + (i + 1)
                        + "\" is an output parameter but corresponding argument is not writable")
                        .sqlState(SqlStates.SYNTAX_ERROR));
                continue;
            }
            int varno = arg.getParam().getParamId();
            targets.assignValue(varno, procedure.getArgTypes().get(i), false);
        }
        return Flow.UNCLOSED;
    }

    @Override
    public Flow visitGetDiag(GetDiagStmt stmt) {
        if (stmt.isStacked() && !state.isInHandler()) {
            state.report(Diagnostic.builder(Severity.ERROR,
                    "GET STACKED DIAGNOSTICS cannot be used outside an exception handler")
                    .sqlState(SqlStates.RERAISE_OUTSIDE_HANDLER));
        }
        for (GetDiagStmt.DiagItem item : stmt.getItems()) {
            targets.assignValue(item.getTargetVarno(), diagnosticsItemType(item.getItem()), false);
        }
        return Flow.UNCLOSED;
    }

    private static PgType diagnosticsItemType(String item) {
        switch (item) {
            case "ROW_COUNT":
                return BuiltinTypes.INT8;
            case "PG_ROUTINE_OID":
                return BuiltinTypes.OID;
            default:
                return BuiltinTypes.TEXT;
        }
    }

    // ------------------------------------------------------------------ cursors

    @Override
    public Flow visitOpen(OpenStmt stmt) {
        Variable cursor = (Variable) state.getCompiled().getDatum(stmt.getCursorVarno());
        state.markRead(cursor.getVarno());
        if (cursor.isBoundCursor()) {
            checkCursorArguments(cursor, stmt.getArguments());
            return Flow.UNCLOSED;
        }
        if (stmt.getArguments() != null) {
            state.report(Diagnostic.builder(Severity.ERROR,
                    "cursor \"" + cursor.getRefname() + "\" has no arguments")
                    .sqlState(SqlStates.SYNTAX_ERROR));
        }
        ResolvedQuery query;
        if (stmt.getQuery() != null) {
            query = exprs.checkDataQuery(stmt.getQuery());
        } else {
            query = exprs.checkDynamicQuery(stmt.getDynamicQuery(), stmt.getParams());
        }
        if (query != null && !query.isOpaque()) {
            cursorQueries.put(cursor.getVarno(), query);
        } else {
            cursorQueries.remove(cursor.getVarno());
        }
        return Flow.UNCLOSED;
    }

    private void checkCursorArguments(Variable cursor, List<PlExpression> arguments) {
        List<Integer> argVarnos = cursor.getCursorArgVarnos();
        int given = arguments != null ? arguments.size() : 0;
        if (given < argVarnos.size()) {
            state.report(Diagnostic.builder(Severity.ERROR,
                    "not enough arguments for cursor \"" + cursor.getRefname() + "\"")
                    .sqlState(SqlStates.SYNTAX_ERROR));
        } else if (given > argVarnos.size()) {
            state.report(Diagnostic.builder(Severity.ERROR,
                    "too many arguments for cursor \"" + cursor.getRefname() + "\"")
                    .sqlState(SqlStates.SYNTAX_ERROR));
        }
        int count = Math.min(given, argVarnos.size());
        for (int i = 0; i < count; i++) {
            exprs.checkAssignment(arguments.get(i), argVarnos.get(i));
        }
    }

    @Override
    public Flow visitFetch(FetchStmt stmt) {
        state.markRead(stmt.getCursorVarno());
        if (stmt.isMove()) {
            return Flow.UNCLOSED;
        }
        assignQueryResult(cursorQueries.get(stmt.getCursorVarno()), stmt.getTargetVarno());
        return Flow.UNCLOSED;
    }

    @Override
    public Flow visitClose(CloseStmt stmt) {
        state.markRead(stmt.getCursorVarno());
        return Flow.UNCLOSED;
    }

    // ------------------------------------------------------------------ transactions

    @Override
    public Flow visitCommit(CommitStmt stmt) {
        checkTransactionControl();
        return Flow.UNCLOSED;
    }

    @Override
    public Flow visitRollback(RollbackStmt stmt) {
        checkTransactionControl();
        return Flow.UNCLOSED;
    }

    private void checkTransactionControl() {
        if (!state.getCompiled().isProcedure()) {
            state.report(Diagnostic.builder(Severity.ERROR, "invalid transaction termination")
                    .sqlState(SqlStates.INVALID_TRANSACTION_TERMINATION));
        } else if (state.isInHandler()) {
            state.report(Diagnostic.builder(Severity.ERROR,
                    "cannot commit while a subtransaction is active")
                    .sqlState(SqlStates.INVALID_TRANSACTION_TERMINATION));
        }
    }

    @Override
    public Flow visitNull(NullStmt stmt) {
        return Flow.UNCLOSED;
    }
}
