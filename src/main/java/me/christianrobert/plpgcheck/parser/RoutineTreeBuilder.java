package me.christianrobert.plpgcheck.parser;

import me.christianrobert.plpgcheck.antlr.PlPgSqlParser;
import me.christianrobert.plpgcheck.antlr.PlPgSqlParserBaseVisitor;
import me.christianrobert.plpgcheck.ast.AssertStmt;
import me.christianrobert.plpgcheck.ast.AssignStmt;
import me.christianrobert.plpgcheck.ast.BlockStmt;
import me.christianrobert.plpgcheck.ast.CallStmt;
import me.christianrobert.plpgcheck.ast.CaseStmt;
import me.christianrobert.plpgcheck.ast.CloseStmt;
import me.christianrobert.plpgcheck.ast.CommitStmt;
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
import me.christianrobert.plpgcheck.ast.LoopStmt;
import me.christianrobert.plpgcheck.ast.Namespace;
import me.christianrobert.plpgcheck.ast.NullStmt;
import me.christianrobert.plpgcheck.ast.OpenStmt;
import me.christianrobert.plpgcheck.ast.PerformStmt;
import me.christianrobert.plpgcheck.ast.PlExpression;
import me.christianrobert.plpgcheck.ast.PlStatement;
import me.christianrobert.plpgcheck.ast.RaiseStmt;
import me.christianrobert.plpgcheck.ast.RecordDatum;
import me.christianrobert.plpgcheck.ast.ReturnNextStmt;
import me.christianrobert.plpgcheck.ast.ReturnQueryStmt;
import me.christianrobert.plpgcheck.ast.ReturnStmt;
import me.christianrobert.plpgcheck.ast.RollbackStmt;
import me.christianrobert.plpgcheck.ast.RowDatum;
import me.christianrobert.plpgcheck.ast.Variable;
import me.christianrobert.plpgcheck.ast.WhileStmt;
import me.christianrobert.plpgcheck.catalog.BuiltinTypes;
import me.christianrobert.plpgcheck.catalog.PgType;
import me.christianrobert.plpgcheck.catalog.QualifiedName;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenStream;
import org.antlr.v4.runtime.misc.Interval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the statement tree from the parse tree. Declarations are turned into datums as
 * they are met, so every expression captures exactly the names visible at its position.
 */
class RoutineTreeBuilder extends PlPgSqlParserBaseVisitor<PlStatement> {

    private static final Set<String> RAISE_LEVELS = Set.of("debug", "log", "info", "notice", "warning", "exception");
    private static final Set<String> RAISE_OPTIONS = Set.of("message", "detail", "hint", "errcode", "column",
            "constraint", "datatype", "table", "schema");
    private static final Set<Integer> IDENTIFIER_TOKENS = Set.of(PlPgSqlParser.IDENT, PlPgSqlParser.QUOTED_IDENT,
            PlPgSqlParser.ALIAS, PlPgSqlParser.CHAIN, PlPgSqlParser.CONSTANT, PlPgSqlParser.CURRENT,
            PlPgSqlParser.DIAGNOSTICS, PlPgSqlParser.NEXT, PlPgSqlParser.NO, PlPgSqlParser.QUERY,
            PlPgSqlParser.REVERSE, PlPgSqlParser.SCROLL, PlPgSqlParser.SLICE, PlPgSqlParser.STACKED);
    private static final Pattern CURSOR_LOOP_SOURCE =
            Pattern.compile("(?s)^\\s*([A-Za-z_][A-Za-z_0-9$]*|\"(?:[^\"]|\"\")+\")\\s*(?:\\((.*)\\))?\\s*$");

    private final CompileContext context;
    private final TokenStream tokens;
    private boolean topLevelPending = true;

    RoutineTreeBuilder(CompileContext context, TokenStream tokens) {
        this.context = context;
        this.tokens = tokens;
    }

    BlockStmt buildTopBlock(PlPgSqlParser.PlFunctionContext ctx) {
        return buildBlock(ctx.block());
    }

    // ---------------------------------------------------------------- blocks and declarations

    private BlockStmt buildBlock(PlPgSqlParser.BlockContext ctx) {
        boolean topLevel = topLevelPending;
        topLevelPending = false;
        int lineno = ctx.getStart().getLine();
        String label = ctx.labelDecl() != null ? identifier(ctx.labelDecl().identifier()) : null;
        checkEndLabel(label, ctx.identifier(), lineno);

        Namespace outer = context.getNamespace();
        context.setNamespace(outer.withLabel(label, Namespace.LabelKind.BLOCK));
        try {
            List<Integer> declared = new ArrayList<>();
            if (ctx.declSection() != null) {
                for (PlPgSqlParser.DeclarationContext decl : ctx.declSection().declaration()) {
                    declare(decl, declared);
                }
            }
            List<PlStatement> body = buildStmts(ctx.stmts());

            List<ExceptionHandler> handlers = new ArrayList<>();
            BlockStmt block;
            if (ctx.exceptionSection() != null) {
                Namespace bodyNamespace = context.getNamespace();
                Variable sqlState = exceptionVariable("sqlstate", lineno);
                Variable sqlErrm = exceptionVariable("sqlerrm", lineno);
                context.addToNamespace("sqlstate", sqlState.getVarno());
                context.addToNamespace("sqlerrm", sqlErrm.getVarno());
                for (PlPgSqlParser.ExceptionHandlerContext handler : ctx.exceptionSection().exceptionHandler()) {
                    handlers.add(new ExceptionHandler(handler.getStart().getLine(), conditions(handler),
                            buildStmts(handler.stmts())));
                }
                context.setNamespace(bodyNamespace);
                block = new BlockStmt(lineno, label, declared, body, handlers, outer, topLevel);
                block.setExceptionVarnos(sqlState.getVarno(), sqlErrm.getVarno());
            } else {
                block = new BlockStmt(lineno, label, declared, body, handlers, outer, topLevel);
            }
            return block;
        } finally {
            context.setNamespace(outer);
        }
    }

    private Variable exceptionVariable(String name, int lineno) {
        Variable variable = context.newVariable(name, lineno, BuiltinTypes.TEXT);
        variable.setInternal(true);
        variable.setAutoVariable(true);
        return variable;
    }

    private List<ExceptionHandler.Condition> conditions(PlPgSqlParser.ExceptionHandlerContext handler) {
        List<ExceptionHandler.Condition> conditions = new ArrayList<>();
        int lineno = handler.getStart().getLine();
        for (PlPgSqlParser.ExceptionConditionContext condition : handler.exceptionCondition()) {
            String name = identifier(condition.identifier());
            if ("sqlstate".equals(name) && condition.STRING() != null) {
                String code = SqlText.literalValue(condition.STRING().getText());
                if (!ExceptionConditions.isValidSqlState(code)) {
                    throw new RoutineCompileException("42601", "invalid SQLSTATE code", lineno);
                }
                conditions.add(new ExceptionHandler.Condition("sqlstate " + code, code));
            } else if (ExceptionConditions.OTHERS.equals(name)) {
                conditions.add(new ExceptionHandler.Condition(name, ExceptionConditions.OTHERS));
            } else {
                String code = ExceptionConditions.codeOf(name);
                if (code == null) {
                    throw new RoutineCompileException("42704", "unrecognized exception condition \"" + name + "\"",
                            lineno);
                }
                conditions.add(new ExceptionHandler.Condition(name, code));
            }
        }
        return conditions;
    }

    private void declare(PlPgSqlParser.DeclarationContext decl, List<Integer> declared) {
        int lineno = decl.getStart().getLine();
        if (decl instanceof PlPgSqlParser.AliasDeclContext) {
            PlPgSqlParser.AliasDeclContext alias = (PlPgSqlParser.AliasDeclContext) decl;
            String name = identifier(alias.identifier(0));
            String target = alias.DOLLAR_PARAM() != null
                    ? alias.DOLLAR_PARAM().getText()
                    : identifier(alias.identifier(1));
            int varno = context.getNamespace().lookupVariable(target);
            if (varno < 0) {
                throw new RoutineCompileException("42704", "variable \"" + target + "\" does not exist", lineno);
            }
            context.addToNamespace(name, varno);
        } else if (decl instanceof PlPgSqlParser.CursorDeclContext) {
            PlPgSqlParser.CursorDeclContext cursor = (PlPgSqlParser.CursorDeclContext) decl;
            String name = identifier(cursor.identifier());
            Namespace cursorNamespace = context.getNamespace();
            List<Integer> argVarnos = new ArrayList<>();
            for (PlPgSqlParser.CursorArgContext arg : cursor.cursorArg()) {
                Datum argument = context.newDatumOfType(identifier(arg.identifier()), lineno,
                        context.resolveType(text(arg.typeSpecArg()), lineno));
                argument.setInternal(true);
                argVarnos.add(argument.getVarno());
                cursorNamespace = cursorNamespace.withVariable(argument.getRefname(), argument.getVarno());
            }
            Variable variable = context.newVariable(name, lineno, BuiltinTypes.REFCURSOR);
            variable.setCursorQuery(new PlExpression(text(cursor.exprUntilSemi()),
                    cursor.exprUntilSemi().getStart().getLine(), cursorNamespace));
            variable.setCursorArgVarnos(argVarnos);
            context.addToNamespace(name, variable.getVarno());
            declared.add(variable.getVarno());
        } else {
            PlPgSqlParser.VarDeclContext var = (PlPgSqlParser.VarDeclContext) decl;
            String name = identifier(var.identifier(0));
            PgType type = context.resolveType(text(var.typeSpec()), lineno);
            PlExpression defaultValue = var.exprUntilSemi() != null
                    ? expression(var.exprUntilSemi())
                    : null;
            boolean notNull = var.NOT() != null;
            if (notNull && defaultValue == null) {
                throw new RoutineCompileException("22004", "variable \"" + name
                        + "\" must have a default value, since it's declared NOT NULL", lineno);
            }
            Datum datum = context.newDatumOfType(name, lineno, type);
            datum.setDefaultValue(defaultValue);
            if (datum instanceof Variable) {
                ((Variable) datum).setConstant(var.CONSTANT() != null);
                ((Variable) datum).setNotNull(notNull);
            }
            context.addToNamespace(name, datum.getVarno());
            declared.add(datum.getVarno());
        }
    }

    // ---------------------------------------------------------------- statements

    List<PlStatement> buildStmts(PlPgSqlParser.StmtsContext ctx) {
        List<PlStatement> result = new ArrayList<>();
        for (PlPgSqlParser.StmtContext stmt : ctx.stmt()) {
            result.add(visit(stmt));
        }
        return result;
    }

    @Override
    public PlStatement visitBlockStmt(PlPgSqlParser.BlockStmtContext ctx) {
        return buildBlock(ctx.block());
    }

    @Override
    public PlStatement visitAssignment(PlPgSqlParser.AssignmentContext ctx) {
        PlPgSqlParser.AssignStmtContext assign = ctx.assignStmt();
        int lineno = ctx.getStart().getLine();
        int target = resolveTarget(assign.assignTarget(), lineno);
        List<PlExpression> subscripts = new ArrayList<>();
        for (PlPgSqlParser.ExprUntilBracketContext subscript : assign.assignTarget().exprUntilBracket()) {
            subscripts.add(expression(subscript));
        }
        return new AssignStmt(lineno, target, subscripts, expression(assign.exprUntilSemi()));
    }

    @Override
    public PlStatement visitIfStatement(PlPgSqlParser.IfStatementContext ctx) {
        PlPgSqlParser.IfStmtContext stmt = ctx.ifStmt();
        List<IfStmt.ElsifClause> elsifs = new ArrayList<>();
        for (PlPgSqlParser.ElsifPartContext elsif : stmt.elsifPart()) {
            elsifs.add(new IfStmt.ElsifClause(elsif.getStart().getLine(), expression(elsif.exprUntilThen()),
                    buildStmts(elsif.stmts())));
        }
        List<PlStatement> elseBody = stmt.elsePart() != null ? buildStmts(stmt.elsePart().stmts()) : null;
        return new IfStmt(ctx.getStart().getLine(), expression(stmt.exprUntilThen()), buildStmts(stmt.stmts()),
                elsifs, elseBody);
    }

    @Override
    public PlStatement visitCaseStatement(PlPgSqlParser.CaseStatementContext ctx) {
        PlPgSqlParser.CaseStmtContext stmt = ctx.caseStmt();
        PlExpression test = stmt.exprUntilWhen() != null ? expression(stmt.exprUntilWhen()) : null;
        List<CaseStmt.CaseWhen> whens = new ArrayList<>();
        for (PlPgSqlParser.CaseWhenContext when : stmt.caseWhen()) {
            whens.add(new CaseStmt.CaseWhen(when.getStart().getLine(), expression(when.exprUntilThen()),
                    buildStmts(when.stmts())));
        }
        List<PlStatement> elseBody = stmt.elsePart() != null ? buildStmts(stmt.elsePart().stmts()) : null;
        return new CaseStmt(ctx.getStart().getLine(), test, whens, elseBody);
    }

    @Override
    public PlStatement visitLoopStatement(PlPgSqlParser.LoopStatementContext ctx) {
        PlPgSqlParser.LoopStmtContext stmt = ctx.loopStmt();
        int lineno = ctx.getStart().getLine();
        String label = loopLabel(stmt.labelDecl(), stmt.identifier(), lineno);
        Namespace saved = enterLoop(label);
        try {
            return new LoopStmt(lineno, label, buildStmts(stmt.stmts()));
        } finally {
            context.setNamespace(saved);
        }
    }

    @Override
    public PlStatement visitWhileStatement(PlPgSqlParser.WhileStatementContext ctx) {
        PlPgSqlParser.WhileStmtContext stmt = ctx.whileStmt();
        int lineno = ctx.getStart().getLine();
        String label = loopLabel(stmt.labelDecl(), stmt.identifier(), lineno);
        PlExpression condition = expression(stmt.exprUntilLoop());
        Namespace saved = enterLoop(label);
        try {
            return new WhileStmt(lineno, label, condition, buildStmts(stmt.stmts()));
        } finally {
            context.setNamespace(saved);
        }
    }

    @Override
    public PlStatement visitForStatement(PlPgSqlParser.ForStatementContext ctx) {
        PlPgSqlParser.ForStmtContext stmt = ctx.forStmt();
        int lineno = ctx.getStart().getLine();
        String label = loopLabel(stmt.labelDecl(), stmt.identifier(), lineno);
        PlPgSqlParser.ForSourceContext source = stmt.forSource();

        if (source instanceof PlPgSqlParser.ForIntegerSourceContext) {
            PlPgSqlParser.ForIntegerSourceContext range = (PlPgSqlParser.ForIntegerSourceContext) source;
            String name = singleTargetName(stmt.targetList(), lineno);
            PlExpression lower = expression(range.exprUntilDotDot());
            PlExpression upper = expression(range.exprUntilByLoop());
            PlExpression step = range.exprUntilLoop() != null ? expression(range.exprUntilLoop()) : null;
            Namespace saved = enterLoop(label);
            try {
                Variable counter = context.newVariable(name, lineno, BuiltinTypes.INT4);
                counter.setAutoVariable(true);
                counter.setInternal(true);
                context.addToNamespace(name, counter.getVarno());
                return new ForIntegerStmt(lineno, label, counter.getVarno(), lower, upper, step,
                        range.REVERSE() != null, buildStmts(stmt.stmts()));
            } finally {
                context.setNamespace(saved);
            }
        }

        if (source instanceof PlPgSqlParser.ForExecuteSourceContext) {
            PlPgSqlParser.ForExecuteSourceContext dynamic = (PlPgSqlParser.ForExecuteSourceContext) source;
            int target = resolveLoopTarget(stmt.targetList(), lineno);
            PlExpression query = expression(dynamic.exprUntilUsingLoop());
            List<PlExpression> params = expressions(dynamic.exprArgList());
            Namespace saved = enterLoop(label);
            try {
                return new ForDynamicStmt(lineno, label, target, query, params, buildStmts(stmt.stmts()));
            } finally {
                context.setNamespace(saved);
            }
        }

        PlPgSqlParser.ForQuerySourceContext querySource = (PlPgSqlParser.ForQuerySourceContext) source;
        String sourceText = text(querySource.exprUntilLoop());
        Matcher cursorMatch = CURSOR_LOOP_SOURCE.matcher(sourceText);
        if (cursorMatch.matches()) {
            int cursorVarno = context.getNamespace()
                    .lookupVariable(QualifiedName.normalizeIdentifier(cursorMatch.group(1)));
            if (cursorVarno >= 0 && isRefcursor(context.getDatum(cursorVarno))) {
                String name = singleTargetName(stmt.targetList(), lineno);
                List<PlExpression> arguments = new ArrayList<>();
                if (cursorMatch.group(2) != null) {
                    int argLine = querySource.getStart().getLine();
                    for (String argument : SqlText.splitTopLevel(cursorMatch.group(2), ',')) {
                        arguments.add(new PlExpression(argument, argLine, context.getNamespace()));
                    }
                }
                Namespace saved = enterLoop(label);
                try {
                    RecordDatum record = context.newRecord(name, lineno, null);
                    record.setInternal(true);
                    context.addToNamespace(name, record.getVarno());
                    return new ForCursorStmt(lineno, label, record.getVarno(), cursorVarno, arguments,
                            buildStmts(stmt.stmts()));
                } finally {
                    context.setNamespace(saved);
                }
            }
        }

        int target = resolveLoopTarget(stmt.targetList(), lineno);
        PlExpression query = expression(querySource.exprUntilLoop());
        Namespace saved = enterLoop(label);
        try {
            return new ForQueryStmt(lineno, label, target, query, buildStmts(stmt.stmts()));
        } finally {
            context.setNamespace(saved);
        }
    }

    @Override
    public PlStatement visitForeachStatement(PlPgSqlParser.ForeachStatementContext ctx) {
        PlPgSqlParser.ForeachStmtContext stmt = ctx.foreachStmt();
        int lineno = ctx.getStart().getLine();
        String label = loopLabel(stmt.labelDecl(), stmt.identifier(), lineno);
        int target = resolveTargetList(stmt.targetList(), lineno);
        int slice = stmt.NUMBER() != null ? Integer.parseInt(stmt.NUMBER().getText()) : 0;
        PlExpression array = expression(stmt.exprUntilLoop());
        Namespace saved = enterLoop(label);
        try {
            return new ForeachStmt(lineno, label, target, slice, array, buildStmts(stmt.stmts()));
        } finally {
            context.setNamespace(saved);
        }
    }

    @Override
    public PlStatement visitExitStatement(PlPgSqlParser.ExitStatementContext ctx) {
        PlPgSqlParser.ExitStmtContext stmt = ctx.exitStmt();
        String label = stmt.identifier() != null ? identifier(stmt.identifier()) : null;
        PlExpression condition = stmt.exprUntilSemi() != null ? expression(stmt.exprUntilSemi()) : null;
        return new ExitStmt(ctx.getStart().getLine(), stmt.EXIT() != null, label, condition);
    }

    @Override
    public PlStatement visitReturnStatement(PlPgSqlParser.ReturnStatementContext ctx) {
        PlPgSqlParser.ReturnStmtContext stmt = ctx.returnStmt();
        int lineno = ctx.getStart().getLine();
        if (stmt instanceof PlPgSqlParser.ReturnNextContext) {
            PlPgSqlParser.ExprUntilSemiContext expr = ((PlPgSqlParser.ReturnNextContext) stmt).exprUntilSemi();
            return new ReturnNextStmt(lineno, expr != null ? expression(expr) : null);
        }
        if (stmt instanceof PlPgSqlParser.ReturnQueryExecuteContext) {
            PlPgSqlParser.ReturnQueryExecuteContext dynamic = (PlPgSqlParser.ReturnQueryExecuteContext) stmt;
            return new ReturnQueryStmt(lineno, null, expression(dynamic.exprUntilUsingSemi()),
                    expressions(dynamic.exprArgList()));
        }
        if (stmt instanceof PlPgSqlParser.ReturnQueryContext) {
            return new ReturnQueryStmt(lineno, expression(((PlPgSqlParser.ReturnQueryContext) stmt).exprUntilSemi()),
                    null, Collections.emptyList());
        }
        PlPgSqlParser.ExprUntilSemiContext expr = ((PlPgSqlParser.ReturnPlainContext) stmt).exprUntilSemi();
        return new ReturnStmt(lineno, expr != null ? expression(expr) : null);
    }

    @Override
    public PlStatement visitRaiseStatement(PlPgSqlParser.RaiseStatementContext ctx) {
        PlPgSqlParser.RaiseStmtContext stmt = ctx.raiseStmt();
        int lineno = ctx.getStart().getLine();
        List<String> words = new ArrayList<>();
        for (PlPgSqlParser.RaiseWordContext word : stmt.raiseWord()) {
            words.add(CompileContext.lower(word.getText()));
        }
        String level = "exception";
        if (!words.isEmpty() && RAISE_LEVELS.contains(words.get(0))) {
            level = words.remove(0);
        }

        String conditionName = null;
        String sqlState = null;
        String message = null;
        List<PlExpression> params = new ArrayList<>();
        PlPgSqlParser.RaiseMessageContext raiseMessage = stmt.raiseMessage();

        if (!words.isEmpty() && "sqlstate".equals(words.get(0))) {
            if (raiseMessage == null) {
                throw new RoutineCompileException("42601", "syntax error at or near \"SQLSTATE\"", lineno);
            }
            sqlState = SqlText.literalValue(raiseMessage.STRING().getText());
            if (!ExceptionConditions.isValidSqlState(sqlState)) {
                throw new RoutineCompileException("42601", "invalid SQLSTATE code", lineno);
            }
            raiseMessage = null;
        } else if (!words.isEmpty()) {
            conditionName = words.get(0);
            sqlState = ExceptionConditions.codeOf(conditionName);
            if (sqlState == null) {
                throw new RoutineCompileException("42704", "unrecognized exception condition \"" + conditionName
                        + "\"", lineno);
            }
        }
        if (raiseMessage != null) {
            message = SqlText.literalValue(raiseMessage.STRING().getText());
            for (PlPgSqlParser.ExprArgContext arg : raiseMessage.exprArg()) {
                params.add(expression(arg));
            }
        }

        List<RaiseStmt.RaiseOption> options = new ArrayList<>();
        if (stmt.raiseUsing() != null) {
            for (PlPgSqlParser.RaiseOptionContext option : stmt.raiseUsing().raiseOption()) {
                String name = identifier(option.identifier());
                if (!RAISE_OPTIONS.contains(name)) {
                    throw new RoutineCompileException("42601", "unrecognized RAISE statement option \"" + name + "\"",
                            lineno);
                }
                options.add(new RaiseStmt.RaiseOption(name, expression(option.exprArg())));
            }
        }
        return new RaiseStmt(lineno, level, conditionName, sqlState, message, params, options);
    }

    @Override
    public PlStatement visitAssertStatement(PlPgSqlParser.AssertStatementContext ctx) {
        PlPgSqlParser.AssertStmtContext stmt = ctx.assertStmt();
        PlExpression message = stmt.exprUntilSemi() != null ? expression(stmt.exprUntilSemi()) : null;
        return new AssertStmt(ctx.getStart().getLine(), expression(stmt.exprArg()), message);
    }

    @Override
    public PlStatement visitExecuteStatement(PlPgSqlParser.ExecuteStatementContext ctx) {
        PlPgSqlParser.ExecuteStmtContext stmt = ctx.executeStmt();
        int lineno = ctx.getStart().getLine();
        boolean into = false;
        boolean strict = false;
        int target = -1;
        List<PlExpression> params = new ArrayList<>();
        for (PlPgSqlParser.ExecuteClauseContext clause : stmt.executeClause()) {
            if (clause instanceof PlPgSqlParser.ExecuteIntoContext) {
                PlPgSqlParser.ExecuteIntoContext intoClause = (PlPgSqlParser.ExecuteIntoContext) clause;
                if (into) {
                    throw new RoutineCompileException("42601", "INTO specified more than once", lineno);
                }
                into = true;
                strict = intoClause.STRICT() != null;
                target = resolveTargetList(intoClause.targetList(), lineno);
            } else {
                params.addAll(expressions(((PlPgSqlParser.ExecuteUsingContext) clause).exprArgList()));
            }
        }
        return new DynExecuteStmt(lineno, expression(stmt.exprUntilIntoUsing()), into, strict, target, params);
    }

    @Override
    public PlStatement visitPerformStatement(PlPgSqlParser.PerformStatementContext ctx) {
        PlPgSqlParser.ExprUntilSemiContext expr = ctx.performStmt().exprUntilSemi();
        return new PerformStmt(ctx.getStart().getLine(),
                new PlExpression("SELECT " + text(expr), expr.getStart().getLine(), context.getNamespace()));
    }

    @Override
    public PlStatement visitCallStatement(PlPgSqlParser.CallStatementContext ctx) {
        return new CallStmt(ctx.getStart().getLine(), expression(ctx.callStmt().exprUntilSemi()));
    }

    @Override
    public PlStatement visitGetDiagStatement(PlPgSqlParser.GetDiagStatementContext ctx) {
        PlPgSqlParser.GetDiagStmtContext stmt = ctx.getDiagStmt();
        int lineno = ctx.getStart().getLine();
        List<GetDiagStmt.DiagItem> items = new ArrayList<>();
        for (PlPgSqlParser.GetDiagItemContext item : stmt.getDiagItem()) {
            items.add(new GetDiagStmt.DiagItem(resolveTarget(item.assignTarget(), lineno),
                    item.identifier().getText().toUpperCase(java.util.Locale.ROOT)));
        }
        return new GetDiagStmt(lineno, stmt.STACKED() != null, items);
    }

    @Override
    public PlStatement visitOpenStatement(PlPgSqlParser.OpenStatementContext ctx) {
        PlPgSqlParser.OpenStmtContext stmt = ctx.openStmt();
        int lineno = ctx.getStart().getLine();
        if (stmt instanceof PlPgSqlParser.OpenForExecuteContext) {
            PlPgSqlParser.OpenForExecuteContext open = (PlPgSqlParser.OpenForExecuteContext) stmt;
            return new OpenStmt(lineno, cursorVarno(open.identifier(), lineno), null,
                    expression(open.exprUntilUsingSemi()), expressions(open.exprArgList()), null);
        }
        if (stmt instanceof PlPgSqlParser.OpenForQueryContext) {
            PlPgSqlParser.OpenForQueryContext open = (PlPgSqlParser.OpenForQueryContext) stmt;
            return new OpenStmt(lineno, cursorVarno(open.identifier(), lineno), expression(open.exprUntilSemi()),
                    null, Collections.emptyList(), null);
        }
        PlPgSqlParser.OpenBoundContext open = (PlPgSqlParser.OpenBoundContext) stmt;
        List<PlExpression> arguments = open.exprArgList() != null ? expressions(open.exprArgList()) : null;
        return new OpenStmt(lineno, cursorVarno(open.identifier(), lineno), null, null,
                Collections.emptyList(), arguments);
    }

    @Override
    public PlStatement visitFetchStatement(PlPgSqlParser.FetchStatementContext ctx) {
        PlPgSqlParser.FetchStmtContext stmt = ctx.fetchStmt();
        int lineno = ctx.getStart().getLine();
        String direction = stmt.fetchDirection() != null ? text(stmt.fetchDirection()) : "next";
        return new FetchStmt(lineno, cursorVarno(stmt.identifier(), lineno),
                resolveTargetList(stmt.targetList(), lineno), false, direction);
    }

    @Override
    public PlStatement visitMoveStatement(PlPgSqlParser.MoveStatementContext ctx) {
        PlPgSqlParser.MoveStmtContext stmt = ctx.moveStmt();
        int lineno = ctx.getStart().getLine();
        String direction = stmt.fetchDirection() != null ? text(stmt.fetchDirection()) : "next";
        return new FetchStmt(lineno, cursorVarno(stmt.identifier(), lineno), -1, true, direction);
    }

    @Override
    public PlStatement visitCloseStatement(PlPgSqlParser.CloseStatementContext ctx) {
        int lineno = ctx.getStart().getLine();
        return new CloseStmt(lineno, cursorVarno(ctx.closeStmt().identifier(), lineno));
    }

    @Override
    public PlStatement visitCommitStatement(PlPgSqlParser.CommitStatementContext ctx) {
        PlPgSqlParser.CommitStmtContext stmt = ctx.commitStmt();
        return new CommitStmt(ctx.getStart().getLine(), stmt.CHAIN() != null && stmt.NO() == null);
    }

    @Override
    public PlStatement visitRollbackStatement(PlPgSqlParser.RollbackStatementContext ctx) {
        PlPgSqlParser.RollbackStmtContext stmt = ctx.rollbackStmt();
        return new RollbackStmt(ctx.getStart().getLine(), stmt.CHAIN() != null && stmt.NO() == null);
    }

    @Override
    public PlStatement visitNullStatement(PlPgSqlParser.NullStatementContext ctx) {
        return new NullStmt(ctx.getStart().getLine());
    }

    @Override
    public PlStatement visitSqlStatement(PlPgSqlParser.SqlStatementContext ctx) {
        PlPgSqlParser.SqlStmtContext stmt = ctx.sqlStmt();
        int lineno = ctx.getStart().getLine();
        List<Token> sqlTokens = defaultChannelTokens(stmt.getStart().getTokenIndex(),
                stmt.getStop().getTokenIndex() - 1);

        int intoIndex = findIntoToken(sqlTokens);
        if (intoIndex < 0) {
            String query = textBetween(sqlTokens.get(0), sqlTokens.get(sqlTokens.size() - 1));
            return new ExecSqlStmt(lineno, new PlExpression(query, lineno, context.getNamespace()), false, false, -1);
        }

        int position = intoIndex + 1;
        boolean strict = false;
        if (position < sqlTokens.size() && sqlTokens.get(position).getType() == PlPgSqlParser.STRICT) {
            strict = true;
            position++;
        }
        List<List<String>> targets = new ArrayList<>();
        int lastTargetToken = position - 1;
        while (position < sqlTokens.size() && IDENTIFIER_TOKENS.contains(sqlTokens.get(position).getType())) {
            List<String> parts = new ArrayList<>();
            parts.add(QualifiedName.normalizeIdentifier(sqlTokens.get(position).getText()));
            lastTargetToken = position++;
            while (position + 1 < sqlTokens.size() && sqlTokens.get(position).getType() == PlPgSqlParser.DOT
                    && IDENTIFIER_TOKENS.contains(sqlTokens.get(position + 1).getType())) {
                parts.add(QualifiedName.normalizeIdentifier(sqlTokens.get(position + 1).getText()));
                position += 2;
                lastTargetToken = position - 1;
            }
            targets.add(parts);
            if (position < sqlTokens.size() && sqlTokens.get(position).getType() == PlPgSqlParser.COMMA) {
                position++;
            } else {
                break;
            }
        }
        if (targets.isEmpty()) {
            throw new RoutineCompileException("42601", "syntax error at or near \"INTO\"", lineno);
        }

        StringBuilder query = new StringBuilder();
        if (intoIndex > 0) {
            query.append(textBetween(sqlTokens.get(0), sqlTokens.get(intoIndex - 1)));
        }
        if (lastTargetToken + 1 < sqlTokens.size()) {
            query.append(' ').append(textBetween(sqlTokens.get(lastTargetToken + 1),
                    sqlTokens.get(sqlTokens.size() - 1)));
        }

        List<Integer> targetVarnos = new ArrayList<>();
        List<String> targetNames = new ArrayList<>();
        for (List<String> parts : targets) {
            targetVarnos.add(resolveName(parts, lineno));
            targetNames.add(String.join(".", parts));
        }
        int target = targetVarnos.size() == 1
                ? targetVarnos.get(0)
                : intoRow(targetVarnos, targetNames, lineno);
        return new ExecSqlStmt(lineno, new PlExpression(query.toString().trim(), lineno, context.getNamespace()),
                true, strict, target);
    }

    private int findIntoToken(List<Token> sqlTokens) {
        int depth = 0;
        for (int i = 0; i < sqlTokens.size(); i++) {
            Token token = sqlTokens.get(i);
            if (token.getType() == PlPgSqlParser.LPAREN) {
                depth++;
            } else if (token.getType() == PlPgSqlParser.RPAREN) {
                depth--;
            } else if (token.getType() == PlPgSqlParser.INTO && depth == 0) {
                String previous = i > 0 ? CompileContext.lower(sqlTokens.get(i - 1).getText()) : "";
                if (!"insert".equals(previous) && !"merge".equals(previous)) {
                    return i;
                }
            }
        }
        return -1;
    }

    // ---------------------------------------------------------------- targets

    private int resolveTarget(PlPgSqlParser.AssignTargetContext target, int lineno) {
        List<String> parts = new ArrayList<>();
        for (PlPgSqlParser.IdentifierContext part : target.qualifiedName().identifier()) {
            parts.add(identifier(part));
        }
        return resolveName(parts, lineno);
    }

    /**
     * Resolves {@code var}, {@code rec.field}, {@code label.var} and {@code label.rec.field} to a datum.
     */
    private int resolveName(List<String> parts, int lineno) {
        Namespace ns = context.getNamespace();
        String name = String.join(".", parts);
        int varno = ns.lookupVariable(parts.get(0));
        int consumed = 1;
        if (parts.size() >= 2) {
            int qualified = ns.lookupQualified(parts.get(0), parts.get(1));
            if (qualified >= 0 && (varno < 0 || parts.size() == 3 || !hasFields(varno))) {
                varno = qualified;
                consumed = 2;
            }
        }
        if (varno < 0) {
            throw new RoutineCompileException("42601", "\"" + name + "\" is not a known variable", lineno);
        }
        if (parts.size() > consumed) {
            varno = fieldOf(varno, parts.get(consumed), name, lineno);
            consumed++;
        }
        if (parts.size() > consumed) {
            throw new RoutineCompileException("42601", "\"" + name + "\" is not a known variable", lineno);
        }
        Datum datum = context.getDatum(varno);
        if (datum instanceof Variable && ((Variable) datum).isConstant()) {
            throw new RoutineCompileException("22005", "variable \"" + datum.getRefname()
                    + "\" is declared CONSTANT", lineno);
        }
        return varno;
    }

    private boolean hasFields(int varno) {
        Datum datum = context.getDatum(varno);
        return datum instanceof RecordDatum || datum instanceof RowDatum;
    }

    private int fieldOf(int varno, String field, String name, int lineno) {
        Datum datum = context.getDatum(varno);
        if (datum instanceof RecordDatum) {
            return context.recordField(varno, field, lineno);
        }
        if (datum instanceof RowDatum) {
            for (RowDatum.RowField rowField : ((RowDatum) datum).getFields()) {
                if (rowField.getName().equals(field)) {
                    return rowField.getVarno();
                }
            }
            throw new RoutineCompileException("42703", "row \"" + datum.getRefname() + "\" has no field \""
                    + field + "\"", lineno);
        }
        throw new RoutineCompileException("42601", "\"" + name + "\" is not a known variable", lineno);
    }

    private int resolveTargetList(PlPgSqlParser.TargetListContext targets, int lineno) {
        List<Integer> varnos = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (PlPgSqlParser.AssignTargetContext target : targets.assignTarget()) {
            varnos.add(resolveTarget(target, lineno));
            names.add(target.getText());
        }
        return varnos.size() == 1 ? varnos.get(0) : intoRow(varnos, names, lineno);
    }

    private int resolveLoopTarget(PlPgSqlParser.TargetListContext targets, int lineno) {
        if (targets.assignTarget().size() == 1) {
            String name = targets.assignTarget(0).getText();
            if (context.getNamespace().lookupVariable(identifier(targets.assignTarget(0).qualifiedName().identifier(0))) < 0) {
                throw new RoutineCompileException("42601", "loop variable of loop over rows must be a record "
                        + "variable or list of scalar variables", lineno, "\"" + name + "\" is not a known variable");
            }
        }
        return resolveTargetList(targets, lineno);
    }

    private int intoRow(List<Integer> varnos, List<String> names, int lineno) {
        List<RowDatum.RowField> fields = new ArrayList<>();
        for (int i = 0; i < varnos.size(); i++) {
            Datum datum = context.getDatum(varnos.get(i));
            if (datum instanceof RecordDatum || datum instanceof RowDatum) {
                throw new RoutineCompileException("42601", "\"" + datum.getRefname()
                        + "\" is not a scalar variable", lineno);
            }
            fields.add(new RowDatum.RowField(names.get(i), varnos.get(i)));
        }
        RowDatum row = context.newRow("(unnamed row)", lineno, fields, null);
        row.setInternal(true);
        return row.getVarno();
    }

    private String singleTargetName(PlPgSqlParser.TargetListContext targets, int lineno) {
        if (targets.assignTarget().size() != 1
                || targets.assignTarget(0).qualifiedName().identifier().size() != 1
                || !targets.assignTarget(0).exprUntilBracket().isEmpty()) {
            throw new RoutineCompileException("42601", "integer FOR loop must have only one target variable",
                    lineno);
        }
        return identifier(targets.assignTarget(0).qualifiedName().identifier(0));
    }

    private int cursorVarno(PlPgSqlParser.IdentifierContext identifier, int lineno) {
        String name = identifier(identifier);
        int varno = context.getNamespace().lookupVariable(name);
        if (varno < 0) {
            throw new RoutineCompileException("42601", "\"" + name + "\" is not a known variable", lineno);
        }
        if (!isRefcursor(context.getDatum(varno))) {
            throw new RoutineCompileException("42804", "variable \"" + name
                    + "\" must be of type cursor or refcursor", lineno);
        }
        return varno;
    }

    private static boolean isRefcursor(Datum datum) {
        return datum instanceof Variable && BuiltinTypes.REFCURSOR.equals(((Variable) datum).getType());
    }

    // ---------------------------------------------------------------- labels

    private String loopLabel(PlPgSqlParser.LabelDeclContext labelDecl, PlPgSqlParser.IdentifierContext endLabel,
                             int lineno) {
        String label = labelDecl != null ? identifier(labelDecl.identifier()) : null;
        checkEndLabel(label, endLabel, lineno);
        return label;
    }

    private void checkEndLabel(String label, PlPgSqlParser.IdentifierContext endLabel, int lineno) {
        if (endLabel == null) {
            return;
        }
        String end = identifier(endLabel);
        if (label == null) {
            throw new RoutineCompileException("42601", "end label \"" + end + "\" specified for unlabeled block",
                    lineno);
        }
        if (!label.equals(end)) {
            throw new RoutineCompileException("42601", "end label \"" + end + "\" differs from block's label \""
                    + label + "\"", lineno);
        }
    }

    private Namespace enterLoop(String label) {
        Namespace saved = context.getNamespace();
        context.setNamespace(saved.withLabel(label, Namespace.LabelKind.LOOP));
        return saved;
    }

    // ---------------------------------------------------------------- text helpers

    private PlExpression expression(ParserRuleContext ctx) {
        return new PlExpression(text(ctx), ctx.getStart().getLine(), context.getNamespace());
    }

    private List<PlExpression> expressions(PlPgSqlParser.ExprArgListContext list) {
        List<PlExpression> result = new ArrayList<>();
        if (list != null) {
            for (PlPgSqlParser.ExprArgContext arg : list.exprArg()) {
                result.add(expression(arg));
            }
        }
        return result;
    }

    private static String identifier(PlPgSqlParser.IdentifierContext ctx) {
        return QualifiedName.normalizeIdentifier(ctx.getText());
    }

    private static String text(ParserRuleContext ctx) {
        return textBetween(ctx.getStart(), ctx.getStop());
    }

    private static String textBetween(Token start, Token stop) {
        return start.getInputStream().getText(Interval.of(start.getStartIndex(), stop.getStopIndex()));
    }

    private List<Token> defaultChannelTokens(int from, int to) {
        List<Token> result = new ArrayList<>();
        for (int i = from; i <= to; i++) {
            Token token = tokens.get(i);
            if (token.getChannel() == Token.DEFAULT_CHANNEL) {
                result.add(token);
            }
        }
        return result;
    }
}
