package me.christianrobert.plpgcheck.parser;

import me.christianrobert.plpgcheck.ast.BlockStmt;
import me.christianrobert.plpgcheck.ast.CompiledRoutine;
import me.christianrobert.plpgcheck.ast.Datum;
import me.christianrobert.plpgcheck.ast.Namespace;
import me.christianrobert.plpgcheck.ast.PlStatement;
import me.christianrobert.plpgcheck.ast.RecordDatum;
import me.christianrobert.plpgcheck.ast.ReturnStmt;
import me.christianrobert.plpgcheck.ast.RowDatum;
import me.christianrobert.plpgcheck.ast.StatementScanner;
import me.christianrobert.plpgcheck.ast.Variable;
import me.christianrobert.plpgcheck.catalog.BuiltinTypes;
import me.christianrobert.plpgcheck.catalog.Catalog;
import me.christianrobert.plpgcheck.catalog.PgType;
import me.christianrobert.plpgcheck.catalog.RelationInfo;
import me.christianrobert.plpgcheck.routine.ParamMode;
import me.christianrobert.plpgcheck.routine.RoutineDefinition;
import me.christianrobert.plpgcheck.routine.RoutineParameter;
import me.christianrobert.plpgcheck.routine.TriggerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Compiles a routine definition into the statement tree and datum table the checker walks.
 * <p>
 * Datums are created in the order PL/pgSQL creates them: parameters (named and {@code $n}),
 * the OUT row, {@code FOUND}, trigger variables, then the declarations of each block.
 */
public class RoutineCompiler {

    private static final Logger log = LoggerFactory.getLogger(RoutineCompiler.class);

    private final RoutineParser parser;

    public RoutineCompiler() {
        this(new RoutineParser());
    }

    public RoutineCompiler(RoutineParser parser) {
        this.parser = parser;
    }

    public CompiledRoutine compile(RoutineDefinition definition, Catalog catalog) {
        return compile(definition, catalog, null, Collections.emptyMap());
    }

    /**
     * @param triggerRelation relation a DML trigger is bound to, shapes NEW and OLD
     * @param polymorphicTypes substitutions keyed by pseudo type name ({@code anyelement}, ...)
     * @throws RoutineCompileException for syntax errors, unknown types and unknown targets
     */
    public CompiledRoutine compile(RoutineDefinition definition, Catalog catalog, RelationInfo triggerRelation,
                                   Map<String, PgType> polymorphicTypes) {
        log.debug("Compiling routine {}", definition.getSignature());

        ParseResult parsed = parser.parseBody(definition.getSource());
        if (parsed.hasErrors()) {
            throw new RoutineCompileException("42601", "syntax error", parsed.getFirstErrorLine(),
                    parsed.getErrorMessage());
        }

        CompileContext context = new CompileContext(catalog, polymorphicTypes);
        context.setNamespace(Namespace.empty().withLabel(definition.getName(), Namespace.LabelKind.BLOCK));

        List<Integer> paramVarnos = new ArrayList<>();
        List<Integer> outVarnos = new ArrayList<>();
        declareParameters(definition, context, paramVarnos, outVarnos);

        int outVarno = -1;
        if (outVarnos.size() == 1) {
            outVarno = outVarnos.get(0);
        } else if (outVarnos.size() > 1) {
            List<RowDatum.RowField> fields = new ArrayList<>();
            for (int varno : outVarnos) {
                fields.add(new RowDatum.RowField(context.getDatum(varno).getRefname(), varno));
            }
            RowDatum row = context.newRow("(unnamed row)", 0, fields, null);
            row.setInternal(true);
            outVarno = row.getVarno();
        }

        Variable found = autoVariable(context, "found", BuiltinTypes.BOOL);

        int newVarno = -1;
        int oldVarno = -1;
        TriggerType triggerType = definition.getTriggerType();
        if (triggerType == TriggerType.DML) {
            PgType rowType = triggerRelation != null ? triggerRelation.getRowType() : null;
            newVarno = triggerRecord(context, "new", rowType);
            oldVarno = triggerRecord(context, "old", rowType);
            autoVariable(context, "tg_name", BuiltinTypes.NAME);
            autoVariable(context, "tg_when", BuiltinTypes.TEXT);
            autoVariable(context, "tg_level", BuiltinTypes.TEXT);
            autoVariable(context, "tg_op", BuiltinTypes.TEXT);
            autoVariable(context, "tg_relid", BuiltinTypes.OID);
            autoVariable(context, "tg_relname", BuiltinTypes.NAME);
            autoVariable(context, "tg_table_name", BuiltinTypes.NAME);
            autoVariable(context, "tg_table_schema", BuiltinTypes.NAME);
            autoVariable(context, "tg_nargs", BuiltinTypes.INT4);
            autoVariable(context, "tg_argv", BuiltinTypes.arrayOf(BuiltinTypes.TEXT));
        } else if (triggerType == TriggerType.EVENT) {
            autoVariable(context, "tg_event", BuiltinTypes.TEXT);
            autoVariable(context, "tg_tag", BuiltinTypes.TEXT);
        }

        PgType returnType = resolveReturnType(definition, context, outVarnos.size());

        RoutineTreeBuilder builder = new RoutineTreeBuilder(context, parsed.getTokens());
        BlockStmt action = builder.buildTopBlock(parsed.getTree());

        if (needsImplicitReturn(definition, returnType, outVarno)) {
            action = addImplicitReturn(action);
        }

        int[] nextId = {1};
        new StatementScanner() {
            @Override
            protected void onStatement(PlStatement stmt, PlStatement parent) {
                stmt.setStmtId(nextId[0]++);
            }
        }.scan(action);

        log.debug("Compiled routine {}: {} datums, {} statements", definition.getSignature(),
                context.getDatums().size(), nextId[0] - 1);
        return new CompiledRoutine(definition, context.getDatums(), action, paramVarnos, found.getVarno(),
                outVarno, newVarno, oldVarno, returnType, nextId[0] - 1);
    }

    private void declareParameters(RoutineDefinition definition, CompileContext context,
                                   List<Integer> paramVarnos, List<Integer> outVarnos) {
        List<RoutineParameter> parameters = definition.getParameters();
        for (int i = 0; i < parameters.size(); i++) {
            RoutineParameter parameter = parameters.get(i);
            ParamMode mode = parameter.getMode() == ParamMode.TABLE ? ParamMode.OUT : parameter.getMode();
            String alias = "$" + (i + 1);
            String name = parameter.getName() != null && !parameter.getName().isEmpty()
                    ? CompileContext.lower(parameter.getName())
                    : null;
            PgType type = context.resolveType(parameter.getDataType(), 0);

            Datum datum = context.newDatumOfType(name != null ? name : alias, 0, type);
            datum.setParamMode(mode);
            context.addToNamespace(alias, datum.getVarno());
            if (name != null) {
                context.addToNamespace(name, datum.getVarno());
            }
            paramVarnos.add(datum.getVarno());
            if (mode.isOutput()) {
                outVarnos.add(datum.getVarno());
            }
        }
    }

    private static Variable autoVariable(CompileContext context, String name, PgType type) {
        Variable variable = context.newVariable(name, 0, type);
        variable.setAutoVariable(true);
        variable.setInternal(true);
        context.addToNamespace(name, variable.getVarno());
        return variable;
    }

    private static int triggerRecord(CompileContext context, String name, PgType rowType) {
        RecordDatum record = context.newRecord(name, 0, rowType);
        record.setInternal(true);
        context.addToNamespace(name, record.getVarno());
        return record.getVarno();
    }

    private static PgType resolveReturnType(RoutineDefinition definition, CompileContext context, int outCount) {
        if (definition.isProcedure()) {
            return BuiltinTypes.VOID;
        }
        if (definition.getTriggerType() == TriggerType.DML) {
            return BuiltinTypes.TRIGGER;
        }
        if (definition.getTriggerType() == TriggerType.EVENT) {
            return BuiltinTypes.EVENT_TRIGGER;
        }
        if (outCount > 1) {
            return BuiltinTypes.RECORD;
        }
        String returnType = definition.getReturnType();
        if (returnType == null || returnType.isBlank()) {
            return BuiltinTypes.VOID;
        }
        return context.resolveType(returnType, 0);
    }

    private static boolean needsImplicitReturn(RoutineDefinition definition, PgType returnType, int outVarno) {
        return definition.isProcedure() || definition.isReturnsSet() || returnType.isVoid() || outVarno >= 0;
    }

    /**
     * Appends the invisible RETURN PL/pgSQL adds when control may fall off the end. A labeled
     * top block or one with handlers is wrapped, so the RETURN sits outside of it.
     */
    private static BlockStmt addImplicitReturn(BlockStmt action) {
        List<PlStatement> body = action.getBody();
        if (!action.hasExceptionSection() && action.getLabel() == null) {
            if (!body.isEmpty() && body.get(body.size() - 1) instanceof ReturnStmt) {
                return action;
            }
            List<PlStatement> extended = new ArrayList<>(body);
            extended.add(new ReturnStmt(0, null));
            return new BlockStmt(action.getLineno(), null, action.getDeclaredVarnos(), extended,
                    action.getHandlers(), action.getOuterNamespace(), true);
        }
        List<PlStatement> wrapped = new ArrayList<>();
        wrapped.add(action);
        wrapped.add(new ReturnStmt(0, null));
        return new BlockStmt(0, null, Collections.emptyList(), wrapped, Collections.emptyList(),
                action.getOuterNamespace(), false);
    }
}
