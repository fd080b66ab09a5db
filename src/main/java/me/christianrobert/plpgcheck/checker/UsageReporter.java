package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.ast.CompiledRoutine;
import me.christianrobert.plpgcheck.ast.Datum;
import me.christianrobert.plpgcheck.ast.RecordFieldDatum;
import me.christianrobert.plpgcheck.ast.RowDatum;
import me.christianrobert.plpgcheck.catalog.Volatility;
import me.christianrobert.plpgcheck.diagnostic.Diagnostic;
import me.christianrobert.plpgcheck.diagnostic.Severity;
import me.christianrobert.plpgcheck.routine.ParamMode;
import me.christianrobert.plpgcheck.routine.TriggerType;

/**
 * End of routine reports: variables and parameters that were never used, OUT variables
 * that were never assigned, and a volatility category weaker than the body needs.
 */
class UsageReporter {

    private final CheckState state;
    private final CompiledRoutine routine;

    UsageReporter(CheckState state) {
        this.state = state;
        this.routine = state.getCompiled();
    }

    void reportUnusedVariables() {
        for (Datum datum : routine.getDatums()) {
            if (!isExplicit(datum) || isUsed(datum)) {
                continue;
            }
            report(Diagnostic.builder(Severity.WARNING_OTHERS, "unused variable \"" + datum.getRefname() + "\"")
                    .statement(datum.getLineno(), null));
        }
        if (!state.getFlags().isExtraWarnings()) {
            return;
        }
        for (Datum datum : routine.getDatums()) {
            if (isExplicit(datum) && state.isWritten(datum.getVarno()) && !isRead(datum)) {
                report(Diagnostic.builder(Severity.WARNING_EXTRA, "never read variable \"" + datum.getRefname() + "\"")
                        .statement(datum.getLineno(), null));
            }
        }
    }

    /**
     * @param foundReturnQuery a static RETURN QUERY fills the result, so OUT variables
     *                         are not expected to be assigned
     */
    void reportUnusedParameters(boolean foundReturnQuery) {
        if (!state.getFlags().isExtraWarnings()) {
            return;
        }
        for (int varno : routine.getParamVarnos()) {
            Datum param = routine.getDatum(varno);
            ParamMode mode = param.getParamMode();
            if (mode == null || !mode.isInput()) {
                continue;
            }
            if (!isUsed(param)) {
                report(Diagnostic.builder(Severity.WARNING_EXTRA, "unused parameter \"" + param.getRefname() + "\""));
            } else if (!isRead(param) && !(mode == ParamMode.INOUT && routine.isProcedure())) {
                report(Diagnostic.builder(Severity.WARNING_EXTRA,
                        "parameter \"" + param.getRefname() + "\" is never read"));
            }
        }
        if (!foundReturnQuery && routine.hasOutParams()) {
            reportUnmodifiedOutVariables();
        }
    }

    private void reportUnmodifiedOutVariables() {
        Datum out = routine.getDatum(routine.getOutVarno());
        if (out instanceof RowDatum && out.isInternal()) {
            for (RowDatum.RowField field : ((RowDatum) out).getFields()) {
                Datum datum = routine.getDatum(field.getVarno());
                if (datum.getKind() == Datum.Kind.ROW || datum.getKind() == Datum.Kind.RECORD) {
                    report(Diagnostic.builder(Severity.WARNING_EXTRA,
                            "composite OUT variable \"" + datum.getRefname() + "\" is not single argument"));
                } else if (!isWritten(datum)) {
                    reportUnmodified(datum);
                }
            }
        } else if (!isWritten(out)) {
            reportUnmodified(out);
        }
    }

    private void reportUnmodified(Datum datum) {
        if (state.isResultFromDynamicSql()) {
            report(Diagnostic.builder(Severity.WARNING_EXTRA,
                    "OUT variable \"" + datum.getRefname() + "\" is maybe unmodified")
                    .detail("cannot to determine result of dynamic SQL"));
        } else {
            report(Diagnostic.builder(Severity.WARNING_EXTRA,
                    "unmodified OUT variable \"" + datum.getRefname() + "\""));
        }
    }

    /**
     * Suggests a stronger volatility category when the body never needs the declared one.
     * Triggers are left alone.
     */
    void reportVolatility() {
        if (!state.getFlags().isPerformanceWarnings() || routine.getTriggerType() != TriggerType.NONE) {
            return;
        }
        Volatility declared = state.getRoutine().getVolatility();
        Volatility observed = state.getObservedVolatility();
        if (declared == null || routine.getReturnType().isVoid() || observed.ordinal() >= declared.ordinal()) {
            return;
        }
        String message = observed == Volatility.IMMUTABLE
                ? "routine is marked as " + declared + ", should be IMMUTABLE"
                : "routine is marked as VOLATILE, should be STABLE";
        Diagnostic.Builder builder = Diagnostic.builder(Severity.WARNING_PERFORMANCE, message)
                .hint("When you fix this issue, please, recheck other functions that uses this function.");
        if (state.isUsesDynamicSql()) {
            builder.detail("attention: cannot to determine volatility of used dynamic SQL");
        }
        report(builder);
    }

    private void report(Diagnostic.Builder builder) {
        state.setCurrentStatement(null);
        state.report(builder);
    }

    /**
     * Declared by the user in a DECLARE section. Parameters have no line.
     */
    private static boolean isExplicit(Datum datum) {
        return !datum.isAutoVariable() && !datum.isInternal() && datum.getLineno() > 0
                && datum.getKind() != Datum.Kind.RECFIELD;
    }

    private boolean isUsed(Datum datum) {
        return isRead(datum) || isWritten(datum);
    }

    private boolean isRead(Datum datum) {
        if (state.isRead(datum.getVarno())) {
            return true;
        }
        if (datum instanceof RowDatum) {
            for (RowDatum.RowField field : ((RowDatum) datum).getFields()) {
                if (state.isRead(field.getVarno())) {
                    return true;
                }
            }
        } else if (datum.getKind() == Datum.Kind.RECORD) {
            for (Datum other : routine.getDatums()) {
                if (other instanceof RecordFieldDatum
                        && ((RecordFieldDatum) other).getRecordVarno() == datum.getVarno()
                        && state.isRead(other.getVarno())) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean isWritten(Datum datum) {
        if (state.isWritten(datum.getVarno())) {
            return true;
        }
        if (datum instanceof RowDatum) {
            for (RowDatum.RowField field : ((RowDatum) datum).getFields()) {
                if (state.isWritten(field.getVarno())) {
                    return true;
                }
            }
        } else if (datum.getKind() == Datum.Kind.RECORD) {
            for (Datum other : routine.getDatums()) {
                if (other instanceof RecordFieldDatum
                        && ((RecordFieldDatum) other).getRecordVarno() == datum.getVarno()
                        && state.isWritten(other.getVarno())) {
                    return true;
                }
            }
        }
        return false;
    }
}
