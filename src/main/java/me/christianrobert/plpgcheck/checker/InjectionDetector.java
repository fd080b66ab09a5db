package me.christianrobert.plpgcheck.checker;

import me.christianrobert.plpgcheck.catalog.CastRules;
import me.christianrobert.plpgcheck.sql.ParamRef;
import me.christianrobert.plpgcheck.sql.ResolvedExpr;

import java.util.List;
import java.util.Set;

/**
 * Heuristic search for string values that reach dynamic SQL without passing a quoting
 * function. Only string typed expressions are considered; concatenation and
 * {@code format('%s')} propagate an unsafe operand, {@code quote_*} and the {@code %I} /
 * {@code %L} specifiers of {@code format} sanitize it.
 */
class InjectionDetector {

    private static final Set<String> SANITIZERS = Set.of("quote_ident", "quote_literal", "quote_nullable");

    private final CheckState state;

    InjectionDetector(CheckState state) {
        this.state = state;
    }

    /**
     * @return the 1-based query position of the first unsafe variable, 0 when the
     * expression is unsafe without a single culprit, -1 when it is considered safe
     */
    int findUnsafe(ResolvedExpr expr) {
        int[] location = {-1};
        return isVulnerable(expr, location) ? Math.max(location[0], 0) : -1;
    }

    private boolean isVulnerable(ResolvedExpr expr, int[] location) {
        switch (expr.getKind()) {
            case FUNCTION:
                return isVulnerableCall(expr, location);
            case OPERATOR:
                for (ResolvedExpr operand : expr.getChildren()) {
                    if (isVulnerable(operand, location)) {
                        return CastRules.isStringType(expr.getType()) && "||".equals(expr.getText());
                    }
                }
                return false;
            case CAST:
                return !expr.getChildren().isEmpty() && isVulnerable(expr.getChildren().get(0), location);
            case PARAM:
                return isVulnerableParam(expr, location);
            default:
                return false;
        }
    }

    private boolean isVulnerableCall(ResolvedExpr call, int[] location) {
        boolean vulnerable = false;
        for (ResolvedExpr arg : call.getChildren()) {
            if (isVulnerable(arg, location)) {
                vulnerable = true;
                break;
            }
        }
        if (!vulnerable || !CastRules.isStringType(call.getType())) {
            return false;
        }
        String name = call.getText();
        if (SANITIZERS.contains(name)) {
            return false;
        }
        if ("format".equals(name)) {
            List<ResolvedExpr> args = call.getChildren();
            ResolvedExpr first = args.isEmpty() ? null : args.get(0).unwrapCasts();
            if (first != null && first.getKind() == ResolvedExpr.Kind.CONST && !first.isNullConstant()) {
                FormatStrings.FormatCheck check = FormatStrings.checkFormat(first.getText(), args.size() - 1);
                if (check.getError() == null) {
                    location[0] = -1;
                    for (int argNumber : check.getPlainStringArgs()) {
                        if (isVulnerable(args.get(argNumber), location)) {
                            return true;
                        }
                    }
                    return false;
                }
            }
        }
        return true;
    }

    private boolean isVulnerableParam(ResolvedExpr expr, int[] location) {
        ParamRef param = expr.getParam();
        if (param == null || !CastRules.isStringType(param.getType()) || param.getType().isUnknown()) {
            return false;
        }
        if (!param.isPositional() && state.isSanitized(param.getParamId())) {
            return false;
        }
        location[0] = expr.getLocation();
        return true;
    }
}
