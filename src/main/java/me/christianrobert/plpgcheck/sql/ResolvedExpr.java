package me.christianrobert.plpgcheck.sql;

import me.christianrobert.plpgcheck.catalog.FunctionInfo;
import me.christianrobert.plpgcheck.catalog.OperatorInfo;
import me.christianrobert.plpgcheck.catalog.PgType;
import me.christianrobert.plpgcheck.catalog.RelationInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Analyzed expression node: what the expression is, its type and where it starts in the
 * query text. Children are ordered as in the source (function arguments, operands, ...).
 */
public class ResolvedExpr {

    public enum Kind {
        CONST,
        PARAM,
        COLUMN,
        FUNCTION,
        OPERATOR,
        CAST,
        BOOL,
        CASE,
        SUBLINK,
        NULL_TEST,
        ARRAY,
        ROW,
        OTHER
    }

    private final Kind kind;
    private final PgType type;
    private final int location;
    private final List<ResolvedExpr> children;
    private String text;
    private boolean nullConstant;
    private ParamRef param;
    private FunctionInfo function;
    private OperatorInfo operator;
    private RelationInfo relation;
    private boolean implicitCast;
    private boolean functionCast;

    public ResolvedExpr(Kind kind, PgType type, int location, List<ResolvedExpr> children) {
        this.kind = kind;
        this.type = type;
        this.location = location;
        this.children = children != null ? children : Collections.emptyList();
    }

    public static ResolvedExpr constant(PgType type, String value, int location) {
        ResolvedExpr expr = new ResolvedExpr(Kind.CONST, type, location, null);
        expr.text = value;
        expr.nullConstant = value == null;
        return expr;
    }

    public static ResolvedExpr param(ParamRef param, int location) {
        ResolvedExpr expr = new ResolvedExpr(Kind.PARAM, param.getType(), location, null);
        expr.param = param;
        expr.text = param.getName();
        return expr;
    }

    public static ResolvedExpr column(RelationInfo relation, String name, PgType type, int location) {
        ResolvedExpr expr = new ResolvedExpr(Kind.COLUMN, type, location, null);
        expr.relation = relation;
        expr.text = name;
        return expr;
    }

    public static ResolvedExpr function(FunctionInfo function, String name, PgType type, int location,
                                        List<ResolvedExpr> args) {
        ResolvedExpr expr = new ResolvedExpr(Kind.FUNCTION, type, location, args);
        expr.function = function;
        expr.text = name;
        return expr;
    }

    public static ResolvedExpr operator(String symbol, OperatorInfo operator, PgType type, int location,
                                        List<ResolvedExpr> operands) {
        ResolvedExpr expr = new ResolvedExpr(Kind.OPERATOR, type, location, operands);
        expr.operator = operator;
        expr.text = symbol;
        return expr;
    }

    public static ResolvedExpr cast(ResolvedExpr source, PgType target, boolean implicit, boolean functionCast) {
        List<ResolvedExpr> children = new ArrayList<>();
        children.add(source);
        ResolvedExpr expr = new ResolvedExpr(Kind.CAST, target, source.getLocation(), children);
        expr.implicitCast = implicit;
        expr.functionCast = functionCast;
        return expr;
    }

    public Kind getKind() {
        return kind;
    }

    public PgType getType() {
        return type;
    }

    public int getLocation() {
        return location;
    }

    public List<ResolvedExpr> getChildren() {
        return children;
    }

    /**
     * Literal value of a constant, operator symbol, function or column name.
     */
    public String getText() {
        return text;
    }

    public boolean isNullConstant() {
        return nullConstant;
    }

    public ParamRef getParam() {
        return param;
    }

    public FunctionInfo getFunction() {
        return function;
    }

    public OperatorInfo getOperator() {
        return operator;
    }

    public RelationInfo getRelation() {
        return relation;
    }

    public boolean isImplicitCast() {
        return implicitCast;
    }

    /**
     * True when the cast runs a conversion function rather than relabeling the value.
     */
    public boolean isFunctionCast() {
        return functionCast;
    }

    /**
     * Strips casts, returning the expression that produces the value.
     */
    public ResolvedExpr unwrapCasts() {
        ResolvedExpr expr = this;
        while (expr.kind == Kind.CAST && !expr.children.isEmpty()) {
            expr = expr.children.get(0);
        }
        return expr;
    }

    /**
     * Visits this node and all descendants, parents first.
     */
    public void walk(Consumer<ResolvedExpr> visitor) {
        visitor.accept(this);
        for (ResolvedExpr child : children) {
            child.walk(visitor);
        }
    }

    @Override
    public String toString() {
        return kind + (text != null ? " " + text : "") + " " + type;
    }
}
