package me.christianrobert.plpgcheck.ast;

import java.util.List;

/**
 * {@code [<<label>>] [DECLARE ...] BEGIN ... [EXCEPTION ...] END}.
 */
public class BlockStmt extends PlStatement {

    private final String label;
    private final List<Integer> declaredVarnos;
    private final List<PlStatement> body;
    private final List<ExceptionHandler> handlers;
    private final Namespace outerNamespace;
    private final boolean topLevel;
    private int sqlStateVarno = -1;
    private int sqlErrmVarno = -1;

    public BlockStmt(int lineno, String label, List<Integer> declaredVarnos, List<PlStatement> body,
                     List<ExceptionHandler> handlers, Namespace outerNamespace, boolean topLevel) {
        super(StatementKind.BLOCK, lineno);
        this.label = label;
        this.declaredVarnos = declaredVarnos;
        this.body = body;
        this.handlers = handlers;
        this.outerNamespace = outerNamespace;
        this.topLevel = topLevel;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Variables declared by this block, in declaration order.
     */
    public List<Integer> getDeclaredVarnos() {
        return declaredVarnos;
    }

    public List<PlStatement> getBody() {
        return body;
    }

    /**
     * @return the exception handlers, empty when the block has no EXCEPTION section
     */
    public List<ExceptionHandler> getHandlers() {
        return handlers;
    }

    public boolean hasExceptionSection() {
        return !handlers.isEmpty();
    }

    /**
     * Names visible just outside this block; used to detect shadowing declarations.
     */
    public Namespace getOuterNamespace() {
        return outerNamespace;
    }

    public boolean isTopLevel() {
        return topLevel;
    }

    public int getSqlStateVarno() {
        return sqlStateVarno;
    }

    public int getSqlErrmVarno() {
        return sqlErrmVarno;
    }

    public void setExceptionVarnos(int sqlStateVarno, int sqlErrmVarno) {
        this.sqlStateVarno = sqlStateVarno;
        this.sqlErrmVarno = sqlErrmVarno;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
