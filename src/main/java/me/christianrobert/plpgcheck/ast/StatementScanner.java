package me.christianrobert.plpgcheck.ast;

import java.util.List;

/**
 * Depth-first pre-order traversal of a statement tree. Subclasses override
 * {@link #onStatement(PlStatement, PlStatement)} to see every statement with its parent.
 */
public abstract class StatementScanner implements StatementVisitor<Void> {

    private PlStatement parent;

    protected abstract void onStatement(PlStatement stmt, PlStatement parent);

    public void scan(PlStatement stmt) {
        onStatement(stmt, parent);
        PlStatement saved = parent;
        parent = stmt;
        try {
            stmt.accept(this);
        } finally {
            parent = saved;
        }
    }

    public void scanAll(List<PlStatement> stmts) {
        if (stmts == null) {
            return;
        }
        for (PlStatement stmt : stmts) {
            scan(stmt);
        }
    }

    @Override
    public Void visitBlock(BlockStmt stmt) {
        scanAll(stmt.getBody());
        for (ExceptionHandler handler : stmt.getHandlers()) {
            scanAll(handler.getBody());
        }
        return null;
    }

    @Override
    public Void visitIf(IfStmt stmt) {
        scanAll(stmt.getThenBody());
        for (IfStmt.ElsifClause elsif : stmt.getElsifs()) {
            scanAll(elsif.getBody());
        }
        scanAll(stmt.getElseBody());
        return null;
    }

    @Override
    public Void visitCase(CaseStmt stmt) {
        for (CaseStmt.CaseWhen when : stmt.getWhens()) {
            scanAll(when.getBody());
        }
        scanAll(stmt.getElseBody());
        return null;
    }

    @Override
    public Void visitLoop(LoopStmt stmt) {
        scanAll(stmt.getBody());
        return null;
    }

    @Override
    public Void visitWhile(WhileStmt stmt) {
        scanAll(stmt.getBody());
        return null;
    }

    @Override
    public Void visitForInteger(ForIntegerStmt stmt) {
        scanAll(stmt.getBody());
        return null;
    }

    @Override
    public Void visitForQuery(ForQueryStmt stmt) {
        scanAll(stmt.getBody());
        return null;
    }

    @Override
    public Void visitForCursor(ForCursorStmt stmt) {
        scanAll(stmt.getBody());
        return null;
    }

    @Override
    public Void visitForDynamic(ForDynamicStmt stmt) {
        scanAll(stmt.getBody());
        return null;
    }

    @Override
    public Void visitForeach(ForeachStmt stmt) {
        scanAll(stmt.getBody());
        return null;
    }

    @Override
    public Void visitAssign(AssignStmt stmt) {
        return null;
    }

    @Override
    public Void visitExit(ExitStmt stmt) {
        return null;
    }

    @Override
    public Void visitReturn(ReturnStmt stmt) {
        return null;
    }

    @Override
    public Void visitReturnNext(ReturnNextStmt stmt) {
        return null;
    }

    @Override
    public Void visitReturnQuery(ReturnQueryStmt stmt) {
        return null;
    }

    @Override
    public Void visitRaise(RaiseStmt stmt) {
        return null;
    }

    @Override
    public Void visitAssert(AssertStmt stmt) {
        return null;
    }

    @Override
    public Void visitExecSql(ExecSqlStmt stmt) {
        return null;
    }

    @Override
    public Void visitDynExecute(DynExecuteStmt stmt) {
        return null;
    }

    @Override
    public Void visitPerform(PerformStmt stmt) {
        return null;
    }

    @Override
    public Void visitCall(CallStmt stmt) {
        return null;
    }

    @Override
    public Void visitGetDiag(GetDiagStmt stmt) {
        return null;
    }

    @Override
    public Void visitOpen(OpenStmt stmt) {
        return null;
    }

    @Override
    public Void visitFetch(FetchStmt stmt) {
        return null;
    }

    @Override
    public Void visitClose(CloseStmt stmt) {
        return null;
    }

    @Override
    public Void visitCommit(CommitStmt stmt) {
        return null;
    }

    @Override
    public Void visitRollback(RollbackStmt stmt) {
        return null;
    }

    @Override
    public Void visitNull(NullStmt stmt) {
        return null;
    }
}
