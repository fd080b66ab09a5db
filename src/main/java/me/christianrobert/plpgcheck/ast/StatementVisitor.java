package me.christianrobert.plpgcheck.ast;

/**
 * Exhaustive visitor over the statement tree; one method per {@link StatementKind}.
 */
public interface StatementVisitor<R> {

    R visitBlock(BlockStmt stmt);

    R visitAssign(AssignStmt stmt);

    R visitIf(IfStmt stmt);

    R visitCase(CaseStmt stmt);

    R visitLoop(LoopStmt stmt);

    R visitWhile(WhileStmt stmt);

    R visitForInteger(ForIntegerStmt stmt);

    R visitForQuery(ForQueryStmt stmt);

    R visitForCursor(ForCursorStmt stmt);

    R visitForDynamic(ForDynamicStmt stmt);

    R visitForeach(ForeachStmt stmt);

    R visitExit(ExitStmt stmt);

    R visitReturn(ReturnStmt stmt);

    R visitReturnNext(ReturnNextStmt stmt);

    R visitReturnQuery(ReturnQueryStmt stmt);

    R visitRaise(RaiseStmt stmt);

    R visitAssert(AssertStmt stmt);

    R visitExecSql(ExecSqlStmt stmt);

    R visitDynExecute(DynExecuteStmt stmt);

    R visitPerform(PerformStmt stmt);

    R visitCall(CallStmt stmt);

    R visitGetDiag(GetDiagStmt stmt);

    R visitOpen(OpenStmt stmt);

    R visitFetch(FetchStmt stmt);

    R visitClose(CloseStmt stmt);

    R visitCommit(CommitStmt stmt);

    R visitRollback(RollbackStmt stmt);

    R visitNull(NullStmt stmt);
}
