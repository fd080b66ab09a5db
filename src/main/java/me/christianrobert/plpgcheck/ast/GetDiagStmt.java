package me.christianrobert.plpgcheck.ast;

import java.util.List;

public class GetDiagStmt extends PlStatement {

    public static class DiagItem {
        private final int targetVarno;
        private final String item;

        public DiagItem(int targetVarno, String item) {
            this.targetVarno = targetVarno;
            this.item = item;
        }

        public int getTargetVarno() {
            return targetVarno;
        }

        /**
         * Upper-case item name such as {@code ROW_COUNT} or {@code MESSAGE_TEXT}.
         */
        public String getItem() {
            return item;
        }
    }

    private final boolean stacked;
    private final List<DiagItem> items;

    public GetDiagStmt(int lineno, boolean stacked, List<DiagItem> items) {
        super(StatementKind.GETDIAG, lineno);
        this.stacked = stacked;
        this.items = items;
    }

    public boolean isStacked() {
        return stacked;
    }

    public List<DiagItem> getItems() {
        return items;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitGetDiag(this);
    }
}
