package me.christianrobert.plpgcheck.coverage;

import me.christianrobert.plpgcheck.ast.CompiledRoutine;
import me.christianrobert.plpgcheck.ast.PlStatement;
import me.christianrobert.plpgcheck.ast.StatementKind;
import me.christianrobert.plpgcheck.ast.StatementScanner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The visible statements of a compiled routine in statement id order.
 */
public class StatementInventory {

    public static class Entry {
        private final int stmtId;
        private final int parentId;
        private final int lineno;
        private final StatementKind kind;
        private final String typeName;

        Entry(int stmtId, int parentId, int lineno, StatementKind kind, String typeName) {
            this.stmtId = stmtId;
            this.parentId = parentId;
            this.lineno = lineno;
            this.kind = kind;
            this.typeName = typeName;
        }

        public int getStmtId() {
            return stmtId;
        }

        /**
         * Id of the enclosing statement, 0 for the top block.
         */
        public int getParentId() {
            return parentId;
        }

        public int getLineno() {
            return lineno;
        }

        public StatementKind getKind() {
            return kind;
        }

        public String getTypeName() {
            return typeName;
        }
    }

    private final List<Entry> entries;

    private StatementInventory(List<Entry> entries) {
        this.entries = entries;
    }

    public static StatementInventory of(CompiledRoutine routine) {
        List<Entry> entries = new ArrayList<>();
        new StatementScanner() {
            @Override
            protected void onStatement(PlStatement stmt, PlStatement parent) {
                if (stmt.isVisible()) {
                    entries.add(new Entry(stmt.getStmtId(), parent != null ? parent.getStmtId() : 0,
                            stmt.getLineno(), stmt.getKind(), stmt.getTypeName()));
                }
            }
        }.scan(routine.getAction());
        return new StatementInventory(Collections.unmodifiableList(entries));
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }
}
