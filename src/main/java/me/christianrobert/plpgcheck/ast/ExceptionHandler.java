package me.christianrobert.plpgcheck.ast;

import java.util.List;

/**
 * One {@code WHEN cond [OR cond] THEN ...} arm of an EXCEPTION section.
 */
public class ExceptionHandler {

    /**
     * A caught condition: its name (or {@code SQLSTATE 'xxxxx'}) and five character code.
     */
    public static class Condition {
        private final String name;
        private final String sqlState;

        public Condition(String name, String sqlState) {
            this.name = name;
            this.sqlState = sqlState;
        }

        public String getName() {
            return name;
        }

        public String getSqlState() {
            return sqlState;
        }

        public boolean isOthers() {
            return "others".equals(name);
        }
    }

    private final int lineno;
    private final List<Condition> conditions;
    private final List<PlStatement> body;

    public ExceptionHandler(int lineno, List<Condition> conditions, List<PlStatement> body) {
        this.lineno = lineno;
        this.conditions = conditions;
        this.body = body;
    }

    public int getLineno() {
        return lineno;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public List<PlStatement> getBody() {
        return body;
    }
}
