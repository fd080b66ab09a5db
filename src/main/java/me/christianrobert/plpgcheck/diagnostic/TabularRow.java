package me.christianrobert.plpgcheck.diagnostic;

/**
 * One row of the tabular report, the shape of {@code plpgsql_check_function_tb}.
 */
public class TabularRow {

    private String functionId;
    private Integer lineno;
    private String statement;
    private String sqlState;
    private String message;
    private String detail;
    private String hint;
    private String level;
    private Integer position;
    private String query;
    private String context;

    public TabularRow() {
    }

    public static TabularRow of(String functionId, Diagnostic diagnostic) {
        TabularRow row = new TabularRow();
        row.functionId = functionId;
        row.lineno = diagnostic.getLineno() > 0 ? diagnostic.getLineno() : null;
        row.statement = diagnostic.getStatement();
        row.sqlState = diagnostic.getSqlState();
        row.message = diagnostic.getMessage();
        row.detail = diagnostic.getDetail();
        row.hint = diagnostic.getHint();
        row.level = diagnostic.getSeverity().getLabel();
        row.position = diagnostic.getPosition() > 0 ? diagnostic.getPosition() : null;
        row.query = diagnostic.getQuery();
        row.context = diagnostic.getContext();
        return row;
    }

    // Getters and setters
    public String getFunctionId() {
        return functionId;
    }

    public void setFunctionId(String functionId) {
        this.functionId = functionId;
    }

    public Integer getLineno() {
        return lineno;
    }

    public void setLineno(Integer lineno) {
        this.lineno = lineno;
    }

    public String getStatement() {
        return statement;
    }

    public void setStatement(String statement) {
        this.statement = statement;
    }

    public String getSqlState() {
        return sqlState;
    }

    public void setSqlState(String sqlState) {
        this.sqlState = sqlState;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getDetail() {
        return detail;
    }

    public void setDetail(String detail) {
        this.detail = detail;
    }

    public String getHint() {
        return hint;
    }

    public void setHint(String hint) {
        this.hint = hint;
    }

    public String getLevel() {
        return level;
    }

    public void setLevel(String level) {
        this.level = level;
    }

    public Integer getPosition() {
        return position;
    }

    public void setPosition(Integer position) {
        this.position = position;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public String getContext() {
        return context;
    }

    public void setContext(String context) {
        this.context = context;
    }
}
