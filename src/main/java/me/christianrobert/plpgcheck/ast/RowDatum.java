package me.christianrobert.plpgcheck.ast;

import me.christianrobert.plpgcheck.catalog.PgType;

import java.util.List;

/**
 * A fixed list of variables filled together: the OUT parameters of a routine or an
 * {@code INTO a, b, c} target list.
 */
public class RowDatum extends Datum {

    public static class RowField {
        private final String name;
        private final int varno;

        public RowField(String name, int varno) {
            this.name = name;
            this.varno = varno;
        }

        public String getName() {
            return name;
        }

        public int getVarno() {
            return varno;
        }
    }

    private final List<RowField> fields;
    private final PgType rowType;

    public RowDatum(int varno, String refname, int lineno, List<RowField> fields, PgType rowType) {
        super(varno, refname, lineno);
        this.fields = List.copyOf(fields);
        this.rowType = rowType;
    }

    @Override
    public Kind getKind() {
        return Kind.ROW;
    }

    public List<RowField> getFields() {
        return fields;
    }

    /**
     * @return the composite type this row mirrors, or {@code null} for ad hoc target lists
     */
    public PgType getRowType() {
        return rowType;
    }
}
