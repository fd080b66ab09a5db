package me.christianrobert.plpgcheck.ast;

/**
 * The target {@code rec.field} of an assignment or INTO clause.
 */
public class RecordFieldDatum extends Datum {

    private final int recordVarno;
    private final String fieldName;

    public RecordFieldDatum(int varno, int recordVarno, String fieldName, String refname, int lineno) {
        super(varno, refname, lineno);
        this.recordVarno = recordVarno;
        this.fieldName = fieldName;
    }

    @Override
    public Kind getKind() {
        return Kind.RECFIELD;
    }

    public int getRecordVarno() {
        return recordVarno;
    }

    public String getFieldName() {
        return fieldName;
    }
}
