package me.christianrobert.plpgcheck.ast;

import me.christianrobert.plpgcheck.catalog.PgType;

/**
 * A record variable. Declared {@code record} it has no shape until assigned; declared with a
 * composite type ({@code %ROWTYPE}, a table or a composite type name) its shape is fixed.
 */
public class RecordDatum extends Datum {

    private final PgType declaredType;

    public RecordDatum(int varno, String refname, int lineno, PgType declaredType) {
        super(varno, refname, lineno);
        this.declaredType = declaredType;
    }

    @Override
    public Kind getKind() {
        return Kind.RECORD;
    }

    /**
     * @return the declared composite type, or {@code null} for a plain {@code record}
     */
    public PgType getDeclaredType() {
        return declaredType;
    }

    public boolean isTyped() {
        return declaredType != null && !declaredType.isRecord();
    }
}
