package me.christianrobert.plpgcheck.sql;

import java.util.List;

/**
 * Hook through which the analyzer asks the routine for the names it cannot find in the
 * range table, like the PL/pgSQL parser hooks of the server.
 */
public interface ParamResolver {

    ParamResolver NONE = new ParamResolver() {
        @Override
        public ParamRef resolveName(List<String> nameParts) {
            return null;
        }

        @Override
        public ParamRef resolveNumber(int number) {
            return null;
        }
    };

    /**
     * Resolves a possibly qualified name ({@code var}, {@code rec.field}, {@code label.var}).
     *
     * @return the reference, or {@code null} when the name is not a routine variable
     * @throws SqlAnalysisException when the name denotes a record that cannot supply the field
     */
    ParamRef resolveName(List<String> nameParts) throws SqlAnalysisException;

    /**
     * Resolves {@code $n}.
     *
     * @return the reference, or {@code null} when there is no such parameter
     */
    ParamRef resolveNumber(int number) throws SqlAnalysisException;
}
