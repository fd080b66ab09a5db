package me.christianrobert.plpgcheck.catalog;

import java.util.List;

/**
 * Read access to the system catalog: relations, types, functions and operators.
 * Implementations resolve unqualified names through their search path.
 */
public interface Catalog {

    /**
     * @return the relation, or {@code null} when it does not exist
     */
    RelationInfo findRelation(QualifiedName name);

    /**
     * All functions and procedures with the given name visible under the name's schema
     * or, when unqualified, the search path.
     */
    List<FunctionInfo> findFunctions(QualifiedName name);

    /**
     * @return a non built-in operator matching the operands, or {@code null}
     */
    OperatorInfo findOperator(String symbol, PgType left, PgType right);

    /**
     * Resolves a type name: built-in types first, then the row types of relations.
     *
     * @return the type, or {@code null} when nothing matches
     */
    default PgType findType(String typeName) {
        PgType builtin = BuiltinTypes.lookup(typeName);
        if (builtin != null) {
            return builtin;
        }
        String normalized = BuiltinTypes.normalize(typeName);
        boolean array = normalized.endsWith("[]");
        if (array) {
            normalized = normalized.substring(0, normalized.length() - 2);
        }
        RelationInfo relation = findRelation(QualifiedName.parse(normalized));
        if (relation == null) {
            return null;
        }
        return array ? BuiltinTypes.arrayOf(relation.getRowType()) : relation.getRowType();
    }

    default RelationInfo findRelation(String name) {
        return findRelation(QualifiedName.parse(name));
    }
}
