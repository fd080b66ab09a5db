package me.christianrobert.plpgcheck.ast;

/**
 * Names visible at a point of the routine, as an immutable chain from the innermost
 * declaration outwards. Variables belong to the nearest label below them, so
 * {@code label.variable} lookups only search the items that label owns.
 */
public final class Namespace {

    public enum ItemType {
        LABEL,
        VARIABLE
    }

    public enum LabelKind {
        BLOCK,
        LOOP
    }

    private static final Namespace EMPTY = new Namespace(null, null, null, -1, null);

    private final Namespace parent;
    private final ItemType itemType;
    private final String name;
    private final int varno;
    private final LabelKind labelKind;

    private Namespace(Namespace parent, ItemType itemType, String name, int varno, LabelKind labelKind) {
        this.parent = parent;
        this.itemType = itemType;
        this.name = name;
        this.varno = varno;
        this.labelKind = labelKind;
    }

    public static Namespace empty() {
        return EMPTY;
    }

    public Namespace withLabel(String label, LabelKind kind) {
        return new Namespace(this, ItemType.LABEL, label, -1, kind);
    }

    public Namespace withVariable(String variableName, int variableNo) {
        return new Namespace(this, ItemType.VARIABLE, variableName, variableNo, null);
    }

    /**
     * @return the varno of the innermost variable with this name, or -1
     */
    public int lookupVariable(String variableName) {
        for (Namespace ns = this; ns != EMPTY; ns = ns.parent) {
            if (ns.itemType == ItemType.VARIABLE && ns.name.equals(variableName)) {
                return ns.varno;
            }
        }
        return -1;
    }

    /**
     * Resolves {@code label.variable}.
     *
     * @return the varno, or -1 when the label does not exist or does not own such a variable
     */
    public int lookupQualified(String label, String variableName) {
        int candidate = -1;
        for (Namespace ns = this; ns != EMPTY; ns = ns.parent) {
            if (ns.itemType == ItemType.VARIABLE) {
                if (candidate < 0 && ns.name.equals(variableName)) {
                    candidate = ns.varno;
                }
            } else {
                if (ns.name != null && ns.name.equals(label)) {
                    return candidate;
                }
                candidate = -1;
            }
        }
        return -1;
    }

    /**
     * @return the kind of the innermost label with this name, or {@code null}
     */
    public LabelKind lookupLabel(String label) {
        for (Namespace ns = this; ns != EMPTY; ns = ns.parent) {
            if (ns.itemType == ItemType.LABEL && ns.name != null && ns.name.equals(label)) {
                return ns.labelKind;
            }
        }
        return null;
    }
}
