package org.treeud.convert;

/**
 * A construction could not be converted. The affected subtree or edge is
 * left as it is and conversion goes on with the rest of the tree.
 */
public class ConversionException extends Exception {

    private static final long serialVersionUID = -3078546148563394321L;

    public enum Kind {
        /** the unique head candidate is missing or not unique */
        AMBIGUOUS_CANDIDATE,
        /** coordination or apposition without flagged members */
        MISSING_MEMBERS,
        /** a recorded ordinal no longer resolves to a node */
        BROKEN_REFERENCE
    }

    final Kind kind;

    public ConversionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
