package org.treeud.common.deptree;

/**
 * Thrown when a sentence block cannot be read as a dependency tree.
 */
public class ParseException extends Exception {

    private static final long serialVersionUID = 4235164581213472069L;

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
