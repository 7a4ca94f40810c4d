package org.treeud.common.deptree;

/**
 * Construction-membership flags set by the shallow conversion stage.
 */
public enum Membership {
    COORDINATION("CoordMember"),
    APPOSITION("AposMember");

    final String miscKey;

    Membership(String miscKey) {
        this.miscKey = miscKey;
    }

    /** Returns the MISC attribute name the flag is stored under. */
    public String getMiscKey() {
        return miscKey;
    }
}
