package org.treeud.convert;

/**
 * Construction a subtree represents, decided from its source annotation.
 */
public enum Construction {
    BRIDGE,
    COORDINATION,
    APPOSITION,
    COPULA,
    ELLIPSIS,
    NONE
}
