package org.treeud.common.deptree;

/**
 * Placeholder for elided material. Empty nodes live outside the primary
 * tree and only take part in the enhanced graph through secondary edges.
 * Their identifier is {@code major.minor}, where major is the ordinal of
 * the surface node they follow.
 */
public class EmptyNode extends DepNode {

    int minor;

    public EmptyNode(int major, int minor, String form) {
        super(major, form);
        this.minor = minor;
    }

    @Override
    public String getId() {
        return ord+"."+minor;
    }

    @Override
    public boolean isEmpty() {
        return true;
    }

    @Override
    public void setParent(DepNode newParent) {
        throw new UnsupportedOperationException("Empty node "+getId()+" cannot take a primary governor");
    }

    @Override
    public boolean precedes(DepNode node) {
        if (ord != node.ord)
            return ord < node.ord;
        return node.isEmpty() && minor < ((EmptyNode) node).minor;
    }
}
