package org.treeud.common.deptree;

/**
 * An enhanced-graph (governor, relation) pair beyond a node's primary governor.
 */
public class SecondaryEdge {

    final DepNode governor;
    final String relation;

    public SecondaryEdge(DepNode governor, String relation) {
        this.governor = governor;
        this.relation = relation;
    }

    public DepNode getGovernor() {
        return governor;
    }

    public String getRelation() {
        return relation;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + System.identityHashCode(governor);
        result = prime * result + ((relation == null) ? 0 : relation.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof SecondaryEdge))
            return false;
        SecondaryEdge other = (SecondaryEdge) obj;
        if (governor != other.governor)
            return false;
        if (relation == null)
            return other.relation == null;
        return relation.equals(other.relation);
    }

    @Override
    public String toString() {
        return governor.getId()+":"+relation;
    }
}
