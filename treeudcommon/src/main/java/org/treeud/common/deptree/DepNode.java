/**
 * Copyright (c) 2007, Regents of the University of Colorado
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *
 * Redistributions of source code must retain the above copyright notice, this list of conditions and the following disclaimer.
 * Redistributions in binary form must reproduce the above copyright notice, this list of conditions and the following disclaimer in the documentation and/or other materials provided with the distribution.
 * Neither the name of the University of Colorado at Boulder nor the names of its contributors may be used to endorse or promote products derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE
 * ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT OWNER OR CONTRIBUTORS BE
 * LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR
 * CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF
 * SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS
 * INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN
 * CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE)
 * ARISING IN ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF THE
 * POSSIBILITY OF SUCH DAMAGE.
 */
package org.treeud.common.deptree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dependency tree node. Every node except the super-root has exactly one
 * governor; dependents are kept in linear (ordinal) order.
 * 
 */
public class DepNode {

    public static final String NONE = "_";

    DepNode parent;
    List<DepNode> children;

    int ord;
    String form;
    String lemma;
    String upos;
    String xpos;
    String feats;
    String deprel;

    String originalDeprel;  // source treebank relation, set upstream
    int originalOrd;        // ordinal before any surface node was removed
    boolean synthetic;      // inserted upstream for an implicit head
    Set<Membership> memberships;

    List<SecondaryEdge> secondaryEdges;
    Map<String, String> misc;   // MISC attributes the engine does not interpret

    /**
     * Initializes the node at the given ordinal with no governor.
     * @param ord linear position, 0 is reserved for the super-root
     * @param form surface form
     */
    public DepNode(int ord, String form) {
        this.ord = ord;
        this.form = form;
        this.originalOrd = -1;
        children = new ArrayList<DepNode>(0);
        memberships = EnumSet.noneOf(Membership.class);
        secondaryEdges = new ArrayList<SecondaryEdge>(0);
        misc = new LinkedHashMap<String, String>();
    }

    public DepNode getParent() {
        return parent;
    }

    /**
     * Attaches this node under a new governor.
     * @param newParent the new governor
     * @throws IllegalArgumentException if the attachment would create a cycle
     */
    public void setParent(DepNode newParent) {
        if (newParent == parent)
            return;
        if (newParent == this || newParent.isDescendantOf(this))
            throw new IllegalArgumentException("Attaching "+this+" under "+newParent+" would create a cycle");
        if (parent != null)
            parent.children.remove(this);
        parent = newParent;
        newParent.insertChild(this);
    }

    void insertChild(DepNode child) {
        int i = 0;
        while (i < children.size() && children.get(i).ord < child.ord)
            ++i;
        children.add(i, child);
    }

    void detach() {
        if (parent != null)
            parent.children.remove(this);
        parent = null;
    }

    /** Returns the dependents in linear order. */
    public List<DepNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean isRoot() {
        return ord == 0 && parent == null;
    }

    public boolean isEmpty() {
        return false;
    }

    public boolean isDescendantOf(DepNode ancestor) {
        DepNode node = this;
        while ((node = node.parent) != null)
            if (node == ancestor)
                return true;
        return false;
    }

    public int getLevelToRoot() {
        int level = 0;
        DepNode ancestor = this;
        while ((ancestor = ancestor.parent) != null)
            ++level;
        return level;
    }

    public boolean precedes(DepNode node) {
        return ord < node.ord || (ord == node.ord && !isEmpty() && node.isEmpty());
    }

    public List<DepNode> getDescendants() {
        List<DepNode> nodes = new ArrayList<DepNode>();
        for (DepNode child : children) {
            nodes.add(child);
            nodes.addAll(child.getDescendants());
        }
        return nodes;
    }

    public int getOrd() {
        return ord;
    }

    /** Returns the CoNLL-U identifier of the node. */
    public String getId() {
        return Integer.toString(ord);
    }

    public String getForm() {
        return form;
    }

    public void setForm(String form) {
        this.form = form;
    }

    public String getLemma() {
        return lemma;
    }

    public void setLemma(String lemma) {
        this.lemma = lemma;
    }

    public String getUPOS() {
        return upos;
    }

    public void setUPOS(String upos) {
        this.upos = upos;
    }

    public String getXPOS() {
        return xpos;
    }

    public void setXPOS(String xpos) {
        this.xpos = xpos;
    }

    public String getFeats() {
        return feats;
    }

    public void setFeats(String feats) {
        this.feats = feats;
    }

    public String getDeprel() {
        return deprel;
    }

    public void setDeprel(String deprel) {
        this.deprel = deprel;
    }

    /**
     * Returns the universal part of the relation, i.e. without the
     * language-specific subtype after ':'.
     */
    public String getUDeprel() {
        return universalPart(deprel);
    }

    public static String universalPart(String label) {
        if (label == null)
            return null;
        int idx = label.indexOf(':');
        return idx < 0 ? label : label.substring(0, idx);
    }

    public String getOriginalDeprel() {
        return originalDeprel;
    }

    public void setOriginalDeprel(String originalDeprel) {
        this.originalDeprel = originalDeprel;
    }

    public int getOriginalOrd() {
        return originalOrd;
    }

    public void setOriginalOrd(int originalOrd) {
        this.originalOrd = originalOrd;
    }

    public boolean isSynthetic() {
        return synthetic;
    }

    public void setSynthetic(boolean synthetic) {
        this.synthetic = synthetic;
    }

    public boolean isMember(Membership membership) {
        return memberships.contains(membership);
    }

    public Set<Membership> getMemberships() {
        return Collections.unmodifiableSet(memberships);
    }

    public void addMembership(Membership membership) {
        memberships.add(membership);
    }

    public void removeMembership(Membership membership) {
        memberships.remove(membership);
    }

    public List<SecondaryEdge> getSecondaryEdges() {
        return Collections.unmodifiableList(secondaryEdges);
    }

    /**
     * Adds an enhanced-graph edge from this node to a governor other than
     * its primary one. Duplicate edges are ignored.
     * @return whether the edge was added
     */
    public boolean addSecondaryEdge(DepNode governor, String relation) {
        SecondaryEdge edge = new SecondaryEdge(governor, relation);
        if (secondaryEdges.contains(edge))
            return false;
        secondaryEdges.add(edge);
        return true;
    }

    public Map<String, String> getMisc() {
        return misc;
    }

    @Override
    public String toString() {
        return getId()+":"+form;
    }
}
