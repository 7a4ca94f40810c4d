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

import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/**
 * Dependency tree of one sentence: the surface nodes hanging from a
 * synthetic super-root, plus the placeholder nodes of the enhanced graph.
 */
public class DepTree {

    private static Logger logger = Logger.getLogger(DepTree.class.getPackage().getName());

    public static final String ROOT_FORM = "<ROOT>";

    String sentId;
    int index;
    List<String> comments;
    DepNode rootNode;
    List<EmptyNode> emptyNodes;
    List<TokenRange> tokenRanges;

    /**
     * A multiword token spanning several surface nodes.
     */
    public static class TokenRange {
        DepNode first;
        DepNode last;
        String form;
        String misc;

        public TokenRange(DepNode first, DepNode last, String form, String misc) {
            this.first = first;
            this.last = last;
            this.form = form;
            this.misc = misc;
        }

        public DepNode getFirst() {
            return first;
        }

        public DepNode getLast() {
            return last;
        }

        public String getForm() {
            return form;
        }

        public String getMisc() {
            return misc;
        }
    }

    public DepTree(String sentId, int index) {
        this.sentId = sentId;
        this.index = index;
        comments = new ArrayList<String>();
        rootNode = new DepNode(0, ROOT_FORM);
        emptyNodes = new ArrayList<EmptyNode>();
        tokenRanges = new ArrayList<TokenRange>();
    }

    public String getSentId() {
        return sentId == null ? Integer.toString(index) : sentId;
    }

    public List<String> getComments() {
        return comments;
    }

    public DepNode getRootNode() {
        return rootNode;
    }

    /**
     * Returns the surface nodes in linear order.
     */
    public List<DepNode> getNodes() {
        List<DepNode> nodes = rootNode.getDescendants();
        Collections.sort(nodes, new Comparator<DepNode>() {
            @Override
            public int compare(DepNode lhs, DepNode rhs) {
                return lhs.ord - rhs.ord;
            }
        });
        return nodes;
    }

    public int getNodeCount() {
        return rootNode.getDescendants().size();
    }

    /**
     * Returns the surface node at the ordinal, the super-root for 0, or
     * null if there is none.
     */
    public DepNode getNodeByOrd(int ord) {
        if (ord == 0)
            return rootNode;
        for (DepNode node : rootNode.getDescendants())
            if (node.ord == ord)
                return node;
        return null;
    }

    /**
     * Indexes the surface nodes (and the super-root) by their current ordinal.
     */
    public TIntObjectMap<DepNode> indexByOrd() {
        TIntObjectMap<DepNode> index = new TIntObjectHashMap<DepNode>();
        index.put(0, rootNode);
        for (DepNode node : rootNode.getDescendants())
            index.put(node.ord, node);
        return index;
    }

    /**
     * Returns the surface node immediately preceding the node, or the
     * super-root if the node is the first one.
     */
    public DepNode getPreviousNode(DepNode node) {
        DepNode previous = rootNode;
        for (DepNode candidate : getNodes()) {
            if (!candidate.precedes(node))
                break;
            previous = candidate;
        }
        return previous;
    }

    /**
     * Removes a surface node, re-attaching its dependents to its governor.
     * @param node node to remove
     * @param warn whether to log a warning if the node still had dependents
     */
    public void removeNode(DepNode node, boolean warn) {
        if (node.isRoot())
            throw new IllegalArgumentException("Cannot remove the root of "+getSentId());
        DepNode governor = node.parent;
        if (warn && !node.isLeaf())
            logger.warning(getSentId()+": removing "+node+" with dependents "+node.children);
        for (DepNode child : new ArrayList<DepNode>(node.children))
            child.setParent(governor);
        node.detach();
        dropSecondaryEdgesTo(node);
        for (TokenRange range : new ArrayList<TokenRange>(tokenRanges))
            if (range.first == node || range.last == node) {
                logger.warning(getSentId()+": dropping multiword token "+range.form+" spanning removed node "+node);
                tokenRanges.remove(range);
            }
        logger.fine(getSentId()+": removed "+node);
    }

    void dropSecondaryEdgesTo(DepNode governor) {
        List<DepNode> nodes = rootNode.getDescendants();
        nodes.addAll(emptyNodes);
        for (DepNode node : nodes)
            for (SecondaryEdge edge : new ArrayList<SecondaryEdge>(node.secondaryEdges))
                if (edge.governor == governor) {
                    node.secondaryEdges.remove(edge);
                    logger.fine(getSentId()+": dropped secondary edge "+node.getId()+" -> "+edge);
                }
    }

    /**
     * Assigns contiguous ordinals starting at 1 to the surface nodes,
     * keeping their linear order.
     */
    public void renumber() {
        int ord = 0;
        for (DepNode node : getNodes())
            node.ord = ++ord;
    }

    public List<EmptyNode> getEmptyNodes() {
        return Collections.unmodifiableList(emptyNodes);
    }

    /**
     * Creates a placeholder after the surface node with ordinal major,
     * using the smallest minor suffix not taken yet.
     */
    public EmptyNode createEmptyNode(int major, String form) {
        TIntObjectMap<EmptyNode> taken = new TIntObjectHashMap<EmptyNode>();
        for (EmptyNode empty : emptyNodes)
            if (empty.ord == major)
                taken.put(empty.minor, empty);
        int minor = 1;
        while (taken.containsKey(minor))
            ++minor;
        return addEmptyNode(new EmptyNode(major, minor, form));
    }

    EmptyNode addEmptyNode(EmptyNode empty) {
        int i = 0;
        while (i < emptyNodes.size() && emptyNodes.get(i).precedes(empty))
            ++i;
        emptyNodes.add(i, empty);
        return empty;
    }

    public List<TokenRange> getTokenRanges() {
        return Collections.unmodifiableList(tokenRanges);
    }

    void addTokenRange(TokenRange range) {
        tokenRanges.add(range);
    }

    /**
     * Returns the address used in diagnostics.
     */
    public String address(DepNode node) {
        return getSentId()+"#"+node.getId();
    }

    @Override
    public String toString() {
        StringBuilder str = new StringBuilder();
        for (DepNode node : getNodes())
            str.append(node.form+"_"+node.getId()+"/"+(node.parent==null?-1:node.parent.ord)+' ');
        return str.toString();
    }
}
