package org.treeud.common.deptree;

import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tree-level helpers shared by the conversion and verification tools.
 */
public final class DepTreeUtil {

    private DepTreeUtil() {
    }

    /**
     * Returns the non-leaf surface nodes ordered bottom-up: deepest
     * (furthest from the root) first, ties in linear order. Every node
     * comes before all of its ancestors.
     * @param tree the sentence tree
     * @return subtree roots in processing order
     */
    public static List<DepNode> getSubtreesBottomUp(DepTree tree) {
        List<DepNode> subtrees = new ArrayList<DepNode>();
        for (DepNode node : tree.getNodes())
            if (!node.isLeaf())
                subtrees.add(node);

        final Map<DepNode, Integer> levelMap = new IdentityHashMap<DepNode, Integer>();
        for (DepNode node : subtrees)
            levelMap.put(node, node.getLevelToRoot());

        Collections.sort(subtrees, new Comparator<DepNode>() {
            @Override
            public int compare(DepNode lhs, DepNode rhs) {
                int diff = levelMap.get(rhs) - levelMap.get(lhs);
                return diff != 0 ? diff : lhs.ord - rhs.ord;
            }
        });
        return subtrees;
    }

    /**
     * Returns the first node whose universal relation matches the earliest
     * possible entry of the priority list, or null if none matches.
     * @param nodes candidates in linear order
     * @param priority relations, most preferred first
     */
    public static DepNode getFirstInPriority(List<DepNode> nodes, String... priority) {
        for (String relation : priority)
            for (DepNode node : nodes)
                if (relation.equals(node.getUDeprel()))
                    return node;
        return null;
    }

    /**
     * Checks that the surface nodes form a single tree under the
     * super-root: distinct ordinals, consistent governor/dependent links,
     * no cycles and no placeholder in the primary tree.
     * @return descriptions of the violations found, empty if none
     */
    public static List<String> verify(DepTree tree) {
        List<String> problems = new ArrayList<String>();
        TIntSet ords = new TIntHashSet();
        List<DepNode> nodes = tree.getNodes();
        int limit = nodes.size() + 1;

        if (tree.rootNode.parent != null)
            problems.add(tree.getSentId()+": super-root has a governor");

        for (DepNode node : nodes) {
            if (node.isEmpty())
                problems.add(tree.address(node)+": placeholder in the primary tree");
            if (!ords.add(node.ord))
                problems.add(tree.address(node)+": duplicate ordinal");
            if (node.parent == null) {
                problems.add(tree.address(node)+": no governor");
                continue;
            }
            if (!node.parent.children.contains(node))
                problems.add(tree.address(node)+": governor "+node.parent+" does not list it as a dependent");
            DepNode ancestor = node;
            int steps = 0;
            while (ancestor.parent != null && steps++ <= limit)
                ancestor = ancestor.parent;
            if (ancestor != tree.rootNode)
                problems.add(tree.address(node)+": not reachable from the root");
        }
        for (EmptyNode empty : tree.emptyNodes)
            for (SecondaryEdge edge : empty.secondaryEdges)
                if (!edge.governor.isRoot() && !edge.governor.isEmpty() && edge.governor.parent == null)
                    problems.add(tree.address(empty)+": secondary edge to removed node "+edge.governor);
        for (DepNode node : nodes)
            for (SecondaryEdge edge : node.secondaryEdges)
                if (!edge.governor.isRoot() && !edge.governor.isEmpty() && edge.governor.parent == null)
                    problems.add(tree.address(node)+": secondary edge to removed node "+edge.governor);
        return problems;
    }
}
