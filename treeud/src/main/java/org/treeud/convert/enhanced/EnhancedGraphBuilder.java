package org.treeud.convert.enhanced;

import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import org.treeud.common.deptree.DepNode;
import org.treeud.common.deptree.DepTree;
import org.treeud.common.deptree.EmptyNode;
import org.treeud.common.deptree.Membership;
import org.treeud.convert.ConversionException;

/**
 * Turns the synthetic nodes left after rewriting into placeholder (empty)
 * nodes and rebuilds their enhanced edges from the pre-rewrite governance.
 */
public final class EnhancedGraphBuilder {

    private static Logger logger = Logger.getLogger(EnhancedGraphBuilder.class.getPackage().getName());

    private EnhancedGraphBuilder() {
    }

    /**
     * @param tree rewritten tree; surface ordinals must still be the ones
     * the snapshot was taken with
     * @param snapshot governance before rewriting
     * @return the number of edges that could not be resolved
     */
    public static int rebuild(DepTree tree, OriginalState snapshot) {
        List<DepNode> synthetics = new ArrayList<DepNode>();
        for (DepNode node : tree.getNodes())
            if (node.isSynthetic())
                synthetics.add(node);
        if (synthetics.isEmpty())
            return 0;

        // index by the ordinals the snapshot knows, before renumbering
        TIntObjectMap<DepNode> live = tree.indexByOrd();

        Map<DepNode, DepNode> anchors = new IdentityHashMap<DepNode, DepNode>();
        int[] startOrds = new int[synthetics.size()];
        for (int i = 0; i < synthetics.size(); ++i) {
            DepNode synthetic = synthetics.get(i);
            startOrds[i] = synthetic.getOrd();
            DepNode anchor = tree.getPreviousNode(synthetic);
            while (anchor.isSynthetic())
                anchor = tree.getPreviousNode(anchor);
            anchors.put(synthetic, anchor);
        }

        for (DepNode synthetic : synthetics)
            tree.removeNode(synthetic, false);
        tree.renumber();

        TIntObjectMap<EmptyNode> placeholders = new TIntObjectHashMap<EmptyNode>();
        for (int i = 0; i < synthetics.size(); ++i) {
            EmptyNode empty = copyToEmpty(tree, synthetics.get(i), anchors.get(synthetics.get(i)), startOrds[i]);
            placeholders.put(startOrds[i], empty);
            live.put(startOrds[i], empty);
        }

        int failures = 0;
        for (int ord : startOrds) {
            EmptyNode empty = placeholders.get(ord);

            for (OriginalState.Entry dependent : snapshot.getDependents(ord))
                try {
                    resolve(live, dependent.getOrd(), snapshot).addSecondaryEdge(empty, dependent.getRelation());
                } catch (ConversionException e) {
                    logger.warning(e.getMessage());
                    ++failures;
                }

            OriginalState.Entry self = snapshot.get(ord);
            if (self == null) {
                logger.warning(snapshot.getSentId()+": no original governance recorded for "+tree.address(empty));
                ++failures;
                continue;
            }
            // an edge to a converted synthetic governor was added from its side
            if (placeholders.containsKey(self.getGovernorOrd()))
                continue;
            try {
                empty.addSecondaryEdge(resolve(live, self.getGovernorOrd(), snapshot), self.getRelation());
            } catch (ConversionException e) {
                logger.warning(e.getMessage());
                ++failures;
            }
        }
        return failures;
    }

    static EmptyNode copyToEmpty(DepTree tree, DepNode synthetic, DepNode anchor, int startOrd) {
        EmptyNode empty = tree.createEmptyNode(anchor.getOrd(), synthetic.getForm());
        empty.setLemma(synthetic.getLemma());
        empty.setUPOS(synthetic.getUPOS());
        empty.setXPOS(synthetic.getXPOS());
        empty.setFeats(synthetic.getFeats());
        empty.setOriginalDeprel(synthetic.getOriginalDeprel());
        empty.setOriginalOrd(synthetic.getOriginalOrd() >= 0 ? synthetic.getOriginalOrd() : startOrd);
        for (Membership membership : synthetic.getMemberships())
            empty.addMembership(membership);
        empty.getMisc().putAll(synthetic.getMisc());
        logger.fine("Creating empty node at "+tree.address(empty)+" for "+synthetic.getForm());
        return empty;
    }

    static DepNode resolve(TIntObjectMap<DepNode> live, int ord, OriginalState snapshot) throws ConversionException {
        DepNode node = live.get(ord);
        if (node == null || (!node.isRoot() && !node.isEmpty() && node.getParent() == null))
            throw new ConversionException(ConversionException.Kind.BROKEN_REFERENCE,
                    snapshot.getSentId()+": no node left for original ordinal "+ord);
        return node;
    }
}
