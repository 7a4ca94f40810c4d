package org.treeud.convert;

import org.treeud.common.deptree.DepNode;

/**
 * Decides which construction a subtree represents. Only the source
 * annotation (original relations, synthetic flag) is consulted, never the
 * current, possibly rewritten, relations.
 */
public final class SubtreeClassifier {

    private SubtreeClassifier() {
    }

    public static Construction classify(DepNode subtree) {
        if (isBridge(subtree))
            return Construction.BRIDGE;
        if (isCoordination(subtree))
            return Construction.COORDINATION;
        if (isApposition(subtree))
            return Construction.APPOSITION;
        if (isCopula(subtree))
            return Construction.COPULA;
        if (isEllipsis(subtree))
            return Construction.ELLIPSIS;
        return Construction.NONE;
    }

    /** Preposition or subordinating conjunction governing a phrase. */
    public static boolean isBridge(DepNode subtree) {
        String label = AGLDTLib.baseLabel(subtree.getOriginalDeprel());
        return AGLDTLib.AUXP.equals(label) || AGLDTLib.AUXC.equals(label);
    }

    public static boolean isCoordination(DepNode subtree) {
        return AGLDTLib.COORD.equals(AGLDTLib.baseLabel(subtree.getOriginalDeprel()));
    }

    public static boolean isApposition(DepNode subtree) {
        return AGLDTLib.APOS.equals(AGLDTLib.baseLabel(subtree.getOriginalDeprel()));
    }

    public static boolean isCopula(DepNode subtree) {
        for (DepNode child : subtree.getChildren())
            if (isPredicateNominal(child))
                return true;
        return false;
    }

    public static boolean isEllipsis(DepNode subtree) {
        return subtree.isSynthetic();
    }

    public static boolean isPredicateNominal(DepNode node) {
        return AGLDTLib.PNOM.equals(AGLDTLib.baseLabel(node.getOriginalDeprel()));
    }

    /**
     * Whether the node can head the phrase of a bridge: a synthetic node,
     * or a content word that is not one of the excluded markers.
     */
    public static boolean isBridgeCandidate(DepNode node) {
        if (node.isSynthetic())
            return true;
        if (AGLDTLib.BRIDGE_EXCLUDED.contains(AGLDTLib.baseLabel(node.getOriginalDeprel())))
            return false;
        String xpos = node.getXPOS();
        if (xpos != null && !xpos.isEmpty())
            return AGLDTLib.CONTENT_XPOS.indexOf(xpos.charAt(0)) >= 0;
        return node.getUPOS() != null && AGLDTLib.CONTENT_UPOS.contains(node.getUPOS());
    }
}
