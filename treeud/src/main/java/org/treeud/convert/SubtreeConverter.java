package org.treeud.convert;

import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.treeud.common.deptree.DepNode;
import org.treeud.common.deptree.DepTree;
import org.treeud.common.deptree.DepTreeUtil;
import org.treeud.common.util.PropertyUtil;
import org.treeud.convert.enhanced.EnhancedGraphBuilder;
import org.treeud.convert.enhanced.OriginalState;

/**
 * Restructures shallow-converted trees into UD trees. Subtrees (non-leaf
 * nodes) are visited bottom-up, so every construction sees its dependents
 * already converted: a coordination below a preposition is resolved
 * before the preposition is demoted.
 * <p>
 * Expects the source relation of every node, the membership flags and the
 * synthetic-node flags to be set by the shallow conversion. Instances
 * hold no per-tree state and can be shared between threads.
 */
public class SubtreeConverter {

    private static Logger logger = Logger.getLogger(SubtreeConverter.class.getPackage().getName());

    public static final String PROP_ENHANCED = "enhanced";

    final boolean withEnhanced;

    /**
     * @param withEnhanced if true, the synthetic nodes left after rewriting
     * become empty nodes and their dependencies are recorded as enhanced
     * edges; otherwise they stay as ordinary surface nodes
     */
    public SubtreeConverter(boolean withEnhanced) {
        this.withEnhanced = withEnhanced;
    }

    public SubtreeConverter(Properties props) {
        this(PropertyUtil.getBoolean(props, PROP_ENHANCED, false));
    }

    public boolean isWithEnhanced() {
        return withEnhanced;
    }

    /**
     * Converts the tree in place.
     * @return the number of subtrees and enhanced edges left unconverted
     */
    public int process(DepTree tree) {
        OriginalState snapshot = OriginalState.capture(tree);
        if (withEnhanced)
            for (DepNode node : tree.getNodes())
                if (node.isSynthetic() && node.getOriginalOrd() < 0)
                    node.setOriginalOrd(node.getOrd());

        int failures = 0;
        for (DepNode subtree : DepTreeUtil.getSubtreesBottomUp(tree)) {
            if (subtree.getParent() == null || subtree.isLeaf())
                continue;
            try {
                convert(tree, subtree);
            } catch (ConversionException e) {
                logger.log(e.getKind() == ConversionException.Kind.MISSING_MEMBERS ? Level.SEVERE : Level.WARNING, e.getMessage());
                ++failures;
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to convert "+tree.address(subtree), e);
                ++failures;
            }
        }

        if (withEnhanced)
            failures += EnhancedGraphBuilder.rebuild(tree, snapshot);
        return failures;
    }

    /**
     * Classifies one subtree and applies the matching rule.
     * @return the construction found
     */
    public Construction convert(DepTree tree, DepNode subtree) throws ConversionException {
        Construction construction = SubtreeClassifier.classify(subtree);
        switch (construction) {
        case BRIDGE:
            StructuralRewriter.convertBridge(tree, subtree);
            break;
        case COORDINATION:
            StructuralRewriter.convertCoordination(tree, subtree);
            break;
        case APPOSITION:
            StructuralRewriter.convertApposition(tree, subtree);
            break;
        case COPULA:
            StructuralRewriter.convertCopula(tree, subtree);
            break;
        case ELLIPSIS:
            StructuralRewriter.convertEllipsis(tree, subtree);
            break;
        default:
            break;
        }
        return construction;
    }
}
