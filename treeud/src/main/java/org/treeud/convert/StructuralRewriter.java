package org.treeud.convert;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import org.treeud.common.deptree.DepNode;
import org.treeud.common.deptree.DepTree;
import org.treeud.common.deptree.DepTreeUtil;
import org.treeud.common.deptree.Membership;

/**
 * Per-construction rewriting rules. All of them change governance
 * through {@link #promote(DepNode, DepNode)} or through parent updates
 * ordered so that no node is ever attached below itself.
 */
public final class StructuralRewriter {

    private static Logger logger = Logger.getLogger(StructuralRewriter.class.getPackage().getName());

    private StructuralRewriter() {
    }

    /**
     * Makes newHead take the place of oldHead under oldHead's governor.
     * oldHead becomes a dependent of newHead, and so do the other
     * dependents of oldHead except the ones tied to it by goeswith.
     * Membership flags move from oldHead to newHead.
     * @param newHead node to promote
     * @param oldHead current head of the subtree
     */
    public static void promote(DepNode newHead, DepNode oldHead) {
        DepNode governor = oldHead.getParent();

        if (newHead.isDescendantOf(oldHead)) {
            newHead.setParent(governor);
            oldHead.setParent(newHead);
        } else {
            // newHead sits above oldHead: park oldHead first, newHead keeps
            // its governor if the old one now lies below it
            oldHead.setParent(newHead);
            if (governor != newHead && !governor.isDescendantOf(newHead))
                newHead.setParent(governor);
        }

        for (Membership membership : Membership.values())
            if (oldHead.isMember(membership)) {
                newHead.addMembership(membership);
                oldHead.removeMembership(membership);
            }

        for (DepNode child : new ArrayList<DepNode>(oldHead.getChildren()))
            if (!AGLDTLib.UD_GOESWITH.equals(child.getUDeprel()))
                child.setParent(newHead);
    }

    /**
     * Re-attaches the node to the nearest following sibling whose universal
     * relation is the given one.
     * @return whether a sibling was found
     */
    public static boolean attachRight(DepNode node, String relation) {
        for (DepNode sibling : node.getParent().getChildren())
            if (sibling != node && node.precedes(sibling) && relation.equals(sibling.getUDeprel())) {
                node.setParent(sibling);
                return true;
            }
        return false;
    }

    /**
     * Promotes the single content dependent of a preposition or
     * subordinating conjunction over it.
     */
    public static void convertBridge(DepTree tree, DepNode subtree) throws ConversionException {
        List<DepNode> candidates = new ArrayList<DepNode>();
        for (DepNode child : subtree.getChildren())
            if (SubtreeClassifier.isBridgeCandidate(child))
                candidates.add(child);
        if (candidates.size() != 1)
            throw new ConversionException(ConversionException.Kind.AMBIGUOUS_CANDIDATE,
                    "Could not find a root candidate for "+tree.address(subtree)+", deprel="+subtree.getDeprel()+", candidates="+candidates.size());
        promote(candidates.get(0), subtree);
    }

    /**
     * Makes the first conjunct the head of the coordination, the other
     * conjuncts its {@code conj} dependents, and moves conjunctions and
     * punctuation to the conjunct they introduce.
     */
    public static void convertCoordination(DepTree tree, DepNode subtree) throws ConversionException {
        List<DepNode> members = getMembers(subtree, Membership.COORDINATION);
        if (members.isEmpty())
            throw new ConversionException(ConversionException.Kind.MISSING_MEMBERS,
                    "No coordination members for "+tree.address(subtree));

        DepNode first = members.remove(0);
        first.setParent(subtree.getParent());
        for (DepNode member : members) {
            member.setParent(first);
            member.setDeprel(AGLDTLib.UD_CONJ);
        }
        inheritMemberships(first, subtree);

        // park the old head under the first conjunct before moving its dependents
        subtree.setParent(first);
        for (DepNode child : new ArrayList<DepNode>(subtree.getChildren())) {
            child.setParent(first);
            if (AGLDTLib.AUXY.equals(AGLDTLib.baseLabel(child.getOriginalDeprel())) && AGLDTLib.UPOS_CCONJ.equals(child.getUPOS()))
                child.setDeprel(AGLDTLib.UD_CC);
        }

        if (subtree.isSynthetic())
            tree.removeNode(subtree, true);
        else if (AGLDTLib.UPOS_CCONJ.equals(subtree.getUPOS()))
            subtree.setDeprel(AGLDTLib.UD_CC);
        else if (AGLDTLib.UPOS_PUNCT.equals(subtree.getUPOS()))
            subtree.setDeprel(AGLDTLib.UD_PUNCT);

        for (DepNode child : new ArrayList<DepNode>(first.getChildren())) {
            String relation = child.getUDeprel();
            if ((AGLDTLib.UD_CC.equals(relation) || AGLDTLib.UD_PUNCT.equals(relation)) && first.precedes(child))
                attachRight(child, AGLDTLib.UD_CONJ);
        }
    }

    /**
     * Makes the first apposition member the head and the other members its
     * {@code appos} dependents.
     */
    public static void convertApposition(DepTree tree, DepNode subtree) throws ConversionException {
        List<DepNode> members = getMembers(subtree, Membership.APPOSITION);
        if (members.isEmpty())
            throw new ConversionException(ConversionException.Kind.MISSING_MEMBERS,
                    "No apposition members for "+tree.address(subtree));

        DepNode first = members.remove(0);
        first.setParent(subtree.getParent());
        for (DepNode member : members) {
            member.setParent(first);
            member.setDeprel(AGLDTLib.UD_APPOS);
        }
        inheritMemberships(first, subtree);

        for (DepNode child : new ArrayList<DepNode>(subtree.getChildren()))
            child.setParent(first);

        if (subtree.isSynthetic())
            tree.removeNode(subtree, true);
        else {
            subtree.setParent(first);
            if (AGLDTLib.UPOS_PUNCT.equals(subtree.getUPOS()))
                subtree.setDeprel(AGLDTLib.UD_PUNCT);
        }
    }

    /**
     * Promotes the single predicate nominal over the copula, which becomes its
     * {@code cop} dependent (or disappears if it was synthetic).
     */
    public static void convertCopula(DepTree tree, DepNode subtree) throws ConversionException {
        List<DepNode> nominals = new ArrayList<DepNode>();
        for (DepNode child : subtree.getChildren())
            if (SubtreeClassifier.isPredicateNominal(child))
                nominals.add(child);
        if (nominals.size() != 1)
            throw new ConversionException(ConversionException.Kind.AMBIGUOUS_CANDIDATE,
                    "Could not find a unique PNOM for copula at "+tree.address(subtree)+", candidates="+nominals.size());

        DepNode nominal = nominals.get(0);
        nominal.setDeprel(subtree.getDeprel());
        promote(nominal, subtree);

        if (subtree.isSynthetic()) {
            logger.fine("Removing node "+tree.address(subtree)+", "+subtree.getOriginalDeprel());
            tree.removeNode(subtree, true);
        } else
            subtree.setDeprel(AGLDTLib.UD_COP);
    }

    /**
     * Promotes the most prominent dependent of an elided head in its place.
     */
    public static void convertEllipsis(DepTree tree, DepNode subtree) throws ConversionException {
        DepNode newHead = DepTreeUtil.getFirstInPriority(subtree.getChildren(), AGLDTLib.ELLIPSIS_PROMOTION_ORDER);
        if (newHead == null)
            throw new ConversionException(ConversionException.Kind.AMBIGUOUS_CANDIDATE,
                    "Could not find candidates for promotion for "+tree.address(subtree)+", "+subtree.getForm());
        newHead.setDeprel(subtree.getDeprel());
        promote(newHead, subtree);
    }

    static List<DepNode> getMembers(DepNode subtree, Membership membership) {
        List<DepNode> members = new ArrayList<DepNode>();
        for (DepNode child : subtree.getChildren())
            if (child.isMember(membership))
                members.add(child);
        return members;
    }

    /**
     * The new head of a coordination or apposition stands for the whole
     * construction in the enclosing one, so it takes over the flags of the
     * construction root and loses the flags it had as an inner member.
     */
    static void inheritMemberships(DepNode first, DepNode subtree) {
        for (Membership membership : Membership.values()) {
            if (subtree.isMember(membership))
                first.addMembership(membership);
            else
                first.removeMembership(membership);
            subtree.removeMembership(membership);
        }
    }
}
