package org.treeud.convert;

import static org.junit.Assert.*;

import org.junit.Test;

import org.treeud.common.deptree.DepTree;

public class TestSubtreeClassifier {

    @Test
    public void testClassify() throws Exception {
        DepTree tree = TreeFixtures.parse(TreeFixtures.BRIDGE_OVER_COORDINATION);
        assertEquals(Construction.BRIDGE, SubtreeClassifier.classify(tree.getNodeByOrd(2)));
        assertEquals(Construction.COORDINATION, SubtreeClassifier.classify(tree.getNodeByOrd(4)));
        assertEquals(Construction.NONE, SubtreeClassifier.classify(tree.getNodeByOrd(1)));

        tree = TreeFixtures.parse(TreeFixtures.APPOSITION);
        assertEquals(Construction.APPOSITION, SubtreeClassifier.classify(tree.getNodeByOrd(3)));

        tree = TreeFixtures.parse(TreeFixtures.COPULA);
        assertEquals(Construction.COPULA, SubtreeClassifier.classify(tree.getNodeByOrd(2)));

        tree = TreeFixtures.parse(TreeFixtures.ELLIPSIS);
        assertEquals(Construction.ELLIPSIS, SubtreeClassifier.classify(tree.getNodeByOrd(3)));

        // a synthetic coordination root is a coordination, not an ellipsis
        tree = TreeFixtures.parse(TreeFixtures.COORDINATION);
        assertEquals(Construction.COORDINATION, SubtreeClassifier.classify(tree.getNodeByOrd(6)));
    }

    @Test
    public void testOriginalRelationOnly() throws Exception {
        DepTree tree = TreeFixtures.parse(TreeFixtures.COPULA);
        // the current relation does not matter
        tree.getNodeByOrd(3).setDeprel("root");
        tree.getNodeByOrd(2).setDeprel("cop");
        assertEquals(Construction.COPULA, SubtreeClassifier.classify(tree.getNodeByOrd(2)));

        tree.getNodeByOrd(3).setOriginalDeprel("PNOM_CO");
        assertTrue(SubtreeClassifier.isPredicateNominal(tree.getNodeByOrd(3)));
        assertEquals("PNOM", AGLDTLib.baseLabel("PNOM_CO"));
        assertNull(AGLDTLib.baseLabel(null));
    }

    @Test
    public void testBridgeCandidate() throws Exception {
        DepTree tree = TreeFixtures.parse(
                "1 in in ADP r-------- _ 0 root _ original_dep=AuxP",
                "2 autem autem ADV d-------- _ 1 advmod _ original_dep=AuxY",
                "3 vero vero PART _ _ 1 advmod _ original_dep=AuxZ",
                "4 urbem urbs NOUN _ _ 1 obl _ original_dep=ADV",
                "5 ne ne PART _ _ 1 advmod _ original_dep=AuxZ",
                "6 [0] _ _ _ _ 1 obl _ original_dep=ADV|NodeType=Artificial");
        assertFalse(SubtreeClassifier.isBridgeCandidate(tree.getNodeByOrd(2)));
        assertFalse(SubtreeClassifier.isBridgeCandidate(tree.getNodeByOrd(3)));
        assertTrue(SubtreeClassifier.isBridgeCandidate(tree.getNodeByOrd(4)));
        assertFalse(SubtreeClassifier.isBridgeCandidate(tree.getNodeByOrd(5)));
        assertTrue(SubtreeClassifier.isBridgeCandidate(tree.getNodeByOrd(6)));
    }
}
