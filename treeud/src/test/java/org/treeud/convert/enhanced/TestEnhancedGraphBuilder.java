package org.treeud.convert.enhanced;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import org.treeud.common.deptree.CoNLLUWriter;
import org.treeud.common.deptree.DepNode;
import org.treeud.common.deptree.DepTree;
import org.treeud.common.deptree.DepTreeUtil;
import org.treeud.common.deptree.EmptyNode;
import org.treeud.common.deptree.SecondaryEdge;
import org.treeud.convert.SubtreeConverter;
import org.treeud.convert.TreeFixtures;

public class TestEnhancedGraphBuilder {

    static String[] columns(String conllu, String id) {
        for (String line : conllu.split("\n"))
            if (line.startsWith(id+"\t"))
                return line.split("\t");
        fail("no line for "+id+" in\n"+conllu);
        return null;
    }

    @Test
    public void testEllipsis() throws Exception {
        DepTree tree = TreeFixtures.parse(TreeFixtures.ELLIPSIS);
        assertEquals(0, new SubtreeConverter(true).process(tree));
        assertTrue(DepTreeUtil.verify(tree).toString(), DepTreeUtil.verify(tree).isEmpty());

        assertEquals(2, tree.getNodeCount());
        List<EmptyNode> empties = tree.getEmptyNodes();
        assertEquals(1, empties.size());
        EmptyNode empty = empties.get(0);
        assertEquals("2.1", empty.getId());
        assertEquals(3, empty.getOriginalOrd());

        String conllu = CoNLLUWriter.toString(tree, true);
        assertEquals("0:root", columns(conllu, "2.1")[8]);
        assertEquals("0:root|2.1:obl", columns(conllu, "1")[8]);
        assertEquals("1:advmod|2.1:advmod", columns(conllu, "2")[8]);
        assertTrue(columns(conllu, "2.1")[9].contains("original_ord=3"));
    }

    @Test
    public void testNestedEllipsis() throws Exception {
        DepTree tree = TreeFixtures.parse(TreeFixtures.NESTED_ELLIPSIS);
        assertEquals(0, new SubtreeConverter(true).process(tree));

        List<EmptyNode> empties = tree.getEmptyNodes();
        assertEquals(2, empties.size());
        EmptyNode first = empties.get(0);
        EmptyNode second = empties.get(1);
        assertEquals("2.1", first.getId());
        assertEquals("2.2", second.getId());

        assertEquals(1, first.getSecondaryEdges().size());
        assertTrue(first.getSecondaryEdges().get(0).getGovernor().isRoot());
        assertEquals("root", first.getSecondaryEdges().get(0).getRelation());

        assertEquals(1, second.getSecondaryEdges().size());
        assertSame(first, second.getSecondaryEdges().get(0).getGovernor());
        assertEquals("ccomp", second.getSecondaryEdges().get(0).getRelation());

        DepNode marcus = tree.getNodeByOrd(1);
        DepNode romam = tree.getNodeByOrd(2);
        assertTrue(marcus.getSecondaryEdges().contains(new SecondaryEdge(first, "nsubj")));
        assertTrue(romam.getSecondaryEdges().contains(new SecondaryEdge(second, "obl")));

        String conllu = CoNLLUWriter.toString(tree, true);
        assertEquals("2.1:ccomp", columns(conllu, "2.2")[8]);
        assertEquals("1:ccomp|2.2:obl", columns(conllu, "2")[8]);
    }

    @Test
    public void testSecondaryGovernorsExist() throws Exception {
        String[][] fixtures = {TreeFixtures.ELLIPSIS, TreeFixtures.NESTED_ELLIPSIS, TreeFixtures.COORDINATION};
        for (String[] fixture : fixtures) {
            DepTree tree = TreeFixtures.parse(fixture);
            new SubtreeConverter(true).process(tree);
            for (DepNode node : tree.getNodes())
                for (SecondaryEdge edge : node.getSecondaryEdges())
                    assertTrue(edge.toString(), edge.getGovernor().isRoot() || tree.getEmptyNodes().contains(edge.getGovernor())
                            || tree.getNodes().contains(edge.getGovernor()));
            assertTrue(DepTreeUtil.verify(tree).isEmpty());
        }
    }

    @Test
    public void testNoSynthetic() throws Exception {
        DepTree tree = TreeFixtures.parse(TreeFixtures.COPULA);
        OriginalState snapshot = OriginalState.capture(tree);
        assertEquals(0, EnhancedGraphBuilder.rebuild(tree, snapshot));
        assertTrue(tree.getEmptyNodes().isEmpty());
    }

    @Test
    public void testBrokenReference() throws Exception {
        DepTree tree = TreeFixtures.parse(TreeFixtures.ELLIPSIS);
        OriginalState snapshot = OriginalState.capture(tree);
        tree.removeNode(tree.getNodeByOrd(2), false);

        assertEquals(1, EnhancedGraphBuilder.rebuild(tree, snapshot));
        assertEquals(1, tree.getEmptyNodes().size());
        assertEquals("1.1", tree.getEmptyNodes().get(0).getId());
        assertTrue(tree.getNodeByOrd(1).getSecondaryEdges().contains(
                new SecondaryEdge(tree.getEmptyNodes().get(0), "obl")));
    }

    @Test
    public void testOriginalState() throws Exception {
        DepTree tree = TreeFixtures.parse(TreeFixtures.NESTED_ELLIPSIS);
        OriginalState snapshot = OriginalState.capture(tree);
        assertEquals(4, snapshot.size());
        assertEquals("nested", snapshot.getSentId());
        assertEquals(3, snapshot.get(1).getGovernorOrd());
        assertTrue(snapshot.get(4).isSynthetic());
        assertEquals("OBJ", snapshot.get(4).getOriginalRelation());
        assertNull(snapshot.get(5));

        List<OriginalState.Entry> dependents = snapshot.getDependents(3);
        assertEquals(2, dependents.size());
        assertEquals(1, dependents.get(0).getOrd());
        assertEquals(4, dependents.get(1).getOrd());
        assertEquals("ccomp", dependents.get(1).getRelation());
    }
}
