package org.treeud.common.deptree;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

public class TestDepTreeUtil {

    @Test
    public void testBottomUp() throws Exception {
        DepTree tree = TestCoNLLUReader.parse(TestCoNLLUReader.SENTENCE);
        List<DepNode> subtrees = DepTreeUtil.getSubtreesBottomUp(tree);

        assertEquals(3, subtrees.size());
        assertEquals(4, subtrees.get(0).getOrd());
        assertEquals(2, subtrees.get(1).getOrd());
        assertEquals(1, subtrees.get(2).getOrd());

        for (int i = 0; i < subtrees.size(); ++i)
            for (int j = i + 1; j < subtrees.size(); ++j)
                assertFalse(subtrees.get(j).isDescendantOf(subtrees.get(i)));
    }

    @Test
    public void testFirstInPriority() throws Exception {
        DepTree tree = TestCoNLLUReader.parse(
                "1 hodie hodie ADV _ _ 3 advmod _ _",
                "2 Romae Roma PROPN _ _ 3 obl:lmod _ _",
                "3 [0] _ _ _ _ 0 root _ _");
        List<DepNode> children = tree.getNodeByOrd(3).getChildren();
        assertSame(tree.getNodeByOrd(2), DepTreeUtil.getFirstInPriority(children, "nsubj", "obl", "advmod"));
        assertSame(tree.getNodeByOrd(1), DepTreeUtil.getFirstInPriority(children, "advmod", "obl"));
        assertNull(DepTreeUtil.getFirstInPriority(children, "nsubj"));
    }

    @Test
    public void testVerify() throws Exception {
        DepTree tree = TestCoNLLUReader.parse(TestCoNLLUReader.SENTENCE);
        assertTrue(DepTreeUtil.verify(tree).isEmpty());

        DepNode removed = tree.getNodeByOrd(6);
        tree.getNodeByOrd(3).addSecondaryEdge(removed, "nsubj");
        removed.detach();
        List<String> problems = DepTreeUtil.verify(tree);
        assertEquals(1, problems.size());
        assertTrue(problems.get(0).startsWith("caes-1#3"));
    }
}
