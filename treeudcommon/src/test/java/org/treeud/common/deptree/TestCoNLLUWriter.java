package org.treeud.common.deptree;

import static org.junit.Assert.*;

import java.io.StringWriter;

import org.junit.Test;

public class TestCoNLLUWriter {

    @Test
    public void testRoundTrip() throws Exception {
        DepTree tree = TestCoNLLUReader.parse(TestCoNLLUReader.SENTENCE);
        String text = CoNLLUWriter.toString(tree, false);
        String[] lines = text.split("\n");

        assertEquals("# sent_id = caes-1", lines[0]);
        assertEquals("3\turbem\turbs\tNOUN\tn-s---fa-\t_\t4\tobl\t_\toriginal_dep=ADV_CO|CoordMember=True", lines[4]);
        assertEquals("4\tet\tet\tCCONJ\tc--------\t_\t2\tcc\t_\toriginal_dep=COORD|SpaceAfter=No", lines[5]);
        assertEquals("6\t[0]\t_\t_\t_\t_\t1\tconj\t_\toriginal_dep=PRED|NodeType=Artificial|original_ord=6", lines[7]);
        assertTrue(text.endsWith("\n\n"));

        DepTree again = TestCoNLLUReader.parse(text.trim().split("\n"));
        assertEquals(text, CoNLLUWriter.toString(again, false));
    }

    @Test
    public void testDeps() throws Exception {
        DepTree tree = TestCoNLLUReader.parse(
                "1 Marcus Marcus PROPN _ _ 2 nsubj _ _",
                "2 venit venio VERB _ _ 0 root _ _");
        DepNode marcus = tree.getNodeByOrd(1);
        EmptyNode empty = tree.createEmptyNode(2, "_");
        empty.addSecondaryEdge(tree.getRootNode(), "root");
        marcus.addSecondaryEdge(empty, "nsubj");

        StringWriter out = new StringWriter();
        CoNLLUWriter writer = new CoNLLUWriter(out, true);
        writer.write(tree);
        writer.flush();
        String[] lines = out.toString().split("\n");

        assertEquals(3, lines.length);
        assertEquals("1\tMarcus\tMarcus\tPROPN\t_\t_\t2\tnsubj\t2:nsubj|2.1:nsubj\t_", lines[0]);
        assertEquals("2\tvenit\tvenio\tVERB\t_\t_\t0\troot\t0:root\t_", lines[1]);
        assertEquals("2.1\t_\t_\t_\t_\t_\t_\t_\t0:root\t_", lines[2]);
    }

    @Test
    public void testTokenRange() throws Exception {
        DepTree tree = TestCoNLLUReader.parse(
                "1-2 nonne _ _ _ _ _ _ _ _",
                "1 non non PART _ _ 3 advmod _ _",
                "2 ne ne PART _ _ 3 discourse _ _",
                "3 vides video VERB _ _ 0 root _ _");
        String[] lines = CoNLLUWriter.toString(tree, false).split("\n");
        assertEquals("1-2\tnonne\t_\t_\t_\t_\t_\t_\t_\t_", lines[0]);
        assertEquals(4, lines.length);
    }
}
