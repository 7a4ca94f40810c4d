package org.treeud.common.util;

import static org.junit.Assert.*;

import java.io.StringReader;

import org.junit.Test;

import org.treeud.common.deptree.CoNLLUReader;

public class TestVerifyTrees {

    @Test
    public void testVerify() throws Exception {
        String input = "# sent_id = ok\n1\tvenit\tvenio\tVERB\t_\t_\t0\troot\t_\t_\n\n"
                + "# sent_id = cycle\n1\ta\ta\tX\t_\t_\t2\tdep\t_\t_\n2\tb\tb\tX\t_\t_\t1\tdep\t_\t_\n\n"
                + "# sent_id = ok2\n1\tvenit\tvenio\tVERB\t_\t_\t0\troot\t_\t_\n\n";
        assertEquals(1, VerifyTrees.verify(new CoNLLUReader(new StringReader(input))));
    }
}
