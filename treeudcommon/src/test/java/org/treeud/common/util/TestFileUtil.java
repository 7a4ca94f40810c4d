package org.treeud.common.util;

import static org.junit.Assert.*;

import java.io.File;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestFileUtil {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testGetFiles() throws Exception {
        folder.newFile("b.conllu");
        folder.newFile("a.conllu");
        folder.newFile("notes.txt");
        folder.newFolder("sub");
        folder.newFile("sub" + File.separator + "c.conllu");
        folder.newFolder(".hidden");
        folder.newFile(".hidden" + File.separator + "d.conllu");

        List<String> files = FileUtil.getFiles(folder.getRoot(), ".*\\.conllu");
        assertEquals(3, files.size());
        assertEquals("a.conllu", files.get(0));
        assertEquals("b.conllu", files.get(1));
        assertEquals("sub" + File.separator + "c.conllu", files.get(2));

        File single = new File(folder.getRoot(), "a.conllu");
        assertEquals(single.getAbsolutePath(), FileUtil.getFiles(single, ".*\\.conllu", true).get(0));
        assertTrue(FileUtil.getFiles(single, ".*\\.txt").isEmpty());
    }
}
