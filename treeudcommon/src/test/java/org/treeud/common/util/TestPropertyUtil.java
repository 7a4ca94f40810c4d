package org.treeud.common.util;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.junit.Test;

public class TestPropertyUtil {

    @Test
    public void testFilter() {
        Properties props = new Properties();
        props.setProperty("convert.enhanced", "true");
        props.setProperty("enhanced", "false");
        props.setProperty("logger.level", "FINE");

        Properties filtered = PropertyUtil.filterProperties(props, "convert.");
        assertEquals(1, filtered.size());
        assertEquals("true", filtered.getProperty("enhanced"));

        Properties inherited = PropertyUtil.filterProperties(props, "convert.", true);
        assertEquals(2, inherited.size());
        assertEquals("true", inherited.getProperty("enhanced"));
        assertEquals("FINE", inherited.getProperty("logger.level"));
    }

    @Test
    public void testLoad() throws Exception {
        String text = "convert.enhanced = yes\nhome = ${TREEUD_SURELY_UNSET_VARIABLE}/data\n";
        Properties props = PropertyUtil.load(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
        assertEquals("/data", props.getProperty("home"));
        assertFalse(PropertyUtil.getBoolean(props, "convert.enhanced", true));
        assertTrue(PropertyUtil.getBoolean(props, "missing", true));
        assertEquals("convert.enhanced = yes\nhome = /data\n", PropertyUtil.toString(props));
    }
}
