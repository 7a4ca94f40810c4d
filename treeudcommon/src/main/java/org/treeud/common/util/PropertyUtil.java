package org.treeud.common.util;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class PropertyUtil {

    // match ${ENV_VAR_NAME}
    static final Pattern ENV_PATTERN = Pattern.compile("\\$\\{(\\w+)\\}");

    /**
     * Filters properties (does not inherit other properties)
     * @see #filterProperties(Properties, String, boolean)
     */
    public static Properties filterProperties(Properties in, String filter) {
        return filterProperties(in, filter, false);
    }

    /**
     * Returns the properties whose names begin with the filter, with the
     * filter part truncated. If inherit is specified, the other properties
     * are returned intact unless a filtered property has the same name, in
     * which case the filtered value wins.
     * @param in input properties object
     * @param filter name prefix
     * @param inherit whether to keep properties that do not begin with the filter
     * @return filtered properties
     */
    public static Properties filterProperties(Properties in, String filter, boolean inherit) {
        Properties out = new Properties();

        for (String propName : in.stringPropertyNames())
            if (propName.startsWith(filter))
                out.setProperty(propName.substring(filter.length()), in.getProperty(propName));

        if (inherit)
            for (String propName : in.stringPropertyNames())
                if (!propName.startsWith(filter) && out.getProperty(propName) == null)
                    out.setProperty(propName, in.getProperty(propName));

        return out;
    }

    /**
     * Returns a new properties object with ${ENV_VAR_NAME} references in
     * the values replaced by the environment; unset variables become empty.
     */
    public static Properties resolveEnvironmentVariables(Properties in) {
        Properties out = new Properties();

        for (String propName : in.stringPropertyNames()) {
            Matcher m = ENV_PATTERN.matcher(in.getProperty(propName));
            StringBuffer sb = new StringBuffer();
            while (m.find()) {
                String envVarValue = System.getenv(m.group(1));
                m.appendReplacement(sb, envVarValue == null ? "" : Matcher.quoteReplacement(envVarValue));
            }
            m.appendTail(sb);
            out.setProperty(propName, sb.toString());
        }
        return out;
    }

    /**
     * Loads a UTF-8 properties file and resolves environment variables.
     */
    public static Properties load(String fileName) throws IOException {
        InputStream in = new FileInputStream(fileName);
        try {
            return load(in);
        } finally {
            in.close();
        }
    }

    public static Properties load(InputStream in) throws IOException {
        Properties props = new Properties();
        Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
        props.load(reader);
        return resolveEnvironmentVariables(props);
    }

    public static boolean getBoolean(Properties props, String name, boolean defaultValue) {
        String value = props.getProperty(name);
        if (value == null || value.trim().isEmpty())
            return defaultValue;
        return Boolean.parseBoolean(value.trim());
    }

    public static String toString(Properties props) {
        StringBuilder builder = new StringBuilder();

        String[] keys = props.stringPropertyNames().toArray(new String[0]);
        Arrays.sort(keys);
        for (String key : keys)
            builder.append(key+" = "+props.getProperty(key)+"\n");
        return builder.toString();
    }
}
