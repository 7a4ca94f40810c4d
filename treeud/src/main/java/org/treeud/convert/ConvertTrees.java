package org.treeud.convert;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Properties;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

import org.treeud.common.deptree.CoNLLUReader;
import org.treeud.common.deptree.CoNLLUWriter;
import org.treeud.common.deptree.DepTree;
import org.treeud.common.deptree.ParseException;
import org.treeud.common.util.FileUtil;
import org.treeud.common.util.PropertyUtil;

/**
 * Command-line front end: reads shallow-converted CoNLL-U, restructures
 * every sentence and writes CoNLL-U.
 */
public class ConvertTrees {

    private static Logger logger = Logger.getLogger("org.treeud");

    public static final String DEFAULT_PROPERTIES = "/treeud.properties";

    @Option(name="-prop",usage="properties file")
    private File propFile = null;

    @Option(name="-in",usage="input file/directory, stdin if not specified")
    private File inFile = null;

    @Option(name="-out",usage="output file/directory, stdout if not specified")
    private File outFile = null;

    @Option(name="-enhanced",usage="create empty nodes and enhanced dependencies (overrides the properties)")
    private boolean enhanced = false;

    @Option(name="-h",usage="help message")
    private boolean help = false;

    SubtreeConverter converter;
    int treeCount;
    int failureCount;

    public ConvertTrees(SubtreeConverter converter) {
        this.converter = converter;
    }

    ConvertTrees() {
    }

    /**
     * Converts every tree of the input. A sentence that cannot be read or
     * converted is logged and skipped.
     */
    public void process(Reader in, String inName, Writer out) throws IOException {
        CoNLLUReader reader = new CoNLLUReader(in, inName);
        CoNLLUWriter writer = new CoNLLUWriter(out, converter.isWithEnhanced());

        while (true) {
            DepTree tree;
            try {
                if ((tree = reader.nextTree()) == null)
                    break;
            } catch (ParseException e) {
                logger.severe(e.getMessage());
                continue;
            }
            try {
                failureCount += converter.process(tree);
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, inName+", "+tree.getSentId()+": conversion failed", e);
            }
            writer.write(tree);
            ++treeCount;
        }
        writer.flush();
        reader.close();
    }

    public int getTreeCount() {
        return treeCount;
    }

    public int getFailureCount() {
        return failureCount;
    }

    static Properties loadProperties(File propFile) throws IOException {
        if (propFile != null)
            return PropertyUtil.load(propFile.getPath());
        InputStream in = ConvertTrees.class.getResourceAsStream(DEFAULT_PROPERTIES);
        if (in == null)
            return new Properties();
        try {
            return PropertyUtil.load(in);
        } finally {
            in.close();
        }
    }

    static Reader openReader(File file) throws IOException {
        InputStream in = new FileInputStream(file);
        if (file.getName().endsWith(".gz"))
            in = new GZIPInputStream(in);
        return new InputStreamReader(in, StandardCharsets.UTF_8);
    }

    static Writer openWriter(File file) throws IOException {
        File dir = file.getAbsoluteFile().getParentFile();
        if (dir != null && !dir.exists() && !dir.mkdirs())
            throw new IOException("Cannot create output directory "+dir.getPath());
        return new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8));
    }

    public static void main(String[] args) throws Exception {
        ConvertTrees options = new ConvertTrees();
        CmdLineParser parser = new CmdLineParser(options);
        try {
            parser.parseArgument(args);
        } catch (CmdLineException e) {
            System.err.println("invalid options:"+e);
            parser.printUsage(System.err);
            System.exit(0);
        }
        if (options.help) {
            parser.printUsage(System.err);
            System.exit(0);
        }

        Properties props = loadProperties(options.propFile);
        Properties convertProps = PropertyUtil.filterProperties(props, "convert.", true);
        if (options.enhanced)
            convertProps.setProperty(SubtreeConverter.PROP_ENHANCED, "true");

        {
            String logLevel = convertProps.getProperty("logger.level");
            if (logLevel != null) {
                logger.setUseParentHandlers(false);
                ConsoleHandler ch = new ConsoleHandler();
                ch.setLevel(Level.parse(logLevel.trim()));
                logger.addHandler(ch);
                logger.setLevel(Level.parse(logLevel.trim()));
            }
        }
        logger.info(PropertyUtil.toString(convertProps));

        options.converter = new SubtreeConverter(convertProps);

        if (options.inFile == null) {
            Writer out = options.outFile == null ? new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)) : openWriter(options.outFile);
            options.process(new InputStreamReader(System.in, StandardCharsets.UTF_8), "stdin", out);
            out.close();
        } else if (options.inFile.isDirectory()) {
            if (options.outFile == null || (options.outFile.exists() && !options.outFile.isDirectory())) {
                logger.severe("An output directory is required for input directory "+options.inFile.getPath());
                System.exit(1);
            }
            List<String> fileNames = FileUtil.getFiles(options.inFile, convertProps.getProperty("input.regex", ".*\\.conllu"));
            logger.info("Converting "+fileNames.size()+" files");
            for (String fileName : fileNames) {
                File in = new File(options.inFile, fileName);
                File out = new File(options.outFile, fileName.endsWith(".gz") ? fileName.substring(0, fileName.length()-3) : fileName);
                logger.info("Processing "+in.getPath()+", outputing to "+out.getPath());
                Writer writer = openWriter(out);
                try {
                    options.process(openReader(in), in.getPath(), writer);
                } finally {
                    writer.close();
                }
            }
        } else {
            Writer out = options.outFile == null ? new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)) : openWriter(options.outFile);
            logger.info("Processing "+options.inFile.getPath()+", outputing to "+(options.outFile == null ? "stdout" : options.outFile.getPath()));
            options.process(openReader(options.inFile), options.inFile.getPath(), out);
            out.close();
        }
        logger.info(options.treeCount+" trees converted, "+options.failureCount+" construction(s) left unconverted");
    }
}
