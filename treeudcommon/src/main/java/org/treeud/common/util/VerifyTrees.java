package org.treeud.common.util;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.logging.Logger;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

import org.treeud.common.deptree.CoNLLUReader;
import org.treeud.common.deptree.DepTree;
import org.treeud.common.deptree.DepTreeUtil;
import org.treeud.common.deptree.ParseException;

/**
 * Reports CoNLL-U sentences that do not form a single rooted tree.
 */
public class VerifyTrees {

    private static Logger logger = Logger.getLogger(VerifyTrees.class.getPackage().getName());

    @Option(name="-in",usage="input file/directory")
    private File input = null;

    @Option(name="-regex",usage="file name pattern when the input is a directory")
    private String regex = ".*\\.conllu(\\.gz)?";

    @Option(name="-h",usage="help message")
    private boolean help = false;

    /**
     * @return the number of sentences with violations
     */
    static int verify(CoNLLUReader reader) throws IOException {
        int bad = 0;
        while (true) {
            DepTree tree;
            try {
                if ((tree = reader.nextTree()) == null)
                    break;
            } catch (ParseException e) {
                logger.severe(e.getMessage());
                ++bad;
                continue;
            }
            List<String> problems = DepTreeUtil.verify(tree);
            for (String problem : problems)
                logger.warning(problem);
            if (!problems.isEmpty())
                ++bad;
        }
        reader.close();
        return bad;
    }

    public static void main(String[] args) throws Exception {

        VerifyTrees options = new VerifyTrees();
        CmdLineParser cmdParser = new CmdLineParser(options);

        try {
            cmdParser.parseArgument(args);
        } catch (CmdLineException e) {
            System.err.println("invalid options:"+e);
            cmdParser.printUsage(System.err);
            System.exit(0);
        }
        if (options.help || options.input == null) {
            cmdParser.printUsage(System.err);
            System.exit(0);
        }

        int bad = 0;
        for (String fName : FileUtil.getFiles(options.input, options.regex, true)) {
            logger.info("Processing "+fName);
            bad += verify(new CoNLLUReader(fName));
        }
        logger.info(bad+" sentence(s) with violations");
    }
}
