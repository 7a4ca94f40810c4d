/**
 * Copyright (c) 2007, Regents of the University of Colorado
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *
 * Redistributions of source code must retain the above copyright notice, this list of conditions and the following disclaimer.
 * Redistributions in binary form must reproduce the above copyright notice, this list of conditions and the following disclaimer in the documentation and/or other materials provided with the distribution.
 * Neither the name of the University of Colorado at Boulder nor the names of its contributors may be used to endorse or promote products derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE
 * ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT OWNER OR CONTRIBUTORS BE
 * LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR
 * CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF
 * SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS
 * INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN
 * CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE)
 * ARISING IN ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF THE
 * POSSIBILITY OF SUCH DAMAGE.
 */
package org.treeud.common.deptree;

import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;

/**
 * Reads CoNLL-U sentence blocks into dependency trees. The engine
 * annotations of the shallow conversion stage are taken from the MISC
 * column; other MISC attributes are kept as they are.
 */
public class CoNLLUReader {

    private static Logger logger = Logger.getLogger(CoNLLUReader.class.getPackage().getName());

    public static final int COLUMNS = 10;

    public static final String MISC_ORIGINAL_DEP = "original_dep";
    public static final String MISC_ORIGINAL_ORD = "original_ord";
    public static final String MISC_NODE_TYPE    = "NodeType";
    public static final String NODE_TYPE_ARTIFICIAL = "Artificial";
    public static final String MISC_TRUE = "True";

    static final Pattern SENT_ID_PATTERN = Pattern.compile("\\A#\\s*sent_id\\s*=\\s*(.*)\\z");
    static final Pattern RANGE_PATTERN = Pattern.compile("\\A(\\d+)-(\\d+)\\z");
    static final Pattern EMPTY_PATTERN = Pattern.compile("\\A(\\d+)\\.(\\d+)\\z");

    BufferedReader reader;
    String         fileName;
    int            treeCount;
    int            lineCount;
    boolean        closed;

    public CoNLLUReader(String fileName) throws IOException {
        this(new InputStreamReader(fileName.endsWith(".gz")?new GZIPInputStream(new FileInputStream(fileName)):new FileInputStream(fileName), StandardCharsets.UTF_8), fileName);
    }

    public CoNLLUReader(Reader reader) {
        this(reader, null);
    }

    public CoNLLUReader(Reader reader, String fileName) {
        this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        this.fileName = fileName == null ? "stdin" : fileName;
        treeCount = 0;
        lineCount = 0;
        closed = false;
    }

    /**
     * Returns the next tree, or null if the input is exhausted.
     * @throws ParseException if the sentence block is malformed; the
     * reader is positioned at the next block
     * @throws IOException
     */
    public DepTree nextTree() throws ParseException, IOException {
        if (closed)
            return null;

        List<String> lines = new ArrayList<String>();
        String line;
        while ((line = reader.readLine()) != null) {
            ++lineCount;
            if (line.trim().isEmpty()) {
                if (lines.isEmpty())
                    continue;
                break;
            }
            lines.add(line);
        }
        if (lines.isEmpty()) {
            logger.fine("Read "+treeCount+" trees from "+fileName+", done.");
            close();
            return null;
        }
        return parseTree(lines, treeCount++);
    }

    /**
     * Reads all remaining trees, skipping malformed ones.
     */
    public List<DepTree> readAll() throws IOException {
        List<DepTree> trees = new ArrayList<DepTree>();
        while (true) {
            try {
                DepTree tree = nextTree();
                if (tree == null)
                    break;
                trees.add(tree);
            } catch (ParseException e) {
                logger.severe(e.getMessage());
            }
        }
        return trees;
    }

    DepTree parseTree(List<String> lines, int index) throws ParseException {
        String location = fileName+", "+index;
        DepTree tree = new DepTree(null, index);

        TIntObjectMap<DepNode> nodes = new TIntObjectHashMap<DepNode>();
        nodes.put(0, tree.rootNode);
        Map<String, EmptyNode> empties = new HashMap<String, EmptyNode>();
        Map<DepNode, String[]> columnMap = new HashMap<DepNode, String[]>();
        List<DepNode> surface = new ArrayList<DepNode>();
        List<String[]> ranges = new ArrayList<String[]>();

        for (String line : lines) {
            if (line.startsWith("#")) {
                Matcher matcher = SENT_ID_PATTERN.matcher(line.trim());
                if (matcher.matches())
                    tree.sentId = matcher.group(1).trim();
                tree.comments.add(line);
                continue;
            }
            String[] cols = line.split("\t", -1);
            if (cols.length != COLUMNS)
                throw new ParseException(location+": expected "+COLUMNS+" columns, found "+cols.length+": "+line);

            if (RANGE_PATTERN.matcher(cols[0]).matches()) {
                ranges.add(cols);
                continue;
            }
            Matcher emptyMatcher = EMPTY_PATTERN.matcher(cols[0]);
            DepNode node;
            if (emptyMatcher.matches()) {
                EmptyNode empty = new EmptyNode(Integer.parseInt(emptyMatcher.group(1)), Integer.parseInt(emptyMatcher.group(2)), cols[1]);
                empties.put(empty.getId(), tree.addEmptyNode(empty));
                node = empty;
            } else {
                int ord;
                try {
                    ord = Integer.parseInt(cols[0]);
                } catch (NumberFormatException e) {
                    throw new ParseException(location+": malformed ID "+cols[0], e);
                }
                if (ord <= 0 || nodes.containsKey(ord))
                    throw new ParseException(location+": invalid or duplicate ID "+ord);
                node = new DepNode(ord, cols[1]);
                nodes.put(ord, node);
                surface.add(node);
            }
            node.lemma = value(cols[2]);
            node.upos = value(cols[3]);
            node.xpos = value(cols[4]);
            node.feats = value(cols[5]);
            node.deprel = value(cols[7]);
            readMisc(node, cols[9], location);
            columnMap.put(node, cols);
        }

        for (DepNode node : surface) {
            String[] cols = columnMap.get(node);
            int head;
            try {
                head = Integer.parseInt(cols[6]);
            } catch (NumberFormatException e) {
                throw new ParseException(location+": malformed HEAD "+cols[6]+" of node "+node.getId(), e);
            }
            DepNode governor = nodes.get(head);
            if (governor == null)
                throw new ParseException(location+": HEAD "+head+" of node "+node.getId()+" not found");
            try {
                node.setParent(governor);
            } catch (IllegalArgumentException e) {
                throw new ParseException(location+": "+e.getMessage(), e);
            }
        }

        for (Map.Entry<DepNode, String[]> entry : columnMap.entrySet())
            readDeps(entry.getKey(), entry.getValue()[8], nodes, empties, location);

        for (String[] cols : ranges) {
            Matcher matcher = RANGE_PATTERN.matcher(cols[0]);
            matcher.matches();
            DepNode first = nodes.get(Integer.parseInt(matcher.group(1)));
            DepNode last = nodes.get(Integer.parseInt(matcher.group(2)));
            if (first == null || last == null)
                throw new ParseException(location+": multiword token "+cols[0]+" spans missing nodes");
            tree.addTokenRange(new DepTree.TokenRange(first, last, cols[1], value(cols[9])));
        }

        return tree;
    }

    void readMisc(DepNode node, String misc, String location) throws ParseException {
        if (misc.equals(DepNode.NONE))
            return;
        for (String attr : misc.split("\\|")) {
            int idx = attr.indexOf('=');
            String key = idx < 0 ? attr : attr.substring(0, idx);
            String val = idx < 0 ? "" : attr.substring(idx + 1);

            if (key.equals(MISC_ORIGINAL_DEP))
                node.originalDeprel = val;
            else if (key.equals(MISC_ORIGINAL_ORD)) {
                try {
                    node.originalOrd = Integer.parseInt(val);
                } catch (NumberFormatException e) {
                    throw new ParseException(location+": malformed "+MISC_ORIGINAL_ORD+" "+val, e);
                }
            } else if (key.equals(MISC_NODE_TYPE) && val.equals(NODE_TYPE_ARTIFICIAL))
                node.synthetic = true;
            else if (key.equals(Membership.COORDINATION.getMiscKey())) {
                if (val.equals(MISC_TRUE)) node.memberships.add(Membership.COORDINATION);
            } else if (key.equals(Membership.APPOSITION.getMiscKey())) {
                if (val.equals(MISC_TRUE)) node.memberships.add(Membership.APPOSITION);
            } else
                node.misc.put(key, val);
        }
    }

    void readDeps(DepNode node, String deps, TIntObjectMap<DepNode> nodes, Map<String, EmptyNode> empties, String location) throws ParseException {
        if (deps.equals(DepNode.NONE))
            return;
        for (String dep : deps.split("\\|")) {
            int idx = dep.indexOf(':');
            if (idx <= 0)
                throw new ParseException(location+": malformed DEPS "+deps+" of node "+node.getId());
            String headId = dep.substring(0, idx);
            String relation = dep.substring(idx + 1);
            DepNode governor;
            if (headId.indexOf('.') >= 0)
                governor = empties.get(headId);
            else
                try {
                    governor = nodes.get(Integer.parseInt(headId));
                } catch (NumberFormatException e) {
                    throw new ParseException(location+": malformed DEPS head "+headId, e);
                }
            if (governor == null)
                throw new ParseException(location+": DEPS head "+headId+" of node "+node.getId()+" not found");
            if (governor == node.parent && relation.equals(node.deprel))
                continue;
            node.addSecondaryEdge(governor, relation);
        }
    }

    static String value(String col) {
        return col.equals(DepNode.NONE) ? null : col;
    }

    public void close() {
        if (!closed) {
            try {
                reader.close();
            } catch (IOException e) {
                logger.warning(fileName+": "+e.getMessage());
            }
            closed = true;
        }
    }

    public boolean isOpen() {
        return !closed;
    }
}
