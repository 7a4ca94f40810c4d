package org.treeud.common.deptree;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Writes dependency trees as CoNLL-U sentence blocks.
 */
public class CoNLLUWriter {

    Writer  writer;
    boolean withDeps;

    /**
     * @param writer output
     * @param withDeps whether to fill the DEPS column from the primary and
     * secondary edges; otherwise DEPS is left empty
     */
    public CoNLLUWriter(Writer writer, boolean withDeps) {
        this.writer = writer;
        this.withDeps = withDeps;
    }

    public void write(DepTree tree) throws IOException {
        writer.write(toString(tree, withDeps));
    }

    public void flush() throws IOException {
        writer.flush();
    }

    public void close() throws IOException {
        writer.close();
    }

    public static String toString(DepTree tree, boolean withDeps) {
        StringBuilder buffer = new StringBuilder();
        for (String comment : tree.comments)
            buffer.append(comment).append('\n');

        List<EmptyNode> empties = tree.emptyNodes;
        int e = 0;
        while (e < empties.size() && empties.get(e).ord == 0)
            appendLine(buffer, empties.get(e++), withDeps);

        for (DepNode node : tree.getNodes()) {
            for (DepTree.TokenRange range : tree.tokenRanges)
                if (range.first == node) {
                    buffer.append(range.first.getId()).append('-').append(range.last.getId()).append('\t');
                    buffer.append(range.form);
                    for (int i = 0; i < 7; ++i)
                        buffer.append("\t_");
                    buffer.append('\t').append(range.misc == null ? DepNode.NONE : range.misc).append('\n');
                }
            appendLine(buffer, node, withDeps);
            while (e < empties.size() && empties.get(e).ord == node.ord)
                appendLine(buffer, empties.get(e++), withDeps);
        }
        while (e < empties.size())
            appendLine(buffer, empties.get(e++), withDeps);

        buffer.append('\n');
        return buffer.toString();
    }

    static void appendLine(StringBuilder buffer, DepNode node, boolean withDeps) {
        String[] cols = new String[CoNLLUReader.COLUMNS];
        cols[0] = node.getId();
        cols[1] = column(node.form);
        cols[2] = column(node.lemma);
        cols[3] = column(node.upos);
        cols[4] = column(node.xpos);
        cols[5] = column(node.feats);
        if (node.isEmpty()) {
            cols[6] = DepNode.NONE;
            cols[7] = DepNode.NONE;
        } else {
            cols[6] = Integer.toString(node.parent.ord);
            cols[7] = column(node.deprel);
        }
        cols[8] = withDeps ? depsColumn(node) : DepNode.NONE;
        cols[9] = miscColumn(node);

        for (int i = 0; i < cols.length; ++i) {
            if (i > 0)
                buffer.append('\t');
            buffer.append(cols[i]);
        }
        buffer.append('\n');
    }

    static String depsColumn(DepNode node) {
        List<SecondaryEdge> edges = new ArrayList<SecondaryEdge>();
        if (!node.isEmpty())
            edges.add(new SecondaryEdge(node.parent, column(node.deprel)));
        for (SecondaryEdge edge : node.secondaryEdges)
            if (!edges.contains(edge))
                edges.add(edge);
        if (edges.isEmpty())
            return DepNode.NONE;
        Collections.sort(edges, new Comparator<SecondaryEdge>() {
            @Override
            public int compare(SecondaryEdge lhs, SecondaryEdge rhs) {
                if (lhs.governor == rhs.governor)
                    return lhs.relation.compareTo(rhs.relation);
                return lhs.governor.precedes(rhs.governor) ? -1 : 1;
            }
        });
        StringBuilder str = new StringBuilder();
        for (SecondaryEdge edge : edges) {
            if (str.length() > 0)
                str.append('|');
            str.append(edge.toString());
        }
        return str.toString();
    }

    static String miscColumn(DepNode node) {
        List<String> attrs = new ArrayList<String>();
        if (node.originalDeprel != null)
            attrs.add(CoNLLUReader.MISC_ORIGINAL_DEP+"="+node.originalDeprel);
        if (node.synthetic)
            attrs.add(CoNLLUReader.MISC_NODE_TYPE+"="+CoNLLUReader.NODE_TYPE_ARTIFICIAL);
        for (Membership membership : node.memberships)
            attrs.add(membership.getMiscKey()+"="+CoNLLUReader.MISC_TRUE);
        if (node.originalOrd >= 0)
            attrs.add(CoNLLUReader.MISC_ORIGINAL_ORD+"="+node.originalOrd);
        for (Map.Entry<String, String> entry : node.misc.entrySet())
            attrs.add(entry.getValue().isEmpty() ? entry.getKey() : entry.getKey()+"="+entry.getValue());
        if (attrs.isEmpty())
            return DepNode.NONE;
        StringBuilder str = new StringBuilder();
        for (String attr : attrs) {
            if (str.length() > 0)
                str.append('|');
            str.append(attr);
        }
        return str.toString();
    }

    static String column(String value) {
        return value == null || value.isEmpty() ? DepNode.NONE : value;
    }
}
