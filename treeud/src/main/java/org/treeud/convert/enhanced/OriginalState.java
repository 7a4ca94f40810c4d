package org.treeud.convert.enhanced;

import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.treeud.common.deptree.DepNode;
import org.treeud.common.deptree.DepTree;

/**
 * Governance of a tree as it was before any rewriting: for every surface
 * node its ordinal, its governor's ordinal and its relations.
 */
public final class OriginalState {

    public static final class Entry {
        final int ord;
        final int governorOrd;
        final String relation;
        final String originalRelation;
        final boolean synthetic;

        Entry(int ord, int governorOrd, String relation, String originalRelation, boolean synthetic) {
            this.ord = ord;
            this.governorOrd = governorOrd;
            this.relation = relation;
            this.originalRelation = originalRelation;
            this.synthetic = synthetic;
        }

        public int getOrd() {
            return ord;
        }

        public int getGovernorOrd() {
            return governorOrd;
        }

        /** universal relation at the time of the snapshot */
        public String getRelation() {
            return relation;
        }

        /** source treebank relation */
        public String getOriginalRelation() {
            return originalRelation;
        }

        public boolean isSynthetic() {
            return synthetic;
        }

        @Override
        public String toString() {
            return governorOrd+"-"+relation+"->"+ord;
        }
    }

    final String sentId;
    final TIntObjectMap<Entry> entries;
    final int[] ords;

    private OriginalState(String sentId, TIntObjectMap<Entry> entries) {
        this.sentId = sentId;
        this.entries = entries;
        this.ords = entries.keys();
        Arrays.sort(ords);
    }

    public static OriginalState capture(DepTree tree) {
        TIntObjectMap<Entry> entries = new TIntObjectHashMap<Entry>();
        for (DepNode node : tree.getNodes())
            entries.put(node.getOrd(), new Entry(node.getOrd(), node.getParent().getOrd(),
                    node.getDeprel(), node.getOriginalDeprel(), node.isSynthetic()));
        return new OriginalState(tree.getSentId(), entries);
    }

    public String getSentId() {
        return sentId;
    }

    /** Returns the entry recorded for the ordinal, or null. */
    public Entry get(int ord) {
        return entries.get(ord);
    }

    public boolean contains(int ord) {
        return entries.containsKey(ord);
    }

    public int size() {
        return ords.length;
    }

    /**
     * Returns the entries originally governed by the ordinal, in linear order.
     */
    public List<Entry> getDependents(int governorOrd) {
        List<Entry> dependents = new ArrayList<Entry>();
        for (int ord : ords) {
            Entry entry = entries.get(ord);
            if (entry.governorOrd == governorOrd)
                dependents.add(entry);
        }
        return Collections.unmodifiableList(dependents);
    }
}
