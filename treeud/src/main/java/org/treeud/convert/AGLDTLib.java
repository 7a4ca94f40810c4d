package org.treeud.convert;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Relation labels of the source (AGLDT) and target (UD) annotation.
 */
public final class AGLDTLib {

    private AGLDTLib() {
    }

    // source relations
    public static final String AUXP  = "AuxP";
    public static final String AUXC  = "AuxC";
    public static final String AUXY  = "AuxY";
    public static final String AUXZ  = "AuxZ";
    public static final String COORD = "COORD";
    public static final String APOS  = "APOS";
    public static final String PNOM  = "PNOM";

    // target relations
    public static final String UD_CONJ     = "conj";
    public static final String UD_CC       = "cc";
    public static final String UD_APPOS    = "appos";
    public static final String UD_PUNCT    = "punct";
    public static final String UD_COP      = "cop";
    public static final String UD_GOESWITH = "goeswith";

    public static final String UPOS_CCONJ = "CCONJ";
    public static final String UPOS_PUNCT = "PUNCT";

    /** Dependents of an elided head, in the order they are tried for promotion. */
    public static final String[] ELLIPSIS_PROMOTION_ORDER = {
        "nsubj", "obj", "iobj", "obl", "advmod", "csubj", "xcomp", "ccomp",
        "advcl", "dislocated", "vocative", "nmod"
    };

    /** First character of the positional tags of content words. */
    public static final String CONTENT_XPOS = "apvntlm";

    public static final Set<String> CONTENT_UPOS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "NOUN", "PROPN", "PRON", "ADJ", "VERB", "AUX", "NUM", "DET")));

    /** Markers that never head a bridge phrase. */
    public static final Set<String> BRIDGE_EXCLUDED = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            AUXY, AUXZ)));

    /**
     * Returns the base label of a source relation, without the
     * coordination/apposition suffixes ({@code OBJ_CO} is {@code OBJ}).
     */
    public static String baseLabel(String label) {
        if (label == null)
            return null;
        int idx = label.indexOf('_');
        return idx < 0 ? label : label.substring(0, idx);
    }
}
