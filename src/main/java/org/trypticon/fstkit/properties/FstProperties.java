package org.trypticon.fstkit.properties;

import org.trypticon.fstkit.Arc;
import org.trypticon.fstkit.Fst;
import org.trypticon.fstkit.Weight;
import org.trypticon.fstkit.algorithm.DfsVisit;
import org.trypticon.fstkit.algorithm.SccVisitor;

import java.util.HashSet;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Structural property bits of an FST and the rules for computing and
 * invalidating them.
 * <p>
 * Binary properties are always known. Trinary properties come in pairs, a
 * positive bit and the negative bit right above it; a trinary property is
 * known when either bit of its pair is set, and both are never set together.
 */
public final class FstProperties {
    private FstProperties() {} // no instance

    // Binary properties.

    /** The FST knows its number of states. */
    public static final long EXPANDED = 0x0000000000000001L;

    /** The FST can be changed in place. */
    public static final long MUTABLE = 0x0000000000000002L;

    /** An error was encountered building or reading the FST. */
    public static final long ERROR = 0x0000000000000004L;

    // Trinary properties.

    /** Input label equals output label on every arc. */
    public static final long ACCEPTOR = 0x0000000000010000L;
    public static final long NOT_ACCEPTOR = 0x0000000000020000L;

    /** No two arcs leaving a state share an input label. */
    public static final long I_DETERMINISTIC = 0x0000000000040000L;
    public static final long NON_I_DETERMINISTIC = 0x0000000000080000L;

    /** No two arcs leaving a state share an output label. */
    public static final long O_DETERMINISTIC = 0x0000000000100000L;
    public static final long NON_O_DETERMINISTIC = 0x0000000000200000L;

    /** Some arc has epsilon on both sides. */
    public static final long EPSILONS = 0x0000000000400000L;
    public static final long NO_EPSILONS = 0x0000000000800000L;

    /** Some arc has an input epsilon. */
    public static final long I_EPSILONS = 0x0000000001000000L;
    public static final long NO_I_EPSILONS = 0x0000000002000000L;

    /** Some arc has an output epsilon. */
    public static final long O_EPSILONS = 0x0000000004000000L;
    public static final long NO_O_EPSILONS = 0x0000000008000000L;

    /** Arcs leaving each state are sorted by input label. */
    public static final long I_LABEL_SORTED = 0x0000000010000000L;
    public static final long NOT_I_LABEL_SORTED = 0x0000000020000000L;

    /** Arcs leaving each state are sorted by output label. */
    public static final long O_LABEL_SORTED = 0x0000000040000000L;
    public static final long NOT_O_LABEL_SORTED = 0x0000000080000000L;

    /** Some arc or final weight is neither zero nor one. */
    public static final long WEIGHTED = 0x0000000100000000L;
    public static final long UNWEIGHTED = 0x0000000200000000L;

    /** Some cycle exists. */
    public static final long CYCLIC = 0x0000000400000000L;
    public static final long ACYCLIC = 0x0000000800000000L;

    /** Some cycle passes through the start state. */
    public static final long INITIAL_CYCLIC = 0x0000001000000000L;
    public static final long INITIAL_ACYCLIC = 0x0000002000000000L;

    /** Every arc goes from a lower state id to a higher one. */
    public static final long TOP_SORTED = 0x0000004000000000L;
    public static final long NOT_TOP_SORTED = 0x0000008000000000L;

    /** Every state is reachable from the start state. */
    public static final long ACCESSIBLE = 0x0000010000000000L;
    public static final long NOT_ACCESSIBLE = 0x0000020000000000L;

    /** Every state can reach a final state. */
    public static final long CO_ACCESSIBLE = 0x0000040000000000L;
    public static final long NOT_CO_ACCESSIBLE = 0x0000080000000000L;

    /** The FST is a single path numbered 0, 1, 2, ... */
    public static final long STRING = 0x0000100000000000L;
    public static final long NOT_STRING = 0x0000200000000000L;

    public static final long BINARY_PROPERTIES = EXPANDED | MUTABLE | ERROR;

    public static final long POS_TRINARY_PROPERTIES = ACCEPTOR | I_DETERMINISTIC | O_DETERMINISTIC | EPSILONS
            | I_EPSILONS | O_EPSILONS | I_LABEL_SORTED | O_LABEL_SORTED | WEIGHTED | CYCLIC | INITIAL_CYCLIC
            | TOP_SORTED | ACCESSIBLE | CO_ACCESSIBLE | STRING;

    public static final long NEG_TRINARY_PROPERTIES = POS_TRINARY_PROPERTIES << 1;

    public static final long TRINARY_PROPERTIES = POS_TRINARY_PROPERTIES | NEG_TRINARY_PROPERTIES;

    public static final long FST_PROPERTIES = BINARY_PROPERTIES | TRINARY_PROPERTIES;

    /** Properties decided by a depth-first traversal rather than a scan of arcs. */
    public static final long DFS_PROPERTIES = CYCLIC | ACYCLIC | INITIAL_CYCLIC | INITIAL_ACYCLIC
            | ACCESSIBLE | NOT_ACCESSIBLE | CO_ACCESSIBLE | NOT_CO_ACCESSIBLE;

    // Bits which stay true under each kind of mutation. Everything else is cleared.

    private static final long SET_START_PROPERTIES = BINARY_PROPERTIES | ACCEPTOR | NOT_ACCEPTOR
            | I_DETERMINISTIC | NON_I_DETERMINISTIC | O_DETERMINISTIC | NON_O_DETERMINISTIC
            | EPSILONS | NO_EPSILONS | I_EPSILONS | NO_I_EPSILONS | O_EPSILONS | NO_O_EPSILONS
            | I_LABEL_SORTED | NOT_I_LABEL_SORTED | O_LABEL_SORTED | NOT_O_LABEL_SORTED
            | WEIGHTED | UNWEIGHTED | CYCLIC | ACYCLIC | TOP_SORTED | NOT_TOP_SORTED
            | CO_ACCESSIBLE | NOT_CO_ACCESSIBLE;

    private static final long SET_FINAL_PROPERTIES = BINARY_PROPERTIES | ACCEPTOR | NOT_ACCEPTOR
            | I_DETERMINISTIC | NON_I_DETERMINISTIC | O_DETERMINISTIC | NON_O_DETERMINISTIC
            | EPSILONS | NO_EPSILONS | I_EPSILONS | NO_I_EPSILONS | O_EPSILONS | NO_O_EPSILONS
            | I_LABEL_SORTED | NOT_I_LABEL_SORTED | O_LABEL_SORTED | NOT_O_LABEL_SORTED
            | CYCLIC | ACYCLIC | INITIAL_CYCLIC | INITIAL_ACYCLIC | TOP_SORTED | NOT_TOP_SORTED
            | ACCESSIBLE | NOT_ACCESSIBLE;

    private static final long ADD_STATE_PROPERTIES = BINARY_PROPERTIES | ACCEPTOR | NOT_ACCEPTOR
            | I_DETERMINISTIC | NON_I_DETERMINISTIC | O_DETERMINISTIC | NON_O_DETERMINISTIC
            | EPSILONS | NO_EPSILONS | I_EPSILONS | NO_I_EPSILONS | O_EPSILONS | NO_O_EPSILONS
            | I_LABEL_SORTED | NOT_I_LABEL_SORTED | O_LABEL_SORTED | NOT_O_LABEL_SORTED
            | WEIGHTED | UNWEIGHTED | CYCLIC | ACYCLIC | INITIAL_CYCLIC | INITIAL_ACYCLIC
            | TOP_SORTED | NOT_TOP_SORTED | NOT_ACCESSIBLE | NOT_CO_ACCESSIBLE;

    // Adding an arc can only make these facts "more true".
    private static final long ADD_ARC_PROPERTIES = BINARY_PROPERTIES | NOT_ACCEPTOR
            | NON_I_DETERMINISTIC | NON_O_DETERMINISTIC | EPSILONS | I_EPSILONS | O_EPSILONS
            | NOT_I_LABEL_SORTED | NOT_O_LABEL_SORTED | WEIGHTED | CYCLIC | INITIAL_CYCLIC
            | NOT_TOP_SORTED | ACCESSIBLE | CO_ACCESSIBLE;

    // Removing states or arcs can only make these facts "more true".
    private static final long DELETE_PROPERTIES = BINARY_PROPERTIES | ACCEPTOR | I_DETERMINISTIC
            | O_DETERMINISTIC | NO_EPSILONS | NO_I_EPSILONS | NO_O_EPSILONS | I_LABEL_SORTED
            | O_LABEL_SORTED | UNWEIGHTED | ACYCLIC | INITIAL_ACYCLIC | TOP_SORTED;

    private static final long STATE_SORT_PROPERTIES = BINARY_PROPERTIES | ACCEPTOR | NOT_ACCEPTOR
            | I_DETERMINISTIC | NON_I_DETERMINISTIC | O_DETERMINISTIC | NON_O_DETERMINISTIC
            | EPSILONS | NO_EPSILONS | I_EPSILONS | NO_I_EPSILONS | O_EPSILONS | NO_O_EPSILONS
            | I_LABEL_SORTED | NOT_I_LABEL_SORTED | O_LABEL_SORTED | NOT_O_LABEL_SORTED
            | WEIGHTED | UNWEIGHTED | CYCLIC | ACYCLIC | INITIAL_CYCLIC | INITIAL_ACYCLIC
            | ACCESSIBLE | NOT_ACCESSIBLE | CO_ACCESSIBLE | NOT_CO_ACCESSIBLE;

    /** Properties of an FST with no states at all. */
    public static final long NULL_PROPERTIES = ACCEPTOR | I_DETERMINISTIC | O_DETERMINISTIC | NO_EPSILONS
            | NO_I_EPSILONS | NO_O_EPSILONS | I_LABEL_SORTED | O_LABEL_SORTED | UNWEIGHTED | ACYCLIC
            | INITIAL_ACYCLIC | TOP_SORTED | ACCESSIBLE | CO_ACCESSIBLE | STRING;

    private static final String[] NAMES = {
            "expanded", "mutable", "error", "", "", "", "", "",
            "", "", "", "", "", "", "", "",
            "acceptor", "not acceptor",
            "input deterministic", "non input deterministic",
            "output deterministic", "non output deterministic",
            "input/output epsilons", "no input/output epsilons",
            "input epsilons", "no input epsilons",
            "output epsilons", "no output epsilons",
            "input label sorted", "not input label sorted",
            "output label sorted", "not output label sorted",
            "weighted", "unweighted",
            "cyclic", "acyclic",
            "cyclic at initial state", "acyclic at initial state",
            "top sorted", "not top sorted",
            "accessible", "not accessible",
            "coaccessible", "not coaccessible",
            "string", "not string",
    };

    /**
     * Gets the bits whose values are known, given a set of properties.
     *
     * @param props the properties.
     * @return the known bits.
     */
    public static long knownProperties(long props) {
        return BINARY_PROPERTIES | (props & TRINARY_PROPERTIES)
                | ((props & POS_TRINARY_PROPERTIES) << 1)
                | ((props & NEG_TRINARY_PROPERTIES) >>> 1);
    }

    /**
     * Tests whether two property sets agree on every bit known to both.
     *
     * @param props1 the first set.
     * @param props2 the second set.
     * @return {@code true} if compatible.
     */
    public static boolean compatProperties(long props1, long props2) {
        long known = knownProperties(props1) & knownProperties(props2);
        return ((props1 ^ props2) & known) == 0;
    }

    /**
     * Finds the known bits on which two property sets disagree.
     *
     * @param props1 the first set.
     * @param props2 the second set.
     * @return the disagreeing bits.
     */
    public static long incompatibleProperties(long props1, long props2) {
        long known = knownProperties(props1) & knownProperties(props2);
        return (props1 ^ props2) & known;
    }

    public static long setStartProperties(long props) {
        long out = props & SET_START_PROPERTIES;
        if ((props & ACYCLIC) != 0) {
            out |= INITIAL_ACYCLIC;
        }
        return out;
    }

    public static long setFinalProperties(long props) {
        return props & SET_FINAL_PROPERTIES;
    }

    public static long addStateProperties(long props) {
        return props & ADD_STATE_PROPERTIES;
    }

    /**
     * Updates properties for one added arc.
     *
     * @param props the properties before the arc was added.
     * @param arc the new arc.
     * @param state the state the arc leaves.
     * @param one the semiring one.
     * @param zero the semiring zero.
     * @param <W> the weight type.
     * @return the properties after.
     */
    public static <W extends Weight> long addArcProperties(long props, int state, Arc<W> arc, W one, W zero) {
        long out = props & ADD_ARC_PROPERTIES;
        if (arc.ilabel() != arc.olabel()) {
            out |= NOT_ACCEPTOR;
        }
        if (arc.ilabel() == 0) {
            out |= I_EPSILONS;
            if (arc.olabel() == 0) {
                out |= EPSILONS;
            }
        }
        if (arc.olabel() == 0) {
            out |= O_EPSILONS;
        }
        if (!arc.weight().equals(one) && !arc.weight().equals(zero)) {
            out |= WEIGHTED;
        }
        if (arc.nextState() <= state) {
            out |= NOT_TOP_SORTED;
        }
        if (arc.nextState() == state) {
            out |= CYCLIC;
        }
        return out;
    }

    public static long deleteStatesProperties(long props) {
        return props & DELETE_PROPERTIES;
    }

    public static long deleteAllStatesProperties(long props) {
        return (props & BINARY_PROPERTIES) | NULL_PROPERTIES;
    }

    public static long deleteArcsProperties(long props) {
        return props & DELETE_PROPERTIES;
    }

    public static long stateSortProperties(long props) {
        return props & STATE_SORT_PROPERTIES;
    }

    /**
     * Computes every trinary property of an FST from scratch. This is a full scan
     * of the states and arcs plus a depth-first traversal.
     *
     * @param fst the FST.
     * @param binary the binary properties to carry over.
     * @param <W> the weight type.
     * @return the properties, with every trinary pair known.
     */
    public static <W extends Weight> long compute(Fst<W> fst, long binary) {
        W one = fst.arcType().one();
        W zero = fst.arcType().zero();
        long props = (binary & BINARY_PROPERTIES) | ACCEPTOR | I_DETERMINISTIC | O_DETERMINISTIC
                | NO_EPSILONS | NO_I_EPSILONS | NO_O_EPSILONS | I_LABEL_SORTED | O_LABEL_SORTED
                | UNWEIGHTED | TOP_SORTED | STRING;

        SccVisitor<W> scc = new SccVisitor<>();
        DfsVisit.visit(fst, scc, false);
        props |= scc.getProperties();

        int start = fst.start();
        if (start != Fst.NO_STATE_ID && start != 0) {
            props = set(props, NOT_STRING, STRING);
        }
        int numFinal = 0;
        Set<Integer> ilabels = new HashSet<>();
        Set<Integer> olabels = new HashSet<>();
        for (int s = 0, n = fst.numStates(); s < n; s++) {
            ilabels.clear();
            olabels.clear();
            Arc<W> previous = null;
            int numArcs = fst.numArcs(s);
            for (int i = 0; i < numArcs; i++) {
                Arc<W> arc = fst.arc(s, i);
                if (!ilabels.add(arc.ilabel())) {
                    props = set(props, NON_I_DETERMINISTIC, I_DETERMINISTIC);
                }
                if (!olabels.add(arc.olabel())) {
                    props = set(props, NON_O_DETERMINISTIC, O_DETERMINISTIC);
                }
                if (arc.ilabel() != arc.olabel()) {
                    props = set(props, NOT_ACCEPTOR, ACCEPTOR);
                }
                if (arc.ilabel() == 0 && arc.olabel() == 0) {
                    props = set(props, EPSILONS, NO_EPSILONS);
                }
                if (arc.ilabel() == 0) {
                    props = set(props, I_EPSILONS, NO_I_EPSILONS);
                }
                if (arc.olabel() == 0) {
                    props = set(props, O_EPSILONS, NO_O_EPSILONS);
                }
                if (previous != null) {
                    if (arc.ilabel() < previous.ilabel()) {
                        props = set(props, NOT_I_LABEL_SORTED, I_LABEL_SORTED);
                    }
                    if (arc.olabel() < previous.olabel()) {
                        props = set(props, NOT_O_LABEL_SORTED, O_LABEL_SORTED);
                    }
                }
                if (!arc.weight().equals(one) && !arc.weight().equals(zero)) {
                    props = set(props, WEIGHTED, UNWEIGHTED);
                }
                if (arc.nextState() <= s) {
                    props = set(props, NOT_TOP_SORTED, TOP_SORTED);
                }
                if (arc.nextState() != s + 1) {
                    props = set(props, NOT_STRING, STRING);
                }
                previous = arc;
            }
            W finalWeight = fst.finalWeight(s);
            if (!finalWeight.equals(zero)) {
                if (!finalWeight.equals(one)) {
                    props = set(props, WEIGHTED, UNWEIGHTED);
                }
                numFinal++;
            } else if (numArcs != 1) {
                props = set(props, NOT_STRING, STRING);
            }
        }
        if (numFinal > 1) {
            props = set(props, NOT_STRING, STRING);
        }
        return props;
    }

    private static long set(long props, long value, long opposite) {
        return (props | value) & ~opposite;
    }

    /**
     * Renders the set bits of a property set by name.
     *
     * @param props the properties.
     * @return the names, comma separated.
     */
    public static String toString(long props) {
        StringJoiner joiner = new StringJoiner(", ");
        for (int bit = 0; bit < NAMES.length; bit++) {
            if ((props & (1L << bit)) != 0 && !NAMES[bit].isEmpty()) {
                joiner.add(NAMES[bit]);
            }
        }
        return joiner.toString();
    }
}
