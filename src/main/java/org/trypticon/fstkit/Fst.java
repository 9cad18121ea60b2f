package org.trypticon.fstkit;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view of a weighted finite-state transducer. States are numbered
 * {@code 0} to {@code numStates() - 1}.
 *
 * @param <W> the weight type.
 */
public interface Fst<W extends Weight> {

    /**
     * State id meaning "no state", returned by {@link #start()} for an FST without a start state.
     */
    int NO_STATE_ID = -1;

    /**
     * The epsilon label.
     */
    int EPSILON = 0;

    /**
     * Gets the name of the implementation, as registered in the {@link FstRegistry}.
     *
     * @return the FST type name.
     */
    String fstType();

    /**
     * Gets the arc type.
     *
     * @return the arc type.
     */
    @Nonnull
    ArcType<W> arcType();

    /**
     * Gets the start state.
     *
     * @return the start state, or {@link #NO_STATE_ID}.
     */
    int start();

    /**
     * Gets the final weight of a state; the semiring zero for non-final states.
     *
     * @param state the state.
     * @return the final weight.
     */
    @Nonnull
    W finalWeight(int state);

    int numStates();

    int numArcs(int state);

    /**
     * Gets one arc leaving a state.
     *
     * @param state the state.
     * @param index the arc index, from {@code 0} to {@code numArcs(state) - 1}.
     * @return the arc.
     */
    @Nonnull
    Arc<W> arc(int state, int index);

    int numInputEpsilons(int state);

    int numOutputEpsilons(int state);

    /**
     * Gets property bits, see {@link org.trypticon.fstkit.properties.FstProperties}.
     *
     * @param mask the properties wanted.
     * @param test {@code true} to compute any requested property which is not yet known.
     * @return the stored properties restricted to {@code mask}.
     */
    long properties(long mask, boolean test);

    @Nullable
    SymbolTable inputSymbols();

    @Nullable
    SymbolTable outputSymbols();

    /**
     * Gets all arcs leaving a state, in order.
     *
     * @param state the state.
     * @return a new list of the arcs.
     */
    default List<Arc<W>> arcs(int state) {
        int numArcs = numArcs(state);
        List<Arc<W>> arcs = new ArrayList<>(numArcs);
        for (int i = 0; i < numArcs; i++) {
            arcs.add(arc(state, i));
        }
        return arcs;
    }

    /**
     * Counts arcs over all states.
     *
     * @return the total number of arcs.
     */
    default long totalArcs() {
        long total = 0;
        for (int s = 0, n = numStates(); s < n; s++) {
            total += numArcs(s);
        }
        return total;
    }
}
