package org.trypticon.fstkit.algorithm;

import org.trypticon.fstkit.Arc;
import org.trypticon.fstkit.Fst;
import org.trypticon.fstkit.MutableFst;
import org.trypticon.fstkit.Weight;
import org.trypticon.fstkit.properties.FstProperties;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * Renumbers the states of a mutable FST.
 */
public final class StateSort {
    private StateSort() {} // no instance

    /**
     * Renumbers states so that old state {@code s} becomes state {@code order[s]}.
     * Arc contents are unchanged apart from their destinations, which follow the
     * new numbering. Properties that do not depend on state ids are kept.
     *
     * @param fst the FST.
     * @param order a permutation of {@code 0..numStates-1}.
     * @param <W> the weight type.
     * @throws IllegalArgumentException if {@code order} is not a permutation of the state ids.
     */
    public static <W extends Weight> void stateSort(@Nonnull MutableFst<W> fst, @Nonnull int[] order) {
        int numStates = fst.numStates();
        checkPermutation(order, numStates);

        long props = fst.properties(FstProperties.FST_PROPERTIES, false);
        int start = fst.start();

        List<W> finals = new ArrayList<>(numStates);
        List<List<Arc<W>>> arcs = new ArrayList<>(numStates);
        for (int s = 0; s < numStates; s++) {
            finals.add(null);
            arcs.add(null);
        }
        for (int s = 0; s < numStates; s++) {
            finals.set(order[s], fst.finalWeight(s));
            List<Arc<W>> remapped = new ArrayList<>(fst.numArcs(s));
            for (Arc<W> arc : fst.arcs(s)) {
                remapped.add(arc.withNextState(order[arc.nextState()]));
            }
            arcs.set(order[s], remapped);
        }

        fst.deleteStates();
        for (int s = 0; s < numStates; s++) {
            fst.addState();
        }
        for (int s = 0; s < numStates; s++) {
            fst.setFinal(s, finals.get(s));
            for (Arc<W> arc : arcs.get(s)) {
                fst.addArc(s, arc);
            }
        }
        if (start != Fst.NO_STATE_ID) {
            fst.setStart(order[start]);
        }
        fst.setProperties(FstProperties.stateSortProperties(props), FstProperties.TRINARY_PROPERTIES);
    }

    private static void checkPermutation(int[] order, int numStates) {
        if (order.length != numStates) {
            throw new IllegalArgumentException("Order has " + order.length + " entries for " +
                    numStates + " states");
        }
        boolean[] seen = new boolean[numStates];
        for (int target : order) {
            if (target < 0 || target >= numStates || seen[target]) {
                throw new IllegalArgumentException("Order is not a permutation of the state IDs");
            }
            seen[target] = true;
        }
    }
}
