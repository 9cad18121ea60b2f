package org.trypticon.fstkit.algorithm;

import org.trypticon.fstkit.Arc;
import org.trypticon.fstkit.Fst;
import org.trypticon.fstkit.InfoStream;
import org.trypticon.fstkit.Weight;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Sanity checks an FST: the start state and every arc destination must exist,
 * labels must be non-negative and every weight must be a member of its semiring.
 */
public final class Verify {
    private Verify() {} // no instance

    private static final String COMPONENT = "Verify";

    /**
     * Verifies an FST, reporting the first problem found if the info stream has
     * {@code Verify} messages enabled.
     *
     * @param fst the FST.
     * @param infoStream where to report a problem.
     * @param <W> the weight type.
     * @return {@code true} if the FST is sane.
     */
    public static <W extends Weight> boolean verify(@Nonnull Fst<W> fst, @Nonnull InfoStream infoStream) {
        String problem = findProblem(fst);
        if (problem == null) {
            return true;
        }
        if (infoStream.isEnabled(COMPONENT)) {
            infoStream.message(COMPONENT, problem);
        }
        return false;
    }

    /**
     * Finds the first problem with an FST.
     *
     * @param fst the FST.
     * @param <W> the weight type.
     * @return a description of the problem. Returns {@code null} if the FST is sane.
     */
    @Nullable
    public static <W extends Weight> String findProblem(@Nonnull Fst<W> fst) {
        int numStates = fst.numStates();
        int start = fst.start();
        if (start != Fst.NO_STATE_ID && (start < 0 || start >= numStates)) {
            return "FST start state ID exceeds number of states";
        }
        for (int s = 0; s < numStates; s++) {
            int numArcs = fst.numArcs(s);
            int numInputEpsilons = 0;
            int numOutputEpsilons = 0;
            for (int i = 0; i < numArcs; i++) {
                Arc<W> arc = fst.arc(s, i);
                if (arc.ilabel() < 0) {
                    return "FST input label ID of arc at position " + i + " of state " + s + " is negative";
                }
                if (arc.olabel() < 0) {
                    return "FST output label ID of arc at position " + i + " of state " + s + " is negative";
                }
                if (!arc.weight().isMember()) {
                    return "FST weight of arc at position " + i + " of state " + s + " is invalid";
                }
                if (arc.nextState() < 0 || arc.nextState() >= numStates) {
                    return "FST destination state ID of arc at position " + i + " of state " + s +
                            " exceeds number of states";
                }
                if (arc.ilabel() == Fst.EPSILON) {
                    numInputEpsilons++;
                }
                if (arc.olabel() == Fst.EPSILON) {
                    numOutputEpsilons++;
                }
            }
            if (!fst.finalWeight(s).isMember()) {
                return "FST final weight of state " + s + " is invalid";
            }
            if (numInputEpsilons != fst.numInputEpsilons(s)) {
                return "FST input epsilon count of state " + s + " is incorrect";
            }
            if (numOutputEpsilons != fst.numOutputEpsilons(s)) {
                return "FST output epsilon count of state " + s + " is incorrect";
            }
        }
        return null;
    }
}
