package org.trypticon.fstkit.algorithm;

import org.trypticon.fstkit.Arc;
import org.trypticon.fstkit.Fst;
import org.trypticon.fstkit.Weight;

import javax.annotation.Nonnull;

/**
 * Iterative depth-first traversal of an FST, classifying every arc it meets.
 */
public final class DfsVisit {
    private DfsVisit() {} // no instance

    private static final byte WHITE = 0; // undiscovered
    private static final byte GREY = 1;  // on the stack
    private static final byte BLACK = 2; // finished

    /**
     * Visits the FST. The search starts at the start state; unless {@code accessOnly}
     * is set, it then restarts from each undiscovered state in id order.
     *
     * @param fst the FST.
     * @param visitor the visitor.
     * @param accessOnly {@code true} to visit only states reachable from the start state.
     * @param <W> the weight type.
     */
    public static <W extends Weight> void visit(@Nonnull Fst<W> fst, @Nonnull DfsVisitor<W> visitor,
                                                boolean accessOnly) {
        visitor.initVisit(fst);
        int numStates = fst.numStates();
        int start = fst.start();
        if (numStates == 0 || (start == Fst.NO_STATE_ID && accessOnly)) {
            visitor.finishVisit();
            return;
        }

        byte[] color = new byte[numStates];
        int[] stateStack = new int[numStates];
        int[] arcStack = new int[numStates];

        boolean dfs = true;
        int root = start != Fst.NO_STATE_ID ? start : 0;
        int nextRoot = 0;
        while (true) {
            int depth = 0;
            color[root] = GREY;
            stateStack[depth] = root;
            arcStack[depth] = 0;
            depth++;
            dfs = visitor.initState(root, root);

            while (depth > 0) {
                int state = stateStack[depth - 1];
                int arcIndex = arcStack[depth - 1];
                if (!dfs || arcIndex >= fst.numArcs(state)) {
                    color[state] = BLACK;
                    depth--;
                    int parent = depth > 0 ? stateStack[depth - 1] : Fst.NO_STATE_ID;
                    visitor.finishState(state, parent);
                    if (depth > 0) {
                        arcStack[depth - 1]++;
                    }
                    continue;
                }
                Arc<W> arc = fst.arc(state, arcIndex);
                int next = arc.nextState();
                if (color[next] == WHITE) {
                    dfs = visitor.treeArc(state, arc);
                    if (dfs) {
                        color[next] = GREY;
                        stateStack[depth] = next;
                        arcStack[depth] = 0;
                        depth++;
                        dfs = visitor.initState(next, root);
                    }
                } else {
                    dfs = color[next] == GREY ? visitor.backArc(state, arc) : visitor.forwardOrCrossArc(state, arc);
                    arcStack[depth - 1]++;
                }
            }

            if (!dfs || accessOnly) {
                break;
            }
            while (nextRoot < numStates && color[nextRoot] != WHITE) {
                nextRoot++;
            }
            if (nextRoot == numStates) {
                break;
            }
            root = nextRoot;
        }
        visitor.finishVisit();
    }
}
