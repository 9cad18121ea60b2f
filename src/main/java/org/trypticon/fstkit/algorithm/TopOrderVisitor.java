package org.trypticon.fstkit.algorithm;

import org.trypticon.fstkit.Arc;
import org.trypticon.fstkit.Fst;
import org.trypticon.fstkit.Weight;

/**
 * Finds a topological order of the states, if there is one. Stops at the first back arc.
 *
 * @param <W> the weight type.
 */
public class TopOrderVisitor<W extends Weight> implements DfsVisitor<W> {

    private int[] finished;
    private int numFinished;
    private int[] order;
    private boolean acyclic;

    @Override
    public void initVisit(Fst<W> fst) {
        finished = new int[fst.numStates()];
        numFinished = 0;
        order = null;
        acyclic = true;
    }

    @Override
    public boolean initState(int state, int root) {
        return true;
    }

    @Override
    public boolean treeArc(int state, Arc<W> arc) {
        return true;
    }

    @Override
    public boolean backArc(int state, Arc<W> arc) {
        acyclic = false;
        return false;
    }

    @Override
    public boolean forwardOrCrossArc(int state, Arc<W> arc) {
        return true;
    }

    @Override
    public void finishState(int state, int parent) {
        finished[numFinished++] = state;
    }

    @Override
    public void finishVisit() {
        if (acyclic) {
            order = new int[finished.length];
            for (int i = 0; i < numFinished; i++) {
                order[finished[numFinished - 1 - i]] = i;
            }
        }
    }

    public boolean isAcyclic() {
        return acyclic;
    }

    /**
     * Gets the order found, mapping each state id to its rank.
     *
     * @return the order, or {@code null} if the FST is cyclic.
     */
    public int[] getOrder() {
        return order;
    }
}
