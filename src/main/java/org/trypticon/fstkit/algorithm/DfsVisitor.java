package org.trypticon.fstkit.algorithm;

import org.trypticon.fstkit.Arc;
import org.trypticon.fstkit.Fst;
import org.trypticon.fstkit.Weight;

/**
 * Callbacks for {@link DfsVisit}. Any callback returning {@code false} stops the
 * search; states already entered are still finished.
 *
 * @param <W> the weight type.
 */
public interface DfsVisitor<W extends Weight> {

    void initVisit(Fst<W> fst);

    /**
     * Called when a state is first discovered.
     *
     * @param state the state.
     * @param root the root of the current search tree.
     * @return {@code true} to continue.
     */
    boolean initState(int state, int root);

    /**
     * Called for an arc to an undiscovered state.
     */
    boolean treeArc(int state, Arc<W> arc);

    /**
     * Called for an arc to a state which is still on the stack, i.e. an arc closing a cycle.
     */
    boolean backArc(int state, Arc<W> arc);

    /**
     * Called for an arc to a state which has already been finished.
     */
    boolean forwardOrCrossArc(int state, Arc<W> arc);

    /**
     * Called when every arc of a state has been explored.
     *
     * @param state the state.
     * @param parent the state it was discovered from, or {@link Fst#NO_STATE_ID} for a root.
     */
    void finishState(int state, int parent);

    void finishVisit();
}
