package org.trypticon.fstkit;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * An {@link Fst} which can be changed in place. Every mutator updates the
 * property cache before returning so that no stale property stays known.
 *
 * @param <W> the weight type.
 */
public interface MutableFst<W extends Weight> extends Fst<W> {

    /**
     * Adds a new non-final state without arcs.
     *
     * @return the id of the new state.
     */
    int addState();

    void setStart(int state);

    void setFinal(int state, @Nonnull W weight);

    void addArc(int state, @Nonnull Arc<W> arc);

    /**
     * Deletes some states and every arc leading to them. The remaining states
     * keep their relative order and are renumbered densely; a deleted start
     * state leaves the FST without one.
     *
     * @param states the states to delete.
     */
    void deleteStates(@Nonnull int... states);

    /**
     * Deletes all states.
     */
    void deleteStates();

    /**
     * Deletes all arcs leaving a state.
     *
     * @param state the state.
     */
    void deleteArcs(int state);

    /**
     * Overwrites property bits.
     *
     * @param props the new values.
     * @param mask the bits to overwrite.
     */
    void setProperties(long props, long mask);

    void setInputSymbols(@Nullable SymbolTable symbols);

    void setOutputSymbols(@Nullable SymbolTable symbols);
}
