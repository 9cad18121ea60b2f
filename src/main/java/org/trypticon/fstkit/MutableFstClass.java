package org.trypticon.fstkit;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Handle on a mutable FST whose arc type is only known at runtime.
 */
public class MutableFstClass extends FstClass {

    private static final String COMPONENT = "MutableFstClass";

    @Nonnull
    private final MutableFst<?> fst;

    public MutableFstClass(@Nonnull MutableFst<?> fst, @Nonnull FstConfig config) {
        super(fst, config);
        this.fst = fst;
    }

    @Nonnull
    public MutableFst<?> getMutableFst() {
        return fst;
    }

    /**
     * Gets the mutable FST with its weight type known.
     *
     * @param arcType the expected arc type.
     * @param <W> the weight type.
     * @return the FST. Returns {@code null} if the FST has a different arc type.
     */
    @Nullable
    @SuppressWarnings("unchecked")
    public <W extends Weight> MutableFst<W> getMutableFst(@Nonnull ArcType<W> arcType) {
        if (!isArcType(fst, arcType)) {
            return null;
        }
        return (MutableFst<W>) fst;
    }

    public int addState() {
        return fst.addState();
    }

    /**
     * Adds an arc.
     *
     * @param state the state the arc leaves.
     * @param ilabel the input label.
     * @param olabel the output label.
     * @param weight the weight, which must be of this FST's weight type.
     * @param nextState the destination state.
     * @return {@code true} if added, {@code false} if the weight has the wrong type.
     */
    public boolean addArc(int state, int ilabel, int olabel, @Nonnull Weight weight, int nextState) {
        return addArc(fst, state, ilabel, olabel, weight, nextState);
    }

    private <W extends Weight> boolean addArc(MutableFst<W> fst, int state, int ilabel, int olabel,
                                              Weight weight, int nextState) {
        W typed = checkWeight(fst, weight);
        if (typed == null) {
            return false;
        }
        fst.addArc(state, new Arc<>(ilabel, olabel, typed, nextState));
        return true;
    }

    public void setStart(int state) {
        fst.setStart(state);
    }

    /**
     * Sets the final weight of a state.
     *
     * @param state the state.
     * @param weight the weight, which must be of this FST's weight type.
     * @return {@code true} if set, {@code false} if the weight has the wrong type.
     */
    public boolean setFinal(int state, @Nonnull Weight weight) {
        return setFinal(fst, state, weight);
    }

    private <W extends Weight> boolean setFinal(MutableFst<W> fst, int state, Weight weight) {
        W typed = checkWeight(fst, weight);
        if (typed == null) {
            return false;
        }
        fst.setFinal(state, typed);
        return true;
    }

    private <W extends Weight> W checkWeight(MutableFst<W> fst, Weight weight) {
        Class<W> weightClass = fst.arcType().weightClass();
        if (!weightClass.isInstance(weight)) {
            getConfig().getInfoStream().message(COMPONENT, "FST and weight types do not match: " +
                    fst.arcType().weightType() + " vs " + weight.type());
            return null;
        }
        return weightClass.cast(weight);
    }

    public void deleteStates(@Nonnull int... states) {
        fst.deleteStates(states);
    }

    public void deleteStates() {
        fst.deleteStates();
    }

    public void deleteArcs(int state) {
        fst.deleteArcs(state);
    }

    public void setProperties(long props, long mask) {
        fst.setProperties(props, mask);
    }

    public void setInputSymbols(@Nullable SymbolTable symbols) {
        fst.setInputSymbols(symbols);
    }

    public void setOutputSymbols(@Nullable SymbolTable symbols) {
        fst.setOutputSymbols(symbols);
    }
}
