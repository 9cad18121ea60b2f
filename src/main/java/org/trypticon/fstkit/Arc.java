package org.trypticon.fstkit;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * An arc: a transition to {@code nextState} reading {@code ilabel}, writing
 * {@code olabel} and carrying {@code weight}. Label {@link Fst#EPSILON} is epsilon.
 *
 * @param <W> the weight type.
 */
public final class Arc<W extends Weight> {

    private final int ilabel;
    private final int olabel;

    @Nonnull
    private final W weight;

    private final int nextState;

    public Arc(int ilabel, int olabel, @Nonnull W weight, int nextState) {
        this.ilabel = ilabel;
        this.olabel = olabel;
        this.weight = Objects.requireNonNull(weight, "weight");
        this.nextState = nextState;
    }

    public int ilabel() {
        return ilabel;
    }

    public int olabel() {
        return olabel;
    }

    @Nonnull
    public W weight() {
        return weight;
    }

    public int nextState() {
        return nextState;
    }

    /**
     * Returns a copy of this arc pointing at a different state.
     *
     * @param nextState the new destination.
     * @return the new arc.
     */
    public Arc<W> withNextState(int nextState) {
        return new Arc<>(ilabel, olabel, weight, nextState);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Arc)) {
            return false;
        }
        Arc<?> other = (Arc<?>) obj;
        return ilabel == other.ilabel && olabel == other.olabel && nextState == other.nextState
                && weight.equals(other.weight);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ilabel, olabel, weight, nextState);
    }

    @Override
    public String toString() {
        return ilabel + ":" + olabel + "/" + weight + " -> " + nextState;
    }
}
