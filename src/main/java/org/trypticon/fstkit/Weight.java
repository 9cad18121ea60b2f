package org.trypticon.fstkit;

/**
 * A semiring element carried on arcs and final states. Implementations are
 * immutable values; only the type name is needed at this level, the algebra
 * belongs to each implementation.
 */
public interface Weight {

    /**
     * Gets the name of the semiring this weight belongs to, e.g. {@code "tropical"}.
     *
     * @return the weight type name.
     */
    String type();

    /**
     * Tests whether this is a valid member of its semiring.
     *
     * @return {@code true} if valid.
     */
    boolean isMember();
}
