package org.trypticon.fstkit.properties;

import org.trypticon.fstkit.Fst;
import org.trypticon.fstkit.Weight;

import javax.annotation.Nonnull;

/**
 * The property bits attached to one FST instance. Known bits always describe
 * the FST as it is now; owners clear bits through {@link #set(long, long)}
 * whenever a mutation could change them.
 */
public interface PropertyCache {

    /**
     * Gets the stored bits without computing anything.
     *
     * @return the stored properties.
     */
    long get();

    /**
     * Overwrites bits.
     *
     * @param props the new values.
     * @param mask the bits to overwrite.
     */
    void set(long props, long mask);

    /**
     * Gets properties of the FST this cache belongs to.
     *
     * @param fst the FST owning this cache.
     * @param mask the properties wanted.
     * @param test {@code true} to compute requested properties which are not yet known,
     *             remembering the result.
     * @param <W> the weight type.
     * @return the properties restricted to {@code mask}.
     */
    <W extends Weight> long properties(@Nonnull Fst<W> fst, long mask, boolean test);
}
