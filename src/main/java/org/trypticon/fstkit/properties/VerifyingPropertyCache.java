package org.trypticon.fstkit.properties;

import org.trypticon.fstkit.Fst;
import org.trypticon.fstkit.Weight;

import javax.annotation.Nonnull;

/**
 * Debugging wrapper which recomputes every property on every query and fails
 * if a known cached bit disagrees with the recomputed value. Each query costs
 * a full traversal of the FST.
 */
public class VerifyingPropertyCache implements PropertyCache {

    @Nonnull
    private final PropertyCache delegate;

    public VerifyingPropertyCache(@Nonnull PropertyCache delegate) {
        this.delegate = delegate;
    }

    @Override
    public long get() {
        return delegate.get();
    }

    @Override
    public void set(long props, long mask) {
        delegate.set(props, mask);
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException if a known cached property is wrong.
     */
    @Override
    public <W extends Weight> long properties(@Nonnull Fst<W> fst, long mask, boolean test) {
        long stored = delegate.get();
        long computed = FstProperties.compute(fst, stored);
        long incompatible = FstProperties.incompatibleProperties(stored, computed);
        if (incompatible != 0) {
            throw new IllegalStateException("Cached properties of " + fst.fstType() + " FST are stale: stored [" +
                    FstProperties.toString(stored & incompatible) + "] but computed [" +
                    FstProperties.toString(computed & incompatible) + "]");
        }
        if (test) {
            delegate.set(computed, FstProperties.TRINARY_PROPERTIES);
        }
        return delegate.get() & mask;
    }
}
