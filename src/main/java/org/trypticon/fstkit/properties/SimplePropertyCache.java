package org.trypticon.fstkit.properties;

import org.trypticon.fstkit.Fst;
import org.trypticon.fstkit.Weight;

import javax.annotation.Nonnull;

/**
 * Property cache which trusts what it stores and computes only what is unknown.
 */
public class SimplePropertyCache implements PropertyCache {

    private long properties;

    public SimplePropertyCache(long properties) {
        this.properties = properties;
    }

    @Override
    public long get() {
        return properties;
    }

    @Override
    public void set(long props, long mask) {
        properties = (properties & ~mask) | (props & mask);
    }

    @Override
    public <W extends Weight> long properties(@Nonnull Fst<W> fst, long mask, boolean test) {
        if (test) {
            long known = FstProperties.knownProperties(properties);
            if ((mask & ~known) != 0) {
                long computed = FstProperties.compute(fst, properties);
                set(computed, FstProperties.TRINARY_PROPERTIES);
            }
        }
        return properties & mask;
    }
}
