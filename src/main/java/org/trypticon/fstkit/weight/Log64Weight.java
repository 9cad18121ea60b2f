package org.trypticon.fstkit.weight;

import org.trypticon.fstkit.Weight;

/**
 * Weight in the log semiring over {@code double}s.
 */
public final class Log64Weight implements Weight {

    public static final String TYPE = "log64";

    public static final Log64Weight ZERO = new Log64Weight(Double.POSITIVE_INFINITY);
    public static final Log64Weight ONE = new Log64Weight(0.0);

    private final double value;

    public Log64Weight(double value) {
        this.value = value == 0.0 ? 0.0 : value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public boolean isMember() {
        return !Double.isNaN(value) && value != Double.NEGATIVE_INFINITY;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Log64Weight
                && Double.doubleToLongBits(((Log64Weight) obj).value) == Double.doubleToLongBits(value);
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
