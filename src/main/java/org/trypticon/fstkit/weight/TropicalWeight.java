package org.trypticon.fstkit.weight;

/**
 * Weight in the tropical semiring (min, +), with zero at positive infinity and one at {@code 0}.
 */
public final class TropicalWeight extends FloatWeight {

    public static final String TYPE = "tropical";

    public static final TropicalWeight ZERO = new TropicalWeight(Float.POSITIVE_INFINITY);
    public static final TropicalWeight ONE = new TropicalWeight(0f);

    public TropicalWeight(float value) {
        super(value);
    }

    @Override
    public String type() {
        return TYPE;
    }
}
