package org.trypticon.fstkit.weight;

/**
 * Weight in the log semiring over {@code float}s: values are negative log probabilities.
 */
public final class LogWeight extends FloatWeight {

    public static final String TYPE = "log";

    public static final LogWeight ZERO = new LogWeight(Float.POSITIVE_INFINITY);
    public static final LogWeight ONE = new LogWeight(0f);

    public LogWeight(float value) {
        super(value);
    }

    @Override
    public String type() {
        return TYPE;
    }
}
