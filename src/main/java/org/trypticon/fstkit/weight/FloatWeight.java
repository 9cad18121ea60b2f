package org.trypticon.fstkit.weight;

import org.trypticon.fstkit.Weight;

/**
 * Base for weights holding a single {@code float}.
 */
public abstract class FloatWeight implements Weight {

    private final float value;

    protected FloatWeight(float value) {
        // -0 and 0 are the same weight
        this.value = value == 0f ? 0f : value;
    }

    /**
     * Gets the raw value.
     *
     * @return the value.
     */
    public float getValue() {
        return value;
    }

    @Override
    public boolean isMember() {
        return !Float.isNaN(value) && value != Float.NEGATIVE_INFINITY;
    }

    @Override
    public boolean equals(Object obj) {
        return obj != null && obj.getClass() == getClass()
                && Float.floatToIntBits(((FloatWeight) obj).value) == Float.floatToIntBits(value);
    }

    @Override
    public int hashCode() {
        return Float.hashCode(value);
    }

    @Override
    public String toString() {
        return Float.toString(value);
    }
}
