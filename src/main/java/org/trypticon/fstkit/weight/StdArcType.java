package org.trypticon.fstkit.weight;

import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;
import org.apache.lucene.store.RandomAccessInput;
import org.trypticon.fstkit.ArcType;
import org.trypticon.fstkit.FstIO;

import javax.annotation.Nonnull;
import java.io.IOException;

/**
 * The {@code "standard"} arc type, carrying {@link TropicalWeight}s.
 */
public final class StdArcType implements ArcType<TropicalWeight> {

    public static final String NAME = "standard";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String weightType() {
        return TropicalWeight.TYPE;
    }

    @Override
    public Class<TropicalWeight> weightClass() {
        return TropicalWeight.class;
    }

    @Override
    public TropicalWeight zero() {
        return TropicalWeight.ZERO;
    }

    @Override
    public TropicalWeight one() {
        return TropicalWeight.ONE;
    }

    @Override
    public TropicalWeight readWeight(@Nonnull DataInput in) throws IOException {
        return new TropicalWeight(FstIO.readFloat(in));
    }

    @Override
    public void writeWeight(@Nonnull DataOutput out, @Nonnull TropicalWeight weight) throws IOException {
        FstIO.writeFloat(out, weight.getValue());
    }

    @Override
    public int weightBytes() {
        return Float.BYTES;
    }

    @Override
    public TropicalWeight getWeight(@Nonnull RandomAccessInput in, long pos) throws IOException {
        return new TropicalWeight(Float.intBitsToFloat(in.readInt(pos)));
    }

    @Override
    public String toString() {
        return NAME;
    }
}
