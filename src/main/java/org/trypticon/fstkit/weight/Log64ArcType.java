package org.trypticon.fstkit.weight;

import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;
import org.apache.lucene.store.RandomAccessInput;
import org.trypticon.fstkit.ArcType;
import org.trypticon.fstkit.FstIO;

import javax.annotation.Nonnull;
import java.io.IOException;

/**
 * The {@code "log64"} arc type, carrying double precision {@link Log64Weight}s.
 */
public final class Log64ArcType implements ArcType<Log64Weight> {

    public static final String NAME = "log64";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String weightType() {
        return Log64Weight.TYPE;
    }

    @Override
    public Class<Log64Weight> weightClass() {
        return Log64Weight.class;
    }

    @Override
    public Log64Weight zero() {
        return Log64Weight.ZERO;
    }

    @Override
    public Log64Weight one() {
        return Log64Weight.ONE;
    }

    @Override
    public Log64Weight readWeight(@Nonnull DataInput in) throws IOException {
        return new Log64Weight(FstIO.readDouble(in));
    }

    @Override
    public void writeWeight(@Nonnull DataOutput out, @Nonnull Log64Weight weight) throws IOException {
        FstIO.writeDouble(out, weight.getValue());
    }

    @Override
    public int weightBytes() {
        return Double.BYTES;
    }

    @Override
    public Log64Weight getWeight(@Nonnull RandomAccessInput in, long pos) throws IOException {
        return new Log64Weight(Double.longBitsToDouble(in.readLong(pos)));
    }

    @Override
    public String toString() {
        return NAME;
    }
}
