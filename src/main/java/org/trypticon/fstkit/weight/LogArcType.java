package org.trypticon.fstkit.weight;

import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;
import org.apache.lucene.store.RandomAccessInput;
import org.trypticon.fstkit.ArcType;
import org.trypticon.fstkit.FstIO;

import javax.annotation.Nonnull;
import java.io.IOException;

/**
 * The {@code "log"} arc type, carrying {@link LogWeight}s.
 */
public final class LogArcType implements ArcType<LogWeight> {

    public static final String NAME = "log";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String weightType() {
        return LogWeight.TYPE;
    }

    @Override
    public Class<LogWeight> weightClass() {
        return LogWeight.class;
    }

    @Override
    public LogWeight zero() {
        return LogWeight.ZERO;
    }

    @Override
    public LogWeight one() {
        return LogWeight.ONE;
    }

    @Override
    public LogWeight readWeight(@Nonnull DataInput in) throws IOException {
        return new LogWeight(FstIO.readFloat(in));
    }

    @Override
    public void writeWeight(@Nonnull DataOutput out, @Nonnull LogWeight weight) throws IOException {
        FstIO.writeFloat(out, weight.getValue());
    }

    @Override
    public int weightBytes() {
        return Float.BYTES;
    }

    @Override
    public LogWeight getWeight(@Nonnull RandomAccessInput in, long pos) throws IOException {
        return new LogWeight(Float.intBitsToFloat(in.readInt(pos)));
    }

    @Override
    public String toString() {
        return NAME;
    }
}
