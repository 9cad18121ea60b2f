package org.trypticon.fstkit;

import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;
import org.apache.lucene.store.RandomAccessInput;
import org.apache.lucene.util.NamedSPILoader;

import javax.annotation.Nonnull;
import java.io.IOException;

/**
 * Describes one kind of arc: its registered name and everything needed to
 * create and persist its weights. Registered in the {@link FstRegistry}
 * so that the arc type name in a header can be resolved at run time.
 *
 * @param <W> the weight type.
 */
public interface ArcType<W extends Weight> extends NamedSPILoader.NamedSPI {

    /**
     * Gets the name of this arc type as written in headers, e.g. {@code "standard"}.
     *
     * @return the arc type name.
     */
    @Override
    String getName();

    /**
     * Gets the name of the weight semiring, e.g. {@code "tropical"}.
     *
     * @return the weight type name.
     */
    String weightType();

    /**
     * Gets the Java class of the weights.
     *
     * @return the class.
     */
    Class<W> weightClass();

    /**
     * Gets the additive identity, which also marks a state as non-final.
     *
     * @return zero.
     */
    W zero();

    /**
     * Gets the multiplicative identity.
     *
     * @return one.
     */
    W one();

    W readWeight(@Nonnull DataInput in) throws IOException;

    void writeWeight(@Nonnull DataOutput out, @Nonnull W weight) throws IOException;

    /**
     * Gets the fixed number of bytes one weight occupies when persisted.
     *
     * @return the size in bytes.
     */
    int weightBytes();

    /**
     * Decodes a weight at an absolute position.
     *
     * @param in the input.
     * @param pos the byte position.
     * @return the weight.
     * @throws IOException if the position is out of range.
     */
    W getWeight(@Nonnull RandomAccessInput in, long pos) throws IOException;
}
