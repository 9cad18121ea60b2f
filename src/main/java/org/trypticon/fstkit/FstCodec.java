package org.trypticon.fstkit;

import org.apache.lucene.store.IndexInput;
import org.apache.lucene.store.IndexOutput;
import org.apache.lucene.util.NamedSPILoader;

import javax.annotation.Nonnull;
import java.io.IOException;

/**
 * Reads, writes and builds one FST implementation. Registered in the
 * {@link FstRegistry} under the FST type name found in headers.
 */
public interface FstCodec extends NamedSPILoader.NamedSPI {

    /**
     * Gets the FST type name, e.g. {@code "vector"}.
     *
     * @return the name.
     */
    @Override
    String getName();

    /**
     * Tests whether FSTs built by this codec implement {@link MutableFst}.
     *
     * @return {@code true} if mutable.
     */
    boolean isMutable();

    /**
     * Reads an FST of this type. Unless the options carry a header, the input is
     * positioned at the start of the header.
     *
     * @param in the input.
     * @param options the read options.
     * @param arcType the arc type named in the header.
     * @param config the configuration.
     * @param <W> the weight type.
     * @return the FST.
     * @throws IOException if an I/O error occurs or the data is malformed.
     */
    <W extends Weight> Fst<W> read(@Nonnull IndexInput in, @Nonnull FstReadOptions options,
                                   @Nonnull ArcType<W> arcType, @Nonnull FstConfig config) throws IOException;

    /**
     * Writes any FST in this type's format, header included.
     *
     * @param fst the FST, of any implementation.
     * @param out the output.
     * @param options the write options.
     * @param <W> the weight type.
     * @throws IOException if an I/O error occurs.
     */
    <W extends Weight> void write(@Nonnull Fst<W> fst, @Nonnull IndexOutput out,
                                  @Nonnull FstWriteOptions options) throws IOException;

    /**
     * Builds an independent FST of this type with the same states, arcs, start state
     * and symbol tables as {@code fst}.
     *
     * @param fst the FST to copy, of any implementation.
     * @param config the configuration.
     * @param <W> the weight type.
     * @return the copy.
     */
    <W extends Weight> Fst<W> copy(@Nonnull Fst<W> fst, @Nonnull FstConfig config);
}
