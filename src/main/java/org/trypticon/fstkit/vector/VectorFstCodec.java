package org.trypticon.fstkit.vector;

import org.apache.lucene.store.IndexInput;
import org.apache.lucene.store.IndexOutput;
import org.trypticon.fstkit.ArcType;
import org.trypticon.fstkit.Fst;
import org.trypticon.fstkit.FstCodec;
import org.trypticon.fstkit.FstConfig;
import org.trypticon.fstkit.FstReadOptions;
import org.trypticon.fstkit.FstWriteOptions;
import org.trypticon.fstkit.Weight;

import javax.annotation.Nonnull;
import java.io.IOException;

/**
 * Codec for {@link VectorFst}. The body is, per state, its final weight, its arc
 * count as an int64, then each arc as {@code ilabel olabel weight nextstate}.
 */
public class VectorFstCodec implements FstCodec {

    @Override
    public String getName() {
        return VectorFst.TYPE;
    }

    @Override
    public boolean isMutable() {
        return true;
    }

    @Override
    public <W extends Weight> Fst<W> read(@Nonnull IndexInput in, @Nonnull FstReadOptions options,
                                          @Nonnull ArcType<W> arcType, @Nonnull FstConfig config)
            throws IOException {
        return VectorFst.read(in, options, arcType, config);
    }

    @Override
    public <W extends Weight> void write(@Nonnull Fst<W> fst, @Nonnull IndexOutput out,
                                         @Nonnull FstWriteOptions options) throws IOException {
        VectorFst.write(fst, out, options);
    }

    @Override
    public <W extends Weight> Fst<W> copy(@Nonnull Fst<W> fst, @Nonnull FstConfig config) {
        return VectorFst.copyOf(fst, config);
    }

    @Override
    public String toString() {
        return getName();
    }
}
