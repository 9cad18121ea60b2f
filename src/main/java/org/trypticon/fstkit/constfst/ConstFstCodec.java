package org.trypticon.fstkit.constfst;

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
 * Codec for {@link ConstFst}. Supports aligned output and reading straight from a memory-mapped file.
 */
public class ConstFstCodec implements FstCodec {

    @Override
    public String getName() {
        return ConstFst.TYPE;
    }

    @Override
    public boolean isMutable() {
        return false;
    }

    @Override
    public <W extends Weight> Fst<W> read(@Nonnull IndexInput in, @Nonnull FstReadOptions options,
                                          @Nonnull ArcType<W> arcType, @Nonnull FstConfig config)
            throws IOException {
        return ConstFst.read(in, options, arcType, config);
    }

    @Override
    public <W extends Weight> void write(@Nonnull Fst<W> fst, @Nonnull IndexOutput out,
                                         @Nonnull FstWriteOptions options) throws IOException {
        ConstFst.write(fst, out, options);
    }

    @Override
    public <W extends Weight> Fst<W> copy(@Nonnull Fst<W> fst, @Nonnull FstConfig config) {
        return ConstFst.copyOf(fst, config);
    }

    @Override
    public String toString() {
        return getName();
    }
}
