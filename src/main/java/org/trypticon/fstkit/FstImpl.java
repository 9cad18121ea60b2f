package org.trypticon.fstkit;

import org.apache.lucene.store.DataOutput;
import org.apache.lucene.store.IndexInput;
import org.trypticon.fstkit.properties.FstProperties;
import org.trypticon.fstkit.properties.PropertyCache;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;

/**
 * Shared plumbing for FST implementations: arc type, symbol tables, the property
 * cache, and the header and symbol table handling every format has in common.
 *
 * @param <W> the weight type.
 */
public abstract class FstImpl<W extends Weight> implements Fst<W> {

    @Nonnull
    private final ArcType<W> arcType;

    @Nonnull
    private final PropertyCache propertyCache;

    @Nullable
    private SymbolTable inputSymbols;

    @Nullable
    private SymbolTable outputSymbols;

    protected FstImpl(@Nonnull ArcType<W> arcType, @Nonnull PropertyCache propertyCache) {
        this.arcType = arcType;
        this.propertyCache = propertyCache;
    }

    @Nonnull
    @Override
    public ArcType<W> arcType() {
        return arcType;
    }

    @Override
    public long properties(long mask, boolean test) {
        return propertyCache.properties(this, mask, test);
    }

    @Nullable
    @Override
    public SymbolTable inputSymbols() {
        return inputSymbols;
    }

    @Nullable
    @Override
    public SymbolTable outputSymbols() {
        return outputSymbols;
    }

    protected void setInputSymbolTable(@Nullable SymbolTable inputSymbols) {
        this.inputSymbols = inputSymbols;
    }

    protected void setOutputSymbolTable(@Nullable SymbolTable outputSymbols) {
        this.outputSymbols = outputSymbols;
    }

    @Nonnull
    protected PropertyCache getPropertyCache() {
        return propertyCache;
    }

    /**
     * Replaces every stored property bit.
     *
     * @param props the new properties.
     */
    protected void updateProperties(long props) {
        propertyCache.set(props, FstProperties.FST_PROPERTIES);
    }

    /**
     * Copies the symbol tables of another FST.
     *
     * @param fst the FST to copy from.
     */
    protected void copySymbols(@Nonnull Fst<W> fst) {
        inputSymbols = fst.inputSymbols() == null ? null : fst.inputSymbols().copy();
        outputSymbols = fst.outputSymbols() == null ? null : fst.outputSymbols().copy();
    }

    /**
     * Checks a state ID against the current number of states.
     *
     * @param state the state ID.
     * @throws IndexOutOfBoundsException if the state does not exist.
     */
    protected void checkState(int state) {
        if (state < 0 || state >= numStates()) {
            throw new IndexOutOfBoundsException("State " + state + " out of range [0, " + numStates() + ")");
        }
    }

    /**
     * Gets the header for a read, checking that it describes what the caller can read.
     * Unless the options already carry a header, it is read from the input.
     *
     * @param in the input.
     * @param options the read options.
     * @param fstType the FST type the caller reads.
     * @param minVersion the lowest format version the caller reads.
     * @param arcType the arc type the caller was given.
     * @param infoStream where to report a bad header.
     * @return the header.
     * @throws IOException if the header is missing, malformed or does not match.
     */
    @Nonnull
    protected static FstHeader readHeader(@Nonnull IndexInput in, @Nonnull FstReadOptions options,
                                          @Nonnull String fstType, int minVersion,
                                          @Nonnull ArcType<?> arcType, @Nonnull InfoStream infoStream)
            throws IOException {
        String source = options.getSource();
        FstHeader header = options.getHeader();
        if (header == null) {
            header = FstHeader.read(in, source, false, infoStream);
            if (header == null) {
                throw new CorruptFstException("Error reading FST header", source);
            }
        }
        if (!header.getFstType().equals(fstType)) {
            throw new CorruptFstException("FST not of type \"" + fstType + "\": " + header.getFstType(), source);
        }
        if (!header.getArcType().equals(arcType.getName())) {
            throw new CorruptFstException("Arc not of type \"" + arcType.getName() + "\": " +
                    header.getArcType(), source);
        }
        if (header.getVersion() < minVersion) {
            throw new CorruptFstException("Obsolete " + fstType + " FST version " + header.getVersion(), source);
        }
        if (header.getNumStates() < 0 || header.getNumStates() > Integer.MAX_VALUE) {
            throw new CorruptFstException("Bad number of states: " + header.getNumStates(), source);
        }
        if (header.getStart() < Fst.NO_STATE_ID || header.getStart() > Integer.MAX_VALUE) {
            throw new CorruptFstException("Bad start state: " + header.getStart(), source);
        }
        return header;
    }

    /**
     * Reads the symbol tables which follow the header. Tables in the stream are kept
     * only if the options ask for them; tables given in the options take precedence.
     *
     * @param in the input, positioned after the header.
     * @param header the header.
     * @param options the read options.
     * @throws IOException if a symbol table cannot be read.
     */
    protected void readSymbols(@Nonnull IndexInput in, @Nonnull FstHeader header,
                               @Nonnull FstReadOptions options) throws IOException {
        if ((header.getFlags() & FstHeader.HAS_ISYMBOLS) != 0) {
            SymbolTable symbols = SymbolTable.read(in, options.getSource());
            if (options.isReadInputSymbols()) {
                inputSymbols = symbols;
            }
        }
        if ((header.getFlags() & FstHeader.HAS_OSYMBOLS) != 0) {
            SymbolTable symbols = SymbolTable.read(in, options.getSource());
            if (options.isReadOutputSymbols()) {
                outputSymbols = symbols;
            }
        }
        if (options.getInputSymbols() != null) {
            inputSymbols = options.getInputSymbols().copy();
        }
        if (options.getOutputSymbols() != null) {
            outputSymbols = options.getOutputSymbols().copy();
        }
    }

    /**
     * Keeps the trinary and error bits of stored properties, replacing the other
     * binary bits with those of the implementation holding them.
     *
     * @param props the stored properties.
     * @param staticProperties the implementation's binary properties.
     * @return the properties to use.
     */
    protected static long copyProperties(long props, long staticProperties) {
        return (props & (FstProperties.TRINARY_PROPERTIES | FstProperties.ERROR)) | staticProperties;
    }

    /**
     * Writes the header and symbol tables of an FST, if the options ask for a header.
     *
     * @param fst the FST, of any implementation.
     * @param out the output.
     * @param options the write options.
     * @param fstType the FST type being written.
     * @param version the format version being written.
     * @param properties the properties to record.
     * @param formatFlags flags describing the body, such as {@link FstHeader#IS_ALIGNED}.
     * @param <W> the weight type.
     * @throws IOException if an I/O error occurs.
     */
    protected static <W extends Weight> void writeHeader(@Nonnull Fst<W> fst, @Nonnull DataOutput out,
                                                         @Nonnull FstWriteOptions options,
                                                         @Nonnull String fstType, int version,
                                                         long properties, int formatFlags) throws IOException {
        if (!options.isWriteHeader()) {
            return;
        }
        SymbolTable isymbols = options.isWriteInputSymbols() ? fst.inputSymbols() : null;
        SymbolTable osymbols = options.isWriteOutputSymbols() ? fst.outputSymbols() : null;
        int flags = formatFlags;
        if (isymbols != null) {
            flags |= FstHeader.HAS_ISYMBOLS;
        }
        if (osymbols != null) {
            flags |= FstHeader.HAS_OSYMBOLS;
        }

        FstHeader header = new FstHeader();
        header.setFstType(fstType);
        header.setArcType(fst.arcType().getName());
        header.setVersion(version);
        header.setFlags(flags);
        header.setProperties(properties);
        header.setStart(fst.start());
        header.setNumStates(fst.numStates());
        header.setNumArcs(fst.totalArcs());
        header.write(out);
        if (isymbols != null) {
            isymbols.write(out);
        }
        if (osymbols != null) {
            osymbols.write(out);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(type=" + fstType() + ", arcType=" + arcType.getName() +
                ", states=" + numStates() + ", start=" + start() + ")";
    }
}
