package org.trypticon.fstkit.constfst;

import org.apache.lucene.store.ByteBuffersDataInput;
import org.apache.lucene.store.ByteBuffersDataOutput;
import org.apache.lucene.store.DataOutput;
import org.apache.lucene.store.IndexInput;
import org.apache.lucene.store.IndexOutput;
import org.apache.lucene.store.RandomAccessInput;
import org.trypticon.fstkit.Arc;
import org.trypticon.fstkit.ArcType;
import org.trypticon.fstkit.CorruptFstException;
import org.trypticon.fstkit.FileReadMode;
import org.trypticon.fstkit.Fst;
import org.trypticon.fstkit.FstConfig;
import org.trypticon.fstkit.FstHeader;
import org.trypticon.fstkit.FstIO;
import org.trypticon.fstkit.FstImpl;
import org.trypticon.fstkit.FstReadOptions;
import org.trypticon.fstkit.FstWriteOptions;
import org.trypticon.fstkit.Weight;
import org.trypticon.fstkit.properties.FstProperties;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.util.List;

/**
 * Immutable FST stored as two packed arrays of fixed-size records, one for states
 * and one for arcs. When read in {@link FileReadMode#MAP} mode the arrays are
 * slices of the input, so a mapped file is never copied.
 *
 * <p>State record: {@code final:weight | pos:int32 | narcs:int32 | niepsilons:int32 | noepsilons:int32}.
 * Arc record: {@code ilabel:int32 | olabel:int32 | weight | nextstate:int32}.</p>
 *
 * @param <W> the weight type.
 */
public class ConstFst<W extends Weight> extends FstImpl<W> {

    public static final String TYPE = "const";

    static final int FILE_VERSION = 2;
    static final int MIN_FILE_VERSION = 2;

    static final long STATIC_PROPERTIES = FstProperties.EXPANDED;

    private RandomAccessInput states;
    private RandomAccessInput arcs;
    private boolean mapped;
    private final int numStates;
    private final int numArcs;
    private final int start;
    private final int stateBytes;
    private final int arcBytes;

    private ConstFst(@Nonnull ArcType<W> arcType, @Nonnull FstConfig config, long properties,
                     int numStates, int numArcs, int start) {
        super(arcType, config.newPropertyCache(copyProperties(properties, STATIC_PROPERTIES)));
        this.numStates = numStates;
        this.numArcs = numArcs;
        this.start = start;
        this.stateBytes = stateBytes(arcType);
        this.arcBytes = arcBytes(arcType);
    }

    private static int stateBytes(ArcType<?> arcType) {
        return arcType.weightBytes() + 4 * Integer.BYTES;
    }

    private static int arcBytes(ArcType<?> arcType) {
        return arcType.weightBytes() + 3 * Integer.BYTES;
    }

    /**
     * Copies any FST into a new const FST. State IDs, arc order, final weights,
     * start state, symbol tables and known properties are all kept.
     *
     * @param fst the FST to copy.
     * @param config the configuration.
     * @param <W> the weight type.
     * @return the copy.
     */
    public static <W extends Weight> ConstFst<W> copyOf(@Nonnull Fst<W> fst, @Nonnull FstConfig config) {
        ArcType<W> arcType = fst.arcType();
        int numStates = fst.numStates();
        long totalArcs = fst.totalArcs();
        if (totalArcs > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too many arcs for a const FST: " + totalArcs);
        }
        int numArcs = (int) totalArcs;
        ByteBuffersDataOutput buffer = new ByteBuffersDataOutput();
        long statesLength;
        try {
            writeStates(fst, buffer);
            statesLength = buffer.size();
            writeArcs(fst, buffer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        ByteBuffersDataInput data = buffer.toDataInput();
        ConstFst<W> copy = new ConstFst<>(arcType, config, fst.properties(FstProperties.FST_PROPERTIES, false),
                numStates, numArcs, fst.start());
        copy.states = data.slice(0, statesLength);
        copy.arcs = data.slice(statesLength, buffer.size() - statesLength);
        copy.copySymbols(fst);
        return copy;
    }

    @Override
    public String fstType() {
        return TYPE;
    }

    @Override
    public int start() {
        return start;
    }

    @Nonnull
    @Override
    public W finalWeight(int state) {
        try {
            return arcType().getWeight(states, stateOffset(state));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public int numStates() {
        return numStates;
    }

    @Override
    public int numArcs(int state) {
        return stateField(state, 1);
    }

    @Nonnull
    @Override
    public Arc<W> arc(int state, int index) {
        int stateArcs = numArcs(state);
        if (index < 0 || index >= stateArcs) {
            throw new IndexOutOfBoundsException("Arc " + index + " out of range [0, " + stateArcs + ")");
        }
        long offset = (long) (stateField(state, 0) + index) * arcBytes;
        int weightBytes = arcType().weightBytes();
        try {
            return new Arc<>(arcs.readInt(offset), arcs.readInt(offset + 4),
                    arcType().getWeight(arcs, offset + 8), arcs.readInt(offset + 8 + weightBytes));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public int numInputEpsilons(int state) {
        return stateField(state, 2);
    }

    @Override
    public int numOutputEpsilons(int state) {
        return stateField(state, 3);
    }

    /**
     * Tests whether the arrays are slices of the input they were read from
     * rather than copies on the heap.
     *
     * @return {@code true} if mapped.
     */
    public boolean isMapped() {
        return mapped;
    }

    private long stateOffset(int state) {
        checkState(state);
        return (long) state * stateBytes;
    }

    // 0 = pos, 1 = narcs, 2 = niepsilons, 3 = noepsilons
    private int stateField(int state, int field) {
        try {
            return states.readInt(stateOffset(state) + arcType().weightBytes() + field * Integer.BYTES);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Reads a const FST. In {@link FileReadMode#MAP} mode the arrays stay in the input,
     * which must then stay open for as long as the FST is used; otherwise they are
     * copied to the heap.
     *
     * @param in the input, positioned at the header unless the options carry one.
     * @param options the read options.
     * @param arcType the arc type.
     * @param config the configuration.
     * @param <W> the weight type.
     * @return the FST.
     * @throws IOException if an I/O error occurs or the data is malformed.
     */
    static <W extends Weight> ConstFst<W> read(@Nonnull IndexInput in, @Nonnull FstReadOptions options,
                                               @Nonnull ArcType<W> arcType, @Nonnull FstConfig config)
            throws IOException {
        String source = options.getSource();
        FstHeader header = readHeader(in, options, TYPE, MIN_FILE_VERSION, arcType, config.getInfoStream());
        if (header.getNumArcs() < 0 || header.getNumArcs() > Integer.MAX_VALUE) {
            throw new CorruptFstException("Bad number of arcs: " + header.getNumArcs(), source);
        }
        int numStates = (int) header.getNumStates();
        int numArcs = (int) header.getNumArcs();
        boolean aligned = (header.getFlags() & FstHeader.IS_ALIGNED) != 0;

        ConstFst<W> fst = new ConstFst<>(arcType, config, header.getProperties(), numStates, numArcs,
                (int) header.getStart());
        fst.readSymbols(in, header, options);
        if (aligned) {
            FstIO.align(in, FstHeader.ALIGNMENT);
        }
        fst.states = slice(in, (long) numStates * fst.stateBytes, options, source);
        if (aligned) {
            FstIO.align(in, FstHeader.ALIGNMENT);
        }
        fst.arcs = slice(in, (long) numArcs * fst.arcBytes, options, source);
        fst.mapped = options.getMode() == FileReadMode.MAP;
        fst.checkArcRanges(source);
        return fst;
    }

    private static RandomAccessInput slice(IndexInput in, long length, FstReadOptions options, String source)
            throws IOException {
        long pos = in.getFilePointer();
        if (length > in.length() - pos) {
            throw new CorruptFstException("Array of " + length + " bytes at position " + pos +
                    " runs past the end of the input", source);
        }
        if (options.getMode() == FileReadMode.MAP) {
            RandomAccessInput slice = in.randomAccessSlice(pos, length);
            in.seek(pos + length);
            return slice;
        }
        if (length > Integer.MAX_VALUE) {
            throw new CorruptFstException("Array of " + length + " bytes is too large", source);
        }
        byte[] bytes = new byte[(int) length];
        in.readBytes(bytes, 0, bytes.length);
        return new ByteBuffersDataInput(List.of(ByteBuffer.wrap(bytes)));
    }

    private void checkArcRanges(String source) throws CorruptFstException {
        for (int s = 0; s < numStates; s++) {
            int pos = stateField(s, 0);
            int stateArcs = stateField(s, 1);
            if (pos < 0 || stateArcs < 0 || (long) pos + stateArcs > numArcs) {
                throw new CorruptFstException("Arcs of state " + s + " out of range: pos=" + pos +
                        ", narcs=" + stateArcs, source);
            }
        }
    }

    /**
     * Writes any FST in the const format.
     *
     * @param fst the FST.
     * @param out the output.
     * @param options the write options.
     * @param <W> the weight type.
     * @throws IOException if an I/O error occurs.
     */
    static <W extends Weight> void write(@Nonnull Fst<W> fst, @Nonnull IndexOutput out,
                                         @Nonnull FstWriteOptions options) throws IOException {
        boolean align = options.isAlign();
        long properties = copyProperties(fst.properties(FstProperties.FST_PROPERTIES, false), STATIC_PROPERTIES);
        writeHeader(fst, out, options, TYPE, FILE_VERSION, properties, align ? FstHeader.IS_ALIGNED : 0);
        if (align) {
            FstIO.align(out, FstHeader.ALIGNMENT);
        }
        writeStates(fst, out);
        if (align) {
            FstIO.align(out, FstHeader.ALIGNMENT);
        }
        writeArcs(fst, out);
    }

    private static <W extends Weight> void writeStates(Fst<W> fst, DataOutput out) throws IOException {
        ArcType<W> arcType = fst.arcType();
        int pos = 0;
        for (int s = 0, n = fst.numStates(); s < n; s++) {
            int stateArcs = fst.numArcs(s);
            arcType.writeWeight(out, fst.finalWeight(s));
            out.writeInt(pos);
            out.writeInt(stateArcs);
            out.writeInt(fst.numInputEpsilons(s));
            out.writeInt(fst.numOutputEpsilons(s));
            pos += stateArcs;
        }
    }

    private static <W extends Weight> void writeArcs(Fst<W> fst, DataOutput out) throws IOException {
        ArcType<W> arcType = fst.arcType();
        for (int s = 0, n = fst.numStates(); s < n; s++) {
            for (int i = 0, numArcs = fst.numArcs(s); i < numArcs; i++) {
                Arc<W> arc = fst.arc(s, i);
                out.writeInt(arc.ilabel());
                out.writeInt(arc.olabel());
                arcType.writeWeight(out, arc.weight());
                out.writeInt(arc.nextState());
            }
        }
    }
}
