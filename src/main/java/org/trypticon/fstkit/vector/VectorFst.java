package org.trypticon.fstkit.vector;

import org.apache.lucene.store.DataOutput;
import org.apache.lucene.store.IndexInput;
import org.trypticon.fstkit.Arc;
import org.trypticon.fstkit.ArcType;
import org.trypticon.fstkit.CorruptFstException;
import org.trypticon.fstkit.Fst;
import org.trypticon.fstkit.FstConfig;
import org.trypticon.fstkit.FstHeader;
import org.trypticon.fstkit.FstImpl;
import org.trypticon.fstkit.FstReadOptions;
import org.trypticon.fstkit.FstWriteOptions;
import org.trypticon.fstkit.MutableFst;
import org.trypticon.fstkit.SymbolTable;
import org.trypticon.fstkit.Weight;
import org.trypticon.fstkit.properties.FstProperties;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable FST keeping each state's arcs in a list. The general-purpose
 * representation which algorithms build and modify.
 *
 * @param <W> the weight type.
 */
public class VectorFst<W extends Weight> extends FstImpl<W> implements MutableFst<W> {

    public static final String TYPE = "vector";

    static final int FILE_VERSION = 2;
    static final int MIN_FILE_VERSION = 2;

    static final long STATIC_PROPERTIES = FstProperties.EXPANDED | FstProperties.MUTABLE;

    // Properties the caller may set directly.
    private static final long SETTABLE_PROPERTIES = FstProperties.TRINARY_PROPERTIES | FstProperties.ERROR;

    private final List<VectorState<W>> states = new ArrayList<>();
    private int start = NO_STATE_ID;

    /**
     * Creates an empty FST.
     *
     * @param arcType the arc type.
     * @param config the configuration.
     */
    public VectorFst(@Nonnull ArcType<W> arcType, @Nonnull FstConfig config) {
        super(arcType, config.newPropertyCache(STATIC_PROPERTIES | FstProperties.NULL_PROPERTIES));
    }

    /**
     * Copies any FST into a new vector FST. State IDs, arc order, final weights,
     * start state, symbol tables and known properties are all kept.
     *
     * @param fst the FST to copy.
     * @param config the configuration.
     * @param <W> the weight type.
     * @return the copy.
     */
    public static <W extends Weight> VectorFst<W> copyOf(@Nonnull Fst<W> fst, @Nonnull FstConfig config) {
        VectorFst<W> copy = new VectorFst<>(fst.arcType(), config);
        int numStates = fst.numStates();
        for (int s = 0; s < numStates; s++) {
            VectorState<W> state = new VectorState<>(fst.finalWeight(s));
            for (Arc<W> arc : fst.arcs(s)) {
                state.addArc(arc);
            }
            copy.states.add(state);
        }
        copy.start = fst.start();
        copy.copySymbols(fst);
        copy.updateProperties(copyProperties(fst.properties(FstProperties.FST_PROPERTIES, false),
                STATIC_PROPERTIES));
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
        return state(state).finalWeight;
    }

    @Override
    public int numStates() {
        return states.size();
    }

    @Override
    public int numArcs(int state) {
        return state(state).arcs.size();
    }

    @Nonnull
    @Override
    public Arc<W> arc(int state, int index) {
        return state(state).arcs.get(index);
    }

    @Override
    public int numInputEpsilons(int state) {
        return state(state).numInputEpsilons;
    }

    @Override
    public int numOutputEpsilons(int state) {
        return state(state).numOutputEpsilons;
    }

    @Override
    public int addState() {
        states.add(new VectorState<>(arcType().zero()));
        updateProperties(FstProperties.addStateProperties(getPropertyCache().get()));
        return states.size() - 1;
    }

    @Override
    public void setStart(int state) {
        if (state != NO_STATE_ID) {
            checkState(state);
        }
        start = state;
        updateProperties(FstProperties.setStartProperties(getPropertyCache().get()));
    }

    @Override
    public void setFinal(int state, @Nonnull W weight) {
        state(state).finalWeight = weight;
        updateProperties(FstProperties.setFinalProperties(getPropertyCache().get()));
    }

    @Override
    public void addArc(int state, @Nonnull Arc<W> arc) {
        VectorState<W> vectorState = state(state);
        checkState(arc.nextState());
        vectorState.addArc(arc);
        updateProperties(FstProperties.addArcProperties(getPropertyCache().get(), state, arc,
                arcType().one(), arcType().zero()));
    }

    @Override
    public void deleteStates(@Nonnull int... toDelete) {
        int numStates = states.size();
        int[] newId = new int[numStates];
        for (int state : toDelete) {
            checkState(state);
            newId[state] = NO_STATE_ID;
        }
        List<VectorState<W>> kept = new ArrayList<>(numStates);
        for (int s = 0; s < numStates; s++) {
            if (newId[s] != NO_STATE_ID) {
                newId[s] = kept.size();
                kept.add(states.get(s));
            }
        }
        for (VectorState<W> state : kept) {
            List<Arc<W>> arcs = new ArrayList<>(state.arcs);
            state.clearArcs();
            for (Arc<W> arc : arcs) {
                int next = newId[arc.nextState()];
                if (next != NO_STATE_ID) {
                    state.addArc(arc.withNextState(next));
                }
            }
        }
        states.clear();
        states.addAll(kept);
        if (start != NO_STATE_ID) {
            start = newId[start];
        }
        updateProperties(FstProperties.deleteStatesProperties(getPropertyCache().get()));
    }

    @Override
    public void deleteStates() {
        states.clear();
        start = NO_STATE_ID;
        updateProperties(FstProperties.deleteAllStatesProperties(getPropertyCache().get()));
    }

    @Override
    public void deleteArcs(int state) {
        state(state).clearArcs();
        updateProperties(FstProperties.deleteArcsProperties(getPropertyCache().get()));
    }

    /**
     * Sets stored properties. Only trinary bits and {@link FstProperties#ERROR} can be set;
     * the other binary bits belong to the implementation.
     */
    @Override
    public void setProperties(long props, long mask) {
        getPropertyCache().set(props, mask & SETTABLE_PROPERTIES);
    }

    @Override
    public void setInputSymbols(@Nullable SymbolTable symbols) {
        setInputSymbolTable(symbols);
    }

    @Override
    public void setOutputSymbols(@Nullable SymbolTable symbols) {
        setOutputSymbolTable(symbols);
    }

    private VectorState<W> state(int state) {
        checkState(state);
        return states.get(state);
    }

    /**
     * Reads a vector FST.
     *
     * @param in the input, positioned at the header unless the options carry one.
     * @param options the read options.
     * @param arcType the arc type.
     * @param config the configuration.
     * @param <W> the weight type.
     * @return the FST.
     * @throws IOException if an I/O error occurs or the data is malformed.
     */
    static <W extends Weight> VectorFst<W> read(@Nonnull IndexInput in, @Nonnull FstReadOptions options,
                                                @Nonnull ArcType<W> arcType, @Nonnull FstConfig config)
            throws IOException {
        String source = options.getSource();
        FstHeader header = readHeader(in, options, TYPE, MIN_FILE_VERSION, arcType, config.getInfoStream());
        VectorFst<W> fst = new VectorFst<>(arcType, config);
        fst.readSymbols(in, header, options);

        int numStates = (int) header.getNumStates();
        long numArcs = 0;
        for (int s = 0; s < numStates; s++) {
            VectorState<W> state = new VectorState<>(arcType.readWeight(in));
            long stateArcs = in.readLong();
            if (stateArcs < 0 || stateArcs > Integer.MAX_VALUE) {
                throw new CorruptFstException("Bad arc count " + stateArcs + " for state " + s, source);
            }
            for (int i = 0; i < stateArcs; i++) {
                int ilabel = in.readInt();
                int olabel = in.readInt();
                W weight = arcType.readWeight(in);
                int nextState = in.readInt();
                state.addArc(new Arc<>(ilabel, olabel, weight, nextState));
            }
            numArcs += stateArcs;
            fst.states.add(state);
        }
        if (header.getNumArcs() != numArcs) {
            throw new CorruptFstException("Expected " + header.getNumArcs() + " arcs but read " + numArcs, source);
        }
        fst.start = (int) header.getStart();
        fst.updateProperties(copyProperties(header.getProperties(), STATIC_PROPERTIES));
        return fst;
    }

    /**
     * Writes any FST in the vector format.
     *
     * @param fst the FST.
     * @param out the output.
     * @param options the write options.
     * @param <W> the weight type.
     * @throws IOException if an I/O error occurs.
     */
    static <W extends Weight> void write(@Nonnull Fst<W> fst, @Nonnull DataOutput out,
                                         @Nonnull FstWriteOptions options) throws IOException {
        ArcType<W> arcType = fst.arcType();
        long properties = copyProperties(fst.properties(FstProperties.FST_PROPERTIES, false), STATIC_PROPERTIES);
        writeHeader(fst, out, options, TYPE, FILE_VERSION, properties, 0);
        for (int s = 0, n = fst.numStates(); s < n; s++) {
            arcType.writeWeight(out, fst.finalWeight(s));
            int numArcs = fst.numArcs(s);
            out.writeLong(numArcs);
            for (int i = 0; i < numArcs; i++) {
                Arc<W> arc = fst.arc(s, i);
                out.writeInt(arc.ilabel());
                out.writeInt(arc.olabel());
                arcType.writeWeight(out, arc.weight());
                out.writeInt(arc.nextState());
            }
        }
    }

    private static final class VectorState<W extends Weight> {
        @Nonnull
        private W finalWeight;

        private final List<Arc<W>> arcs = new ArrayList<>();
        private int numInputEpsilons;
        private int numOutputEpsilons;

        private VectorState(@Nonnull W finalWeight) {
            this.finalWeight = finalWeight;
        }

        private void addArc(Arc<W> arc) {
            if (arc.ilabel() == EPSILON) {
                numInputEpsilons++;
            }
            if (arc.olabel() == EPSILON) {
                numOutputEpsilons++;
            }
            arcs.add(arc);
        }

        private void clearArcs() {
            arcs.clear();
            numInputEpsilons = 0;
            numOutputEpsilons = 0;
        }
    }
}
