package org.trypticon.fstkit;

import org.trypticon.fstkit.vector.VectorFst;
import org.trypticon.fstkit.weight.StdArcType;
import org.trypticon.fstkit.weight.TropicalWeight;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

/**
 * Sample FSTs and helpers shared by the tests.
 */
public class TestFsts {
    public static final StdArcType STD = new StdArcType();

    public static TropicalWeight w(float value) {
        return new TropicalWeight(value);
    }

    public static Arc<TropicalWeight> arc(int ilabel, int olabel, float weight, int nextState) {
        return new Arc<>(ilabel, olabel, w(weight), nextState);
    }

    public static VectorFst<TropicalWeight> empty(FstConfig config) {
        return new VectorFst<>(STD, config);
    }

    /**
     * Acyclic acceptor: {@code 0 -1-> 1 -2-> 2}, plus {@code 0 -3-> 2}. State 2 is final.
     */
    public static VectorFst<TropicalWeight> dag(FstConfig config) {
        VectorFst<TropicalWeight> fst = empty(config);
        addStates(fst, 3);
        fst.setStart(0);
        fst.addArc(0, arc(1, 1, 0f, 1));
        fst.addArc(0, arc(3, 3, 0f, 2));
        fst.addArc(1, arc(2, 2, 0f, 2));
        fst.setFinal(2, TropicalWeight.ONE);
        return fst;
    }

    /**
     * Acyclic transducer numbered against its topological order. Start is state 3,
     * state 2 is not reachable from it, state 0 is final.
     * <pre>
     *   3 -1:2/0.5-> 1 -2:0-> 0
     *   3 -0:3-> 0
     *   2 -4:4/1.5-> 0
     * </pre>
     */
    public static VectorFst<TropicalWeight> unsortedDag(FstConfig config) {
        VectorFst<TropicalWeight> fst = empty(config);
        addStates(fst, 4);
        fst.setStart(3);
        fst.addArc(3, arc(1, 2, 0.5f, 1));
        fst.addArc(3, arc(0, 3, 0f, 0));
        fst.addArc(1, arc(2, 0, 0f, 0));
        fst.addArc(2, arc(4, 4, 1.5f, 0));
        fst.setFinal(0, w(2f));
        return fst;
    }

    /**
     * Cycle through the start state: {@code 0 -> 1 -> 2 -> 0}, with state 2 final.
     */
    public static VectorFst<TropicalWeight> cycle(FstConfig config) {
        VectorFst<TropicalWeight> fst = empty(config);
        addStates(fst, 3);
        fst.setStart(0);
        fst.addArc(0, arc(1, 1, 1f, 1));
        fst.addArc(1, arc(2, 2, 0f, 2));
        fst.addArc(2, arc(3, 3, 0f, 0));
        fst.setFinal(2, w(0.25f));
        return fst;
    }

    public static void addStates(MutableFst<?> fst, int count) {
        for (int i = 0; i < count; i++) {
            fst.addState();
        }
    }

    public static SymbolTable symbols(String name, String... symbols) {
        SymbolTable table = new SymbolTable(name);
        table.addSymbol("<eps>");
        for (String symbol : symbols) {
            table.addSymbol(symbol);
        }
        return table;
    }

    public static byte[] toBytes(FstClass fst) {
        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        assertThat(fst.write(stream, "test"), is(true));
        return stream.toByteArray();
    }

    public static byte[] toBytes(FstHeader header) throws IOException {
        return Utils.bytes(header::write);
    }

    public static FstClass fromBytes(byte[] bytes, FstConfig config) {
        return FstClass.read(Utils.input(bytes), config.readOptions("test"), config);
    }

    /**
     * Asserts that two FSTs have the same start state, final weights and arcs, state by state.
     */
    public static void assertSameStructure(Fst<?> expected, Fst<?> actual) {
        assertThat(actual.numStates(), is(expected.numStates()));
        assertThat(actual.start(), is(expected.start()));
        for (int s = 0; s < expected.numStates(); s++) {
            assertThat("final weight of " + s, (Object) actual.finalWeight(s), is((Object) expected.finalWeight(s)));
            assertThat("arcs of " + s, (Object) actual.arcs(s), is((Object) expected.arcs(s)));
            assertThat(actual.numInputEpsilons(s), is(expected.numInputEpsilons(s)));
            assertThat(actual.numOutputEpsilons(s), is(expected.numOutputEpsilons(s)));
        }
    }
}
