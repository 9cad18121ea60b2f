package org.trypticon.fstkit.algorithm;

import org.junit.Test;
import org.trypticon.fstkit.Arc;
import org.trypticon.fstkit.ArcType;
import org.trypticon.fstkit.Fst;
import org.trypticon.fstkit.FstConfig;
import org.trypticon.fstkit.RecordingInfoStream;
import org.trypticon.fstkit.SymbolTable;
import org.trypticon.fstkit.vector.VectorFst;
import org.trypticon.fstkit.weight.TropicalWeight;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.trypticon.fstkit.TestFsts.arc;
import static org.trypticon.fstkit.TestFsts.cycle;
import static org.trypticon.fstkit.TestFsts.dag;
import static org.trypticon.fstkit.TestFsts.empty;
import static org.trypticon.fstkit.TestFsts.w;

/**
 * Tests for {@link Verify}.
 */
public class VerifyTests {
    private final FstConfig config = FstConfig.defaults();
    private final RecordingInfoStream infoStream = new RecordingInfoStream();

    @Test
    public void testSane() {
        assertThat(Verify.verify(dag(config), infoStream), is(true));
        assertThat(Verify.verify(cycle(config), infoStream), is(true));
        assertThat(Verify.verify(empty(config), infoStream), is(true));
        assertThat(infoStream.getMessages().isEmpty(), is(true));
    }

    @Test
    public void testNegativeInputLabel() {
        VectorFst<TropicalWeight> fst = dag(config);
        fst.addArc(1, arc(-2, 1, 0f, 2));
        assertThat(Verify.verify(fst, infoStream), is(false));
        assertThat(infoStream.getMessages(),
                is(List.of("Verify: FST input label ID of arc at position 1 of state 1 is negative")));
    }

    @Test
    public void testNegativeOutputLabel() {
        VectorFst<TropicalWeight> fst = dag(config);
        fst.addArc(0, arc(1, -1, 0f, 2));
        assertThat(Verify.verify(fst, infoStream), is(false));
        assertThat(infoStream.getMessages(),
                is(List.of("Verify: FST output label ID of arc at position 2 of state 0 is negative")));
    }

    @Test
    public void testInvalidArcWeight() {
        VectorFst<TropicalWeight> fst = dag(config);
        fst.addArc(1, new Arc<>(5, 5, w(Float.NaN), 2));
        assertThat(Verify.verify(fst, infoStream), is(false));
        assertThat(infoStream.getMessages(),
                is(List.of("Verify: FST weight of arc at position 1 of state 1 is invalid")));
    }

    @Test
    public void testInvalidFinalWeight() {
        VectorFst<TropicalWeight> fst = dag(config);
        fst.setFinal(1, w(Float.NEGATIVE_INFINITY));
        assertThat(Verify.verify(fst, infoStream), is(false));
        assertThat(infoStream.getMessages(), is(List.of("Verify: FST final weight of state 1 is invalid")));
    }

    @Test
    public void testDestinationOutOfRange() {
        Fst<TropicalWeight> fst = new Tampered(dag(config)) {
            @Nonnull
            @Override
            public Arc<TropicalWeight> arc(int state, int index) {
                Arc<TropicalWeight> arc = super.arc(state, index);
                return state == 0 && index == 1 ? arc.withNextState(3) : arc;
            }
        };
        assertThat(Verify.verify(fst, infoStream), is(false));
        assertThat(infoStream.getMessages(), is(List.of(
                "Verify: FST destination state ID of arc at position 1 of state 0 exceeds number of states")));
    }

    @Test
    public void testStartOutOfRange() {
        Fst<TropicalWeight> fst = new Tampered(dag(config)) {
            @Override
            public int start() {
                return 3;
            }
        };
        assertThat(Verify.verify(fst, infoStream), is(false));
        assertThat(infoStream.getMessages(), is(List.of("Verify: FST start state ID exceeds number of states")));
    }

    @Test
    public void testComponentDisabled() {
        VectorFst<TropicalWeight> fst = dag(config);
        fst.setFinal(0, w(Float.NaN));
        RecordingInfoStream quiet = new RecordingInfoStream("Verify");
        assertThat(Verify.verify(fst, quiet), is(false));
        assertThat(quiet.getMessages().isEmpty(), is(true));
        assertThat(Verify.findProblem(fst), is("FST final weight of state 0 is invalid"));
        assertThat(Verify.findProblem(dag(config)), is((String) null));
    }

    @Test
    public void testNoStartIsSane() {
        VectorFst<TropicalWeight> fst = dag(config);
        fst.setStart(Fst.NO_STATE_ID);
        assertThat(Verify.verify(fst, infoStream), is(true));
    }

    @Test
    public void testWrongEpsilonCount() {
        Fst<TropicalWeight> fst = new Tampered(dag(config)) {
            @Override
            public int numOutputEpsilons(int state) {
                return state == 2 ? 1 : super.numOutputEpsilons(state);
            }
        };
        assertThat(Verify.verify(fst, infoStream), is(false));
        assertThat(infoStream.getMessages(), is(List.of("Verify: FST output epsilon count of state 2 is incorrect")));
    }

    /**
     * Passes everything through to another FST, so that tests can misreport single values.
     */
    private static class Tampered implements Fst<TropicalWeight> {
        private final Fst<TropicalWeight> delegate;

        Tampered(Fst<TropicalWeight> delegate) {
            this.delegate = delegate;
        }

        @Override
        public String fstType() {
            return delegate.fstType();
        }

        @Nonnull
        @Override
        public ArcType<TropicalWeight> arcType() {
            return delegate.arcType();
        }

        @Override
        public int start() {
            return delegate.start();
        }

        @Nonnull
        @Override
        public TropicalWeight finalWeight(int state) {
            return delegate.finalWeight(state);
        }

        @Override
        public int numStates() {
            return delegate.numStates();
        }

        @Override
        public int numArcs(int state) {
            return delegate.numArcs(state);
        }

        @Nonnull
        @Override
        public Arc<TropicalWeight> arc(int state, int index) {
            return delegate.arc(state, index);
        }

        @Override
        public int numInputEpsilons(int state) {
            return delegate.numInputEpsilons(state);
        }

        @Override
        public int numOutputEpsilons(int state) {
            return delegate.numOutputEpsilons(state);
        }

        @Override
        public long properties(long mask, boolean test) {
            return delegate.properties(mask, test);
        }

        @Nullable
        @Override
        public SymbolTable inputSymbols() {
            return delegate.inputSymbols();
        }

        @Nullable
        @Override
        public SymbolTable outputSymbols() {
            return delegate.outputSymbols();
        }
    }
}
