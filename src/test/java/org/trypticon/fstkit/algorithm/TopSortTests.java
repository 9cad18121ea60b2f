package org.trypticon.fstkit.algorithm;

import org.junit.Test;
import org.trypticon.fstkit.Arc;
import org.trypticon.fstkit.FstConfig;
import org.trypticon.fstkit.MutableFstClass;
import org.trypticon.fstkit.RecordingInfoStream;
import org.trypticon.fstkit.properties.FstProperties;
import org.trypticon.fstkit.vector.VectorFst;
import org.trypticon.fstkit.weight.TropicalWeight;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.trypticon.fstkit.TestFsts.addStates;
import static org.trypticon.fstkit.TestFsts.arc;
import static org.trypticon.fstkit.TestFsts.assertSameStructure;
import static org.trypticon.fstkit.TestFsts.cycle;
import static org.trypticon.fstkit.TestFsts.empty;
import static org.trypticon.fstkit.TestFsts.unsortedDag;
import static org.trypticon.fstkit.TestFsts.w;

/**
 * Tests for {@link TopSort}.
 */
public class TopSortTests {
    private final FstConfig config = FstConfig.defaults();

    @Test
    public void testDag() {
        VectorFst<TropicalWeight> fst = unsortedDag(config);
        assertThat(TopSort.topSort(fst), is(true));

        assertThat(fst.numStates(), is(4));
        assertThat(fst.start(), is(1));
        assertThat(fst.arcs(0), is(List.of(arc(4, 4, 1.5f, 3))));
        assertThat(fst.arcs(1), is(List.of(arc(1, 2, 0.5f, 2), arc(0, 3, 0f, 3))));
        assertThat(fst.arcs(2), is(List.of(arc(2, 0, 0f, 3))));
        assertThat(fst.numArcs(3), is(0));
        assertThat(fst.finalWeight(3), is(w(2f)));
        assertThat(fst.finalWeight(1), is(TropicalWeight.ZERO));
        assertThat(fst.numInputEpsilons(1), is(1));
        assertThat(fst.numOutputEpsilons(2), is(1));
        assertArcsAscend(fst);
    }

    @Test
    public void testDag_Properties() {
        VectorFst<TropicalWeight> fst = unsortedDag(config);
        assertThat(TopSort.topSort(fst), is(true));
        assertThat(fst.properties(FstProperties.TOP_SORTED | FstProperties.NOT_TOP_SORTED, false),
                is(FstProperties.TOP_SORTED));
        assertThat(fst.properties(FstProperties.ACYCLIC | FstProperties.INITIAL_ACYCLIC, false),
                is(FstProperties.ACYCLIC | FstProperties.INITIAL_ACYCLIC));
        assertThat(fst.properties(FstProperties.TRINARY_PROPERTIES, true),
                is(FstProperties.compute(fst, 0) & FstProperties.TRINARY_PROPERTIES));
    }

    @Test
    public void testDag_KeepsKnownProperties() {
        VectorFst<TropicalWeight> fst = unsortedDag(config);
        fst.properties(FstProperties.TRINARY_PROPERTIES, true);
        assertThat(TopSort.topSort(fst), is(true));
        assertThat(fst.properties(FstProperties.ACCEPTOR | FstProperties.NOT_ACCEPTOR, false),
                is(FstProperties.NOT_ACCEPTOR));
        assertThat(fst.properties(FstProperties.ACCESSIBLE | FstProperties.NOT_ACCESSIBLE, false),
                is(FstProperties.NOT_ACCESSIBLE));
        long known = fst.properties(FstProperties.TRINARY_PROPERTIES, false);
        assertThat(FstProperties.compute(fst, 0) & FstProperties.knownProperties(known), is(known));
    }

    @Test
    public void testAlreadySorted() {
        VectorFst<TropicalWeight> fst = unsortedDag(config);
        assertThat(TopSort.topSort(fst), is(true));
        VectorFst<TropicalWeight> sorted = VectorFst.copyOf(fst, config);
        assertThat(TopSort.topSort(fst), is(true));
        assertArcsAscend(fst);
        assertThat(fst.numStates(), is(sorted.numStates()));
    }

    @Test
    public void testCyclic() {
        VectorFst<TropicalWeight> fst = cycle(config);
        VectorFst<TropicalWeight> before = VectorFst.copyOf(fst, config);
        assertThat(TopSort.topSort(fst), is(false));
        assertSameStructure(before, fst);
        assertThat(fst.properties(FstProperties.CYCLIC | FstProperties.ACYCLIC, false), is(FstProperties.CYCLIC));
        assertThat(fst.properties(FstProperties.TOP_SORTED | FstProperties.NOT_TOP_SORTED, false),
                is(FstProperties.NOT_TOP_SORTED));
    }

    @Test
    public void testSelfLoop() {
        VectorFst<TropicalWeight> fst = unsortedDag(config);
        fst.addArc(2, arc(7, 7, 0f, 2));
        VectorFst<TropicalWeight> before = VectorFst.copyOf(fst, config);
        assertThat(TopSort.topSort(fst), is(false));
        assertSameStructure(before, fst);
    }

    @Test
    public void testEmpty() {
        VectorFst<TropicalWeight> fst = empty(config);
        assertThat(TopSort.topSort(fst), is(true));
        assertThat(fst.numStates(), is(0));
    }

    @Test
    public void testNoStartState() {
        VectorFst<TropicalWeight> fst = unsortedDag(config);
        fst.setStart(VectorFst.NO_STATE_ID);
        assertThat(TopSort.topSort(fst), is(true));
        assertThat(fst.start(), is(VectorFst.NO_STATE_ID));
        assertArcsAscend(fst);
    }

    @Test
    public void testHandle_Cyclic() {
        RecordingInfoStream infoStream = new RecordingInfoStream();
        FstConfig config = FstConfig.builder().setInfoStream(infoStream).build();
        MutableFstClass fst = new MutableFstClass(cycle(config), config);
        assertThat(TopSort.topSort(fst), is(false));
        assertThat(infoStream.getMessages(), is(List.of("TopSort: Input FST is cyclic")));
    }

    @Test
    public void testHandle_Acyclic() {
        RecordingInfoStream infoStream = new RecordingInfoStream();
        FstConfig config = FstConfig.builder().setInfoStream(infoStream).build();
        MutableFstClass fst = new MutableFstClass(unsortedDag(config), config);
        assertThat(TopSort.topSort(fst), is(true));
        assertThat(fst.start(), is(1));
        assertThat(infoStream.getMessages().isEmpty(), is(true));
    }

    @Test
    public void testLargerDag() {
        VectorFst<TropicalWeight> fst = empty(config);
        int numStates = 50;
        addStates(fst, numStates);
        fst.setStart(numStates - 1);
        // every state links to some lower-numbered states
        for (int s = 1; s < numStates; s++) {
            fst.addArc(s, arc(s, s, 0f, s - 1));
            fst.addArc(s, arc(s, s, 0f, (s * 7) % s));
            if (s > 3) {
                fst.addArc(s, arc(s, s, 0f, s / 3));
            }
        }
        fst.setFinal(0, TropicalWeight.ONE);
        assertThat(TopSort.topSort(fst), is(true));
        assertArcsAscend(fst);
        assertThat(fst.start(), is(0));
        assertThat(fst.finalWeight(numStates - 1), is(TropicalWeight.ONE));
    }

    private static void assertArcsAscend(VectorFst<TropicalWeight> fst) {
        for (int s = 0; s < fst.numStates(); s++) {
            for (Arc<TropicalWeight> arc : fst.arcs(s)) {
                assertThat(s, is(lessThan(arc.nextState())));
            }
        }
    }
}
