package org.trypticon.fstkit.algorithm;

import org.junit.Test;
import org.trypticon.fstkit.FstConfig;
import org.trypticon.fstkit.properties.FstProperties;
import org.trypticon.fstkit.vector.VectorFst;
import org.trypticon.fstkit.weight.TropicalWeight;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;
import static org.trypticon.fstkit.TestFsts.arc;
import static org.trypticon.fstkit.TestFsts.assertSameStructure;
import static org.trypticon.fstkit.TestFsts.dag;
import static org.trypticon.fstkit.TestFsts.w;

/**
 * Tests for {@link StateSort}.
 */
public class StateSortTests {
    private final FstConfig config = FstConfig.defaults();

    @Test
    public void testReverse() {
        VectorFst<TropicalWeight> fst = dag(config);
        StateSort.stateSort(fst, new int[] { 2, 1, 0 });

        assertThat(fst.start(), is(2));
        assertThat(fst.arcs(2), is(List.of(arc(1, 1, 0f, 1), arc(3, 3, 0f, 0))));
        assertThat(fst.arcs(1), is(List.of(arc(2, 2, 0f, 0))));
        assertThat(fst.numArcs(0), is(0));
        assertThat(fst.finalWeight(0), is(TropicalWeight.ONE));
        assertThat(fst.finalWeight(2), is(TropicalWeight.ZERO));
    }

    @Test
    public void testIdentity() {
        VectorFst<TropicalWeight> fst = dag(config);
        VectorFst<TropicalWeight> before = VectorFst.copyOf(fst, config);
        StateSort.stateSort(fst, new int[] { 0, 1, 2 });
        assertSameStructure(before, fst);
    }

    @Test
    public void testKeepsIdFreeProperties() {
        VectorFst<TropicalWeight> fst = dag(config);
        fst.setFinal(1, w(0.5f));
        long before = fst.properties(FstProperties.TRINARY_PROPERTIES, true);
        StateSort.stateSort(fst, new int[] { 1, 2, 0 });

        long after = fst.properties(FstProperties.TRINARY_PROPERTIES, false);
        assertThat(after & FstProperties.ACCEPTOR, is(FstProperties.ACCEPTOR));
        assertThat(after & (FstProperties.ACYCLIC | FstProperties.ACCESSIBLE),
                is(before & (FstProperties.ACYCLIC | FstProperties.ACCESSIBLE)));
        assertThat(after & (FstProperties.TOP_SORTED | FstProperties.NOT_TOP_SORTED), is(0L));
        assertThat(FstProperties.compute(fst, 0) & FstProperties.knownProperties(after), is(after));
    }

    @Test
    public void testNotAPermutation() {
        VectorFst<TropicalWeight> fst = dag(config);
        assertThrows(IllegalArgumentException.class, () -> StateSort.stateSort(fst, new int[] { 0, 0, 1 }));
        assertThrows(IllegalArgumentException.class, () -> StateSort.stateSort(fst, new int[] { 0, 1 }));
        assertThrows(IllegalArgumentException.class, () -> StateSort.stateSort(fst, new int[] { 0, 1, 3 }));
        assertSameStructure(dag(config), fst);
    }
}
