package org.trypticon.fstkit.algorithm;

import org.junit.Test;
import org.trypticon.fstkit.Arc;
import org.trypticon.fstkit.FstConfig;
import org.trypticon.fstkit.properties.FstProperties;
import org.trypticon.fstkit.vector.VectorFst;
import org.trypticon.fstkit.weight.TropicalWeight;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.trypticon.fstkit.TestFsts.addStates;
import static org.trypticon.fstkit.TestFsts.arc;
import static org.trypticon.fstkit.TestFsts.cycle;
import static org.trypticon.fstkit.TestFsts.empty;

/**
 * Tests for {@link DfsVisit} with {@link SccVisitor} and {@link TopOrderVisitor}.
 */
public class DfsVisitTests {
    private final FstConfig config = FstConfig.defaults();

    /**
     * {@code 0 <-> 1 -> 2}, with 2 final, and {@code 3 -> 2} unreachable.
     */
    private VectorFst<TropicalWeight> components() {
        VectorFst<TropicalWeight> fst = empty(config);
        addStates(fst, 4);
        fst.setStart(0);
        fst.addArc(0, arc(1, 1, 0f, 1));
        fst.addArc(1, arc(2, 2, 0f, 0));
        fst.addArc(1, arc(3, 3, 0f, 2));
        fst.addArc(3, arc(4, 4, 0f, 2));
        fst.setFinal(2, TropicalWeight.ONE);
        return fst;
    }

    @Test
    public void testScc() {
        VectorFst<TropicalWeight> fst = components();
        SccVisitor<TropicalWeight> visitor = new SccVisitor<>();
        DfsVisit.visit(fst, visitor, false);

        int[] scc = visitor.getScc();
        assertThat(visitor.getNumScc(), is(3));
        assertThat(scc[0], is(scc[1]));
        assertThat(scc[2], is(not(scc[0])));
        assertThat(scc[3], is(not(scc[0])));
        for (int s = 0; s < fst.numStates(); s++) {
            for (Arc<TropicalWeight> arc : fst.arcs(s)) {
                if (scc[s] != scc[arc.nextState()]) {
                    assertThat(scc[s], is(lessThan(scc[arc.nextState()])));
                }
            }
        }

        assertThat(visitor.getAccess(), is(new boolean[] { true, true, true, false }));
        assertThat(visitor.getCoaccess(), is(new boolean[] { true, true, true, true }));
        long props = visitor.getProperties();
        assertThat(props & (FstProperties.CYCLIC | FstProperties.ACYCLIC), is(FstProperties.CYCLIC));
        assertThat(props & (FstProperties.INITIAL_CYCLIC | FstProperties.INITIAL_ACYCLIC),
                is(FstProperties.INITIAL_CYCLIC));
        assertThat(props & (FstProperties.ACCESSIBLE | FstProperties.NOT_ACCESSIBLE),
                is(FstProperties.NOT_ACCESSIBLE));
        assertThat(props & (FstProperties.CO_ACCESSIBLE | FstProperties.NOT_CO_ACCESSIBLE),
                is(FstProperties.CO_ACCESSIBLE));
    }

    @Test
    public void testScc_AccessOnly() {
        SccVisitor<TropicalWeight> visitor = new SccVisitor<>();
        DfsVisit.visit(components(), visitor, true);
        assertThat(visitor.getAccess(), is(new boolean[] { true, true, true, false }));
        assertThat(visitor.getNumScc(), is(2));
    }

    @Test
    public void testTopOrder() {
        VectorFst<TropicalWeight> fst = empty(config);
        addStates(fst, 3);
        fst.setStart(0);
        fst.addArc(0, arc(1, 1, 0f, 2));
        fst.addArc(0, arc(2, 2, 0f, 1));
        fst.addArc(2, arc(3, 3, 0f, 1));
        TopOrderVisitor<TropicalWeight> visitor = new TopOrderVisitor<>();
        DfsVisit.visit(fst, visitor, false);
        assertThat(visitor.isAcyclic(), is(true));
        assertThat(visitor.getOrder(), is(new int[] { 0, 2, 1 }));
    }

    @Test
    public void testTopOrder_Cyclic() {
        TopOrderVisitor<TropicalWeight> visitor = new TopOrderVisitor<>();
        DfsVisit.visit(cycle(config), visitor, false);
        assertThat(visitor.isAcyclic(), is(false));
        assertThat(visitor.getOrder(), is(nullValue()));
    }

    @Test
    public void testEmpty() {
        TopOrderVisitor<TropicalWeight> visitor = new TopOrderVisitor<>();
        DfsVisit.visit(empty(config), visitor, false);
        assertThat(visitor.isAcyclic(), is(true));
        assertThat(visitor.getOrder(), is(new int[0]));
    }
}
