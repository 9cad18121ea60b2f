package org.trypticon.fstkit.algorithm;

import org.trypticon.fstkit.MutableFst;
import org.trypticon.fstkit.MutableFstClass;
import org.trypticon.fstkit.Weight;
import org.trypticon.fstkit.properties.FstProperties;

import javax.annotation.Nonnull;

/**
 * Topological sort of the states of an FST.
 */
public final class TopSort {
    private TopSort() {} // no instance

    private static final String COMPONENT = "TopSort";

    private static final long ACYCLIC_PROPERTIES =
            FstProperties.ACYCLIC | FstProperties.INITIAL_ACYCLIC | FstProperties.TOP_SORTED;

    private static final long CYCLIC_PROPERTIES = FstProperties.CYCLIC | FstProperties.NOT_TOP_SORTED;

    /**
     * Renumbers the states so that every arc leads from a lower state id to a higher one.
     * If the FST has a cycle, nothing is renumbered.
     *
     * @param fst the FST.
     * @param <W> the weight type.
     * @return {@code true} if the FST was acyclic and has been sorted.
     */
    public static <W extends Weight> boolean topSort(@Nonnull MutableFst<W> fst) {
        TopOrderVisitor<W> visitor = new TopOrderVisitor<>();
        DfsVisit.visit(fst, visitor, false);
        if (visitor.isAcyclic()) {
            StateSort.stateSort(fst, visitor.getOrder());
            fst.setProperties(ACYCLIC_PROPERTIES, ACYCLIC_PROPERTIES | FstProperties.CYCLIC
                    | FstProperties.INITIAL_CYCLIC | FstProperties.NOT_TOP_SORTED);
            return true;
        } else {
            fst.setProperties(CYCLIC_PROPERTIES, CYCLIC_PROPERTIES | FstProperties.ACYCLIC
                    | FstProperties.TOP_SORTED);
            return false;
        }
    }

    /**
     * Sorts the FST behind a handle, reporting a cyclic FST to the handle's info stream.
     *
     * @param fst the handle.
     * @return {@code true} if the FST was acyclic and has been sorted.
     */
    public static boolean topSort(@Nonnull MutableFstClass fst) {
        boolean acyclic = topSort(fst.getMutableFst());
        if (!acyclic) {
            fst.getConfig().getInfoStream().message(COMPONENT, "Input FST is cyclic");
        }
        return acyclic;
    }
}
