package org.trypticon.fstkit.algorithm;

import org.trypticon.fstkit.Arc;
import org.trypticon.fstkit.Fst;
import org.trypticon.fstkit.Weight;
import org.trypticon.fstkit.properties.FstProperties;

/**
 * Tarjan's strongly connected components, collecting along the way whether
 * the FST is cyclic, cyclic at its start state, accessible and coaccessible.
 * Components are numbered in topological order of the condensed graph.
 *
 * @param <W> the weight type.
 */
public class SccVisitor<W extends Weight> implements DfsVisitor<W> {

    private Fst<W> fst;
    private W zero;
    private int start;

    private int[] scc;
    private boolean[] access;
    private boolean[] coaccess;
    private int[] dfnumber;
    private int[] lowlink;
    private boolean[] onStack;
    private int[] stack;
    private int stackSize;
    private int numVisited;
    private int numScc;
    private long properties;

    @Override
    public void initVisit(Fst<W> fst) {
        this.fst = fst;
        this.zero = fst.arcType().zero();
        this.start = fst.start();
        int numStates = fst.numStates();
        scc = new int[numStates];
        access = new boolean[numStates];
        coaccess = new boolean[numStates];
        dfnumber = new int[numStates];
        lowlink = new int[numStates];
        onStack = new boolean[numStates];
        stack = new int[numStates];
        stackSize = 0;
        numVisited = 0;
        numScc = 0;
        properties = FstProperties.ACYCLIC | FstProperties.INITIAL_ACYCLIC
                | FstProperties.ACCESSIBLE | FstProperties.CO_ACCESSIBLE;
    }

    @Override
    public boolean initState(int state, int root) {
        stack[stackSize++] = state;
        dfnumber[state] = numVisited;
        lowlink[state] = numVisited;
        onStack[state] = true;
        if (root == start) {
            access[state] = true;
        } else {
            properties = (properties | FstProperties.NOT_ACCESSIBLE) & ~FstProperties.ACCESSIBLE;
        }
        numVisited++;
        return true;
    }

    @Override
    public boolean treeArc(int state, Arc<W> arc) {
        return true;
    }

    @Override
    public boolean backArc(int state, Arc<W> arc) {
        int next = arc.nextState();
        if (dfnumber[next] < lowlink[state]) {
            lowlink[state] = dfnumber[next];
        }
        if (coaccess[next]) {
            coaccess[state] = true;
        }
        properties = (properties | FstProperties.CYCLIC) & ~FstProperties.ACYCLIC;
        if (next == start) {
            properties = (properties | FstProperties.INITIAL_CYCLIC) & ~FstProperties.INITIAL_ACYCLIC;
        }
        return true;
    }

    @Override
    public boolean forwardOrCrossArc(int state, Arc<W> arc) {
        int next = arc.nextState();
        if (dfnumber[next] < dfnumber[state] && onStack[next] && dfnumber[next] < lowlink[state]) {
            lowlink[state] = dfnumber[next];
        }
        if (coaccess[next]) {
            coaccess[state] = true;
        }
        return true;
    }

    @Override
    public void finishState(int state, int parent) {
        if (!fst.finalWeight(state).equals(zero)) {
            coaccess[state] = true;
        }
        if (dfnumber[state] == lowlink[state]) {
            // state is the root of a component; everything above it on the stack belongs to it
            boolean sccCoaccess = false;
            int i = stackSize;
            int t;
            do {
                t = stack[--i];
                if (coaccess[t]) {
                    sccCoaccess = true;
                }
            } while (t != state);
            do {
                t = stack[--stackSize];
                scc[t] = numScc;
                if (sccCoaccess) {
                    coaccess[t] = true;
                }
                onStack[t] = false;
            } while (t != state);
            if (!sccCoaccess) {
                properties = (properties | FstProperties.NOT_CO_ACCESSIBLE) & ~FstProperties.CO_ACCESSIBLE;
            }
            numScc++;
        }
        if (parent != Fst.NO_STATE_ID) {
            if (coaccess[state]) {
                coaccess[parent] = true;
            }
            if (lowlink[state] < lowlink[parent]) {
                lowlink[parent] = lowlink[state];
            }
        }
    }

    @Override
    public void finishVisit() {
        for (int s = 0; s < scc.length; s++) {
            scc[s] = numScc - 1 - scc[s];
        }
        fst = null;
    }

    /**
     * Gets the DFS-derived properties, see {@link FstProperties#DFS_PROPERTIES}.
     *
     * @return the properties.
     */
    public long getProperties() {
        return properties;
    }

    /**
     * Gets the component of each state.
     *
     * @return the component numbers, indexed by state.
     */
    public int[] getScc() {
        return scc;
    }

    public boolean[] getAccess() {
        return access;
    }

    public boolean[] getCoaccess() {
        return coaccess;
    }

    public int getNumScc() {
        return numScc;
    }
}
