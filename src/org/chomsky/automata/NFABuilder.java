/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Adds epsilon edges to the common builder:
 * <code>withEpsilonEdge(from, to)</code>.
 */
public final class NFABuilder extends AutomatonBuilder<NFA, NFABuilder> {

    private final List<String[]> epsilonEdges = new ArrayList<String[]>();

    public NFABuilder(String alphabet) {
        super(alphabet);
    }

    @Override
    NFABuilder self() {
        return this;
    }

    public NFABuilder withEpsilonEdge(String from, String to) {
        epsilonEdges.add(new String[] {from, to});
        return this;
    }

    @Override
    public NFA getResult() {
        checkStarted("NFA");
        NFA nfa = new NFA(alphabet, start, states.get(start));
        for (Map.Entry<String, Boolean> e : states.entrySet()) {
            if (!e.getKey().equals(start)) nfa.addState(e.getKey(), e.getValue());
        }
        for (Edge edge : edges) {
            nfa.addEdge(edge.from, edge.over.charAt(0), edge.to);
        }
        for (String[] edge : epsilonEdges) {
            nfa.addEpsilonEdge(edge[0], edge[1]);
        }
        return nfa;
    }
}
