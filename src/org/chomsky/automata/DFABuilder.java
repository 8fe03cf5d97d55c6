/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.Map;

public final class DFABuilder extends AutomatonBuilder<DFA, DFABuilder> {

    public DFABuilder(String alphabet) {
        super(alphabet);
    }

    @Override
    DFABuilder self() {
        return this;
    }

    @Override
    public DFA getResult() {
        checkStarted("DFA");
        DFA dfa = new DFA(alphabet, start, states.get(start));
        for (Map.Entry<String, Boolean> e : states.entrySet()) {
            if (!e.getKey().equals(start)) dfa.addState(e.getKey(), e.getValue());
        }
        for (Edge edge : edges) {
            dfa.addEdge(edge.from, edge.over.charAt(0), edge.to);
        }
        return dfa;
    }
}
