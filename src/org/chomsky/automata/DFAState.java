/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A {@link DFA} state: at most one successor per symbol, exactly one when
 * the machine is valid.
 */
public final class DFAState extends State {

    private final Map<Character, DFAState> arcs =
        new LinkedHashMap<Character, DFAState>();

    DFAState(String name, boolean accepting) {
        super(name, accepting);
    }

    @Override
    public Kind kind() {
        return Kind.DFA;
    }

    /**
     * @return the successor on <code>symbol</code>, or <code>null</code>
     */
    public DFAState transition(char symbol) {
        return arcs.get(symbol);
    }

    public Map<Character, DFAState> arcs() {
        return Collections.unmodifiableMap(arcs);
    }

    void putArc(char symbol, DFAState ns) {
        arcs.put(symbol, ns);
    }

    boolean removeArc(char symbol) {
        return arcs.remove(symbol) != null;
    }

    @Override
    void appendTransitions(StringBuilder sb, String indent) {
        for (Map.Entry<Character, DFAState> e : arcs.entrySet()) {
            sb.append(indent).append(name()).append(" -");
            Misc.Esc.TXT.esc(sb, e.getKey());
            sb.append("-> ").append(e.getValue().name()).append('\n');
        }
    }
}
