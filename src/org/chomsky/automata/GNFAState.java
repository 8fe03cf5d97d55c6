/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A {@link GNFA} state. Edges are labeled with regular expressions, at most
 * one edge per ordered pair of states; incoming edges are mirrored so a state
 * can be ripped out without scanning the whole machine.
 */
public final class GNFAState extends State {

    private final Map<GNFAState, String> out =
        new LinkedHashMap<GNFAState, String>();
    private final Map<GNFAState, String> in =
        new LinkedHashMap<GNFAState, String>();

    GNFAState(String name, boolean accepting) {
        super(name, accepting);
    }

    @Override
    public Kind kind() {
        return Kind.GNFA;
    }

    /**
     * @return the label of the edge to <code>ns</code>, or <code>null</code>
     */
    public String label(GNFAState ns) {
        return out.get(ns);
    }

    public Map<GNFAState, String> outgoing() {
        return Collections.unmodifiableMap(out);
    }

    public Map<GNFAState, String> incoming() {
        return Collections.unmodifiableMap(in);
    }

    void putEdge(GNFAState ns, String regex) {
        out.put(ns, regex);
        ns.in.put(this, regex);
    }

    boolean removeEdge(GNFAState ns) {
        if (out.remove(ns) == null) return false;
        ns.in.remove(this);
        return true;
    }

    @Override
    void appendTransitions(StringBuilder sb, String indent) {
        for (Map.Entry<GNFAState, String> e : out.entrySet()) {
            sb.append(indent).append(name()).append(" -(")
                .append(e.getValue()).append(")-> ")
                .append(e.getKey().name()).append('\n');
        }
    }
}
