/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * An {@link NFA} state: any number of successors per symbol plus a set of
 * epsilon successors.
 */
public final class NFAState extends State {

    private final Map<Character, Set<NFAState>> arcs =
        new LinkedHashMap<Character, Set<NFAState>>();
    private final Set<NFAState> epsilonArcs = new LinkedHashSet<NFAState>();

    NFAState(String name, boolean accepting) {
        super(name, accepting);
    }

    @Override
    public Kind kind() {
        return Kind.NFA;
    }

    /**
     * @return the (possibly empty) successors on <code>symbol</code>
     */
    public Set<NFAState> transitions(char symbol) {
        Set<NFAState> ns = arcs.get(symbol);
        return ns == null ?
            Collections.<NFAState>emptySet() : Collections.unmodifiableSet(ns);
    }

    public Set<NFAState> epsilonTransitions() {
        return Collections.unmodifiableSet(epsilonArcs);
    }

    /**
     * Symbols with at least one outgoing edge, in insertion order.
     */
    public Set<Character> symbols() {
        return Collections.unmodifiableSet(arcs.keySet());
    }

    /*
     * every successor, epsilon or not
     */
    Set<NFAState> successors() {
        Set<NFAState> ret = new LinkedHashSet<NFAState>();
        for (Set<NFAState> ns : arcs.values()) ret.addAll(ns);
        ret.addAll(epsilonArcs);
        return ret;
    }

    boolean addArc(char symbol, NFAState ns) {
        Set<NFAState> set = arcs.get(symbol);
        if (set == null) {
            arcs.put(symbol, set = new LinkedHashSet<NFAState>());
        }
        return set.add(ns);
    }

    boolean removeArc(char symbol, NFAState ns) {
        Set<NFAState> set = arcs.get(symbol);
        if (set == null || !set.remove(ns)) return false;
        if (set.isEmpty()) arcs.remove(symbol);
        return true;
    }

    boolean addEpsilonArc(NFAState ns) {
        return epsilonArcs.add(ns);
    }

    boolean removeEpsilonArc(NFAState ns) {
        return epsilonArcs.remove(ns);
    }

    @Override
    void appendTransitions(StringBuilder sb, String indent) {
        for (Map.Entry<Character, Set<NFAState>> e : arcs.entrySet()) {
            for (NFAState ns : e.getValue()) {
                sb.append(indent).append(name()).append(" -");
                Misc.Esc.TXT.esc(sb, e.getKey());
                sb.append("-> ").append(ns.name()).append('\n');
            }
        }
        for (NFAState ns : epsilonArcs) {
            sb.append(indent).append(name()).append(" -")
                .append(Alphabet.EPSILON).append("-> ")
                .append(ns.name()).append('\n');
        }
    }
}
