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
 * A {@link PDA} state: input symbol (possibly {@link Alphabet#EPSILON}) to
 * a set of stack-guarded {@link Edge}s.
 */
public final class PDAState extends State {

    /**
     * Pop <code>pop</code>, push <code>push</code> and go to
     * <code>to</code>. Either stack symbol may be {@link Alphabet#EPSILON},
     * meaning "don't". Compared by value.
     */
    public static final class Edge {

        final char pop;
        final char push;
        final String to;

        Edge(char pop, char push, String to) {
            this.pop = pop;
            this.push = push;
            this.to = to;
        }

        public char pop() {
            return pop;
        }

        public char push() {
            return push;
        }

        public String to() {
            return to;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Edge)) return false;
            Edge other = (Edge) obj;
            return pop == other.pop && push == other.push
                && to.equals(other.to);
        }

        @Override
        public int hashCode() {
            return (31 * pop + push) * 31 + to.hashCode();
        }

        @Override
        public String toString() {
            return pop + "/" + push + "->" + to;
        }
    }

    private final Map<Character, Set<Edge>> edges =
        new LinkedHashMap<Character, Set<Edge>>();

    PDAState(String name, boolean accepting) {
        super(name, accepting);
    }

    @Override
    public Kind kind() {
        return Kind.PDA;
    }

    /**
     * @return the (possibly empty) edges taken on <code>input</code>
     */
    public Set<Edge> edges(char input) {
        Set<Edge> set = edges.get(input);
        return set == null ?
            Collections.<Edge>emptySet() : Collections.unmodifiableSet(set);
    }

    Map<Character, Set<Edge>> allEdges() {
        return edges;
    }

    boolean addEdge(char input, Edge edge) {
        Set<Edge> set = edges.get(input);
        if (set == null) {
            edges.put(input, set = new LinkedHashSet<Edge>());
        }
        return set.add(edge);
    }

    boolean removeEdge(char input, Edge edge) {
        Set<Edge> set = edges.get(input);
        if (set == null || !set.remove(edge)) return false;
        if (set.isEmpty()) edges.remove(input);
        return true;
    }

    @Override
    void appendTransitions(StringBuilder sb, String indent) {
        for (Map.Entry<Character, Set<Edge>> e : edges.entrySet()) {
            for (Edge edge : e.getValue()) {
                sb.append(indent).append(name()).append(" -");
                Misc.Esc.TXT.esc(sb, e.getKey());
                sb.append(',');
                Misc.Esc.TXT.esc(sb, edge.pop);
                sb.append('/');
                Misc.Esc.TXT.esc(sb, edge.push);
                sb.append("-> ").append(edge.to).append('\n');
            }
        }
    }
}
