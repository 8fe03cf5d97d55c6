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
 * A {@link TM} state: tape symbol read (possibly {@link Alphabet#BLANK}) to a
 * set of {@link Edge}s.
 */
public final class TMState extends State {

    /**
     * Write <code>write</code>, move the head, go to <code>to</code>.
     * Compared by value.
     */
    public static final class Edge {

        final char write;
        final TM.Move move;
        final String to;

        Edge(char write, TM.Move move, String to) {
            this.write = write;
            this.move = move;
            this.to = to;
        }

        public char write() {
            return write;
        }

        public TM.Move move() {
            return move;
        }

        public String to() {
            return to;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Edge)) return false;
            Edge other = (Edge) obj;
            return write == other.write && move == other.move
                && to.equals(other.to);
        }

        @Override
        public int hashCode() {
            return (31 * write + move.hashCode()) * 31 + to.hashCode();
        }

        @Override
        public String toString() {
            return write + "," + move + "->" + to;
        }
    }

    private final Map<Character, Set<Edge>> edges =
        new LinkedHashMap<Character, Set<Edge>>();

    TMState(String name, boolean accepting) {
        super(name, accepting);
    }

    @Override
    public Kind kind() {
        return Kind.TM;
    }

    /**
     * @return the (possibly empty) edges taken when <code>read</code> is
     *         under the head
     */
    public Set<Edge> edges(char read) {
        Set<Edge> set = edges.get(read);
        return set == null ?
            Collections.<Edge>emptySet() : Collections.unmodifiableSet(set);
    }

    Map<Character, Set<Edge>> allEdges() {
        return edges;
    }

    boolean hasEdges() {
        return !edges.isEmpty();
    }

    boolean addEdge(char read, Edge edge) {
        Set<Edge> set = edges.get(read);
        if (set == null) {
            edges.put(read, set = new LinkedHashSet<Edge>());
        }
        return set.add(edge);
    }

    boolean removeEdge(char read, Edge edge) {
        Set<Edge> set = edges.get(read);
        if (set == null || !set.remove(edge)) return false;
        if (set.isEmpty()) edges.remove(read);
        return true;
    }

    @Override
    void appendTransitions(StringBuilder sb, String indent) {
        for (Map.Entry<Character, Set<Edge>> e : edges.entrySet()) {
            for (Edge edge : e.getValue()) {
                sb.append(indent).append(name()).append(" -");
                Misc.Esc.TXT.esc(sb, e.getKey());
                sb.append('/');
                Misc.Esc.TXT.esc(sb, edge.write);
                sb.append(',').append(edge.move).append("-> ")
                    .append(edge.to).append('\n');
            }
        }
    }
}
