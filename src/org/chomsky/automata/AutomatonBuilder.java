/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects states and edges, then builds the machine in one go. The first
 * state added becomes the start state. Edges read naturally when chained:
 * <pre>
 * new DFABuilder("ab")
 *     .withNotFinalStates("q0", "q1")
 *     .withFinalStates("q2")
 *     .withEdges().from("q0").to("q1").over("a")
 *     .withEdges().from("q0").toSelf().over("b")
 *     ...
 *     .getResult();
 * </pre>
 *
 * @param <T> the machine built
 * @param <B> the concrete builder, returned from every chaining method
 */
public abstract class AutomatonBuilder<T extends Automaton<?>, B extends AutomatonBuilder<T, B>> {

    static final class Edge {
        final String from;
        final String over;
        final String to;

        Edge(String from, String over, String to) {
            this.from = from;
            this.over = over;
            this.to = to;
        }
    }

    final String alphabet;
    final Map<String, Boolean> states = new LinkedHashMap<String, Boolean>();
    final List<Edge> edges = new ArrayList<Edge>();
    String start;

    AutomatonBuilder(String alphabet) {
        this.alphabet = alphabet;
    }

    abstract B self();

    /**
     * Builds a new machine from everything added so far.
     *
     * @throws IllegalArgumentException if no state was added, or the machine
     *         rejects one of the states or edges
     */
    public abstract T getResult();

    public B addState(String name, boolean accepting) {
        if (start == null) start = name;
        states.put(name, accepting);
        return self();
    }

    public B withNotFinalStates(String... names) {
        for (String name : names) addState(name, false);
        return self();
    }

    public B withFinalStates(String... names) {
        for (String name : names) addState(name, true);
        return self();
    }

    /**
     * @param over a single symbol
     */
    public B addEdge(String from, String over, String to) {
        if (over.length() != 1) {
            throw new IllegalArgumentException(
                "an edge reads exactly one symbol: " + over);
        }
        if (over.charAt(0) == Alphabet.EPSILON) {
            throw new IllegalArgumentException(
                "epsilon edges need a dedicated method: " + from + " -> " + to);
        }
        edges.add(new Edge(from, over, to));
        return self();
    }

    /*
     * one edge per symbol; machines with wider labels split differently
     */
    void addEdges(String from, String symbols, String to) {
        for (int i = 0; i < symbols.length(); ++i) {
            addEdge(from, symbols.substring(i, i + 1), to);
        }
    }

    public From withEdges() {
        return new From();
    }

    final void checkStarted(String machine) {
        if (start == null) {
            throw new IllegalArgumentException(
                "cannot build a " + machine + " without any states");
        }
    }

    public final class From {
        private From() {}

        public To from(String from) {
            return new To(from);
        }
    }

    public final class To {
        private final String from;

        private To(String from) {
            this.from = from;
        }

        public Over to(String to) {
            return new Over(from, to);
        }

        public Over toSelf() {
            return new Over(from, from);
        }
    }

    public class Over {
        final String from;
        final String to;

        Over(String from, String to) {
            this.from = from;
            this.to = to;
        }

        public B over(String symbols) {
            addEdges(from, symbols, to);
            return self();
        }
    }
}
