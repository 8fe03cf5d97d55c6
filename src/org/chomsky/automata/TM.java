/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Nondeterministic single tape Turing machine. The tape is bounded on the
 * left and grows to the right on demand, filled with {@link Alphabet#BLANK}.
 * There is at most one accepting state and it has no outgoing edges; a
 * branch rejects by having no edge to take.
 * <p>
 * Running a machine that loops on some input does not return.
 */
public final class TM extends Automaton<TMState> {

    /**
     * Head movement.
     */
    public enum Move {
        L, R
    }

    /**
     * An instantaneous description: state name, tape contents and head
     * position. Compared by value.
     */
    public static final class Configuration {

        final String state;
        final List<Character> tape;
        final int head;

        Configuration(String state, List<Character> tape, int head) {
            assert 0 <= head && head < tape.size();
            this.state = state;
            this.tape = Collections.unmodifiableList(tape);
            this.head = head;
        }

        public String state() {
            return state;
        }

        public List<Character> tape() {
            return tape;
        }

        public int head() {
            return head;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Configuration)) return false;
            Configuration other = (Configuration) obj;
            return head == other.head && state.equals(other.state)
                && tape.equals(other.tape);
        }

        @Override
        public int hashCode() {
            return (31 * state.hashCode() + tape.hashCode()) * 31 + head;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append('(').append(state).append(", ");
            for (int i = 0; i < tape.size(); ++i) {
                if (i == head) sb.append('[');
                sb.append(tape.get(i));
                if (i == head) sb.append(']');
            }
            return sb.append(')').toString();
        }
    }

    final Alphabet tapeAlphabet;

    /**
     * @param tapeAlphabet the work symbols; the input symbols are always on
     *        the tape alphabet too
     */
    public TM(Alphabet alphabet, Alphabet tapeAlphabet, String start) {
        super(alphabet, new TMState(start, false));
        if (tapeAlphabet == null) {
            throw new IllegalArgumentException("tape alphabet is null");
        }
        this.tapeAlphabet = alphabet.union(tapeAlphabet);
    }

    public TM(String alphabet, String tapeAlphabet, String start) {
        this(Alphabet.fromString(alphabet), Alphabet.fromString(tapeAlphabet),
            start);
    }

    public Alphabet tapeAlphabet() {
        return tapeAlphabet;
    }

    /**
     * @throws IllegalArgumentException when adding a second accepting state
     */
    public TMState addState(String name, boolean accepting) {
        if (accepting) checkNewAcceptState(name);
        TMState state = new TMState(name, accepting);
        insertState(state);
        return state;
    }

    /**
     * Adds non accepting states.
     */
    public void addStates(String... names) {
        for (String name : names) addState(name, false);
    }

    @Override
    public void setAccepting(String name, boolean accepting) {
        TMState state = stateFor(name);
        if (accepting && !state.isAccepting()) {
            checkNewAcceptState(name);
            if (state.hasEdges()) {
                throw new IllegalArgumentException(
                    "the accepting state cannot have outgoing edges: " + name);
            }
        }
        state.setAccepting(accepting);
    }

    private void checkNewAcceptState(String name) {
        TMState accept = acceptState();
        if (accept != null) {
            throw new IllegalArgumentException("cannot accept in " + name
                + ", " + accept.name() + " is already the accepting state");
        }
    }

    /**
     * @return the accepting state, or <code>null</code> if there is none
     */
    public TMState acceptState() {
        for (TMState state : states.values()) {
            if (state.isAccepting()) return state;
        }
        return null;
    }

    /**
     * Adds <code>from -read/write,move-&gt; to</code>. Both tape symbols may
     * be {@link Alphabet#BLANK}.
     */
    public void addEdge(String from, char read, char write, Move move,
            String to) {
        checkTapeSymbol(read);
        checkTapeSymbol(write);
        stateFor(to);
        TMState state = stateFor(from);
        if (state.isAccepting()) {
            throw new IllegalArgumentException(
                "the accepting state cannot have outgoing edges: " + from);
        }
        state.addEdge(read, new TMState.Edge(write, move, to));
    }

    public boolean removeEdge(String from, char read, char write, Move move,
            String to) {
        checkTapeSymbol(read);
        checkTapeSymbol(write);
        stateFor(to);
        return stateFor(from).removeEdge(read, new TMState.Edge(write, move, to));
    }

    private void checkTapeSymbol(char symbol) {
        if (symbol == Alphabet.EPSILON) {
            throw new IllegalArgumentException(
                "epsilon given where a tape symbol is required");
        }
        if (symbol != Alphabet.BLANK && !tapeAlphabet.contains(symbol)) {
            throw new IllegalArgumentException(
                "symbol not in tape alphabet " + tapeAlphabet + ": " + symbol);
        }
    }

    /**
     * Breadth first search of the configurations reachable from the input.
     * Does not return if some branch runs forever and none accepts.
     */
    @Override
    public boolean runString(CharSequence input) {
        checkInput(input);
        return new TMRunner(this).run(input);
    }

    @Override
    public TM copy() {
        TM tm = new TM(alphabet, tapeAlphabet, startState.name());
        tm.startState.setAccepting(startState.isAccepting());
        for (TMState state : states.values()) {
            if (state != startState) {
                tm.addState(state.name(), state.isAccepting());
            }
        }
        for (TMState state : states.values()) {
            for (Map.Entry<Character, Set<TMState.Edge>> e
                    : state.allEdges().entrySet()) {
                for (TMState.Edge edge : e.getValue()) {
                    tm.addEdge(state.name(), e.getKey(), edge.write, edge.move,
                        edge.to);
                }
            }
        }
        return tm;
    }

    @Override
    Iterable<TMState> successors(TMState state) {
        List<TMState> ret = new ArrayList<TMState>();
        for (Set<TMState.Edge> edges : state.allEdges().values()) {
            for (TMState.Edge edge : edges) ret.add(stateFor(edge.to));
        }
        return ret;
    }

    @Override
    void appendAlphabets(StringBuilder sb) {
        sb.append(INDENT).append("Tape Alphabet: ").append(tapeAlphabet)
            .append('\n');
    }

    @Override
    String machineType() {
        return "TM";
    }
}
