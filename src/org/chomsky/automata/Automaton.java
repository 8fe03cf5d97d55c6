/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.chomsky.automata.Misc.BreadthFirstVisitor;

/**
 * Common base of the machines: a name to state table kept in insertion order,
 * an input {@link Alphabet} and a start state. Accepting states are derived
 * from the states' flags. Every state an edge refers to is in the table.
 *
 * @param <S> the state variant of the machine
 */
public abstract class Automaton<S extends State> {

    /**
     * Thrown when a machine is asked to do something its current shape does
     * not support, such as running a {@link DFA} whose transition function
     * is not total.
     */
    public static final class IllegalAutomatonStateException
            extends IllegalStateException {

        private static final long serialVersionUID = 1L;

        public IllegalAutomatonStateException(String msg) {
            super(msg);
        }
    }

    static final String INDENT = "\t";

    final Alphabet alphabet;
    final Map<String, S> states = new LinkedHashMap<String, S>();
    final S startState;

    Automaton(Alphabet alphabet, S startState) {
        if (alphabet == null) {
            throw new IllegalArgumentException("alphabet is null");
        }
        this.alphabet = alphabet;
        this.startState = startState;
        insertState(startState);
    }

    public final Alphabet alphabet() {
        return alphabet;
    }

    public final S startState() {
        return startState;
    }

    /**
     * @return the state called <code>name</code>, or <code>null</code>
     */
    public final S getState(String name) {
        return states.get(name);
    }

    public final boolean hasState(String name) {
        return states.containsKey(name);
    }

    /**
     * All states, in the order they were added.
     */
    public final Collection<S> states() {
        return Collections.unmodifiableCollection(states.values());
    }

    public final int size() {
        return states.size();
    }

    public final Set<S> acceptStates() {
        Set<S> ret = new LinkedHashSet<S>();
        for (S state : states.values()) {
            if (state.isAccepting()) ret.add(state);
        }
        return ret;
    }

    public void setAccepting(String name, boolean accepting) {
        stateFor(name).setAccepting(accepting);
    }

    /**
     * States reachable from the start state, start first, in breadth first
     * discovery order.
     */
    public final Set<S> reachableStates() {
        return new BreadthFirstVisitor<S>() {
            @Override
            protected Iterable<S> successors(S state) {
                return Automaton.this.successors(state);
            }
        }.start(startState).visited();
    }

    /**
     * @return true iff the machine accepts <code>input</code>
     * @throws IllegalArgumentException if <code>input</code> holds a symbol
     *         outside the alphabet
     */
    public abstract boolean runString(CharSequence input);

    /**
     * A structure preserving clone sharing nothing mutable with this one.
     */
    public abstract Automaton<S> copy();

    abstract Iterable<S> successors(S state);

    abstract String machineType();

    final S stateFor(String name) {
        S state = states.get(name);
        if (state == null) {
            throw new IllegalArgumentException("no such state: " + name);
        }
        return state;
    }

    void insertState(S state) {
        if (states.containsKey(state.name())) {
            throw new IllegalArgumentException(
                "duplicate state: " + state.name());
        }
        states.put(state.name(), state);
    }

    /*
     * a concrete symbol of the input alphabet
     */
    final void checkSymbol(char symbol) {
        if (symbol == Alphabet.EPSILON) {
            throw new IllegalArgumentException(
                "epsilon given where a symbol is required");
        }
        if (!alphabet.contains(symbol)) {
            throw new IllegalArgumentException(
                "symbol not in alphabet " + alphabet + ": " + symbol);
        }
    }

    final void checkInput(CharSequence input) {
        for (int i = 0; i < input.length(); ++i) {
            checkSymbol(input.charAt(i));
        }
    }

    /*
     * extra header lines (stack or tape alphabets)
     */
    void appendAlphabets(StringBuilder sb) {}

    /**
     * The printable form: alphabet, states, start, accepting states and
     * transitions, tab indented, one item per line.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(machineType()).append(": {").append('\n');
        sb.append(INDENT).append("Alphabet: ").append(alphabet).append('\n');
        appendAlphabets(sb);
        sb.append(INDENT).append("States: ")
            .append(Misc.namesFrom(states.values())).append('\n');
        sb.append(INDENT).append("Starting State: ")
            .append(startState.name()).append('\n');
        sb.append(INDENT).append("Accepting States: ")
            .append(Misc.namesFrom(acceptStates())).append('\n');
        sb.append(INDENT).append("Transitions:").append('\n');
        for (S state : states.values()) {
            state.appendTransitions(sb, INDENT + INDENT);
        }
        sb.append('}');
        return sb.toString();
    }
}
