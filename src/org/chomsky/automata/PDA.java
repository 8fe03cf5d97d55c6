/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Nondeterministic pushdown automaton. Every edge reads an input symbol or
 * epsilon, optionally pops a required stack top and optionally pushes one
 * symbol. A string is accepted when some run consumes all of it and ends in
 * an accepting state; what is left on the stack does not matter.
 */
public final class PDA extends Automaton<PDAState> {

    /**
     * An instantaneous description: a state name and the stack, bottom
     * first. Compared by value.
     */
    public static final class Configuration {

        final String state;
        final List<Character> stack;

        /**
         * @param stack the stack symbols, bottom first
         */
        public Configuration(String state, CharSequence stack) {
            this(state, listFrom(stack));
        }

        Configuration(String state, List<Character> stack) {
            this.state = state;
            this.stack = Collections.unmodifiableList(stack);
        }

        private static List<Character> listFrom(CharSequence cs) {
            List<Character> ret = new ArrayList<Character>(cs.length());
            for (int i = 0; i < cs.length(); ++i) ret.add(cs.charAt(i));
            return ret;
        }

        public String state() {
            return state;
        }

        public List<Character> stack() {
            return stack;
        }

        /**
         * @return the top of the stack, or {@link Alphabet#EPSILON} when
         *         it is empty
         */
        public char top() {
            return stack.isEmpty() ? Alphabet.EPSILON : stack.get(stack.size() - 1);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Configuration)) return false;
            Configuration other = (Configuration) obj;
            return state.equals(other.state) && stack.equals(other.stack);
        }

        @Override
        public int hashCode() {
            return 31 * state.hashCode() + stack.hashCode();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append('(').append(state).append(", ");
            for (char c : stack) sb.append(c);
            return sb.append(')').toString();
        }
    }

    final Alphabet stackAlphabet;

    public PDA(Alphabet alphabet, Alphabet stackAlphabet, String start,
            boolean startAccepting) {
        super(alphabet, new PDAState(start, startAccepting));
        if (stackAlphabet == null) {
            throw new IllegalArgumentException("stack alphabet is null");
        }
        this.stackAlphabet = stackAlphabet;
    }

    public PDA(String alphabet, String stackAlphabet, String start,
            boolean startAccepting) {
        this(Alphabet.fromString(alphabet), Alphabet.fromString(stackAlphabet),
            start, startAccepting);
    }

    public Alphabet stackAlphabet() {
        return stackAlphabet;
    }

    public PDAState addState(String name, boolean accepting) {
        PDAState state = new PDAState(name, accepting);
        insertState(state);
        return state;
    }

    /**
     * Adds non accepting states.
     */
    public void addStates(String... names) {
        for (String name : names) addState(name, false);
    }

    /**
     * Adds the edge <code>from -input,pop/push-&gt; to</code>. Any of the
     * three symbols may be {@link Alphabet#EPSILON}.
     */
    public void addEdge(String from, char input, char pop, char push, String to) {
        checkEdge(input, pop, push);
        stateFor(to);
        stateFor(from).addEdge(input, new PDAState.Edge(pop, push, to));
    }

    public boolean removeEdge(String from, char input, char pop, char push,
            String to) {
        checkEdge(input, pop, push);
        stateFor(to);
        return stateFor(from).removeEdge(input, new PDAState.Edge(pop, push, to));
    }

    private void checkEdge(char input, char pop, char push) {
        if (input != Alphabet.EPSILON) checkSymbol(input);
        checkStackSymbol(pop);
        checkStackSymbol(push);
    }

    private void checkStackSymbol(char symbol) {
        if (symbol != Alphabet.EPSILON && !stackAlphabet.contains(symbol)) {
            throw new IllegalArgumentException(
                "symbol not in stack alphabet " + stackAlphabet + ": " + symbol);
        }
    }

    /**
     * The configurations reachable from <code>configurations</code> over
     * epsilon-input edges alone, the given ones included.
     */
    public Set<Configuration> epsilonClosure(
            Collection<Configuration> configurations) {
        return new PDARunner(this).epsilonClosure(configurations);
    }

    @Override
    public boolean runString(CharSequence input) {
        checkInput(input);
        return new PDARunner(this).run(input);
    }

    @Override
    public PDA copy() {
        PDA pda = new PDA(alphabet, stackAlphabet, startState.name(),
            startState.isAccepting());
        for (PDAState state : states.values()) {
            if (state != startState) {
                pda.addState(state.name(), state.isAccepting());
            }
        }
        for (PDAState state : states.values()) {
            for (Map.Entry<Character, Set<PDAState.Edge>> e
                    : state.allEdges().entrySet()) {
                for (PDAState.Edge edge : e.getValue()) {
                    pda.addEdge(state.name(), e.getKey(), edge.pop, edge.push,
                        edge.to);
                }
            }
        }
        return pda;
    }

    @Override
    Iterable<PDAState> successors(PDAState state) {
        List<PDAState> ret = new ArrayList<PDAState>();
        for (Set<PDAState.Edge> edges : state.allEdges().values()) {
            for (PDAState.Edge edge : edges) ret.add(stateFor(edge.to));
        }
        return ret;
    }

    @Override
    void appendAlphabets(StringBuilder sb) {
        sb.append(INDENT).append("Stack Alphabet: ").append(stackAlphabet)
            .append('\n');
    }

    @Override
    String machineType() {
        return "PDA";
    }
}
