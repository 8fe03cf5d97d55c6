/*
 * @LICENSE@
 */

package org.chomsky.automata;

/**
 * Deterministic finite automaton. The machine is built incrementally; it is
 * <em>valid</em>, and may only be run, once every state has exactly one
 * outgoing edge per alphabet symbol.
 */
public final class DFA extends Automaton<DFAState> {

    public DFA(Alphabet alphabet, String start, boolean startAccepting) {
        super(alphabet, new DFAState(start, startAccepting));
    }

    public DFA(String alphabet, String start, boolean startAccepting) {
        this(Alphabet.fromString(alphabet), start, startAccepting);
    }

    public DFAState addState(String name, boolean accepting) {
        DFAState state = new DFAState(name, accepting);
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
     * Sets the successor of <code>from</code> on <code>symbol</code>,
     * replacing any previous one.
     */
    public void addEdge(String from, char symbol, String to) {
        checkSymbol(symbol);
        stateFor(from).putArc(symbol, stateFor(to));
    }

    public void addEdges(String from, CharSequence symbols, String to) {
        for (int i = 0; i < symbols.length(); ++i) {
            addEdge(from, symbols.charAt(i), to);
        }
    }

    /**
     * @return true iff there was an edge to remove
     */
    public boolean removeEdge(String from, char symbol) {
        checkSymbol(symbol);
        return stateFor(from).removeArc(symbol);
    }

    /**
     * @return true iff the transition function is total
     */
    public boolean isValid() {
        for (DFAState state : states.values()) {
            for (char c : alphabet) {
                if (state.transition(c) == null) return false;
            }
        }
        return true;
    }

    /**
     * @throws IllegalAutomatonStateException if the machine is not
     *         {@linkplain #isValid() valid}
     */
    @Override
    public boolean runString(CharSequence input) {
        if (!isValid()) {
            throw new IllegalAutomatonStateException(
                "cannot run a DFA whose transition function is not total");
        }
        checkInput(input);
        DFAState state = startState;
        for (int i = 0; i < input.length(); ++i) {
            state = state.transition(input.charAt(i));
        }
        return state.isAccepting();
    }

    /**
     * The same machine, seen as an NFA without epsilon edges.
     */
    public NFA toNFA() {
        return toNFA(alphabet);
    }

    NFA toNFA(Alphabet sigma) {
        assert alphabet.isSubsetOf(sigma);
        NFA nfa = new NFA(sigma, startState.name(), startState.isAccepting());
        for (DFAState state : states.values()) {
            if (state != startState) {
                nfa.addState(state.name(), state.isAccepting());
            }
        }
        for (DFAState state : states.values()) {
            for (char c : state.arcs().keySet()) {
                nfa.addEdge(state.name(), c, state.transition(c).name());
            }
        }
        return nfa;
    }

    public GNFA toGNFA() {
        return GNFA.fromNFA(toNFA());
    }

    /**
     * @return a regular expression for the language, or <code>null</code> if
     *         the language is empty
     */
    public String toRegex() {
        return toGNFA().toRegex();
    }

    @Override
    public DFA copy() {
        DFA dfa = new DFA(alphabet, startState.name(), startState.isAccepting());
        for (DFAState state : states.values()) {
            if (state != startState) {
                dfa.addState(state.name(), state.isAccepting());
            }
        }
        for (DFAState state : states.values()) {
            for (char c : state.arcs().keySet()) {
                dfa.addEdge(state.name(), c, state.transition(c).name());
            }
        }
        return dfa;
    }

    @Override
    Iterable<DFAState> successors(DFAState state) {
        return state.arcs().values();
    }

    @Override
    String machineType() {
        return "DFA";
    }
}
