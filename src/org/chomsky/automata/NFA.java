/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Nondeterministic finite automaton with epsilon edges.
 */
public final class NFA extends Automaton<NFAState> {

    private static final Logger logger = Logger.getLogger("org.chomsky.automata");
    private static final Level level = Level.FINEST;

    public NFA(Alphabet alphabet, String start, boolean startAccepting) {
        super(alphabet, new NFAState(start, startAccepting));
    }

    public NFA(String alphabet, String start, boolean startAccepting) {
        this(Alphabet.fromString(alphabet), start, startAccepting);
    }

    public NFAState addState(String name, boolean accepting) {
        NFAState state = new NFAState(name, accepting);
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
     * @throws IllegalArgumentException for {@link Alphabet#EPSILON}; use
     *         {@link #addEpsilonEdge(String, String)}
     */
    public void addEdge(String from, char symbol, String to) {
        checkSymbol(symbol);
        stateFor(from).addArc(symbol, stateFor(to));
    }

    public void addEdges(String from, CharSequence symbols, String to) {
        for (int i = 0; i < symbols.length(); ++i) {
            addEdge(from, symbols.charAt(i), to);
        }
    }

    public void addEpsilonEdge(String from, String to) {
        stateFor(from).addEpsilonArc(stateFor(to));
    }

    /**
     * @return true iff the edge existed
     */
    public boolean removeEdge(String from, char symbol, String to) {
        checkSymbol(symbol);
        return stateFor(from).removeArc(symbol, stateFor(to));
    }

    public boolean removeEpsilonEdge(String from, String to) {
        return stateFor(from).removeEpsilonArc(stateFor(to));
    }

    /**
     * Any shape of NFA can be run.
     */
    public boolean isValid() {
        return true;
    }

    /**
     * The given states plus every state reachable from them over epsilon
     * edges alone.
     */
    public Set<NFAState> epsilonClosure(Collection<NFAState> states) {
        Set<NFAState> closure = new LinkedHashSet<NFAState>(states);
        LinkedList<NFAState> worklist = new LinkedList<NFAState>(states);
        while (!worklist.isEmpty()) {
            for (NFAState ns : worklist.removeFirst().epsilonTransitions()) {
                if (closure.add(ns)) worklist.addLast(ns);
            }
        }
        return closure;
    }

    @Override
    public boolean runString(CharSequence input) {
        checkInput(input);
        Set<NFAState> current =
            epsilonClosure(Collections.singleton(startState));
        for (int i = 0; i < input.length() && !current.isEmpty(); ++i) {
            Set<NFAState> next = new LinkedHashSet<NFAState>();
            for (NFAState state : current) {
                next.addAll(state.transitions(input.charAt(i)));
            }
            current = epsilonClosure(next);
        }
        if (logger.isLoggable(level)) {
            logger.log(level, "nfa run \"" + input + "\" ends in "
                + Misc.namesFrom(current));
        }
        for (NFAState state : current) {
            if (state.isAccepting()) return true;
        }
        return false;
    }

    /**
     * Subset construction.
     */
    public DFA toDFA() {
        return new SubsetConstruction(this, SubsetConstruction.ANY).construct();
    }

    public GNFA toGNFA() {
        return GNFA.fromNFA(this);
    }

    /**
     * @return a regular expression for the language, or <code>null</code> if
     *         the language is empty
     */
    public String toRegex() {
        return toGNFA().toRegex();
    }

    @Override
    public NFA copy() {
        return copyOver(alphabet);
    }

    /*
     * same structure, read over the superset alphabet sigma
     */
    NFA copyOver(Alphabet sigma) {
        return copyOver(sigma, "", new NFA(sigma,
            startState.name(), startState.isAccepting()));
    }

    /*
     * Copies every state and edge into target, prefixing names. The start
     * state is only copied when target does not have it already.
     */
    NFA copyOver(Alphabet sigma, String prefix, NFA target) {
        assert alphabet.isSubsetOf(sigma) && target.alphabet.equals(sigma);
        for (NFAState state : states.values()) {
            if (!target.hasState(prefix + state.name())) {
                target.addState(prefix + state.name(), state.isAccepting());
            }
        }
        for (NFAState state : states.values()) {
            String from = prefix + state.name();
            for (char c : state.symbols()) {
                for (NFAState ns : state.transitions(c)) {
                    target.addEdge(from, c, prefix + ns.name());
                }
            }
            for (NFAState ns : state.epsilonTransitions()) {
                target.addEpsilonEdge(from, prefix + ns.name());
            }
        }
        return target;
    }

    @Override
    Iterable<NFAState> successors(NFAState state) {
        return state.successors();
    }

    @Override
    String machineType() {
        return "NFA";
    }
}
