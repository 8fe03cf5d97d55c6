/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Generalized nondeterministic finite automaton: edges carry regular
 * expressions in the regular core of {@link java.util.regex.Pattern} syntax
 * (see {@link LabelParser}), and there is
 * exactly one start and one final state. The start state has no incoming
 * edges, the final state no outgoing ones, and neither can be removed.
 * <p>
 * Ripping out every other state (state elimination) leaves a single edge
 * from start to final whose label is a regular expression for the language.
 * Ripping state <i>r</i> with self-loop <i>C</i> replaces each path
 * <i>p</i> -<i>A</i>-&gt; <i>r</i> -<i>B</i>-&gt; <i>q</i> by an edge
 * <i>p</i> -(<i>A</i>)(<i>C</i>)*(<i>B</i>)-&gt; <i>q</i>, alternated with
 * any label <i>p</i> -&gt; <i>q</i> had before. The star is only written when
 * <i>r</i> has a self-loop, and empty labels stand for the empty string and
 * are left out of the concatenation.
 */
public final class GNFA extends Automaton<GNFAState> {

    private static final Logger logger = Logger.getLogger("org.chomsky.automata");
    private static final Level level = Level.FINEST;

    private static final String START = "gnfa-start";
    private static final String FINAL = "gnfa-final";

    private final GNFAState finalState;

    public GNFA(Alphabet alphabet, String start, String finalName) {
        super(alphabet, new GNFAState(start, false));
        finalState = new GNFAState(finalName, true);
        insertState(finalState);
    }

    public GNFA(String alphabet, String start, String finalName) {
        this(Alphabet.fromString(alphabet), start, finalName);
    }

    /**
     * The standard construction: a new start state with an epsilon edge to
     * the NFA's start, epsilon edges from every accepting state to a new
     * final state, and symbol edges between the same two states merged
     * into one alternation.
     */
    public static GNFA fromNFA(NFA nfa) {
        String start = freshName(START, nfa);
        String fin = freshName(FINAL, nfa);
        GNFA gnfa = new GNFA(nfa.alphabet(), start, fin);
        for (NFAState state : nfa.states()) {
            gnfa.addState(state.name());
        }
        gnfa.addEdge(start, nfa.startState().name(), "");
        for (NFAState state : nfa.states()) {
            for (char c : state.symbols()) {
                for (NFAState ns : state.transitions(c)) {
                    gnfa.addEdge(state.name(), ns.name(), Misc.Esc.RXP.esc(c));
                }
            }
            for (NFAState ns : state.epsilonTransitions()) {
                gnfa.addEdge(state.name(), ns.name(), "");
            }
            if (state.isAccepting()) {
                gnfa.addEdge(state.name(), fin, "");
            }
        }
        return gnfa;
    }

    private static String freshName(String base, Automaton<?> taken) {
        String name = base;
        while (taken.hasState(name)) name += '\'';
        return name;
    }

    public GNFAState finalState() {
        return finalState;
    }

    /**
     * Adds a non accepting, interior state.
     */
    public GNFAState addState(String name) {
        GNFAState state = new GNFAState(name, false);
        insertState(state);
        return state;
    }

    /**
     * Only the final state accepts.
     *
     * @throws IllegalArgumentException always
     */
    @Override
    public void setAccepting(String name, boolean accepting) {
        throw new IllegalArgumentException(
            "a GNFA accepts in its final state only");
    }

    /**
     * Adds an edge labeled <code>regex</code>, or alternates
     * <code>regex</code> into the existing label. Both <code>""</code> and
     * <code>"ε"</code> label an epsilon edge.
     *
     * @throws IllegalArgumentException for an edge into the start state, out
     *         of the final state, or a malformed regex
     */
    public void addEdge(String from, String to, String regex) {
        GNFAState p = stateFor(from);
        GNFAState q = stateFor(to);
        if (q == startState) {
            throw new IllegalArgumentException(
                "no edge may enter the start state: " + from + " -> " + to);
        }
        if (p == finalState) {
            throw new IllegalArgumentException(
                "no edge may leave the final state: " + from + " -> " + to);
        }
        String label = String.valueOf(Alphabet.EPSILON).equals(regex) ?
            "" : regex;
        LabelParser.check(label, alphabet); // PatternSyntaxException is an IAE
        merge(p, q, label);
    }

    /**
     * @return the label from <code>from</code> to <code>to</code>, or
     *         <code>null</code> if there is no edge
     */
    public String getEdge(String from, String to) {
        return stateFor(from).label(stateFor(to));
    }

    public boolean removeEdge(String from, String to) {
        return stateFor(from).removeEdge(stateFor(to));
    }

    private static void merge(GNFAState p, GNFAState q, String regex) {
        String existing = p.label(q);
        p.putEdge(q, existing == null ? regex : existing + '|' + regex);
    }

    private static String group(String regex) {
        return regex.isEmpty() ? "" : "(" + regex + ")";
    }

    private static String star(String regex) {
        return regex == null || regex.isEmpty() ? "" : "(" + regex + ")*";
    }

    /**
     * Removes an interior state, rerouting every path through it.
     *
     * @throws IllegalArgumentException for the start or final state
     */
    public void ripState(String name) {
        GNFAState r = stateFor(name);
        if (r == startState || r == finalState) {
            throw new IllegalArgumentException(
                "cannot rip the start or final state: " + name);
        }
        String loop = star(r.label(r));
        Map<GNFAState, String> in = new LinkedHashMap<GNFAState, String>(r.incoming());
        Map<GNFAState, String> out = new LinkedHashMap<GNFAState, String>(r.outgoing());
        in.remove(r);
        out.remove(r);

        for (Map.Entry<GNFAState, String> a : in.entrySet()) {
            for (Map.Entry<GNFAState, String> b : out.entrySet()) {
                merge(a.getKey(), b.getKey(),
                    group(a.getValue()) + loop + group(b.getValue()));
            }
        }
        for (GNFAState p : in.keySet()) p.removeEdge(r);
        for (GNFAState q : out.keySet()) r.removeEdge(q);
        r.removeEdge(r);
        states.remove(name);

        if (logger.isLoggable(level)) {
            logger.log(level, "ripped " + name + ": " + in.size() + " in x "
                + out.size() + " out, " + states.size() + " states left");
        }
    }

    /**
     * Eliminates every interior state of a copy of this machine.
     *
     * @return the regex from start to final, or <code>null</code> when no
     *         string is accepted
     */
    public String toRegex() {
        GNFA gnfa = copy();
        List<String> interior = new ArrayList<String>();
        for (GNFAState state : gnfa.states()) {
            if (state != gnfa.startState && state != gnfa.finalState) {
                interior.add(state.name());
            }
        }
        for (String name : interior) {
            gnfa.ripState(name);
        }
        assert gnfa.size() == 2;
        return gnfa.startState.label(gnfa.finalState);
    }

    /**
     * Runs the machine as is: every label is compiled into an NFA fragment
     * between its two states. Accepts the same strings as a whole-input
     * match of {@link #toRegex()}.
     */
    @Override
    public boolean runString(CharSequence input) {
        checkInput(input);
        return toNFA().runString(input);
    }

    /*
     * same state names; label fragments get fresh ones
     */
    NFA toNFA() {
        NFA nfa = new NFA(alphabet, startState.name(), false);
        for (GNFAState state : states.values()) {
            if (state != startState) {
                nfa.addState(state.name(), state == finalState);
            }
        }
        for (GNFAState state : states.values()) {
            for (Map.Entry<GNFAState, String> e : state.outgoing().entrySet()) {
                LabelParser.compile(e.getValue(), nfa, state.name(),
                    e.getKey().name());
            }
        }
        return nfa;
    }

    @Override
    public GNFA copy() {
        GNFA gnfa = new GNFA(alphabet, startState.name(), finalState.name());
        for (GNFAState state : states.values()) {
            if (state != startState && state != finalState) {
                gnfa.addState(state.name());
            }
        }
        for (GNFAState state : states.values()) {
            for (Map.Entry<GNFAState, String> e : state.outgoing().entrySet()) {
                gnfa.stateFor(state.name()).putEdge(
                    gnfa.stateFor(e.getKey().name()), e.getValue());
            }
        }
        return gnfa;
    }

    @Override
    Iterable<GNFAState> successors(GNFAState state) {
        return state.outgoing().keySet();
    }

    @Override
    String machineType() {
        return "GNFA";
    }
}
