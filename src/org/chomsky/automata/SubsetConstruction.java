/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * NFA to DFA. Each DFA state stands for a bunch of NFA states and is named
 * after it; braces and backslashes inside state names are escaped, so
 * different bunches never share a name. Which bunches accept is pluggable,
 * which lets the same construction
 * serve both plain determinization and the product-style combinations of
 * {@link NFACombinator}.
 */
final class SubsetConstruction {

    private static final Logger logger = Logger.getLogger("org.chomsky.automata");
    private static final Level level = Level.FINEST;

    static final String DEAD_STATE = "dead-state";

    /**
     * Decides whether a bunch of NFA states makes an accepting DFA state.
     */
    interface Acceptance {
        boolean accepts(Set<NFAState> bunch);
    }

    static final Acceptance ANY = new Acceptance() {
        public boolean accepts(Set<NFAState> bunch) {
            for (NFAState state : bunch) {
                if (state.isAccepting()) return true;
            }
            return false;
        }
    };

    /**
     * The canonical name of a bunch: sorted <code>{name}</code> pieces,
     * concatenated, or {@link #DEAD_STATE} for the empty bunch. A
     * <code>{</code>, <code>}</code> or <code>\</code> inside a name is
     * escaped with a backslash.
     */
    static String nameOf(Collection<NFAState> bunch) {
        if (bunch.isEmpty()) return DEAD_STATE;
        List<String> pieces = new ArrayList<String>(bunch.size());
        for (NFAState state : bunch) {
            pieces.add('{' + escape(state.name()) + '}');
        }
        Collections.sort(pieces);
        StringBuilder sb = new StringBuilder();
        for (String piece : pieces) sb.append(piece);
        return sb.toString();
    }

    private static String escape(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); ++i) {
            char c = name.charAt(i);
            if (c == '{' || c == '}' || c == '\\') sb.append('\\');
            sb.append(c);
        }
        return sb.toString();
    }

    private final NFA nfa;
    private final Acceptance acceptance;

    SubsetConstruction(NFA nfa, Acceptance acceptance) {
        this.nfa = nfa;
        this.acceptance = acceptance;
    }

    /**
     * Builds a total DFA over the NFA's alphabet; the empty bunch becomes a
     * non accepting {@link #DEAD_STATE} looping on every symbol.
     */
    DFA construct() {
        Set<NFAState> init =
            nfa.epsilonClosure(Collections.singleton(nfa.startState()));
        String initName = nameOf(init);
        DFA dfa = new DFA(nfa.alphabet(), initName, acceptance.accepts(init));

        Map<Set<NFAState>, String> bunches = new HashMap<Set<NFAState>, String>();
        bunches.put(init, initName);
        LinkedList<Set<NFAState>> worklist = new LinkedList<Set<NFAState>>();
        worklist.addFirst(init);

        while (!worklist.isEmpty()) {
            Set<NFAState> bunch = worklist.removeFirst();
            String name = bunches.get(bunch);
            for (char c : nfa.alphabet()) {
                Set<NFAState> next = new LinkedHashSet<NFAState>();
                for (NFAState state : bunch) {
                    next.addAll(state.transitions(c));
                }
                next = nfa.epsilonClosure(next);
                String nextName = bunches.get(next);
                if (nextName == null) {
                    nextName = nameOf(next);
                    bunches.put(next, nextName);
                    dfa.addState(nextName, acceptance.accepts(next));
                    worklist.addFirst(next);
                }
                dfa.addEdge(name, c, nextName);
            }
        }
        assert dfa.isValid();

        if (logger.isLoggable(level)) {
            logger.log(level, "subset construction: " + nfa.size()
                + " nfa states -> " + dfa.size() + " dfa states");
            logger.log(level, "dfa: " + dfa.toString());
        }
        return dfa;
    }
}
