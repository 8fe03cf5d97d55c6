/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.Set;

/**
 * Combines two NFAs into one DFA. Both machines are copied side by side
 * behind a fresh start state with epsilon edges into each, their state names
 * prefixed so that every state of the result tells which half it came from.
 * Subset construction then yields the product of the two, and the accepting
 * states are those whose halves satisfy the {@link Operator}.
 */
final class NFACombinator {

    static final String FIRST = "1-";
    static final String SECOND = "2-";
    static final String START = "U";

    enum Operator {
        OR {
            boolean apply(boolean first, boolean second) {
                return first || second;
            }
        },
        AND {
            boolean apply(boolean first, boolean second) {
                return first && second;
            }
        },
        XOR {
            boolean apply(boolean first, boolean second) {
                return first != second;
            }
        };

        abstract boolean apply(boolean first, boolean second);
    }

    private NFACombinator() {
    } // never instantiated

    /**
     * The epsilon-branch union of <code>a</code> and <code>b</code>, over
     * the union of their alphabets. A symbol one half lacks has no edges in
     * that half.
     */
    static NFA union(NFA a, NFA b) {
        Alphabet sigma = a.alphabet().union(b.alphabet());
        NFA ret = new NFA(sigma, START, false);
        a.copyOver(sigma, FIRST, ret);
        b.copyOver(sigma, SECOND, ret);
        ret.addEpsilonEdge(START, FIRST + a.startState().name());
        ret.addEpsilonEdge(START, SECOND + b.startState().name());
        return ret;
    }

    static DFA combine(NFA a, NFA b, final Operator op) {
        return new SubsetConstruction(union(a, b),
            new SubsetConstruction.Acceptance() {
                public boolean accepts(Set<NFAState> bunch) {
                    boolean first = false, second = false;
                    for (NFAState state : bunch) {
                        if (!state.isAccepting()) continue;
                        if (state.name().startsWith(FIRST)) {
                            first = true;
                        } else if (state.name().startsWith(SECOND)) {
                            second = true;
                        }
                    }
                    return op.apply(first, second);
                }
            }).construct();
    }
}
