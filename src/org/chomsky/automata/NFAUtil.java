/*
 * @LICENSE@
 */

package org.chomsky.automata;

import org.chomsky.automata.NFACombinator.Operator;

/**
 * Language questions and the boolean algebra for {@link NFA}s. Union stays
 * nondeterministic; everything needing a complement goes through
 * {@linkplain NFA#toDFA() subset construction}.
 */
public final class NFAUtil extends RegularAutomatonUtil<NFA> {

    private final DFAUtil dfaUtil = new DFAUtil();

    /**
     * True iff no accepting state is reachable, epsilon edges included.
     */
    @Override
    public boolean isLanguageEmpty(NFA nfa) {
        for (NFAState state : nfa.reachableStates()) {
            if (state.isAccepting()) return false;
        }
        return true;
    }

    @Override
    public boolean isLanguageAllStrings(NFA nfa) {
        return dfaUtil.isLanguageAllStrings(nfa.toDFA());
    }

    @Override
    public boolean doesLanguageContainString(NFA nfa, String word) {
        return nfa.runString(word);
    }

    @Override
    public boolean equal(NFA a, NFA b) {
        return dfaUtil.equal(a.toDFA(), b.toDFA());
    }

    /**
     * A fresh start state with epsilon edges into prefixed copies of both
     * operands.
     */
    @Override
    public NFA union(NFA a, NFA b) {
        return NFACombinator.union(a, b);
    }

    @Override
    public NFA intersection(NFA a, NFA b) {
        return NFACombinator.combine(a, b, Operator.AND).toNFA();
    }

    @Override
    public NFA negation(NFA nfa) {
        return dfaUtil.negation(nfa.toDFA()).toNFA();
    }

    /**
     * Same states and edges; no edge reads a new symbol.
     */
    @Override
    public NFA extendAlphabet(NFA nfa, Alphabet extra) {
        return nfa.copyOver(nfa.alphabet().union(extra));
    }
}
