/*
 * @LICENSE@
 */

package org.chomsky.automata;

import org.chomsky.automata.Automaton.IllegalAutomatonStateException;
import org.chomsky.automata.NFACombinator.Operator;

/**
 * Language questions and the boolean algebra for {@link DFA}s. Union,
 * intersection and symmetric difference go through the NFA union and
 * {@linkplain NFA#toDFA() subset construction}, so their state names carry
 * the <code>1-</code>/<code>2-</code> provenance of the operands.
 */
public final class DFAUtil extends RegularAutomatonUtil<DFA> {

    /**
     * True iff no accepting state is reachable.
     */
    @Override
    public boolean isLanguageEmpty(DFA dfa) {
        for (DFAState state : dfa.reachableStates()) {
            if (state.isAccepting()) return false;
        }
        return true;
    }

    /**
     * True iff every reachable state accepts. A machine with missing edges is
     * completed first, since a missing edge rejects.
     */
    @Override
    public boolean isLanguageAllStrings(DFA dfa) {
        DFA total = dfa.isValid() ? dfa : dfa.toNFA().toDFA();
        for (DFAState state : total.reachableStates()) {
            if (!state.isAccepting()) return false;
        }
        return true;
    }

    @Override
    public boolean doesLanguageContainString(DFA dfa, String word) {
        return dfa.runString(word);
    }

    /**
     * A and B are equal iff (A &cap; &not;B) &cup; (&not;A &cap; B) is empty.
     * Both are extended to the union alphabet before anything is negated.
     */
    @Override
    public boolean equal(DFA a, DFA b) {
        Alphabet sigma = a.alphabet().union(b.alphabet());
        DFA x = extendAlphabet(a, sigma);
        DFA y = extendAlphabet(b, sigma);
        return isLanguageEmpty(union(
            intersection(x, negation(y)),
            intersection(negation(x), y)));
    }

    @Override
    public DFA union(DFA a, DFA b) {
        return NFACombinator.combine(a.toNFA(), b.toNFA(), Operator.OR);
    }

    @Override
    public DFA intersection(DFA a, DFA b) {
        return NFACombinator.combine(a.toNFA(), b.toNFA(), Operator.AND);
    }

    /**
     * Strings accepted by exactly one of <code>a</code> and <code>b</code>.
     */
    public DFA symmetricDifference(DFA a, DFA b) {
        return NFACombinator.combine(a.toNFA(), b.toNFA(), Operator.XOR);
    }

    /**
     * A copy with every accepting flag flipped.
     *
     * @throws IllegalAutomatonStateException if <code>dfa</code> is not
     *         {@linkplain DFA#isValid() valid}
     */
    @Override
    public DFA negation(DFA dfa) {
        if (!dfa.isValid()) {
            throw new IllegalAutomatonStateException(
                "cannot negate a DFA whose transition function is not total");
        }
        DFA ret = dfa.copy();
        for (DFAState state : ret.states()) {
            state.setAccepting(!state.isAccepting());
        }
        return ret;
    }

    /**
     * The result is total: the new symbols lead to a
     * {@linkplain SubsetConstruction#DEAD_STATE dead state}.
     */
    @Override
    public DFA extendAlphabet(DFA dfa, Alphabet extra) {
        Alphabet sigma = dfa.alphabet().union(extra);
        if (sigma.equals(dfa.alphabet()) && dfa.isValid()) {
            return dfa.copy();
        }
        return dfa.toNFA(sigma).toDFA();
    }
}
