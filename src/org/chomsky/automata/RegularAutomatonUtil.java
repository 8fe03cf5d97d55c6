/*
 * @LICENSE@
 */

package org.chomsky.automata;

/**
 * Regular languages are closed under the boolean operations, so finite
 * automata also get an algebra. Binary operations accept operands over
 * different alphabets and work over the union of the two. None of the
 * operations modifies its operands.
 *
 * @param <T> {@link DFA} or {@link NFA}
 */
public abstract class RegularAutomatonUtil<T extends Automaton<?>>
        extends AutomatonUtil<T> {

    RegularAutomatonUtil() {
    }

    public abstract T union(T a, T b);

    public abstract T intersection(T a, T b);

    public abstract T negation(T automaton);

    /**
     * Rebuilds <code>automaton</code> over its alphabet plus
     * <code>extra</code>. Strings using the new symbols are rejected.
     */
    public abstract T extendAlphabet(T automaton, Alphabet extra);

    public final T extendAlphabet(T automaton, String extra) {
        return extendAlphabet(automaton, Alphabet.fromString(extra));
    }
}
