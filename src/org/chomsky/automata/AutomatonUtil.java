/*
 * @LICENSE@
 */

package org.chomsky.automata;

/**
 * The language questions every kind of machine or grammar can be asked.
 * Kinds for which a question has no general algorithm answer with an
 * {@link UndecidableProblemException}.
 *
 * @param <T> the kind of machine or grammar
 */
public abstract class AutomatonUtil<T> {

    /**
     * Signals that a question has no general algorithm, as opposed to the
     * input being malformed.
     */
    public static final class UndecidableProblemException
            extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public UndecidableProblemException(String msg) {
            super(msg);
        }
    }

    AutomatonUtil() {
    }

    public abstract boolean isLanguageEmpty(T automaton);

    public abstract boolean isLanguageAllStrings(T automaton);

    public abstract boolean doesLanguageContainString(T automaton, String word);

    public abstract boolean equal(T a, T b);
}
