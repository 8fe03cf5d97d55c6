/*
 * @LICENSE@
 */

package org.chomsky.automata;

/**
 * Language questions about Turing machines have no general algorithm; every
 * one of them throws. Run a machine on a single input with
 * {@link TM#runString(CharSequence)} instead, at the risk of it not halting.
 */
public final class TMUtil extends AutomatonUtil<TM> {

    private static UndecidableProblemException undecidable(String problem) {
        return new UndecidableProblemException(
            problem + " is undecidable for Turing machines");
    }

    @Override
    public boolean isLanguageEmpty(TM tm) {
        throw undecidable("emptiness");
    }

    @Override
    public boolean isLanguageAllStrings(TM tm) {
        throw undecidable("universality");
    }

    @Override
    public boolean doesLanguageContainString(TM tm, String word) {
        throw undecidable("membership");
    }

    @Override
    public boolean equal(TM a, TM b) {
        throw undecidable("equality");
    }
}
