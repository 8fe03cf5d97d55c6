/*
 * @LICENSE@
 */

package org.chomsky.automata;

/**
 * A named node of an automaton. The set of variants is closed: one per
 * {@link Kind}, each carrying the transition storage of its machine.
 */
public abstract class State {

    /**
     * Tags the variant, and with it the machine the state belongs to.
     */
    public enum Kind {
        DFA, NFA, GNFA, PDA, TM
    }

    private final String name;
    private boolean accepting;

    State(String name, boolean accepting) {
        if (name == null) {
            throw new IllegalArgumentException("state name is null");
        }
        this.name = name;
        this.accepting = accepting;
    }

    public final String name() {
        return name;
    }

    public final boolean isAccepting() {
        return accepting;
    }

    final void setAccepting(boolean accepting) {
        this.accepting = accepting;
    }

    public abstract Kind kind();

    /*
     * transition lines for the printable form, one per edge, each starting
     * with the state name
     */
    abstract void appendTransitions(StringBuilder sb, String indent);

    @Override
    public String toString() {
        return name;
    }
}
