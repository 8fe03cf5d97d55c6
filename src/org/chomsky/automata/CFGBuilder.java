/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects a grammar, then builds it in one go. The first variable added is
 * the start variable unless {@link #withStartVariable(String)} says
 * otherwise. Productions given as a single string read one symbol per
 * character, <code>"aXb"</code>; longer variable names need
 * {@link #addTransition(String, String...)}.
 */
public final class CFGBuilder {

    private final String terminals;
    private final Set<String> variables = new LinkedHashSet<String>();
    private final List<String[]> transitions = new ArrayList<String[]>();
    private String start;

    public CFGBuilder(String terminals) {
        this.terminals = terminals;
    }

    public CFGBuilder addVariable(String name) {
        if (start == null) start = name;
        variables.add(name);
        return this;
    }

    public CFGBuilder withVariables(String... names) {
        for (String name : names) addVariable(name);
        return this;
    }

    public CFGBuilder withStartVariable(String name) {
        addVariable(name);
        start = name;
        return this;
    }

    /**
     * @param to one terminal or variable name per element
     */
    public CFGBuilder addTransition(String from, String... to) {
        if (to.length == 0) {
            throw new IllegalArgumentException(
                "use withEpsilonTransition for epsilon productions");
        }
        for (String symbol : to) {
            if (symbol.indexOf(Alphabet.EPSILON) >= 0) {
                throw new IllegalArgumentException(
                    "use withEpsilonTransition for epsilon productions");
            }
        }
        String[] transition = new String[to.length + 1];
        transition[0] = from;
        System.arraycopy(to, 0, transition, 1, to.length);
        transitions.add(transition);
        return this;
    }

    /**
     * One production per string, one symbol per character.
     */
    public CFGBuilder withTransitions(String from, String... rhss) {
        for (String rhs : rhss) addTransition(from, CFG.symbolsOf(rhs));
        return this;
    }

    public CFGBuilder withEpsilonTransition(String from) {
        transitions.add(new String[] {from});
        return this;
    }

    public CFG getResult() {
        if (start == null) {
            throw new IllegalArgumentException("no start variable");
        }
        CFG cfg = new CFG(start);
        for (String variable : variables) cfg.addVariable(variable);
        for (int i = 0; i < terminals.length(); ++i) {
            cfg.addTerminal(terminals.charAt(i));
        }
        for (String[] transition : transitions) {
            if (transition.length == 1) {
                cfg.addTransitionToEmptyString(transition[0]);
            } else {
                String[] to = new String[transition.length - 1];
                System.arraycopy(transition, 1, to, 0, to.length);
                cfg.addTransition(transition[0], to);
            }
        }
        return cfg;
    }
}
