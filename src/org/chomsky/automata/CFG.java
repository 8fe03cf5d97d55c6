/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Context-free grammar. Terminals are single characters, variables have
 * names of any length, and the two name spaces are disjoint. Each variable
 * owns a set of productions; a production is a sequence of symbols, and the
 * empty production is the one element sequence holding {@link #EPSILON}.
 * <p>
 * Symbols are values: two terminals or two variables with the same name are
 * equal, whichever grammar they came from.
 */
public final class CFG {

    /**
     * A terminal or a variable, compared by kind and name.
     */
    public static abstract class Symbol {

        final String symbol;

        Symbol(String symbol) {
            this.symbol = symbol;
        }

        public final String symbol() {
            return symbol;
        }

        public abstract boolean isTerminal();

        @Override
        public final boolean equals(Object obj) {
            if (this == obj) return true;
            if (obj == null || obj.getClass() != getClass()) return false;
            return symbol.equals(((Symbol) obj).symbol);
        }

        @Override
        public final int hashCode() {
            return symbol.hashCode() * (isTerminal() ? 31 : 17);
        }

        @Override
        public String toString() {
            return symbol;
        }
    }

    public static final class Terminal extends Symbol {

        Terminal(char symbol) {
            super(String.valueOf(symbol));
        }

        public char charValue() {
            return symbol.charAt(0);
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    public static final class Variable extends Symbol {

        Variable(String symbol) {
            super(symbol);
        }

        @Override
        public boolean isTerminal() {
            return false;
        }
    }

    /**
     * The empty string, shared by every grammar.
     */
    public static final Terminal EPSILON = new Terminal(Alphabet.EPSILON);

    static final List<Symbol> EMPTY_PRODUCTION =
        Collections.<Symbol>singletonList(EPSILON);

    private final Map<String, Terminal> terminals =
        new LinkedHashMap<String, Terminal>();
    private final Map<String, Variable> variables =
        new LinkedHashMap<String, Variable>();
    private final Map<Variable, Set<List<Symbol>>> productions =
        new LinkedHashMap<Variable, Set<List<Symbol>>>();
    private Variable startVariable;

    public CFG(String startVariable) {
        this.startVariable = addVariable(startVariable);
    }

    /**
     * @return the new terminal, or the existing one of the same name
     * @throws IllegalArgumentException for epsilon, blank or a variable's
     *         name
     */
    public Terminal addTerminal(char symbol) {
        String name = String.valueOf(symbol);
        if (symbol == Alphabet.EPSILON || symbol == Alphabet.BLANK) {
            throw new IllegalArgumentException(
                "reserved symbol cannot be a terminal: " + symbol);
        }
        if (variables.containsKey(name)) {
            throw new IllegalArgumentException(
                "already a variable: " + name);
        }
        Terminal terminal = terminals.get(name);
        if (terminal == null) {
            terminals.put(name, terminal = new Terminal(symbol));
        }
        return terminal;
    }

    /**
     * @throws IllegalArgumentException unless <code>symbol</code> is exactly
     *         one character
     */
    public Terminal addTerminal(String symbol) {
        return addTerminal(single(symbol));
    }

    private static char single(String symbol) {
        if (symbol == null || symbol.length() != 1) {
            throw new IllegalArgumentException(
                "a terminal is exactly one character: " + symbol);
        }
        return symbol.charAt(0);
    }

    /**
     * @return the new variable, or the existing one of the same name
     * @throws IllegalArgumentException for an empty name, epsilon or a
     *         terminal's name
     */
    public Variable addVariable(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("variable name is empty");
        }
        if (name.equals(EPSILON.symbol)) {
            throw new IllegalArgumentException(
                "epsilon cannot be a variable");
        }
        if (terminals.containsKey(name)) {
            throw new IllegalArgumentException(
                "already a terminal: " + name);
        }
        Variable variable = variables.get(name);
        if (variable == null) {
            variables.put(name, variable = new Variable(name));
            productions.put(variable, new LinkedHashSet<List<Symbol>>());
        }
        return variable;
    }

    /**
     * @return the terminal, or <code>null</code> if there is none
     * @throws IllegalArgumentException unless <code>symbol</code> is exactly
     *         one character
     */
    public Terminal getTerminal(String symbol) {
        return terminals.get(String.valueOf(single(symbol)));
    }

    /**
     * @return the variable, or <code>null</code> if there is none
     */
    public Variable getVariable(String name) {
        return variables.get(name);
    }

    public Collection<Terminal> terminals() {
        return Collections.unmodifiableCollection(terminals.values());
    }

    public Collection<Variable> variables() {
        return Collections.unmodifiableCollection(variables.values());
    }

    public Variable startVariable() {
        return startVariable;
    }

    public void changeStartVariable(String name) {
        startVariable = variableFor(name);
    }

    /**
     * The productions of <code>variable</code>, in insertion order.
     */
    public Set<List<Symbol>> productions(String variable) {
        return Collections.unmodifiableSet(productions.get(variableFor(variable)));
    }

    Set<List<Symbol>> productions(Variable variable) {
        return productions.get(variable);
    }

    private Variable variableFor(String name) {
        Variable variable = variables.get(name);
        if (variable == null) {
            throw new IllegalArgumentException("no such variable: " + name);
        }
        return variable;
    }

    private Symbol symbolFor(String name) {
        if (name.equals(EPSILON.symbol)) {
            throw new IllegalArgumentException(
                "use addTransitionToEmptyString for epsilon productions");
        }
        Symbol symbol = variables.get(name);
        if (symbol == null) symbol = terminals.get(name);
        if (symbol == null) {
            throw new IllegalArgumentException(
                "no such terminal or variable: " + name);
        }
        return symbol;
    }

    private List<Symbol> productionFrom(String... to) {
        if (to.length == 0) {
            throw new IllegalArgumentException(
                "use addTransitionToEmptyString for epsilon productions");
        }
        List<Symbol> ret = new ArrayList<Symbol>(to.length);
        for (String name : to) ret.add(symbolFor(name));
        return Collections.unmodifiableList(ret);
    }

    /**
     * Adds the production <code>from -&gt; to[0] to[1] ...</code>, each
     * element naming a terminal or variable of this grammar.
     */
    public void addTransition(String from, String... to) {
        productions.get(variableFor(from)).add(productionFrom(to));
    }

    public void addTransitionToEmptyString(String from) {
        productions.get(variableFor(from)).add(EMPTY_PRODUCTION);
    }

    /**
     * @return true iff the production existed
     */
    public boolean removeTransition(String from, String... to) {
        return productions.get(variableFor(from)).remove(productionFrom(to));
    }

    public boolean removeTransitionToEmptyString(String from) {
        return productions.get(variableFor(from)).remove(EMPTY_PRODUCTION);
    }

    /**
     * Removes a variable no production refers to, with its own productions.
     *
     * @throws IllegalArgumentException for the start variable or a variable
     *         still in use
     */
    public boolean removeVariable(String name) {
        Variable variable = variables.get(name);
        if (variable == null) return false;
        if (variable.equals(startVariable)) {
            throw new IllegalArgumentException(
                "cannot remove the start variable: " + name);
        }
        checkUnused(variable);
        variables.remove(name);
        productions.remove(variable);
        return true;
    }

    /**
     * @throws IllegalArgumentException for a terminal still in use
     */
    public boolean removeTerminal(String symbol) {
        Terminal terminal = getTerminal(symbol);
        if (terminal == null) return false;
        checkUnused(terminal);
        terminals.remove(terminal.symbol);
        return true;
    }

    private void checkUnused(Symbol symbol) {
        for (Map.Entry<Variable, Set<List<Symbol>>> e : productions.entrySet()) {
            if (e.getKey().equals(symbol)) continue;
            for (List<Symbol> rhs : e.getValue()) {
                if (rhs.contains(symbol)) {
                    throw new IllegalArgumentException(symbol
                        + " is still used by a production of " + e.getKey());
                }
            }
        }
    }

    /*
     * for the converter: symbols are already this grammar's
     */
    void addProduction(Variable from, List<Symbol> rhs) {
        assert variables.containsKey(from.symbol);
        productions.get(from).add(Collections.unmodifiableList(
            new ArrayList<Symbol>(rhs)));
    }

    void setProductions(Variable from, Collection<List<Symbol>> rhss) {
        Set<List<Symbol>> set = productions.get(from);
        set.clear();
        for (List<Symbol> rhs : rhss) addProduction(from, rhs);
    }

    /**
     * Same start, terminals, variables and productions, sharing nothing
     * mutable with this grammar.
     */
    public CFG copy() {
        return copyWithPrefix("");
    }

    /*
     * every variable renamed to prefix + name
     */
    CFG copyWithPrefix(String prefix) {
        CFG cfg = new CFG(prefix + startVariable.symbol);
        for (Terminal terminal : terminals.values()) {
            cfg.addTerminal(terminal.charValue());
        }
        for (Variable variable : variables.values()) {
            cfg.addVariable(prefix + variable.symbol);
        }
        for (Map.Entry<Variable, Set<List<Symbol>>> e : productions.entrySet()) {
            Variable from = cfg.variableFor(prefix + e.getKey().symbol);
            for (List<Symbol> rhs : e.getValue()) {
                List<Symbol> to = new ArrayList<Symbol>(rhs.size());
                for (Symbol symbol : rhs) {
                    to.add(symbol.isTerminal() ?
                        symbol : cfg.variableFor(prefix + symbol.symbol));
                }
                cfg.addProduction(from, to);
            }
        }
        return cfg;
    }

    /*
     * "aXb", or "T0 U1" once a name is longer than one character
     */
    static String toString(List<Symbol> rhs) {
        boolean spaced = false;
        for (Symbol symbol : rhs) spaced |= symbol.symbol.length() > 1;
        StringBuilder sb = new StringBuilder();
        for (Symbol symbol : rhs) {
            if (spaced && sb.length() > 0) sb.append(' ');
            sb.append(symbol.symbol);
        }
        return sb.toString();
    }

    /**
     * The printable form: terminals, variables, start variable and one
     * line of alternatives per variable, tab indented.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("CFG: {").append('\n');
        sb.append(Automaton.INDENT).append("Terminals: ")
            .append(Misc.listFrom(terminals.keySet())).append('\n');
        sb.append(Automaton.INDENT).append("Variables: ")
            .append(Misc.listFrom(variables.keySet())).append('\n');
        sb.append(Automaton.INDENT).append("Start Variable: ")
            .append(startVariable).append('\n');
        sb.append(Automaton.INDENT).append("Productions:").append('\n');
        for (Map.Entry<Variable, Set<List<Symbol>>> e : productions.entrySet()) {
            if (e.getValue().isEmpty()) continue;
            sb.append(Automaton.INDENT).append(Automaton.INDENT)
                .append(e.getKey()).append(" -> ");
            int mark = sb.length();
            for (List<Symbol> rhs : e.getValue()) {
                if (sb.length() > mark) sb.append(" | ");
                sb.append(toString(rhs));
            }
            sb.append('\n');
        }
        sb.append('}');
        return sb.toString();
    }

    /*
     * literal productions for tests and builders: each char one symbol
     */
    static String[] symbolsOf(String rhs) {
        String[] ret = new String[rhs.length()];
        for (int i = 0; i < ret.length; ++i) {
            ret[i] = String.valueOf(rhs.charAt(i));
        }
        return ret;
    }
}
