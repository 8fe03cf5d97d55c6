/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.chomsky.automata.CFG.Symbol;
import org.chomsky.automata.CFG.Terminal;
import org.chomsky.automata.CFG.Variable;

/**
 * Rewrites a grammar into Chomsky normal form, on a copy:
 * <ol>
 * <li>every variable is renamed with {@link #PREFIX}, freeing the short
 * names used below;</li>
 * <li>a new start variable <code>S0</code> derives the old start;</li>
 * <li>terminals in productions of two or more symbols are replaced by
 * variables <code>Tn -&gt; terminal</code>;</li>
 * <li>epsilon productions are removed, adding every variant with nullable
 * occurrences left out; only <code>S0</code> may keep one;</li>
 * <li>unit productions <code>A -&gt; B</code> are replaced by the non unit
 * productions of everything <code>A</code> reaches through units;</li>
 * <li>longer productions are split into right associated chains of
 * variables <code>Un</code>.</li>
 * </ol>
 */
final class ChomskyConverter {

    private static final Logger logger = Logger.getLogger("org.chomsky.automata");
    private static final Level level = Level.FINEST;

    static final String PREFIX = "-";
    static final String START = "S0";
    static final String TERMINAL = "T";
    static final String CHAIN = "U";

    private final CFG source;
    private CFG cfg;
    private int terminalCount = 0;
    private int chainCount = 0;

    ChomskyConverter(CFG source) {
        this.source = source;
    }

    CFG convert() {
        cfg = source.copyWithPrefix(PREFIX);
        addStartVariable();
        trace("start");
        isolateTerminals();
        trace("terminals");
        eliminateEpsilonProductions();
        trace("epsilon");
        eliminateUnitProductions();
        trace("unit");
        reduceArity();
        trace("arity");
        assert ChomskyChecker.isInChomskyNormalForm(cfg) : cfg;
        return cfg;
    }

    private void trace(String pass) {
        if (logger.isLoggable(level)) {
            logger.log(level, "cnf after " + pass + " pass: " + cfg);
        }
    }

    private Variable freshVariable(String base, int n) {
        String name = base + n;
        assert cfg.getVariable(name) == null : name;
        return cfg.addVariable(name);
    }

    private void addStartVariable() {
        Variable start = cfg.addVariable(START);
        List<Symbol> rhs = new ArrayList<Symbol>(1);
        rhs.add(cfg.startVariable());
        cfg.addProduction(start, rhs);
        cfg.changeStartVariable(START);
    }

    private void isolateTerminals() {
        Map<Terminal, Variable> isolated = new LinkedHashMap<Terminal, Variable>();
        for (Variable variable : new ArrayList<Variable>(cfg.variables())) {
            Set<List<Symbol>> rewritten = new LinkedHashSet<List<Symbol>>();
            for (List<Symbol> rhs : cfg.productions(variable)) {
                if (rhs.size() < 2) {
                    rewritten.add(rhs);
                    continue;
                }
                List<Symbol> to = new ArrayList<Symbol>(rhs.size());
                for (Symbol symbol : rhs) {
                    if (symbol.isTerminal()) {
                        Variable t = isolated.get(symbol);
                        if (t == null) {
                            t = freshVariable(TERMINAL, terminalCount++);
                            List<Symbol> single = new ArrayList<Symbol>(1);
                            single.add(symbol);
                            cfg.addProduction(t, single);
                            isolated.put((Terminal) symbol, t);
                        }
                        symbol = t;
                    }
                    to.add(symbol);
                }
                rewritten.add(to);
            }
            cfg.setProductions(variable, rewritten);
        }
    }

    /*
     * For each variable, a worklist of productions still to expand: every
     * production with one nullable occurrence left out goes back on it,
     * unless already seen. Variants only get shorter, so this ends.
     */
    private void eliminateEpsilonProductions() {
        Set<Variable> nullable = Derivations.nullable(cfg);
        Variable start = cfg.startVariable();
        for (Variable variable : cfg.variables()) {
            Set<List<Symbol>> seen = new LinkedHashSet<List<Symbol>>();
            LinkedList<List<Symbol>> worklist = new LinkedList<List<Symbol>>();
            for (List<Symbol> rhs : cfg.productions(variable)) {
                if (seen.add(rhs)) worklist.add(rhs);
            }
            while (!worklist.isEmpty()) {
                List<Symbol> rhs = worklist.removeFirst();
                for (int i = 0; i < rhs.size(); ++i) {
                    if (!nullable.contains(rhs.get(i))) continue;
                    List<Symbol> variant = new ArrayList<Symbol>(rhs);
                    variant.remove(i);
                    if (variant.isEmpty()) variant = CFG.EMPTY_PRODUCTION;
                    if (seen.add(variant)) worklist.add(variant);
                }
            }
            Set<List<Symbol>> kept = new LinkedHashSet<List<Symbol>>();
            for (List<Symbol> rhs : seen) {
                if (!rhs.equals(CFG.EMPTY_PRODUCTION) || variable.equals(start)) {
                    kept.add(rhs);
                }
            }
            cfg.setProductions(variable, kept);
        }
    }

    private static boolean isUnit(List<Symbol> rhs) {
        return rhs.size() == 1 && !rhs.get(0).isTerminal();
    }

    /*
     * Every variable gets the non unit productions of all variables it
     * reaches through unit productions, itself included. All new sets are
     * computed from the old productions before any is replaced.
     */
    private void eliminateUnitProductions() {
        Map<Variable, Set<List<Symbol>>> replaced =
            new HashMap<Variable, Set<List<Symbol>>>();
        for (Variable variable : cfg.variables()) {
            Set<Variable> reached = new LinkedHashSet<Variable>();
            LinkedList<Variable> worklist = new LinkedList<Variable>();
            reached.add(variable);
            worklist.add(variable);
            Set<List<Symbol>> rhss = new LinkedHashSet<List<Symbol>>();
            while (!worklist.isEmpty()) {
                for (List<Symbol> rhs : cfg.productions(worklist.removeFirst())) {
                    if (!isUnit(rhs)) {
                        rhss.add(rhs);
                    } else if (reached.add((Variable) rhs.get(0))) {
                        worklist.add((Variable) rhs.get(0));
                    }
                }
            }
            replaced.put(variable, rhss);
        }
        for (Map.Entry<Variable, Set<List<Symbol>>> e : replaced.entrySet()) {
            cfg.setProductions(e.getKey(), e.getValue());
        }
    }

    /*
     * A -> X1 X2 ... Xn becomes A -> X1 U1, U1 -> X2 U2, ..., U(n-2) -> X(n-1) Xn
     */
    private void reduceArity() {
        for (Variable variable : new ArrayList<Variable>(cfg.variables())) {
            Set<List<Symbol>> rewritten = new LinkedHashSet<List<Symbol>>();
            for (List<Symbol> rhs : cfg.productions(variable)) {
                if (rhs.size() <= 2) {
                    rewritten.add(rhs);
                    continue;
                }
                Variable lhs = null;
                for (int i = 0; i < rhs.size() - 2; ++i) {
                    Variable chain = freshVariable(CHAIN, chainCount++);
                    List<Symbol> pair = new ArrayList<Symbol>(2);
                    pair.add(rhs.get(i));
                    pair.add(chain);
                    if (lhs == null) {
                        rewritten.add(pair);
                    } else {
                        cfg.addProduction(lhs, pair);
                    }
                    lhs = chain;
                }
                cfg.addProduction(lhs, rhs.subList(rhs.size() - 2, rhs.size()));
            }
            cfg.setProductions(variable, rewritten);
        }
    }
}
