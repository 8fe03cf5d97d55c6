/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.chomsky.automata.CFG.Symbol;
import org.chomsky.automata.CFG.Variable;

/**
 * Which variables derive something. A variable is marked once one of its
 * productions consists of marked variables and allowed terminals only;
 * marking a variable re-examines just the productions that mention it, so
 * every variable enters the worklist at most once.
 */
final class Derivations {

    private Derivations() {
    } // never instantiated

    /**
     * Variables deriving some string of terminals.
     */
    static Set<Variable> generating(CFG cfg) {
        return marked(cfg, true);
    }

    /**
     * Variables deriving the empty string.
     */
    static Set<Variable> nullable(CFG cfg) {
        return marked(cfg, false);
    }

    private static final class Rule {
        final Variable lhs;
        final List<Symbol> rhs;

        Rule(Variable lhs, List<Symbol> rhs) {
            this.lhs = lhs;
            this.rhs = rhs;
        }
    }

    private static boolean satisfied(List<Symbol> rhs, Set<Variable> marked,
            boolean terminals) {
        for (Symbol symbol : rhs) {
            if (symbol.equals(CFG.EPSILON)) continue;
            if (symbol.isTerminal() ? !terminals : !marked.contains(symbol)) {
                return false;
            }
        }
        return true;
    }

    private static Set<Variable> marked(CFG cfg, boolean terminals) {
        Set<Variable> marked = new LinkedHashSet<Variable>();
        LinkedList<Variable> worklist = new LinkedList<Variable>();
        Map<Variable, List<Rule>> users = new HashMap<Variable, List<Rule>>();

        for (Variable lhs : cfg.variables()) {
            for (List<Symbol> rhs : cfg.productions(lhs)) {
                if (satisfied(rhs, marked, terminals)) {
                    if (marked.add(lhs)) worklist.add(lhs);
                }
                for (Symbol symbol : rhs) {
                    if (symbol.isTerminal()) continue;
                    List<Rule> rules = users.get(symbol);
                    if (rules == null) {
                        users.put((Variable) symbol, rules = new ArrayList<Rule>());
                    }
                    rules.add(new Rule(lhs, rhs));
                }
            }
        }
        while (!worklist.isEmpty()) {
            List<Rule> rules = users.get(worklist.removeFirst());
            if (rules == null) continue;
            for (Rule rule : rules) {
                if (!marked.contains(rule.lhs)
                        && satisfied(rule.rhs, marked, terminals)) {
                    marked.add(rule.lhs);
                    worklist.add(rule.lhs);
                }
            }
        }
        return marked;
    }
}
