/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.List;

import org.chomsky.automata.CFG.Symbol;
import org.chomsky.automata.CFG.Variable;

/**
 * Checks the shape rules of Chomsky normal form one by one. A grammar is in
 * normal form when every production is <code>A -&gt; B C</code>,
 * <code>A -&gt; a</code>, or <code>S -&gt; ε</code> for the start variable
 * <code>S</code>, and <code>S</code> appears on no right hand side.
 */
final class ChomskyChecker {

    private ChomskyChecker() {
    } // never instantiated

    static boolean isInChomskyNormalForm(CFG cfg) {
        return checkStartRule(cfg) && checkEpsilonRule(cfg)
            && checkUnitRule(cfg) && checkProperForm(cfg);
    }

    /**
     * The start variable is on no right hand side.
     */
    static boolean checkStartRule(CFG cfg) {
        Variable start = cfg.startVariable();
        for (Variable variable : cfg.variables()) {
            for (List<Symbol> rhs : cfg.productions(variable)) {
                if (rhs.contains(start)) return false;
            }
        }
        return true;
    }

    /**
     * Only the start variable derives epsilon directly.
     */
    static boolean checkEpsilonRule(CFG cfg) {
        for (Variable variable : cfg.variables()) {
            if (variable.equals(cfg.startVariable())) continue;
            if (cfg.productions(variable).contains(CFG.EMPTY_PRODUCTION)) {
                return false;
            }
        }
        return true;
    }

    /**
     * No production is a single variable.
     */
    static boolean checkUnitRule(CFG cfg) {
        for (Variable variable : cfg.variables()) {
            for (List<Symbol> rhs : cfg.productions(variable)) {
                if (rhs.size() == 1 && !rhs.get(0).isTerminal()) return false;
            }
        }
        return true;
    }

    /**
     * Every production is one terminal (epsilon included) or two variables.
     */
    static boolean checkProperForm(CFG cfg) {
        for (Variable variable : cfg.variables()) {
            for (List<Symbol> rhs : cfg.productions(variable)) {
                switch (rhs.size()) {
                case 1:
                    if (!rhs.get(0).isTerminal()) return false;
                    break;
                case 2:
                    if (rhs.get(0).isTerminal() || rhs.get(1).isTerminal()) {
                        return false;
                    }
                    break;
                default:
                    return false;
                }
            }
        }
        return true;
    }
}
