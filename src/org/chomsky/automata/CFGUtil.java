/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.chomsky.automata.CFG.Symbol;
import org.chomsky.automata.CFG.Terminal;
import org.chomsky.automata.CFG.Variable;

/**
 * Language questions for context-free grammars. Emptiness and membership
 * are decidable; universality and equality are not and throw.
 */
public final class CFGUtil extends AutomatonUtil<CFG> {

    private static final Logger logger = Logger.getLogger("org.chomsky.automata");
    private static final Level level = Level.FINEST;

    static final String FIRST = "1-";
    static final String SECOND = "2-";
    static final String START = "S0";

    /**
     * Empty iff the start variable derives no string of terminals.
     */
    @Override
    public boolean isLanguageEmpty(CFG cfg) {
        return !Derivations.generating(cfg).contains(cfg.startVariable());
    }

    @Override
    public boolean isLanguageAllStrings(CFG cfg) {
        throw new UndecidableProblemException(
            "universality is undecidable for context-free grammars");
    }

    @Override
    public boolean equal(CFG a, CFG b) {
        throw new UndecidableProblemException(
            "equality is undecidable for context-free grammars");
    }

    /**
     * CYK over the Chomsky normal form. A word using a character that is not
     * a terminal of the grammar is not in the language. The word
     * <code>"ε"</code> is the empty string.
     */
    @Override
    public boolean doesLanguageContainString(CFG cfg, String word) {
        if (word.equals(CFG.EPSILON.symbol())) word = "";
        return cyk(toChomskyNormalForm(cfg), word);
    }

    public CFG toChomskyNormalForm(CFG cfg) {
        return new ChomskyConverter(cfg).convert();
    }

    public boolean isInChomskyNormalForm(CFG cfg) {
        return ChomskyChecker.isInChomskyNormalForm(cfg);
    }

    /**
     * A new start variable deriving either start variable, over copies of
     * <code>a</code> and <code>b</code> whose variables are prefixed with
     * <code>1-</code> and <code>2-</code>.
     */
    public CFG union(CFG a, CFG b) {
        CFG ret = new CFG(START);
        merge(ret, a.copyWithPrefix(FIRST));
        merge(ret, b.copyWithPrefix(SECOND));
        ret.addTransition(START, FIRST + a.startVariable().symbol());
        ret.addTransition(START, SECOND + b.startVariable().symbol());
        return ret;
    }

    private static void merge(CFG target, CFG part) {
        for (Terminal terminal : part.terminals()) {
            target.addTerminal(terminal.charValue());
        }
        for (Variable variable : part.variables()) {
            target.addVariable(variable.symbol());
        }
        for (Variable variable : part.variables()) {
            for (List<Symbol> rhs : part.productions(variable)) {
                target.addProduction(variable, rhs);
            }
        }
    }

    @SuppressWarnings("unchecked")
    static boolean cyk(CFG cnf, String word) {
        assert ChomskyChecker.isInChomskyNormalForm(cnf);
        int n = word.length();
        if (n == 0) {
            return cnf.productions(cnf.startVariable())
                .contains(CFG.EMPTY_PRODUCTION);
        }

        Map<Symbol, Set<Variable>> unary = new HashMap<Symbol, Set<Variable>>();
        List<Variable[]> binary = new ArrayList<Variable[]>();
        for (Variable variable : cnf.variables()) {
            for (List<Symbol> rhs : cnf.productions(variable)) {
                if (rhs.size() == 2) {
                    binary.add(new Variable[] {
                        variable, (Variable) rhs.get(0), (Variable) rhs.get(1)});
                } else if (!rhs.equals(CFG.EMPTY_PRODUCTION)) {
                    Set<Variable> set = unary.get(rhs.get(0));
                    if (set == null) {
                        unary.put(rhs.get(0), set = new HashSet<Variable>());
                    }
                    set.add(variable);
                }
            }
        }

        // table[i][l - 1]: variables deriving word[i, i + l)
        Set<Variable>[][] table = new Set[n][n];
        for (int i = 0; i < n; ++i) {
            Terminal terminal = cnf.getTerminal(word.substring(i, i + 1));
            Set<Variable> set = terminal == null ? null : unary.get(terminal);
            if (set == null) return false;
            table[i][0] = set;
        }
        for (int l = 2; l <= n; ++l) {
            for (int i = 0; i + l <= n; ++i) {
                Set<Variable> cell = new HashSet<Variable>();
                for (int k = 1; k < l; ++k) {
                    Set<Variable> left = table[i][k - 1];
                    Set<Variable> right = table[i + k][l - k - 1];
                    if (left.isEmpty() || right.isEmpty()) continue;
                    for (Variable[] p : binary) {
                        if (left.contains(p[1]) && right.contains(p[2])) {
                            cell.add(p[0]);
                        }
                    }
                }
                table[i][l - 1] = cell;
            }
        }
        boolean ret = table[0][n - 1].contains(cnf.startVariable());
        logger.log(level, "cyk \"" + word + "\": " + ret);
        return ret;
    }
}
