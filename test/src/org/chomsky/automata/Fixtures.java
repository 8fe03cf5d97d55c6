/*
 * @LICENSE@
 */

package org.chomsky.automata;

import static org.chomsky.automata.Alphabet.BLANK;
import static org.chomsky.automata.Alphabet.EPSILON;

import java.util.Random;

import org.chomsky.automata.TM.Move;

/**
 * Sample machines and grammars shared by the tests. Every call builds a
 * fresh object.
 */
public final class Fixtures {

    private Fixtures() {}   // not instantiable.

    /**
     * Over {a, b}: strings containing "aa".
     */
    public static DFA containsAA() {
        DFA dfa = new DFA("ab", "q0", false);
        dfa.addStates("q1");
        dfa.addState("q2", true);
        dfa.addEdge("q0", 'b', "q0");
        dfa.addEdge("q0", 'a', "q1");
        dfa.addEdge("q1", 'a', "q2");
        dfa.addEdge("q1", 'b', "q0");
        dfa.addEdge("q2", 'a', "q2");
        dfa.addEdge("q2", 'b', "q2");
        return dfa;
    }

    /**
     * Four states over {a, b}; "end" is entered on the second a after a b.
     */
    public static DFA genericValidDFA() {
        DFA dfa = new DFA("ab", "start", false);
        dfa.addStates("1", "2");
        dfa.addState("end", true);
        dfa.addEdge("start", 'a', "start");
        dfa.addEdge("start", 'b', "1");
        dfa.addEdge("1", 'a', "2");
        dfa.addEdge("1", 'b', "1");
        dfa.addEdge("2", 'a', "end");
        dfa.addEdge("2", 'b', "start");
        dfa.addEdge("end", 'a', "end");
        dfa.addEdge("end", 'b', "1");
        return dfa;
    }

    /**
     * Missing the edges out of "1".
     */
    public static DFA invalidDFA() {
        DFA dfa = new DFA("ab", "0", false);
        dfa.addState("1", true);
        dfa.addEdge("0", 'a', "1");
        dfa.addEdge("0", 'b', "0");
        return dfa;
    }

    /**
     * Over {c, d}: an even number of c's.
     */
    public static DFA evenC() {
        DFA dfa = new DFA("cd", "x", true);
        dfa.addStates("y");
        dfa.addEdge("x", 'c', "y");
        dfa.addEdge("x", 'd', "x");
        dfa.addEdge("y", 'c', "x");
        dfa.addEdge("y", 'd', "y");
        return dfa;
    }

    /**
     * Same language as {@link #evenC()}, three states.
     */
    public static DFA evenCThreeStates() {
        DFA dfa = new DFA("cd", "p", true);
        dfa.addStates("q");
        dfa.addState("r", true);
        dfa.addEdge("p", 'c', "q");
        dfa.addEdge("p", 'd', "p");
        dfa.addEdge("q", 'c', "r");
        dfa.addEdge("q", 'd', "q");
        dfa.addEdge("r", 'c', "q");
        dfa.addEdge("r", 'd', "r");
        return dfa;
    }

    /**
     * One accepting state looping on every symbol.
     */
    public static DFA allStrings(String alphabet) {
        DFA dfa = new DFA(alphabet, "all", true);
        dfa.addEdges("all", alphabet, "all");
        return dfa;
    }

    /**
     * Over {a, b}: a b* a.
     */
    public static NFA genericNFA() {
        NFA nfa = new NFA("ab", "start", false);
        nfa.addStates("1", "2");
        nfa.addState("end", true);
        nfa.addEdge("start", 'a', "1");
        nfa.addEdge("start", 'a', "2");
        nfa.addEdge("1", 'b', "1");
        nfa.addEdge("1", 'b', "2");
        nfa.addEdge("2", 'a', "end");
        return nfa;
    }

    /**
     * Over {a, b}: the empty string, "ab", and b a*.
     */
    public static NFA epsilonNFA() {
        NFA nfa = new NFA("ab", "s", false);
        nfa.addState("p", true);
        nfa.addStates("r", "r1");
        nfa.addState("f", true);
        nfa.addState("q", true);
        nfa.addEpsilonEdge("s", "p");
        nfa.addEpsilonEdge("s", "r");
        nfa.addEdge("r", 'a', "r1");
        nfa.addEdge("r1", 'b', "f");
        nfa.addEdge("p", 'b', "q");
        nfa.addEdge("q", 'a', "q");
        return nfa;
    }

    /**
     * Over {a, b}: a* b (a|b)*, with the interior states added in order.
     */
    public static GNFA genericGNFA() {
        GNFA gnfa = new GNFA("ab", "s", "f");
        gnfa.addState("q1");
        gnfa.addState("q2");
        gnfa.addEdge("s", "q1", "ε");
        gnfa.addEdge("q1", "q1", "a");
        gnfa.addEdge("q1", "q2", "b");
        gnfa.addEdge("q2", "q2", "a");
        gnfa.addEdge("q2", "q2", "b");
        gnfa.addEdge("q2", "f", "");
        return gnfa;
    }

    /**
     * 0^n 1^n, n &gt;= 0, marking the bottom of the stack with '$'.
     */
    public static PDA zerosThenOnes() {
        PDA pda = new PDA("01", "0$", "q1", true);
        pda.addStates("q2", "q3");
        pda.addState("q4", true);
        pda.addEdge("q1", EPSILON, EPSILON, '$', "q2");
        pda.addEdge("q2", '0', EPSILON, '0', "q2");
        pda.addEdge("q2", '1', '0', EPSILON, "q3");
        pda.addEdge("q3", '1', '0', EPSILON, "q3");
        pda.addEdge("q3", EPSILON, '$', EPSILON, "q4");
        return pda;
    }

    /**
     * Decides 0^n 1^n, n &gt;= 0: cross off a 0 with X, the matching 1
     * with Y, and repeat.
     */
    public static TM zerosThenOnesDecider() {
        TM tm = new TM("01", "XY", "q0");
        tm.addStates("q1", "q2", "q3");
        tm.addState("qa", true);
        tm.addEdge("q0", '0', 'X', Move.R, "q1");
        tm.addEdge("q0", 'Y', 'Y', Move.R, "q3");
        tm.addEdge("q0", BLANK, BLANK, Move.R, "qa");
        tm.addEdge("q1", '0', '0', Move.R, "q1");
        tm.addEdge("q1", 'Y', 'Y', Move.R, "q1");
        tm.addEdge("q1", '1', 'Y', Move.L, "q2");
        tm.addEdge("q2", '0', '0', Move.L, "q2");
        tm.addEdge("q2", 'Y', 'Y', Move.L, "q2");
        tm.addEdge("q2", 'X', 'X', Move.R, "q0");
        tm.addEdge("q3", 'Y', 'Y', Move.R, "q3");
        tm.addEdge("q3", BLANK, BLANK, Move.R, "qa");
        return tm;
    }

    /**
     * Over {a, b}: strings containing "aa", by guessing where it starts.
     */
    public static TM guessAA() {
        TM tm = new TM("ab", "", "q0");
        tm.addStates("q1");
        tm.addState("qa", true);
        tm.addEdge("q0", 'a', 'a', Move.R, "q0");
        tm.addEdge("q0", 'b', 'b', Move.R, "q0");
        tm.addEdge("q0", 'a', 'a', Move.R, "q1");
        tm.addEdge("q1", 'a', 'a', Move.R, "qa");
        return tm;
    }

    /**
     * S -&gt; aSb | ε
     */
    public static CFG anbn() {
        return new CFGBuilder("ab")
            .addVariable("S")
            .withTransitions("S", "aSb")
            .withEpsilonTransition("S")
            .getResult();
    }

    /**
     * Palindromes over {a, b}.
     */
    public static CFG palindromes() {
        return new CFGBuilder("ab")
            .addVariable("S")
            .withTransitions("S", "aSa", "bSb", "a", "b")
            .withEpsilonTransition("S")
            .getResult();
    }

    /**
     * Balanced parentheses.
     */
    public static CFG balanced() {
        return new CFGBuilder("()")
            .addVariable("S")
            .withTransitions("S", "SS", "(S)")
            .withEpsilonTransition("S")
            .getResult();
    }

    /**
     * As many a's as b's.
     */
    public static CFG sameCount() {
        return new CFGBuilder("ab")
            .addVariable("S")
            .withTransitions("S", "aSbS", "bSaS")
            .withEpsilonTransition("S")
            .getResult();
    }

    /**
     * a*b* or c, through nullable variables and a unit cycle.
     */
    public static CFG unitsAndNullables() {
        return new CFGBuilder("abc")
            .withVariables("S", "A", "B", "C", "D")
            .withTransitions("S", "AB", "C")
            .withTransitions("A", "aA")
            .withEpsilonTransition("A")
            .withTransitions("B", "bB")
            .withEpsilonTransition("B")
            .withTransitions("C", "D")
            .withTransitions("D", "c", "C")
            .getResult();
    }

    /**
     * (abc)*, with a production longer than two symbols.
     */
    public static CFG abcStar() {
        return new CFGBuilder("abc")
            .addVariable("S")
            .withTransitions("S", "abcS")
            .withEpsilonTransition("S")
            .getResult();
    }

    /**
     * An NFA with <code>n</code> states named "0".."n-1" and random edges,
     * some of them epsilon.
     */
    public static NFA randomNFA(Random rnd, String alphabet, int n) {
        NFA nfa = new NFA(alphabet, "0", rnd.nextInt(4) == 0);
        for (int i = 1; i < n; ++i) {
            nfa.addState(String.valueOf(i), rnd.nextInt(3) == 0);
        }
        for (int i = 0; i < n; ++i) {
            for (int j = 0; j < n; ++j) {
                for (int k = 0; k < alphabet.length(); ++k) {
                    if (rnd.nextInt(4) == 0) {
                        nfa.addEdge(String.valueOf(i), alphabet.charAt(k),
                            String.valueOf(j));
                    }
                }
                if (i != j && rnd.nextInt(8) == 0) {
                    nfa.addEpsilonEdge(String.valueOf(i), String.valueOf(j));
                }
            }
        }
        return nfa;
    }

    /**
     * A total DFA with <code>n</code> states named "0".."n-1".
     */
    public static DFA randomDFA(Random rnd, String alphabet, int n) {
        DFA dfa = new DFA(alphabet, "0", rnd.nextBoolean());
        for (int i = 1; i < n; ++i) {
            dfa.addState(String.valueOf(i), rnd.nextBoolean());
        }
        for (int i = 0; i < n; ++i) {
            for (int k = 0; k < alphabet.length(); ++k) {
                dfa.addEdge(String.valueOf(i), alphabet.charAt(k),
                    String.valueOf(rnd.nextInt(n)));
            }
        }
        return dfa;
    }

    /**
     * A grammar over <code>terminals</code> with variables "A".."A+n-1",
     * start "A". Productions are zero to three symbols long.
     */
    public static CFG randomCFG(Random rnd, String terminals, int n) {
        CFGBuilder builder = new CFGBuilder(terminals);
        for (int i = 0; i < n; ++i) {
            builder.addVariable(String.valueOf((char) ('A' + i)));
        }
        for (int i = 0; i < n; ++i) {
            String lhs = String.valueOf((char) ('A' + i));
            int count = 1 + rnd.nextInt(3);
            for (int p = 0; p < count; ++p) {
                int length = rnd.nextInt(4);
                if (length == 0) {
                    builder.withEpsilonTransition(lhs);
                    continue;
                }
                StringBuilder rhs = new StringBuilder();
                for (int s = 0; s < length; ++s) {
                    rhs.append(rnd.nextBoolean() ?
                        terminals.charAt(rnd.nextInt(terminals.length())) :
                        (char) ('A' + rnd.nextInt(n)));
                }
                builder.withTransitions(lhs, rhs.toString());
            }
        }
        return builder.getResult();
    }
}
