/*
 * @LICENSE@
 */

package org.chomsky.automata;

import static org.chomsky.automata.AutomatonAssert.*;

public class BuilderTestCase extends AbstractAutomataTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(BuilderTestCase.class);
    }

    public BuilderTestCase(String name) {
        super(name);
    }

    public void testDFABuilder() {
        DFA dfa = new DFABuilder("ab")
            .withNotFinalStates("q0", "q1")
            .withFinalStates("q2")
            .withEdges().from("q0").toSelf().over("b")
            .withEdges().from("q0").to("q1").over("a")
            .withEdges().from("q1").to("q2").over("a")
            .withEdges().from("q1").to("q0").over("b")
            .withEdges().from("q2").toSelf().over("ab")
            .getResult();
        assertEquals(Fixtures.containsAA().toString(), dfa.toString());
    }

    public void testNFABuilder() {
        NFA nfa = new NFABuilder("ab")
            .withNotFinalStates("s")
            .withFinalStates("p")
            .withNotFinalStates("r", "r1")
            .withFinalStates("f", "q")
            .withEpsilonEdge("s", "p")
            .withEpsilonEdge("s", "r")
            .addEdge("r", "a", "r1")
            .withEdges().from("r1").to("f").over("b")
            .withEdges().from("p").to("q").over("b")
            .withEdges().from("q").toSelf().over("a")
            .getResult();
        assertEquals(Fixtures.epsilonNFA().toString(), nfa.toString());
        assertSameLanguage(Fixtures.epsilonNFA(), nfa, 6);
    }

    public void testTMBuilder() {
        String blank = String.valueOf(Alphabet.BLANK);
        TM tm = new TMBuilder("01", "XY")
            .withNotFinalStates("q0", "q1", "q2", "q3")
            .withFinalStates("qa")
            .withEdges().from("q0").to("q1").over("0XR")
            .withEdges().from("q0").to("q3").over("YYR")
            .withEdges().from("q0").to("qa").over(blank + blank + "R")
            .withEdges().from("q1").toSelf().over("00RYYR")
            .withEdges().from("q1").to("q2").over("1YL")
            .withEdges().from("q2").toSelf().over("00LYYL")
            .withEdges().from("q2").to("q0").over("XXR")
            .withEdges().from("q3").toSelf().over("YYR")
            .withEdges().from("q3").to("qa").over(blank + blank + "R")
            .getResult();
        assertEquals(Fixtures.zerosThenOnesDecider().toString(), tm.toString());
        assertAccepts(tm, "0011");
        assertRejects(tm, "011");

        tm = new TMBuilder("a", "").withFinalStates("s").getResult();
        assertSame(tm.startState(), tm.acceptState());
        assertAccepts(tm, "", "aaa");
    }

    public void testCFGBuilder() {
        CFG cfg = new CFGBuilder("ab")
            .withVariables("S", "T1")
            .withStartVariable("T1")
            .addTransition("T1", "a", "S", "b")
            .withTransitions("S", "ab")
            .withEpsilonTransition("T1")
            .getResult();
        assertEquals("T1", cfg.startVariable().symbol());
        assertEquals(2, cfg.productions("T1").size());
        assertTrue(cfgUtil.doesLanguageContainString(cfg, "aabb"));
        assertTrue(cfgUtil.doesLanguageContainString(cfg, ""));
        assertFalse(cfgUtil.doesLanguageContainString(cfg, "ab"));
    }

    public void testMalformed() {
        assertIllegalArgument(new Runnable() {
            public void run() {
                new DFABuilder("ab").getResult();
            }
        });
        assertIllegalArgument(new Runnable() {
            public void run() {
                new NFABuilder("ab").withNotFinalStates("s").addEdge("s", "ab", "s");
            }
        });
        assertIllegalArgument(new Runnable() {
            public void run() {
                new NFABuilder("ab").withNotFinalStates("s")
                    .addEdge("s", String.valueOf(Alphabet.EPSILON), "s");
            }
        });
        assertIllegalArgument(new Runnable() {
            public void run() {
                new DFABuilder("ab").withNotFinalStates("s")
                    .withEdges().from("s").to("t").over("a").getResult();
            }
        });
        assertIllegalArgument(new Runnable() {
            public void run() {
                new TMBuilder("a", "").withNotFinalStates("s")
                    .withEdges().from("s").toSelf().over("aaRa");
            }
        });
        assertIllegalArgument(new Runnable() {
            public void run() {
                new TMBuilder("a", "").withNotFinalStates("s")
                    .addEdge("s", "aaQ", "s");
            }
        });
        assertIllegalArgument(new Runnable() {
            public void run() {
                new TMBuilder("a", "").withFinalStates("s", "t").getResult();
            }
        });
        assertIllegalArgument(new Runnable() {
            public void run() {
                new CFGBuilder("a").getResult();
            }
        });
        assertIllegalArgument(new Runnable() {
            public void run() {
                new CFGBuilder("a").addVariable("S").addTransition("S");
            }
        });
        assertIllegalArgument(new Runnable() {
            public void run() {
                new CFGBuilder("a").addVariable("S")
                    .withTransitions("S", "a" + Alphabet.EPSILON);
            }
        });
    }
}
