/*
 * @LICENSE@
 */

package org.chomsky.automata;

import static org.chomsky.automata.AutomatonAssert.*;

import org.chomsky.automata.AutomatonUtil.UndecidableProblemException;

public class CFGUtilTestCase extends AbstractAutomataTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(CFGUtilTestCase.class);
    }

    public CFGUtilTestCase(String name) {
        super(name);
    }

    /**
     * Membership of a known language, decided directly.
     */
    private interface Language {
        boolean contains(String s);
    }

    private static final Language ANBN = new Language() {
        public boolean contains(String s) {
            int n = s.length() / 2;
            return s.length() % 2 == 0 && s.matches("a{" + n + "}b{" + n + "}");
        }
    };

    private static final Language PALINDROMES = new Language() {
        public boolean contains(String s) {
            return new StringBuilder(s).reverse().toString().equals(s);
        }
    };

    private static final Language BALANCED = new Language() {
        public boolean contains(String s) {
            int depth = 0;
            for (int i = 0; i < s.length(); ++i) {
                depth += s.charAt(i) == '(' ? 1 : -1;
                if (depth < 0) return false;
            }
            return depth == 0;
        }
    };

    private static final Language SAME_COUNT = new Language() {
        public boolean contains(String s) {
            int count = 0;
            for (int i = 0; i < s.length(); ++i) {
                count += s.charAt(i) == 'a' ? 1 : -1;
            }
            return count == 0;
        }
    };

    private static Language regex(final String regex) {
        return new Language() {
            public boolean contains(String s) {
                return s.matches(regex);
            }
        };
    }

    private static Alphabet terminalsOf(CFG cfg) {
        StringBuilder sb = new StringBuilder();
        for (CFG.Terminal terminal : cfg.terminals()) {
            sb.append(terminal.charValue());
        }
        return Alphabet.fromString(sb);
    }

    private static void assertLanguage(Language expected, CFG cfg, int n) {
        CFG cnf = cfgUtil.toChomskyNormalForm(cfg);
        assertCNF(cnf);
        for (String s : corpus(terminalsOf(cfg), n)) {
            assertEquals("\"" + s + "\" in\n" + cnf,
                expected.contains(s), CFGUtil.cyk(cnf, s));
        }
    }

    public void testMembership() {
        assertLanguage(ANBN, Fixtures.anbn(), 8);
        assertLanguage(PALINDROMES, Fixtures.palindromes(), 8);
        assertLanguage(BALANCED, Fixtures.balanced(), 8);
        assertLanguage(SAME_COUNT, Fixtures.sameCount(), 8);
        assertLanguage(regex("a*b*|c"), Fixtures.unitsAndNullables(), 6);
        assertLanguage(regex("(abc)*"), Fixtures.abcStar(), 6);
    }

    public void testDoesLanguageContainString() {
        CFG cfg = Fixtures.anbn();
        assertTrue(cfgUtil.doesLanguageContainString(cfg, ""));
        assertTrue(cfgUtil.doesLanguageContainString(cfg,
            String.valueOf(Alphabet.EPSILON)));
        assertTrue(cfgUtil.doesLanguageContainString(cfg, "aabb"));
        assertFalse(cfgUtil.doesLanguageContainString(cfg, "aab"));
        assertFalse(cfgUtil.doesLanguageContainString(cfg, "abc"));
        assertFalse(cfgUtil.doesLanguageContainString(cfg, "a" + Alphabet.EPSILON + "b"));

        cfg.removeTransitionToEmptyString("S");
        cfg.addTransition("S", "a", "b");
        assertFalse(cfgUtil.doesLanguageContainString(cfg, ""));
        assertFalse(cfgUtil.doesLanguageContainString(cfg,
            String.valueOf(Alphabet.EPSILON)));
        assertTrue(cfgUtil.doesLanguageContainString(cfg, "ab"));
    }

    public void testIsLanguageEmpty() {
        assertFalse(cfgUtil.isLanguageEmpty(Fixtures.anbn()));
        assertTrue(cfgUtil.isLanguageEmpty(new CFG("S")));

        assertFalse(cfgUtil.isLanguageEmpty(new CFGBuilder("a")
            .addVariable("X").withTransitions("X", "XX", "a").getResult()));
        assertTrue(cfgUtil.isLanguageEmpty(new CFGBuilder("a")
            .addVariable("X").withTransitions("X", "XX", "X").getResult()));
        // every production keeps an X around
        assertTrue(cfgUtil.isLanguageEmpty(new CFGBuilder("a")
            .addVariable("X").withTransitions("X", "XX", "aX").getResult()));

        CFG cfg = new CFGBuilder("ab")
            .withVariables("S", "A", "B")
            .withTransitions("S", "AB")
            .withTransitions("A", "a")
            .withTransitions("B", "BB", "bB")
            .getResult();
        assertTrue(cfgUtil.isLanguageEmpty(cfg));
        cfg.addTransitionToEmptyString("B");
        assertFalse(cfgUtil.isLanguageEmpty(cfg));
    }

    public void testUndecidable() {
        try {
            cfgUtil.isLanguageAllStrings(Fixtures.anbn());
            fail("universality decided");
        } catch (UndecidableProblemException e) {
            /* correct, expected behavior */
        }
        try {
            cfgUtil.equal(Fixtures.anbn(), Fixtures.anbn());
            fail("equality decided");
        } catch (UndecidableProblemException e) {
            /* correct, expected behavior */
        }
    }

    public void testUnion() {
        CFG union = cfgUtil.union(Fixtures.anbn(), Fixtures.abcStar());
        assertEquals("S0", union.startVariable().symbol());
        assertNotNull(union.getVariable("1-S"));
        assertNotNull(union.getVariable("2-S"));
        assertEquals(3, union.terminals().size());
        assertTrue(cfgUtil.doesLanguageContainString(union, ""));
        assertTrue(cfgUtil.doesLanguageContainString(union, "aabb"));
        assertTrue(cfgUtil.doesLanguageContainString(union, "abcabc"));
        assertFalse(cfgUtil.doesLanguageContainString(union, "abab"));
        assertFalse(cfgUtil.doesLanguageContainString(union, "aabbc"));
    }

    public void testChomskyNormalForm() {
        CFG cfg = Fixtures.anbn();
        assertFalse(cfgUtil.isInChomskyNormalForm(cfg));
        CFG cnf = cfgUtil.toChomskyNormalForm(cfg);
        assertTrue(cfgUtil.isInChomskyNormalForm(cnf));
        assertEquals("S0", cnf.startVariable().symbol());
        assertTrue(cnf.productions("S0").contains(CFG.EMPTY_PRODUCTION));
        // the input is left alone
        assertEquals(Fixtures.anbn().toString(), cfg.toString());
    }
}
