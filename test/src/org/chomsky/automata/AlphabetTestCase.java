/*
 * @LICENSE@
 */

package org.chomsky.automata;

import junit.framework.TestCase;

public class AlphabetTestCase extends TestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(AlphabetTestCase.class);
    }

    public AlphabetTestCase(String name) {
        super(name);
    }

    public void testFromString() {
        Alphabet sigma = Alphabet.fromString("abca");
        assertEquals(3, sigma.size());
        assertEquals("abc", sigma.joinToString());
        assertTrue(sigma.contains('c'));
        assertFalse(sigma.contains('d'));
        assertEquals(0, Alphabet.fromString("").size());
    }

    public void testReservedSymbols() {
        try {
            Alphabet.fromString("a" + Alphabet.EPSILON);
            fail("epsilon accepted as a symbol");
        } catch (IllegalArgumentException e) {
            /* correct, expected behavior */
        }
        try {
            Alphabet.of('a', Alphabet.BLANK);
            fail("blank accepted as a symbol");
        } catch (IllegalArgumentException e) {
            /* correct, expected behavior */
        }
    }

    public void testUnion() {
        Alphabet ab = Alphabet.fromString("ab");
        Alphabet bc = Alphabet.fromString("bc");
        assertEquals("abc", ab.union(bc).joinToString());
        assertEquals("bca", bc.union(ab).joinToString());
        assertEquals("ab", ab.joinToString());
        assertTrue(ab.isSubsetOf(ab.union(bc)));
        assertFalse(ab.isSubsetOf(bc));
    }

    public void testEquality() {
        assertEquals(Alphabet.fromString("ab"), Alphabet.fromString("ba"));
        assertEquals(Alphabet.fromString("ab").hashCode(),
            Alphabet.fromString("ba").hashCode());
        assertFalse(Alphabet.fromString("ab").equals(Alphabet.fromString("abc")));
    }

    public void testToString() {
        assertEquals("[a, b]", Alphabet.fromString("ab").toString());
        assertEquals("[\\t, x]", Alphabet.of('\t', 'x').toString());
        assertEquals("[]", Alphabet.fromString("").toString());
    }

    public void testImmutable() {
        try {
            Alphabet.fromString("ab").symbols().add('c');
            fail("symbols are modifiable");
        } catch (UnsupportedOperationException e) {
            /* correct, expected behavior */
        }
    }
}
