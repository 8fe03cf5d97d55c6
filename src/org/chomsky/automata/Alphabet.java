/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An immutable, ordered set of input symbols. Symbols are single
 * <code>char</code>s; the two reserved sentinels {@link #EPSILON} and
 * {@link #BLANK} can never be members.
 */
public final class Alphabet implements Iterable<Character> {

    /**
     * The empty string. Legal only as a transition label.
     */
    public static final char EPSILON = 'ε';

    /**
     * The blank tape cell of a {@link TM}.
     */
    public static final char BLANK = '□';

    private final Set<Character> symbols;

    private Alphabet(Set<Character> symbols) {
        this.symbols = Collections.unmodifiableSet(symbols);
    }

    /**
     * Creates an alphabet holding each distinct character of
     * <code>symbols</code>, in order of first appearance.
     *
     * @throws IllegalArgumentException if a character is a reserved sentinel
     */
    public static Alphabet fromString(CharSequence symbols) {
        Set<Character> set = new LinkedHashSet<Character>();
        for (int i = 0; i < symbols.length(); ++i) {
            set.add(checked(symbols.charAt(i)));
        }
        return new Alphabet(set);
    }

    public static Alphabet of(char... symbols) {
        return fromString(new String(symbols));
    }

    private static char checked(char symbol) {
        if (symbol == EPSILON) {
            throw new IllegalArgumentException(
                "epsilon cannot be an alphabet symbol");
        }
        if (symbol == BLANK) {
            throw new IllegalArgumentException(
                "blank cannot be an alphabet symbol");
        }
        return symbol;
    }

    public boolean contains(char symbol) {
        return symbols.contains(symbol);
    }

    public int size() {
        return symbols.size();
    }

    public Set<Character> symbols() {
        return symbols;
    }

    public Iterator<Character> iterator() {
        return symbols.iterator();
    }

    /**
     * This alphabet's symbols followed by the new symbols of
     * <code>other</code>.
     */
    public Alphabet union(Alphabet other) {
        Set<Character> set = new LinkedHashSet<Character>(symbols);
        set.addAll(other.symbols);
        return new Alphabet(set);
    }

    public boolean isSubsetOf(Alphabet other) {
        return other.symbols.containsAll(symbols);
    }

    /**
     * The symbols as a string, in order.
     */
    public String joinToString() {
        StringBuilder sb = new StringBuilder(symbols.size());
        for (char c : symbols) {
            sb.append(c);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Alphabet)) return false;
        return symbols.equals(((Alphabet) obj).symbols);
    }

    @Override
    public int hashCode() {
        return symbols.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (char c : symbols) {
            if (sb.length() > 1) sb.append(", ");
            Misc.Esc.TXT.esc(sb, c);
        }
        return sb.append(']').toString();
    }
}
