/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.AbstractQueue;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, interfaces, classes, and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    /*
     * "[a, b, c]" style listing, in iteration order.
     */
    static String listFrom(Iterable<?> items) {
        StringBuilder sb = new StringBuilder("[");
        for (Object item : items) {
            if (sb.length() > 1) sb.append(", ");
            sb.append(item);
        }
        return sb.append(']').toString();
    }

    static String namesFrom(Iterable<? extends State> states) {
        StringBuilder sb = new StringBuilder("[");
        for (State state : states) {
            if (sb.length() > 1) sb.append(", ");
            sb.append(state.name());
        }
        return sb.append(']').toString();
    }

    private static abstract class Escaper {
        abstract boolean esc(StringBuilder sb, int c);
    }

    private static final class MapEscaper extends Escaper {
        private final Map<Character, String> map =
                new HashMap<Character, String>();

        public boolean esc(StringBuilder sb, int c) {
            boolean ret = (c == (char) c) ? map.containsKey((char) c) : false;
            if (ret)
                sb.append(map.get((char) c));
            return ret;
        }

        MapEscaper map(Character c, String s) {
            map.put(c, s);
            return this;
        }

        MapEscaper backslash(String chars) {
            for (int i = 0; i < chars.length(); ++i) {
                map(chars.charAt(i), "\\" + chars.charAt(i));
            }
            return this;
        }
    }

    private static final MapEscaper rxEscaper =
            new MapEscaper().map('\r', "\\r").map('\n', "\\n").map('\t', "\\t")
                .map('\f', "\\f").map('\013', "\\x0B").map('\007', "\\a");
    private static final MapEscaper rxpEscaper =
            new MapEscaper().backslash("\\.^$|?*+()[]{}-&");

    /**
     * Singleton escapers used to turn alphabet symbols into text that is
     * safe to embed in other syntaxes.
     */
    enum Esc {

        /**
         * Regex Pattern escaper - control chars plus metachars (like '('),
         * for symbols that end up in {@link java.util.regex.Pattern} text.
         */
        RXP(rxEscaper, rxpEscaper),
        /**
         * Control chars only, for printable forms.
         */
        TXT(rxEscaper);

        private final Escaper[] path;

        Esc(final Escaper... path) {
            this.path = path;
        }

        void esc(StringBuilder sb, int c) {
            for (Escaper e : path) {
                if (e.esc(sb, c))
                    return;
            }
            sb.append((char) c);
        }

        String esc(int c) {
            StringBuilder sb = new StringBuilder();
            esc(sb, c);
            return sb.toString();
        }
    }

    static final class IdentitySetQueue<E> extends AbstractQueue<E> {

        final Map<E, Void> map = new IdentityHashMap<E, Void>();
        final LinkedList<E> list = new LinkedList<E>();

        public IdentitySetQueue() {
            super();
        }

        @Override
        public Iterator<E> iterator() {
            return list.iterator();
        }

        @Override
        public int size() {
            assert list.size() == map.size();
            return map.size();
        }

        public boolean offer(E o) {
            if (o == null || map.containsKey(o)) return false;
            map.put(o, null);
            return list.offer(o);
        }

        public E peek() {
            return list.peek();
        }

        public E poll() {
            if (isEmpty()) return null;
            E ret = list.poll();
            assert map.containsKey(ret);
            map.remove(ret);
            return ret;
        }
    }

    /*
     * Generic digraph visitor. Subclasses say how to get from a vertex to
     * its successors; vertices are compared by identity.
     */
    static abstract class BreadthFirstVisitor<V> {

        final Map<V, Void> black = new IdentityHashMap<V, Void>();
        final Queue<V> gray = new IdentitySetQueue<V>();

        final BreadthFirstVisitor<V> start(V init) {
            black.clear(); gray.clear(); order.clear();
            visitFrom(init);
            return this;
        }

        private void visitFrom(V init) {
            gray.offer(init);
            while (!gray.isEmpty()) {
                V vertex = gray.remove();
                black.put(vertex, null);
                order.add(vertex);
                for (V next : successors(vertex)) {
                    if (!black.containsKey(next)) {
                        gray.offer(next);
                    }
                }
            }
        }

        /*
         * black in discovery order
         */
        final Set<V> visited() {
            return new LinkedHashSet<V>(order);
        }
        private final LinkedList<V> order = new LinkedList<V>();

        protected abstract Iterable<V> successors(V vertex);
    }
}
