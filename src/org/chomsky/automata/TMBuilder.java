/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.Map;

/**
 * Edge labels are read/write/move triples, several of which may be given at
 * once: <code>over("aXR0_L")</code> adds <code>a/X,R</code> and
 * <code>0/_,L</code>. Use {@link Alphabet#BLANK} for the blank.
 */
public final class TMBuilder extends AutomatonBuilder<TM, TMBuilder> {

    private final String tapeAlphabet;

    public TMBuilder(String alphabet, String tapeAlphabet) {
        super(alphabet);
        this.tapeAlphabet = tapeAlphabet;
    }

    @Override
    TMBuilder self() {
        return this;
    }

    /**
     * @param over a read/write/move triple such as <code>"abR"</code>
     */
    @Override
    public TMBuilder addEdge(String from, String over, String to) {
        if (over.length() != 3) {
            throw new IllegalArgumentException(
                "a TM edge is a read/write/move triple: " + over);
        }
        move(over.charAt(2));
        edges.add(new Edge(from, over, to));
        return this;
    }

    @Override
    void addEdges(String from, String triples, String to) {
        if (triples.length() % 3 != 0) {
            throw new IllegalArgumentException(
                "not a sequence of read/write/move triples: " + triples);
        }
        for (int i = 0; i < triples.length(); i += 3) {
            addEdge(from, triples.substring(i, i + 3), to);
        }
    }

    private static TM.Move move(char c) {
        switch (c) {
        case 'L': return TM.Move.L;
        case 'R': return TM.Move.R;
        default:
            throw new IllegalArgumentException("a move is L or R: " + c);
        }
    }

    @Override
    public TM getResult() {
        checkStarted("TM");
        TM tm = new TM(alphabet, tapeAlphabet, start);
        for (Map.Entry<String, Boolean> e : states.entrySet()) {
            if (!e.getKey().equals(start)) tm.addState(e.getKey(), e.getValue());
        }
        if (states.get(start)) tm.setAccepting(start, true);
        for (Edge edge : edges) {
            tm.addEdge(edge.from, edge.over.charAt(0), edge.over.charAt(1),
                move(edge.over.charAt(2)), edge.to);
        }
        return tm;
    }
}
