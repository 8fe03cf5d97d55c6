/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.chomsky.automata.TM.Configuration;

/**
 * Runs a {@link TM} breadth first: every step advances all live
 * configurations at once, so an accepting branch is found even when other
 * branches never halt.
 */
final class TMRunner {

    private static final Logger logger = Logger.getLogger("org.chomsky.automata");
    private static final Level level = Level.FINEST;

    private final TM tm;

    TMRunner(TM tm) {
        this.tm = tm;
    }

    /**
     * The input followed by one blank, head on the first cell.
     */
    Configuration initial(CharSequence input) {
        List<Character> tape = new ArrayList<Character>(input.length() + 1);
        for (int i = 0; i < input.length(); ++i) tape.add(input.charAt(i));
        tape.add(Alphabet.BLANK);
        return new Configuration(tm.startState().name(), tape, 0);
    }

    boolean run(CharSequence input) {
        Set<Configuration> current = new LinkedHashSet<Configuration>();
        current.add(initial(input));
        for (int step = 0; ; ++step) {
            for (Configuration conf : current) {
                if (tm.stateFor(conf.state).isAccepting()) {
                    logger.log(level, "tm accepts after " + step + " steps");
                    return true;
                }
            }
            if (current.isEmpty()) {
                logger.log(level, "tm rejects after " + step + " steps");
                return false;
            }
            current = step(current);
        }
    }

    Set<Configuration> step(Set<Configuration> current) {
        Set<Configuration> next = new LinkedHashSet<Configuration>();
        for (Configuration conf : current) {
            char read = conf.tape.get(conf.head);
            for (TMState.Edge edge : tm.stateFor(conf.state).edges(read)) {
                next.add(follow(conf, edge));
            }
        }
        return next;
    }

    /*
     * write, then move; R past the end grows the tape, L stops at 0
     */
    static Configuration follow(Configuration conf, TMState.Edge edge) {
        List<Character> tape = new ArrayList<Character>(conf.tape.size() + 1);
        tape.addAll(conf.tape);
        tape.set(conf.head, edge.write);
        int head = conf.head;
        if (edge.move == TM.Move.R) {
            if (++head == tape.size()) tape.add(Alphabet.BLANK);
        } else {
            head = Math.max(0, head - 1);
        }
        return new Configuration(edge.to, tape, head);
    }
}
