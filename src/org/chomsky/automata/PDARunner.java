/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.chomsky.automata.PDA.Configuration;

/**
 * Runs a {@link PDA} on all its branches at once, as a set of
 * configurations. Configurations are compared by value, so two branches
 * that reach the same state with the same stack are followed once.
 */
final class PDARunner {

    private static final Logger logger = Logger.getLogger("org.chomsky.automata");
    private static final Level level = Level.FINEST;

    private final PDA pda;

    PDARunner(PDA pda) {
        this.pda = pda;
    }

    boolean run(CharSequence input) {
        Set<Configuration> current = epsilonClosure(Collections.singleton(
            new Configuration(pda.startState().name(), new ArrayList<Character>())));

        for (int i = 0; i < input.length(); ++i) {
            char c = input.charAt(i);
            Set<Configuration> next = new LinkedHashSet<Configuration>();
            for (Configuration conf : current) {
                for (PDAState.Edge edge : pda.stateFor(conf.state).edges(c)) {
                    Configuration nc = follow(conf, edge);
                    if (nc != null) next.add(nc);
                }
            }
            current = epsilonClosure(next);
            logger.log(level, "pda read " + c + ": " + current.size()
                + " configurations");
            if (current.isEmpty()) return false;
        }
        for (Configuration conf : current) {
            if (pda.stateFor(conf.state).isAccepting()) return true;
        }
        return false;
    }

    /*
     * Worklist over epsilon-input edges. Each configuration enters the
     * worklist once, when first added to the closure.
     */
    Set<Configuration> epsilonClosure(Collection<Configuration> seeds) {
        Set<Configuration> closure = new LinkedHashSet<Configuration>(seeds);
        LinkedList<Configuration> worklist = new LinkedList<Configuration>(seeds);
        while (!worklist.isEmpty()) {
            Configuration conf = worklist.removeFirst();
            for (PDAState.Edge edge
                    : pda.stateFor(conf.state).edges(Alphabet.EPSILON)) {
                Configuration nc = follow(conf, edge);
                if (nc != null && closure.add(nc)) worklist.addLast(nc);
            }
        }
        return closure;
    }

    /**
     * @return the configuration after taking <code>edge</code>, or
     *         <code>null</code> when the edge must pop a symbol that is not
     *         on top
     */
    static Configuration follow(Configuration conf, PDAState.Edge edge) {
        List<Character> stack = conf.stack;
        if (edge.pop != Alphabet.EPSILON) {
            if (stack.isEmpty() || stack.get(stack.size() - 1) != edge.pop) {
                return null;
            }
            stack = stack.subList(0, stack.size() - 1);
        }
        List<Character> ns = new ArrayList<Character>(stack.size() + 1);
        ns.addAll(stack);
        if (edge.push != Alphabet.EPSILON) ns.add(edge.push);
        return new Configuration(edge.to, ns);
    }
}
