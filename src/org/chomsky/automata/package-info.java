/*
 * @LICENSE@
 */

/**
 * <h3><b>chomsky-automata</b> - machines and grammars of the Chomsky
 * hierarchy: build them, run them, convert them, combine them.</h3>
 * <p>
 * <h4>What's in the box.</h4>
 * <ul>
 * <li><b>Regular languages.</b> {@link org.chomsky.automata.DFA},
 * {@link org.chomsky.automata.NFA} (with epsilon edges) and
 * {@link org.chomsky.automata.GNFA}. NFAs become DFAs by subset construction;
 * any finite automaton becomes a regular expression by state elimination.
 * {@link org.chomsky.automata.DFAUtil} and
 * {@link org.chomsky.automata.NFAUtil} add union, intersection, negation,
 * alphabet extension, language equality, emptiness and universality.</li>
 * <li><b>Context-free languages.</b> {@link org.chomsky.automata.CFG}, which
 * {@link org.chomsky.automata.CFGUtil} normalizes into Chomsky normal form,
 * then tests for emptiness and membership (CYK). Pushdown automata
 * ({@link org.chomsky.automata.PDA}) are simulated directly.</li>
 * <li><b>Turing machines.</b> {@link org.chomsky.automata.TM}, simulated
 * breadth first over all nondeterministic branches.</li>
 * </ul>
 * <p>
 * <h4>Conventions.</h4>
 * <p>
 * Symbols are <code>char</code>s. {@link org.chomsky.automata.Alphabet#EPSILON}
 * ('ε') is the empty string and {@link org.chomsky.automata.Alphabet#BLANK}
 * ('□') the blank tape cell; neither is ever a member of an alphabet.
 * <p>
 * Machines and grammars are built by mutation (<code>addState</code>,
 * <code>addEdge</code>, <code>addTransition</code>, or one of the builders),
 * then queried. Every conversion and every algebraic operation returns a new
 * object and leaves its operands alone, so one machine can feed any number of
 * derivations.
 * <p>
 * Derived machines name their states after where they came from: subset
 * construction names a DFA state after its NFA states
 * (<code>{q0}{q1}</code>, or <code>dead-state</code> for none), combinations
 * prefix the states of each operand with <code>1-</code> and <code>2-</code>,
 * and Chomsky normal form introduces <code>S0</code>, <code>Tn</code> and
 * <code>Un</code>.
 * <p>
 * <h4>Errors.</h4>
 * <ul>
 * <li>{@link java.lang.IllegalArgumentException}: malformed input, such as an
 * unknown state, a symbol outside the alphabet or epsilon where a symbol is
 * needed.</li>
 * <li>{@link org.chomsky.automata.Automaton.IllegalAutomatonStateException}:
 * running or negating a DFA whose transition function is not total.</li>
 * <li>{@link org.chomsky.automata.AutomatonUtil.UndecidableProblemException}:
 * questions with no general algorithm (CFG universality and equality, every
 * language question about a TM).</li>
 * </ul>
 * <p>
 * <h4>Logging.</h4>
 * <p>
 * Construction traces go to the <code>java.util.logging</code> logger
 * <code>org.chomsky.automata</code> at <code>FINEST</code>.
 * <p>
 * <h4>Caveat.</h4>
 * <p>
 * {@link org.chomsky.automata.TM#runString(CharSequence)} does not return for
 * a machine that loops forever on the input without accepting. Callers who
 * need a bound must impose it from the outside.
 */
package org.chomsky.automata;
