/*
 * @LICENSE@
 */

package org.chomsky.automata;

import java.util.regex.PatternSyntaxException;

/**
 * Compiles a GNFA edge label into a fragment of an {@link NFA}, so that a
 * GNFA can be run without handing its labels to a backtracking matcher.
 * <p>
 * Labels are the regular core of {@link java.util.regex.Pattern} syntax:
 * literals, groups, <code>|</code>, the quantifiers <code>*</code>,
 * <code>+</code> and <code>?</code>, <code>.</code> for any symbol of the
 * alphabet, backslash-escaped metacharacters, and the escapes
 * <code>\t \n \r \f \a \e</code>, <code>\x</code><i>hh</i> and <code>\</code><code>u</code><i>hhhh</i>. Everything else (character
 * classes, bounded repetition, anchors, named classes) is rejected.
 * <p>
 * Only groups recurse; concatenation and alternation are loops, so long
 * labels are fine.
 */
final class LabelParser {

    private static final int EOX = -1; // end of expression

    /*
     * an NFA piece with one entry and one exit state
     */
    private static final class Fragment {
        final String in;
        final String out;

        Fragment(String in, String out) {
            this.in = in;
            this.out = out;
        }
    }

    private final String label;
    private final NFA target;
    private int iNext = 0;
    private int iCurrent = 0;

    private LabelParser(String label, NFA target) {
        this.label = label;
        this.target = target;
    }

    /**
     * Adds states and edges to <code>target</code> so that the strings
     * leading from <code>from</code> to <code>to</code> through them are
     * exactly those matching <code>label</code>.
     *
     * @throws PatternSyntaxException for a malformed or unsupported label
     */
    static void compile(String label, NFA target, String from, String to) {
        Fragment f = new LabelParser(label, target).regex();
        target.addEpsilonEdge(from, f.in);
        target.addEpsilonEdge(f.out, to);
    }

    /**
     * @throws PatternSyntaxException for a malformed or unsupported label
     */
    static void check(String label, Alphabet alphabet) {
        new LabelParser(label, new NFA(alphabet, "check", false)).regex();
    }

    private Fragment regex() {
        Fragment ret = alternation();
        if (peek() != EOX) {
            next();
            syntaxError("unbalanced parenthesis");
        }
        return ret;
    }

    private Fragment alternation() {
        Fragment first = sequence();
        if (peek() != '|') return first;
        Fragment ret = new Fragment(fresh(), fresh());
        join(ret.in, first.in);
        join(first.out, ret.out);
        while (peek() == '|') {
            next();
            Fragment f = sequence();
            join(ret.in, f.in);
            join(f.out, ret.out);
        }
        return ret;
    }

    private Fragment sequence() {
        String in = fresh();
        String out = in;
        for (int c = peek(); c != EOX && c != '|' && c != ')'; c = peek()) {
            Fragment f = repetition();
            join(out, f.in);
            out = f.out;
        }
        return new Fragment(in, out);
    }

    private Fragment repetition() {
        Fragment ret = atom();
        for (int c = peek(); c == '*' || c == '+' || c == '?'; c = peek()) {
            next();
            Fragment f = new Fragment(fresh(), fresh());
            join(f.in, ret.in);
            join(ret.out, f.out);
            if (c != '+') join(f.in, f.out);
            if (c != '?') join(ret.out, ret.in);
            ret = f;
        }
        return ret;
    }

    private Fragment atom() {
        int c = next();
        switch (c) {
        case '(':
            if (peek() == '?') syntaxError("special groups are not supported");
            Fragment ret = alternation();
            if (next() != ')') syntaxError("unbalanced parenthesis");
            return ret;
        case '*':
        case '+':
        case '?':
            syntaxError("dangling quantifier");
            break;
        case '[':
        case '{':
        case '^':
        case '$':
            syntaxError("not supported in a GNFA label");
            break;
        case '.':
            Fragment any = new Fragment(fresh(), fresh());
            for (char symbol : target.alphabet()) {
                target.addEdge(any.in, symbol, any.out);
            }
            return any;
        case '\\':
            return literal(escaped());
        default:
            break;
        }
        return literal((char) c);
    }

    private char escaped() {
        int c = next();
        switch (c) {
        case EOX:
            syntaxError("trailing backslash");
            break;
        case 't':
            return '\t';
        case 'n':
            return '\n';
        case 'r':
            return '\r';
        case 'f':
            return '\f';
        case 'a':
            return '\007';
        case 'e':
            return '\033';
        case 'x':
            return hex(2);
        case 'u':
            return hex(4);
        default:
            if (Character.isLetterOrDigit(c)) {
                syntaxError("escape not supported in a GNFA label");
            }
            break;
        }
        return (char) c;
    }

    private char hex(int digits) {
        int ret = 0;
        for (int i = 0; i < digits; ++i) {
            int d = Character.digit(next(), 16);
            if (d < 0) syntaxError("illegal hexadecimal escape");
            ret = ret * 16 + d;
        }
        return (char) ret;
    }

    /*
     * a symbol outside the alphabet never occurs in valid input: no edge
     */
    private Fragment literal(char c) {
        Fragment ret = new Fragment(fresh(), fresh());
        if (target.alphabet().contains(c)) {
            target.addEdge(ret.in, c, ret.out);
        }
        return ret;
    }

    private void join(String from, String to) {
        target.addEpsilonEdge(from, to);
    }

    private String fresh() {
        String name = "#" + target.size();
        while (target.hasState(name)) name += '\'';
        target.addState(name, false);
        return name;
    }

    private int peek() {
        return iNext < label.length() ? label.charAt(iNext) : EOX;
    }

    private int next() {
        iCurrent = iNext;
        return iNext < label.length() ? label.charAt(iNext++) : EOX;
    }

    private void syntaxError(String msg) {
        throw new PatternSyntaxException(msg, label, iCurrent);
    }
}
