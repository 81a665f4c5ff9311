package org.ctyped.compiler.frontend.parser;

import org.ctyped.compiler.diagnostics.CompilerLogger;
import org.ctyped.compiler.frontend.lexer.TokenType;
import org.ctyped.compiler.frontend.parser.ast.ParseNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The backtracking combinators shared by all grammar classes.
 */
final class GrammarSupport {

    private GrammarSupport() {}

    /**
     * A grammar rule: a pure function from a start position to a result.
     */
    @FunctionalInterface
    interface Rule {
        /**
         * @param pos The position to start at.
         * @return The parsed node and the position after it.
         * @throws ParseFailure if the rule does not match at {@code pos}.
         */
        Parsed apply(int pos);
    }

    /**
     * The nodes of a list production and the position after the last one.
     *
     * @param nodes The parsed items, possibly empty for repetitions.
     * @param position The first position not consumed.
     */
    record Sequence(List<ParseNode> nodes, int position) {
        boolean isEmpty() {
            return nodes.isEmpty();
        }
    }

    /**
     * Ordered choice. Each alternative starts at {@code pos}; the first success wins.
     * Only recoverable failures are discarded.
     *
     * @param production Name used in the failure message.
     * @param pos The start position shared by all alternatives.
     * @param alternatives The candidates, in priority order.
     * @return The result of the first alternative that succeeds.
     * @throws ParseFailure {@code NO_VIABLE_ALTERNATIVE} carrying the last failure, or any hard failure.
     */
    static Parsed firstOf(String production, int pos, Rule... alternatives) {
        ParseFailure last = null;
        for (Rule alternative : alternatives) {
            try {
                return alternative.apply(pos);
            } catch (ParseFailure f) {
                if (!f.isRecoverable()) {
                    throw f;
                }
                if (CompilerLogger.isTraceEnabled()) {
                    CompilerLogger.trace(production + " alternative failed at " + pos + ": " + f.getMessage());
                }
                last = f;
            }
        }
        throw ParseFailure.noViableAlternative(production, pos, last);
    }

    /**
     * Runs a rule, turning a recoverable failure into an empty result.
     */
    static Optional<Parsed> optional(Rule rule, int pos) {
        try {
            return Optional.of(rule.apply(pos));
        } catch (ParseFailure f) {
            if (!f.isRecoverable()) {
                throw f;
            }
            return Optional.empty();
        }
    }

    /**
     * Zero or more repetitions of {@code item}, stopping at the first recoverable failure.
     */
    static Sequence repeat(Rule item, int pos) {
        List<ParseNode> nodes = new ArrayList<>();
        int p = pos;
        while (true) {
            Optional<Parsed> next = optional(item, p);
            if (next.isEmpty() || next.get().position() == p) {
                return new Sequence(nodes, p);
            }
            nodes.add(next.get().node());
            p = next.get().position();
        }
    }

    /**
     * One or more repetitions of {@code item}.
     * @throws ParseFailure from the first item if not even one matches.
     */
    static Sequence repeatAtLeastOnce(Rule item, int pos) {
        Parsed first = item.apply(pos);
        Sequence rest = repeat(item, first.position());
        List<ParseNode> nodes = new ArrayList<>(rest.nodes().size() + 1);
        nodes.add(first.node());
        nodes.addAll(rest.nodes());
        return new Sequence(nodes, rest.position());
    }

    /**
     * One or more items separated by {@code separator}. A separator is committed only together
     * with the item after it, so for {@code a , b , )} the list is {@code a , b} and the
     * returned position points at the trailing comma.
     *
     * @throws ParseFailure from the first item if the list is empty.
     */
    static Sequence separatedList(Rule item, TokenType separator, TokenCursor cursor, int pos) {
        Parsed first = item.apply(pos);
        List<ParseNode> nodes = new ArrayList<>();
        nodes.add(first.node());
        int p = first.position();
        while (cursor.check(p, separator)) {
            Optional<Parsed> next = optional(item, p + 1);
            if (next.isEmpty()) {
                break;
            }
            nodes.add(next.get().node());
            p = next.get().position();
        }
        return new Sequence(nodes, p);
    }
}
