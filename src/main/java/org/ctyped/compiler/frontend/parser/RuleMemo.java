package org.ctyped.compiler.frontend.parser;

import java.util.HashMap;
import java.util.Map;

/**
 * Remembers the outcome of one rule per start position, so ordered choices that retry the
 * same prefix reuse the earlier result instead of parsing it again.
 * <p>
 * Successes and recoverable failures are stored. Hard failures are not, since they abort the
 * whole parse. A memo belongs to one {@link Parser} and therefore to one token stream.
 */
final class RuleMemo {

    private final Map<Integer, Parsed> successes = new HashMap<>();
    private final Map<Integer, ParseFailure> failures = new HashMap<>();

    /**
     * Returns the remembered outcome at {@code pos}, or runs {@code rule} and remembers it.
     *
     * @throws ParseFailure the remembered or fresh failure of the rule.
     */
    Parsed apply(int pos, GrammarSupport.Rule rule) {
        Parsed known = successes.get(pos);
        if (known != null) {
            return known;
        }
        ParseFailure failed = failures.get(pos);
        if (failed != null) {
            throw failed;
        }
        try {
            Parsed result = rule.apply(pos);
            successes.put(pos, result);
            return result;
        } catch (ParseFailure f) {
            if (f.isRecoverable()) {
                failures.put(pos, f);
            }
            throw f;
        }
    }
}
