package org.ctyped.compiler.frontend.parser;

import org.ctyped.compiler.frontend.parser.ast.ParseNode;
import org.ctyped.compiler.frontend.types.TypeExpression;

/**
 * The result of a successful rule: the node it built and the position right after it.
 *
 * @param node The new subtree.
 * @param position The index of the first token not consumed by the rule.
 */
public record Parsed(ParseNode node, int position) {

    public TypeExpression type() {
        return node.type();
    }
}
