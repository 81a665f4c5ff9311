package org.ctyped.compiler.frontend.parser.ast;

import org.ctyped.compiler.frontend.types.TypeExpression;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * One node of the typed parse tree. Nodes are immutable and own their children exclusively.
 *
 * @param kind The production that built the node, with its payload.
 * @param children The child nodes in source order.
 * @param type The C type of the construct, never {@code null}.
 */
public record ParseNode(NodeKind kind, List<ParseNode> children, TypeExpression type) {

    public ParseNode {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(type, "every parse node must carry a type");
        children = List.copyOf(children);
    }

    public static ParseNode leaf(NodeKind kind, TypeExpression type) {
        return new ParseNode(kind, List.of(), type);
    }

    public static ParseNode of(NodeKind kind, TypeExpression type, ParseNode... children) {
        return new ParseNode(kind, List.of(children), type);
    }

    public ParseNode child(int index) {
        return children.get(index);
    }

    /**
     * @return This node followed by all of its descendants in pre-order.
     */
    public Stream<ParseNode> descendants() {
        return Stream.concat(Stream.of(this), children.stream().flatMap(ParseNode::descendants));
    }

    /**
     * Unwraps single-child wrappers until a node with a different shape is reached.
     * @return The first node that does not have exactly one child, or whose kind carries a payload.
     */
    public ParseNode unwrap() {
        ParseNode n = this;
        while (n.children.size() == 1 && n.kind instanceof NodeKind.Production) {
            n = n.children.get(0);
        }
        return n;
    }
}
