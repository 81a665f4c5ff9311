package org.ctyped.compiler.api;

import org.ctyped.compiler.frontend.parser.ast.ParseNode;

/**
 * The result of a successful parse: the translation-unit node and the label of its source.
 *
 * @param root The translation-unit node. Every node below it carries a type.
 * @param sourceLabel The label of the parsed source, usually a file name.
 * @param tokenCount The number of tokens the tree was built from.
 */
public record ParseTree(ParseNode root, String sourceLabel, int tokenCount) {
}
