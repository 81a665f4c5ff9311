package org.ctyped.compiler.util;

import org.ctyped.compiler.frontend.parser.ast.ParseNode;

/**
 * Renders typed parse trees as indented text for logs and tests.
 */
public final class TreePrinter {

	private TreePrinter() {}

	/**
	 * Prints one line per node in pre-order: a dash per level of depth, the node kind and its type.
	 * @param root The root of the tree.
	 * @return The rendering, each line terminated by a newline.
	 */
	public static String print(ParseNode root) {
		StringBuilder sb = new StringBuilder();
		append(sb, root, 0);
		return sb.toString();
	}

	private static void append(StringBuilder sb, ParseNode node, int depth) {
		sb.append("-".repeat(depth))
				.append(node.kind().describe())
				.append(" : ")
				.append(node.type())
				.append('\n');
		for (ParseNode child : node.children()) {
			append(sb, child, depth + 1);
		}
	}
}
