package org.javai.exprlang.tree;

/**
 * Thrown when a tree contains a node whose kind has no textual form, such as a
 * separator or a parenthesis token that a tree builder should have consumed.
 */
public class UnrenderableNodeException extends RuntimeException {

	private final transient ExpressionNode node;

	public UnrenderableNodeException(ExpressionNode node) {
		super("Cannot render " + node.kind() + " node '" + node.token().raw() + "'");
		this.node = node;
	}

	public ExpressionNode node() {
		return node;
	}
}
