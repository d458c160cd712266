package org.javai.exprlang.tree;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.javai.exprlang.lexer.Token;
import org.javai.exprlang.lexer.TokenKind;

/**
 * A node of an expression syntax tree: a token plus its ordered children.
 * <p>
 * Trees are built outside this library from tokenizer output. The constructor
 * rejects child counts that do not fit the token kind:
 * operators with two operands take exactly two children, prefix operators one,
 * literals and variables none; functions and arrays take any number.
 */
public record ExpressionNode(Token token, List<ExpressionNode> children) {

	public ExpressionNode {
		Objects.requireNonNull(token, "token must not be null");
		children = children != null ? List.copyOf(children) : List.of();
		checkArity(token.kind(), children.size());
	}

	/**
	 * Creates a node without children.
	 */
	public static ExpressionNode leaf(Token token) {
		return new ExpressionNode(token, List.of());
	}

	public static ExpressionNode of(Token token, ExpressionNode... children) {
		return new ExpressionNode(token, Arrays.asList(children));
	}

	public TokenKind kind() {
		return token.kind();
	}

	public ExpressionNode child(int index) {
		return children.get(index);
	}

	public boolean isLeaf() {
		return children.isEmpty();
	}

	private static void checkArity(TokenKind kind, int count) {
		int expected = switch (kind) {
			case COMPARATOR, LOGICALOP, MODIFIER, TERNARY -> 2;
			case PREFIX -> 1;
			case NUMERIC, STRING, TIME, BOOLEAN, VARIABLE, ACCESSOR -> 0;
			default -> -1;
		};
		if (expected >= 0 && count != expected) {
			throw new IllegalArgumentException(kind + " node requires " + expected + " children but got " + count);
		}
	}
}
