package org.javai.exprlang.tree;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders an expression syntax tree back into canonical expression text.
 * <p>
 * Logical connectives are split over indented lines, two spaces per depth level,
 * and parenthesised unless they sit at the top. Comparators stay on one line.
 * Arithmetic and ternary operators are parenthesised when nested, so the output
 * re-reads with the same grouping.
 * <p>
 * Rendering is a pure function of the tree. Nodes whose kind has no text form
 * (separators, parentheses) either fail the call ({@link #strict()}, the default)
 * or render as nothing ({@link #lenient()}).
 */
public final class ExpressionRenderer {

	private static final Logger logger = LoggerFactory.getLogger(ExpressionRenderer.class);

	private static final String INDENT = "  ";

	private static final ExpressionRenderer STRICT = new ExpressionRenderer(true);
	private static final ExpressionRenderer LENIENT = new ExpressionRenderer(false);

	private final boolean strict;

	private ExpressionRenderer(boolean strict) {
		this.strict = strict;
	}

	public static ExpressionRenderer strict() {
		return STRICT;
	}

	/**
	 * A renderer that writes an empty fragment for nodes it cannot render, logging a warning.
	 */
	public static ExpressionRenderer lenient() {
		return LENIENT;
	}

	/**
	 * Static convenience method to render a tree with the strict renderer.
	 */
	public static String print(ExpressionNode root) {
		return STRICT.render(root);
	}

	public String render(ExpressionNode root) {
		return render(root, 0);
	}

	/**
	 * Renders a node as if it were nested {@code depth} levels deep.
	 *
	 * @throws UnrenderableNodeException in strict mode, for a node kind with no text form
	 */
	public String render(ExpressionNode node, int depth) {
		Objects.requireNonNull(node, "node must not be null");
		if (depth < 0) {
			throw new IllegalArgumentException("depth must not be negative: " + depth);
		}

		String text = node.token().value().text();
		return switch (node.kind()) {
			case LOGICALOP -> renderLogical(node, text, depth);
			case COMPARATOR -> render(node.child(0), depth + 1) + " " + text + " " + render(node.child(1), depth + 1);
			case MODIFIER, TERNARY -> group(
					render(node.child(0), depth + 1) + " " + text + " " + render(node.child(1), depth + 1), depth);
			case PREFIX -> text + "(" + render(node.child(0), depth + 1) + ")";
			case FUNCTION -> text + "( " + join(node.children(), 0) + " )";
			case ARRAY -> "( " + join(node.children(), depth + 1) + " )";
			case VARIABLE, STRING, NUMERIC, BOOLEAN, ACCESSOR -> text;
			case TIME -> "'" + text + "'";
			case SEPARATOR, CLAUSE, CLAUSE_CLOSE, UNKNOWN -> unrenderable(node, depth);
		};
	}

	private String renderLogical(ExpressionNode node, String operator, int depth) {
		String indent = INDENT.repeat(depth);
		String code = render(node.child(0), depth + 1)
				+ "\n" + indent + operator
				+ "\n" + indent + render(node.child(1), depth + 1);
		if (depth == 0) {
			return code;
		}
		return "(\n" + indent + code + "\n" + indent + ")";
	}

	private String join(List<ExpressionNode> nodes, int depth) {
		return nodes.stream()
				.map(child -> render(child, depth))
				.collect(Collectors.joining(", "));
	}

	private static String group(String code, int depth) {
		return depth == 0 ? code : "(" + code + ")";
	}

	private String unrenderable(ExpressionNode node, int depth) {
		if (strict) {
			throw new UnrenderableNodeException(node);
		}
		logger.warn("Dropping {} node '{}' at depth {}: kind has no text form",
				node.kind(), node.token().raw(), depth);
		return "";
	}
}
