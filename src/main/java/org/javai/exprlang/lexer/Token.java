package org.javai.exprlang.lexer;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;

/**
 * A classified lexical unit of an expression.
 *
 * @param kind the token kind
 * @param raw the source text consumed for this token, before escape processing
 * @param value the decoded value; its variant follows from {@code kind}
 * @param start offset of the first code point of the token in the source
 * @param end offset just past the last code point of the token
 */
public record Token(TokenKind kind, String raw, TokenValue value, int start, int end) {

	public Token {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(raw, "raw must not be null");
		Objects.requireNonNull(value, "value must not be null");
		if (start < 0 || end < start) {
			throw new IllegalArgumentException("Invalid token range [" + start + ", " + end + ")");
		}
	}

	/**
	 * Creates a token that does not originate from source text, such as the
	 * {@link TokenKind#ARRAY} grouping a tree builder introduces.
	 */
	public static Token synthetic(TokenKind kind, TokenValue value) {
		return new Token(kind, value.text(), value, 0, 0);
	}

	public boolean isKind(TokenKind expectedKind) {
		return kind == expectedKind;
	}

	public double numericValue() {
		return as(TokenValue.Numeric.class).value();
	}

	public boolean booleanValue() {
		return as(TokenValue.Bool.class).value();
	}

	public String textValue() {
		return as(TokenValue.Text.class).value();
	}

	public ZonedDateTime timeValue() {
		return as(TokenValue.Time.class).value();
	}

	public ExpressionFunction functionValue() {
		return as(TokenValue.FunctionRef.class).function();
	}

	public List<String> pathValue() {
		return as(TokenValue.Path.class).segments();
	}

	public Operator operator() {
		return as(TokenValue.Symbol.class).operator();
	}

	private <V extends TokenValue> V as(Class<V> variant) {
		if (!variant.isInstance(value)) {
			throw new IllegalStateException(kind + " token carries " + value.getClass().getSimpleName()
					+ ", not " + variant.getSimpleName());
		}
		return variant.cast(value);
	}

	@Override
	public String toString() {
		return switch (kind) {
			case STRING -> "STRING('" + value.text() + "')";
			case CLAUSE, CLAUSE_CLOSE, SEPARATOR -> kind.toString();
			default -> kind + "(" + value.text() + ")";
		};
	}
}
