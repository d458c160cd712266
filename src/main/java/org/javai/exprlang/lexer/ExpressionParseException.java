package org.javai.exprlang.lexer;

/**
 * Exception thrown when expression text cannot be tokenized.
 * <p>
 * Carries the offending source text and its {@code [start, end)} code point range
 * so callers can point at the problem.
 */
public class ExpressionParseException extends RuntimeException {

	private final ParseErrorKind kind;
	private final String offendingText;
	private final int start;
	private final int end;

	public ExpressionParseException(ParseErrorKind kind, String message, String offendingText, int start, int end) {
		this(kind, message, offendingText, start, end, null);
	}

	public ExpressionParseException(ParseErrorKind kind, String message, String offendingText, int start, int end,
			Throwable cause) {
		super(message + " at [" + start + ", " + end + ")", cause);
		this.kind = kind;
		this.offendingText = offendingText;
		this.start = start;
		this.end = end;
	}

	public ParseErrorKind kind() {
		return kind;
	}

	public String offendingText() {
		return offendingText;
	}

	public int start() {
		return start;
	}

	public int end() {
		return end;
	}
}
