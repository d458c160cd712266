package org.javai.exprlang.lexer;

/**
 * Reasons a tokenization can fail. Every one of them is fatal to the call.
 */
public enum ParseErrorKind {
	MALFORMED_NUMERIC,
	UNTERMINATED_LITERAL,
	INVALID_ACCESSOR,
	INVALID_TOKEN,
	UNBALANCED_PARENTHESIS,
	// only raised when strict syntax checking is enabled
	INVALID_TRANSITION
}
