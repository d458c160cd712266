package org.javai.exprlang.lexer;

/**
 * Operator identities that symbol text resolves to.
 * <p>
 * The mapping from text to identity lives in {@link OperatorSymbols}; the same
 * text may map to different identities in different tables ({@code -} is
 * {@link #NEGATE} as a prefix and {@link #MINUS} as a modifier).
 */
public enum Operator {

	// prefix
	NEGATE,
	INVERT,
	BITWISE_NOT,

	// modifier
	PLUS,
	MINUS,
	MULTIPLY,
	DIVIDE,
	MODULUS,
	EXPONENT,
	BITWISE_AND,
	BITWISE_OR,
	BITWISE_XOR,
	BITWISE_LSHIFT,
	BITWISE_RSHIFT,

	// logical
	AND,
	OR,

	// comparator
	EQ,
	NEQ,
	GT,
	GTE,
	LT,
	LTE,
	REQ,
	NREQ,
	IN,

	// ternary
	TERNARY_TRUE,
	TERNARY_FALSE,
	COALESCE
}
