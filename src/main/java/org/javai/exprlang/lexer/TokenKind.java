package org.javai.exprlang.lexer;

/**
 * Category of a lexical token.
 * <p>
 * These kinds are the contract between the tokenizer and whatever builds a
 * syntax tree from its output. {@link #ARRAY} is never emitted by the tokenizer;
 * it only appears in trees handed to the renderer.
 */
public enum TokenKind {
	NUMERIC,       // 64-bit float, decimal or 0x-prefixed hex
	STRING,        // 'quoted' or "quoted" text that is not a timestamp
	TIME,          // quoted text matching one of the timestamp formats
	BOOLEAN,       // true / false
	VARIABLE,      // plain or [bracketed] name
	ACCESSOR,      // dotted path such as order.Customer.Name
	FUNCTION,      // name found in the caller's function mapping
	SEPARATOR,     // ,
	COMPARATOR,    // == != > >= < <= =~ !~ in
	LOGICALOP,     // && ||
	PREFIX,        // unary - ! ~
	MODIFIER,      // binary arithmetic and bitwise operators
	TERNARY,       // ? : ??
	CLAUSE,        // (
	CLAUSE_CLOSE,  // )
	ARRAY,         // tree-only grouping of values
	UNKNOWN
}
