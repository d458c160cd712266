/**
 * Expression tokenizer.
 * <p>
 * {@link org.javai.exprlang.lexer.ExpressionTokenizer} turns expression text into
 * {@link org.javai.exprlang.lexer.Token}s. Operator symbols come from
 * {@link org.javai.exprlang.lexer.OperatorSymbols}, quoted literals are matched
 * against {@link org.javai.exprlang.lexer.TimestampFormats}, and prefix operators
 * are told apart from binary ones with {@link org.javai.exprlang.lexer.LexerState}.
 */
@org.springframework.lang.NonNullApi
package org.javai.exprlang.lexer;
