package org.javai.exprlang.lexer;

import java.util.List;
import java.util.Objects;

/**
 * Describes a function that can be called from within an expression.
 * <p>
 * Descriptors are supplied by the caller as a name-to-descriptor mapping; the
 * tokenizer only looks names up and attaches the matching descriptor to the
 * resulting {@link TokenKind#FUNCTION} token.
 *
 * @param name the name the function is called by
 * @param parameterTypes type names of the parameters, in call order
 * @param returnType type name of the result
 */
public record ExpressionFunction(String name, List<String> parameterTypes, String returnType) {

	public ExpressionFunction {
		Objects.requireNonNull(name, "name must not be null");
		parameterTypes = parameterTypes != null ? List.copyOf(parameterTypes) : List.of();
		Objects.requireNonNull(returnType, "returnType must not be null");
	}

	public static ExpressionFunction of(String name, String returnType, String... parameterTypes) {
		return new ExpressionFunction(name, List.of(parameterTypes), returnType);
	}

	public int arity() {
		return parameterTypes.size();
	}
}
