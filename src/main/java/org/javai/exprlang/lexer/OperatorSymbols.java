package org.javai.exprlang.lexer;

import java.util.Map;
import java.util.Optional;

/**
 * The five symbol tables the tokenizer classifies symbol runs against.
 * <p>
 * Instances are immutable and may be shared between tokenizers and threads.
 *
 * @param prefix operators valid only where an operand may start
 * @param modifier binary arithmetic and bitwise operators
 * @param logical logical connectives
 * @param comparator comparison operators, including the textual {@code in}
 * @param ternary ternary and coalescing operators
 */
public record OperatorSymbols(
		Map<String, Operator> prefix,
		Map<String, Operator> modifier,
		Map<String, Operator> logical,
		Map<String, Operator> comparator,
		Map<String, Operator> ternary) {

	public OperatorSymbols {
		prefix = copy(prefix);
		modifier = copy(modifier);
		logical = copy(logical);
		comparator = copy(comparator);
		ternary = copy(ternary);
	}

	/**
	 * Tables loaded from {@code META-INF/exprlang-operators.yml} on this library's classpath.
	 */
	public static OperatorSymbols defaults() {
		return DefaultsHolder.DEFAULTS;
	}

	public Optional<Operator> prefixOperator(String symbol) {
		return Optional.ofNullable(prefix.get(symbol));
	}

	public Optional<Operator> modifierOperator(String symbol) {
		return Optional.ofNullable(modifier.get(symbol));
	}

	public Optional<Operator> logicalOperator(String symbol) {
		return Optional.ofNullable(logical.get(symbol));
	}

	public Optional<Operator> comparatorOperator(String symbol) {
		return Optional.ofNullable(comparator.get(symbol));
	}

	public Optional<Operator> ternaryOperator(String symbol) {
		return Optional.ofNullable(ternary.get(symbol));
	}

	private static Map<String, Operator> copy(Map<String, Operator> table) {
		return table != null ? Map.copyOf(table) : Map.of();
	}

	private static final class DefaultsHolder {
		private static final OperatorSymbols DEFAULTS = new OperatorSymbolsLoader().loadDefault();
	}
}
