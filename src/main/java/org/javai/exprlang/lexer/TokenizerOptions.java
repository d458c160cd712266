package org.javai.exprlang.lexer;

import java.time.ZoneId;
import java.util.Objects;

/**
 * Settings for an {@link ExpressionTokenizer}.
 *
 * @param operators symbol tables used to classify symbol runs
 * @param zone zone for timestamp literals that carry no offset
 * @param accessorPolicy rule applied to every non-root accessor segment
 * @param strictSyntax whether every token transition is checked against the lexer state table
 */
public record TokenizerOptions(
		OperatorSymbols operators,
		ZoneId zone,
		AccessorPolicy accessorPolicy,
		boolean strictSyntax) {

	public TokenizerOptions {
		Objects.requireNonNull(operators, "operators must not be null");
		Objects.requireNonNull(zone, "zone must not be null");
		Objects.requireNonNull(accessorPolicy, "accessorPolicy must not be null");
	}

	/**
	 * Bundled operator tables, the system zone, exported-only accessors and no strict syntax checking.
	 */
	public static TokenizerOptions defaults() {
		return new TokenizerOptions(OperatorSymbols.defaults(), ZoneId.systemDefault(),
				AccessorPolicy.exportedOnly(), false);
	}

	public TokenizerOptions withOperators(OperatorSymbols operators) {
		return new TokenizerOptions(operators, zone, accessorPolicy, strictSyntax);
	}

	public TokenizerOptions withZone(ZoneId zone) {
		return new TokenizerOptions(operators, zone, accessorPolicy, strictSyntax);
	}

	public TokenizerOptions withAccessorPolicy(AccessorPolicy accessorPolicy) {
		return new TokenizerOptions(operators, zone, accessorPolicy, strictSyntax);
	}

	public TokenizerOptions withStrictSyntax(boolean strictSyntax) {
		return new TokenizerOptions(operators, zone, accessorPolicy, strictSyntax);
	}
}
