package org.javai.exprlang.lexer;

import java.math.BigDecimal;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Decoded payload of a {@link Token}. The variant is determined by the token's kind.
 */
public sealed interface TokenValue {

	/**
	 * Text form used when the value is written back out as an expression fragment.
	 */
	String text();

	record Numeric(double value) implements TokenValue {

		@Override
		public String text() {
			if (Double.isNaN(value) || Double.isInfinite(value)) {
				return Double.toString(value);
			}
			// plain notation so the text re-reads as a numeric literal (no exponent, no trailing .0)
			return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
		}
	}

	record Bool(boolean value) implements TokenValue {

		@Override
		public String text() {
			return Boolean.toString(value);
		}
	}

	/**
	 * Decoded string content, variable names and delimiter characters.
	 */
	record Text(String value) implements TokenValue {

		public Text {
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public String text() {
			return value;
		}
	}

	record Time(ZonedDateTime value) implements TokenValue {

		public Time {
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public String text() {
			return value.toOffsetDateTime().toString();
		}
	}

	record FunctionRef(ExpressionFunction function) implements TokenValue {

		public FunctionRef {
			Objects.requireNonNull(function, "function must not be null");
		}

		@Override
		public String text() {
			return function.name();
		}
	}

	/**
	 * Segments of an accessor path, first segment being the root variable.
	 */
	record Path(List<String> segments) implements TokenValue {

		public Path {
			segments = List.copyOf(segments);
		}

		@Override
		public String text() {
			return String.join(".", segments);
		}
	}

	/**
	 * Operator symbol text together with the identity it resolved to.
	 */
	record Symbol(String symbol, Operator operator) implements TokenValue {

		public Symbol {
			Objects.requireNonNull(symbol, "symbol must not be null");
			Objects.requireNonNull(operator, "operator must not be null");
		}

		@Override
		public String text() {
			return symbol;
		}
	}
}
