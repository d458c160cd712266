package org.javai.exprlang.lexer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.Level;
import org.javai.exprlang.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

@DisplayName("Expression tokenizer")
class ExpressionTokenizerTest {

	private final ExpressionTokenizer tokenizer = new ExpressionTokenizer(
			TokenizerOptions.defaults().withZone(ZoneOffset.UTC));

	private static List<TokenKind> kinds(List<Token> tokens) {
		return tokens.stream().map(Token::kind).toList();
	}

	@Nested
	@DisplayName("Empty and blank input")
	class EmptyInput {

		@Test
		void tokenizeEmptyString() {
			assertThat(tokenizer.tokenize("")).isEmpty();
		}

		@Test
		void tokenizeWhitespaceOnly() {
			assertThat(tokenizer.tokenize("   \n\t  ")).isEmpty();
		}

		@Test
		void tokenizeNullInput() {
			assertThat(tokenizer.tokenize(null)).isEmpty();
		}

		@Test
		void noBreakSpaceSeparatesTokens() {
			List<Token> tokens = tokenizer.tokenize("1\u00a0+ 2");

			assertThat(kinds(tokens)).containsExactly(TokenKind.NUMERIC, TokenKind.MODIFIER, TokenKind.NUMERIC);
			assertThat(tokens.get(1).raw()).isEqualTo("+");
		}

		@Test
		void unicodeSpacesOnlyAreEmpty() {
			assertThat(tokenizer.tokenize("\u00a0\u2003\u3000")).isEmpty();
		}

		@Test
		void trailingWhitespaceIsNotAnError() {
			List<Token> tokens = tokenizer.tokenize("x   ");

			assertThat(tokens).hasSize(1);
			assertThat(tokens.get(0).end()).isEqualTo(1);
		}
	}

	@Nested
	@DisplayName("Numeric literals")
	class Numerics {

		@Test
		void tokenizeSimpleAddition() {
			List<Token> tokens = tokenizer.tokenize("1 + 2");

			assertThat(kinds(tokens)).containsExactly(TokenKind.NUMERIC, TokenKind.MODIFIER, TokenKind.NUMERIC);
			assertThat(tokens.get(0).numericValue()).isEqualTo(1.0);
			assertThat(tokens.get(1).value()).isEqualTo(new TokenValue.Symbol("+", Operator.PLUS));
			assertThat(tokens.get(2).numericValue()).isEqualTo(2.0);
		}

		@Test
		void tokenizeDecimal() {
			Token token = tokenizer.tokenize("3.14").get(0);

			assertThat(token.kind()).isEqualTo(TokenKind.NUMERIC);
			assertThat(token.numericValue()).isEqualTo(3.14);
			assertThat(token.raw()).isEqualTo("3.14");
		}

		@Test
		void tokenizeLeadingDecimalPoint() {
			Token token = tokenizer.tokenize(".5").get(0);

			assertThat(token.numericValue()).isEqualTo(0.5);
		}

		@Test
		void tokenizeHexadecimal() {
			Token token = tokenizer.tokenize("0xFF").get(0);

			assertThat(token.kind()).isEqualTo(TokenKind.NUMERIC);
			assertThat(token.numericValue()).isEqualTo(255.0);
			assertThat(token.raw()).isEqualTo("0xFF");
			assertThat(token.start()).isZero();
			assertThat(token.end()).isEqualTo(4);
		}

		@Test
		void tokenizeLargestUnsignedHex() {
			Token token = tokenizer.tokenize("0xFFFFFFFFFFFFFFFF").get(0);

			assertThat(token.numericValue()).isEqualTo(18446744073709551615.0);
		}

		@Test
		void tokenizeZeroAndLeadingZero() {
			List<Token> tokens = tokenizer.tokenize("0 + 007");

			assertThat(tokens.get(0).numericValue()).isZero();
			assertThat(tokens.get(2).numericValue()).isEqualTo(7.0);
		}

		@Test
		void multipleDecimalPointsAreMalformed() {
			assertThatThrownBy(() -> tokenizer.tokenize("1.2.3"))
				.isInstanceOf(ExpressionParseException.class)
				.hasMessageContaining("1.2.3")
				.satisfies(e -> {
					ExpressionParseException error = (ExpressionParseException) e;
					assertThat(error.kind()).isEqualTo(ParseErrorKind.MALFORMED_NUMERIC);
					assertThat(error.offendingText()).isEqualTo("1.2.3");
					assertThat(error.start()).isZero();
					assertThat(error.end()).isEqualTo(5);
				});
		}

		@Test
		void hexWithoutDigitsIsMalformed() {
			assertThatThrownBy(() -> tokenizer.tokenize("0x"))
				.isInstanceOf(ExpressionParseException.class)
				.extracting(e -> ((ExpressionParseException) e).kind())
				.isEqualTo(ParseErrorKind.MALFORMED_NUMERIC);
		}

		@Test
		void hexOverflowIsMalformed() {
			assertThatThrownBy(() -> tokenizer.tokenize("0x1FFFFFFFFFFFFFFFF"))
				.isInstanceOf(ExpressionParseException.class)
				.extracting(e -> ((ExpressionParseException) e).kind())
				.isEqualTo(ParseErrorKind.MALFORMED_NUMERIC);
		}
	}

	@Nested
	@DisplayName("Prefix versus modifier")
	class PrefixDisambiguation {

		@Test
		void minusAtStartIsPrefix() {
			List<Token> tokens = tokenizer.tokenize("-1");

			assertThat(kinds(tokens)).containsExactly(TokenKind.PREFIX, TokenKind.NUMERIC);
			assertThat(tokens.get(0).operator()).isEqualTo(Operator.NEGATE);
		}

		@Test
		void minusBetweenOperandsIsModifier() {
			List<Token> tokens = tokenizer.tokenize("1 - 1");

			assertThat(kinds(tokens)).containsExactly(TokenKind.NUMERIC, TokenKind.MODIFIER, TokenKind.NUMERIC);
			assertThat(tokens.get(1).operator()).isEqualTo(Operator.MINUS);
		}

		@Test
		void minusAfterOpeningParenthesisIsPrefix() {
			List<Token> tokens = tokenizer.tokenize("(-x)");

			assertThat(tokens.get(1).kind()).isEqualTo(TokenKind.PREFIX);
		}

		@Test
		void minusAfterOperatorIsPrefix() {
			List<Token> tokens = tokenizer.tokenize("2 * -3");

			assertThat(kinds(tokens)).containsExactly(
				TokenKind.NUMERIC, TokenKind.MODIFIER, TokenKind.PREFIX, TokenKind.NUMERIC);
		}

		@Test
		void minusAfterClosingParenthesisIsModifier() {
			List<Token> tokens = tokenizer.tokenize("(a) - b");

			assertThat(tokens.get(3).kind()).isEqualTo(TokenKind.MODIFIER);
		}

		@Test
		void minusAfterSeparatorIsPrefix() {
			List<Token> tokens = tokenizer.tokenize("a, -b");

			assertThat(kinds(tokens)).containsExactly(
				TokenKind.VARIABLE, TokenKind.SEPARATOR, TokenKind.PREFIX, TokenKind.VARIABLE);
		}

		@Test
		void invertAtStartIsPrefix() {
			List<Token> tokens = tokenizer.tokenize("!done");

			assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.PREFIX);
			assertThat(tokens.get(0).operator()).isEqualTo(Operator.INVERT);
		}

		@Test
		void prefixOnlySymbolAfterOperandIsInvalid() {
			assertThatThrownBy(() -> tokenizer.tokenize("a ~ b"))
				.isInstanceOf(ExpressionParseException.class)
				.hasMessageContaining("Invalid token: '~'");
		}
	}

	@Nested
	@DisplayName("Operators")
	class Operators {

		@Test
		void classifiesEachTable() {
			List<Token> tokens = tokenizer.tokenize("a ** 2 >= b && c ? d : e ?? f");

			assertThat(kinds(tokens)).containsExactly(
				TokenKind.VARIABLE, TokenKind.MODIFIER, TokenKind.NUMERIC, TokenKind.COMPARATOR,
				TokenKind.VARIABLE, TokenKind.LOGICALOP, TokenKind.VARIABLE, TokenKind.TERNARY,
				TokenKind.VARIABLE, TokenKind.TERNARY, TokenKind.VARIABLE, TokenKind.TERNARY,
				TokenKind.VARIABLE);
			assertThat(tokens.get(1).operator()).isEqualTo(Operator.EXPONENT);
			assertThat(tokens.get(3).operator()).isEqualTo(Operator.GTE);
			assertThat(tokens.get(5).operator()).isEqualTo(Operator.AND);
			assertThat(tokens.get(11).operator()).isEqualTo(Operator.COALESCE);
		}

		@Test
		void symbolsNeedNoSurroundingWhitespace() {
			List<Token> tokens = tokenizer.tokenize("a>=1||b!=2");

			assertThat(kinds(tokens)).containsExactly(
				TokenKind.VARIABLE, TokenKind.COMPARATOR, TokenKind.NUMERIC, TokenKind.LOGICALOP,
				TokenKind.VARIABLE, TokenKind.COMPARATOR, TokenKind.NUMERIC);
		}

		@ParameterizedTest
		@ValueSource(strings = { "in", "IN", "In" })
		void textualInIsCanonicalisedComparator(String keyword) {
			Token token = tokenizer.tokenize("x " + keyword + " y").get(1);

			assertThat(token.kind()).isEqualTo(TokenKind.COMPARATOR);
			assertThat(token.value()).isEqualTo(new TokenValue.Symbol("in", Operator.IN));
			assertThat(token.raw()).isEqualTo(keyword);
		}

		@Test
		void unknownSymbolRunIsInvalid() {
			assertThatThrownBy(() -> tokenizer.tokenize("a @ b"))
				.isInstanceOf(ExpressionParseException.class)
				.hasMessageContaining("Invalid token: '@'")
				.satisfies(e -> {
					ExpressionParseException error = (ExpressionParseException) e;
					assertThat(error.kind()).isEqualTo(ParseErrorKind.INVALID_TOKEN);
					assertThat(error.start()).isEqualTo(2);
					assertThat(error.end()).isEqualTo(3);
				});
		}

		@Test
		void adjacentSymbolsFormOneRun() {
			assertThatThrownBy(() -> tokenizer.tokenize("a >=- 1"))
				.isInstanceOf(ExpressionParseException.class)
				.hasMessageContaining("'>=-'");
		}

		@Test
		void strayClosingBracketIsInvalid() {
			assertThatThrownBy(() -> tokenizer.tokenize("a ] b"))
				.isInstanceOf(ExpressionParseException.class)
				.hasMessageContaining("Invalid token: ']'");
		}
	}

	@Nested
	@DisplayName("Variables, booleans, accessors and functions")
	class Words {

		@Test
		void tokenizeVariable() {
			Token token = tokenizer.tokenize("hello_world2").get(0);

			assertThat(token.kind()).isEqualTo(TokenKind.VARIABLE);
			assertThat(token.textValue()).isEqualTo("hello_world2");
		}

		@Test
		void tokenizeBooleans() {
			List<Token> tokens = tokenizer.tokenize("true && false");

			assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.BOOLEAN);
			assertThat(tokens.get(0).booleanValue()).isTrue();
			assertThat(tokens.get(2).booleanValue()).isFalse();
		}

		@Test
		void booleansAreCaseSensitive() {
			assertThat(tokenizer.tokenize("TRUE").get(0).kind()).isEqualTo(TokenKind.VARIABLE);
		}

		@Test
		void tokenizeBracketedVariable() {
			Token token = tokenizer.tokenize("[response time]").get(0);

			assertThat(token.kind()).isEqualTo(TokenKind.VARIABLE);
			assertThat(token.textValue()).isEqualTo("response time");
			assertThat(token.raw()).isEqualTo("[response time]");
			assertThat(token.end()).isEqualTo(15);
		}

		@Test
		void bracketedVariableSupportsEscapes() {
			Token token = tokenizer.tokenize("[a\\]b]").get(0);

			assertThat(token.textValue()).isEqualTo("a]b");
		}

		@Test
		void unterminatedBracketFails() {
			assertThatThrownBy(() -> tokenizer.tokenize("[unclosed + 1"))
				.isInstanceOf(ExpressionParseException.class)
				.hasMessageContaining("Unclosed parameter bracket")
				.extracting(e -> ((ExpressionParseException) e).kind())
				.isEqualTo(ParseErrorKind.UNTERMINATED_LITERAL);
		}

		@Test
		void tokenizeAccessor() {
			Token token = tokenizer.tokenize("foo.Bar").get(0);

			assertThat(token.kind()).isEqualTo(TokenKind.ACCESSOR);
			assertThat(token.pathValue()).containsExactly("foo", "Bar");
		}

		@Test
		void tokenizeDeepAccessor() {
			Token token = tokenizer.tokenize("order.Customer.Name == 'x'").get(0);

			assertThat(token.pathValue()).containsExactly("order", "Customer", "Name");
		}

		@Test
		void lowerCaseAccessorSegmentFails() {
			assertThatThrownBy(() -> tokenizer.tokenize("foo.bar"))
				.isInstanceOf(ExpressionParseException.class)
				.hasMessageContaining("unexported field 'bar'")
				.hasMessageContaining("foo.bar")
				.extracting(e -> ((ExpressionParseException) e).kind())
				.isEqualTo(ParseErrorKind.INVALID_ACCESSOR);
		}

		@Test
		void hangingAccessorFails() {
			assertThatThrownBy(() -> tokenizer.tokenize("foo.Bar."))
				.isInstanceOf(ExpressionParseException.class)
				.hasMessageContaining("Hanging accessor on token 'foo.Bar.'");
		}

		@Test
		void emptyAccessorSegmentFails() {
			assertThatThrownBy(() -> tokenizer.tokenize("foo..Bar"))
				.isInstanceOf(ExpressionParseException.class)
				.extracting(e -> ((ExpressionParseException) e).kind())
				.isEqualTo(ParseErrorKind.INVALID_ACCESSOR);
		}

		@Test
		void tokenizeFunction() {
			ExpressionFunction max = ExpressionFunction.of("max", "number", "number", "number");

			List<Token> tokens = tokenizer.tokenize("max(a, 2)", Map.of("max", max));

			assertThat(kinds(tokens)).containsExactly(
				TokenKind.FUNCTION, TokenKind.CLAUSE, TokenKind.VARIABLE, TokenKind.SEPARATOR,
				TokenKind.NUMERIC, TokenKind.CLAUSE_CLOSE);
			assertThat(tokens.get(0).functionValue()).isSameAs(max);
		}

		@Test
		void unknownFunctionNameIsVariable() {
			List<Token> tokens = tokenizer.tokenize("min(a)");

			assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.VARIABLE);
		}

		@Test
		void functionLookupWinsOverAccessor() {
			ExpressionFunction fn = ExpressionFunction.of("math.abs", "number", "number");

			Token token = tokenizer.tokenize("math.abs(x)", Map.of("math.abs", fn)).get(0);

			assertThat(token.kind()).isEqualTo(TokenKind.FUNCTION);
		}
	}

	@Nested
	@DisplayName("Quoted literals")
	class Quoted {

		@Test
		void plainTextIsString() {
			Token token = tokenizer.tokenize("'not a date'").get(0);

			assertThat(token.kind()).isEqualTo(TokenKind.STRING);
			assertThat(token.textValue()).isEqualTo("not a date");
			assertThat(token.raw()).isEqualTo("'not a date'");
		}

		@Test
		void doubleQuotesAreAccepted() {
			Token token = tokenizer.tokenize("\"it's\"").get(0);

			assertThat(token.textValue()).isEqualTo("it's");
		}

		@Test
		void escapedQuoteStaysInString() {
			Token token = tokenizer.tokenize("'it\\'s'").get(0);

			assertThat(token.textValue()).isEqualTo("it's");
		}

		@Test
		void dateIsTime() {
			Token token = tokenizer.tokenize("'2023-01-02'").get(0);

			assertThat(token.kind()).isEqualTo(TokenKind.TIME);
			assertThat(token.timeValue().toLocalDate()).isEqualTo(LocalDate.of(2023, 1, 2));
			assertThat(token.timeValue().getOffset()).isEqualTo(ZoneOffset.UTC);
		}

		@Test
		void mismatchedWeekdayIsStillTime() {
			Token token = tokenizer.tokenize("'Tue Jan  2 15:04:05 2006'").get(0);

			assertThat(token.kind()).isEqualTo(TokenKind.TIME);
			assertThat(token.timeValue().toLocalDate()).isEqualTo(LocalDate.of(2006, 1, 2));
		}

		@Test
		void timestampWithOffsetKeepsOffset() {
			Token token = tokenizer.tokenize("'2023-01-02T10:15:30+02:00'").get(0);

			assertThat(token.kind()).isEqualTo(TokenKind.TIME);
			assertThat(token.timeValue().getHour()).isEqualTo(10);
			assertThat(token.timeValue().getOffset()).isEqualTo(ZoneOffset.ofHours(2));
		}

		@Test
		void unterminatedStringFails() {
			assertThatThrownBy(() -> tokenizer.tokenize("name == 'abc"))
				.isInstanceOf(ExpressionParseException.class)
				.hasMessageContaining("Unclosed string literal")
				.satisfies(e -> {
					ExpressionParseException error = (ExpressionParseException) e;
					assertThat(error.kind()).isEqualTo(ParseErrorKind.UNTERMINATED_LITERAL);
					assertThat(error.start()).isEqualTo(8);
					assertThat(error.end()).isEqualTo(12);
				});
		}

		@Test
		void mismatchedQuoteDoesNotCloseLiteral() {
			assertThatThrownBy(() -> tokenizer.tokenize("'abc\""))
				.isInstanceOf(ExpressionParseException.class)
				.hasMessageContaining("Unclosed string literal");
		}
	}

	@Nested
	@DisplayName("Parentheses")
	class Parentheses {

		@Test
		void missingCloseIsUnbalanced() {
			assertThatThrownBy(() -> tokenizer.tokenize("(1 + 2"))
				.isInstanceOf(ExpressionParseException.class)
				.hasMessageContaining("Unbalanced parenthesis")
				.extracting(e -> ((ExpressionParseException) e).kind())
				.isEqualTo(ParseErrorKind.UNBALANCED_PARENTHESIS);
		}

		@Test
		void extraCloseIsUnbalanced() {
			assertThatThrownBy(() -> tokenizer.tokenize("(1 + 2))"))
				.isInstanceOf(ExpressionParseException.class)
				.hasMessageContaining("Unbalanced parenthesis");
		}

		@Test
		void nestedGroupsBalance() {
			List<Token> tokens = tokenizer.tokenize("((a + b) * (c))");

			assertThat(tokens).hasSize(11);
			assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.CLAUSE);
			assertThat(tokens.get(10).kind()).isEqualTo(TokenKind.CLAUSE_CLOSE);
		}
	}

	@Nested
	@DisplayName("Offsets")
	class Offsets {

		@Test
		void tokensCarryHalfOpenRanges() {
			List<Token> tokens = tokenizer.tokenize("  ab >= 10");

			assertThat(tokens.get(0).start()).isEqualTo(2);
			assertThat(tokens.get(0).end()).isEqualTo(4);
			assertThat(tokens.get(1).start()).isEqualTo(5);
			assertThat(tokens.get(1).end()).isEqualTo(7);
			assertThat(tokens.get(2).start()).isEqualTo(8);
			assertThat(tokens.get(2).end()).isEqualTo(10);
		}

		@Test
		void everyTokenIsNonEmpty() {
			List<Token> tokens = tokenizer.tokenize("f(a.B, [x y], 'z', 0x1F) || !(c <= -2.5)",
					Map.of("f", ExpressionFunction.of("f", "bool", "any", "any", "any", "number")));

			assertThat(tokens).allSatisfy(token -> assertThat(token.start()).isLessThan(token.end()));
		}

		@Test
		void offsetsCountCodePoints() {
			List<Token> tokens = tokenizer.tokenize("'😀' == x");

			assertThat(tokens.get(0).end()).isEqualTo(3);
			assertThat(tokens.get(1).start()).isEqualTo(4);
		}
	}

	@Nested
	@DisplayName("Strict syntax checking")
	class StrictSyntax {

		private final ExpressionTokenizer strict = new ExpressionTokenizer(
				TokenizerOptions.defaults().withStrictSyntax(true));

		@Test
		void acceptsWellFormedExpression() {
			List<Token> tokens = strict.tokenize("(a + 1) >= b.Total && !flag");

			assertThat(tokens).hasSize(10);
		}

		@Test
		void rejectsTwoOperandsInARow() {
			assertThatThrownBy(() -> strict.tokenize("a b"))
				.isInstanceOf(ExpressionParseException.class)
				.satisfies(e -> {
					ExpressionParseException error = (ExpressionParseException) e;
					assertThat(error.kind()).isEqualTo(ParseErrorKind.INVALID_TRANSITION);
					assertThat(error.offendingText()).isEqualTo("b");
				});
		}

		@Test
		void rejectsDanglingOperator() {
			assertThatThrownBy(() -> strict.tokenize("a +"))
				.isInstanceOf(ExpressionParseException.class)
				.hasMessageContaining("Unexpected end of expression");
		}

		@Test
		void rejectsFunctionWithoutCall() {
			assertThatThrownBy(() -> strict.tokenize("f + 1", Map.of("f", ExpressionFunction.of("f", "number"))))
				.isInstanceOf(ExpressionParseException.class)
				.extracting(e -> ((ExpressionParseException) e).kind())
				.isEqualTo(ParseErrorKind.INVALID_TRANSITION);
		}

		@Test
		void lenientModeAcceptsSameInput() {
			assertThat(tokenizer.tokenize("a b")).hasSize(2);
		}
	}

	@Nested
	@DisplayName("Accessor policy")
	class AccessorPolicyHook {

		@Mock
		private AccessorPolicy policy;

		private ExpressionTokenizer custom;

		@BeforeEach
		void setUp() {
			MockitoAnnotations.openMocks(this);
			custom = new ExpressionTokenizer(TokenizerOptions.defaults().withAccessorPolicy(policy));
		}

		@Test
		void consultsPolicyForEverySegmentAfterTheFirst() {
			when(policy.isAccessible(anyString())).thenReturn(true);

			Token token = custom.tokenize("root.inner.leaf").get(0);

			assertThat(token.pathValue()).containsExactly("root", "inner", "leaf");
			verify(policy).isAccessible("inner");
			verify(policy).isAccessible("leaf");
			verify(policy, never()).isAccessible("root");
		}

		@Test
		void rejectionFromPolicyFailsTokenization() {
			when(policy.isAccessible(anyString())).thenReturn(false);

			assertThatThrownBy(() -> custom.tokenize("root.Inner"))
				.isInstanceOf(ExpressionParseException.class)
				.extracting(e -> ((ExpressionParseException) e).kind())
				.isEqualTo(ParseErrorKind.INVALID_ACCESSOR);
		}

		@Test
		void anyNonEmptyAllowsLowerCaseSegments() {
			ExpressionTokenizer permissive = new ExpressionTokenizer(
					TokenizerOptions.defaults().withAccessorPolicy(AccessorPolicy.anyNonEmpty()));

			assertThat(permissive.tokenize("foo.bar").get(0).pathValue()).containsExactly("foo", "bar");
		}
	}

	@Nested
	@DisplayName("Logging")
	class Logging {

		@Test
		void logsTokenCountAtDebug() {
			try (LogCaptorAppender captor = LogCaptorAppender.attach(ExpressionTokenizer.class, Level.DEBUG)) {
				tokenizer.tokenize("a + 1");

				assertThat(captor.messages()).anyMatch(msg -> msg.contains("into 3 tokens"));
			}
		}

		@Test
		void logsRejectionAtDebug() {
			try (LogCaptorAppender captor = LogCaptorAppender.attach(ExpressionTokenizer.class, Level.DEBUG)) {
				assertThatThrownBy(() -> tokenizer.tokenize("a @ b"))
					.isInstanceOf(ExpressionParseException.class);

				assertThat(captor.messages()).anyMatch(msg -> msg.startsWith("Rejected expression: Invalid token"));
			}
		}
	}
}
