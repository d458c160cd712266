package org.javai.exprlang.lexer;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * Converts expression text into a validated, balanced list of typed tokens.
 * <p>
 * The scan is a single left-to-right pass. Each token is classified from its
 * leading character; symbol runs that are ambiguous (a {@code -} that is either
 * negation or subtraction) are resolved with the {@link LexerState} reached after
 * the previous token. Any error aborts the whole call; no partial token list is
 * ever returned.
 * <p>
 * Instances are immutable. Concurrent calls are safe as long as the function
 * mapping passed in is not modified while they run.
 */
public class ExpressionTokenizer {

	private static final Logger logger = LoggerFactory.getLogger(ExpressionTokenizer.class);

	private final TokenizerOptions options;

	public ExpressionTokenizer() {
		this(TokenizerOptions.defaults());
	}

	public ExpressionTokenizer(TokenizerOptions options) {
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	public TokenizerOptions options() {
		return options;
	}

	/**
	 * Tokenizes an expression that calls no functions.
	 *
	 * @see #tokenize(String, Map)
	 */
	public List<Token> tokenize(@Nullable String expression) {
		return tokenize(expression, Map.of());
	}

	/**
	 * Tokenizes the entire expression.
	 *
	 * @param expression the source text; {@code null} is treated as empty
	 * @param functions functions callable from the expression, by name
	 * @return the tokens in source order; empty for empty or blank input
	 * @throws ExpressionParseException if any part of the text cannot be tokenized
	 */
	public List<Token> tokenize(@Nullable String expression, Map<String, ExpressionFunction> functions) {
		Objects.requireNonNull(functions, "functions must not be null");
		CharacterStream stream = new CharacterStream(expression);
		try {
			List<Token> tokens = scan(stream, functions);
			logger.debug("Tokenized {} code points into {} tokens", stream.length(), tokens.size());
			return tokens;
		} catch (ExpressionParseException e) {
			logger.debug("Rejected expression: {}", e.getMessage());
			throw e;
		}
	}

	private List<Token> scan(CharacterStream stream, Map<String, ExpressionFunction> functions) {
		List<Token> tokens = new ArrayList<>();
		LexerState state = LexerState.initial();

		while (stream.canRead()) {
			Optional<Token> next = readToken(stream, state, functions);
			if (next.isEmpty()) {
				break; // only whitespace was left
			}
			Token token = next.get();
			if (options.strictSyntax()) {
				checkTransition(state, token);
			}
			state = LexerState.forKind(token.kind());
			tokens.add(token);
		}

		checkBalance(tokens, stream);
		if (options.strictSyntax() && !tokens.isEmpty() && !state.canEnd()) {
			Token last = tokens.get(tokens.size() - 1);
			throw new ExpressionParseException(ParseErrorKind.INVALID_TRANSITION,
					"Unexpected end of expression after " + last.kind() + " '" + last.raw() + "'",
					last.raw(), last.start(), last.end());
		}
		return List.copyOf(tokens);
	}

	private Optional<Token> readToken(CharacterStream stream, LexerState state,
			Map<String, ExpressionFunction> functions) {
		while (stream.canRead()) {
			int start = stream.position();
			int character = stream.readCharacter();

			if (isSpace(character)) {
				continue;
			}
			if (isDigit(character) || (character == '.' && nextIsDigit(stream))) {
				return Optional.of(readNumeric(stream, start, character));
			}
			if (character == ',') {
				return Optional.of(delimiter(TokenKind.SEPARATOR, ",", start, stream));
			}
			if (character == '[') {
				String name = readDelimited(stream, start, ']', "Unclosed parameter bracket");
				return Optional.of(new Token(TokenKind.VARIABLE, stream.substring(start, stream.position()),
						new TokenValue.Text(name), start, stream.position()));
			}
			if (Character.isLetter(character)) {
				return Optional.of(readWord(stream, start, functions));
			}
			if (isQuote(character)) {
				return Optional.of(readQuoted(stream, start, character));
			}
			if (character == '(') {
				return Optional.of(delimiter(TokenKind.CLAUSE, "(", start, stream));
			}
			if (character == ')') {
				return Optional.of(delimiter(TokenKind.CLAUSE_CLOSE, ")", start, stream));
			}
			return Optional.of(readSymbol(stream, start, state));
		}
		return Optional.empty();
	}

	private Token readNumeric(CharacterStream stream, int start, int first) {
		if (first == '0' && stream.canRead()) {
			if (stream.readCharacter() == 'x') {
				String digits = readWhile(stream, ExpressionTokenizer::isHexDigit);
				try {
					double value = unsignedToDouble(Long.parseUnsignedLong(digits, 16));
					return new Token(TokenKind.NUMERIC, stream.substring(start, stream.position()),
							new TokenValue.Numeric(value), start, stream.position());
				} catch (NumberFormatException e) {
					throw new ExpressionParseException(ParseErrorKind.MALFORMED_NUMERIC,
							"Unable to parse hex value '" + digits + "' as an unsigned 64-bit integer",
							stream.substring(start, stream.position()), start, stream.position(), e);
				}
			}
			stream.rewind(1);
		}

		stream.rewind(1);
		String text = readWhile(stream, ExpressionTokenizer::isNumericCharacter);
		try {
			return new Token(TokenKind.NUMERIC, text, new TokenValue.Numeric(Double.parseDouble(text)),
					start, stream.position());
		} catch (NumberFormatException e) {
			throw new ExpressionParseException(ParseErrorKind.MALFORMED_NUMERIC,
					"Unable to parse numeric value '" + text + "'", text, start, stream.position(), e);
		}
	}

	private Token readWord(CharacterStream stream, int start, Map<String, ExpressionFunction> functions) {
		stream.rewind(1);
		String word = readWhile(stream, ExpressionTokenizer::isVariableNameCharacter);
		int end = stream.position();

		if (word.equals("true") || word.equals("false")) {
			return new Token(TokenKind.BOOLEAN, word, new TokenValue.Bool(Boolean.parseBoolean(word)), start, end);
		}
		if (word.equalsIgnoreCase("in")) {
			Operator in = options.operators().comparatorOperator("in").orElse(Operator.IN);
			return new Token(TokenKind.COMPARATOR, word, new TokenValue.Symbol("in", in), start, end);
		}
		ExpressionFunction function = functions.get(word);
		if (function != null) {
			return new Token(TokenKind.FUNCTION, word, new TokenValue.FunctionRef(function), start, end);
		}
		if (word.indexOf('.') > 0) {
			return new Token(TokenKind.ACCESSOR, word, new TokenValue.Path(accessorSegments(word, start, end)),
					start, end);
		}
		return new Token(TokenKind.VARIABLE, word, new TokenValue.Text(word), start, end);
	}

	private List<String> accessorSegments(String word, int start, int end) {
		if (word.endsWith(".")) {
			throw new ExpressionParseException(ParseErrorKind.INVALID_ACCESSOR,
					"Hanging accessor on token '" + word + "'", word, start, end);
		}
		List<String> segments = Arrays.asList(word.split("\\.", -1));
		for (String segment : segments.subList(1, segments.size())) {
			if (!options.accessorPolicy().isAccessible(segment)) {
				throw new ExpressionParseException(ParseErrorKind.INVALID_ACCESSOR,
						"Unable to access unexported field '" + segment + "' in token '" + word + "'",
						word, start, end);
			}
		}
		return segments;
	}

	private Token readQuoted(CharacterStream stream, int start, int quote) {
		String text = readDelimited(stream, start, quote, "Unclosed string literal");
		String raw = stream.substring(start, stream.position());

		Optional<ZonedDateTime> time = TimestampFormats.parse(text, options.zone());
		if (time.isPresent()) {
			return new Token(TokenKind.TIME, raw, new TokenValue.Time(time.get()), start, stream.position());
		}
		return new Token(TokenKind.STRING, raw, new TokenValue.Text(text), start, stream.position());
	}

	private Token readSymbol(CharacterStream stream, int start, LexerState state) {
		stream.rewind(1);
		String symbol = readWhile(stream, ExpressionTokenizer::isSymbolCharacter);
		if (symbol.isEmpty()) {
			// a stray ']' or similar that cannot start any token
			stream.readCharacter();
			symbol = stream.substring(start, stream.position());
		}
		int end = stream.position();

		// Prefix eligibility must be decided before the other tables are consulted,
		// otherwise a leading '-' would be classified as subtraction.
		if (state.canTransitionTo(TokenKind.PREFIX)) {
			Optional<Operator> prefix = options.operators().prefixOperator(symbol);
			if (prefix.isPresent()) {
				return symbolToken(TokenKind.PREFIX, symbol, prefix.get(), start, end);
			}
		}

		OperatorSymbols operators = options.operators();
		Optional<Operator> operator = operators.modifierOperator(symbol);
		if (operator.isPresent()) {
			return symbolToken(TokenKind.MODIFIER, symbol, operator.get(), start, end);
		}
		operator = operators.logicalOperator(symbol);
		if (operator.isPresent()) {
			return symbolToken(TokenKind.LOGICALOP, symbol, operator.get(), start, end);
		}
		operator = operators.comparatorOperator(symbol);
		if (operator.isPresent()) {
			return symbolToken(TokenKind.COMPARATOR, symbol, operator.get(), start, end);
		}
		operator = operators.ternaryOperator(symbol);
		if (operator.isPresent()) {
			return symbolToken(TokenKind.TERNARY, symbol, operator.get(), start, end);
		}

		throw new ExpressionParseException(ParseErrorKind.INVALID_TOKEN,
				"Invalid token: '" + symbol + "'", symbol, start, end);
	}

	/**
	 * Reads up to an unescaped {@code closing} character and consumes it.
	 * A backslash makes the character after it literal.
	 *
	 * @return the decoded content between the delimiters
	 */
	private String readDelimited(CharacterStream stream, int start, int closing, String unterminatedMessage) {
		StringBuilder buffer = new StringBuilder();
		while (stream.canRead()) {
			int character = stream.readCharacter();
			if (character == '\\') {
				if (!stream.canRead()) {
					break;
				}
				buffer.appendCodePoint(stream.readCharacter());
				continue;
			}
			if (character == closing) {
				return buffer.toString();
			}
			buffer.appendCodePoint(character);
		}
		throw new ExpressionParseException(ParseErrorKind.UNTERMINATED_LITERAL, unterminatedMessage,
				stream.substring(start, stream.position()), start, stream.position());
	}

	/**
	 * Reads while {@code condition} holds, leaving the stream on the first character that fails it.
	 */
	private static String readWhile(CharacterStream stream, IntPredicate condition) {
		StringBuilder buffer = new StringBuilder();
		while (stream.canRead()) {
			int character = stream.readCharacter();
			if (!condition.test(character)) {
				stream.rewind(1);
				break;
			}
			buffer.appendCodePoint(character);
		}
		return buffer.toString();
	}

	private void checkTransition(LexerState state, Token token) {
		if (!state.canTransitionTo(token.kind())) {
			throw new ExpressionParseException(ParseErrorKind.INVALID_TRANSITION,
					"Cannot transition from " + state + " to " + token.kind() + " '" + token.raw() + "'",
					token.raw(), token.start(), token.end());
		}
	}

	private static void checkBalance(List<Token> tokens, CharacterStream stream) {
		int parens = 0;
		for (Token token : tokens) {
			if (token.kind() == TokenKind.CLAUSE) {
				parens++;
			} else if (token.kind() == TokenKind.CLAUSE_CLOSE) {
				parens--;
			}
		}
		if (parens != 0) {
			throw new ExpressionParseException(ParseErrorKind.UNBALANCED_PARENTHESIS, "Unbalanced parenthesis",
					stream.substring(0, stream.length()), 0, stream.length());
		}
	}

	private static Token delimiter(TokenKind kind, String text, int start, CharacterStream stream) {
		return new Token(kind, text, new TokenValue.Text(text), start, stream.position());
	}

	private static Token symbolToken(TokenKind kind, String symbol, Operator operator, int start, int end) {
		return new Token(kind, symbol, new TokenValue.Symbol(symbol, operator), start, end);
	}

	private static boolean nextIsDigit(CharacterStream stream) {
		if (!stream.canRead()) {
			return false;
		}
		int next = stream.readCharacter();
		stream.rewind(1);
		return isDigit(next);
	}

	private static double unsignedToDouble(long value) {
		if (value >= 0) {
			return value;
		}
		// halve keeping the low bit so rounding matches the exact unsigned value
		return ((value >>> 1) | (value & 1)) * 2.0;
	}

	private static boolean isDigit(int c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isHexDigit(int c) {
		return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
	}

	private static boolean isNumericCharacter(int c) {
		return isDigit(c) || c == '.';
	}

	// covers no-break and other Unicode space separators as well as control whitespace
	private static boolean isSpace(int c) {
		return Character.isWhitespace(c) || Character.isSpaceChar(c);
	}

	private static boolean isQuote(int c) {
		return c == '\'' || c == '"';
	}

	private static boolean isVariableNameCharacter(int c) {
		return Character.isLetter(c) || Character.isDigit(c) || c == '_' || c == '.';
	}

	private static boolean isSymbolCharacter(int c) {
		return !(Character.isLetterOrDigit(c)
				|| isSpace(c)
				|| c == '(' || c == ')'
				|| c == '[' || c == ']'
				|| isQuote(c));
	}
}
