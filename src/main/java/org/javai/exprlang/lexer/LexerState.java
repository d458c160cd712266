package org.javai.exprlang.lexer;

import static org.javai.exprlang.lexer.TokenKind.ACCESSOR;
import static org.javai.exprlang.lexer.TokenKind.BOOLEAN;
import static org.javai.exprlang.lexer.TokenKind.CLAUSE;
import static org.javai.exprlang.lexer.TokenKind.CLAUSE_CLOSE;
import static org.javai.exprlang.lexer.TokenKind.COMPARATOR;
import static org.javai.exprlang.lexer.TokenKind.FUNCTION;
import static org.javai.exprlang.lexer.TokenKind.LOGICALOP;
import static org.javai.exprlang.lexer.TokenKind.MODIFIER;
import static org.javai.exprlang.lexer.TokenKind.NUMERIC;
import static org.javai.exprlang.lexer.TokenKind.PREFIX;
import static org.javai.exprlang.lexer.TokenKind.SEPARATOR;
import static org.javai.exprlang.lexer.TokenKind.STRING;
import static org.javai.exprlang.lexer.TokenKind.TERNARY;
import static org.javai.exprlang.lexer.TokenKind.TIME;
import static org.javai.exprlang.lexer.TokenKind.VARIABLE;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Lexer states, each derived from the kind of the most recently emitted token.
 * <p>
 * A state knows which token kinds may legally follow it and whether an
 * expression may end in it. The tokenizer recomputes the state after every token
 * with {@link #forKind(TokenKind)}; nothing is entered or exited explicitly.
 */
public enum LexerState {

	INITIAL(true, PREFIX, NUMERIC, BOOLEAN, VARIABLE, FUNCTION, ACCESSOR, STRING, TIME, CLAUSE),
	AFTER_CLAUSE(false, PREFIX, NUMERIC, BOOLEAN, VARIABLE, FUNCTION, ACCESSOR, STRING, TIME, CLAUSE,
			CLAUSE_CLOSE),
	AFTER_CLAUSE_CLOSE(true, COMPARATOR, MODIFIER, NUMERIC, BOOLEAN, VARIABLE, STRING, TIME, CLAUSE,
			CLAUSE_CLOSE, LOGICALOP, TERNARY, SEPARATOR),
	AFTER_LITERAL(true, MODIFIER, COMPARATOR, LOGICALOP, CLAUSE_CLOSE, TERNARY, SEPARATOR),
	AFTER_TIME(true, MODIFIER, COMPARATOR, LOGICALOP, CLAUSE_CLOSE, SEPARATOR),
	AFTER_VARIABLE(true, MODIFIER, COMPARATOR, LOGICALOP, CLAUSE_CLOSE, TERNARY, SEPARATOR),
	AFTER_MODIFIER(false, PREFIX, NUMERIC, VARIABLE, FUNCTION, ACCESSOR, STRING, BOOLEAN, CLAUSE,
			CLAUSE_CLOSE),
	AFTER_COMPARATOR(false, PREFIX, NUMERIC, BOOLEAN, VARIABLE, FUNCTION, ACCESSOR, STRING, TIME, CLAUSE,
			CLAUSE_CLOSE),
	AFTER_LOGICALOP(false, PREFIX, NUMERIC, BOOLEAN, VARIABLE, FUNCTION, ACCESSOR, STRING, TIME, CLAUSE,
			CLAUSE_CLOSE),
	AFTER_PREFIX(false, NUMERIC, BOOLEAN, VARIABLE, FUNCTION, ACCESSOR, CLAUSE, CLAUSE_CLOSE),
	AFTER_TERNARY(false, PREFIX, NUMERIC, BOOLEAN, STRING, TIME, VARIABLE, FUNCTION, ACCESSOR, CLAUSE,
			SEPARATOR),
	AFTER_FUNCTION(false, CLAUSE),
	AFTER_ACCESSOR(true, CLAUSE, MODIFIER, COMPARATOR, LOGICALOP, CLAUSE_CLOSE, TERNARY, SEPARATOR),
	AFTER_SEPARATOR(false, PREFIX, NUMERIC, BOOLEAN, STRING, TIME, CLAUSE, VARIABLE, FUNCTION, ACCESSOR),
	// ARRAY exists only in trees; nothing may follow it in a token sequence
	DEAD(false);

	private final boolean canEnd;
	private final Set<TokenKind> validNextKinds;

	LexerState(boolean canEnd, TokenKind... validNextKinds) {
		this.canEnd = canEnd;
		EnumSet<TokenKind> kinds = EnumSet.noneOf(TokenKind.class);
		Collections.addAll(kinds, validNextKinds);
		this.validNextKinds = Collections.unmodifiableSet(kinds);
	}

	public static LexerState initial() {
		return INITIAL;
	}

	/**
	 * State reached after emitting a token of the given kind.
	 */
	public static LexerState forKind(TokenKind kind) {
		Objects.requireNonNull(kind, "kind must not be null");
		return switch (kind) {
			case UNKNOWN -> INITIAL;
			case CLAUSE -> AFTER_CLAUSE;
			case CLAUSE_CLOSE -> AFTER_CLAUSE_CLOSE;
			case NUMERIC, BOOLEAN, STRING -> AFTER_LITERAL;
			case TIME -> AFTER_TIME;
			case VARIABLE -> AFTER_VARIABLE;
			case MODIFIER -> AFTER_MODIFIER;
			case COMPARATOR -> AFTER_COMPARATOR;
			case LOGICALOP -> AFTER_LOGICALOP;
			case PREFIX -> AFTER_PREFIX;
			case TERNARY -> AFTER_TERNARY;
			case FUNCTION -> AFTER_FUNCTION;
			case ACCESSOR -> AFTER_ACCESSOR;
			case SEPARATOR -> AFTER_SEPARATOR;
			case ARRAY -> DEAD;
		};
	}

	public boolean canTransitionTo(TokenKind kind) {
		return validNextKinds.contains(kind);
	}

	/**
	 * Whether a complete expression may end in this state.
	 */
	public boolean canEnd() {
		return canEnd;
	}

	public Set<TokenKind> validNextKinds() {
		return validNextKinds;
	}
}
