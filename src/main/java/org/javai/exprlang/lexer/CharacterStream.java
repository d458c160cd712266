package org.javai.exprlang.lexer;

import org.springframework.lang.Nullable;

/**
 * Position-tracked, code-point oriented view over expression text.
 * <p>
 * The tokenizer is the only reader; a fresh stream is created for every call.
 * The position always stays within {@code [0, length]}.
 */
public final class CharacterStream {

	private final int[] codePoints;
	private int position = 0;

	public CharacterStream(@Nullable String source) {
		this.codePoints = source != null ? source.codePoints().toArray() : new int[0];
	}

	public boolean canRead() {
		return position < codePoints.length;
	}

	/**
	 * Returns the code point at the current position and advances past it.
	 *
	 * @throws IllegalStateException if the stream is exhausted
	 */
	public int readCharacter() {
		if (!canRead()) {
			throw new IllegalStateException("Read past end of input at position " + position);
		}
		return codePoints[position++];
	}

	/**
	 * Moves the position back by {@code amount} code points, or forward when
	 * {@code amount} is negative.
	 *
	 * @throws IllegalStateException if the move would leave {@code [0, length]}
	 */
	public void rewind(int amount) {
		int target = position - amount;
		if (target < 0 || target > codePoints.length) {
			throw new IllegalStateException("Cannot rewind by " + amount + " from position " + position
					+ " (length " + codePoints.length + ")");
		}
		position = target;
	}

	public int position() {
		return position;
	}

	public int length() {
		return codePoints.length;
	}

	/**
	 * Source text between two code point offsets.
	 */
	public String substring(int start, int end) {
		return new String(codePoints, start, end - start);
	}

	@Override
	public String toString() {
		return "CharacterStream[" + position + "/" + codePoints.length + "]";
	}
}
