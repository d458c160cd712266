package org.javai.exprlang.lexer;

/**
 * Decides whether a segment after the root of an accessor path may be accessed.
 * <p>
 * The policy depends on the data-binding model expressions are evaluated against.
 * The default, {@link #exportedOnly()}, follows the convention that only fields
 * starting with an upper-case letter are visible.
 */
@FunctionalInterface
public interface AccessorPolicy {

	/**
	 * @param segment a non-root segment of an accessor path
	 * @return {@code true} if the segment may be accessed
	 */
	boolean isAccessible(String segment);

	static AccessorPolicy exportedOnly() {
		return segment -> !segment.isEmpty() && Character.isUpperCase(segment.codePointAt(0));
	}

	/**
	 * Accepts every non-empty segment.
	 */
	static AccessorPolicy anyNonEmpty() {
		return segment -> !segment.isEmpty();
	}
}
