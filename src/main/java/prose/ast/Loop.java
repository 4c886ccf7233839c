package prose.ast;

/**
 * Counted repetition or element-wise iteration.
 *
 * For {@link LoopKind#REPEAT_N} {@code countOrCollection} holds the count and
 * {@code variable} is {@code _}; for {@link LoopKind#FOR_EACH} it holds the
 * collection name and {@code variable} the element name.
 */
public record Loop(LoopKind kind, String countOrCollection, String variable, Action body) implements Instruction {
	public static final String DISCARD = "_";

	public static Loop repeat(String count, Action body) {
		return new Loop(LoopKind.REPEAT_N, count, DISCARD, body);
	}

	public static Loop forEach(String variable, String collection, Action body) {
		return new Loop(LoopKind.FOR_EACH, collection, variable, body);
	}
}
