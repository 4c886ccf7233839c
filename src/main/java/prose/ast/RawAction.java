package prose.ast;

/**
 * Action text that is not a print directive. Rendered as a no-op carrying the
 * text as a comment.
 */
public record RawAction(String text) implements Action {
	public static final RawAction EMPTY = new RawAction("");

	public boolean isEmpty() {
		return text.isBlank();
	}
}
