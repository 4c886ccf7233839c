package prose;

/**
 * A translation that produced no source text.
 *
 * {@code statementIndex} is 1-based; 0 means the failure concerns the input as
 * a whole rather than one statement.
 */
public class TranslationException extends Exception {
	private final ErrorKind kind;
	private final int statementIndex;
	private final String statementText;
	private final String reason;

	public TranslationException(ErrorKind kind, String statementText, String reason) {
		this(kind, 0, statementText, reason);
	}

	public TranslationException(ErrorKind kind, int statementIndex, String statementText, String reason) {
		super(format(statementIndex, statementText, reason));
		this.kind = kind;
		this.statementIndex = statementIndex;
		this.statementText = statementText;
		this.reason = reason;
	}

	/**
	 * Same failure, attributed to statement {@code index} of a batch.
	 */
	public TranslationException atStatement(int index) {
		return new TranslationException(kind, index, statementText, reason);
	}

	public ErrorKind kind() {
		return kind;
	}

	public int statementIndex() {
		return statementIndex;
	}

	public String statementText() {
		return statementText;
	}

	public String reason() {
		return reason;
	}

	private static String format(int index, String text, String reason) {
		if (index > 0) {
			return "Error in statement " + index + " ('" + text + "'): " + reason;
		}
		return reason;
	}
}
