package prose.exec;

/**
 * The executor itself failed (interpreter missing, I/O error, interrupted).
 */
public class ExecutionException extends Exception {
	public ExecutionException(String message) {
		super(message);
	}

	public ExecutionException(String message, Throwable cause) {
		super(message, cause);
	}
}
