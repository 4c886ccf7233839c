package prose.exec;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Captured output of one run.
 *
 * {@code errorLine} is the 1-based source line named by the interpreter's
 * error report, or null when there is none.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResult(boolean success, String stdout, String stderr, String errorMessage, Integer errorLine,
		long elapsedMillis, boolean timedOut) {

	public static ExecutionResult success(String stdout, String stderr, long elapsedMillis) {
		return new ExecutionResult(true, stdout, stderr, null, null, elapsedMillis, false);
	}

	public static ExecutionResult failure(String stdout, String stderr, String errorMessage, Integer errorLine,
			long elapsedMillis) {
		return new ExecutionResult(false, stdout, stderr, errorMessage, errorLine, elapsedMillis, false);
	}

	public static ExecutionResult timeout(String stdout, long elapsedMillis) {
		return new ExecutionResult(false, stdout, "", "Execution timed out after " + elapsedMillis + " ms", null,
				elapsedMillis, true);
	}

	public boolean hasOutput() {
		return stdout != null && !stdout.isEmpty();
	}
}
