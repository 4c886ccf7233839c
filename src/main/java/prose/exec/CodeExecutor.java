package prose.exec;

/**
 * Runs generated source text and reports what it printed.
 */
public interface CodeExecutor {
	/**
	 * @return the outcome of the run; a program that fails to parse or raises is a
	 *         failed result, not an exception
	 * @throws ExecutionException if the program could not be run at all
	 */
	ExecutionResult execute(String source) throws ExecutionException;
}
