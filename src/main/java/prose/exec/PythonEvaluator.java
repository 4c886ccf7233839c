package prose.exec;

import prose.ProseConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs generated code with an external Python interpreter.
 *
 * The program is fed on stdin, so nothing is written to disk. A run that
 * exceeds the timeout is killed and reported as a timed-out result.
 */
public final class PythonEvaluator implements CodeExecutor {
	private static final Logger LOGGER = Logger.getLogger(PythonEvaluator.class.getName());
	private static final Pattern ERROR_LINE = Pattern.compile("line (\\d+)");
	private static final String PARSE_ONLY = "import ast, sys; ast.parse(sys.stdin.read())";

	private final String command;
	private final Duration timeout;

	public PythonEvaluator() {
		this(ProseConfig.PYTHON_COMMAND, Duration.ofMillis(ProseConfig.EXEC_TIMEOUT_MS));
	}

	public PythonEvaluator(String command, Duration timeout) {
		if (command == null || command.isBlank()) {
			throw new IllegalArgumentException("interpreter command cannot be blank");
		}
		if (timeout == null || timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("timeout must be positive");
		}
		this.command = command;
		this.timeout = timeout;
	}

	/**
	 * Executes the program and captures what it prints.
	 */
	@Override
	public ExecutionResult execute(String source) throws ExecutionException {
		return run(List.of(command, "-"), source);
	}

	/**
	 * Parses the program without running it. A syntax error yields a failed
	 * result whose {@code errorLine} points at the offending line.
	 */
	public ExecutionResult validateSyntax(String source) throws ExecutionException {
		return run(List.of(command, "-c", PARSE_ONLY), source);
	}

	/**
	 * Whether the interpreter can be started at all.
	 */
	public boolean isAvailable() {
		try {
			return run(List.of(command, "-c", "pass"), "").success();
		} catch (ExecutionException e) {
			LOGGER.log(Level.FINE, "Interpreter {0} unavailable: {1}", new Object[] { command, e.getMessage() });
			return false;
		}
	}

	private ExecutionResult run(List<String> cmd, String stdin) throws ExecutionException {
		ProcessBuilder processBuilder = new ProcessBuilder(cmd);
		processBuilder.environment().put("PYTHONIOENCODING", "utf-8");

		long started = System.nanoTime();
		Process process;
		try {
			process = processBuilder.start();
		} catch (IOException e) {
			throw new ExecutionException("Could not start interpreter '" + command + "'", e);
		}

		CompletableFuture<String> out = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
		CompletableFuture<String> err = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));

		try (OutputStream os = process.getOutputStream()) {
			os.write(stdin.getBytes(StandardCharsets.UTF_8));
			os.flush();
		} catch (IOException e) {
			// the interpreter may exit before reading everything; its output tells why
			LOGGER.log(Level.FINE, "Interpreter closed stdin early: {0}", e.getMessage());
		}

		try {
			boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
			long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
			if (!finished) {
				process.destroyForcibly();
				LOGGER.log(Level.WARNING, "Execution exceeded {0} ms and was stopped", timeout.toMillis());
				return ExecutionResult.timeout(partial(out), elapsed);
			}

			String stdout = out.join();
			String stderr = err.join();
			int exitCode = process.exitValue();
			if (exitCode == 0) {
				return ExecutionResult.success(stdout, stderr, elapsed);
			}
			LOGGER.log(Level.FINE, "Interpreter exited with code {0}", exitCode);
			return ExecutionResult.failure(stdout, stderr, lastLine(stderr), errorLine(stderr), elapsed);
		} catch (InterruptedException e) {
			process.destroyForcibly();
			Thread.currentThread().interrupt();
			throw new ExecutionException("Interrupted while waiting for the interpreter", e);
		} catch (CompletionException e) {
			throw new ExecutionException("Could not read interpreter output", e.getCause());
		}
	}

	private static String readAll(InputStream in) {
		try (in) {
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	private static String partial(CompletableFuture<String> out) {
		return out.isDone() && !out.isCompletedExceptionally() ? out.join() : "";
	}

	private static String lastLine(String stderr) {
		String trimmed = stderr.strip();
		int nl = trimmed.lastIndexOf('\n');
		return nl < 0 ? trimmed : trimmed.substring(nl + 1);
	}

	static Integer errorLine(String stderr) {
		Matcher m = ERROR_LINE.matcher(stderr);
		Integer line = null;
		while (m.find()) {
			line = Integer.valueOf(m.group(1));
		}
		return line;
	}
}
