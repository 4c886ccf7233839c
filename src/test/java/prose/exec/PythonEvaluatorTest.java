package prose.exec;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class PythonEvaluatorTest {
	private static PythonEvaluator python(Duration timeout) {
		assumeTrue(new PythonEvaluator("python3", Duration.ofSeconds(20)).isAvailable(), "python3 not available");
		return new PythonEvaluator("python3", timeout);
	}

	@Test
	void capturesStandardOutput() throws Exception {
		ExecutionResult result = python(Duration.ofSeconds(20)).execute("print(\"hi\")\nprint(1 + 2)");
		assertTrue(result.success());
		assertEquals("hi\n3\n", result.stdout().replace("\r\n", "\n"));
		assertNull(result.errorLine());
	}

	@Test
	void runtimeErrorReportsLine() throws Exception {
		ExecutionResult result = python(Duration.ofSeconds(20)).execute("x = 1\ny = undefined_name\n");
		assertFalse(result.success());
		assertEquals(2, result.errorLine());
		assertTrue(result.errorMessage().startsWith("NameError"), result.errorMessage());
	}

	@Test
	void syntaxCheckDoesNotRunTheProgram() throws Exception {
		PythonEvaluator evaluator = python(Duration.ofSeconds(20));
		ExecutionResult ok = evaluator.validateSyntax("print(\"side effect\")");
		assertTrue(ok.success());
		assertEquals("", ok.stdout());

		ExecutionResult bad = evaluator.validateSyntax("x = 1\nif x:\n");
		assertFalse(bad.success());
		assertEquals(2, bad.errorLine());
	}

	@Test
	void longRunningProgramIsStopped() throws Exception {
		ExecutionResult result = python(Duration.ofMillis(500)).execute("while True:\n    pass\n");
		assertTrue(result.timedOut());
		assertFalse(result.success());
	}

	@Test
	void missingInterpreterIsAnExecutionError() {
		PythonEvaluator evaluator = new PythonEvaluator("no-such-python-interpreter", Duration.ofSeconds(1));
		assertFalse(evaluator.isAvailable());
		assertThrows(ExecutionException.class, () -> evaluator.execute("print(1)"));
	}

	@Test
	void errorLineIsTheLastOneMentioned() {
		assertEquals(7, PythonEvaluator.errorLine("File \"a\", line 3, in f\nFile \"<stdin>\", line 7\n"));
		assertNull(PythonEvaluator.errorLine("no location"));
	}

	@Test
	void rejectsNonPositiveTimeout() {
		assertThrows(IllegalArgumentException.class, () -> new PythonEvaluator("python3", Duration.ZERO));
	}
}
