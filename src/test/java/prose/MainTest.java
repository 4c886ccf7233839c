package prose;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MainTest {
	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	private int run(String stdin, String... args) {
		return Main.run(args, new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
				new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
	}

	private String out() {
		return out.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
	}

	private String err() {
		return err.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
	}

	@Test
	void translatesStandardInput() {
		assertEquals(Main.OK, run("set x to 5\n"));
		assertEquals("x = 5\n", out());
	}

	@Test
	void translatesFileArgument() throws Exception {
		Path file = Files.createTempFile("prose", ".txt");
		try {
			Files.writeString(file, "add 1 and 2\n");
			assertEquals(Main.OK, run("", file.toString()));
			assertEquals("result = 1 + 2\n", out());
		} finally {
			Files.deleteIfExists(file);
		}
	}

	@Test
	void unrecognizedInputFailsWithHints() {
		assertEquals(Main.FAILED, run("bogus statement"));
		assertTrue(err().contains("Unrecognized statement: bogus statement"));
		assertTrue(err().contains("Supported patterns and examples:"));
		assertEquals("", out());
	}

	@Test
	void jsonOutput() {
		assertEquals(Main.OK, run("set x to 5", "--json"));
		assertTrue(out().contains("\"code\" : \"x = 5\""), out());
	}

	@Test
	void warningsGoToStandardError() {
		assertEquals(Main.OK, run("divide 4 by 0"));
		assertEquals("result = 4 / 0\n", out());
		assertTrue(err().contains("Division by zero"));
	}

	@Test
	void examplesListing() {
		assertEquals(Main.OK, run("", "--examples"));
		assertTrue(out().contains("Loop Operations:"));
		assertTrue(out().contains("repeat 5 times print hello"));
	}

	@Test
	void helpIsNotAnError() {
		assertEquals(Main.OK, run("", "--help"));
	}

	@Test
	void badArgumentsAreUsageErrors() {
		assertEquals(Main.USAGE, run("", "--no-such-flag"));
		assertEquals(Main.USAGE, run("set x to 1", "--timeout", "0"));
		assertEquals(Main.USAGE, run("", "/no/such/file.txt"));
	}
}
