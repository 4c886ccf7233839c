package prose;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class GoldenTranslateTest {
	@Test
	void translatesSampleProgramToExpectedPython() throws Exception {
		Path inputPath = Path.of("src", "test", "resources", "golden", "program.txt");
		Path expectedPath = Path.of("src", "test", "resources", "golden", "program.py");

		String input = Files.readString(inputPath);
		String expected = Files.readString(expectedPath);
		String actual = new Translator().translate(input).source();

		assertEquals(normalize(expected), normalize(actual));
	}

	private static String normalize(String s) {
		String normalized = s.replace("\r\n", "\n");
		if (!normalized.endsWith("\n")) {
			normalized += "\n";
		}
		return normalized;
	}
}
