package prose;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks applied to the whole input before it is split.
 */
public final class InputValidator {
	private static final List<Pattern> UNSAFE = List.of(
			Pattern.compile("\\bimport\\s+os\\b", Pattern.CASE_INSENSITIVE),
			Pattern.compile("\\bexec\\b", Pattern.CASE_INSENSITIVE),
			Pattern.compile("\\beval\\b", Pattern.CASE_INSENSITIVE),
			Pattern.compile("\\b__\\w*__\\b"),
			Pattern.compile("\\bopen\\s*\\(", Pattern.CASE_INSENSITIVE));

	private final int maxLength;

	public InputValidator() {
		this(ProseConfig.MAX_INPUT_LENGTH);
	}

	public InputValidator(int maxLength) {
		if (maxLength <= 0) {
			throw new IllegalArgumentException("maxLength must be positive");
		}
		this.maxLength = maxLength;
	}

	public void validate(String input) throws TranslationException {
		if (input == null || input.isBlank()) {
			throw new TranslationException(ErrorKind.EMPTY_INPUT, "",
					"Input cannot be empty. Enter an instruction such as 'set x to 10'.");
		}
		if (input.length() > maxLength) {
			throw new TranslationException(ErrorKind.INPUT_TOO_LONG, input,
					"Input too long (" + input.length() + " characters, max " + maxLength + ")");
		}
		for (Pattern p : UNSAFE) {
			if (p.matcher(input).find()) {
				throw new TranslationException(ErrorKind.UNSAFE_CONTENT, input,
						"Input contains potentially unsafe content; use plain instructions such as arithmetic, "
								+ "assignments and conditionals");
			}
		}
	}
}
