package prose.parse;

import prose.ast.Comparator;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Fixed vocabulary shared by the matcher and the splitter.
 */
public final class Keywords {
	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	/**
	 * Exact comparator phrases. Anything else is not a comparator.
	 */
	static final Map<String, Comparator> COMPARATORS = Map.of(
			"greater than", Comparator.GT,
			"is greater than", Comparator.GT,
			"less than", Comparator.LT,
			"is less than", Comparator.LT,
			"equals", Comparator.EQ,
			"equal to", Comparator.EQ,
			"is equal to", Comparator.EQ);

	// reserved words of the target grammar, plus the lowercase boolean spellings
	// that the resolver rewrites to True/False
	private static final Set<String> RESERVED = Set.of(
			"False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
			"def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
			"is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield",
			"true", "false");

	private Keywords() {
	}

	/**
	 * @return the comparator for an exact phrase, or null when the phrase has no
	 *         mapping
	 */
	public static Comparator comparator(String phrase) {
		String normalized = WHITESPACE.matcher(phrase.strip().toLowerCase(Locale.ROOT)).replaceAll(" ");
		return COMPARATORS.get(normalized);
	}

	/**
	 * Whether {@code name} can be bound by generated code.
	 */
	public static boolean isIdentifier(String name) {
		return name != null && IDENTIFIER.matcher(name).matches() && !RESERVED.contains(name);
	}

	/**
	 * Alternation of every comparator phrase, longest first, for use inside a
	 * larger pattern.
	 */
	static String comparatorPattern() {
		return COMPARATORS.keySet().stream()
				.sorted((a, b) -> b.length() - a.length())
				.map(phrase -> phrase.replace(" ", "\\s+"))
				.collect(Collectors.joining("|", "(", ")"));
	}
}
