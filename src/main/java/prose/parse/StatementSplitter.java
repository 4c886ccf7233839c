package prose.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Divides an input block into single statements.
 *
 * Notes:
 * - Multi-line input: every non-blank line is one statement.
 * - Single line: a leading keyword phrase ("set x to", "if", "add a and", ...)
 * starts a new statement when it is glued to the previous word
 * ("set x to 5set y to 6"), or, if a completeness check was supplied, when the
 * text before it is already a complete statement. ';' separates statements;
 * with a completeness check only when both neighbours are complete statements,
 * otherwise it stays in the text ("set msg to a;b").
 * - Text inside double quotes is never split.
 *
 * This is a heuristic. A statement that legitimately contains a keyword phrase
 * may be cut; the pieces then fail to match downstream.
 */
public final class StatementSplitter {
	private static final Pattern LINE_BREAK = Pattern.compile("\\R");
	private static final Pattern LEADING_KEYWORD = Pattern.compile(
			"(?:set\\s+\\S+\\s+to\\s"
					+ "|if\\s+\\S+\\s"
					+ "|when\\s+\\S+\\s"
					+ "|add\\s+\\S+\\s+(?:and|to)\\s"
					+ "|subtract\\s+\\S+\\s+from\\s"
					+ "|multiply\\s+\\S+\\s+by\\s"
					+ "|divide\\s+\\S+\\s+by\\s"
					+ "|create\\s"
					+ "|repeat\\s+\\d+\\s+times?\\b"
					+ "|while\\s+\\S+\\s"
					+ "|for\\s+each\\s)",
			Pattern.CASE_INSENSITIVE);

	private final Predicate<String> completeStatement;

	/**
	 * Splitter that only cuts at line breaks, every unquoted ';' and glued
	 * keywords.
	 */
	public StatementSplitter() {
		this(null);
	}

	/**
	 * @param completeStatement tells whether a prefix is a whole statement on its
	 *                          own; enables cuts at whitespace-separated keywords
	 */
	public StatementSplitter(Predicate<String> completeStatement) {
		this.completeStatement = completeStatement;
	}

	public List<String> split(String input) {
		List<String> statements = new ArrayList<>();
		if (input == null) {
			return statements;
		}
		for (String line : LINE_BREAK.split(input)) {
			if (!line.isBlank()) {
				statements.add(line.strip());
			}
		}
		if (statements.size() != 1) {
			return statements;
		}

		List<String> pieces = new ArrayList<>();
		for (String segment : splitOnSemicolons(statements.get(0))) {
			splitOnKeywords(segment, pieces);
		}
		return pieces;
	}

	private List<String> splitOnSemicolons(String line) {
		List<Integer> separators = new ArrayList<>();
		boolean quoted = false;
		for (int i = 0; i < line.length(); i++) {
			char c = line.charAt(i);
			if (c == '"') {
				quoted = !quoted;
			} else if (c == ';' && !quoted) {
				separators.add(i);
			}
		}

		List<String> segments = new ArrayList<>();
		int start = 0;
		for (int k = 0; k < separators.size(); k++) {
			int at = separators.get(k);
			int next = k + 1 < separators.size() ? separators.get(k + 1) : line.length();
			if (separates(line.substring(start, at), line.substring(at + 1, next))) {
				segments.add(line.substring(start, at));
				start = at + 1;
			}
		}
		segments.add(line.substring(start));
		return segments;
	}

	// a ';' that is not between two statements belongs to the text
	private boolean separates(String before, String after) {
		if (completeStatement == null || before.isBlank() || after.isBlank()) {
			return true;
		}
		List<String> left = new ArrayList<>();
		splitOnKeywords(before, left);
		List<String> right = new ArrayList<>();
		splitOnKeywords(after, right);
		return completeStatement.test(left.get(left.size() - 1)) && completeStatement.test(right.get(0));
	}

	private void splitOnKeywords(String segment, List<String> out) {
		Matcher keyword = LEADING_KEYWORD.matcher(segment);
		int start = 0;
		boolean quoted = false;
		for (int i = 0; i < segment.length(); i++) {
			char c = segment.charAt(i);
			if (c == '"') {
				quoted = !quoted;
				continue;
			}
			if (quoted || i == start || !Character.isLetter(c)) {
				continue;
			}
			char prev = segment.charAt(i - 1);
			boolean glued = Character.isLetterOrDigit(prev) || prev == '_';
			if (!glued && !Character.isWhitespace(prev)) {
				continue;
			}
			keyword.region(i, segment.length());
			if (!keyword.lookingAt()) {
				continue;
			}
			String prefix = segment.substring(start, i).strip();
			if (!prefix.isEmpty() && isBoundary(prefix, glued)) {
				out.add(prefix);
				start = i;
			}
		}
		String rest = segment.substring(start).strip();
		if (!rest.isEmpty()) {
			out.add(rest);
		}
	}

	private boolean isBoundary(String prefix, boolean glued) {
		if (completeStatement == null) {
			return glued;
		}
		return completeStatement.test(prefix);
	}
}
