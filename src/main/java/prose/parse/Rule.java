package prose.parse;

import prose.ast.Instruction;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One entry of the matcher's priority table: a whole-statement pattern and the
 * constructor for its captures.
 */
record Rule(String name, Pattern pattern, Builder builder) {
	/**
	 * Builds the instruction from a successful match, or returns null to let the
	 * next rule try.
	 */
	@FunctionalInterface
	interface Builder {
		Instruction build(Matcher m);
	}

	static Rule of(String name, String regex, Builder builder) {
		return new Rule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), builder);
	}

	Instruction apply(String statement) {
		Matcher m = pattern.matcher(statement);
		if (!m.matches()) {
			return null;
		}
		return builder.build(m);
	}
}
