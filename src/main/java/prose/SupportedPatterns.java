package prose;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Example sentences for every recognized construct, grouped by category.
 */
public final class SupportedPatterns {
	private static final Map<String, List<String>> EXAMPLES;

	static {
		Map<String, List<String>> m = new LinkedHashMap<>();
		m.put("Arithmetic Operations", List.of(
				"add 5 and 3",
				"subtract 3 from 8",
				"multiply x by 2",
				"divide total by count",
				"set total to price times 2"));
		m.put("Variable Assignment", List.of(
				"set x to 10",
				"create variable name with value hello",
				"assign 42 to answer"));
		m.put("Conditional Statements", List.of(
				"if x greater than 5 then print yes",
				"when count equals 0 do print empty",
				"if temperature less than 32 then print freezing else print mild"));
		m.put("Data Operations", List.of(
				"create list with 1, 2, 3",
				"create dictionary with name John and age 25",
				"add 4 to list numbers"));
		m.put("Loop Operations", List.of(
				"repeat 5 times print hello",
				"while count less than 3 print count",
				"for each item in numbers print item"));
		EXAMPLES = Collections.unmodifiableMap(m);
	}

	private SupportedPatterns() {
	}

	public static Map<String, List<String>> examples() {
		return EXAMPLES;
	}

	public static String describe() {
		StringBuilder sb = new StringBuilder("Supported patterns and examples:");
		for (Map.Entry<String, List<String>> e : EXAMPLES.entrySet()) {
			sb.append("\n\n").append(e.getKey()).append(':');
			for (String example : e.getValue()) {
				sb.append("\n  - ").append(example);
			}
		}
		return sb.toString();
	}
}
