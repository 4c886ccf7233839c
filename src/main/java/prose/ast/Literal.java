package prose.ast;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Typed assignment value.
 */
public record Literal(Kind kind, String text) {
	private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");

	public enum Kind {
		NUMBER,
		BOOLEAN,
		STRING
	}

	public Literal {
		if (kind == null || text == null) {
			throw new IllegalArgumentException("literal kind and text are required");
		}
	}

	/**
	 * Classifies a raw value: digits become numbers, true/false (any case)
	 * booleans, everything else a string. Surrounding double quotes force a
	 * string and are dropped.
	 */
	public static Literal of(String raw) {
		Operand operand = Operand.of(raw);
		String t = operand.text();
		if (operand.quoted()) {
			return new Literal(Kind.STRING, t);
		}
		if (isNumber(t)) {
			return new Literal(Kind.NUMBER, t);
		}
		if (isBoolean(t)) {
			return new Literal(Kind.BOOLEAN, t.toLowerCase(Locale.ROOT));
		}
		return new Literal(Kind.STRING, t);
	}

	public static boolean isNumber(String text) {
		return NUMBER.matcher(text).matches();
	}

	public static boolean isBoolean(String text) {
		return "true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text);
	}
}
