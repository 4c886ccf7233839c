package prose.resolve;

import prose.ast.Literal;
import prose.ast.Operand;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether a free-form token is emitted as a bare reference or as a
 * literal.
 *
 * Resolution is stateless: the same token against the same lookup always
 * yields the same text.
 */
public final class ActionResolver {
	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_]\\w*");

	private ActionResolver() {
	}

	/**
	 * Operands of comparisons and arithmetic. A bare word is always a variable
	 * reference here, declared or not.
	 */
	public static String operand(Operand operand) {
		String t = operand.text();
		if (operand.quoted()) {
			return quote(t);
		}
		if (Literal.isBoolean(t)) {
			return booleanLiteral(t);
		}
		if (Literal.isNumber(t)) {
			return number(t);
		}
		return IDENTIFIER.matcher(t).matches() ? t : quote(t);
	}

	/**
	 * Whether {@link #operand(Operand)} emits this operand as a variable reference.
	 */
	public static boolean isReference(Operand operand) {
		String t = operand.text();
		return !operand.quoted() && !Literal.isBoolean(t) && IDENTIFIER.matcher(t).matches();
	}

	public static String resolve(Operand operand, SymbolLookup symbols) {
		String t = operand.text();
		if (operand.quoted()) {
			return quote(t);
		}
		if (Literal.isBoolean(t)) {
			return booleanLiteral(t);
		}
		if (symbols.isKnown(t)) {
			return t;
		}
		if (Literal.isNumber(t)) {
			return number(t);
		}
		return quote(t);
	}

	/**
	 * Assignment values are literals regardless of what has been declared.
	 */
	public static String literal(Literal value) {
		switch (value.kind()) {
			case NUMBER:
				return number(value.text());
			case BOOLEAN:
				return booleanLiteral(value.text());
			case STRING:
				return quote(value.text());
			default:
				throw new IllegalStateException("unknown literal kind " + value.kind());
		}
	}

	// 007 is not a valid literal in the target grammar
	static String number(String text) {
		return new BigDecimal(text).toPlainString();
	}

	static String booleanLiteral(String text) {
		return "true".equals(text.toLowerCase(Locale.ROOT)) ? "True" : "False";
	}

	/**
	 * Double-quoted literal. Control characters other than the named escapes are
	 * written as {@code \\xNN}.
	 */
	public static String quote(String text) {
		StringBuilder sb = new StringBuilder(text.length() + 2);
		sb.append('"');
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch (c) {
				case '\\':
					sb.append("\\\\");
					break;
				case '"':
					sb.append("\\\"");
					break;
				case '\n':
					sb.append("\\n");
					break;
				case '\r':
					sb.append("\\r");
					break;
				case '\t':
					sb.append("\\t");
					break;
				default:
					if (c < 0x20 || c == 0x7f) {
						sb.append(String.format("\\x%02x", (int) c));
					} else {
						sb.append(c);
					}
			}
		}
		return sb.append('"').toString();
	}
}
