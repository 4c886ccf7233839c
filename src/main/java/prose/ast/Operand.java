package prose.ast;

/**
 * An unresolved token that may name an identifier or spell a literal.
 *
 * {@code quoted} is set when the user wrote the token inside double quotes;
 * such tokens are always literals.
 */
public record Operand(String text, boolean quoted) {
	public Operand {
		if (text == null) {
			throw new IllegalArgumentException("operand text cannot be null");
		}
	}

	public static Operand of(String raw) {
		String t = raw.strip();
		if (t.length() >= 2 && t.startsWith("\"") && t.endsWith("\"")) {
			return new Operand(t.substring(1, t.length() - 1), true);
		}
		return new Operand(t, false);
	}
}
