package prose.parse;

import prose.ast.Action;
import prose.ast.Operand;
import prose.ast.Print;
import prose.ast.RawAction;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the text after then/do/else or a loop header into an {@link Action}.
 */
final class ActionParser {
	private static final Pattern PRINT = Pattern.compile("^print\\s+(.+)$", Pattern.CASE_INSENSITIVE);

	private ActionParser() {
	}

	static Action parse(String text) {
		String t = text.strip();
		Matcher m = PRINT.matcher(t);
		if (m.matches()) {
			return new Print(Operand.of(m.group(1)));
		}
		return t.isEmpty() ? RawAction.EMPTY : new RawAction(t);
	}
}
