package prose;

import java.util.List;

/**
 * Generated program text of one successful translation.
 */
public record Translation(String source, List<String> warnings, int statementCount) {
	public Translation {
		warnings = List.copyOf(warnings);
	}
}
