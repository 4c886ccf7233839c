package prose.resolve;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Names assigned by earlier statements of one translation session.
 *
 * The table only grows. Declaring a name twice is not an error.
 */
public final class SymbolTable implements SymbolLookup {
	private final Set<String> names = new LinkedHashSet<>();

	public void declare(String name) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("cannot declare a blank name");
		}
		names.add(name);
	}

	public void declareAll(Iterable<String> declared) {
		for (String name : declared) {
			declare(name);
		}
	}

	/**
	 * Independent table holding the same names.
	 */
	public SymbolTable copy() {
		SymbolTable copy = new SymbolTable();
		copy.names.addAll(names);
		return copy;
	}

	@Override
	public boolean isKnown(String name) {
		return names.contains(name);
	}

	public int size() {
		return names.size();
	}

	/**
	 * Declared names in declaration order.
	 */
	public Set<String> names() {
		return Collections.unmodifiableSet(names);
	}

	@Override
	public String toString() {
		return "SymbolTable" + names;
	}
}
