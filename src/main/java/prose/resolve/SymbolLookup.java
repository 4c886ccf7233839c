package prose.resolve;

/**
 * Read-only view of the identifiers visible to the printer.
 */
public interface SymbolLookup {
	boolean isKnown(String name);

	/**
	 * A view that additionally knows {@code name}, without declaring it here.
	 */
	default SymbolLookup with(String name) {
		return new ScopedLookup(this, name);
	}
}
