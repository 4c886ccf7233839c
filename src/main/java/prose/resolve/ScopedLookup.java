package prose.resolve;

/**
 * Makes a loop variable visible inside the loop body only.
 */
record ScopedLookup(SymbolLookup parent, String local) implements SymbolLookup {
	@Override
	public boolean isKnown(String name) {
		return local.equals(name) || parent.isKnown(name);
	}
}
