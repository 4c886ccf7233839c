package prose.ast;

public enum Comparator {
	GT(">"),
	LT("<"),
	EQ("==");

	private final String symbol;

	Comparator(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}
}
