package prose.ast;

public enum ArithmeticOp {
	ADD("+"),
	SUBTRACT("-"),
	MULTIPLY("*"),
	DIVIDE("/");

	private final String symbol;

	ArithmeticOp(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}
}
