package prose.ast;

/**
 * Binary arithmetic bound to {@code destination}.
 *
 * Operands are kept in emission order: "subtract 5 from 20" is stored as
 * lhs=20, rhs=5.
 */
public record Arithmetic(ArithmeticOp op, Operand lhs, Operand rhs, String destination) implements Instruction {
	public static final String DEFAULT_DESTINATION = "result";

	public Arithmetic(ArithmeticOp op, Operand lhs, Operand rhs) {
		this(op, lhs, rhs, DEFAULT_DESTINATION);
	}
}
