package prose.ast;

/**
 * while LHS CMP RHS ACTION
 */
public record WhileLoop(Operand lhs, Comparator comparator, Operand rhs, Action body) implements Instruction {
}
