package prose.ast;

import java.util.Optional;

/**
 * if LHS CMP RHS then ACTION [else ACTION]
 *
 * {@code elseAction} is null when the statement has no else branch.
 */
public record Conditional(Operand lhs, Comparator comparator, Operand rhs, Action thenAction, Action elseAction)
		implements Instruction {
	public Conditional(Operand lhs, Comparator comparator, Operand rhs, Action thenAction) {
		this(lhs, comparator, rhs, thenAction, null);
	}

	public Optional<Action> elseBranch() {
		return Optional.ofNullable(elseAction);
	}
}
