package prose.ast;

/**
 * One recognized statement.
 *
 * Instructions are created by the matcher, rendered once by the printer and
 * then discarded.
 */
public sealed interface Instruction permits Assignment, Arithmetic, Conditional, Loop, WhileLoop, CollectionLiteral, ListAppend {
}
