package prose.ast;

/**
 * add ITEM to [list] NAME
 */
public record ListAppend(Operand item, String listName) implements Instruction {
}
