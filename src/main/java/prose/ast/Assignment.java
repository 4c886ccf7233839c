package prose.ast;

/**
 * set age to 25 / create variable age with value 25 / assign 25 to age
 */
public record Assignment(String name, Literal value) implements Instruction {
}
