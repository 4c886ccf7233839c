package prose.ast;

/**
 * print TOKEN. The token is resolved to a literal or a reference when the
 * action is rendered, not when it is matched.
 */
public record Print(Operand token) implements Action {
}
