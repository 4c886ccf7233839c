package prose.ast;

/**
 * Body of a conditional branch or loop.
 */
public sealed interface Action permits Print, RawAction {
}
