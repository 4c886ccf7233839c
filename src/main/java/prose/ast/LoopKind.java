package prose.ast;

public enum LoopKind {
	REPEAT_N,
	FOR_EACH
}
