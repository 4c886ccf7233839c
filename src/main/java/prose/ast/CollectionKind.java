package prose.ast;

public enum CollectionKind {
	LIST("new_list"),
	DICT("new_dict");

	private final String variableName;

	CollectionKind(String variableName) {
		this.variableName = variableName;
	}

	/**
	 * Name the generated literal is bound to.
	 */
	public String variableName() {
		return variableName;
	}
}
