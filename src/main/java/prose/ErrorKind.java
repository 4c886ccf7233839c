package prose;

public enum ErrorKind {
	/** No rule matched the statement. */
	UNRECOGNIZED_STATEMENT,
	/** A comparison was written with an operator word that has no mapping. */
	AMBIGUOUS_OPERATOR,
	/** Nothing left to translate after splitting. */
	EMPTY_INPUT,
	INPUT_TOO_LONG,
	UNSAFE_CONTENT
}
