package sixu.cst;

public enum EmbeddedSyntax {
	/** {@code @{ ... }} */
	BRACE,
	/** {@code ## ... ##} */
	HASH
}
