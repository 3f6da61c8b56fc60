package sixu.cst;

public enum TriviaKind {
	WHITESPACE,
	LINE_COMMENT,
	BLOCK_COMMENT
}
