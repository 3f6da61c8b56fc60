package sixu.cst;

public enum TokenKind {
	PARAGRAPH_MARKER,
	COMMAND_MARKER,
	SYSTEM_CALL_MARKER,
	NAME,
	LPAREN,
	RPAREN,
	COMMA,
	EQUALS,
	LBRACE,
	RBRACE,
	ATTRIBUTE_OPEN,
	LBRACKET,
	RBRACKET,
	/** Quoted attribute condition, quotes included. */
	CONDITION,
	/** Trailing text-line tag, {@code #} included. */
	TAG
}
