package sixu.cst;

public enum NodeKind {
	ROOT,
	PARAGRAPH,
	PARAMETER,
	BLOCK,
	ATTRIBUTE,
	COMMAND,
	SYSTEM_CALL,
	ARGUMENT,
	VALUE,
	TEXT_LINE,
	EMBEDDED_CODE,
	ERROR,
	TOKEN,
	TRIVIA
}
