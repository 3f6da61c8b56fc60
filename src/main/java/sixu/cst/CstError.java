package sixu.cst;

/**
 * Source text the parser could not make sense of, kept verbatim.
 */
public record CstError(String text, String message, Span span) implements CstNode {
	@Override
	public NodeKind kind() {
		return NodeKind.ERROR;
	}

	@Override
	public void appendText(StringBuilder out) {
		out.append(text);
	}
}
