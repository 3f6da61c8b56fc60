package sixu.cst;

/**
 * Opaque code block. {@code code} is the text between the delimiters.
 */
public record CstEmbeddedCode(EmbeddedSyntax syntax, String code, String raw, Span span) implements CstNode {
	@Override
	public NodeKind kind() {
		return NodeKind.EMBEDDED_CODE;
	}

	@Override
	public void appendText(StringBuilder out) {
		out.append(raw);
	}
}
