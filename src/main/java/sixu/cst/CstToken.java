package sixu.cst;

public record CstToken(TokenKind tokenKind, String text, Span span) implements CstNode {
	@Override
	public NodeKind kind() {
		return NodeKind.TOKEN;
	}

	@Override
	public void appendText(StringBuilder out) {
		out.append(text);
	}
}
