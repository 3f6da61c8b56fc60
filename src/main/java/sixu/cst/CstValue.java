package sixu.cst;

public record CstValue(ValueKind valueKind, String raw, Span span) implements CstNode {
	@Override
	public NodeKind kind() {
		return NodeKind.VALUE;
	}

	@Override
	public void appendText(StringBuilder out) {
		out.append(raw);
	}
}
