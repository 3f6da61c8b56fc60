package sixu.cst;

import java.util.List;

/**
 * {@code [speaker] body #tag}, every part optional.
 */
public record CstTextLine(CstValue speaker, CstValue body, String tag, Span tagSpan, List<CstNode> children,
		Span span) implements CstNode {
	public CstTextLine {
		children = List.copyOf(children);
	}

	@Override
	public NodeKind kind() {
		return NodeKind.TEXT_LINE;
	}
}
