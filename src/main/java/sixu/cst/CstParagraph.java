package sixu.cst;

import java.util.List;

/**
 * {@code ::name(params) { ... }}. {@code body} is null when the header is not
 * followed by a block.
 */
public record CstParagraph(String name, Span nameSpan, List<CstParameter> parameters, CstBlock body,
		List<CstNode> children, Span span) implements CstNode {
	public CstParagraph {
		parameters = List.copyOf(parameters);
		children = List.copyOf(children);
	}

	@Override
	public NodeKind kind() {
		return NodeKind.PARAGRAPH;
	}
}
