package sixu.cst;

import java.util.List;

/**
 * {@code #[keyword]} or {@code #[keyword("condition")]} governing the next
 * statement. The target may itself be an attribute; a missing target is a
 * zero-length {@link CstError}.
 */
public record CstAttribute(String keyword, Span keywordSpan, String condition, Span conditionSpan, CstNode target,
		List<CstNode> children, Span span) implements CstNode {
	public CstAttribute {
		children = List.copyOf(children);
	}

	@Override
	public NodeKind kind() {
		return NodeKind.ATTRIBUTE;
	}
}
