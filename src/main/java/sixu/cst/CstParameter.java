package sixu.cst;

import java.util.List;

public record CstParameter(String name, Span nameSpan, CstValue defaultValue, List<CstNode> children, Span span)
		implements CstNode {
	public CstParameter {
		children = List.copyOf(children);
	}

	@Override
	public NodeKind kind() {
		return NodeKind.PARAMETER;
	}
}
