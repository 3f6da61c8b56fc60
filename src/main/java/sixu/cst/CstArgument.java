package sixu.cst;

import java.util.List;

/**
 * {@code name} or {@code name=value}. A null value is a boolean flag.
 */
public record CstArgument(String name, Span nameSpan, Span equalsSpan, CstValue value, List<CstNode> children,
		Span span) implements CstNode {
	public CstArgument {
		children = List.copyOf(children);
	}

	@Override
	public NodeKind kind() {
		return NodeKind.ARGUMENT;
	}

	public boolean isFlag() {
		return equalsSpan == null;
	}
}
