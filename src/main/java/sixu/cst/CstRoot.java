package sixu.cst;

import java.util.List;

/**
 * Whole-document container. Immutable; a new parse produces a new root.
 */
public record CstRoot(String name, List<CstNode> children, Span span, LineIndex lineIndex) implements CstNode {
	public CstRoot {
		children = List.copyOf(children);
	}

	@Override
	public NodeKind kind() {
		return NodeKind.ROOT;
	}

	public String source() {
		return lineIndex.source();
	}
}
