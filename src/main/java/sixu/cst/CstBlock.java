package sixu.cst;

import java.util.List;

/**
 * Braced statement list. A null {@code closeBrace} marks an unterminated block.
 */
public record CstBlock(Span openBrace, Span closeBrace, List<CstNode> children, Span span) implements CstNode {
	public CstBlock {
		children = List.copyOf(children);
	}

	@Override
	public NodeKind kind() {
		return NodeKind.BLOCK;
	}

	public boolean isTerminated() {
		return closeBrace != null;
	}
}
