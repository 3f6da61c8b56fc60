package sixu.cst;

import java.util.List;

/**
 * A node of the lossless concrete syntax tree.
 *
 * The set of node types is closed. Consumers dispatch on {@link #kind()}.
 * Leaves ({@link CstToken}, {@link Trivia}, {@link CstValue},
 * {@link CstEmbeddedCode}, {@link CstError}) carry raw source text; the text
 * of every other node is the concatenation of its children.
 */
public sealed interface CstNode
		permits CstRoot, CstParagraph, CstParameter, CstBlock, CstAttribute, CstCall, CstArgument, CstValue,
		CstTextLine, CstEmbeddedCode, CstError, CstToken, Trivia {
	NodeKind kind();

	Span span();

	default List<CstNode> children() {
		return List.of();
	}

	default String text() {
		StringBuilder out = new StringBuilder();
		appendText(out);
		return out.toString();
	}

	default void appendText(StringBuilder out) {
		for (CstNode child : children()) {
			child.appendText(out);
		}
	}
}
