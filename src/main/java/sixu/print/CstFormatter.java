package sixu.print;

import sixu.cst.CstAttribute;
import sixu.cst.CstBlock;
import sixu.cst.CstCall;
import sixu.cst.CstEmbeddedCode;
import sixu.cst.CstError;
import sixu.cst.CstNode;
import sixu.cst.CstParagraph;
import sixu.cst.CstRoot;
import sixu.cst.CstTextLine;
import sixu.cst.CstToken;
import sixu.cst.EmbeddedSyntax;
import sixu.cst.NodeKind;
import sixu.cst.TokenKind;
import sixu.cst.Trivia;
import sixu.cst.TriviaKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Prints a CST as normalized source.
 *
 * One statement per line, one indent unit per block level, canonical spacing
 * inside constructs. Argument lists keep the syntax they were written in.
 * Comments are kept in source order: a comment that starts on the same line
 * as the preceding construct stays at the end of that construct's line, any
 * other comment gets a line of its own. Error nodes are printed verbatim.
 */
public final class CstFormatter {
	public static final int DEFAULT_INDENT = 4;

	private final String indentUnit;

	public CstFormatter() {
		this(DEFAULT_INDENT);
	}

	public CstFormatter(int indentWidth) {
		if (indentWidth < 1) {
			throw new IllegalArgumentException("Indent width must be positive, got " + indentWidth);
		}
		this.indentUnit = " ".repeat(indentWidth);
	}

	public String format(CstRoot root) {
		Output out = new Output();
		sequence(root.children(), 0, true, false, out);
		return out.toString();
	}

	/**
	 * Prints the statements and comments of a container.
	 *
	 * @param lineOpen whether the container's own line (a block header) is
	 *                 the line a same-line comment attaches to
	 */
	private void sequence(List<CstNode> children, int indent, boolean topLevel, boolean lineOpen, Output out) {
		int newlines = lineOpen ? 0 : 1;
		boolean previous = lineOpen;
		boolean emitted = false;
		boolean lastOwnLineComment = false;
		for (int i = 0; i < children.size(); i++) {
			CstNode child = children.get(i);
			if (child.kind() == NodeKind.TOKEN || (child.kind() == NodeKind.ERROR && child.span().isEmpty())) {
				continue;
			}
			if (child instanceof Trivia trivia) {
				if (!trivia.isComment()) {
					newlines += trivia.newlineCount();
					continue;
				}
				if (previous && newlines == 0) {
					out.append(" " + trivia.text());
					lastOwnLineComment = false;
				} else {
					if (emitted && (newlines >= 2 || (topLevel && !lastOwnLineComment && leadsParagraph(children, i)))) {
						out.blank();
					}
					out.line(indent, trivia.text());
					lastOwnLineComment = true;
				}
			} else {
				if (emitted) {
					boolean attached = lastOwnLineComment && newlines < 2;
					if (newlines >= 2 || (topLevel && child.kind() == NodeKind.PARAGRAPH && !attached)) {
						out.blank();
					}
				}
				statement(child, indent, out);
				lastOwnLineComment = false;
			}
			previous = true;
			emitted = true;
			newlines = 0;
		}
	}

	/** Whether the comment at {@code index} is followed, without a blank line, by a paragraph. */
	private static boolean leadsParagraph(List<CstNode> children, int index) {
		for (int i = index + 1; i < children.size(); i++) {
			CstNode next = children.get(i);
			if (next instanceof Trivia trivia) {
				if (!trivia.isComment() && trivia.newlineCount() >= 2) {
					return false;
				}
				continue;
			}
			return next.kind() == NodeKind.PARAGRAPH;
		}
		return false;
	}

	private void statement(CstNode node, int indent, Output out) {
		switch (node.kind()) {
			case PARAGRAPH -> paragraph((CstParagraph) node, indent, out);
			case BLOCK -> {
				out.line(indent, "{");
				blockBody((CstBlock) node, indent, out);
			}
			case ATTRIBUTE -> attribute((CstAttribute) node, indent, out);
			case COMMAND, SYSTEM_CALL -> call((CstCall) node, indent, out);
			case TEXT_LINE -> textLine((CstTextLine) node, indent, out);
			case EMBEDDED_CODE -> embeddedCode((CstEmbeddedCode) node, indent, out);
			case ERROR -> out.line(indent, ((CstError) node).text());
			case ROOT, PARAMETER, ARGUMENT, VALUE, TOKEN, TRIVIA ->
					throw new IllegalArgumentException("Not a statement: " + node.kind());
		}
	}

	private void blockBody(CstBlock block, int indent, Output out) {
		sequence(block.children(), indent + 1, false, true, out);
		if (block.isTerminated()) {
			out.line(indent, "}");
		}
	}

	private void paragraph(CstParagraph paragraph, int indent, Output out) {
		Inline header = new Inline();
		TokenKind previous = null;
		boolean spaced = false;
		for (CstNode child : paragraph.children()) {
			switch (child.kind()) {
				case TOKEN -> {
					CstToken token = (CstToken) child;
					header.word("", token.text());
					previous = token.tokenKind();
					spaced = false;
				}
				case PARAMETER -> {
					item(header, child, previous == TokenKind.LPAREN ? "" : " ");
					previous = null;
					spaced = false;
				}
				case TRIVIA -> {
					header.trivia((Trivia) child);
					spaced = true;
				}
				case ERROR -> {
					if (!child.span().isEmpty()) {
						header.word(spaced ? " " : "", ((CstError) child).text());
						previous = null;
						spaced = false;
					}
				}
				case BLOCK -> header.word(" ", "{");
				default -> throw new IllegalArgumentException("Unexpected " + child.kind() + " in paragraph");
			}
		}
		header.emit(indent, out);
		if (paragraph.body() != null) {
			blockBody(paragraph.body(), indent, out);
		}
	}

	private void attribute(CstAttribute attribute, int indent, Output out) {
		StringBuilder head = new StringBuilder();
		List<CstNode> rest = new ArrayList<>();
		boolean closed = false;
		for (CstNode child : attribute.children()) {
			if (!closed && child instanceof CstToken token) {
				head.append(token.text());
				closed = token.tokenKind() == TokenKind.RBRACKET;
			} else {
				rest.add(child);
			}
		}
		out.line(indent, head.toString());
		sequence(rest, indent, false, true, out);
	}

	private void call(CstCall call, int indent, Output out) {
		Inline line = new Inline();
		boolean afterOpen = false;
		boolean spaced = false;
		for (CstNode child : call.children()) {
			switch (child.kind()) {
				case TOKEN -> {
					CstToken token = (CstToken) child;
					line.word("", token.text());
					afterOpen = token.tokenKind() == TokenKind.LPAREN;
					spaced = false;
				}
				case ARGUMENT -> {
					item(line, child, afterOpen ? "" : " ");
					afterOpen = false;
					spaced = false;
				}
				case TRIVIA -> {
					line.trivia((Trivia) child);
					spaced = true;
				}
				case ERROR -> {
					String text = ((CstError) child).text();
					if (!text.isEmpty()) {
						// unparsed text keeps its adjacency to what precedes it
						line.word(spaced ? " " : "", text);
						afterOpen = false;
						spaced = false;
					}
				}
				default -> throw new IllegalArgumentException("Unexpected " + child.kind() + " in " + call.kind());
			}
		}
		line.emit(indent, out);
	}

	/** An argument or parameter: {@code name}, {@code name=value}, comments kept in place. */
	private static void item(Inline line, CstNode item, String separator) {
		boolean first = true;
		boolean spaced = false;
		for (CstNode part : item.children()) {
			if (part instanceof Trivia trivia) {
				line.trivia(trivia);
				spaced = true;
				continue;
			}
			String text = part.text();
			if (text.isEmpty()) {
				continue;
			}
			line.word(first ? separator : (part.kind() == NodeKind.ERROR && spaced ? " " : ""), text);
			first = false;
			spaced = false;
		}
	}

	private void textLine(CstTextLine textLine, int indent, Output out) {
		Inline line = new Inline();
		boolean inSpeaker = false;
		for (CstNode child : textLine.children()) {
			if (child instanceof Trivia trivia) {
				line.trivia(trivia);
				continue;
			}
			if (child instanceof CstToken token) {
				switch (token.tokenKind()) {
					case LBRACKET -> inSpeaker = true;
					case RBRACKET -> inSpeaker = false;
					default -> {
					}
				}
				line.word(token.tokenKind() == TokenKind.RBRACKET ? "" : " ", token.text());
				continue;
			}
			line.word(inSpeaker ? "" : " ", child.text());
		}
		line.emit(indent, out);
	}

	private void embeddedCode(CstEmbeddedCode code, int indent, Output out) {
		String open = code.syntax() == EmbeddedSyntax.BRACE ? "@{" : "##";
		String close = code.syntax() == EmbeddedSyntax.BRACE ? "}" : "##";
		if (code.code().indexOf('\n') < 0) {
			String body = code.code().strip();
			out.line(indent, body.isEmpty() ? open + " " + close : open + " " + body + " " + close);
			return;
		}
		List<String> lines = new ArrayList<>(Arrays.asList(code.code().split("\n", -1)));
		while (!lines.isEmpty() && lines.get(0).isBlank()) {
			lines.remove(0);
		}
		while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
			lines.remove(lines.size() - 1);
		}
		if (lines.isEmpty()) {
			out.line(indent, open + " " + close);
			return;
		}
		out.line(indent, open);
		for (String bodyLine : lines) {
			out.verbatim(bodyLine);
		}
		out.line(indent, close);
	}

	/**
	 * Builds the text of a one-line construct. A line comment inside it forces
	 * the rest onto a continuation line, one indent deeper.
	 */
	private static final class Inline {
		private final List<String> lines = new ArrayList<>();
		private final StringBuilder current = new StringBuilder();
		private boolean broken;
		private boolean afterComment;

		void word(String separator, String text) {
			if (broken) {
				lines.add(current.toString());
				current.setLength(0);
				broken = false;
			} else if (current.length() > 0) {
				current.append(afterComment ? " " : separator);
			}
			current.append(text);
			afterComment = false;
		}

		void trivia(Trivia trivia) {
			if (!trivia.isComment()) {
				return;
			}
			if (broken) {
				lines.add(current.toString());
				current.setLength(0);
				broken = false;
			} else if (current.length() > 0) {
				current.append(' ');
			}
			current.append(trivia.text());
			afterComment = true;
			broken = trivia.triviaKind() == TriviaKind.LINE_COMMENT;
		}

		void emit(int indent, Output out) {
			lines.add(current.toString());
			out.line(indent, lines.get(0));
			for (int i = 1; i < lines.size(); i++) {
				out.line(indent + 1, lines.get(i));
			}
		}
	}

	private final class Output {
		private final List<String> lines = new ArrayList<>();

		void line(int indent, String text) {
			lines.add(indentUnit.repeat(indent) + text);
		}

		void verbatim(String text) {
			lines.add(text);
		}

		void append(String text) {
			int last = lines.size() - 1;
			lines.set(last, lines.get(last) + text);
		}

		void blank() {
			if (!lines.isEmpty() && !lines.get(lines.size() - 1).isEmpty()) {
				lines.add("");
			}
		}

		@Override
		public String toString() {
			if (lines.isEmpty()) {
				return "";
			}
			return String.join("\n", lines) + "\n";
		}
	}
}
