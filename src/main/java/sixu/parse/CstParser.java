package sixu.parse;

import sixu.cst.CallSyntax;
import sixu.cst.CstArgument;
import sixu.cst.CstAttribute;
import sixu.cst.CstBlock;
import sixu.cst.CstCommand;
import sixu.cst.CstEmbeddedCode;
import sixu.cst.CstError;
import sixu.cst.CstNode;
import sixu.cst.CstParagraph;
import sixu.cst.CstParameter;
import sixu.cst.CstRoot;
import sixu.cst.CstSystemCall;
import sixu.cst.CstTextLine;
import sixu.cst.CstToken;
import sixu.cst.CstValue;
import sixu.cst.EmbeddedSyntax;
import sixu.cst.LineIndex;
import sixu.cst.Span;
import sixu.cst.TokenKind;
import sixu.cst.Trivia;
import sixu.cst.ValueKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.IntFunction;

/**
 * Error-tolerant parser producing a lossless {@link CstRoot}.
 *
 * Never throws for any input: malformed constructs become {@link CstError}
 * leaves spanning to the next synchronization point (see
 * {@link Lexical#syncPoint(String, int, int)}) and parsing continues with the
 * following sibling.
 */
public final class CstParser {
	static final Set<String> ATTRIBUTE_KEYWORDS = Set.of("cond", "if", "while", "loop");

	public CstRoot parse(String source) {
		return parse("<input>", source);
	}

	public CstRoot parse(String name, String source) {
		Cursor c = new Cursor(source);
		List<CstNode> children = new ArrayList<>();
		while (!c.atEnd()) {
			if (c.trivia(children)) {
				continue;
			}
			if (c.startsWith("::")) {
				children.add(paragraph(c));
				continue;
			}
			if (c.peek() == '}') {
				children.add(c.error(c.pos, c.pos + 1, "unmatched '}'"));
				continue;
			}
			children.add(statement(c));
		}
		return new CstRoot(name, children, c.span(0, c.n), c.index);
	}

	private CstNode paragraph(Cursor c) {
		int start = c.pos;
		if (!Lexical.isIdentStartAt(c.s, start + 2)) {
			return c.error(start, Math.max(Lexical.syncPoint(c.s, start, c.n), start + 2),
					"expected paragraph name after '::'");
		}
		List<CstNode> children = new ArrayList<>();
		children.add(c.token(TokenKind.PARAGRAPH_MARKER, 2));
		int nameStart = c.pos;
		int nameEnd = Lexical.identEnd(c.s, nameStart);
		String name = c.s.substring(nameStart, nameEnd);
		children.add(c.token(TokenKind.NAME, nameEnd - nameStart));

		List<CstParameter> parameters = new ArrayList<>();
		int t = TriviaLexer.skip(c.s, c.pos, c.n, false);
		if (t < c.n && c.s.charAt(t) == '(') {
			c.triviaTo(children, t, false);
			int open = c.pos;
			DelimiterScanner.Result region = DelimiterScanner.scan(c.s, open);
			if (region.terminated()) {
				children.add(c.token(TokenKind.LPAREN, 1));
				list(c, children, parameters, region.end() - 1, limit -> parameter(c, limit));
			} else {
				children.add(c.error(open, Lexical.syncPoint(c.s, open, c.n), "unterminated parameter list, expected ')'"));
			}
			t = TriviaLexer.skip(c.s, c.pos, c.n, false);
		}

		CstBlock body = null;
		if (t < c.n && c.s.charAt(t) == '{') {
			c.triviaTo(children, t, false);
			body = block(c);
			children.add(body);
		} else {
			children.add(c.error(c.pos, c.pos, "expected '{' after paragraph header"));
		}
		return new CstParagraph(name, c.span(nameStart, nameEnd), parameters, body, children, c.span(start, c.pos));
	}

	/**
	 * Comma-separated items up to {@code close}, then the closing paren. Any
	 * trivia is allowed between items.
	 */
	private <T extends CstNode> void list(Cursor c, List<CstNode> children, List<T> items, int close,
			IntFunction<T> item) {
		boolean expectItem = true;
		boolean sawComma = false;
		while (true) {
			c.triviaTo(children, TriviaLexer.skip(c.s, c.pos, close, false), false);
			if (c.pos >= close) {
				if (sawComma && expectItem) {
					children.add(c.error(c.pos, c.pos, "trailing ',' in list"));
				}
				break;
			}
			if (expectItem && Lexical.isIdentStart(c.peek())) {
				T node = item.apply(close);
				children.add(node);
				items.add(node);
				expectItem = false;
				continue;
			}
			if (!expectItem && c.peek() == ',') {
				children.add(c.token(TokenKind.COMMA, 1));
				expectItem = true;
				sawComma = true;
				continue;
			}
			children.add(c.error(c.pos, Lexical.trimEnd(c.s, c.pos, close),
					expectItem ? "expected a name" : "expected ',' or ')'"));
		}
		children.add(c.token(TokenKind.RPAREN, 1));
	}

	private CstParameter parameter(Cursor c, int close) {
		int start = c.pos;
		List<CstNode> children = new ArrayList<>();
		int nameEnd = Lexical.identEnd(c.s, start);
		String name = c.s.substring(start, nameEnd);
		children.add(c.token(TokenKind.NAME, nameEnd - start));

		CstValue value = null;
		int t = TriviaLexer.skip(c.s, c.pos, close, false);
		if (t < close && c.s.charAt(t) == '=') {
			c.triviaTo(children, t, false);
			children.add(c.token(TokenKind.EQUALS, 1));
			c.triviaTo(children, TriviaLexer.skip(c.s, c.pos, close, false), false);
			int valueStart = c.pos;
			ValueLexer.Result r = c.values.lex(valueStart, close);
			if (!r.ok()) {
				children.add(c.error(valueStart, Lexical.trimEnd(c.s, valueStart, close), r.error()));
			} else if (!isLiteral(r.value())) {
				children.add(c.error(valueStart, r.end(), "parameter default must be a literal"));
			} else {
				value = c.value(r, valueStart);
				children.add(value);
			}
		}
		return new CstParameter(name, c.span(start, nameEnd), value, children, c.span(start, c.pos));
	}

	static boolean isLiteral(ValueKind value) {
		return value instanceof ValueKind.QuotedString || value instanceof ValueKind.IntegerNumber
				|| value instanceof ValueKind.FloatNumber || value instanceof ValueKind.BooleanLiteral;
	}

	private CstBlock block(Cursor c) {
		int start = c.pos;
		List<CstNode> children = new ArrayList<>();
		Span open = c.span(start, start + 1);
		children.add(c.token(TokenKind.LBRACE, 1));
		Span close = null;
		while (true) {
			if (c.atEnd() || c.startsWith("::")) {
				children.add(c.error(c.pos, c.pos, "unterminated block, expected '}'"));
				break;
			}
			if (c.trivia(children)) {
				continue;
			}
			if (c.peek() == '}') {
				close = c.span(c.pos, c.pos + 1);
				children.add(c.token(TokenKind.RBRACE, 1));
				break;
			}
			children.add(statement(c));
		}
		return new CstBlock(open, close, children, c.span(start, c.pos));
	}

	private CstNode statement(Cursor c) {
		if (c.startsWith("@{")) {
			return braceEmbeddedCode(c);
		}
		if (c.startsWith("##")) {
			return hashEmbeddedCode(c);
		}
		if (c.startsWith("#[")) {
			return attribute(c);
		}
		char ch = c.peek();
		if (ch == '@') {
			return call(c, true);
		}
		if (ch == '#') {
			return call(c, false);
		}
		if (ch == '{') {
			return block(c);
		}
		return textLine(c);
	}

	private CstNode braceEmbeddedCode(Cursor c) {
		int start = c.pos;
		DelimiterScanner.Result region = DelimiterScanner.scan(c.s, start + 1);
		if (!region.terminated() || Lexical.crossesStatementLine(c.s, start + 2, region.end() - 1)) {
			return c.error(start, Lexical.syncPoint(c.s, start + 2, c.n), "unterminated embedded code, expected '}'");
		}
		return c.embedded(EmbeddedSyntax.BRACE, start, start + 2, region.end() - 1, region.end());
	}

	private CstNode hashEmbeddedCode(Cursor c) {
		int start = c.pos;
		int close = c.s.indexOf("##", start + 2);
		if (close < 0 || Lexical.crossesStatementLine(c.s, start + 2, close)) {
			return c.error(start, Lexical.syncPoint(c.s, start + 2, c.n), "unterminated embedded code, expected '##'");
		}
		return c.embedded(EmbeddedSyntax.HASH, start, start + 2, close, close + 2);
	}

	private CstNode attribute(Cursor c) {
		String s = c.s;
		int start = c.pos;
		int kwStart = start + 2;
		int kwEnd = Lexical.identEnd(s, kwStart);
		if (kwEnd == kwStart) {
			return attributeError(c, start, "expected attribute keyword after '#['");
		}
		String keyword = s.substring(kwStart, kwEnd);
		if (!ATTRIBUTE_KEYWORDS.contains(keyword)) {
			return attributeError(c, start, "unknown attribute '" + keyword + "'");
		}
		int i = kwEnd;
		int condStart = -1;
		int condEnd = -1;
		if (i < c.n && s.charAt(i) == '(') {
			condStart = i + 1;
			if (condStart >= c.n || (s.charAt(condStart) != '"' && s.charAt(condStart) != '\'')) {
				return attributeError(c, start, "expected quoted condition");
			}
			char quote = s.charAt(condStart);
			int q = condStart + 1;
			while (q < c.n && s.charAt(q) != quote && s.charAt(q) != '\n') {
				q++;
			}
			if (q >= c.n || s.charAt(q) != quote) {
				return attributeError(c, start, "unterminated attribute condition");
			}
			condEnd = q + 1;
			if (condEnd >= c.n || s.charAt(condEnd) != ')') {
				return attributeError(c, start, "expected ')' after attribute condition");
			}
			i = condEnd + 1;
		}
		if (i >= c.n || s.charAt(i) != ']') {
			return attributeError(c, start, "expected ']' to close attribute");
		}

		List<CstNode> children = new ArrayList<>();
		children.add(c.token(TokenKind.ATTRIBUTE_OPEN, 2));
		Span keywordSpan = c.span(kwStart, kwEnd);
		children.add(c.token(TokenKind.NAME, kwEnd - kwStart));
		String condition = null;
		Span conditionSpan = null;
		if (condStart >= 0) {
			children.add(c.token(TokenKind.LPAREN, 1));
			condition = s.substring(condStart + 1, condEnd - 1);
			conditionSpan = c.span(condStart, condEnd);
			children.add(c.token(TokenKind.CONDITION, condEnd - condStart));
			children.add(c.token(TokenKind.RPAREN, 1));
		}
		children.add(c.token(TokenKind.RBRACKET, 1));

		CstNode target;
		int t = TriviaLexer.skip(s, c.pos, c.n, false);
		if (t >= c.n || s.charAt(t) == '}' || s.startsWith("::", t)) {
			target = c.error(c.pos, c.pos, "expected a statement after attribute");
		} else {
			c.triviaTo(children, t, false);
			target = statement(c);
		}
		children.add(target);
		return new CstAttribute(keyword, keywordSpan, condition, conditionSpan, target, children,
				c.span(start, c.pos));
	}

	private CstNode attributeError(Cursor c, int start, String message) {
		return c.error(start, Math.max(Lexical.syncPoint(c.s, start, c.n), start + 2), message);
	}

	private CstNode call(Cursor c, boolean command) {
		String s = c.s;
		int start = c.pos;
		if (!Lexical.isIdentStartAt(s, start + 1)) {
			return c.error(start, Math.max(Lexical.syncPoint(s, start, c.n), start + 1),
					command ? "expected command name after '@'" : "expected system call name after '#'");
		}
		List<CstNode> children = new ArrayList<>();
		Span marker = c.span(start, start + 1);
		children.add(c.token(command ? TokenKind.COMMAND_MARKER : TokenKind.SYSTEM_CALL_MARKER, 1));
		int nameStart = c.pos;
		int nameEnd = Lexical.identEnd(s, nameStart);
		String name = s.substring(nameStart, nameEnd);
		Span nameSpan = c.span(nameStart, nameEnd);
		children.add(c.token(TokenKind.NAME, nameEnd - nameStart));

		List<CstArgument> arguments = new ArrayList<>();
		CallSyntax syntax;
		if (!c.atEnd() && c.peek() == '(') {
			syntax = parenthesizedArguments(c, children, arguments);
		} else {
			syntax = CallSyntax.SPACE_SEPARATED;
			spaceSeparatedArguments(c, children, arguments);
		}
		unexpectedTail(c, children);

		Span span = c.span(start, c.pos);
		if (command) {
			return new CstCommand(name, marker, nameSpan, arguments, syntax, children, span);
		}
		return new CstSystemCall(name, marker, nameSpan, arguments, syntax, children, span);
	}

	private CallSyntax parenthesizedArguments(Cursor c, List<CstNode> children, List<CstArgument> arguments) {
		int open = c.pos;
		Span openSpan = c.span(open, open + 1);
		DelimiterScanner.Result region = DelimiterScanner.scan(c.s, open);
		if (!region.terminated()) {
			children.add(c.error(open, Lexical.syncPoint(c.s, open, c.n), "unterminated argument list, expected ')'"));
			return new CallSyntax.Parenthesized(openSpan, null);
		}
		int close = region.end() - 1;
		children.add(c.token(TokenKind.LPAREN, 1));
		list(c, children, arguments, close, limit -> argument(c, limit, false));
		return new CallSyntax.Parenthesized(openSpan, c.span(close, close + 1));
	}

	private void spaceSeparatedArguments(Cursor c, List<CstNode> children, List<CstArgument> arguments) {
		while (true) {
			int t = TriviaLexer.skip(c.s, c.pos, c.n, true);
			if (t == c.pos || !Lexical.isIdentStartAt(c.s, t)) {
				return;
			}
			c.triviaTo(children, t, true);
			CstArgument argument = argument(c, c.n, true);
			children.add(argument);
			arguments.add(argument);
			List<CstNode> parts = argument.children();
			if (parts.get(parts.size() - 1) instanceof CstError) {
				return;
			}
		}
	}

	/** Anything left on the line after an argument list is an error. */
	private void unexpectedTail(Cursor c, List<CstNode> children) {
		int t = TriviaLexer.skip(c.s, c.pos, c.n, true);
		if (t >= c.n) {
			return;
		}
		char ch = c.s.charAt(t);
		if (ch == '\n' || ch == '\r' || ch == '}' || Lexical.isCommentStart(c.s, t)) {
			return;
		}
		c.triviaTo(children, t, true);
		children.add(c.error(t, Math.max(Lexical.syncPoint(c.s, t, c.n), t + 1), "unexpected input after arguments"));
	}

	private CstArgument argument(Cursor c, int limit, boolean inline) {
		int start = c.pos;
		List<CstNode> children = new ArrayList<>();
		int nameEnd = Lexical.identEnd(c.s, start);
		String name = c.s.substring(start, nameEnd);
		Span nameSpan = c.span(start, nameEnd);
		children.add(c.token(TokenKind.NAME, nameEnd - start));

		Span equals = null;
		CstValue value = null;
		int t = TriviaLexer.skip(c.s, c.pos, limit, inline);
		if (t < limit && c.s.charAt(t) == '=') {
			c.triviaTo(children, t, inline);
			equals = c.span(t, t + 1);
			children.add(c.token(TokenKind.EQUALS, 1));
			c.triviaTo(children, TriviaLexer.skip(c.s, c.pos, limit, inline), inline);
			int valueStart = c.pos;
			ValueLexer.Result r = c.values.lex(valueStart, limit);
			if (r.ok()) {
				value = c.value(r, valueStart);
				children.add(value);
			} else {
				int end;
				if (!inline) {
					end = Lexical.trimEnd(c.s, valueStart, limit);
				} else if (valueStart >= limit || c.s.charAt(valueStart) == '\n' || c.s.charAt(valueStart) == '\r') {
					end = valueStart;
				} else {
					end = Lexical.syncPoint(c.s, valueStart, limit);
				}
				children.add(c.error(valueStart, end, r.error()));
			}
		}
		return new CstArgument(name, nameSpan, equals, value, children, c.span(start, c.pos));
	}

	private CstNode textLine(Cursor c) {
		int start = c.pos;
		TextLineLexer.Shape shape = c.lines.lex(start);
		if (!shape.ok()) {
			return c.error(start, Math.max(Lexical.syncPoint(c.s, start, c.n), start + 1), shape.error());
		}
		List<CstNode> children = new ArrayList<>();
		CstValue speaker = null;
		CstValue body = null;
		String tag = null;
		Span tagSpan = null;
		if (shape.open() >= 0) {
			children.add(c.token(TokenKind.LBRACKET, 1));
			c.triviaTo(children, shape.speaker().start(), true);
			speaker = c.piece(shape.speaker());
			children.add(speaker);
			c.triviaTo(children, shape.close(), true);
			children.add(c.token(TokenKind.RBRACKET, 1));
		}
		if (shape.body() != null) {
			c.triviaTo(children, shape.body().start(), true);
			body = c.piece(shape.body());
			children.add(body);
		}
		if (shape.tagStart() >= 0) {
			c.triviaTo(children, shape.tagStart(), true);
			tagSpan = c.span(shape.tagStart(), shape.tagEnd());
			tag = shape.tag(c.s);
			children.add(c.token(TokenKind.TAG, shape.tagEnd() - shape.tagStart()));
		}
		return new CstTextLine(speaker, body, tag, tagSpan, children, c.span(start, c.pos));
	}

	private static final class Cursor {
		final String s;
		final int n;
		final LineIndex index;
		final ValueLexer values;
		final TextLineLexer lines;
		int pos;

		Cursor(String source) {
			this.s = source;
			this.n = source.length();
			this.index = new LineIndex(source);
			this.values = new ValueLexer(index);
			this.lines = new TextLineLexer(source, values);
		}

		boolean atEnd() {
			return pos >= n;
		}

		char peek() {
			return s.charAt(pos);
		}

		boolean startsWith(String prefix) {
			return s.startsWith(prefix, pos);
		}

		Span span(int from, int to) {
			return new Span(index.positionAtChar(from), index.positionAtChar(to));
		}

		CstToken token(TokenKind kind, int length) {
			CstToken token = new CstToken(kind, s.substring(pos, pos + length), span(pos, pos + length));
			pos += length;
			return token;
		}

		CstError error(int from, int to, String message) {
			pos = to;
			return new CstError(s.substring(from, to), message, span(from, to));
		}

		CstValue value(ValueLexer.Result r, int start) {
			pos = r.end();
			return new CstValue(r.value(), s.substring(start, r.end()), span(start, r.end()));
		}

		CstValue piece(TextLineLexer.Piece piece) {
			pos = piece.end();
			return new CstValue(piece.value(), s.substring(piece.start(), piece.end()), span(piece.start(), piece.end()));
		}

		CstEmbeddedCode embedded(EmbeddedSyntax syntax, int start, int codeStart, int codeEnd, int end) {
			pos = end;
			return new CstEmbeddedCode(syntax, s.substring(codeStart, codeEnd), s.substring(start, end), span(start, end));
		}

		/** Consumes one trivia run at the cursor; an unterminated block comment becomes an error. */
		boolean trivia(List<CstNode> out) {
			TriviaLexer.Match m = TriviaLexer.match(s, pos, false);
			if (m == null) {
				return false;
			}
			if (!m.terminated()) {
				out.add(error(pos, Lexical.syncPoint(s, pos + 2, n), "unterminated block comment"));
				return true;
			}
			out.add(new Trivia(m.kind(), s.substring(pos, m.end()), span(pos, m.end())));
			pos = m.end();
			return true;
		}

		/** Consumes trivia up to {@code to}, which must end a trivia run. */
		void triviaTo(List<CstNode> out, int to, boolean inline) {
			while (pos < to) {
				TriviaLexer.Match m = TriviaLexer.match(s, pos, inline);
				if (m == null || !m.terminated() || m.end() > to) {
					throw new IllegalStateException("Expected trivia at offset " + pos);
				}
				out.add(new Trivia(m.kind(), s.substring(pos, m.end()), span(pos, m.end())));
				pos = m.end();
			}
		}
	}
}
