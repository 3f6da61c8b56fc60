package sixu.parse;

import sixu.ast.Argument;
import sixu.ast.Attribute;
import sixu.ast.Block;
import sixu.ast.Child;
import sixu.ast.ChildContent;
import sixu.ast.CommandLine;
import sixu.ast.EmbeddedCode;
import sixu.ast.Paragraph;
import sixu.ast.Parameter;
import sixu.ast.PlainText;
import sixu.ast.Primitive;
import sixu.ast.RValue;
import sixu.ast.Story;
import sixu.ast.SystemCallLine;
import sixu.ast.TextContent;
import sixu.ast.TextLine;
import sixu.cst.LineIndex;
import sixu.cst.Position;
import sixu.cst.TemplatePart;
import sixu.cst.ValueKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Fail-fast parser for the execution pipeline.
 *
 * Accepts exactly the documents that {@link CstParser} parses without error
 * nodes and produces the tree that lowering their CST would produce. The
 * first problem aborts the parse with a {@link LocatedParseException}.
 */
public final class StrictParser {
	public Story parse(String source) {
		return parse("<input>", source);
	}

	public Story parse(String name, String source) {
		Cursor c = new Cursor(source);
		List<Paragraph> paragraphs = new ArrayList<>();
		while (!c.atEnd()) {
			if (c.trivia()) {
				continue;
			}
			if (!c.startsWith("::")) {
				throw c.fail(c.pos, c.peek() == '}' ? "unmatched '}'" : "statement outside of a paragraph");
			}
			paragraphs.add(paragraph(c));
		}
		return new Story(name, paragraphs);
	}

	private Paragraph paragraph(Cursor c) {
		c.pos += 2;
		String name = c.ident("expected paragraph name after '::'");
		List<Parameter> parameters = new ArrayList<>();
		c.pos = TriviaLexer.skip(c.s, c.pos, c.n, false);
		if (c.peekIs('(')) {
			int close = c.region("unterminated parameter list, expected ')'");
			c.pos++;
			items(c, close, () -> parameters.add(parameter(c, close)));
			c.pos = TriviaLexer.skip(c.s, c.pos, c.n, false);
		}
		if (!c.peekIs('{')) {
			throw c.fail(c.pos, "expected '{' after paragraph header");
		}
		return new Paragraph(name, parameters, block(c));
	}

	private void items(Cursor c, int close, Runnable item) {
		boolean expectItem = true;
		boolean sawComma = false;
		while (true) {
			c.pos = TriviaLexer.skip(c.s, c.pos, close, false);
			if (c.pos >= close) {
				if (sawComma && expectItem) {
					throw c.fail(c.pos, "trailing ',' in list");
				}
				break;
			}
			if (expectItem && Lexical.isIdentStart(c.peek())) {
				item.run();
				expectItem = false;
			} else if (!expectItem && c.peek() == ',') {
				c.pos++;
				expectItem = true;
				sawComma = true;
			} else {
				throw c.fail(c.pos, expectItem ? "expected a name" : "expected ',' or ')'");
			}
		}
		c.pos = close + 1;
	}

	private Parameter parameter(Cursor c, int close) {
		String name = c.ident("expected a name");
		int t = TriviaLexer.skip(c.s, c.pos, close, false);
		if (t >= close || c.s.charAt(t) != '=') {
			return new Parameter(name, null);
		}
		c.pos = TriviaLexer.skip(c.s, t + 1, close, false);
		int start = c.pos;
		ValueLexer.Result r = c.values.lex(start, close);
		if (!r.ok()) {
			throw c.fail(start, r.error());
		}
		if (!CstParser.isLiteral(r.value())) {
			throw c.fail(start, "parameter default must be a literal");
		}
		c.pos = r.end();
		return new Parameter(name, AstValues.primitive(r.value()));
	}

	private Block block(Cursor c) {
		c.pos++;
		List<Child> children = new ArrayList<>();
		while (true) {
			if (c.atEnd() || c.startsWith("::")) {
				throw c.fail(c.pos, "unterminated block, expected '}'");
			}
			if (c.trivia()) {
				continue;
			}
			if (c.peek() == '}') {
				c.pos++;
				return new Block(children);
			}
			children.add(statement(c));
		}
	}

	private Child statement(Cursor c) {
		if (c.startsWith("@{")) {
			int start = c.pos;
			DelimiterScanner.Result region = DelimiterScanner.scan(c.s, start + 1);
			if (!region.terminated() || Lexical.crossesStatementLine(c.s, start + 2, region.end() - 1)) {
				throw c.fail(start, "unterminated embedded code, expected '}'");
			}
			c.pos = region.end();
			return Child.of(new EmbeddedCode(c.s.substring(start + 2, region.end() - 1).strip()));
		}
		if (c.startsWith("##")) {
			int start = c.pos;
			int close = c.s.indexOf("##", start + 2);
			if (close < 0 || Lexical.crossesStatementLine(c.s, start + 2, close)) {
				throw c.fail(start, "unterminated embedded code, expected '##'");
			}
			c.pos = close + 2;
			return Child.of(new EmbeddedCode(c.s.substring(start + 2, close).strip()));
		}
		if (c.startsWith("#[")) {
			return attribute(c);
		}
		char ch = c.peek();
		if (ch == '@' || ch == '#') {
			return Child.of(call(c, ch == '@'));
		}
		if (ch == '{') {
			return Child.of(block(c));
		}
		return Child.of(textLine(c));
	}

	private Child attribute(Cursor c) {
		String s = c.s;
		int start = c.pos;
		c.pos += 2;
		String keyword = c.ident("expected attribute keyword after '#['");
		if (!CstParser.ATTRIBUTE_KEYWORDS.contains(keyword)) {
			throw c.fail(start, "unknown attribute '" + keyword + "'");
		}
		String condition = null;
		if (c.peekIs('(')) {
			int q = c.pos + 1;
			if (q >= c.n || (s.charAt(q) != '"' && s.charAt(q) != '\'')) {
				throw c.fail(start, "expected quoted condition");
			}
			int end = q + 1;
			while (end < c.n && s.charAt(end) != s.charAt(q) && s.charAt(end) != '\n') {
				end++;
			}
			if (end >= c.n || s.charAt(end) != s.charAt(q)) {
				throw c.fail(start, "unterminated attribute condition");
			}
			condition = s.substring(q + 1, end);
			c.pos = end + 1;
			if (!c.peekIs(')')) {
				throw c.fail(start, "expected ')' after attribute condition");
			}
			c.pos++;
		}
		if (!c.peekIs(']')) {
			throw c.fail(start, "expected ']' to close attribute");
		}
		c.pos++;

		int t = TriviaLexer.skip(s, c.pos, c.n, false);
		if (t >= c.n || s.charAt(t) == '}' || s.startsWith("::", t)) {
			throw c.fail(c.pos, "expected a statement after attribute");
		}
		c.pos = t;
		Child target = statement(c);
		Attribute attribute = target.attribute() != null ? target.attribute() : new Attribute(keyword, condition);
		return new Child(attribute, target.content());
	}

	private ChildContent call(Cursor c, boolean command) {
		c.pos++;
		String name = c.ident(command ? "expected command name after '@'" : "expected system call name after '#'");
		List<Argument> arguments = new ArrayList<>();
		if (c.peekIs('(')) {
			int close = c.region("unterminated argument list, expected ')'");
			c.pos++;
			items(c, close, () -> arguments.add(argument(c, close, false)));
		} else {
			while (true) {
				int t = TriviaLexer.skip(c.s, c.pos, c.n, true);
				if (t == c.pos || !Lexical.isIdentStartAt(c.s, t)) {
					break;
				}
				c.pos = t;
				arguments.add(argument(c, c.n, true));
			}
		}
		int t = TriviaLexer.skip(c.s, c.pos, c.n, true);
		if (t < c.n) {
			char ch = c.s.charAt(t);
			if (ch != '\n' && ch != '\r' && ch != '}' && !Lexical.isCommentStart(c.s, t)) {
				throw c.fail(t, "unexpected input after arguments");
			}
		}
		return command ? new CommandLine(name, arguments) : new SystemCallLine(name, arguments);
	}

	private Argument argument(Cursor c, int limit, boolean inline) {
		String name = c.ident("expected a name");
		int t = TriviaLexer.skip(c.s, c.pos, limit, inline);
		if (t >= limit || c.s.charAt(t) != '=') {
			return new Argument(name, new Primitive.BooleanValue(true));
		}
		c.pos = TriviaLexer.skip(c.s, t + 1, limit, inline);
		int start = c.pos;
		ValueLexer.Result r = c.values.lex(start, limit);
		if (!r.ok()) {
			throw c.fail(start, r.error());
		}
		c.requireValidTemplate(r.value());
		c.pos = r.end();
		RValue value = AstValues.rvalue(r.value());
		return new Argument(name, value);
	}

	private TextLine textLine(Cursor c) {
		TextLineLexer.Shape shape = c.lines.lex(c.pos);
		if (!shape.ok()) {
			throw c.fail(c.pos, shape.error());
		}
		TextContent leading = null;
		if (shape.speaker() != null) {
			c.requireValidTemplate(shape.speaker().value());
			leading = AstValues.text(shape.speaker().value());
		}
		TextContent text = new PlainText("");
		if (shape.body() != null) {
			c.requireValidTemplate(shape.body().value());
			text = AstValues.text(shape.body().value());
		}
		c.pos = shape.end();
		return new TextLine(leading, text, shape.tag(c.s));
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

		boolean peekIs(char ch) {
			return pos < n && s.charAt(pos) == ch;
		}

		boolean startsWith(String prefix) {
			return s.startsWith(prefix, pos);
		}

		/** Skips one trivia run; fails on an unterminated block comment. */
		boolean trivia() {
			TriviaLexer.Match m = TriviaLexer.match(s, pos, false);
			if (m == null) {
				return false;
			}
			if (!m.terminated()) {
				throw fail(pos, "unterminated block comment");
			}
			pos = m.end();
			return true;
		}

		String ident(String message) {
			if (!Lexical.isIdentStartAt(s, pos)) {
				throw fail(pos, message);
			}
			int start = pos;
			pos = Lexical.identEnd(s, pos);
			return s.substring(start, pos);
		}

		/** Index of the closer matching the opener at the cursor. */
		int region(String message) {
			DelimiterScanner.Result region = DelimiterScanner.scan(s, pos);
			if (!region.terminated()) {
				throw fail(pos, message);
			}
			return region.end() - 1;
		}

		void requireValidTemplate(ValueKind value) {
			TemplatePart.Invalid invalid = AstValues.firstInvalid(value).orElse(null);
			if (invalid != null) {
				Position at = invalid.span().start();
				throw new LocatedParseException(invalid.message(), at.line(), at.column());
			}
		}

		LocatedParseException fail(int at, String message) {
			Position position = index.positionAtChar(Math.min(at, n));
			return new LocatedParseException(message, position.line(), position.column());
		}
	}
}
