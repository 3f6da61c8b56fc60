package sixu.parse;

import sixu.cst.LineIndex;
import sixu.cst.Span;
import sixu.cst.TemplatePart;
import sixu.cst.ValueKind;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Lexes one literal value: quoted and template strings, numbers, booleans and
 * variable paths.
 */
public final class ValueLexer {
	private static final Pattern HEX = Pattern.compile("[+-]?0[xX][0-9a-fA-F][0-9a-fA-F_]*");
	private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9][0-9_]*");
	private static final Pattern FLOAT = Pattern.compile("[+-]?([0-9][0-9_]*\\.([0-9][0-9_]*)?|\\.[0-9][0-9_]*)");

	/**
	 * Outcome of lexing a value. Exactly one of {@code value} and {@code error}
	 * is set; {@code end} is where the value (or the offending run) stops.
	 */
	public record Result(ValueKind value, int end, String error) {
		public boolean ok() {
			return error == null;
		}

		static Result failure(int end, String error) {
			return new Result(null, end, error);
		}
	}

	private final String s;
	private final LineIndex index;

	public ValueLexer(LineIndex index) {
		this.s = index.source();
		this.index = index;
	}

	public static boolean isQuote(char ch) {
		return ch == '"' || ch == '\'' || ch == '`';
	}

	public Result lex(int start, int limit) {
		if (start >= limit) {
			return Result.failure(start, "expected a value");
		}
		char ch = s.charAt(start);
		if (ch == '"' || ch == '\'') {
			return quoted(start, limit);
		}
		if (ch == '`') {
			return template(start, limit);
		}
		if (isDigit(ch) || ch == '+' || ch == '-' || (ch == '.' && start + 1 < limit && isDigit(s.charAt(start + 1)))) {
			return number(start, limit);
		}
		if (Lexical.isIdentStart(ch)) {
			return path(start, limit);
		}
		return Result.failure(start, "expected a value");
	}

	private Result quoted(int start, int limit) {
		char quote = s.charAt(start);
		StringBuilder out = new StringBuilder();
		String error = null;
		int i = start + 1;
		while (true) {
			if (i >= limit || s.charAt(i) == '\n') {
				return Result.failure(i, "unterminated string literal");
			}
			char ch = s.charAt(i);
			if (ch == quote) {
				i++;
				break;
			}
			if (ch == '\\') {
				int next = escape(i, limit, out);
				if (next < 0) {
					if (error == null) {
						error = "invalid escape sequence in string literal";
					}
					i++;
				} else {
					i = next;
				}
				continue;
			}
			if (ch < 0x20) {
				if (error == null) {
					error = "control character in string literal";
				}
				i++;
				continue;
			}
			out.append(ch);
			i++;
		}
		if (error != null) {
			return Result.failure(i, error);
		}
		return new Result(new ValueKind.QuotedString(quote, out.toString()), i, null);
	}

	private Result template(int start, int limit) {
		List<TemplatePart> parts = new ArrayList<>();
		StringBuilder text = new StringBuilder();
		String error = null;
		int literalStart = start + 1;
		int i = start + 1;
		while (true) {
			if (i >= limit) {
				return Result.failure(i, "unterminated template string");
			}
			char ch = s.charAt(i);
			if (ch == '`') {
				addLiteral(parts, literalStart, i, text);
				i++;
				break;
			}
			if (ch == '\\') {
				int next = escape(i, limit, text);
				if (next < 0) {
					if (error == null) {
						error = "invalid escape sequence in template string";
					}
					i++;
				} else {
					i = next;
				}
				continue;
			}
			if (ch == '$' && i + 1 < limit && s.charAt(i + 1) == '{') {
				addLiteral(parts, literalStart, i, text);
				text.setLength(0);
				DelimiterScanner.Result region = DelimiterScanner.scan(s, i + 1);
				if (!region.terminated() || region.end() > limit) {
					return Result.failure(limit, "unterminated interpolation in template string");
				}
				parts.add(interpolation(i, region.end()));
				i = region.end();
				literalStart = i;
				continue;
			}
			if (ch < 0x20 && ch != '\n' && ch != '\r' && ch != '\t') {
				if (error == null) {
					error = "control character in template string";
				}
				i++;
				continue;
			}
			text.append(ch);
			i++;
		}
		if (error != null) {
			return Result.failure(i, error);
		}
		return new Result(new ValueKind.TemplateString(parts), i, null);
	}

	private void addLiteral(List<TemplatePart> parts, int from, int to, StringBuilder text) {
		if (from < to) {
			parts.add(new TemplatePart.Literal(s.substring(from, to), text.toString(), span(from, to)));
		}
	}

	private TemplatePart interpolation(int from, int to) {
		String body = s.substring(from + 2, to - 1).strip();
		List<String> path = parsePath(body);
		if (path == null) {
			return new TemplatePart.Invalid(s.substring(from, to),
					"invalid interpolation '" + body + "': expected a variable path", span(from, to));
		}
		return new TemplatePart.Interpolation(path, span(from, to));
	}

	/** Splits {@code a.b.c} into segments, or returns null if it is not a dotted path. */
	public static List<String> parsePath(String text) {
		if (text.isEmpty()) {
			return null;
		}
		List<String> segments = new ArrayList<>();
		for (String segment : text.split("\\.", -1)) {
			if (segment.isEmpty() || !Lexical.isIdentStart(segment.charAt(0))
					|| Lexical.identEnd(segment, 0) != segment.length()) {
				return null;
			}
			segments.add(segment);
		}
		return segments;
	}

	/** Decodes the escape at {@code i}; returns the index after it, or -1 if invalid. */
	private int escape(int i, int limit, StringBuilder out) {
		if (i + 1 >= limit) {
			return -1;
		}
		char e = s.charAt(i + 1);
		switch (e) {
			case 'n' -> out.append('\n');
			case 'r' -> out.append('\r');
			case 't' -> out.append('\t');
			case '\\', '/', '"', '\'', '`', '$' -> out.append(e);
			case 'u' -> {
				return unicodeEscape(i, limit, out);
			}
			default -> {
				return -1;
			}
		}
		return i + 2;
	}

	private int unicodeEscape(int i, int limit, StringBuilder out) {
		int digitsStart;
		int digitsEnd;
		int next;
		if (i + 2 < limit && s.charAt(i + 2) == '{') {
			digitsStart = i + 3;
			int close = s.indexOf('}', digitsStart);
			if (close < 0 || close >= limit || close == digitsStart || close - digitsStart > 6) {
				return -1;
			}
			digitsEnd = close;
			next = close + 1;
		} else {
			digitsStart = i + 2;
			digitsEnd = i + 6;
			if (digitsEnd > limit) {
				return -1;
			}
			next = digitsEnd;
		}
		int cp = 0;
		for (int k = digitsStart; k < digitsEnd; k++) {
			int digit = Character.digit(s.charAt(k), 16);
			if (digit < 0) {
				return -1;
			}
			cp = cp * 16 + digit;
		}
		if (cp > Character.MAX_CODE_POINT || (cp >= Character.MIN_SURROGATE && cp <= Character.MAX_SURROGATE)) {
			return -1;
		}
		out.appendCodePoint(cp);
		return next;
	}

	private Result number(int start, int limit) {
		int end = runEnd(start, limit);
		String token = s.substring(start, end);
		if (token.endsWith("_") || token.contains("_.") || token.contains("._")) {
			return Result.failure(end, "invalid number literal '" + token + "'");
		}
		try {
			if (HEX.matcher(token).matches()) {
				boolean negative = token.startsWith("-");
				String digits = token.substring(token.indexOf('x') >= 0 ? token.indexOf('x') + 1 : token.indexOf('X') + 1)
						.replace("_", "");
				return new Result(new ValueKind.IntegerNumber(Long.parseLong((negative ? "-" : "") + digits, 16)), end,
						null);
			}
			if (INTEGER.matcher(token).matches()) {
				return new Result(new ValueKind.IntegerNumber(Long.parseLong(token.replace("_", ""))), end, null);
			}
		} catch (NumberFormatException e) {
			return Result.failure(end, "integer literal '" + token + "' out of range");
		}
		if (FLOAT.matcher(token).matches()) {
			double value = Double.parseDouble(token.replace("_", ""));
			if (Double.isInfinite(value)) {
				return Result.failure(end, "float literal '" + token + "' out of range");
			}
			return new Result(new ValueKind.FloatNumber(value), end, null);
		}
		return Result.failure(end, "invalid number literal '" + token + "'");
	}

	private Result path(int start, int limit) {
		List<String> segments = new ArrayList<>();
		int i = Lexical.identEnd(s, start);
		segments.add(s.substring(start, i));
		while (i < limit && s.charAt(i) == '.') {
			if (i + 1 >= limit || !Lexical.isIdentStart(s.charAt(i + 1))) {
				return Result.failure(runEnd(start, limit), "malformed variable path '" + s.substring(start, runEnd(start, limit)) + "'");
			}
			int next = Lexical.identEnd(s, i + 1);
			segments.add(s.substring(i + 1, next));
			i = next;
		}
		if (!Lexical.isDelimiter(s, i, limit)) {
			int end = runEnd(start, limit);
			return Result.failure(end, "unexpected character after '" + s.substring(start, i) + "'");
		}
		if (segments.size() == 1 && (segments.get(0).equals("true") || segments.get(0).equals("false"))) {
			return new Result(new ValueKind.BooleanLiteral(segments.get(0).equals("true")), i, null);
		}
		return new Result(new ValueKind.VariableReference(segments), i, null);
	}

	private int runEnd(int start, int limit) {
		int i = start;
		while (!Lexical.isDelimiter(s, i, limit)) {
			i++;
		}
		return i;
	}

	private Span span(int from, int to) {
		return new Span(index.positionAtChar(from), index.positionAtChar(to));
	}

	private static boolean isDigit(char ch) {
		return ch >= '0' && ch <= '9';
	}
}
