package sixu.parse;

import sixu.cst.ValueKind;

/**
 * Splits a text line into its optional speaker, body and tag.
 *
 * Shared by both parsers so they agree on where each part starts and ends.
 * Gaps between parts are spaces or tabs only.
 */
public final class TextLineLexer {
	public record Piece(int start, int end, ValueKind value) {
	}

	/**
	 * Positions of the parts of one text line. {@code open}/{@code close} are
	 * the speaker brackets (-1 when absent); {@code tagStart}/{@code tagEnd}
	 * cover {@code #tag} (-1 when absent). When {@code error} is set, nothing
	 * else is meaningful.
	 */
	public record Shape(int start, int open, Piece speaker, int close, Piece body, int tagStart, int tagEnd, int end,
			String error) {
		public boolean ok() {
			return error == null;
		}

		public String tag(String source) {
			return tagStart < 0 ? null : source.substring(tagStart + 1, tagEnd);
		}
	}

	private final String s;
	private final ValueLexer values;

	public TextLineLexer(String source, ValueLexer values) {
		this.s = source;
		this.values = values;
	}

	public Shape lex(int start) {
		int n = s.length();
		int i = start;
		int open = -1;
		int close = -1;
		Piece speaker = null;
		if (s.charAt(i) == '[') {
			open = i;
			int j = Lexical.skipInlineSpaces(s, i + 1);
			if (j < n && ValueLexer.isQuote(s.charAt(j))) {
				ValueLexer.Result r = values.lex(j, n);
				if (r.ok()) {
					int k = Lexical.skipInlineSpaces(s, r.end());
					if (k < n && s.charAt(k) == ']') {
						speaker = new Piece(j, r.end(), r.value());
						close = k;
					}
				}
			}
			if (speaker == null) {
				int k = i + 1;
				while (k < n && s.charAt(k) != ']' && s.charAt(k) != '\n') {
					k++;
				}
				if (k >= n || s.charAt(k) != ']') {
					return failure(start, "unterminated speaker, expected ']'");
				}
				int b = k;
				while (b > j && Lexical.isInlineSpace(s.charAt(b - 1))) {
					b--;
				}
				speaker = new Piece(j, b, new ValueKind.BareText(s.substring(j, b)));
				close = k;
			}
			i = Lexical.skipInlineSpaces(s, close + 1);
		}

		Piece body = null;
		int after = open >= 0 ? close + 1 : start;
		if (i < n && ValueLexer.isQuote(s.charAt(i))) {
			ValueLexer.Result r = values.lex(i, n);
			if (!r.ok()) {
				return failure(start, r.error());
			}
			body = new Piece(i, r.end(), r.value());
			after = r.end();
		} else if (i < n && s.charAt(i) != '\n' && s.charAt(i) != '\r' && s.charAt(i) != '}' && !isTagAt(i)) {
			int k = i;
			while (k < n && s.charAt(k) != '\n' && s.charAt(k) != '}'
					&& !(k > i && Lexical.isInlineSpace(s.charAt(k - 1)) && isTagAt(k))) {
				k++;
			}
			int b = Lexical.trimEnd(s, i, k);
			body = new Piece(i, b, new ValueKind.BareText(s.substring(i, b)));
			after = b;
		}

		int tagStart = -1;
		int tagEnd = -1;
		int t = Lexical.skipInlineSpaces(s, after);
		if (isTagAt(t)) {
			int k = t + 1;
			while (k < n && !Lexical.isWhitespace(s.charAt(k)) && s.charAt(k) != '}') {
				k++;
			}
			tagStart = t;
			tagEnd = k;
			after = k;
		}
		if (after == start) {
			return failure(start, "unexpected character '" + s.charAt(start) + "'");
		}
		return new Shape(start, open, speaker, close, body, tagStart, tagEnd, after, null);
	}

	private boolean isTagAt(int i) {
		return i + 1 < s.length() && s.charAt(i) == '#' && !Lexical.isWhitespace(s.charAt(i + 1))
				&& s.charAt(i + 1) != '}';
	}

	private Shape failure(int start, String message) {
		return new Shape(start, -1, null, -1, null, -1, -1, start, message);
	}
}
