package sixu.parse;

import sixu.cst.TriviaKind;

/**
 * Recognizes whitespace and comment runs.
 *
 * Each match covers the longest run of exactly one kind; a whitespace run
 * never absorbs a comment and vice versa.
 */
public final class TriviaLexer {
	/**
	 * @param terminated false only for a block comment that reaches the end of
	 *                   input without its closing {@code *}{@code /}
	 */
	public record Match(TriviaKind kind, int start, int end, boolean terminated) {
	}

	private TriviaLexer() {
	}

	/** Matches any trivia at {@code offset}, or returns null. */
	public static Match match(String source, int offset) {
		return match(source, offset, false);
	}

	/**
	 * With {@code inline} set, only spaces, tabs and block comments that stay on
	 * the current line are accepted.
	 */
	public static Match match(String source, int offset, boolean inline) {
		int n = source.length();
		if (offset >= n) {
			return null;
		}
		char ch = source.charAt(offset);
		if (inline ? Lexical.isInlineSpace(ch) : Lexical.isWhitespace(ch)) {
			int i = offset + 1;
			while (i < n && (inline ? Lexical.isInlineSpace(source.charAt(i)) : Lexical.isWhitespace(source.charAt(i)))) {
				i++;
			}
			return new Match(TriviaKind.WHITESPACE, offset, i, true);
		}
		if (ch != '/' || offset + 1 >= n) {
			return null;
		}
		char next = source.charAt(offset + 1);
		if (next == '/' && !inline) {
			int i = source.indexOf('\n', offset);
			if (i < 0) {
				i = n;
			} else if (i > offset && source.charAt(i - 1) == '\r') {
				i--;
			}
			return new Match(TriviaKind.LINE_COMMENT, offset, i, true);
		}
		if (next == '*') {
			int close = source.indexOf("*/", offset + 2);
			if (close < 0) {
				return inline ? null : new Match(TriviaKind.BLOCK_COMMENT, offset, n, false);
			}
			int end = close + 2;
			if (inline && source.substring(offset, end).indexOf('\n') >= 0) {
				return null;
			}
			return new Match(TriviaKind.BLOCK_COMMENT, offset, end, true);
		}
		return null;
	}

	/**
	 * End of the run of terminated trivia starting at {@code from}, not past
	 * {@code limit}.
	 */
	public static int skip(String source, int from, int limit, boolean inline) {
		int i = from;
		while (i < limit) {
			Match m = match(source, i, inline);
			if (m == null || !m.terminated() || m.end() > limit) {
				break;
			}
			i = m.end();
		}
		return i;
	}
}
