package sixu.parse;

/**
 * Character classes shared by the tolerant and the strict parser.
 */
public final class Lexical {
	private Lexical() {
	}

	public static boolean isIdentStart(char ch) {
		return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_';
	}

	public static boolean isIdentPart(char ch) {
		return isIdentStart(ch) || (ch >= '0' && ch <= '9');
	}

	public static boolean isIdentStartAt(String s, int i) {
		return i < s.length() && isIdentStart(s.charAt(i));
	}

	/** End of the identifier starting at {@code start}. */
	public static int identEnd(String s, int start) {
		int i = start;
		while (i < s.length() && isIdentPart(s.charAt(i))) {
			i++;
		}
		return i;
	}

	public static boolean isWhitespace(char ch) {
		return ch == ' ' || ch == '\t' || ch == '\n' || ch == '\r' || ch == '\f';
	}

	public static boolean isInlineSpace(char ch) {
		return ch == ' ' || ch == '\t';
	}

	public static int skipInlineSpaces(String s, int from) {
		int i = from;
		while (i < s.length() && isInlineSpace(s.charAt(i))) {
			i++;
		}
		return i;
	}

	public static boolean isCommentStart(String s, int i) {
		return i + 1 < s.length() && s.charAt(i) == '/' && (s.charAt(i + 1) == '/' || s.charAt(i + 1) == '*');
	}

	/**
	 * Whether a literal may end right before {@code i}: whitespace, list
	 * punctuation, a closing bracket, a comment or the region end.
	 */
	public static boolean isDelimiter(String s, int i, int limit) {
		if (i >= limit) {
			return true;
		}
		char ch = s.charAt(i);
		return isWhitespace(ch) || ch == ',' || ch == ')' || ch == '}' || ch == ']' || isCommentStart(s, i);
	}

	/** Moves {@code end} back over whitespace, never below {@code start}. */
	public static int trimEnd(String s, int start, int end) {
		int i = end;
		while (i > start && isWhitespace(s.charAt(i - 1))) {
			i--;
		}
		return i;
	}

	/**
	 * Whether a line inside {@code [from, to)} starts, after spaces or tabs,
	 * with {@code @}, {@code #} or {@code ::}. Embedded code may not contain
	 * such a line.
	 */
	public static boolean crossesStatementLine(String s, int from, int to) {
		int i = s.indexOf('\n', from);
		while (i >= 0 && i < to) {
			int j = skipInlineSpaces(s, i + 1);
			if (j < to && (s.charAt(j) == '@' || s.charAt(j) == '#' || s.startsWith("::", j))) {
				return true;
			}
			i = s.indexOf('\n', i + 1);
		}
		return false;
	}

	/**
	 * Where parsing resumes after a malformed construct starting at
	 * {@code from}: before a {@code '}'} that closes a brace opened outside the
	 * region, at the start of a later line whose first non-blank characters are
	 * {@code @}, {@code #} or {@code ::}, or at {@code limit}. Trailing
	 * whitespace is left outside the region.
	 */
	public static int syncPoint(String s, int from, int limit) {
		int depth = 0;
		int i = from;
		while (i < limit) {
			char ch = s.charAt(i);
			if (ch == '{') {
				depth++;
			} else if (ch == '}') {
				if (depth == 0) {
					return trimEnd(s, from, i);
				}
				depth--;
			} else if (ch == '\n') {
				int j = skipInlineSpaces(s, i + 1);
				if (j < limit && (s.charAt(j) == '@' || s.charAt(j) == '#' || s.startsWith("::", j))) {
					return trimEnd(s, from, i + 1);
				}
			}
			i++;
		}
		return trimEnd(s, from, limit);
	}
}
