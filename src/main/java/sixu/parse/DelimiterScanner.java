package sixu.parse;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Finds the end of a bracketed region.
 *
 * Counts nested openers of the same kind. Bracket characters inside quoted
 * strings, template literals and comments are not counted, except inside a
 * template's {@code ${...}} body where braces count again.
 */
public final class DelimiterScanner {
	/**
	 * @param end        index just past the matching closer, or the input length
	 *                   when the region is unterminated
	 * @param terminated whether the closer was found
	 */
	public record Result(int end, boolean terminated) {
	}

	private enum Mode {
		CODE,
		INTERPOLATION,
		STRING,
		TEMPLATE
	}

	private static final class Frame {
		final Mode mode;
		final char quote;
		int depth;

		Frame(Mode mode, char quote, int depth) {
			this.mode = mode;
			this.quote = quote;
			this.depth = depth;
		}
	}

	private DelimiterScanner() {
	}

	/** Scans the region opened by the {@code (}, {@code [} or {@code {} at {@code openIndex}. */
	public static Result scan(String source, int openIndex) {
		char open = source.charAt(openIndex);
		char close = closerOf(open);
		int n = source.length();
		Deque<Frame> stack = new ArrayDeque<>();
		stack.push(new Frame(Mode.CODE, '\0', 1));

		int i = openIndex + 1;
		while (i < n) {
			char ch = source.charAt(i);
			Frame top = stack.peek();
			switch (top.mode) {
				case STRING -> {
					if (ch == '\\') {
						i += 2;
						continue;
					}
					if (ch == top.quote) {
						stack.pop();
					}
					i++;
				}
				case TEMPLATE -> {
					if (ch == '\\') {
						i += 2;
						continue;
					}
					if (ch == '`') {
						stack.pop();
						i++;
					} else if (ch == '$' && i + 1 < n && source.charAt(i + 1) == '{') {
						stack.push(new Frame(Mode.INTERPOLATION, '\0', 1));
						i += 2;
					} else {
						i++;
					}
				}
				case CODE, INTERPOLATION -> {
					if (ch == '/' && i + 1 < n && source.charAt(i + 1) == '/') {
						int eol = source.indexOf('\n', i);
						i = eol < 0 ? n : eol;
						continue;
					}
					if (ch == '/' && i + 1 < n && source.charAt(i + 1) == '*') {
						int end = source.indexOf("*/", i + 2);
						i = end < 0 ? n : end + 2;
						continue;
					}
					if (ch == '"' || ch == '\'') {
						stack.push(new Frame(Mode.STRING, ch, 0));
						i++;
						continue;
					}
					if (ch == '`') {
						stack.push(new Frame(Mode.TEMPLATE, '`', 0));
						i++;
						continue;
					}
					char opener = top.mode == Mode.CODE ? open : '{';
					char closer = top.mode == Mode.CODE ? close : '}';
					if (ch == opener) {
						top.depth++;
					} else if (ch == closer) {
						top.depth--;
						if (top.depth == 0) {
							if (top.mode == Mode.CODE) {
								return new Result(i + 1, true);
							}
							stack.pop();
						}
					}
					i++;
				}
			}
		}
		return new Result(n, false);
	}

	private static char closerOf(char open) {
		return switch (open) {
			case '(' -> ')';
			case '[' -> ']';
			case '{' -> '}';
			default -> throw new IllegalArgumentException("Not an opening delimiter: '" + open + "'");
		};
	}
}
