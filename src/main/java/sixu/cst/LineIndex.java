package sixu.cst;

import java.util.Arrays;

/**
 * Precomputed line-start and encoding tables for one document.
 *
 * Built in a single pass over the text. Byte offsets are UTF-8 offsets; the
 * parser works on {@code char} indices and converts through
 * {@link #positionAtChar(int)}.
 */
public final class LineIndex {
	private final String source;
	private final int[] lineStartChars;
	private final int[] charToByte;
	private final int[] charToCodePoint;

	public LineIndex(String source) {
		this.source = source;
		int n = source.length();
		this.charToByte = new int[n + 1];
		this.charToCodePoint = new int[n + 1];

		int[] starts = new int[16];
		int lines = 1;
		starts[0] = 0;
		for (int i = 0; i < n; i++) {
			char ch = source.charAt(i);
			charToByte[i + 1] = charToByte[i] + utf8Width(ch);
			charToCodePoint[i + 1] = charToCodePoint[i] + (Character.isHighSurrogate(ch) ? 0 : 1);
			if (ch == '\n') {
				if (lines == starts.length) {
					starts = Arrays.copyOf(starts, lines * 2);
				}
				starts[lines++] = i + 1;
			}
		}
		this.lineStartChars = Arrays.copyOf(starts, lines);
	}

	// The low surrogate carries the whole 4-byte width, so both halves of a pair
	// map to the start of the code point.
	private static int utf8Width(char ch) {
		if (ch < 0x80) {
			return 1;
		}
		if (ch < 0x800) {
			return 2;
		}
		if (Character.isHighSurrogate(ch)) {
			return 0;
		}
		if (Character.isLowSurrogate(ch)) {
			return 4;
		}
		return 3;
	}

	public String source() {
		return source;
	}

	public int lineCount() {
		return lineStartChars.length;
	}

	public int byteLength() {
		return charToByte[source.length()];
	}

	/**
	 * Resolves a UTF-8 byte offset. The offset must lie on a character boundary
	 * within {@code [0, byteLength()]}.
	 */
	public Position positionAt(int byteOffset) {
		return positionAtChar(charIndexOf(byteOffset));
	}

	public Position positionAtChar(int charIndex) {
		if (charIndex < 0 || charIndex > source.length()) {
			throw new IllegalArgumentException(
					"Character index " + charIndex + " out of range [0, " + source.length() + "]");
		}
		int line = lineOfChar(charIndex);
		int column = charToCodePoint[charIndex] - charToCodePoint[lineStartChars[line]];
		return new Position(charToByte[charIndex], line + 1, column);
	}

	public int charIndexOf(int byteOffset) {
		if (byteOffset < 0 || byteOffset > byteLength()) {
			throw new IllegalArgumentException("Offset " + byteOffset + " out of range [0, " + byteLength() + "]");
		}
		int found = Arrays.binarySearch(charToByte, byteOffset);
		if (found < 0) {
			throw new IllegalArgumentException("Offset " + byteOffset + " is not on a character boundary");
		}
		while (found > 0 && charToByte[found - 1] == byteOffset) {
			found--;
		}
		return found;
	}

	/** Byte offset of the first character of a 1-based line. */
	public int lineStartOffset(int line) {
		if (line < 1 || line > lineStartChars.length) {
			throw new IllegalArgumentException("Line " + line + " out of range [1, " + lineStartChars.length + "]");
		}
		return charToByte[lineStartChars[line - 1]];
	}

	/** Byte offset for a 1-based line and a code point column, clamped to the line end. */
	public int offsetAt(int line, int column) {
		if (column < 0) {
			throw new IllegalArgumentException("Column " + column + " is negative");
		}
		lineStartOffset(line);
		int start = lineStartChars[line - 1];
		int limit = line < lineStartChars.length ? lineStartChars[line] - 1 : source.length();
		int i = start;
		int seen = 0;
		while (i < limit && seen < column) {
			i += Character.isHighSurrogate(source.charAt(i)) && i + 1 < limit ? 2 : 1;
			seen++;
		}
		return charToByte[i];
	}

	private int lineOfChar(int charIndex) {
		int found = Arrays.binarySearch(lineStartChars, charIndex);
		return found >= 0 ? found : -found - 2;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof LineIndex other && other.source.equals(source);
	}

	@Override
	public int hashCode() {
		return source.hashCode();
	}

	@Override
	public String toString() {
		return "LineIndex[lines=" + lineStartChars.length + ", bytes=" + byteLength() + "]";
	}
}
