package sixu.cst;

/**
 * A point in a source document.
 *
 * @param offset UTF-8 byte offset, 0-based
 * @param line   1-based line number
 * @param column 0-based column, counted in code points
 */
public record Position(int offset, int line, int column) {
	public static final Position START = new Position(0, 1, 0);
}
