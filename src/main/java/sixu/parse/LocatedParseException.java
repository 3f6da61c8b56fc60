package sixu.parse;

/**
 * Thrown by {@link StrictParser} on the first syntax error.
 */
public final class LocatedParseException extends IllegalArgumentException {
	private final String detail;
	private final int line;
	private final int column;

	public LocatedParseException(String detail, int line, int column) {
		super(line + ":" + column + ": " + detail);
		this.detail = detail;
		this.line = line;
		this.column = column;
	}

	public String detail() {
		return detail;
	}

	/** 1-based. */
	public int line() {
		return line;
	}

	/** 0-based, in code points. */
	public int column() {
		return column;
	}
}
