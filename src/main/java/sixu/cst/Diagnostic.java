package sixu.cst;

/**
 * A positioned problem report. Line is 1-based, column 0-based.
 */
public record Diagnostic(Span span, String message) {
	public int line() {
		return span.start().line();
	}

	public int column() {
		return span.start().column();
	}

	@Override
	public String toString() {
		return line() + ":" + column() + ": " + message;
	}
}
