package sixu.cst;

/**
 * Half-open source range {@code [start, end)}.
 */
public record Span(Position start, Position end) {
	public Span {
		if (end.offset() < start.offset()) {
			throw new IllegalArgumentException("Span end " + end.offset() + " precedes start " + start.offset());
		}
	}

	public static Span empty(Position at) {
		return new Span(at, at);
	}

	public int length() {
		return end.offset() - start.offset();
	}

	public boolean isEmpty() {
		return length() == 0;
	}

	public boolean contains(int byteOffset) {
		return byteOffset >= start.offset() && byteOffset < end.offset();
	}
}
