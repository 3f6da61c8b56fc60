package sixu.transform;

import sixu.cst.Diagnostic;
import sixu.cst.Span;

public final class LoweringException extends RuntimeException {
	private final transient Diagnostic diagnostic;

	public LoweringException(Span span, String message) {
		super(span.start().line() + ":" + span.start().column() + ": " + message);
		this.diagnostic = new Diagnostic(span, message);
	}

	public Diagnostic diagnostic() {
		return diagnostic;
	}

	public int line() {
		return diagnostic.line();
	}

	public int column() {
		return diagnostic.column();
	}
}
