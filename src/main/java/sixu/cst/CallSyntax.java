package sixu.cst;

/**
 * Which surface syntax an argument list was written in.
 */
public sealed interface CallSyntax {
	record SpaceSeparated() implements CallSyntax {
	}

	/** {@code close} is null when the list is unterminated. */
	record Parenthesized(Span open, Span close) implements CallSyntax {
	}

	CallSyntax SPACE_SEPARATED = new SpaceSeparated();
}
