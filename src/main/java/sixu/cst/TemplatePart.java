package sixu.cst;

import java.util.List;

public sealed interface TemplatePart {
	Span span();

	/** Literal segment; {@code text} has escapes resolved. */
	record Literal(String raw, String text, Span span) implements TemplatePart {
	}

	/** {@code ${a.b.c}} */
	record Interpolation(List<String> path, Span span) implements TemplatePart {
		public Interpolation {
			path = List.copyOf(path);
		}
	}

	/** {@code ${...}} whose body is not a dotted path. */
	record Invalid(String raw, String message, Span span) implements TemplatePart {
	}
}
