package sixu.cst;

import java.util.List;

/**
 * Decoded payload of a {@link CstValue}.
 */
public sealed interface ValueKind {
	/** {@code "..."} or {@code '...'} with escapes resolved. */
	record QuotedString(char quote, String value) implements ValueKind {
	}

	record TemplateString(List<TemplatePart> parts) implements ValueKind {
		public TemplateString {
			parts = List.copyOf(parts);
		}

		public boolean isValid() {
			return parts.stream().noneMatch(p -> p instanceof TemplatePart.Invalid);
		}
	}

	record IntegerNumber(long value) implements ValueKind {
	}

	record FloatNumber(double value) implements ValueKind {
	}

	record BooleanLiteral(boolean value) implements ValueKind {
	}

	record VariableReference(List<String> segments) implements ValueKind {
		public VariableReference {
			segments = List.copyOf(segments);
		}
	}

	/** Unquoted speaker or text-line body, trimmed. */
	record BareText(String text) implements ValueKind {
	}
}
