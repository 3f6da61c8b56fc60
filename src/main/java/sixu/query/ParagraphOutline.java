package sixu.query;

import sixu.cst.Span;

import java.util.List;

/**
 * Outline entry for one paragraph.
 */
public record ParagraphOutline(String name, Span nameSpan, Span span, List<String> parameters) {
	public ParagraphOutline {
		parameters = List.copyOf(parameters);
	}
}
