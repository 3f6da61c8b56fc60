package sixu.ast;

import java.util.List;

/**
 * Semantic tree of one document, as consumed by the runtime.
 */
public record Story(String name, List<Paragraph> paragraphs) {
	public Story {
		paragraphs = List.copyOf(paragraphs);
	}
}
