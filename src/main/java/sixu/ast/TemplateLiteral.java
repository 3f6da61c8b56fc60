package sixu.ast;

import java.util.List;

public record TemplateLiteral(List<Segment> parts) implements RValue, TextContent {
	public TemplateLiteral {
		parts = List.copyOf(parts);
	}

	public sealed interface Segment {
	}

	public record Text(String text) implements Segment {
	}

	public record Reference(Variable variable) implements Segment {
	}
}
