package sixu.ast;

import java.util.List;

public record Paragraph(String name, List<Parameter> parameters, Block block) {
	public Paragraph {
		parameters = List.copyOf(parameters);
	}
}
