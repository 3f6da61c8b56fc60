package sixu.ast;

import java.util.List;

public record SystemCallLine(String command, List<Argument> arguments) implements ChildContent {
	public SystemCallLine {
		arguments = List.copyOf(arguments);
	}
}
