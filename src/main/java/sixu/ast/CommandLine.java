package sixu.ast;

import java.util.List;

public record CommandLine(String command, List<Argument> arguments) implements ChildContent {
	public CommandLine {
		arguments = List.copyOf(arguments);
	}
}
