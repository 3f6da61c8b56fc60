package sixu.cst;

import java.util.List;

public record CstCommand(String name, Span markerSpan, Span nameSpan, List<CstArgument> arguments,
		CallSyntax syntax, List<CstNode> children, Span span) implements CstCall {
	public CstCommand {
		arguments = List.copyOf(arguments);
		children = List.copyOf(children);
	}

	@Override
	public NodeKind kind() {
		return NodeKind.COMMAND;
	}
}
