package sixu.cst;

import java.util.List;

/**
 * Shared shape of {@code @command} and {@code #systemCall} lines.
 */
public sealed interface CstCall extends CstNode permits CstCommand, CstSystemCall {
	String name();

	Span markerSpan();

	Span nameSpan();

	List<CstArgument> arguments();

	CallSyntax syntax();
}
