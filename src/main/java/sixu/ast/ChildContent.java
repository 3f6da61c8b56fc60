package sixu.ast;

public sealed interface ChildContent permits Block, CommandLine, SystemCallLine, TextLine, EmbeddedCode {
}
