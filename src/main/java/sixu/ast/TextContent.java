package sixu.ast;

public sealed interface TextContent permits PlainText, TemplateLiteral {
}
