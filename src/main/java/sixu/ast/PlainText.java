package sixu.ast;

public record PlainText(String text) implements TextContent {
}
