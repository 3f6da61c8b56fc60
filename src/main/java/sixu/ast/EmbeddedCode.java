package sixu.ast;

public record EmbeddedCode(String code) implements ChildContent {
}
