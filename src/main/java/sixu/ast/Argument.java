package sixu.ast;

public record Argument(String name, RValue value) {
}
