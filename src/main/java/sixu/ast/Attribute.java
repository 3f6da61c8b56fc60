package sixu.ast;

/** {@code condition} is null for a bare {@code #[keyword]}. */
public record Attribute(String keyword, String condition) {
}
