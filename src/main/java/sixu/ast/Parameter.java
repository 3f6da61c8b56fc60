package sixu.ast;

/** {@code defaultValue} is null for a required parameter. */
public record Parameter(String name, Primitive defaultValue) {
}
