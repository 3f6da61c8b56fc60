package sixu.ast;

/**
 * One statement of a block with its governing attribute, if any.
 */
public record Child(Attribute attribute, ChildContent content) {
	public static Child of(ChildContent content) {
		return new Child(null, content);
	}
}
