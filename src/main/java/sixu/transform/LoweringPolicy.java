package sixu.transform;

/**
 * What {@link CstLowering} does when it meets an error node.
 */
public enum LoweringPolicy {
	/** Abort with a {@link LoweringException}. */
	STRICT,
	/** Skip the failing paragraph or statement, record a diagnostic, keep going. */
	BEST_EFFORT
}
