package sixu.ast;

/**
 * {@code leading} is the speaker (null when absent); {@code tag} is null when
 * absent.
 */
public record TextLine(TextContent leading, TextContent text, String tag) implements ChildContent {
}
