package sixu.cst;

public record Trivia(TriviaKind triviaKind, String text, Span span) implements CstNode {
	@Override
	public NodeKind kind() {
		return NodeKind.TRIVIA;
	}

	@Override
	public void appendText(StringBuilder out) {
		out.append(text);
	}

	public boolean isComment() {
		return triviaKind != TriviaKind.WHITESPACE;
	}

	public int newlineCount() {
		int count = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				count++;
			}
		}
		return count;
	}
}
