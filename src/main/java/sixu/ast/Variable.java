package sixu.ast;

import java.util.List;

public record Variable(List<String> chain) implements RValue {
	public Variable {
		chain = List.copyOf(chain);
	}
}
