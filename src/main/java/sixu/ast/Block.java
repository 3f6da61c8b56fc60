package sixu.ast;

import java.util.List;

public record Block(List<Child> children) implements ChildContent {
	public Block {
		children = List.copyOf(children);
	}
}
