package sixu.transform;

import sixu.ast.Story;
import sixu.cst.Diagnostic;

import java.util.List;

public record LoweringResult(Story story, List<Diagnostic> diagnostics) {
	public LoweringResult {
		diagnostics = List.copyOf(diagnostics);
	}

	public boolean isClean() {
		return diagnostics.isEmpty();
	}
}
