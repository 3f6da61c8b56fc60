package sixu;

import sixu.ast.Story;
import sixu.cst.CstRoot;
import sixu.cst.Diagnostic;
import sixu.parse.CstParser;
import sixu.parse.StrictParser;
import sixu.print.CstFormatter;
import sixu.query.CstQueries;
import sixu.transform.CstLowering;
import sixu.transform.LoweringPolicy;
import sixu.transform.LoweringResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Public entrypoint: parse, lower, format and check Sixu documents.
 */
public final class Sixu {
	private final CstParser parser = new CstParser();
	private final CstFormatter formatter;

	public Sixu() {
		this(SixuConfig.load());
	}

	public Sixu(SixuConfig config) {
		this.formatter = new CstFormatter(config.indentWidth());
	}

	public CstRoot parse(String name, String source) {
		return parser.parse(name, source);
	}

	/** Lowers for execution; the first error aborts. */
	public Story lower(CstRoot root) {
		return new CstLowering(LoweringPolicy.STRICT).lower(root).story();
	}

	public LoweringResult lowerBestEffort(CstRoot root) {
		return new CstLowering(LoweringPolicy.BEST_EFFORT).lower(root);
	}

	public Story parseStrict(String name, String source) {
		return new StrictParser().parse(name, source);
	}

	public String format(String source) {
		return formatter.format(parser.parse(source));
	}

	/**
	 * Syntax diagnostics plus the problems only lowering can see, such as a
	 * statement outside of any paragraph. Sorted by position.
	 */
	public List<Diagnostic> check(String name, String source) {
		CstRoot root = parse(name, source);
		Set<Diagnostic> all = new LinkedHashSet<>(CstQueries.diagnostics(root));
		all.addAll(lowerBestEffort(root).diagnostics());
		List<Diagnostic> sorted = new ArrayList<>(all);
		sorted.sort(Comparator.comparingInt(d -> d.span().start().offset()));
		return sorted;
	}
}
