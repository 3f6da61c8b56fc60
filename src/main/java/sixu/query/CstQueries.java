package sixu.query;

import sixu.cst.CstCall;
import sixu.cst.CstCommand;
import sixu.cst.CstError;
import sixu.cst.CstNode;
import sixu.cst.CstParagraph;
import sixu.cst.CstParameter;
import sixu.cst.CstRoot;
import sixu.cst.CstSystemCall;
import sixu.cst.CstValue;
import sixu.cst.Diagnostic;
import sixu.cst.TemplatePart;
import sixu.cst.ValueKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only lookups over a parsed document for editor features.
 */
public final class CstQueries {
	private CstQueries() {
	}

	/**
	 * Path from the root to the smallest node whose span contains the byte
	 * offset. The end of the document resolves to the root alone.
	 *
	 * @throws IllegalArgumentException if the offset is outside the document or
	 *                                  not on a character boundary
	 */
	public static List<CstNode> pathAt(CstRoot root, int byteOffset) {
		root.lineIndex().charIndexOf(byteOffset);
		List<CstNode> path = new ArrayList<>();
		path.add(root);
		CstNode current = root;
		boolean descended = true;
		while (descended) {
			descended = false;
			for (CstNode child : current.children()) {
				if (child.span().contains(byteOffset)) {
					path.add(child);
					current = child;
					descended = true;
					break;
				}
			}
		}
		return path;
	}

	public static CstNode nodeAt(CstRoot root, int byteOffset) {
		List<CstNode> path = pathAt(root, byteOffset);
		return path.get(path.size() - 1);
	}

	/** Node at a 1-based line and 0-based code point column. */
	public static CstNode nodeAt(CstRoot root, int line, int column) {
		return nodeAt(root, root.lineIndex().offsetAt(line, column));
	}

	public static List<ParagraphOutline> outline(CstRoot root) {
		List<ParagraphOutline> outline = new ArrayList<>();
		for (CstNode child : root.children()) {
			if (child instanceof CstParagraph paragraph) {
				List<String> parameters = new ArrayList<>();
				for (CstParameter parameter : paragraph.parameters()) {
					parameters.add(parameter.name());
				}
				outline.add(new ParagraphOutline(paragraph.name(), paragraph.nameSpan(), paragraph.span(), parameters));
			}
		}
		return outline;
	}

	/** One diagnostic per error node and per invalid template interpolation, in document order. */
	public static List<Diagnostic> diagnostics(CstRoot root) {
		List<Diagnostic> diagnostics = new ArrayList<>();
		collectDiagnostics(root, diagnostics);
		return diagnostics;
	}

	private static void collectDiagnostics(CstNode node, List<Diagnostic> out) {
		if (node instanceof CstError error) {
			out.add(new Diagnostic(error.span(), error.message()));
			return;
		}
		if (node instanceof CstValue value && value.valueKind() instanceof ValueKind.TemplateString template) {
			for (TemplatePart part : template.parts()) {
				if (part instanceof TemplatePart.Invalid invalid) {
					out.add(new Diagnostic(invalid.span(), invalid.message()));
				}
			}
			return;
		}
		for (CstNode child : node.children()) {
			collectDiagnostics(child, out);
		}
	}

	/** Every {@code @command} in the document, nested ones included. */
	public static List<CstCommand> commands(CstRoot root) {
		List<CstCommand> out = new ArrayList<>();
		collect(root, CstCommand.class, out);
		return out;
	}

	/** Every {@code #systemCall} in the document, nested ones included. */
	public static List<CstSystemCall> systemCalls(CstRoot root) {
		List<CstSystemCall> out = new ArrayList<>();
		collect(root, CstSystemCall.class, out);
		return out;
	}

	private static <T extends CstNode> void collect(CstNode node, Class<T> type, List<T> out) {
		if (type.isInstance(node)) {
			out.add(type.cast(node));
		}
		for (CstNode child : node.children()) {
			collect(child, type, out);
		}
	}

	/**
	 * Value of a named argument as written. Quoted strings are returned
	 * unquoted; a flag argument yields {@code "true"}.
	 */
	public static Optional<String> argumentValue(CstCall call, String name) {
		return call.arguments().stream()
				.filter(a -> a.name().equals(name))
				.findFirst()
				.map(a -> {
					if (a.value() == null) {
						return a.isFlag() ? "true" : "";
					}
					if (a.value().valueKind() instanceof ValueKind.QuotedString quoted) {
						return quoted.value();
					}
					return a.value().raw();
				});
	}
}
