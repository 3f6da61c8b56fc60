package sixu.transform;

import sixu.ast.Argument;
import sixu.ast.Attribute;
import sixu.ast.Block;
import sixu.ast.Child;
import sixu.ast.ChildContent;
import sixu.ast.CommandLine;
import sixu.ast.EmbeddedCode;
import sixu.ast.Paragraph;
import sixu.ast.Parameter;
import sixu.ast.PlainText;
import sixu.ast.Primitive;
import sixu.ast.RValue;
import sixu.ast.Story;
import sixu.ast.SystemCallLine;
import sixu.ast.TextContent;
import sixu.ast.TextLine;
import sixu.cst.CstArgument;
import sixu.cst.CstAttribute;
import sixu.cst.CstBlock;
import sixu.cst.CstCall;
import sixu.cst.CstEmbeddedCode;
import sixu.cst.CstError;
import sixu.cst.CstNode;
import sixu.cst.CstParagraph;
import sixu.cst.CstParameter;
import sixu.cst.CstRoot;
import sixu.cst.CstTextLine;
import sixu.cst.CstValue;
import sixu.cst.Diagnostic;
import sixu.cst.NodeKind;
import sixu.cst.TemplatePart;
import sixu.parse.AstValues;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds a CST into the semantic tree.
 *
 * Trivia and tokens are dropped, each semantic node maps to its AST
 * counterpart, and a flag argument lowers to {@code true}. Stacked attributes
 * keep only the one closest to the statement. The unit of failure is the
 * paragraph header or a single statement: under
 * {@link LoweringPolicy#BEST_EFFORT} the failing unit is left out and its
 * siblings are still lowered.
 */
public final class CstLowering {
	private final LoweringPolicy policy;

	public CstLowering() {
		this(LoweringPolicy.STRICT);
	}

	public CstLowering(LoweringPolicy policy) {
		this.policy = policy;
	}

	/**
	 * @throws LoweringException on the first error node under
	 *                           {@link LoweringPolicy#STRICT}
	 */
	public LoweringResult lower(CstRoot root) {
		List<Diagnostic> diagnostics = new ArrayList<>();
		List<Paragraph> paragraphs = new ArrayList<>();
		for (CstNode child : root.children()) {
			switch (child.kind()) {
				case TRIVIA -> {
				}
				case PARAGRAPH -> {
					try {
						paragraphs.add(lowerParagraph((CstParagraph) child, diagnostics));
					} catch (LoweringException e) {
						report(e, diagnostics);
					}
				}
				case ERROR -> report(failure((CstError) child), diagnostics);
				default -> report(new LoweringException(child.span(), "statement outside of a paragraph"), diagnostics);
			}
		}
		return new LoweringResult(new Story(root.name(), paragraphs), diagnostics);
	}

	private void report(LoweringException e, List<Diagnostic> diagnostics) {
		if (policy == LoweringPolicy.STRICT) {
			throw e;
		}
		diagnostics.add(e.diagnostic());
	}

	private Paragraph lowerParagraph(CstParagraph paragraph, List<Diagnostic> diagnostics) {
		List<Parameter> parameters = new ArrayList<>();
		for (CstNode child : paragraph.children()) {
			if (child instanceof CstError error) {
				throw failure(error);
			}
		}
		for (CstParameter parameter : paragraph.parameters()) {
			requireNoErrors(parameter);
			Primitive defaultValue = parameter.defaultValue() == null
					? null
					: AstValues.primitive(parameter.defaultValue().valueKind());
			parameters.add(new Parameter(parameter.name(), defaultValue));
		}
		return new Paragraph(paragraph.name(), parameters, lowerBlock(paragraph.body(), diagnostics));
	}

	private Block lowerBlock(CstBlock block, List<Diagnostic> diagnostics) {
		List<Child> children = new ArrayList<>();
		for (CstNode child : block.children()) {
			switch (child.kind()) {
				case TRIVIA, TOKEN -> {
				}
				default -> {
					try {
						children.add(lowerChild(child, diagnostics));
					} catch (LoweringException e) {
						report(e, diagnostics);
					}
				}
			}
		}
		return new Block(children);
	}

	private Child lowerChild(CstNode node, List<Diagnostic> diagnostics) {
		if (node.kind() != NodeKind.ATTRIBUTE) {
			return Child.of(lowerContent(node, diagnostics));
		}
		CstAttribute attribute = (CstAttribute) node;
		while (attribute.target() instanceof CstAttribute inner) {
			attribute = inner;
		}
		return new Child(new Attribute(attribute.keyword(), attribute.condition()),
				lowerContent(attribute.target(), diagnostics));
	}

	private ChildContent lowerContent(CstNode node, List<Diagnostic> diagnostics) {
		return switch (node.kind()) {
			case BLOCK -> lowerBlock((CstBlock) node, diagnostics);
			case COMMAND, SYSTEM_CALL -> lowerCall((CstCall) node);
			case TEXT_LINE -> lowerTextLine((CstTextLine) node);
			case EMBEDDED_CODE -> new EmbeddedCode(((CstEmbeddedCode) node).code().strip());
			case ERROR -> throw failure((CstError) node);
			case ROOT, PARAGRAPH, PARAMETER, ATTRIBUTE, ARGUMENT, VALUE, TOKEN, TRIVIA ->
					throw new LoweringException(node.span(), "unexpected " + node.kind() + " in statement position");
		};
	}

	private ChildContent lowerCall(CstCall call) {
		requireNoErrors(call);
		List<Argument> arguments = new ArrayList<>();
		for (CstArgument argument : call.arguments()) {
			RValue value = argument.value() == null
					? new Primitive.BooleanValue(true)
					: lowerValue(argument.value());
			arguments.add(new Argument(argument.name(), value));
		}
		if (call.kind() == NodeKind.COMMAND) {
			return new CommandLine(call.name(), arguments);
		}
		return new SystemCallLine(call.name(), arguments);
	}

	private ChildContent lowerTextLine(CstTextLine line) {
		requireNoErrors(line);
		TextContent leading = line.speaker() == null ? null : lowerText(line.speaker());
		TextContent text = line.body() == null ? new PlainText("") : lowerText(line.body());
		return new TextLine(leading, text, line.tag());
	}

	private RValue lowerValue(CstValue value) {
		requireValidTemplate(value);
		return AstValues.rvalue(value.valueKind());
	}

	private TextContent lowerText(CstValue value) {
		requireValidTemplate(value);
		return AstValues.text(value.valueKind());
	}

	private static void requireValidTemplate(CstValue value) {
		TemplatePart.Invalid invalid = AstValues.firstInvalid(value.valueKind()).orElse(null);
		if (invalid != null) {
			throw new LoweringException(invalid.span(), invalid.message());
		}
	}

	private static void requireNoErrors(CstNode node) {
		if (node instanceof CstError error) {
			throw failure(error);
		}
		for (CstNode child : node.children()) {
			requireNoErrors(child);
		}
	}

	private static LoweringException failure(CstError error) {
		return new LoweringException(error.span(), error.message());
	}
}
