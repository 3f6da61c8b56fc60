package sixu.parse;

import sixu.ast.PlainText;
import sixu.ast.Primitive;
import sixu.ast.RValue;
import sixu.ast.TemplateLiteral;
import sixu.ast.TextContent;
import sixu.ast.Variable;
import sixu.cst.TemplatePart;
import sixu.cst.ValueKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts lexed values to their semantic form. Both the strict parser and
 * CST lowering go through here, so a value means the same thing on either
 * path.
 */
public final class AstValues {
	private AstValues() {
	}

	/** The first {@code ${...}} segment that is not a variable path, if any. */
	public static Optional<TemplatePart.Invalid> firstInvalid(ValueKind value) {
		if (value instanceof ValueKind.TemplateString template) {
			for (TemplatePart part : template.parts()) {
				if (part instanceof TemplatePart.Invalid invalid) {
					return Optional.of(invalid);
				}
			}
		}
		return Optional.empty();
	}

	public static RValue rvalue(ValueKind value) {
		if (value instanceof ValueKind.TemplateString template) {
			return template(template);
		}
		if (value instanceof ValueKind.VariableReference ref) {
			return new Variable(ref.segments());
		}
		return primitive(value);
	}

	public static Primitive primitive(ValueKind value) {
		if (value instanceof ValueKind.QuotedString s) {
			return new Primitive.StringValue(s.value());
		}
		if (value instanceof ValueKind.IntegerNumber i) {
			return new Primitive.IntegerValue(i.value());
		}
		if (value instanceof ValueKind.FloatNumber f) {
			return new Primitive.FloatValue(f.value());
		}
		if (value instanceof ValueKind.BooleanLiteral b) {
			return new Primitive.BooleanValue(b.value());
		}
		throw new IllegalArgumentException("Not a literal value: " + value);
	}

	public static TextContent text(ValueKind value) {
		if (value instanceof ValueKind.QuotedString s) {
			return new PlainText(s.value());
		}
		if (value instanceof ValueKind.BareText bare) {
			return new PlainText(bare.text());
		}
		if (value instanceof ValueKind.TemplateString template) {
			return template(template);
		}
		throw new IllegalArgumentException("Not a text value: " + value);
	}

	public static TemplateLiteral template(ValueKind.TemplateString template) {
		List<TemplateLiteral.Segment> segments = new ArrayList<>();
		for (TemplatePart part : template.parts()) {
			if (part instanceof TemplatePart.Literal literal) {
				segments.add(new TemplateLiteral.Text(literal.text()));
			} else if (part instanceof TemplatePart.Interpolation interpolation) {
				segments.add(new TemplateLiteral.Reference(new Variable(interpolation.path())));
			} else {
				throw new IllegalArgumentException(((TemplatePart.Invalid) part).message());
			}
		}
		return new TemplateLiteral(segments);
	}
}
