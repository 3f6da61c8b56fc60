package sixu.parse;

import org.junit.jupiter.api.Test;
import sixu.ast.Argument;
import sixu.ast.Attribute;
import sixu.ast.Child;
import sixu.ast.CommandLine;
import sixu.ast.Paragraph;
import sixu.ast.Parameter;
import sixu.ast.PlainText;
import sixu.ast.Primitive;
import sixu.ast.Story;
import sixu.ast.TextLine;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class StrictParserTest {
	private static LocatedParseException failure(String source) {
		return assertThrows(LocatedParseException.class, () -> new StrictParser().parse(source));
	}

	@Test
	void parsesParagraphWithDefaults() {
		Story story = new StrictParser().parse("demo", "::p(a, b=2) {\n  @show visible\n}\n");
		assertEquals("demo", story.name());
		Paragraph paragraph = story.paragraphs().get(0);
		assertEquals(List.of(new Parameter("a", null), new Parameter("b", new Primitive.IntegerValue(2))),
				paragraph.parameters());
		assertEquals(Child.of(new CommandLine("show", List.of(new Argument("visible", new Primitive.BooleanValue(true))))),
				paragraph.block().children().get(0));
	}

	@Test
	void closestAttributeWins() {
		Story story = new StrictParser().parse("::p {\n#[if(\"a\")]\n#[while(\"b\")]\n@x\n}");
		Child child = story.paragraphs().get(0).block().children().get(0);
		assertEquals(new Attribute("while", "b"), child.attribute());
		assertEquals(new CommandLine("x", List.of()), child.content());
	}

	@Test
	void speakerWithoutBodyHasEmptyText() {
		Story story = new StrictParser().parse("::p {\n[Bob]\n}");
		assertEquals(Child.of(new TextLine(new PlainText("Bob"), new PlainText(""), null)),
				story.paragraphs().get(0).block().children().get(0));
	}

	@Test
	void rejectsStatementOutsideParagraph() {
		LocatedParseException e = failure("@x\n");
		assertEquals("statement outside of a paragraph", e.detail());
		assertEquals(1, e.line());
		assertEquals(0, e.column());
		assertEquals("unmatched '}'", failure("}").detail());
	}

	@Test
	void reportsPositionOfUnterminatedString() {
		LocatedParseException e = failure("::p {\n@cmd a=\"open\n}");
		assertEquals("unterminated string literal", e.detail());
		assertEquals(2, e.line());
		assertEquals(7, e.column());
	}

	@Test
	void embeddedCodeCannotSpanAStatementLine() {
		LocatedParseException e = failure("::p {\n  @{ open\n  @y\n}\n");
		assertEquals("unterminated embedded code, expected '}'", e.detail());
		assertEquals(2, e.line());
		assertEquals(2, e.column());
		assertEquals("unterminated embedded code, expected '##'", failure("::p {\n## raw\n#jump(to=b)\n## x ##\n}\n").detail());
	}

	@Test
	void reportsUnterminatedBlockAtEndOfInput() {
		LocatedParseException e = failure("::p {\n@x\n");
		assertEquals("unterminated block, expected '}'", e.detail());
		assertEquals(3, e.line());
		assertEquals(0, e.column());
	}

	@Test
	void rejectsInvalidInterpolation() {
		LocatedParseException e = failure("::p {\n@say t=`${1+1}`\n}");
		assertEquals("invalid interpolation '1+1': expected a variable path", e.detail());
		assertEquals("2:8: invalid interpolation '1+1': expected a variable path", e.getMessage());
	}

	@Test
	void rejectsNonLiteralDefault() {
		assertEquals("parameter default must be a literal", failure("::p(a=b) {\n}").detail());
	}
}
