package sixu.transform;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import sixu.Sixu;
import sixu.ast.Argument;
import sixu.ast.Attribute;
import sixu.ast.Child;
import sixu.ast.CommandLine;
import sixu.ast.Primitive;
import sixu.ast.Story;
import sixu.cst.CstRoot;
import sixu.cst.Diagnostic;
import sixu.parse.CstParser;
import sixu.parse.StrictParser;
import sixu.query.CstQueries;
import sixu.query.ParagraphOutline;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CstLoweringTest {
	private static final List<String> WELL_FORMED = List.of(
			"::p(a, b=2, c=\"x\", d=1.5, e=false) {\n  @show visible\n}\n",
			"// c\n::a {\n#[if(\"x\")] @go\n  @{ let y = \"}\"; }\n## raw ##\n#jump(to=b, with=`n=${n.value}`)\n}\n",
			"::p {\n  [Bob] \"Hi \\\"there\\\"\" #tag\n  [`${who}`] `Hello ${name}!`\n  { @nested /* c */ x=1 }\n}\n",
			"::p {\n#[loop]\n{\n  Just text\n}\n}\n");

	private static CstRoot parse(String source) {
		return new CstParser().parse("doc", source);
	}

	@Test
	void matchesStrictParserOnWellFormedInput() {
		for (String source : WELL_FORMED) {
			Story expected = new StrictParser().parse("doc", source);
			LoweringResult actual = new CstLowering().lower(parse(source));
			assertTrue(actual.isClean(), source);
			assertEquals(expected, actual.story(), source);
		}
	}

	@Test
	void matchesStrictParserOnGoldenInput() throws Exception {
		String source = Files.readString(Path.of("src", "test", "resources", "golden", "scene.sixu"));
		assertEquals(new StrictParser().parse("doc", source), new CstLowering().lower(parse(source)).story());
	}

	@Test
	void flagLowersToTrue() {
		Story story = new CstLowering().lower(parse("::p {\n@show visible\n}")).story();
		assertEquals(Child.of(new CommandLine("show", List.of(new Argument("visible", new Primitive.BooleanValue(true))))),
				story.paragraphs().get(0).block().children().get(0));
	}

	@Test
	void closestAttributeWins() {
		Story story = new CstLowering().lower(parse("::p {\n#[if(\"a\")]\n#[while(\"b\")]\n@x\n}")).story();
		assertEquals(new Attribute("while", "b"), story.paragraphs().get(0).block().children().get(0).attribute());
	}

	@Test
	void syntaxVariantsLowerIdentically() {
		Story story = new CstLowering().lower(parse("::p {\n@cmd(a=1, b=2)\n@cmd a=1 b=2\n}")).story();
		List<Child> children = story.paragraphs().get(0).block().children();
		assertEquals(children.get(0), children.get(1));
	}

	@Test
	void strictPolicyStopsAtFirstError() {
		LoweringException e = assertThrows(LoweringException.class,
				() -> new CstLowering().lower(parse("::p {\n@a x=1\n@b y=\"open\n@c z=2\n}\n")));
		assertEquals("unterminated string literal", e.diagnostic().message());
		assertEquals(3, e.line());
		assertEquals(5, e.column());
	}

	@Test
	void bestEffortSkipsOnlyTheBrokenStatement() {
		LoweringResult result = new CstLowering(LoweringPolicy.BEST_EFFORT)
				.lower(parse("::p {\n@a x=1\n@b y=\"open\n@c z=2\n}\n::q {\n@d\n}\n"));
		assertEquals(1, result.diagnostics().size());
		Diagnostic diagnostic = result.diagnostics().get(0);
		assertEquals("unterminated string literal", diagnostic.message());
		assertEquals(3, diagnostic.line());
		List<Child> p = result.story().paragraphs().get(0).block().children();
		assertEquals(List.of("a", "c"), p.stream().map(c -> ((CommandLine) c.content()).command()).toList());
		assertEquals("q", result.story().paragraphs().get(1).name());
	}

	@ParameterizedTest
	@ValueSource(strings = {
			"/* open",
			"## raw",
			"@{ open",
			"@cmd(a=1",
			"@cmd(a=1,)",
			"@cmd a=\"u",
			"@cmd x=1 ?",
			"@say t=`${1+1}`",
			"@say t=`${x",
			"[Bob hi",
			"@",
			"#[nope] x",
			"#[if(\"c\""})
	void brokenLineDamagesOnlyItself(String broken) {
		String intact = "::a {\n  @x k=1\n  @y\n}\n\n::b {\n  @z\n}\n";
		String source = intact.replace("  @y\n", "  " + broken + "\n  @y\n");
		Sixu sixu = new Sixu();

		assertEquals(1, sixu.check("doc", source).size(), source);
		assertEquals(List.of("a", "b"),
				CstQueries.outline(parse(source)).stream().map(ParagraphOutline::name).toList(), source);
		LoweringResult result = new CstLowering(LoweringPolicy.BEST_EFFORT).lower(parse(source));
		assertEquals(new CstLowering().lower(parse(intact)).story(), result.story(), source);
	}

	@Test
	void brokenHeaderDropsTheParagraph() {
		LoweringResult result = new CstLowering(LoweringPolicy.BEST_EFFORT).lower(parse("::p(a=b) {\n@x\n}\n::q {\n}\n"));
		assertEquals("parameter default must be a literal", result.diagnostics().get(0).message());
		assertEquals(1, result.story().paragraphs().size());
		assertEquals("q", result.story().paragraphs().get(0).name());
	}

	@Test
	void topLevelStatementIsReported() {
		LoweringResult result = new CstLowering(LoweringPolicy.BEST_EFFORT).lower(parse("@cmd\n::p {\n}\n"));
		assertEquals("statement outside of a paragraph", result.diagnostics().get(0).message());
		assertEquals(1, result.story().paragraphs().size());
	}

	@Test
	void invalidInterpolationFailsTheStatement() {
		LoweringResult result = new CstLowering(LoweringPolicy.BEST_EFFORT).lower(parse("::p {\n@say t=`${1+1}`\n@ok\n}"));
		assertEquals("invalid interpolation '1+1': expected a variable path", result.diagnostics().get(0).message());
		assertEquals(8, result.diagnostics().get(0).column());
		assertEquals(1, result.story().paragraphs().get(0).block().children().size());
	}

	@Test
	void unterminatedStringYieldsNoCommand() {
		LoweringResult result = new CstLowering(LoweringPolicy.BEST_EFFORT).lower(parse("@cmd a=\"unterminated"));
		assertFalse(result.isClean());
		assertTrue(result.story().paragraphs().isEmpty());
	}
}
