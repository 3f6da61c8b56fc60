package sixu;

import org.junit.jupiter.api.Test;
import sixu.cst.Diagnostic;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SixuTest {
	@Test
	void checkMergesSyntaxAndLoweringDiagnostics() {
		List<Diagnostic> diagnostics = new Sixu(SixuConfig.defaults()).check("doc", "@top\n::p {\n@x y=\"o\n}\n");
		assertEquals(2, diagnostics.size());
		assertEquals("1:0: statement outside of a paragraph", diagnostics.get(0).toString());
		assertEquals("3:5: unterminated string literal", diagnostics.get(1).toString());
	}

	@Test
	void cleanDocumentHasNoDiagnostics() {
		assertTrue(new Sixu(SixuConfig.defaults()).check("doc", "::p {\n  @x\n}\n").isEmpty());
	}

	@Test
	void bothPipelinesAgree() {
		Sixu sixu = new Sixu(SixuConfig.defaults());
		String source = "::p(n=1) {\n  [Ann] `Hi ${n}` #wave\n  #[if(\"n\")] @go to=end\n}\n";
		assertEquals(sixu.parseStrict("doc", source), sixu.lower(sixu.parse("doc", source)));
	}

	@Test
	void formatUsesConfiguredIndent() {
		Properties properties = new Properties();
		properties.setProperty(SixuConfig.INDENT_KEY, "2");
		assertEquals("::p {\n  @x\n}\n", new Sixu(new SixuConfig(properties)).format("::p {\n@x\n}"));
	}
}
