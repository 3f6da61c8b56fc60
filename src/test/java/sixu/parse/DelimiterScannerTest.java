package sixu.parse;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class DelimiterScannerTest {
	@Test
	void matchesNestedParentheses() {
		assertEquals(new DelimiterScanner.Result(11, true), DelimiterScanner.scan("(a, (b), c) tail", 0));
	}

	@Test
	void ignoresDelimitersInsideStrings() {
		assertEquals(new DelimiterScanner.Result(14, true), DelimiterScanner.scan("(s=\")\", t='(')", 0));
	}

	@Test
	void escapedQuoteDoesNotCloseString() {
		assertEquals(new DelimiterScanner.Result(8, true), DelimiterScanner.scan("(\"a\\\")\")", 0));
	}

	@Test
	void countsBracesInsideTemplateInterpolation() {
		assertEquals(new DelimiterScanner.Result(14, true), DelimiterScanner.scan("{ `${ {a} }` }", 0));
	}

	@Test
	void ignoresDelimitersInsideComments() {
		assertEquals(new DelimiterScanner.Result(8, true), DelimiterScanner.scan("{ // }\n}", 0));
		assertEquals(new DelimiterScanner.Result(11, true), DelimiterScanner.scan("{ /* } */ }", 0));
	}

	@Test
	void stringBracesInEmbeddedCode() {
		String code = "@{ if (x) { y = \"{}\"; } }";
		assertEquals(new DelimiterScanner.Result(code.length(), true), DelimiterScanner.scan(code, 1));
	}

	@Test
	void unterminatedRegionReachesEndOfInput() {
		assertEquals(new DelimiterScanner.Result(8, false), DelimiterScanner.scan("(a, \"b)\"", 0));
		assertEquals(new DelimiterScanner.Result(3, false), DelimiterScanner.scan("{{}", 0));
	}

	@Test
	void rejectsNonOpener() {
		assertThrows(IllegalArgumentException.class, () -> DelimiterScanner.scan("a)", 0));
	}
}
