package sixu.parse;

import org.junit.jupiter.api.Test;
import sixu.cst.LineIndex;
import sixu.cst.TemplatePart;
import sixu.cst.ValueKind;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ValueLexerTest {
	private static ValueLexer.Result lex(String source) {
		return new ValueLexer(new LineIndex(source)).lex(0, source.length());
	}

	@Test
	void quotedStringsResolveEscapes() {
		ValueLexer.Result r = lex("\"a\\nb\"");
		assertEquals(new ValueKind.QuotedString('"', "a\nb"), r.value());
		assertEquals(6, r.end());
		assertEquals(new ValueKind.QuotedString('\'', "it's"), lex("'it\\'s'").value());
		assertEquals(new ValueKind.QuotedString('"', "A"), lex("\"\\u0041\"").value());
		assertEquals(new ValueKind.QuotedString('"', new String(Character.toChars(0x1F600))),
				lex("\"\\u{1F600}\"").value());
	}

	@Test
	void badEscapeFailsTheWholeLiteral() {
		ValueLexer.Result r = lex("\"bad \\q\" rest");
		assertEquals("invalid escape sequence in string literal", r.error());
		assertEquals(8, r.end());
		assertNull(r.value());
	}

	@Test
	void stringCannotSpanLines() {
		assertEquals("unterminated string literal", lex("\"open").error());
		ValueLexer.Result r = lex("\"line\nbreak\"");
		assertEquals("unterminated string literal", r.error());
		assertEquals(5, r.end());
	}

	@Test
	void numbers() {
		assertEquals(new ValueKind.IntegerNumber(42), lex("42").value());
		assertEquals(new ValueKind.IntegerNumber(-31), lex("-0x1F").value());
		assertEquals(new ValueKind.IntegerNumber(1000), lex("1_000").value());
		assertEquals(new ValueKind.FloatNumber(3.5), lex("3.5").value());
		assertEquals(new ValueKind.FloatNumber(0.5), lex(".5").value());
	}

	@Test
	void malformedNumbers() {
		assertEquals("invalid number literal '1_'", lex("1_").error());
		assertEquals("invalid number literal '12abc'", lex("12abc").error());
		assertEquals("integer literal '99999999999999999999' out of range", lex("99999999999999999999").error());
	}

	@Test
	void numberStopsAtListPunctuation() {
		ValueLexer.Result r = new ValueLexer(new LineIndex("(a=1)")).lex(3, 4);
		assertEquals(new ValueKind.IntegerNumber(1), r.value());
		assertEquals(4, r.end());
	}

	@Test
	void booleansAndPaths() {
		assertEquals(new ValueKind.BooleanLiteral(true), lex("true").value());
		assertEquals(new ValueKind.VariableReference(List.of("player", "name")), lex("player.name").value());
		assertEquals("malformed variable path 'a.'", lex("a.").error());
		assertEquals("unexpected character after 'a'", lex("a-b").error());
	}

	@Test
	void templateSplitsIntoParts() {
		ValueLexer.Result r = lex("`Hi ${user.name}!`");
		assertEquals(18, r.end());
		ValueKind.TemplateString template = assertInstanceOf(ValueKind.TemplateString.class, r.value());
		assertEquals(3, template.parts().size());
		assertEquals("Hi ", ((TemplatePart.Literal) template.parts().get(0)).text());
		assertEquals(List.of("user", "name"), ((TemplatePart.Interpolation) template.parts().get(1)).path());
		assertEquals("!", ((TemplatePart.Literal) template.parts().get(2)).text());
		assertTrue(template.isValid());
	}

	@Test
	void nonPathInterpolationIsKeptAsInvalidPart() {
		ValueLexer.Result r = lex("`${1 + 2}`");
		assertTrue(r.ok());
		ValueKind.TemplateString template = (ValueKind.TemplateString) r.value();
		assertFalse(template.isValid());
		TemplatePart.Invalid invalid = assertInstanceOf(TemplatePart.Invalid.class, template.parts().get(0));
		assertEquals("invalid interpolation '1 + 2': expected a variable path", invalid.message());
		assertEquals(1, invalid.span().start().offset());
	}

	@Test
	void unterminatedTemplate() {
		assertEquals("unterminated template string", lex("`abc").error());
		assertEquals("unterminated interpolation in template string", lex("`a ${b").error());
	}

	@Test
	void parsePath() {
		assertEquals(List.of("a", "b"), ValueLexer.parsePath("a.b"));
		assertNull(ValueLexer.parsePath("a..b"));
		assertNull(ValueLexer.parsePath(""));
	}
}
