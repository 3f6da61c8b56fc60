package sixu;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MainTest {
	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	private int run(String... args) throws Exception {
		Main main = new Main(new ProjectFormatter(SixuConfig.defaults()));
		return main.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
				new PrintStream(err, true, StandardCharsets.UTF_8));
	}

	@Test
	void usageOnBadArguments() throws Exception {
		assertEquals(Main.USAGE, run());
		assertEquals(Main.USAGE, run("lint", "x"));
		assertEquals(Main.USAGE, run("fmt", "--fast", "x"));
		assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Usage: sixu fmt"));
	}

	@Test
	void fmtCheckFailsOnUnformattedFiles(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("a.sixu");
		Files.writeString(file, "::p {\n@a\n}");

		assertEquals(Main.FAILED, run("fmt", "--check", dir.toString()));
		assertEquals("needs formatting: " + file + System.lineSeparator(), out.toString(StandardCharsets.UTF_8));

		assertEquals(Main.OK, run("fmt", dir.toString()));
		assertEquals(Main.OK, run("fmt", "--check", dir.toString()));
	}

	@Test
	void checkPrintsPositionedDiagnostics(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("broken.sixu");
		Files.writeString(file, "::p {\n@x y=\"o\n}\n");

		assertEquals(Main.FAILED, run("check", dir.toString()));
		assertEquals(file + ":2:5: unterminated string literal" + System.lineSeparator(),
				out.toString(StandardCharsets.UTF_8));
	}
}
