package sixu;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sixu.cst.Diagnostic;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProjectFormatterTest {
	private static final String MESSY = "::p {\n@a   x=1\n}";
	private static final String CLEAN = "::p {\n    @a x=1\n}\n";

	@Test
	void checkOnlyReportsWithoutWriting(@TempDir Path dir) throws Exception {
		Path messy = dir.resolve(Path.of("scenes", "a.sixu"));
		Path clean = dir.resolve(Path.of("scenes", "nested", "b.sixu"));
		Path other = dir.resolve("notes.txt");
		Files.createDirectories(clean.getParent());
		Files.writeString(messy, MESSY);
		Files.writeString(clean, CLEAN);
		Files.writeString(other, MESSY);

		List<Path> changed = new ProjectFormatter(SixuConfig.defaults()).formatTree(dir, true);

		assertEquals(List.of(messy), changed);
		assertEquals(MESSY, Files.readString(messy));
	}

	@Test
	void rewritesFilesInPlace(@TempDir Path dir) throws Exception {
		Path messy = dir.resolve("a.sixu");
		Files.writeString(messy, MESSY);

		ProjectFormatter formatter = new ProjectFormatter(SixuConfig.defaults());
		assertEquals(List.of(messy), formatter.formatTree(dir, false));
		assertEquals(CLEAN, Files.readString(messy));
		assertTrue(formatter.formatTree(dir, false).isEmpty());
	}

	@Test
	void acceptsASingleFile(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("one.sixu");
		Files.writeString(file, MESSY);
		assertEquals(List.of(file), new ProjectFormatter(SixuConfig.defaults()).formatTree(file, true));
	}

	@Test
	void checkTreeCollectsDiagnosticsPerFile(@TempDir Path dir) throws Exception {
		Path broken = dir.resolve("broken.sixu");
		Files.writeString(broken, "::p {\n@x y=\"o\n}\n");
		Files.writeString(dir.resolve("fine.sixu"), CLEAN);

		Map<Path, List<Diagnostic>> problems = new ProjectFormatter(SixuConfig.defaults()).checkTree(dir);

		assertEquals(1, problems.size());
		assertEquals("unterminated string literal", problems.get(broken).get(0).message());
	}
}
