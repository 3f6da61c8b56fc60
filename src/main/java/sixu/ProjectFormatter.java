package sixu;

import sixu.cst.Diagnostic;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Formats or checks every source file under a directory, one file at a time.
 */
public final class ProjectFormatter {
	private static final Logger LOGGER = Logger.getLogger(ProjectFormatter.class.getName());

	private final Sixu sixu;
	private final String extension;

	public ProjectFormatter() {
		this(SixuConfig.load());
	}

	public ProjectFormatter(SixuConfig config) {
		this.sixu = new Sixu(config);
		this.extension = config.sourceExtension();
	}

	/**
	 * Formats each source file in place, or with {@code checkOnly} leaves them
	 * untouched.
	 *
	 * @return the files whose content was not already formatted
	 */
	public List<Path> formatTree(Path root, boolean checkOnly) throws IOException {
		List<Path> changed = new ArrayList<>();
		for (Path file : sources(root)) {
			String source = Files.readString(file);
			String formatted = sixu.format(source);
			if (formatted.equals(source)) {
				continue;
			}
			changed.add(file);
			if (!checkOnly) {
				Files.writeString(file, formatted);
				LOGGER.fine(() -> "Formatted " + file);
			}
		}
		LOGGER.info(() -> (checkOnly ? "Checked " : "Formatted ") + root + ": " + changed.size() + " file(s) "
				+ (checkOnly ? "need formatting" : "changed"));
		return changed;
	}

	/** Diagnostics per source file; files without problems are omitted. */
	public Map<Path, List<Diagnostic>> checkTree(Path root) throws IOException {
		Map<Path, List<Diagnostic>> problems = new LinkedHashMap<>();
		for (Path file : sources(root)) {
			List<Diagnostic> diagnostics = sixu.check(file.toString(), Files.readString(file));
			if (!diagnostics.isEmpty()) {
				problems.put(file, diagnostics);
			}
		}
		return problems;
	}

	List<Path> sources(Path root) throws IOException {
		if (Files.isRegularFile(root)) {
			return List.of(root);
		}
		try (Stream<Path> paths = Files.walk(root)) {
			return paths
					.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().endsWith(extension))
					.sorted()
					.collect(Collectors.toList());
		}
	}
}
