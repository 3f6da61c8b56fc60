package sixu;

import sixu.cst.Diagnostic;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Command line: {@code fmt [--check] <path>} and {@code check <path>}.
 */
public final class Main {
	static final int OK = 0;
	static final int FAILED = 1;
	static final int USAGE = 2;

	private final ProjectFormatter project;

	public Main() {
		this(new ProjectFormatter());
	}

	Main(ProjectFormatter project) {
		this.project = project;
	}

	public static void main(String[] args) throws IOException {
		int code = new Main().run(args, System.out, System.err);
		if (code != OK) {
			System.exit(code);
		}
	}

	int run(String[] args, PrintStream out, PrintStream err) throws IOException {
		if (args.length == 0) {
			return usage(err);
		}
		switch (args[0]) {
			case "fmt" -> {
				boolean check = args.length == 3 && args[1].equals("--check");
				if (args.length != 2 && !check) {
					return usage(err);
				}
				List<Path> changed = project.formatTree(Path.of(args[args.length - 1]), check);
				for (Path file : changed) {
					out.println((check ? "needs formatting: " : "formatted: ") + file);
				}
				return check && !changed.isEmpty() ? FAILED : OK;
			}
			case "check" -> {
				if (args.length != 2) {
					return usage(err);
				}
				Map<Path, List<Diagnostic>> problems = project.checkTree(Path.of(args[1]));
				problems.forEach((file, diagnostics) -> {
					for (Diagnostic d : diagnostics) {
						out.println(file + ":" + d.line() + ":" + d.column() + ": " + d.message());
					}
				});
				return problems.isEmpty() ? OK : FAILED;
			}
			default -> {
				return usage(err);
			}
		}
	}

	private static int usage(PrintStream err) {
		err.println("Usage: sixu fmt [--check] <path>");
		err.println("       sixu check <path>");
		return USAGE;
	}
}
