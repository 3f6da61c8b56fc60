package sixu;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Tooling settings.
 *
 * Read from {@code sixu.properties} on the classpath; JVM system properties
 * with the same keys take precedence.
 */
public final class SixuConfig {
	private static final Logger LOGGER = Logger.getLogger(SixuConfig.class.getName());

	public static final String RESOURCE = "/sixu.properties";
	public static final String INDENT_KEY = "sixu.format.indent";
	public static final String EXTENSION_KEY = "sixu.source.extension";

	private static final int DEFAULT_INDENT = 4;
	private static final String DEFAULT_EXTENSION = ".sixu";

	private final Properties base;

	public SixuConfig(Properties base) {
		this.base = base;
	}

	public static SixuConfig load() {
		Properties merged = loadResource(RESOURCE);
		for (String key : new String[] { INDENT_KEY, EXTENSION_KEY }) {
			String override = System.getProperty(key);
			if (override != null) {
				merged.setProperty(key, override);
			}
		}
		return new SixuConfig(merged);
	}

	public static SixuConfig defaults() {
		return new SixuConfig(new Properties());
	}

	static Properties loadResource(String name) {
		Properties ret = new Properties();
		try (InputStream in = SixuConfig.class.getResourceAsStream(name)) {
			if (in == null) {
				LOGGER.fine(() -> "No " + name + " on the classpath, using defaults");
				return ret;
			}
			ret.load(in);
		} catch (IOException exc) {
			throw new UncheckedIOException("Could not read " + name, exc);
		}
		return ret;
	}

	public String get(String key) {
		return base.getProperty(key);
	}

	public int indentWidth() {
		String raw = get(INDENT_KEY);
		if (raw == null || raw.isBlank()) {
			return DEFAULT_INDENT;
		}
		int width;
		try {
			width = Integer.parseInt(raw.trim());
		} catch (NumberFormatException exc) {
			throw new IllegalArgumentException(INDENT_KEY + " must be an integer, got '" + raw + "'", exc);
		}
		if (width < 1) {
			throw new IllegalArgumentException(INDENT_KEY + " must be positive, got " + width);
		}
		return width;
	}

	public String sourceExtension() {
		String raw = get(EXTENSION_KEY);
		if (raw == null || raw.isBlank()) {
			return DEFAULT_EXTENSION;
		}
		String ext = raw.trim();
		return ext.startsWith(".") ? ext : "." + ext;
	}
}
