package sixu;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class SixuConfigTest {
	private static SixuConfig config(String indent, String extension) {
		Properties properties = new Properties();
		if (indent != null) {
			properties.setProperty(SixuConfig.INDENT_KEY, indent);
		}
		if (extension != null) {
			properties.setProperty(SixuConfig.EXTENSION_KEY, extension);
		}
		return new SixuConfig(properties);
	}

	@Test
	void defaultsWhenUnset() {
		assertEquals(4, SixuConfig.defaults().indentWidth());
		assertEquals(".sixu", SixuConfig.defaults().sourceExtension());
	}

	@Test
	void readsConfiguredValues() {
		SixuConfig config = config(" 2 ", "story");
		assertEquals(2, config.indentWidth());
		assertEquals(".story", config.sourceExtension());
	}

	@Test
	void rejectsInvalidIndent() {
		assertThrows(IllegalArgumentException.class, () -> config("0", null).indentWidth());
		assertThrows(IllegalArgumentException.class, () -> config("wide", null).indentWidth());
	}

	@Test
	void loadsBundledProperties() {
		assertEquals("4", SixuConfig.loadResource(SixuConfig.RESOURCE).getProperty(SixuConfig.INDENT_KEY));
		assertEquals(0, SixuConfig.loadResource("/missing.properties").size());
	}
}
