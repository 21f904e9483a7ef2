package org.javai.paredros.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link DebuggerSettings} from YAML. Missing sections and keys keep their defaults.
 * <pre>
 * navigation:
 *   lookahead_depth: 3
 * expansion:
 *   max_steps: 1000
 *   resolve_ll1_decisions: true
 * inference:
 *   budget: 100000
 *   max_call_depth: 256
 * builder:
 *   merge_duplicate_decisions: true
 * collector:
 *   report_chosen_alternatives: true
 * </pre>
 */
public class DebuggerSettingsLoader {

	public static final String DEFAULT_RESOURCE = "META-INF/paredros-debugger.yml";

	private static final Logger logger = LoggerFactory.getLogger(DebuggerSettingsLoader.class);

	private final Yaml yaml = new Yaml();

	/**
	 * Loads {@value #DEFAULT_RESOURCE} from the classpath, or the defaults when it is absent.
	 */
	public DebuggerSettings load() {
		return load(DEFAULT_RESOURCE);
	}

	public DebuggerSettings load(String resourceName) {
		ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
		if (classLoader == null) {
			classLoader = DebuggerSettingsLoader.class.getClassLoader();
		}
		try (InputStream stream = classLoader.getResourceAsStream(resourceName)) {
			if (stream == null) {
				logger.debug("No {} on the classpath, using default settings", resourceName);
				return DebuggerSettings.defaults();
			}
			return parse(stream);
		} catch (IOException e) {
			throw new SettingsException("Failed to read settings resource: " + resourceName, e);
		}
	}

	public DebuggerSettings parse(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (IOException e) {
			throw new SettingsException("Failed to read settings from path: " + path, e);
		}
	}

	public DebuggerSettings parse(InputStream inputStream) {
		Object data;
		try {
			data = yaml.load(inputStream);
		} catch (RuntimeException e) {
			throw new SettingsException("Failed to parse settings from input stream", e);
		}
		return buildSettings(data);
	}

	public DebuggerSettings parse(Reader reader) {
		Object data;
		try {
			data = yaml.load(reader);
		} catch (RuntimeException e) {
			throw new SettingsException("Failed to parse settings from reader", e);
		}
		return buildSettings(data);
	}

	public DebuggerSettings parseString(String yamlContent) {
		Object data;
		try {
			data = yaml.load(yamlContent);
		} catch (RuntimeException e) {
			throw new SettingsException("Failed to parse settings from string", e);
		}
		return buildSettings(data);
	}

	private DebuggerSettings buildSettings(Object data) {
		if (data == null) {
			return DebuggerSettings.defaults();
		}
		if (!(data instanceof Map)) {
			throw new SettingsException("Settings must be a mapping of sections, got " + data.getClass().getSimpleName());
		}
		Map<?, ?> root = (Map<?, ?>) data;
		Map<?, ?> navigation = section(root, "navigation");
		Map<?, ?> expansion = section(root, "expansion");
		Map<?, ?> inference = section(root, "inference");
		Map<?, ?> builder = section(root, "builder");
		Map<?, ?> collector = section(root, "collector");

		DebuggerSettings settings = new DebuggerSettings(
				intValue(navigation, "navigation", "lookahead_depth", DebuggerSettings.DEFAULT_LOOKAHEAD_DEPTH),
				intValue(expansion, "expansion", "max_steps", DebuggerSettings.DEFAULT_MAX_EXPANSION_STEPS),
				intValue(inference, "inference", "budget", DebuggerSettings.DEFAULT_INFERENCE_BUDGET),
				intValue(inference, "inference", "max_call_depth", DebuggerSettings.DEFAULT_MAX_CALL_DEPTH),
				booleanValue(expansion, "expansion", "resolve_ll1_decisions", true),
				booleanValue(builder, "builder", "merge_duplicate_decisions", true),
				booleanValue(collector, "collector", "report_chosen_alternatives", true)
		);
		logger.debug("Loaded debugger settings: {}", settings);
		return settings;
	}

	private Map<?, ?> section(Map<?, ?> root, String name) {
		Object value = root.get(name);
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map)) {
			throw new SettingsException("Section '" + name + "' must be a mapping");
		}
		return (Map<?, ?>) value;
	}

	private int intValue(Map<?, ?> section, String sectionName, String key, int defaultValue) {
		Object value = section.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Integer) {
			return (Integer) value;
		}
		if (value instanceof String) {
			try {
				return Integer.parseInt(((String) value).trim());
			} catch (NumberFormatException e) {
				throw new SettingsException("'" + sectionName + "." + key + "' must be an integer, got '" + value + "'", e);
			}
		}
		throw new SettingsException("'" + sectionName + "." + key + "' must be an integer, got " + value);
	}

	private boolean booleanValue(Map<?, ?> section, String sectionName, String key, boolean defaultValue) {
		Object value = section.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Boolean) {
			return (Boolean) value;
		}
		if ("true".equalsIgnoreCase(String.valueOf(value)) || "false".equalsIgnoreCase(String.valueOf(value))) {
			return Boolean.parseBoolean(String.valueOf(value));
		}
		throw new SettingsException("'" + sectionName + "." + key + "' must be true or false, got " + value);
	}
}
