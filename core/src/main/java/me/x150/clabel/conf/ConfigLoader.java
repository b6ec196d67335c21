package me.x150.clabel.conf;

import lombok.extern.log4j.Log4j2;
import me.x150.clabel.conf.javaconf.Configurable;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.Set;

/**
 * Fills a {@link Configurable} from {@code key=value} properties.
 */
@Log4j2
public class ConfigLoader {
	public static <T extends Configurable> T load(T target, Path file) throws IOException {
		Properties props = new Properties();
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			props.load(reader);
		}
		log.debug("Loading {} keys from {}", props.size(), file.toAbsolutePath().normalize());
		return apply(target, props);
	}

	/**
	 * @throws IllegalArgumentException for unknown keys or values that don't convert to the key's type
	 * @throws IllegalStateException    if required keys remain unset afterwards
	 */
	public static <T extends Configurable> T apply(T target, Properties props) {
		Set<String> known = Set.of(target.getConfigKeys());
		for (String key : props.stringPropertyNames()) {
			if (!known.contains(key)) {
				throw new IllegalArgumentException("Unknown config key " + key + ", expected one of:\n" + describe(target));
			}
			Class<?> type = target.getConfigValueType(key);
			target.setConfigValue(key, convert(key, props.getProperty(key).trim(), type));
		}
		Set<String> missing = target.missingRequiredKeys();
		if (!missing.isEmpty()) throw new IllegalStateException("Missing required config keys: " + missing);
		return target;
	}

	/**
	 * One line per key: name, type and description.
	 */
	public static String describe(Configurable target) {
		StringBuilder sb = new StringBuilder();
		for (String key : target.getConfigKeys()) {
			sb.append("  ").append(key).append(" (").append(target.getConfigValueType(key).getSimpleName()).append(')');
			String description = target.getDescription(key);
			if (!description.isEmpty()) sb.append(": ").append(description);
			sb.append('\n');
		}
		return sb.toString();
	}

	static Object convert(String key, String raw, Class<?> type) {
		try {
			if (type == int.class || type == Integer.class) return Integer.parseInt(raw);
			if (type == long.class || type == Long.class) return Long.parseLong(raw);
			if (type == boolean.class || type == Boolean.class) {
				if (raw.equalsIgnoreCase("true")) return true;
				if (raw.equalsIgnoreCase("false")) return false;
				throw new IllegalArgumentException("Expected true or false for " + key + ", got " + raw);
			}
			if (type == String.class) return raw;
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Expected a number for " + key + ", got " + raw, e);
		}
		throw new IllegalArgumentException("Config key " + key + " has unsupported type " + type.getName());
	}
}
