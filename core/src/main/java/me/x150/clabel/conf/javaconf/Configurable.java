package me.x150.clabel.conf.javaconf;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.TreeSet;

public interface Configurable {
	String[] getConfigKeys();

	Class<?> getConfigValueType(String key);

	Object getConfigValue(String key);

	void setConfigValue(String key, Object value);

	void validatePathsFilled(Deque<String> currentPath, Set<String> missing);

	String getDescription(String key);

	/**
	 * @return dotted paths of required keys that were never set, sorted
	 */
	default Set<String> missingRequiredKeys() {
		Set<String> missing = new TreeSet<>();
		validatePathsFilled(new ArrayDeque<>(), missing);
		return missing;
	}
}
