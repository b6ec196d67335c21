package me.x150.clabel.conf.javaconf.annots;

import me.x150.clabel.conf.javaconf.Configurable;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Exposes the public {@link ConfigValue} fields of a subclass as configuration keys.
 */
public abstract class DTOConfigurable implements Configurable {

	private final Map<String, Slot> slots;
	private final String[] keys;
	private final BitSet setKeys;

	public DTOConfigurable() {
		List<String> hidden = hierarchy(getClass())
				.flatMap(it -> Arrays.stream(it.getDeclaredFields()))
				.filter(f -> f.isAnnotationPresent(ConfigValue.class))
				.filter(f -> !Modifier.isPublic(f.getModifiers()))
				.map(Field::toString).toList();
		if (!hidden.isEmpty()) {
			throw new IllegalStateException("Fields have @ConfigValue but aren't public: " + hidden);
		}
		MethodHandles.Lookup lookup = MethodHandles.lookup();
		Map<String, Slot> found = new HashMap<>();
		for (Field field : getClass().getFields()) {
			ConfigValue cv = field.getAnnotation(ConfigValue.class);
			if (cv == null) continue;
			if (Modifier.isStatic(field.getModifiers()))
				throw new IllegalStateException("Static field " + field + " has @" + ConfigValue.class.getSimpleName());
			try {
				if (found.put(cv.value(), new Slot(cv, lookup.unreflectVarHandle(field))) != null)
					throw new IllegalStateException("Duplicate config key " + cv.value() + " in " + getClass().getSimpleName());
			} catch (IllegalAccessException e) {
				throw new IllegalStateException("Cannot access config field " + field, e);
			}
		}
		this.slots = found;
		this.keys = found.keySet().toArray(String[]::new);
		Arrays.sort(this.keys);
		this.setKeys = new BitSet(keys.length);
	}

	private static Stream<Class<?>> hierarchy(Class<?> cl) {
		Stream.Builder<Class<?>> out = Stream.builder();
		for (Class<?> current = cl; current != null; current = current.getSuperclass()) {
			out.accept(current);
		}
		return out.build();
	}

	private Slot slot(String key) {
		Slot s = slots.get(key);
		if (s == null) throw new IllegalArgumentException("Unknown config key " + key + ", expected one of " + Arrays.toString(keys));
		return s;
	}

	@Override
	public String[] getConfigKeys() {
		return keys;
	}

	@Override
	public Class<?> getConfigValueType(String key) {
		return slot(key).handle.varType();
	}

	@Override
	public Object getConfigValue(String key) {
		return slot(key).handle.get(this);
	}

	@Override
	public void setConfigValue(String key, Object value) {
		slot(key).handle.set(this, value);
		setKeys.set(Arrays.binarySearch(this.keys, key), value != null);
	}

	@Override
	public void validatePathsFilled(Deque<String> currentPath, Set<String> missing) {
		for (int i = 0; i < keys.length; i++) {
			String key = keys[i];
			currentPath.addLast(key);
			if (getConfigValue(key) instanceof Configurable nested) nested.validatePathsFilled(currentPath, missing);
			if (!setKeys.get(i) && slots.get(key).meta.required()) {
				missing.add(String.join(".", currentPath));
			}
			currentPath.removeLast();
		}
	}

	@Override
	public String getDescription(String key) {
		return slot(key).meta.description();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + Arrays.stream(keys)
				.map(k -> k + "=" + getConfigValue(k))
				.collect(Collectors.joining(", ", "{", "}"));
	}

	private record Slot(ConfigValue meta, VarHandle handle) {
	}
}
