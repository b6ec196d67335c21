package me.x150.clabel.label;

import me.x150.clabel.mem.Arena;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Immutable view over the bytes of a jump target name. The bytes either wrap source text
 * ({@link #of(String)}) or live in an {@link Arena} ({@link #copyOf(Arena, CharSequence)}).
 * Two labels are equal when their contents are, regardless of where the bytes are stored.
 */
public final class Label {
	private final ByteBuffer bytes;
	private final int hash;

	private Label(ByteBuffer bytes) {
		this.bytes = bytes.asReadOnlyBuffer();
		this.hash = djb2(this.bytes);
	}

	public static Label of(String text) {
		return new Label(ByteBuffer.wrap(text.getBytes(StandardCharsets.UTF_8)));
	}

	public static Label copyOf(Arena arena, CharSequence text) {
		byte[] encoded = text.toString().getBytes(StandardCharsets.UTF_8);
		ByteBuffer region = arena.alloc(encoded.length);
		region.put(0, encoded);
		return new Label(region);
	}

	private static int djb2(ByteBuffer buf) {
		int out = 5381;
		for (int i = 0; i < buf.limit(); i++) {
			out = out * 33 + buf.get(i);
		}
		return out;
	}

	/**
	 * Copies this label followed by {@code suffix} into the arena.
	 */
	public Label derive(Arena arena, String suffix) {
		byte[] tail = suffix.getBytes(StandardCharsets.UTF_8);
		int len = length();
		ByteBuffer region = arena.alloc(len + tail.length);
		region.put(0, bytes, 0, len);
		region.put(len, tail);
		return new Label(region);
	}

	public int length() {
		return bytes.limit();
	}

	public boolean isEmpty() {
		return length() == 0;
	}

	public boolean contains(char c) {
		for (int i = 0; i < bytes.limit(); i++) {
			if (bytes.get(i) == c) return true;
		}
		return false;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Label other)) return false;
		return hash == other.hash && bytes.equals(other.bytes);
	}

	@Override
	public int hashCode() {
		return hash;
	}

	@Override
	public String toString() {
		byte[] copy = new byte[length()];
		bytes.get(0, copy);
		return new String(copy, StandardCharsets.UTF_8);
	}
}
