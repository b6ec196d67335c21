package me.x150.clabel.label;

import lombok.Getter;
import org.jetbrains.annotations.Nullable;

/**
 * Fixed-size chained hash map from {@link Label} to {@link Label}. One table is built per function
 * and thrown away once that function's passes are done, so it never grows or rehashes.
 * Keys and values are not owned by the table.
 */
public class LabelTable implements AutoCloseable {
	private Entry[] buckets;
	@Getter
	private int size;

	public LabelTable(int bucketCount) {
		if (bucketCount <= 0) throw new IllegalArgumentException("Bucket count must be positive, got " + bucketCount);
		this.buckets = new Entry[bucketCount];
	}

	private int indexOf(Label key) {
		return Math.floorMod(key.hashCode(), buckets().length);
	}

	private Entry[] buckets() {
		if (buckets == null) throw new IllegalStateException("Label table has been destroyed");
		return buckets;
	}

	private @Nullable Entry find(Label key) {
		for (Entry e = buckets()[indexOf(key)]; e != null; e = e.next) {
			if (e.key.equals(key)) return e;
		}
		return null;
	}

	/**
	 * Maps {@code key} to {@code value}, replacing the value of an equal key if one is present.
	 */
	public void insert(Label key, Label value) {
		Entry[] arr = buckets();
		int idx = indexOf(key);
		Entry e = arr[idx];
		if (e == null) {
			arr[idx] = new Entry(key, value);
			size++;
			return;
		}
		while (true) {
			if (e.key.equals(key)) {
				e.value = value;
				return;
			}
			if (e.next == null) break;
			e = e.next;
		}
		e.next = new Entry(key, value);
		size++;
	}

	public @Nullable Label get(Label key) {
		Entry e = find(key);
		return e == null ? null : e.value;
	}

	public boolean contains(Label key) {
		return find(key) != null;
	}

	public int bucketCount() {
		return buckets().length;
	}

	public boolean isDestroyed() {
		return buckets == null;
	}

	/**
	 * Drops the bucket array and every chain node. Later calls to anything but this method fail.
	 */
	public void destroy() {
		buckets = null;
		size = 0;
	}

	@Override
	public void close() {
		destroy();
	}

	private static final class Entry {
		final Label key;
		Label value;
		@Nullable Entry next;

		Entry(Label key, Label value) {
			this.key = key;
			this.value = value;
		}
	}
}
