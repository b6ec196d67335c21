package me.x150.clabel.ast;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Immutable singly linked list of case entries. {@link #prepend(CaseEntry)} shares the existing
 * tail, so a list built while walking a switch holds its entries in reverse encounter order.
 */
public final class CaseList implements Iterable<CaseEntry> {
	public static final CaseList EMPTY = new CaseList(null, null, 0);

	private final @Nullable CaseEntry head;
	private final @Nullable CaseList next;
	private final int size;

	private CaseList(@Nullable CaseEntry head, @Nullable CaseList next, int size) {
		this.head = head;
		this.next = next;
		this.size = size;
	}

	public CaseList prepend(CaseEntry entry) {
		return new CaseList(entry, this, size + 1);
	}

	public int size() {
		return size;
	}

	public boolean isEmpty() {
		return size == 0;
	}

	public boolean containsValue(long value) {
		for (CaseEntry entry : this) {
			if (entry instanceof CaseEntry.IntCase ic && ic.value() == value) return true;
		}
		return false;
	}

	public boolean hasDefault() {
		for (CaseEntry entry : this) {
			if (entry instanceof CaseEntry.DefaultCase) return true;
		}
		return false;
	}

	public Stream<CaseEntry> stream() {
		return StreamSupport.stream(spliterator(), false);
	}

	public List<CaseEntry> toList() {
		List<CaseEntry> out = new ArrayList<>(size);
		forEach(out::add);
		return out;
	}

	@Override
	public @NotNull Iterator<CaseEntry> iterator() {
		return new Iterator<>() {
			CaseList current = CaseList.this;

			@Override
			public boolean hasNext() {
				return current.size > 0;
			}

			@Override
			public CaseEntry next() {
				if (!hasNext()) throw new NoSuchElementException();
				CaseEntry e = current.head;
				current = current.next;
				return e;
			}
		};
	}

	@Override
	public String toString() {
		return stream().map(CaseEntry::toString).collect(Collectors.joining(", ", "[", "]"));
	}
}
