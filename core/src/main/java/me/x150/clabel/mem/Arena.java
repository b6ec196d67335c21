package me.x150.clabel.mem;

import lombok.Getter;
import me.x150.clabel.exc.ArenaExhaustedException;
import org.jetbrains.annotations.Nullable;

import java.nio.ByteBuffer;

/**
 * Bump allocator for data that lives as long as the compilation run: synthesized label text and similar.
 * Regions are carved out of the most recently allocated block; nothing is ever released individually.
 * Blocks are chained most-recent-first and dropped together by {@link #destroy()}.
 */
public class Arena implements AutoCloseable {
	public static final int MIN_BLOCK_SIZE = 1024;
	public static final int ALIGNMENT = 8;

	@Getter
	private final int blockSize;
	/**
	 * total bytes this arena may hand out, 0 for no limit
	 */
	@Getter
	private final long limit;
	private @Nullable Block head;
	@Getter
	private long bytesAllocated;
	@Getter
	private int blockCount;
	/**
	 * summed capacity of every block, counted against the limit
	 */
	@Getter
	private long reservedBytes;
	@Getter
	private boolean destroyed;

	public Arena() {
		this(MIN_BLOCK_SIZE, 0);
	}

	public Arena(int blockSize) {
		this(blockSize, 0);
	}

	public Arena(int blockSize, long limit) {
		if (limit < 0) throw new IllegalArgumentException("Negative arena limit " + limit);
		this.blockSize = Math.max(blockSize, MIN_BLOCK_SIZE);
		this.limit = limit;
	}

	private static int alignUp(int value) {
		return (value + ALIGNMENT - 1) & -ALIGNMENT;
	}

	/**
	 * Hands out a zeroed region of at least {@code size} bytes. The returned buffer starts at an
	 * {@link #ALIGNMENT}-aligned offset of its block and stays valid until the arena is destroyed.
	 *
	 * @param size requested byte count, may be 0
	 * @return a buffer with position 0 and capacity {@code size}
	 * @throws ArenaExhaustedException if a limit is configured and would be exceeded
	 */
	public ByteBuffer alloc(int size) {
		if (destroyed) throw new IllegalStateException("Arena has been destroyed");
		if (size < 0) throw new IllegalArgumentException("Negative allocation size " + size);
		int reserved = size == 0 ? ALIGNMENT : alignUp(size);

		Block current = head;
		if (current == null || current.used + reserved > current.data.capacity()) {
			int cap = Math.max(blockSize, reserved);
			if (limit > 0 && reservedBytes + cap > limit) {
				// a smaller block still fits the request
				if (reservedBytes + reserved > limit) throw new ArenaExhaustedException(size, bytesAllocated, limit);
				cap = (int) (limit - reservedBytes);
			}
			current = new Block(ByteBuffer.allocate(cap), head);
			head = current;
			blockCount++;
			reservedBytes += cap;
		}

		ByteBuffer out = current.data.slice(current.used, size);
		current.used += reserved;
		bytesAllocated += reserved;
		return out;
	}

	/**
	 * Drops every block. Regions handed out earlier stay readable to whoever still holds them,
	 * but the arena refuses further allocations.
	 */
	public void destroy() {
		head = null;
		blockCount = 0;
		bytesAllocated = 0;
		reservedBytes = 0;
		destroyed = true;
	}

	@Override
	public void close() {
		destroy();
	}

	private static final class Block {
		final ByteBuffer data;
		final @Nullable Block next;
		int used;

		Block(ByteBuffer data, @Nullable Block next) {
			this.data = data;
			this.next = next;
		}
	}
}
