package me.x150.clabel.label;

import lombok.RequiredArgsConstructor;
import me.x150.clabel.mem.Arena;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Produces {@code seed.kind.N} where N comes from one counter shared by every seed and kind.
 * The counter is never reset, so labels stay distinct across functions of a compilation run.
 */
@RequiredArgsConstructor
public class CountingLabelGenerator implements LabelGenerator {
	private final Arena arena;
	private final AtomicInteger counter = new AtomicInteger();

	@Override
	public Label freshLabel(Label seed, String kind) {
		int id = counter.getAndIncrement();
		return seed.derive(arena, "." + kind + "." + id);
	}

	@Override
	public int generated() {
		return counter.get();
	}
}
