package me.x150.clabel.conf;

import lombok.Builder;
import lombok.NonNull;
import me.x150.clabel.label.CountingLabelGenerator;
import me.x150.clabel.label.LabelGenerator;
import me.x150.clabel.mem.Arena;

/**
 * State shared by every function of one compilation run.
 */
@Builder
public record Context(
		@NonNull Arena arena,
		@NonNull LabelGenerator labels,
		@NonNull LabelingSettings settings
) {
	public static Context create(LabelingSettings settings) {
		Arena arena = new Arena(settings.arenaBlockSize, settings.arenaLimit);
		return Context.builder()
				.arena(arena)
				.labels(new CountingLabelGenerator(arena))
				.settings(settings)
				.build();
	}

	public static Context create() {
		return create(new LabelingSettings());
	}
}
