package me.x150.clabel.conf;

import me.x150.clabel.conf.javaconf.annots.ConfigValue;
import me.x150.clabel.conf.javaconf.annots.DTOConfigurable;
import me.x150.clabel.mem.Arena;

public class LabelingSettings extends DTOConfigurable {
	@ConfigValue(value = "labelTableBuckets", description = "Bucket count of the per-function goto label table")
	public int labelTableBuckets = 256;

	@ConfigValue(value = "arenaBlockSize", description = "Minimum block size of the label arena, in bytes (at least " + Arena.MIN_BLOCK_SIZE + ")")
	public int arenaBlockSize = Arena.MIN_BLOCK_SIZE;

	@ConfigValue(value = "arenaLimit", description = "Total bytes the label arena may hand out, 0 for no limit")
	public long arenaLimit = 0;

	@ConfigValue(value = "dumpLabeledTrees", description = "Log every function tree after labeling")
	public boolean dumpLabeledTrees = false;
}
