package me.x150.clabel.conf;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

	private static Properties props(String... kv) {
		Properties p = new Properties();
		for (int i = 0; i < kv.length; i += 2) {
			p.setProperty(kv[i], kv[i + 1]);
		}
		return p;
	}

	@Test
	public void testDefaults() {
		LabelingSettings settings = new LabelingSettings();
		assertEquals(256, settings.labelTableBuckets);
		assertEquals(1024, settings.arenaBlockSize);
		assertEquals(0L, settings.arenaLimit);
		assertFalse(settings.dumpLabeledTrees);
		assertArrayEquals(new String[]{"arenaBlockSize", "arenaLimit", "dumpLabeledTrees", "labelTableBuckets"}, settings.getConfigKeys());
	}

	@Test
	public void testApplyConvertsTypes() {
		LabelingSettings settings = ConfigLoader.apply(new LabelingSettings(), props(
				"labelTableBuckets", "31",
				"arenaLimit", " 65536 ",
				"dumpLabeledTrees", "TRUE"));
		assertEquals(31, settings.labelTableBuckets);
		assertEquals(65536L, settings.arenaLimit);
		assertTrue(settings.dumpLabeledTrees);
		assertEquals(1024, settings.arenaBlockSize);
	}

	@Test
	public void testRejectsUnknownKeysAndBadValues() {
		IllegalArgumentException unknown = assertThrows(IllegalArgumentException.class, () -> ConfigLoader.apply(new LabelingSettings(), props("bogus", "1")));
		assertTrue(unknown.getMessage().startsWith("Unknown config key bogus"));
		assertTrue(unknown.getMessage().contains("labelTableBuckets (int): Bucket count of the per-function goto label table"));
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
				() -> ConfigLoader.apply(new LabelingSettings(), props("labelTableBuckets", "many")));
		assertEquals("Expected a number for labelTableBuckets, got many", e.getMessage());
		assertThrows(IllegalArgumentException.class, () -> ConfigLoader.apply(new LabelingSettings(), props("dumpLabeledTrees", "yes")));
	}

	@Test
	public void testMissingRequiredKeys() {
		RequiredSettings settings = new RequiredSettings();
		assertEquals(Set.of("unit"), settings.missingRequiredKeys());
		IllegalStateException e = assertThrows(IllegalStateException.class, () -> ConfigLoader.apply(new RequiredSettings(), props("retries", "3")));
		assertTrue(e.getMessage().contains("unit"));

		ConfigLoader.apply(settings, props("unit", "main.c"));
		assertEquals("main.c", settings.unit);
		assertTrue(settings.missingRequiredKeys().isEmpty());
	}

	@Test
	public void testDescribe() {
		assertEquals("""
				  retries (int)
				  unit (String): Name of the translation unit
				""", ConfigLoader.describe(new RequiredSettings()));
	}

	@Test
	public void testLoadFromFile(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("labeling.properties");
		Files.writeString(file, "# arena tuning\narenaBlockSize=4096\nlabelTableBuckets=64\n");
		LabelingSettings settings = ConfigLoader.load(new LabelingSettings(), file);
		assertEquals(4096, settings.arenaBlockSize);
		assertEquals(64, settings.labelTableBuckets);
	}

	@Test
	public void testContextUsesSettings() {
		LabelingSettings settings = new LabelingSettings();
		settings.arenaBlockSize = 8192;
		settings.arenaLimit = 1L << 20;
		Context context = Context.create(settings);
		assertEquals(8192, context.arena().getBlockSize());
		assertEquals(1L << 20, context.arena().getLimit());
		assertSame(settings, context.settings());
	}
}
