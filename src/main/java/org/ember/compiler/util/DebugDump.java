package org.ember.compiler.util;

import org.ember.compiler.api.LoweredProgram;
import org.ember.compiler.ir.IrPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility class for dumping debug information during compilation.
 */
public final class DebugDump {

	private static final Logger LOG = LoggerFactory.getLogger(DebugDump.class);

	private DebugDump() {}

	/**
	 * Writes the lowered forms of a unit, one term per line, and its warnings next to them.
	 * A failure to write is logged and otherwise ignored so that dumping never fails a compilation.
	 *
	 * @param directory The dump root; a sub-directory per unit is created below it.
	 * @param program   The lowered unit.
	 * @return The directory the dump was written to.
	 */
	public static Path dumpLowered(Path directory, LoweredProgram program) {
		Path root = directory.resolve(sanitize(program.fileName()));
		try {
			Files.createDirectories(root);
			Files.writeString(root.resolve("lowered.txt"), IrPrinter.printAll(program.forms()));
			StringBuilder sb = new StringBuilder();
			program.warnings().forEach(w -> sb.append(w).append('\n'));
			Files.writeString(root.resolve("warnings.txt"), sb.toString());
			LOG.debug("Wrote debug dump of {} to {}", program.fileName(), root);
		} catch (IOException e) {
			LOG.warn("Could not write debug dump to {}: {}", root, e.getMessage());
		}
		return root;
	}

	private static String sanitize(String s) { return s.replaceAll("[^A-Za-z0-9_.-]", "_"); }
}
