/*-
 * #%L
 * This file is part of dcm2png.
 * %%
 * Copyright (C) 2024 dcm2png developers
 * %%
 * dcm2png is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * dcm2png is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with dcm2png.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package dcm2png.lib.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@SuppressWarnings("javadoc")
public class TestSourceCollector {

	private static Path touch(Path path) throws IOException {
		Files.createDirectories(path.getParent());
		return Files.createFile(path);
	}

	@Test
	public void test_collectFolder(@TempDir Path dir) throws IOException {
		var a = touch(dir.resolve("a.dcm"));
		var b = touch(dir.resolve("nested").resolve("b.DICOM"));
		var c = touch(dir.resolve("nested").resolve("deeper").resolve("IM0001"));
		touch(dir.resolve("notes.txt"));
		touch(dir.resolve("nested").resolve(".hidden.dcm"));

		var sources = new SourceCollector().collect(List.of(dir));
		assertEquals(List.of(normalize(a), normalize(c), normalize(b)).stream().sorted().toList(), sources);
		assertEquals(3, sources.size());
	}

	@Test
	public void test_collectFilesAndWalkedDuplicates(@TempDir Path dir) throws IOException {
		var a = touch(dir.resolve("a.dcm"));
		var b = touch(dir.resolve("b.dcm"));
		// Files given explicitly are used regardless of extension
		var txt = touch(dir.resolve("other.txt"));

		var collector = new SourceCollector();
		assertEquals(List.of(normalize(txt), normalize(a), normalize(b)), collector.collect(List.of(txt, a, dir)));
		assertEquals(List.of(normalize(b), normalize(a)), collector.collect(List.of(dir, a)));
		assertEquals(List.of(normalize(a), normalize(b)), collector.collect(List.of(dir, dir)));
	}

	@Test
	public void test_repeatedFilesAreKept(@TempDir Path dir) throws IOException {
		var a = touch(dir.resolve("a.dcm"));
		var sources = new SourceCollector().collect(List.of(a, dir.resolve(".").resolve("a.dcm")));
		assertEquals(List.of(normalize(a), normalize(a)), sources);
	}

	@Test
	public void test_missingPath(@TempDir Path dir) {
		assertThrows(NoSuchFileException.class, () -> new SourceCollector().collect(List.of(dir.resolve("missing"))));
	}

	@Test
	public void test_accepted() {
		var collector = new SourceCollector();
		assertTrue(collector.isAccepted(Path.of("image.dcm")));
		assertTrue(collector.isAccepted(Path.of("image.Dicom")));
		assertTrue(collector.isAccepted(Path.of("IM0001")));
		assertFalse(collector.isAccepted(Path.of("image.png")));

		var pngCollector = new SourceCollector(List.of(".png"));
		assertTrue(pngCollector.isAccepted(Path.of("image.png")));
		assertFalse(pngCollector.isAccepted(Path.of("image.dcm")));
	}

	private static Path normalize(Path path) {
		return path.toAbsolutePath().normalize();
	}

}
