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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dcm2png.lib.common.GeneralTools;

/**
 * Collects the source files for a batch from a list of files and folders.
 * <p>
 * Files are used as given, and a file named more than once is returned more than once so that the
 * duplicate can be reported when the batch is submitted.
 * Folders are walked recursively, and every regular file with an accepted extension is collected in sorted order.
 * Hidden files (starting with a dot) found while walking are skipped.
 * A file found by walking is returned only once, and not at all if it is also named explicitly.
 */
public class SourceCollector {

	private static final Logger logger = LoggerFactory.getLogger(SourceCollector.class);

	/**
	 * Extensions accepted when walking folders. The empty string means files without an extension.
	 */
	public static final Set<String> DEFAULT_EXTENSIONS = Set.of(".dcm", ".dicom", "");

	private final Set<String> extensions;

	/**
	 * Collector using {@link #DEFAULT_EXTENSIONS}.
	 */
	public SourceCollector() {
		this(DEFAULT_EXTENSIONS);
	}

	/**
	 * Collector using specific extensions.
	 * @param extensions lower-case extensions including the dot; use an empty string to accept files without an extension
	 */
	public SourceCollector(Collection<String> extensions) {
		this.extensions = Set.copyOf(extensions);
	}

	/**
	 * Collect sources.
	 * @param paths files or folders
	 * @return the source files, in argument order
	 * @throws NoSuchFileException if a path does not exist
	 * @throws IOException if a folder cannot be read
	 */
	public List<Path> collect(Collection<Path> paths) throws IOException {
		var named = new HashSet<Path>();
		for (var path : paths) {
			if (Files.isDirectory(path))
				continue;
			if (!Files.exists(path))
				throw new NoSuchFileException(path.toString());
			named.add(path.toAbsolutePath().normalize());
		}
		var walked = new HashSet<Path>();
		var sources = new ArrayList<Path>();
		for (var path : paths) {
			if (Files.isDirectory(path)) {
				var found = walk(path);
				logger.debug("Found {} source(s) in {}", found.size(), GeneralTools.abbreviatePath(path.toAbsolutePath(), 3));
				for (var p : found) {
					if (!named.contains(p) && walked.add(p))
						sources.add(p);
				}
			} else
				sources.add(path.toAbsolutePath().normalize());
		}
		return sources;
	}

	private List<Path> walk(Path dir) throws IOException {
		try (var stream = Files.walk(dir)) {
			return stream
					.filter(Files::isRegularFile)
					.filter(p -> !p.getFileName().toString().startsWith("."))
					.filter(this::isAccepted)
					.map(p -> p.toAbsolutePath().normalize())
					.sorted()
					.collect(Collectors.toList());
		}
	}

	/**
	 * Query whether a file would be collected when walking a folder.
	 * @param path
	 * @return
	 */
	public boolean isAccepted(Path path) {
		return extensions.contains(GeneralTools.getExtension(path).orElse(""));
	}

}
