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

package dcm2png.lib.jobs;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Request to convert one source file, as submitted to a {@link ConversionDispatcher}.
 *
 * @param source path of the image to convert
 * @param outputDirectory directory where the converted image should be written
 * @param displayName name used in status messages
 */
public record JobSpec(Path source, Path outputDirectory, String displayName) {

	/**
	 * Constructor.
	 * @param source
	 * @param outputDirectory
	 * @param displayName
	 */
	public JobSpec {
		Objects.requireNonNull(source, "source");
		Objects.requireNonNull(outputDirectory, "outputDirectory");
		Objects.requireNonNull(displayName, "displayName");
	}

	/**
	 * Create a spec using the source file name as the display name.
	 * @param source
	 * @param outputDirectory
	 * @return
	 */
	public static JobSpec of(Path source, Path outputDirectory) {
		var fileName = source.getFileName();
		return new JobSpec(source, outputDirectory, fileName == null ? source.toString() : fileName.toString());
	}

}
