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

package dcm2png.lib.images.readers;

import java.nio.file.Path;

import dcm2png.lib.images.ImageData;

/**
 * Interface for reading a single-frame grayscale image and its metadata from a file.
 * <p>
 * Implementations must be safe to call from multiple threads concurrently, since one reader
 * is shared by all conversion workers.
 */
public interface ImageReader {

	/**
	 * Get the name of the reader, e.g. "DICOM".
	 * @return
	 */
	String getName();

	/**
	 * Read pixels and metadata.
	 * @param path the source file
	 * @return the decoded image
	 * @throws DecodeException if the file cannot be read, or is not a supported single-frame image
	 */
	ImageData read(Path path) throws DecodeException;

}
