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

package dcm2png.lib.images.writers;

import java.nio.file.Path;
import java.util.Collection;

import dcm2png.lib.images.PixelMatrix;

/**
 * Interface for writing 8-bit single-channel images to a file.
 */
public interface ImageWriter {

	/**
	 * Get the name of the writer, e.g. "PNG".
	 * @return
	 */
	String getName();

	/**
	 * Get the file extensions used with this writer, without the leading dot.
	 * @return
	 */
	Collection<String> getExtensions();

	/**
	 * Get the extension used for new files. By default this is the first element of {@link #getExtensions()}.
	 * @return
	 */
	default String getDefaultExtension() {
		return getExtensions().iterator().next();
	}

	/**
	 * Write an image.
	 * <p>
	 * Implementations must not leave a partially-written file at {@code path} if writing fails.
	 * @param pixels pixels to write; must be {@link dcm2png.lib.images.PixelType#UINT8}
	 * @param path the output file
	 * @throws WriteException if the image could not be written
	 */
	void writeImage(PixelMatrix pixels, Path path) throws WriteException;

}
