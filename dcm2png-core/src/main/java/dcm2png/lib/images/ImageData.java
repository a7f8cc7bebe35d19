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

package dcm2png.lib.images;

import java.util.Objects;

/**
 * A decoded image: pixel values together with the header metadata needed to display them.
 *
 * @param pixels
 * @param metadata
 */
public record ImageData(PixelMatrix pixels, ImageMetadata metadata) {

	/**
	 * Constructor.
	 * @param pixels
	 * @param metadata
	 */
	public ImageData {
		Objects.requireNonNull(pixels, "pixels");
		Objects.requireNonNull(metadata, "metadata");
	}

}
