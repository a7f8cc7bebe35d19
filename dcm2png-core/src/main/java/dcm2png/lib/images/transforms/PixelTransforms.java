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

package dcm2png.lib.images.transforms;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dcm2png.lib.common.GeneralTools;
import dcm2png.lib.images.ImageData;
import dcm2png.lib.images.ImageMetadata;
import dcm2png.lib.images.LookupTable;
import dcm2png.lib.images.PixelMatrix;
import dcm2png.lib.images.PixelType;
import dcm2png.lib.images.RescaleParameters;

/**
 * Static methods to convert decoded pixel values into an 8-bit display range.
 * <p>
 * Conversion has three steps, applied in order:
 * <ol>
 *   <li>{@link #rescale(ImageData)}: apply the rescale slope and intercept, if present</li>
 *   <li>{@link #applyLookupTable(ImageData)}: remap values through the VOI lookup table, if present</li>
 *   <li>{@link #normalizeToUint8(PixelMatrix)}: stretch the minimum and maximum to 0 and 255</li>
 * </ol>
 * The first two steps consume the corresponding metadata, so that applying them again has no effect.
 * None of the methods modify their inputs.
 */
public class PixelTransforms {

	private static final Logger logger = LoggerFactory.getLogger(PixelTransforms.class);

	private static final int MAX_LUT_BIT_DEPTH = 16;

	private PixelTransforms() {
		throw new AssertionError();
	}

	/**
	 * Apply all transforms to produce an 8-bit display image.
	 * @param imageData
	 * @return an 8-bit matrix with the same dimensions as the input
	 * @throws TransformException if the metadata describes an inconsistent lookup table
	 */
	public static PixelMatrix convertForDisplay(ImageData imageData) throws TransformException {
		return normalizeToUint8(applyRescaleAndLookupTable(imageData).pixels());
	}

	/**
	 * Apply the rescale and lookup table from the metadata, if available.
	 * @param imageData
	 * @return transformed image data, with the rescale and lookup table removed from the metadata
	 * @throws TransformException if the metadata describes an inconsistent lookup table
	 */
	public static ImageData applyRescaleAndLookupTable(ImageData imageData) throws TransformException {
		return applyLookupTable(rescale(imageData));
	}

	/**
	 * Apply the rescale formula {@code value * slope + intercept} if the metadata contains rescale parameters.
	 * <p>
	 * Computation is performed in double precision, and the result cast back to the original pixel type
	 * (see {@link PixelType#cast(double)}).
	 * @param imageData
	 * @return transformed image data, or the input if there are no rescale parameters
	 */
	public static ImageData rescale(ImageData imageData) {
		Objects.requireNonNull(imageData, "imageData");
		var rescale = imageData.metadata().getRescale().orElse(null);
		if (rescale == null)
			return imageData;
		var pixels = imageData.pixels();
		var metadata = new ImageMetadata.Builder(imageData.metadata())
				.rescale(null)
				.build();
		if (rescale.isIdentity())
			return new ImageData(pixels, metadata);
		logger.trace("Applying {} to {}", rescale, pixels);
		return new ImageData(rescale(pixels, rescale), metadata);
	}

	/**
	 * Apply rescale parameters to a matrix, retaining its pixel type.
	 * @param pixels
	 * @param rescale
	 * @return
	 */
	public static PixelMatrix rescale(PixelMatrix pixels, RescaleParameters rescale) {
		return pixels.map(rescale::apply, pixels.getPixelType());
	}

	/**
	 * Remap values through the lookup table in the metadata, if there is one.
	 * <p>
	 * Values are first rounded to the nearest integer (with ties to even).
	 * Values below the first mapped value take the first table entry; values beyond the last mapped value
	 * take the last entry. The result is cast back to the original pixel type.
	 *
	 * @param imageData
	 * @return transformed image data, or the input if there is no lookup table
	 * @throws TransformException if the lookup table is empty, its descriptor count does not match its data,
	 *                            or its bit depth is invalid
	 */
	public static ImageData applyLookupTable(ImageData imageData) throws TransformException {
		Objects.requireNonNull(imageData, "imageData");
		var lut = imageData.metadata().getLookupTable().orElse(null);
		if (lut == null)
			return imageData;
		var metadata = new ImageMetadata.Builder(imageData.metadata())
				.lookupTable(null)
				.build();
		return new ImageData(applyLookupTable(imageData.pixels(), lut), metadata);
	}

	/**
	 * Remap the values of a matrix through a lookup table, retaining its pixel type.
	 * @param pixels
	 * @param lut
	 * @return
	 * @throws TransformException if the lookup table is inconsistent
	 * @see #applyLookupTable(ImageData)
	 */
	public static PixelMatrix applyLookupTable(PixelMatrix pixels, LookupTable lut) throws TransformException {
		checkLookupTable(lut);
		int first = lut.getFirstValue();
		int n = lut.size();
		logger.trace("Applying {} to {}", lut, pixels);
		return pixels.map(v -> {
			double ind = GeneralTools.clipValue(Math.rint(v) - first, 0, n - 1);
			return lut.getEntry((int)ind);
		}, pixels.getPixelType());
	}

	private static void checkLookupTable(LookupTable lut) throws TransformException {
		if (lut.size() == 0)
			throw new TransformException("Lookup table contains no data");
		if (lut.getCount() != lut.size())
			throw new TransformException("Lookup table descriptor declares " + lut.getCount() + " entries, but data contains " + lut.size());
		if (lut.getBitDepth() < 1 || lut.getBitDepth() > MAX_LUT_BIT_DEPTH)
			throw new TransformException("Lookup table bit depth must be between 1 and " + MAX_LUT_BIT_DEPTH + ", but was " + lut.getBitDepth());
	}

	/**
	 * Stretch the values of a matrix so that its minimum becomes 0 and its maximum 255,
	 * truncating the scaled values to an 8-bit unsigned representation.
	 * <p>
	 * If all values are the same, there is no range to stretch and the output is 0 everywhere.
	 * @param pixels
	 * @return a {@link PixelType#UINT8} matrix of the same size
	 */
	public static PixelMatrix normalizeToUint8(PixelMatrix pixels) {
		Objects.requireNonNull(pixels, "pixels");
		double min = pixels.getMinValue();
		double max = pixels.getMaxValue();
		double range = max - min;
		if (!(range > 0)) {
			logger.debug("Constant image (all values {}), output will be 0", min);
			return pixels.map(v -> 0, PixelType.UINT8);
		}
		return pixels.map(v -> (v - min) / range * 255.0, PixelType.UINT8);
	}

}
