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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import dcm2png.lib.images.ImageData;
import dcm2png.lib.images.ImageMetadata;
import dcm2png.lib.images.LookupTable;
import dcm2png.lib.images.PixelMatrix;
import dcm2png.lib.images.PixelType;
import dcm2png.lib.images.RescaleParameters;

@SuppressWarnings("javadoc")
public class TestPixelTransforms {

	private static final LookupTable LUT = LookupTable.createInstance(100, 16, 10, 20, 30, 40);

	private static ImageData createImageData(PixelMatrix pixels, RescaleParameters rescale, LookupTable lut) {
		var metadata = new ImageMetadata.Builder()
				.name("test")
				.size(pixels.getWidth(), pixels.getHeight())
				.bits(pixels.getPixelType().getBitsPerPixel(), pixels.getPixelType().getBitsPerPixel())
				.signed(pixels.getPixelType().isSignedInteger())
				.rescale(rescale)
				.lookupTable(lut)
				.build();
		return new ImageData(pixels, metadata);
	}

	@Test
	public void test_rescaleIdentity() {
		var pixels = PixelMatrix.fromRows(PixelType.INT16,
				new double[] {-1000, 0, 1},
				new double[] {5, 32767, -32768});
		var result = PixelTransforms.applyRescaleAndLookupTable(createImageData(pixels, RescaleParameters.IDENTITY, null));
		assertEquals(pixels, result.pixels());
		assertTrue(result.metadata().getRescale().isEmpty());

		// No rescale at all returns the input
		var imageData = createImageData(pixels, null, null);
		assertSame(imageData, PixelTransforms.rescale(imageData));
	}

	@Test
	public void test_rescaleArithmetic() {
		var pixels = PixelMatrix.fromRows(PixelType.INT16, new double[] {10, 0, -3});
		var result = PixelTransforms.rescale(createImageData(pixels, new RescaleParameters(2, 5), null));
		assertArrayEquals(new double[] {25, 5, -1}, result.pixels().getValues());
		assertEquals(PixelType.INT16, result.pixels().getPixelType());
		// Rescale is consumed
		assertTrue(result.metadata().getRescale().isEmpty());
		assertEquals(result, PixelTransforms.rescale(result));
	}

	@Test
	public void test_rescaleCastsToPixelType() {
		var pixels = PixelMatrix.fromRows(PixelType.UINT16, new double[] {0, 1, 3, 60000});
		// Fractional results are truncated toward zero, out-of-range values saturate
		var result = PixelTransforms.rescale(pixels, new RescaleParameters(1.5, -1.0));
		assertArrayEquals(new double[] {0, 0, 3, 65535}, result.getValues());

		var floats = PixelMatrix.fromRows(PixelType.FLOAT32, new double[] {1});
		assertEquals((double)(float)0.1, PixelTransforms.rescale(floats, new RescaleParameters(0.1, 0)).getValue(0, 0));
	}

	@Test
	public void test_rescaleNegativeInterceptOnUnsignedData() {
		// Values rescaled below zero are clipped by the unsigned type before normalization
		var pixels = PixelMatrix.fromRows(PixelType.UINT16, new double[] {0, 24, 1024, 2048});
		var imageData = createImageData(pixels, new RescaleParameters(1, -1024), null);
		assertArrayEquals(new double[] {0, 0, 0, 1024}, PixelTransforms.rescale(imageData).pixels().getValues());
		assertArrayEquals(new double[] {0, 0, 0, 255}, PixelTransforms.convertForDisplay(imageData).getValues());

		// Signed data keeps the negative values
		var signed = PixelMatrix.fromRows(PixelType.INT16, new double[] {0, 24, 1024, 2048});
		var signedData = createImageData(signed, new RescaleParameters(1, -1024), null);
		assertArrayEquals(new double[] {-1024, -1000, 0, 1024}, PixelTransforms.rescale(signedData).pixels().getValues());
	}

	@Test
	public void test_lookupTable() {
		var pixels = PixelMatrix.fromRows(PixelType.INT16,
				new double[] {99, 100, 101},
				new double[] {102, 103, 500});
		var result = PixelTransforms.applyLookupTable(pixels, LUT);
		assertArrayEquals(new double[][] {
			{10, 10, 20},
			{30, 40, 40}}, result.toRows());
	}

	@Test
	public void test_lookupTableClamp() {
		var pixels = PixelMatrix.fromRows(PixelType.INT32, new double[] {-50000, 0, 99, 104, 500, 100000});
		var result = PixelTransforms.applyLookupTable(pixels, LUT);
		assertArrayEquals(new double[] {10, 10, 10, 40, 40, 40}, result.getValues());
	}

	@Test
	public void test_lookupTableRounding() {
		var pixels = PixelMatrix.fromRows(PixelType.FLOAT64, new double[] {100.4, 100.6, 101.5, 102.5});
		// Ties round to even
		var result = PixelTransforms.applyLookupTable(pixels, LUT);
		assertArrayEquals(new double[] {10, 20, 30, 30}, result.getValues());
	}

	@Test
	public void test_lookupTableFromMetadata() {
		var pixels = PixelMatrix.fromRows(PixelType.INT16, new double[] {45, 50, 51});
		var imageData = createImageData(pixels, new RescaleParameters(2, 0), LUT);
		var result = PixelTransforms.applyRescaleAndLookupTable(imageData);
		// Rescale is applied first: 90 -> clamp, 100, 102
		assertArrayEquals(new double[] {10, 10, 30}, result.pixels().getValues());
		assertTrue(result.metadata().getLookupTable().isEmpty());
		assertTrue(result.metadata().getRescale().isEmpty());
	}

	@Test
	public void test_invalidLookupTable() {
		var pixels = PixelMatrix.fromRows(PixelType.UINT16, new double[] {1, 2});
		assertThrows(TransformException.class,
				() -> PixelTransforms.applyLookupTable(pixels, LookupTable.createInstance(0, 0, 16, new int[0])));
		assertThrows(TransformException.class,
				() -> PixelTransforms.applyLookupTable(pixels, LookupTable.createInstance(0, 5, 16, new int[] {1, 2})));
		assertThrows(TransformException.class,
				() -> PixelTransforms.applyLookupTable(pixels, LookupTable.createInstance(0, 2, 0, new int[] {1, 2})));
		assertThrows(TransformException.class,
				() -> PixelTransforms.applyLookupTable(pixels, LookupTable.createInstance(0, 2, 17, new int[] {1, 2})));
	}

	@Test
	public void test_normalize() {
		var pixels = PixelMatrix.fromRows(PixelType.UINT16,
				new double[] {0, 10},
				new double[] {20, 30});
		var result = PixelTransforms.normalizeToUint8(pixels);
		assertEquals(PixelType.UINT8, result.getPixelType());
		assertArrayEquals(new double[][] {
			{0, 85},
			{170, 255}}, result.toRows());
	}

	@Test
	public void test_normalizeBounds() {
		var pixels = PixelMatrix.fromRows(PixelType.INT16,
				new double[] {-1024, 3071, 17},
				new double[] {-5, 0, 1200});
		var result = PixelTransforms.normalizeToUint8(pixels);
		assertEquals(0, result.getMinValue());
		assertEquals(255, result.getMaxValue());
		assertEquals(0, result.getValue(0, 0));
		assertEquals(255, result.getValue(1, 0));
		for (double v : result.getValues())
			assertTrue(v >= 0 && v <= 255 && v == Math.floor(v));
	}

	@Test
	public void test_normalizeConstant() {
		var pixels = PixelMatrix.fromRows(PixelType.UINT16,
				new double[] {7, 7},
				new double[] {7, 7});
		var result = PixelTransforms.normalizeToUint8(pixels);
		assertEquals(PixelType.UINT8, result.getPixelType());
		assertArrayEquals(new double[] {0, 0, 0, 0}, result.getValues());
	}

	@Test
	public void test_convertForDisplay() {
		var pixels = PixelMatrix.fromRows(PixelType.UINT16, new double[] {0, 1, 2, 3});
		var imageData = createImageData(pixels, new RescaleParameters(10, 0), null);
		var result = PixelTransforms.convertForDisplay(imageData);
		assertArrayEquals(new double[] {0, 85, 170, 255}, result.getValues());
		// Inputs are unchanged
		assertArrayEquals(new double[] {0, 1, 2, 3}, pixels.getValues());
		assertTrue(imageData.metadata().getRescale().isPresent());
	}

}
