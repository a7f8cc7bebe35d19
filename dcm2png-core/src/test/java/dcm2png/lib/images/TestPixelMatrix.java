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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestPixelMatrix {

	@Test
	public void test_create() {
		var matrix = PixelMatrix.createInstance(3, 2, PixelType.UINT8, new double[] {0, 1, 2, 3, 4, 5});
		assertEquals(3, matrix.getWidth());
		assertEquals(2, matrix.getHeight());
		assertEquals(6, matrix.nPixels());
		assertEquals(5, matrix.getValue(2, 1));
		assertArrayEquals(new double[][] {{0, 1, 2}, {3, 4, 5}}, matrix.toRows());
		assertEquals(matrix, PixelMatrix.fromRows(PixelType.UINT8, new double[] {0, 1, 2}, new double[] {3, 4, 5}));

		assertThrows(IllegalArgumentException.class, () -> PixelMatrix.createInstance(0, 2, PixelType.UINT8, new double[0]));
		assertThrows(IllegalArgumentException.class, () -> PixelMatrix.createInstance(2, 2, PixelType.UINT8, new double[3]));
		assertThrows(IllegalArgumentException.class, () -> PixelMatrix.fromRows(PixelType.UINT8, new double[2], new double[3]));
		assertThrows(IndexOutOfBoundsException.class, () -> matrix.getValue(3, 0));
	}

	@Test
	public void test_immutable() {
		double[] values = {1, 2, 3, 4};
		var matrix = PixelMatrix.createInstance(2, 2, PixelType.INT16, values);
		values[0] = 100;
		assertEquals(1, matrix.getValue(0, 0));
		matrix.getValues()[1] = 100;
		assertEquals(2, matrix.getValue(1, 0));

		var mapped = matrix.map(v -> v * 2, PixelType.INT16);
		assertArrayEquals(new double[] {2, 4, 6, 8}, mapped.getValues());
		assertArrayEquals(new double[] {1, 2, 3, 4}, matrix.getValues());
		assertNotEquals(matrix, mapped);
	}

	@Test
	public void test_minMax() {
		var matrix = PixelMatrix.fromRows(PixelType.INT16, new double[] {5, -20}, new double[] {300, 0});
		assertEquals(-20, matrix.getMinValue());
		assertEquals(300, matrix.getMaxValue());
	}

	@Test
	public void test_cast() {
		assertEquals(255, PixelType.UINT8.cast(1000));
		assertEquals(0, PixelType.UINT8.cast(-5));
		assertEquals(2, PixelType.UINT8.cast(2.9));
		assertEquals(-2, PixelType.INT16.cast(-2.9));
		assertEquals(-32768, PixelType.INT16.cast(-1e6));
		assertEquals(0, PixelType.INT32.cast(Double.NaN));
		assertEquals(4294967295.0, PixelType.UINT32.cast(1e12));
		assertEquals(0.5, PixelType.FLOAT64.cast(0.5));
		assertEquals((double)(float)0.1, PixelType.FLOAT32.cast(0.1));

		var matrix = PixelMatrix.createInstance(2, 1, PixelType.UINT8, new double[] {-1, 256.5});
		assertArrayEquals(new double[] {0, 255}, matrix.getValues());
	}

	@Test
	public void test_forIntegerBits() {
		assertEquals(PixelType.UINT8, PixelType.forIntegerBits(8, false));
		assertEquals(PixelType.INT8, PixelType.forIntegerBits(8, true));
		assertEquals(PixelType.UINT16, PixelType.forIntegerBits(16, false));
		assertEquals(PixelType.INT16, PixelType.forIntegerBits(16, true));
		assertEquals(PixelType.INT32, PixelType.forIntegerBits(32, true));
		assertThrows(IllegalArgumentException.class, () -> PixelType.forIntegerBits(12, false));

		assertEquals(16, PixelType.INT16.getBitsPerPixel());
		assertEquals(-32768, PixelType.INT16.getLowerBound());
		assertEquals(65535, PixelType.UINT16.getUpperBound());
	}

	@Test
	public void test_metadataBuilder() {
		var lut = LookupTable.createInstance(0, 8, 1, 2);
		var metadata = new ImageMetadata.Builder()
				.name("image")
				.size(4, 3)
				.bits(16, 12)
				.signed(true)
				.rescale(new RescaleParameters(1, -1024))
				.lookupTable(lut)
				.build();
		var copy = new ImageMetadata.Builder(metadata)
				.rescale(null)
				.build();
		assertEquals("image", copy.getName());
		assertEquals(4, copy.getWidth());
		assertEquals(3, copy.getHeight());
		assertEquals(12, copy.getBitsStored());
		assertEquals(lut, copy.getLookupTable().orElseThrow());
		assertEquals(new RescaleParameters(1, -1024), metadata.getRescale().orElseThrow());
		assertEquals(true, copy.getRescale().isEmpty());
	}

}
