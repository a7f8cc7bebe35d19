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

import java.util.Arrays;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * An immutable 2D grid of single-channel pixel values.
 * <p>
 * Values are stored in row-major order as doubles, but always represent values permitted by
 * the matrix {@link PixelType}. Transforms create new instances rather than modifying existing ones.
 */
public final class PixelMatrix {

	private final int width;
	private final int height;
	private final PixelType pixelType;
	private final double[] values;

	private PixelMatrix(int width, int height, PixelType pixelType, double[] values) {
		this.width = width;
		this.height = height;
		this.pixelType = pixelType;
		this.values = values;
	}

	/**
	 * Create a matrix from row-major values.
	 * Values are cast to the pixel type using {@link PixelType#cast(double)}.
	 * @param width
	 * @param height
	 * @param pixelType
	 * @param values row-major values; the array is copied
	 * @return
	 * @throws IllegalArgumentException if the dimensions are not positive or do not match the number of values
	 */
	public static PixelMatrix createInstance(int width, int height, PixelType pixelType, double[] values) {
		Objects.requireNonNull(pixelType, "pixelType");
		Objects.requireNonNull(values, "values");
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Matrix dimensions must be positive, but were " + width + "x" + height);
		if ((long)width * height != values.length)
			throw new IllegalArgumentException("Expected " + ((long)width * height) + " values for a " + width + "x" + height + " matrix, but got " + values.length);
		double[] copy = new double[values.length];
		for (int i = 0; i < values.length; i++)
			copy[i] = pixelType.cast(values[i]);
		return new PixelMatrix(width, height, pixelType, copy);
	}

	/**
	 * Create a matrix from an array of rows. All rows must have the same length.
	 * @param pixelType
	 * @param rows
	 * @return
	 */
	public static PixelMatrix fromRows(PixelType pixelType, double[]... rows) {
		if (rows.length == 0)
			throw new IllegalArgumentException("At least one row is required");
		int w = rows[0].length;
		double[] values = new double[w * rows.length];
		for (int y = 0; y < rows.length; y++) {
			if (rows[y].length != w)
				throw new IllegalArgumentException("Row " + y + " has length " + rows[y].length + ", expected " + w);
			System.arraycopy(rows[y], 0, values, y * w, w);
		}
		return createInstance(w, rows.length, pixelType, values);
	}

	/**
	 * Width of the matrix, in pixels.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Height of the matrix, in pixels.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Total number of pixels.
	 * @return
	 */
	public int nPixels() {
		return values.length;
	}

	/**
	 * Pixel type of the stored values.
	 * @return
	 */
	public PixelType getPixelType() {
		return pixelType;
	}

	/**
	 * Get a single value.
	 * @param x column index
	 * @param y row index
	 * @return
	 */
	public double getValue(int x, int y) {
		if (x < 0 || x >= width || y < 0 || y >= height)
			throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") is outside a " + width + "x" + height + " matrix");
		return values[y * width + x];
	}

	/**
	 * Get a copy of all values, in row-major order.
	 * @return
	 */
	public double[] getValues() {
		return values.clone();
	}

	/**
	 * Get a copy of the values as an array of rows.
	 * @return
	 */
	public double[][] toRows() {
		double[][] rows = new double[height][];
		for (int y = 0; y < height; y++)
			rows[y] = Arrays.copyOfRange(values, y * width, (y + 1) * width);
		return rows;
	}

	/**
	 * Minimum value in the matrix.
	 * @return
	 */
	public double getMinValue() {
		double min = Double.POSITIVE_INFINITY;
		for (double v : values) {
			if (v < min)
				min = v;
		}
		return min;
	}

	/**
	 * Maximum value in the matrix.
	 * @return
	 */
	public double getMaxValue() {
		double max = Double.NEGATIVE_INFINITY;
		for (double v : values) {
			if (v > max)
				max = v;
		}
		return max;
	}

	/**
	 * Create a new matrix of the same size by applying an operator to every value.
	 * The result of the operator is cast to the output type.
	 * @param op
	 * @param outputType
	 * @return
	 */
	public PixelMatrix map(DoubleUnaryOperator op, PixelType outputType) {
		double[] output = new double[values.length];
		for (int i = 0; i < values.length; i++)
			output[i] = outputType.cast(op.applyAsDouble(values[i]));
		return new PixelMatrix(width, height, outputType, output);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof PixelMatrix))
			return false;
		PixelMatrix other = (PixelMatrix)obj;
		return width == other.width && height == other.height && pixelType == other.pixelType && Arrays.equals(values, other.values);
	}

	@Override
	public int hashCode() {
		return Objects.hash(width, height, pixelType, Arrays.hashCode(values));
	}

	@Override
	public String toString() {
		return "PixelMatrix [" + width + "x" + height + ", " + pixelType + "]";
	}

}
