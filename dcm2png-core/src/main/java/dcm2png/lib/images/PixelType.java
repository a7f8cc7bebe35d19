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

/**
 * Pixel bit-depths and types. Decoded DICOM images are usually UINT8, UINT16 or INT16;
 * normalized output is always UINT8.
 */
public enum PixelType {

	/**
	 * 8-bit unsigned integer
	 */
	UINT8(8, PixelValueType.UNSIGNED_INTEGER, 0, 255),
	/**
	 * 8-bit signed integer
	 */
	INT8(8, PixelValueType.SIGNED_INTEGER, Byte.MIN_VALUE, Byte.MAX_VALUE),
	/**
	 * 16-bit unsigned integer
	 */
	UINT16(16, PixelValueType.UNSIGNED_INTEGER, 0, 65535),
	/**
	 * 16-bit signed integer
	 */
	INT16(16, PixelValueType.SIGNED_INTEGER, Short.MIN_VALUE, Short.MAX_VALUE),
	/**
	 * 32-bit unsigned integer
	 */
	UINT32(32, PixelValueType.UNSIGNED_INTEGER, 0, 4294967295L),
	/**
	 * 32-bit signed integer
	 */
	INT32(32, PixelValueType.SIGNED_INTEGER, Integer.MIN_VALUE, Integer.MAX_VALUE),
	/**
	 * 32-bit floating point
	 */
	FLOAT32(32, PixelValueType.FLOATING_POINT, -Float.MAX_VALUE, Float.MAX_VALUE),
	/**
	 * 64-bit floating point
	 */
	FLOAT64(64, PixelValueType.FLOATING_POINT, -Double.MAX_VALUE, Double.MAX_VALUE);

	private final int bitsPerPixel;
	private final PixelValueType type;
	private final double minValue, maxValue;

	private PixelType(int bpp, PixelValueType type, double minValue, double maxValue) {
		this.bitsPerPixel = bpp;
		this.type = type;
		this.minValue = minValue;
		this.maxValue = maxValue;
	}

	/**
	 * Get the integer pixel type for a number of allocated bits and signedness.
	 * @param bitsAllocated 8, 16 or 32
	 * @param signed true for a signed (two's complement) representation
	 * @return
	 * @throws IllegalArgumentException if the number of bits is not supported
	 */
	public static PixelType forIntegerBits(int bitsAllocated, boolean signed) {
		switch (bitsAllocated) {
		case 8:
			return signed ? INT8 : UINT8;
		case 16:
			return signed ? INT16 : UINT16;
		case 32:
			return signed ? INT32 : UINT32;
		default:
			throw new IllegalArgumentException("Unsupported number of bits allocated: " + bitsAllocated);
		}
	}

	/**
	 * Number of bits per pixel.
	 * @return
	 */
	public int getBitsPerPixel() {
		return bitsPerPixel;
	}

	/**
	 * Get the minimum value permitted by this type (may be negative).
	 * @return
	 */
	public double getLowerBound() {
		return minValue;
	}

	/**
	 * Get the maximum value permitted by this type.
	 * @return
	 */
	public double getUpperBound() {
		return maxValue;
	}

	/**
	 * Convert a value computed in double precision back to this representation.
	 * <p>
	 * For integer types the value is truncated toward zero and saturated at the type bounds;
	 * NaN becomes 0. For FLOAT32 the value is rounded to float precision; FLOAT64 values are unchanged.
	 * @param value
	 * @return the value as it would be stored by this type
	 */
	public double cast(double value) {
		switch (type) {
		case FLOATING_POINT:
			return this == FLOAT32 ? (double)(float)value : value;
		case SIGNED_INTEGER:
		case UNSIGNED_INTEGER:
		default:
			if (Double.isNaN(value))
				return 0;
			double truncated = value < 0 ? Math.ceil(value) : Math.floor(value);
			return Math.max(minValue, Math.min(maxValue, truncated));
		}
	}

	/**
	 * Returns true if the type is a signed integer representation.
	 * @return
	 */
	public boolean isSignedInteger() {
		return type == PixelValueType.SIGNED_INTEGER;
	}

	/**
	 * Returns true if the type is an unsigned integer representation.
	 * @return
	 */
	public boolean isUnsignedInteger() {
		return type == PixelValueType.UNSIGNED_INTEGER;
	}

	/**
	 * Returns true if the type is a floating point representation.
	 * @return
	 */
	public boolean isFloatingPoint() {
		return type == PixelValueType.FLOATING_POINT;
	}

	private enum PixelValueType {
		SIGNED_INTEGER, UNSIGNED_INTEGER, FLOATING_POINT;
	}

}
