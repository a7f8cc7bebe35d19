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

/**
 * A lookup table mapping a contiguous range of integer input values to output values,
 * as used for VOI (windowing) presets.
 * <p>
 * The descriptor values (entry count, first mapped value and bit depth) are retained exactly
 * as they were read, so that inconsistencies with the table data can be reported when the
 * table is applied.
 */
public final class LookupTable {

	private final int firstValue;
	private final int count;
	private final int bitDepth;
	private final int[] data;

	private LookupTable(int firstValue, int count, int bitDepth, int[] data) {
		this.firstValue = firstValue;
		this.count = count;
		this.bitDepth = bitDepth;
		this.data = data;
	}

	/**
	 * Create a lookup table.
	 * @param firstValue the first input value that is mapped through the table
	 * @param count number of entries, as given by the descriptor
	 * @param bitDepth number of bits used by output values
	 * @param data output values, one per input value from {@code firstValue} to {@code firstValue + count - 1}
	 * @return
	 */
	public static LookupTable createInstance(int firstValue, int count, int bitDepth, int[] data) {
		Objects.requireNonNull(data, "data");
		return new LookupTable(firstValue, count, bitDepth, data.clone());
	}

	/**
	 * Create a lookup table where the count is the length of the data.
	 * @param firstValue
	 * @param bitDepth
	 * @param data
	 * @return
	 */
	public static LookupTable createInstance(int firstValue, int bitDepth, int... data) {
		return createInstance(firstValue, data.length, bitDepth, data);
	}

	/**
	 * First input value mapped by the table.
	 * @return
	 */
	public int getFirstValue() {
		return firstValue;
	}

	/**
	 * Number of entries declared by the descriptor.
	 * @return
	 */
	public int getCount() {
		return count;
	}

	/**
	 * Number of bits of each output value.
	 * @return
	 */
	public int getBitDepth() {
		return bitDepth;
	}

	/**
	 * Number of output values actually present.
	 * @return
	 */
	public int size() {
		return data.length;
	}

	/**
	 * Get the output value at the specified index.
	 * @param index
	 * @return
	 */
	public int getEntry(int index) {
		return data[index];
	}

	/**
	 * Get a copy of all output values.
	 * @return
	 */
	public int[] getData() {
		return data.clone();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof LookupTable))
			return false;
		LookupTable other = (LookupTable)obj;
		return firstValue == other.firstValue && count == other.count && bitDepth == other.bitDepth && Arrays.equals(data, other.data);
	}

	@Override
	public int hashCode() {
		return Objects.hash(firstValue, count, bitDepth, Arrays.hashCode(data));
	}

	@Override
	public String toString() {
		return "LookupTable [first=" + firstValue + ", count=" + count + ", bits=" + bitDepth + "]";
	}

}
