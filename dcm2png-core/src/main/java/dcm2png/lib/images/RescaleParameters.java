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
 * Linear rescale applied to stored pixel values: {@code output = input * slope + intercept}.
 *
 * @param slope
 * @param intercept
 */
public record RescaleParameters(double slope, double intercept) {

	/**
	 * Rescale parameters that leave values unchanged.
	 */
	public static final RescaleParameters IDENTITY = new RescaleParameters(1.0, 0.0);

	/**
	 * Apply the rescale to a single value.
	 * @param value
	 * @return
	 */
	public double apply(double value) {
		return value * slope + intercept;
	}

	/**
	 * Returns true if applying these parameters cannot change any value.
	 * @return
	 */
	public boolean isIdentity() {
		return slope == 1.0 && intercept == 0.0;
	}

}
