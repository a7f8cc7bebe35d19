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

package dcm2png.lib.common;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Collection of generally useful static methods for file names, paths and values.
 */
public final class GeneralTools {

	// Suppressed default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}

	/**
	 * Get the version string from the manifest of the jar containing the specified class,
	 * if available.
	 * @param cls
	 * @return the version, or null if it cannot be found
	 */
	public static String getPackageVersion(Class<?> cls) {
		var pkg = cls.getPackage();
		String version = pkg == null ? null : pkg.getImplementationVersion();
		if (version == null || version.isBlank())
			return null;
		return version.strip();
	}

	/**
	 * Get extension from a filename.
	 * <ul>
	 * <li>This is 'the final dot and beyond', and the dot is included as the first character.</li>
	 * <li>If a dot is the final character, or the name starts with its only dot, then no extension is returned.</li>
	 * <li>The extension is returned in lower case.</li>
	 * </ul>
	 * @param name
	 * @return
	 * @see #getNameWithoutExtension(String)
	 */
	public static Optional<String> getExtension(String name) {
		Objects.requireNonNull(name);
		int ind = name.lastIndexOf(".");
		if (ind <= 0 || ind == name.length() - 1)
			return Optional.empty();
		String ext = name.substring(ind);
		// Check we only have letters, digits or underscores
		if (!ext.matches(".\\w*"))
			return Optional.empty();
		return Optional.of(ext.toLowerCase());
	}

	/**
	 * Get the extension of the file name of a path.
	 * @param path
	 * @return
	 * @see #getExtension(String)
	 */
	public static Optional<String> getExtension(Path path) {
		var fileName = path.getFileName();
		return fileName == null ? Optional.empty() : getExtension(fileName.toString());
	}

	/**
	 * Get the file name with extension removed.
	 * @param name
	 * @return
	 * @see #getExtension(String)
	 */
	public static String getNameWithoutExtension(String name) {
		var ext = getExtension(name).orElse(null);
		return ext == null ? name : name.substring(0, name.length() - ext.length());
	}

	/**
	 * Get the file name of a path with extension removed.
	 * @param path
	 * @return
	 */
	public static String getNameWithoutExtension(Path path) {
		var fileName = path.getFileName();
		return fileName == null ? "" : getNameWithoutExtension(fileName.toString());
	}

	/**
	 * Abbreviate a path for display, retaining only the last {@code length} elements
	 * and prefixing with "...".
	 * Paths with no more than {@code length + 1} elements are returned unchanged.
	 * @param path
	 * @param length number of trailing path elements to retain
	 * @return
	 */
	public static String abbreviatePath(Path path, int length) {
		int n = path.getNameCount();
		if (n <= length + 1)
			return path.toString();
		return Path.of("...", path.subpath(n - length, n).toString()).toString();
	}

	/**
	 * Clip a value to be within a specific range.
	 *
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static double clipValue(final double value, final double min, final double max) {
		if (value < min)
			return min;
		if (value > max)
			return max;
		return value;
	}

	/**
	 * Check if a string is blank, i.e. it is null or its length is 0.
	 * @param s
	 * @param trim If true, any string will be trimmed before its length checked.
	 * @return True if the string is null or empty.
	 */
	public static boolean blankString(final String s, final boolean trim) {
		return s == null || (trim ? s.trim().length() == 0 : s.length() == 0);
	}

}
