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

package dcm2png.lib.jobs;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

/**
 * Exception thrown when a batch contains the same source more than once, or a source that is
 * already pending or being converted. No job of the batch is admitted.
 */
public class DuplicateSourceException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final List<Path> duplicates;

	/**
	 * Constructor.
	 * @param duplicates the source paths found more than once
	 */
	public DuplicateSourceException(Collection<Path> duplicates) {
		super(duplicates.size() == 1 ?
				duplicates.iterator().next() + " added more than once" :
				duplicates.size() + " sources added more than once: " + duplicates);
		this.duplicates = List.copyOf(duplicates);
	}

	/**
	 * Get the duplicated source paths.
	 * @return
	 */
	public List<Path> getDuplicates() {
		return duplicates;
	}

}
