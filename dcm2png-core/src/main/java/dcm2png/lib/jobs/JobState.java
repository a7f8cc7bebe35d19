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

/**
 * Lifecycle states of a {@link ConversionJob}.
 * <p>
 * A job starts as {@link #PENDING}, becomes {@link #ACTIVE} when a worker starts it, and ends
 * in exactly one of the terminal states. Pending jobs may also become {@link #ABORTED} directly
 * if the batch is aborted before they start.
 */
public enum JobState {

	/**
	 * Submitted, waiting for a free worker
	 */
	PENDING,
	/**
	 * Being converted by a worker
	 */
	ACTIVE,
	/**
	 * Output written successfully
	 */
	DONE,
	/**
	 * Conversion failed; no output was written
	 */
	FAILED,
	/**
	 * Conversion was cancelled; no output was written
	 */
	ABORTED;

	/**
	 * Returns true if no further state changes are possible.
	 * @return
	 */
	public boolean isTerminal() {
		return this == DONE || this == FAILED || this == ABORTED;
	}

}
