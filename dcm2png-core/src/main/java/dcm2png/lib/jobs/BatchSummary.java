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
 * Number of jobs that reached each terminal state, reported when a batch completes.
 *
 * @param done
 * @param failed
 * @param aborted
 */
public record BatchSummary(int done, int failed, int aborted) {

	/**
	 * Total number of jobs in the batch.
	 * @return
	 */
	public int total() {
		return done + failed + aborted;
	}

	/**
	 * Returns true if every job in the batch was converted successfully.
	 * @return
	 */
	public boolean isSuccessful() {
		return failed == 0 && aborted == 0;
	}

}
