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
 * Snapshot of the number of jobs in each phase of the current batch, for progress display.
 *
 * @param pending jobs waiting for a worker
 * @param active jobs currently being converted
 * @param finished jobs that have reached a terminal state in the current batch
 */
public record JobCounts(int pending, int active, int finished) {

	/**
	 * Total number of jobs in the current batch.
	 * @return
	 */
	public int total() {
		return pending + active + finished;
	}

}
