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
 * Listener for progress of a {@link ConversionDispatcher}.
 * <p>
 * Methods are called while the dispatcher holds its registry lock, either on the thread that
 * submitted or aborted jobs or on the dispatcher's coordination thread. Implementations should
 * return quickly and must not wait for other jobs to finish.
 */
public interface ConversionListener {

	/**
	 * A human-readable status message, e.g. for display in a log window.
	 * @param message
	 */
	default void statusMessage(String message) {}

	/**
	 * A job has been assigned a worker.
	 * @param job
	 */
	default void jobStarted(ConversionJob job) {}

	/**
	 * A job has reached a terminal state. This is called exactly once per job.
	 * @param job
	 * @param outcome
	 */
	default void jobFinished(ConversionJob job, JobOutcome outcome) {}

	/**
	 * The number of pending, active or finished jobs has changed.
	 * @param counts
	 */
	default void countsChanged(JobCounts counts) {}

	/**
	 * Every submitted job has reached a terminal state.
	 * @param summary
	 */
	default void batchCompleted(BatchSummary summary) {}

}
