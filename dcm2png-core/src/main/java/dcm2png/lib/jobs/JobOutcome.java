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

import java.util.Objects;

/**
 * Terminal result reported by a worker for one job.
 *
 * @param state one of {@link JobState#DONE}, {@link JobState#FAILED} or {@link JobState#ABORTED}
 * @param message human-readable description of the outcome
 * @param cause the exception responsible for a failure; null unless the state is FAILED
 */
public record JobOutcome(JobState state, String message, Throwable cause) {

	/**
	 * Constructor.
	 * @param state
	 * @param message
	 * @param cause
	 */
	public JobOutcome {
		Objects.requireNonNull(state, "state");
		if (!state.isTerminal())
			throw new IllegalArgumentException("Outcome state must be terminal, but was " + state);
	}

	/**
	 * Successful conversion.
	 * @param message
	 * @return
	 */
	public static JobOutcome done(String message) {
		return new JobOutcome(JobState.DONE, message, null);
	}

	/**
	 * Failed conversion.
	 * @param message
	 * @param cause
	 * @return
	 */
	public static JobOutcome failed(String message, Throwable cause) {
		return new JobOutcome(JobState.FAILED, message, cause);
	}

	/**
	 * Cancelled conversion.
	 * @param message
	 * @return
	 */
	public static JobOutcome aborted(String message) {
		return new JobOutcome(JobState.ABORTED, message, null);
	}

}
