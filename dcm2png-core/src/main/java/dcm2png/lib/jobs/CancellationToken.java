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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Flag used to request that a job stops at its next checkpoint.
 * <p>
 * Each job has its own token, written by the {@link CancellationController} and read by the worker.
 */
public final class CancellationToken {

	private final AtomicBoolean cancelled = new AtomicBoolean(false);

	/**
	 * Request cancellation.
	 * @return true if this call changed the state, false if cancellation had already been requested
	 */
	public boolean cancel() {
		return cancelled.compareAndSet(false, true);
	}

	/**
	 * Query whether cancellation has been requested.
	 * @return
	 */
	public boolean isCancelled() {
		return cancelled.get();
	}

}
