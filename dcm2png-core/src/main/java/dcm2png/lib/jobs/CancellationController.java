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

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aborts every job of the current batch of a {@link ConversionDispatcher}, and allows callers to wait
 * until no job is running.
 * <p>
 * An abort cancels pending jobs immediately, and signals active jobs to stop at their next checkpoint.
 * Active jobs that have already passed their last checkpoint may still complete successfully.
 * While an abort is in progress the dispatcher rejects new submissions; the flag is cleared once the
 * batch completes.
 */
public class CancellationController {

	private static final Logger logger = LoggerFactory.getLogger(CancellationController.class);

	private final ConversionDispatcher dispatcher;
	private final JobRegistry registry;

	private volatile boolean abortRequested = false;

	CancellationController(ConversionDispatcher dispatcher, JobRegistry registry) {
		this.dispatcher = dispatcher;
		this.registry = registry;
	}

	/**
	 * Request that all pending and active jobs are aborted.
	 * @return true if an abort was started, false if there was nothing to abort or an abort is already in progress
	 */
	public boolean requestAbort() {
		synchronized (registry) {
			if (abortRequested) {
				logger.debug("Abort already in progress");
				return false;
			}
			if (registry.isEmpty()) {
				logger.debug("Abort requested, but no conversions are running");
				return false;
			}
			dispatcher.statusMessage("Stopping in-progress conversions...");
			for (var job : registry.getActiveJobs()) {
				if (job.getCancellationToken().cancel())
					dispatcher.statusMessage("[!]: Cancelling conversion for \"" + job.getDisplayName() + "\"");
			}
			// Set before aborting pending jobs, since that may complete the batch and clear the flag
			abortRequested = true;
			dispatcher.abortPendingJobs();
			return true;
		}
	}

	/**
	 * Query whether an abort is in progress.
	 * @return
	 */
	public boolean isAbortRequested() {
		return abortRequested;
	}

	/**
	 * Block until no job is active.
	 * @throws InterruptedException
	 * @throws IllegalStateException if called from the dispatcher's own coordination thread
	 */
	public void waitForQuiescence() throws InterruptedException {
		waitForQuiescence(-1, TimeUnit.MILLISECONDS);
	}

	/**
	 * Block until no job is active, or the timeout elapses.
	 * @param timeout maximum time to wait; a negative value waits indefinitely
	 * @param unit
	 * @return true if no job is active, false if the timeout elapsed first
	 * @throws InterruptedException
	 * @throws IllegalStateException if called from the dispatcher's own coordination thread
	 */
	public boolean waitForQuiescence(long timeout, TimeUnit unit) throws InterruptedException {
		if (dispatcher.isCoordinationThread(Thread.currentThread()))
			throw new IllegalStateException("Cannot wait for quiescence on the dispatcher thread");
		return registry.awaitNoActive(timeout, unit);
	}

	void batchCompleted() {
		abortRequested = false;
	}

}
