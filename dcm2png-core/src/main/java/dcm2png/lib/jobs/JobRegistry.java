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
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Bookkeeping of pending and active jobs for a single {@link ConversionDispatcher}.
 * <p>
 * The registry is also the lock that guards every state change of the dispatcher:
 * all methods are synchronized, and callers that need several steps to be atomic
 * synchronize on the registry themselves.
 * A job is never pending and active at the same time.
 */
class JobRegistry {

	private final Map<String, ConversionJob> pending = new LinkedHashMap<>();
	private final Map<String, ActiveJob> active = new LinkedHashMap<>();

	private static class ActiveJob {

		private final ConversionJob job;
		private final Future<JobOutcome> future;

		private ActiveJob(ConversionJob job, Future<JobOutcome> future) {
			this.job = job;
			this.future = future;
		}

	}

	/**
	 * Append a job to the end of the pending queue.
	 * @param job
	 */
	synchronized void addPending(ConversionJob job) {
		if (pending.containsKey(job.getId()) || active.containsKey(job.getId()))
			throw new IllegalStateException("Job " + job.getId() + " is already registered");
		pending.put(job.getId(), job);
	}

	/**
	 * Remove and return the job that has been pending longest.
	 * @return the job, or null if nothing is pending
	 */
	synchronized ConversionJob pollPending() {
		Iterator<ConversionJob> iter = pending.values().iterator();
		if (!iter.hasNext())
			return null;
		var job = iter.next();
		iter.remove();
		return job;
	}

	/**
	 * Remove and return all pending jobs, in submission order.
	 * @return
	 */
	synchronized List<ConversionJob> drainPending() {
		var jobs = new ArrayList<>(pending.values());
		pending.clear();
		return jobs;
	}

	/**
	 * Record that a job is being converted by a worker.
	 * @param job
	 * @param future handle of the running worker
	 */
	synchronized void addActive(ConversionJob job, Future<JobOutcome> future) {
		if (pending.containsKey(job.getId()))
			throw new IllegalStateException("Job " + job.getId() + " is still pending");
		active.put(job.getId(), new ActiveJob(job, future));
	}

	/**
	 * Remove an active job, waking any thread waiting for the active set to empty.
	 * @param id
	 * @return the job, or null if no active job has the id
	 */
	synchronized ConversionJob removeActive(String id) {
		var entry = active.remove(id);
		if (active.isEmpty())
			notifyAll();
		return entry == null ? null : entry.job;
	}

	/**
	 * Find the id of the active job whose worker is represented by the given future.
	 * @param future
	 * @return the id, or null if the future does not belong to an active job
	 */
	synchronized String findActiveId(Future<?> future) {
		for (var entry : active.entrySet()) {
			if (entry.getValue().future == future)
				return entry.getKey();
		}
		return null;
	}

	/**
	 * Get a snapshot of the active jobs.
	 * @return
	 */
	synchronized List<ConversionJob> getActiveJobs() {
		var jobs = new ArrayList<ConversionJob>(active.size());
		for (var entry : active.values())
			jobs.add(entry.job);
		return jobs;
	}

	/**
	 * Get a snapshot of the pending jobs, in submission order.
	 * @return
	 */
	synchronized List<ConversionJob> getPendingJobs() {
		return new ArrayList<>(pending.values());
	}

	/**
	 * Query whether a pending or active job converts the given source.
	 * Paths are compared after conversion to normalized absolute paths.
	 * @param source
	 * @return
	 */
	synchronized boolean containsSource(Path source) {
		var key = normalize(source);
		for (var job : pending.values()) {
			if (normalize(job.getSourcePath()).equals(key))
				return true;
		}
		for (var entry : active.values()) {
			if (normalize(entry.job.getSourcePath()).equals(key))
				return true;
		}
		return false;
	}

	static Path normalize(Path path) {
		return path.toAbsolutePath().normalize();
	}

	synchronized int nPending() {
		return pending.size();
	}

	synchronized int nActive() {
		return active.size();
	}

	/**
	 * Returns true if there are no pending or active jobs.
	 * @return
	 */
	synchronized boolean isEmpty() {
		return pending.isEmpty() && active.isEmpty();
	}

	/**
	 * Wait until there are no active jobs.
	 * @param timeout maximum time to wait, or a negative value to wait indefinitely
	 * @param unit
	 * @return true if the active set is empty, false if the timeout elapsed first
	 * @throws InterruptedException
	 */
	synchronized boolean awaitNoActive(long timeout, TimeUnit unit) throws InterruptedException {
		if (timeout < 0) {
			while (!active.isEmpty())
				wait();
			return true;
		}
		long deadline = System.nanoTime() + unit.toNanos(timeout);
		while (!active.isEmpty()) {
			long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
			if (remainingMillis <= 0)
				return false;
			wait(remainingMillis);
		}
		return true;
	}

}
