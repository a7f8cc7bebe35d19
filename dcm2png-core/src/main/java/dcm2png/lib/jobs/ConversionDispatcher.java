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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dcm2png.lib.common.GeneralTools;
import dcm2png.lib.common.ThreadTools;
import dcm2png.lib.images.readers.ImageReader;
import dcm2png.lib.images.writers.ImageWriter;

/**
 * Accepts batches of conversion requests and runs them with a bounded number of concurrent workers.
 * <p>
 * Jobs start in submission order, and no more than {@link #getMaxConcurrency()} jobs are active at any time.
 * When a worker finishes, its outcome is received on a single coordination thread, which records the
 * terminal state, notifies listeners and starts the next pending job. Once no job is pending or active,
 * listeners are told that the batch is complete.
 * <p>
 * All state changes happen while holding the lock of the internal {@link JobRegistry}.
 * Use {@link #getCancellationController()} to abort a batch.
 */
public class ConversionDispatcher implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ConversionDispatcher.class);

	private final ImageReader reader;
	private final ImageWriter writer;
	private final int maxConcurrency;

	private final JobRegistry registry = new JobRegistry();
	private final CancellationController cancellationController;
	private final List<ConversionListener> listeners = new CopyOnWriteArrayList<>();

	private ExecutorService pool;
	private CompletionService<JobOutcome> service;
	private Thread coordinationThread;

	private long jobCounter = 0;
	private boolean closed = false;

	private int nDone = 0;
	private int nFailed = 0;
	private int nAborted = 0;

	/**
	 * Constructor for a dispatcher that uses the default number of workers, read from
	 * {@link ThreadTools#getParallelism()}.
	 * @param reader reader used to decode every source
	 * @param writer writer used to write every output
	 */
	public ConversionDispatcher(ImageReader reader, ImageWriter writer) {
		this(reader, writer, ThreadTools.getParallelism());
	}

	/**
	 * Constructor for a dispatcher with a fixed number of workers.
	 * @param reader reader used to decode every source
	 * @param writer writer used to write every output
	 * @param maxConcurrency maximum number of jobs that may be active at once; must be at least 1
	 */
	public ConversionDispatcher(ImageReader reader, ImageWriter writer, int maxConcurrency) {
		this.reader = Objects.requireNonNull(reader, "reader");
		this.writer = Objects.requireNonNull(writer, "writer");
		if (maxConcurrency < 1)
			throw new IllegalArgumentException("Concurrency limit must be at least 1, but was " + maxConcurrency);
		this.maxConcurrency = maxConcurrency;
		this.cancellationController = new CancellationController(this, registry);
	}

	/**
	 * Maximum number of jobs that may be active at once.
	 * @return
	 */
	public int getMaxConcurrency() {
		return maxConcurrency;
	}

	/**
	 * Get the controller used to abort the current batch.
	 * @return
	 */
	public CancellationController getCancellationController() {
		return cancellationController;
	}

	/**
	 * Add a listener to receive progress notifications.
	 * @param listener
	 */
	public void addListener(ConversionListener listener) {
		listeners.add(Objects.requireNonNull(listener));
	}

	/**
	 * Remove a previously-added listener.
	 * @param listener
	 */
	public void removeListener(ConversionListener listener) {
		listeners.remove(listener);
	}

	/**
	 * Submit a batch of conversions.
	 * <p>
	 * The whole batch is rejected if any source occurs more than once, or is already pending or active.
	 * Otherwise every request is registered as a pending job and as many as possible are started immediately.
	 * Submitting an empty batch when nothing is running reports a completed, empty batch.
	 *
	 * @param specs the conversions to perform, in the order they should be started
	 * @return the new jobs, in submission order
	 * @throws DuplicateSourceException if a source is duplicated
	 * @throws IllegalStateException if an abort is in progress, or the dispatcher has been closed
	 */
	public List<ConversionJob> submit(Collection<JobSpec> specs) throws DuplicateSourceException {
		Objects.requireNonNull(specs, "specs");
		synchronized (registry) {
			if (closed)
				throw new IllegalStateException("Dispatcher has been closed");
			if (cancellationController.isAbortRequested())
				throw new IllegalStateException("Cannot submit conversions while an abort is in progress");

			checkDuplicates(specs);

			if (specs.isEmpty()) {
				logger.debug("Empty batch submitted");
				if (registry.isEmpty())
					completeBatch();
				return Collections.emptyList();
			}

			ensurePool();
			statusMessage("Processing " + specs.size() + " new " + (specs.size() == 1 ? "file" : "files") + "...");
			var jobs = new ArrayList<ConversionJob>(specs.size());
			for (var spec : specs) {
				var job = createJob(spec);
				registry.addPending(job);
				jobs.add(job);
			}
			fireCountsChanged();
			dispatch();
			return jobs;
		}
	}

	private void checkDuplicates(Collection<JobSpec> specs) {
		var seen = new LinkedHashSet<Path>();
		var duplicates = new LinkedHashSet<Path>();
		for (var spec : specs) {
			var path = JobRegistry.normalize(spec.source());
			if (!seen.add(path) || registry.containsSource(path))
				duplicates.add(path);
		}
		if (!duplicates.isEmpty()) {
			var e = new DuplicateSourceException(duplicates);
			logger.warn("Batch rejected: {}", e.getLocalizedMessage());
			throw e;
		}
	}

	private ConversionJob createJob(JobSpec spec) {
		String id = "job-" + (++jobCounter);
		String name = GeneralTools.getNameWithoutExtension(spec.source()) + "." + writer.getDefaultExtension();
		var output = spec.outputDirectory().resolve(name);
		return new ConversionJob(id, spec.source(), output, spec.displayName());
	}

	private void ensurePool() {
		if (pool == null) {
			pool = Executors.newFixedThreadPool(maxConcurrency, ThreadTools.createThreadFactory("conversion-worker-", true));
			logger.debug("New threadpool created with {} threads", maxConcurrency);
			service = new ExecutorCompletionService<>(pool);
			coordinationThread = ThreadTools.createThreadFactory("conversion-dispatcher", true).newThread(this::drainCompletions);
			coordinationThread.start();
		}
	}

	/**
	 * Start pending jobs until the concurrency limit is reached or nothing is pending.
	 */
	private void dispatch() {
		synchronized (registry) {
			while (registry.nActive() < maxConcurrency) {
				var job = registry.pollPending();
				if (job == null)
					break;
				job.setState(JobState.ACTIVE);
				Future<JobOutcome> future = service.submit(new ConversionWorker(job, reader, writer));
				registry.addActive(job, future);
				statusMessage("Starting conversion for \"" + job.getDisplayName() + "\"");
				for (var listener : listeners) {
					try {
						listener.jobStarted(job);
					} catch (RuntimeException e) {
						logger.warn("Listener error: {}", e.getLocalizedMessage(), e);
					}
				}
			}
			fireCountsChanged();
		}
	}

	private void drainCompletions() {
		while (!Thread.currentThread().isInterrupted()) {
			Future<JobOutcome> future;
			try {
				future = service.take();
			} catch (InterruptedException e) {
				logger.debug("Dispatcher thread interrupted");
				Thread.currentThread().interrupt();
				break;
			}
			handleCompletion(future);
		}
	}

	private void handleCompletion(Future<JobOutcome> future) {
		String id = registry.findActiveId(future);
		if (id == null) {
			logger.warn("Received a result for a job that is not active");
			return;
		}
		JobOutcome outcome;
		try {
			outcome = future.get();
		} catch (ExecutionException e) {
			var cause = e.getCause() == null ? e : e.getCause();
			logger.error("Error running conversion {}: {}", id, cause.getLocalizedMessage(), cause);
			outcome = JobOutcome.failed("Unexpected error: " + cause.getLocalizedMessage(), cause);
		} catch (CancellationException e) {
			outcome = JobOutcome.aborted("[interrupted]");
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			outcome = JobOutcome.failed("Interrupted while retrieving result", e);
		}
		onJobFinished(id, outcome);
	}

	/**
	 * Record the terminal outcome of an active job, start the next pending job and complete the batch if
	 * nothing remains. Outcomes for jobs that are not active are ignored, so each job finishes exactly once.
	 * @param id
	 * @param outcome
	 */
	void onJobFinished(String id, JobOutcome outcome) {
		synchronized (registry) {
			var job = registry.removeActive(id);
			if (job == null) {
				logger.warn("Ignoring outcome {} for job {}, which is not active", outcome.state(), id);
				return;
			}
			finishJob(job, outcome);
			dispatch();
			if (registry.isEmpty())
				completeBatch();
		}
	}

	/**
	 * Move every pending job straight to {@link JobState#ABORTED}.
	 */
	void abortPendingJobs() {
		synchronized (registry) {
			for (var job : registry.drainPending())
				finishJob(job, JobOutcome.aborted("[not started]"));
			if (registry.isEmpty())
				completeBatch();
			else
				fireCountsChanged();
		}
	}

	private void finishJob(ConversionJob job, JobOutcome outcome) {
		job.setState(outcome.state());
		String name = job.getDisplayName();
		switch (outcome.state()) {
		case DONE:
			nDone++;
			statusMessage("[OK]: Finished converting \"" + name + "\"");
			break;
		case FAILED:
			nFailed++;
			logger.debug("Conversion of {} failed", job.getSourcePath(), outcome.cause());
			statusMessage("[FAIL]: Failed converting \"" + name + "\": " + outcome.message());
			break;
		case ABORTED:
		default:
			nAborted++;
			statusMessage("[FAIL]: Conversion cancelled \"" + name + "\" " + outcome.message());
			break;
		}
		for (var listener : listeners) {
			try {
				listener.jobFinished(job, outcome);
			} catch (RuntimeException e) {
				logger.warn("Listener error: {}", e.getLocalizedMessage(), e);
			}
		}
		fireCountsChanged();
	}

	private void completeBatch() {
		var summary = new BatchSummary(nDone, nFailed, nAborted);
		nDone = 0;
		nFailed = 0;
		nAborted = 0;
		cancellationController.batchCompleted();
		statusMessage("[DONE]: All conversions finished.");
		logger.info("Batch complete: {} done, {} failed, {} aborted", summary.done(), summary.failed(), summary.aborted());
		for (var listener : listeners) {
			try {
				listener.batchCompleted(summary);
			} catch (RuntimeException e) {
				logger.warn("Listener error: {}", e.getLocalizedMessage(), e);
			}
		}
	}

	void statusMessage(String message) {
		logger.debug(message);
		for (var listener : listeners) {
			try {
				listener.statusMessage(message);
			} catch (RuntimeException e) {
				logger.warn("Listener error: {}", e.getLocalizedMessage(), e);
			}
		}
	}

	private void fireCountsChanged() {
		if (listeners.isEmpty())
			return;
		var counts = getCounts();
		for (var listener : listeners) {
			try {
				listener.countsChanged(counts);
			} catch (RuntimeException e) {
				logger.warn("Listener error: {}", e.getLocalizedMessage(), e);
			}
		}
	}

	/**
	 * Get the number of pending, active and finished jobs in the current batch.
	 * @return
	 */
	public JobCounts getCounts() {
		synchronized (registry) {
			return new JobCounts(registry.nPending(), registry.nActive(), nDone + nFailed + nAborted);
		}
	}

	/**
	 * Get a snapshot of jobs waiting for a worker, in submission order.
	 * @return
	 */
	public List<ConversionJob> getPendingJobs() {
		return registry.getPendingJobs();
	}

	/**
	 * Get a snapshot of jobs currently being converted.
	 * @return
	 */
	public List<ConversionJob> getActiveJobs() {
		return registry.getActiveJobs();
	}

	/**
	 * Returns true if no job is pending or active.
	 * @return
	 */
	public boolean isIdle() {
		return registry.isEmpty();
	}

	boolean isCoordinationThread(Thread thread) {
		synchronized (registry) {
			return thread == coordinationThread;
		}
	}

	/**
	 * Abort any running batch, wait for active jobs to stop and release all threads.
	 * Further submissions are rejected.
	 */
	@Override
	public void close() throws InterruptedException {
		synchronized (registry) {
			if (closed)
				return;
			closed = true;
		}
		cancellationController.requestAbort();
		cancellationController.waitForQuiescence();
		Thread thread;
		synchronized (registry) {
			thread = coordinationThread;
			if (pool != null)
				pool.shutdown();
		}
		if (thread != null) {
			thread.interrupt();
			thread.join(TimeUnit.SECONDS.toMillis(10));
		}
		if (pool != null && !pool.awaitTermination(10, TimeUnit.SECONDS))
			logger.warn("Conversion workers did not terminate");
	}

}
