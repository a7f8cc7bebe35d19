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

package dcm2png.lib.cli;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dcm2png.lib.jobs.BatchSummary;
import dcm2png.lib.jobs.ConversionJob;
import dcm2png.lib.jobs.ConversionListener;
import dcm2png.lib.jobs.JobCounts;
import dcm2png.lib.jobs.JobOutcome;

/**
 * Listener that logs conversion progress for a single batch, and allows the caller to wait for it to complete.
 */
public class CommandLineConversionMonitor implements ConversionListener {

	private static final Logger logger = LoggerFactory.getLogger(CommandLineConversionMonitor.class);

	private final long startTime = System.currentTimeMillis();
	private final CountDownLatch latch = new CountDownLatch(1);

	private volatile BatchSummary summary;
	private int maxTotal = 0;
	private int finished = 0;
	private String lastMessage;

	@Override
	public void statusMessage(String message) {
		logger.info(message);
	}

	@Override
	public synchronized void countsChanged(JobCounts counts) {
		// Aborted pending jobs count as finished, so the total only grows until the batch completes
		maxTotal = Math.max(maxTotal, counts.total());
	}

	@Override
	public synchronized void jobFinished(ConversionJob job, JobOutcome outcome) {
		finished++;
		int total = Math.max(maxTotal, finished);
		int progressPercent = (int)((double)finished / total * 100 + .5);
		String newMessage = "Converted " + finished + "/" + total + " (" + progressPercent + "%)";
		if (!newMessage.equals(lastMessage))
			logger.info(newMessage);
		lastMessage = newMessage;
	}

	@Override
	public synchronized void batchCompleted(BatchSummary summary) {
		this.summary = summary;
		maxTotal = 0;
		finished = 0;
		logger.info(String.format("Processing complete in %.2f seconds: %d done, %d failed, %d aborted",
				(System.currentTimeMillis() - startTime)/1000.0, summary.done(), summary.failed(), summary.aborted()));
		latch.countDown();
	}

	/**
	 * Wait for the batch to complete.
	 * @return a summary of the batch
	 * @throws InterruptedException
	 */
	public BatchSummary awaitCompletion() throws InterruptedException {
		latch.await();
		return summary;
	}

	/**
	 * Wait for the batch to complete, up to a timeout.
	 * @param timeout
	 * @param unit
	 * @return a summary of the batch, or null if the timeout elapsed first
	 * @throws InterruptedException
	 */
	public BatchSummary awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
		if (latch.await(timeout, unit))
			return summary;
		return null;
	}

}
