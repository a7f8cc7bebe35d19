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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import dcm2png.lib.jobs.BatchSummary;
import dcm2png.lib.jobs.JobCounts;

@SuppressWarnings("javadoc")
public class TestCommandLineConversionMonitor {

	@Test
	public void test_awaitCompletion() throws InterruptedException {
		var monitor = new CommandLineConversionMonitor();
		monitor.countsChanged(new JobCounts(2, 1, 0));
		monitor.statusMessage("Starting conversion");
		assertNull(monitor.awaitCompletion(10, TimeUnit.MILLISECONDS));

		var summary = new BatchSummary(2, 1, 0);
		monitor.batchCompleted(summary);
		assertEquals(summary, monitor.awaitCompletion());
		assertEquals(summary, monitor.awaitCompletion(10, TimeUnit.MILLISECONDS));
	}

}
