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

/**
 * A single conversion submitted to a {@link ConversionDispatcher}.
 * <p>
 * The identifying fields are fixed on creation; only the state changes over the lifetime of the job,
 * and only under the control of the dispatcher.
 */
public final class ConversionJob {

	private final String id;
	private final Path sourcePath;
	private final Path outputPath;
	private final String displayName;
	private final CancellationToken cancellationToken = new CancellationToken();

	private volatile JobState state = JobState.PENDING;

	ConversionJob(String id, Path sourcePath, Path outputPath, String displayName) {
		this.id = id;
		this.sourcePath = sourcePath;
		this.outputPath = outputPath;
		this.displayName = displayName;
	}

	/**
	 * Unique identifier for the job. Identifiers are never reused by the same dispatcher.
	 * @return
	 */
	public String getId() {
		return id;
	}

	/**
	 * Path of the image to convert.
	 * @return
	 */
	public Path getSourcePath() {
		return sourcePath;
	}

	/**
	 * Path where the converted image will be written.
	 * @return
	 */
	public Path getOutputPath() {
		return outputPath;
	}

	/**
	 * Name to show in status messages.
	 * @return
	 */
	public String getDisplayName() {
		return displayName;
	}

	/**
	 * Current state.
	 * @return
	 */
	public JobState getState() {
		return state;
	}

	void setState(JobState state) {
		this.state = state;
	}

	CancellationToken getCancellationToken() {
		return cancellationToken;
	}

	/**
	 * Query whether cancellation has been requested for this job.
	 * @return
	 */
	public boolean isCancellationRequested() {
		return cancellationToken.isCancelled();
	}

	@Override
	public String toString() {
		return "ConversionJob [" + id + ", " + displayName + ", " + state + "]";
	}

}
