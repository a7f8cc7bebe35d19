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

import java.io.IOException;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dcm2png.lib.images.readers.DecodeException;
import dcm2png.lib.images.readers.ImageReader;
import dcm2png.lib.images.transforms.PixelTransforms;
import dcm2png.lib.images.transforms.TransformException;
import dcm2png.lib.images.writers.ImageWriter;
import dcm2png.lib.images.writers.WriteException;

/**
 * Converts the source of a single {@link ConversionJob}.
 * <p>
 * The worker checks the job's cancellation token at fixed checkpoints between the expensive steps,
 * and returns a {@link JobOutcome} instead of throwing. If cancellation is observed at any checkpoint,
 * nothing is written to the output path.
 */
class ConversionWorker implements Callable<JobOutcome> {

	private static final Logger logger = LoggerFactory.getLogger(ConversionWorker.class);

	/**
	 * Points at which a worker checks whether it should stop.
	 */
	enum Checkpoint {
		BEFORE_DECODE,
		AFTER_DECODE,
		AFTER_RESCALE_AND_LUT,
		AFTER_NORMALIZE,
		BEFORE_WRITE;

		/**
		 * Index of the checkpoint, as shown in status messages.
		 * @return
		 */
		int getIndex() {
			return ordinal();
		}
	}

	private final ConversionJob job;
	private final ImageReader reader;
	private final ImageWriter writer;
	private final Consumer<Checkpoint> checkpointObserver;

	ConversionWorker(ConversionJob job, ImageReader reader, ImageWriter writer) {
		this(job, reader, writer, checkpoint -> {});
	}

	/**
	 * Create a worker that notifies an observer whenever a checkpoint is reached,
	 * immediately before the cancellation token is checked.
	 * @param job
	 * @param reader
	 * @param writer
	 * @param checkpointObserver
	 */
	ConversionWorker(ConversionJob job, ImageReader reader, ImageWriter writer, Consumer<Checkpoint> checkpointObserver) {
		this.job = job;
		this.reader = reader;
		this.writer = writer;
		this.checkpointObserver = checkpointObserver;
	}

	@Override
	public JobOutcome call() {
		try {
			return convert();
		} catch (Exception e) {
			logger.error("Unexpected error converting {}: {}", job.getSourcePath(), e.getLocalizedMessage(), e);
			return JobOutcome.failed("Unexpected error: " + e.getLocalizedMessage(), e);
		}
	}

	private JobOutcome convert() {
		var outputPath = job.getOutputPath();
		var dir = outputPath.toAbsolutePath().getParent();
		try {
			if (dir != null)
				Files.createDirectories(dir);
		} catch (IOException e) {
			return JobOutcome.failed("Unable to create output directory " + dir + ": " + e.getLocalizedMessage(),
					new WriteException("Unable to create " + dir, e));
		}

		if (isCancelled(Checkpoint.BEFORE_DECODE))
			return aborted(Checkpoint.BEFORE_DECODE);

		try {
			var imageData = reader.read(job.getSourcePath());
			logger.debug("Read {}", imageData.metadata());
			if (isCancelled(Checkpoint.AFTER_DECODE))
				return aborted(Checkpoint.AFTER_DECODE);

			imageData = PixelTransforms.applyRescaleAndLookupTable(imageData);
			if (isCancelled(Checkpoint.AFTER_RESCALE_AND_LUT))
				return aborted(Checkpoint.AFTER_RESCALE_AND_LUT);

			var displayPixels = PixelTransforms.normalizeToUint8(imageData.pixels());
			if (isCancelled(Checkpoint.AFTER_NORMALIZE))
				return aborted(Checkpoint.AFTER_NORMALIZE);

			if (isCancelled(Checkpoint.BEFORE_WRITE))
				return aborted(Checkpoint.BEFORE_WRITE);
			writer.writeImage(displayPixels, outputPath);
			return JobOutcome.done("Written to " + outputPath);
		} catch (DecodeException e) {
			return JobOutcome.failed("Unable to read " + job.getSourcePath() + ": " + e.getLocalizedMessage(), e);
		} catch (TransformException e) {
			return JobOutcome.failed("Unable to transform pixels: " + e.getLocalizedMessage(), e);
		} catch (WriteException e) {
			return JobOutcome.failed("Unable to write " + outputPath + ": " + e.getLocalizedMessage(), e);
		}
	}

	private boolean isCancelled(Checkpoint checkpoint) {
		checkpointObserver.accept(checkpoint);
		if (job.getCancellationToken().isCancelled()) {
			logger.debug("Cancellation of {} observed at checkpoint {}", job.getId(), checkpoint);
			return true;
		}
		return false;
	}

	private static JobOutcome aborted(Checkpoint checkpoint) {
		return JobOutcome.aborted("[" + checkpoint.getIndex() + "]");
	}

}
