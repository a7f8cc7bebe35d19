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

package dcm2png;

import java.io.File;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dcm2png.lib.cli.CommandLineConversionMonitor;
import dcm2png.lib.cli.logging.LogManager;
import dcm2png.lib.cli.logging.LogManager.LogLevel;
import dcm2png.lib.cli.prefs.ConverterPrefs;
import dcm2png.lib.common.GeneralTools;
import dcm2png.lib.images.readers.DicomImageReader;
import dcm2png.lib.images.writers.PngWriter;
import dcm2png.lib.io.SourceCollector;
import dcm2png.lib.jobs.ConversionDispatcher;
import dcm2png.lib.jobs.DuplicateSourceException;
import dcm2png.lib.jobs.JobSpec;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Command line launcher for converting DICOM images to PNG.
 */
@Command(name = "dcm2png", description = {
		"Converts single-frame grayscale DICOM images to normalized 8-bit PNG images.",
		"Folders are searched recursively for .dcm and .dicom files, and files without an extension."},
	footer = {"", "Copyright(c) dcm2png developers"},
	mixinStandardHelpOptions = true, versionProvider = Dcm2Png.VersionProvider.class)
public class Dcm2Png implements Callable<Integer> {

	private static final Logger logger = LoggerFactory.getLogger(Dcm2Png.class);

	/**
	 * Exit code if any conversion failed or was aborted.
	 */
	public static final int EXIT_INCOMPLETE = 1;

	/**
	 * Exit code if the arguments were invalid, e.g. a missing or duplicated source.
	 */
	public static final int EXIT_INVALID_ARGUMENTS = ExitCode.USAGE;

	@Parameters(arity = "1..*", description = "DICOM files or folders to convert.", paramLabel = "paths")
	private List<Path> paths = new ArrayList<>();

	@Option(names = {"-o", "--output"}, description = "Output folder (default = the last saved folder, or ~/png_files_from_dicom).", paramLabel = "dir")
	private Path output;

	@Option(names = {"--save-output"}, description = "Store the output folder as the default for future conversions.")
	private boolean saveOutput;

	@Option(names = {"-t", "--threads"}, description = "Maximum number of images to convert in parallel (default = number of processors).", paramLabel = "n")
	private Integer nThreads;

	@Option(names = {"-l", "--log"}, description = {"Log level (default = INFO).", "Options: ${COMPLETION-CANDIDATES}"} )
	private LogLevel logLevel = LogLevel.INFO;

	@Option(names = {"--log-file"}, description = "Also write log messages to the specified file.", paramLabel = "file")
	private File logFile;

	/**
	 * Main class to launch the converter.
	 *
	 * @param args
	 */
	public static void main(String[] args) {
		int exitCode = run(args);
		if (exitCode != 0)
			logger.debug("Calling System.exit with exit code {}", exitCode);
		System.exit(exitCode);
	}

	/**
	 * Parse the arguments and run the conversion, without calling {@link System#exit(int)}.
	 * @param args
	 * @return the exit code
	 */
	public static int run(String... args) {
		CommandLine cmd = new CommandLine(new Dcm2Png());
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		cmd.setExpandAtFiles(false);
		cmd.setExitCodeExceptionMapper(t -> EXIT_INCOMPLETE);
		return cmd.execute(args);
	}

	@Override
	public Integer call() throws Exception {
		if (logLevel != null)
			LogManager.setRootLogLevel(logLevel);
		if (logFile != null)
			LogManager.logToFile(logFile);

		if (nThreads != null && nThreads < 1) {
			logger.error("Number of threads must be at least 1, but was {}", nThreads);
			return EXIT_INVALID_ARGUMENTS;
		}

		var prefs = ConverterPrefs.load();
		Path outputDir = output == null ? prefs.getOutputPath() : output;
		if (saveOutput) {
			if (output == null)
				logger.warn("--save-output has no effect without --output");
			else {
				prefs.setOutputPath(output.toAbsolutePath().normalize());
				try {
					prefs.save();
					logger.info("Default output folder set to {}", prefs.getOutputPath());
				} catch (IOException e) {
					logger.error("Unable to save preferences to {}: {}", prefs.getFile(), e.getLocalizedMessage());
				}
			}
		}

		List<Path> sources;
		try {
			sources = new SourceCollector().collect(paths);
		} catch (NoSuchFileException e) {
			logger.error("File not found: {}", e.getFile());
			return EXIT_INVALID_ARGUMENTS;
		}
		if (sources.isEmpty()) {
			logger.warn("No DICOM files found in {}", paths);
			return ExitCode.OK;
		}
		logger.info("Writing {} image(s) to {}", sources.size(), outputDir.toAbsolutePath());

		var specs = new ArrayList<JobSpec>(sources.size());
		for (var source : sources)
			specs.add(JobSpec.of(source, outputDir));

		var dispatcher = nThreads == null ?
				new ConversionDispatcher(new DicomImageReader(), new PngWriter()) :
				new ConversionDispatcher(new DicomImageReader(), new PngWriter(), nThreads);
		var monitor = new CommandLineConversionMonitor();
		dispatcher.addListener(monitor);

		Thread shutdownHook = new Thread(() -> abortOnShutdown(dispatcher), "dcm2png-shutdown");
		Runtime.getRuntime().addShutdownHook(shutdownHook);
		try {
			dispatcher.submit(specs);
			var summary = monitor.awaitCompletion();
			return summary.isSuccessful() ? ExitCode.OK : EXIT_INCOMPLETE;
		} catch (DuplicateSourceException e) {
			logger.error(e.getLocalizedMessage());
			return EXIT_INVALID_ARGUMENTS;
		} finally {
			removeShutdownHook(shutdownHook);
			dispatcher.close();
		}
	}

	private static void abortOnShutdown(ConversionDispatcher dispatcher) {
		var controller = dispatcher.getCancellationController();
		if (!controller.requestAbort())
			return;
		logger.warn("Interrupted, stopping conversions...");
		try {
			if (!controller.waitForQuiescence(30, TimeUnit.SECONDS))
				logger.warn("Conversions did not stop within 30 seconds");
		} catch (InterruptedException e) {
			logger.warn("Interrupted while waiting for conversions to stop");
			Thread.currentThread().interrupt();
		}
	}

	private static void removeShutdownHook(Thread hook) {
		try {
			Runtime.getRuntime().removeShutdownHook(hook);
		} catch (IllegalStateException e) {
			// Thrown if the JVM is already shutting down, in which case the hook is running
			logger.debug("Unable to remove shutdown hook: {}", e.getLocalizedMessage());
		}
	}


	static class VersionProvider implements IVersionProvider {

		@Override
		public String[] getVersion() throws Exception {
			var version = GeneralTools.getPackageVersion(Dcm2Png.class);
			if (GeneralTools.blankString(version, true))
				return new String[] {"Unknown dcm2png version!"};
			if (!version.startsWith("v"))
				version = "v" + version;
			return new String[] {"dcm2png " + version};
		}

	}

}
