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

package dcm2png.lib.cli.prefs;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonParseException;

import dcm2png.lib.common.GeneralTools;
import dcm2png.lib.io.GsonTools;

/**
 * Persistent preferences for the converter, stored as JSON.
 * <p>
 * By default the file is {@code ~/.dcm2png.json}; this can be changed with the system property
 * {@value #PREFS_PROPERTY}.
 */
public class ConverterPrefs {

	private static final Logger logger = LoggerFactory.getLogger(ConverterPrefs.class);

	/**
	 * System property used to specify the preferences file.
	 */
	public static final String PREFS_PROPERTY = "dcm2png.prefs";

	private transient Path file;

	private Path outputPath;

	private ConverterPrefs() {}

	/**
	 * Get the preferences file to use, taking into account {@value #PREFS_PROPERTY}.
	 * @return
	 */
	public static Path getDefaultPrefsPath() {
		var property = System.getProperty(PREFS_PROPERTY);
		if (!GeneralTools.blankString(property, true))
			return Paths.get(property);
		return Paths.get(System.getProperty("user.home"), ".dcm2png.json");
	}

	/**
	 * Get the output folder used when none is specified.
	 * @return
	 */
	public static Path getDefaultOutputPath() {
		return Paths.get(System.getProperty("user.home"), "png_files_from_dicom");
	}

	/**
	 * Load preferences from the default file.
	 * @return
	 * @see #getDefaultPrefsPath()
	 */
	public static ConverterPrefs load() {
		return load(getDefaultPrefsPath());
	}

	/**
	 * Load preferences from a file.
	 * If the file does not exist, it is created with default values.
	 * If it cannot be read, the error is logged and default values are used.
	 * @param file
	 * @return
	 */
	public static ConverterPrefs load(Path file) {
		Objects.requireNonNull(file, "file");
		ConverterPrefs prefs = null;
		if (Files.exists(file)) {
			try {
				var json = Files.readString(file, StandardCharsets.UTF_8);
				prefs = GsonTools.getInstance().fromJson(json, ConverterPrefs.class);
			} catch (IOException | JsonParseException e) {
				logger.warn("Unable to read preferences from {}: {}", file, e.getLocalizedMessage());
				logger.debug(e.getLocalizedMessage(), e);
			}
			if (prefs == null)
				prefs = new ConverterPrefs();
			prefs.file = file;
		} else {
			prefs = new ConverterPrefs();
			prefs.file = file;
			try {
				prefs.save();
				logger.info("Created preferences file {}", file);
			} catch (IOException e) {
				logger.warn("Unable to create preferences file {}: {}", file, e.getLocalizedMessage());
			}
		}
		return prefs;
	}

	/**
	 * Write the preferences to the file they were loaded from.
	 * @throws IOException
	 */
	public void save() throws IOException {
		if (outputPath == null)
			outputPath = getDefaultOutputPath();
		var dir = file.toAbsolutePath().getParent();
		if (dir != null)
			Files.createDirectories(dir);
		Files.writeString(file, GsonTools.getInstance(true).toJson(this), StandardCharsets.UTF_8);
		logger.debug("Preferences written to {}", file);
	}

	/**
	 * Folder where converted images are written.
	 * @return
	 */
	public Path getOutputPath() {
		return outputPath == null ? getDefaultOutputPath() : outputPath;
	}

	/**
	 * Set the folder where converted images are written. Call {@link #save()} to persist the change.
	 * @param outputPath
	 */
	public void setOutputPath(Path outputPath) {
		this.outputPath = Objects.requireNonNull(outputPath, "outputPath");
	}

	/**
	 * File used to store the preferences.
	 * @return
	 */
	public Path getFile() {
		return file;
	}

}
