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

package dcm2png.lib.images.writers;

import java.awt.image.BufferedImage;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.Collections;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dcm2png.lib.images.PixelMatrix;
import dcm2png.lib.images.PixelType;

/**
 * ImageWriter implementation to write 8-bit grayscale PNG images using ImageIO.
 * <p>
 * The image is first written to a temporary file in the output directory, flushed to disk
 * and then moved into place, so that the output path only ever contains a complete image.
 */
public class PngWriter implements ImageWriter {

	private static final Logger logger = LoggerFactory.getLogger(PngWriter.class);

	@Override
	public String getName() {
		return "PNG";
	}

	@Override
	public Collection<String> getExtensions() {
		return Collections.singleton("png");
	}

	@Override
	public void writeImage(PixelMatrix pixels, Path path) throws WriteException {
		if (pixels.getPixelType() != PixelType.UINT8)
			throw new IllegalArgumentException("PNG writer requires UINT8 pixels, but got " + pixels.getPixelType());
		var img = createGrayImage(pixels);
		Path dir = path.toAbsolutePath().getParent();
		Path temp = null;
		try {
			temp = Files.createTempFile(dir, "." + path.getFileName().toString(), ".tmp");
			try (var stream = new FileOutputStream(temp.toFile())) {
				if (!ImageIO.write(img, getDefaultExtension(), stream))
					throw new WriteException("Unable to write using ImageIO with extension " + getDefaultExtension());
				stream.flush();
				stream.getChannel().force(true);
			}
			moveIntoPlace(temp, path);
			temp = null;
		} catch (WriteException e) {
			throw e;
		} catch (IOException e) {
			throw new WriteException("Unable to write " + path + ": " + e.getLocalizedMessage(), e);
		} finally {
			if (temp != null)
				deleteQuietly(temp);
		}
	}

	private static void moveIntoPlace(Path temp, Path path) throws IOException {
		try {
			Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			logger.debug("Atomic move not supported for {}, falling back to replace", path);
			Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private static void deleteQuietly(Path temp) {
		try {
			Files.deleteIfExists(temp);
		} catch (IOException e) {
			logger.warn("Unable to delete temporary file {}: {}", temp, e.getLocalizedMessage());
		}
	}

	/**
	 * Create a {@link BufferedImage#TYPE_BYTE_GRAY} image from 8-bit pixels.
	 * @param pixels
	 * @return
	 */
	static BufferedImage createGrayImage(PixelMatrix pixels) {
		int w = pixels.getWidth();
		int h = pixels.getHeight();
		var img = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
		var raster = img.getRaster();
		double[] values = pixels.getValues();
		raster.setSamples(0, 0, w, h, 0, values);
		return img;
	}

}
