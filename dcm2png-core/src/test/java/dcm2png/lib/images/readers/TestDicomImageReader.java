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

package dcm2png.lib.images.readers;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dcm2png.lib.images.LookupTable;
import dcm2png.lib.images.PixelType;
import dcm2png.lib.images.RescaleParameters;

@SuppressWarnings("javadoc")
public class TestDicomImageReader {

	private final DicomImageReader reader = new DicomImageReader();

	@Test
	public void test_explicitLittleEndian() throws Exception {
		byte[] bytes = DicomBytesBuilder.explicitLittleEndian()
				.image(3, 2, 16, 16, false)
				.pixels16(0, 100, 200, 300, 400, 65535)
				.build();
		var imageData = reader.read(bytes, "explicit.dcm");
		var pixels = imageData.pixels();
		assertEquals(3, pixels.getWidth());
		assertEquals(2, pixels.getHeight());
		assertEquals(PixelType.UINT16, pixels.getPixelType());
		assertArrayEquals(new double[] {0, 100, 200, 300, 400, 65535}, pixels.getValues());
		assertEquals(300, pixels.getValue(0, 1));

		var metadata = imageData.metadata();
		assertEquals("explicit.dcm", metadata.getName());
		assertEquals(16, metadata.getBitsAllocated());
		assertEquals(16, metadata.getBitsStored());
		assertFalse(metadata.isSigned());
		assertEquals("MONOCHROME2", metadata.getPhotometricInterpretation());
		assertTrue(metadata.getRescale().isEmpty());
		assertTrue(metadata.getLookupTable().isEmpty());
	}

	@Test
	public void test_implicitLittleEndian() throws Exception {
		byte[] bytes = DicomBytesBuilder.implicitLittleEndian()
				.image(2, 2, 16, 16, false)
				.pixels16(1, 2, 3, 4)
				.build();
		assertArrayEquals(new double[] {1, 2, 3, 4}, reader.read(bytes, "implicit").pixels().getValues());
	}

	@Test
	public void test_explicitBigEndian() throws Exception {
		byte[] bytes = DicomBytesBuilder.explicitBigEndian()
				.image(2, 1, 16, 16, false)
				.ds(DicomImageReader.RESCALE_SLOPE, "2")
				.pixels16(258, 1000)
				.build();
		var imageData = reader.read(bytes, "big");
		assertArrayEquals(new double[] {258, 1000}, imageData.pixels().getValues());
		assertEquals(new RescaleParameters(2, 0), imageData.metadata().getRescale().orElseThrow());
	}

	@Test
	public void test_datasetWithoutPreamble() throws Exception {
		byte[] explicit = DicomBytesBuilder.explicitLittleEndian()
				.image(2, 1, 8, 8, false)
				.pixels8(7, 250)
				.buildDatasetOnly();
		assertArrayEquals(new double[] {7, 250}, reader.read(explicit, "explicit").pixels().getValues());

		byte[] implicit = DicomBytesBuilder.implicitLittleEndian()
				.image(2, 1, 8, 8, false)
				.pixels8(7, 250)
				.buildDatasetOnly();
		assertArrayEquals(new double[] {7, 250}, reader.read(implicit, "implicit").pixels().getValues());
	}

	@Test
	public void test_signedPixelsWithFewerBitsStored() throws Exception {
		byte[] bytes = DicomBytesBuilder.explicitLittleEndian()
				.image(4, 1, 16, 12, true)
				.pixels16(0x0FFF, 0x0800, 0x07FF, 0xF001)
				.build();
		var imageData = reader.read(bytes, "signed");
		assertEquals(PixelType.INT16, imageData.pixels().getPixelType());
		assertTrue(imageData.metadata().isSigned());
		// High bits beyond those stored are ignored
		assertArrayEquals(new double[] {-1, -2048, 2047, 1}, imageData.pixels().getValues());
	}

	@Test
	public void test_rescaleAndLookupTable() throws Exception {
		byte[] bytes = DicomBytesBuilder.explicitLittleEndian()
				.image(2, 1, 16, 16, false)
				.ds(DicomImageReader.RESCALE_INTERCEPT, "-1024")
				.ds(DicomImageReader.RESCALE_SLOPE, "1.5")
				.voiLut(3, 10, 8, 0, 128, 255)
				.pixels16(0, 1)
				.build();
		var metadata = reader.read(bytes, "lut").metadata();
		assertEquals(new RescaleParameters(1.5, -1024), metadata.getRescale().orElseThrow());
		assertEquals(LookupTable.createInstance(10, 3, 8, new int[] {0, 128, 255}), metadata.getLookupTable().orElseThrow());
	}

	@Test
	public void test_lookupTableImplicit() throws Exception {
		byte[] bytes = DicomBytesBuilder.implicitLittleEndian()
				.image(1, 1, 16, 16, false)
				.voiLut(2, 0, 16, 1000, 2000)
				.pixels16(1)
				.build();
		var lut = reader.read(bytes, "lut").metadata().getLookupTable().orElseThrow();
		assertEquals(2, lut.getCount());
		assertEquals(16, lut.getBitDepth());
		assertArrayEquals(new int[] {1000, 2000}, lut.getData());
	}

	@Test
	public void test_rejectUnsupported() {
		// Multi-frame
		byte[] multiframe = DicomBytesBuilder.explicitLittleEndian()
				.image(1, 1, 16, 16, false)
				.is(DicomImageReader.NUMBER_OF_FRAMES, "2")
				.pixels16(1, 2)
				.build();
		assertThrows(DecodeException.class, () -> reader.read(multiframe, "multiframe"));

		// Color
		byte[] rgb = DicomBytesBuilder.explicitLittleEndian()
				.us(DicomImageReader.SAMPLES_PER_PIXEL, 3)
				.cs(DicomImageReader.PHOTOMETRIC_INTERPRETATION, "RGB")
				.us(DicomImageReader.ROWS, 1)
				.us(DicomImageReader.COLUMNS, 1)
				.us(DicomImageReader.BITS_ALLOCATED, 8)
				.pixels8(1, 2, 3)
				.build();
		assertThrows(DecodeException.class, () -> reader.read(rgb, "rgb"));

		// Compressed
		byte[] jpeg = DicomBytesBuilder.withTransferSyntax("1.2.840.10008.1.2.4.50")
				.image(1, 1, 8, 8, false)
				.pixels8(1)
				.build();
		assertThrows(DecodeException.class, () -> reader.read(jpeg, "jpeg"));

		// No pixel data
		byte[] noPixels = DicomBytesBuilder.explicitLittleEndian()
				.image(1, 1, 8, 8, false)
				.build();
		assertThrows(DecodeException.class, () -> reader.read(noPixels, "empty"));
	}

	@Test
	public void test_rejectTruncated() {
		byte[] tooFewPixels = DicomBytesBuilder.explicitLittleEndian()
				.image(4, 4, 16, 16, false)
				.pixels16(1, 2, 3)
				.build();
		assertThrows(DecodeException.class, () -> reader.read(tooFewPixels, "short"));

		byte[] complete = DicomBytesBuilder.explicitLittleEndian()
				.image(2, 2, 16, 16, false)
				.pixels16(1, 2, 3, 4)
				.build();
		byte[] truncated = Arrays.copyOf(complete, complete.length - 3);
		assertThrows(DecodeException.class, () -> reader.read(truncated, "truncated"));
	}

	@Test
	public void test_readFile(@TempDir Path dir) throws IOException {
		var path = dir.resolve("image.dcm");
		Files.write(path, DicomBytesBuilder.explicitLittleEndian()
				.image(1, 2, 8, 8, false)
				.pixels8(5, 6)
				.build());
		var imageData = reader.read(path);
		assertEquals("image.dcm", imageData.metadata().getName());
		assertArrayEquals(new double[] {5, 6}, imageData.pixels().getValues());

		assertThrows(DecodeException.class, () -> reader.read(dir.resolve("missing.dcm")));

		var notDicom = dir.resolve("notes.txt");
		Files.writeString(notDicom, "This is not a DICOM file");
		assertThrows(DecodeException.class, () -> reader.read(notDicom));
	}

	@Test
	public void test_tagToString() {
		assertEquals("(7FE0,0010)", DicomImageReader.tagToString(DicomImageReader.PIXEL_DATA));
		assertEquals("(0028,3010)", DicomImageReader.tagToString(DicomImageReader.VOI_LUT_SEQUENCE));
	}

}
