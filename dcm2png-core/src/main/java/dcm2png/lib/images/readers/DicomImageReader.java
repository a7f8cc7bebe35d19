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

import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dcm2png.lib.common.LogTools;
import dcm2png.lib.images.ImageData;
import dcm2png.lib.images.ImageMetadata;
import dcm2png.lib.images.LookupTable;
import dcm2png.lib.images.PixelMatrix;
import dcm2png.lib.images.PixelType;
import dcm2png.lib.images.RescaleParameters;

/**
 * Reader for single-frame grayscale DICOM files with native (uncompressed) pixel data.
 * <p>
 * Supported transfer syntaxes are Implicit VR Little Endian, Explicit VR Little Endian and
 * Explicit VR Big Endian. Files may have the standard 128-byte preamble and "DICM" prefix,
 * or start directly with the dataset (in which case Implicit VR Little Endian is assumed unless
 * the first element has an explicit VR).
 * <p>
 * Only the elements needed for display are read: image size and bit depth, rescale slope
 * and intercept, and the first item of the VOI LUT Sequence.
 */
public class DicomImageReader implements ImageReader {

	private static final Logger logger = LoggerFactory.getLogger(DicomImageReader.class);

	static final String IMPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2";
	static final String EXPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2.1";
	static final String EXPLICIT_VR_BIG_ENDIAN = "1.2.840.10008.1.2.2";

	static final int TRANSFER_SYNTAX_UID = 0x00020010;
	static final int SAMPLES_PER_PIXEL = 0x00280002;
	static final int PHOTOMETRIC_INTERPRETATION = 0x00280004;
	static final int NUMBER_OF_FRAMES = 0x00280008;
	static final int ROWS = 0x00280010;
	static final int COLUMNS = 0x00280011;
	static final int BITS_ALLOCATED = 0x00280100;
	static final int BITS_STORED = 0x00280101;
	static final int PIXEL_REPRESENTATION = 0x00280103;
	static final int RESCALE_INTERCEPT = 0x00281052;
	static final int RESCALE_SLOPE = 0x00281053;
	static final int LUT_DESCRIPTOR = 0x00283002;
	static final int LUT_DATA = 0x00283006;
	static final int VOI_LUT_SEQUENCE = 0x00283010;
	static final int PIXEL_DATA = 0x7FE00010;

	static final int ITEM = 0xFFFEE000;
	static final int ITEM_DELIMITATION = 0xFFFEE00D;
	static final int SEQUENCE_DELIMITATION = 0xFFFEE0DD;

	private static final long UNDEFINED_LENGTH = 0xFFFFFFFFL;
	private static final int PREAMBLE_LENGTH = 128;

	private static final Set<String> LONG_LENGTH_VRS = Set.of(
			"OB", "OD", "OF", "OL", "OV", "OW", "SQ", "SV", "UC", "UN", "UR", "UT", "UV");

	@Override
	public String getName() {
		return "DICOM";
	}

	@Override
	public ImageData read(Path path) throws DecodeException {
		byte[] bytes;
		try {
			bytes = Files.readAllBytes(path);
		} catch (NoSuchFileException e) {
			throw new DecodeException("File not found: " + path, e);
		} catch (IOException e) {
			throw new DecodeException("Unable to read " + path + ": " + e.getLocalizedMessage(), e);
		}
		var fileName = path.getFileName();
		return read(bytes, fileName == null ? path.toString() : fileName.toString());
	}

	/**
	 * Read an image from the bytes of a DICOM file.
	 * @param bytes
	 * @param name name to store in the metadata
	 * @return
	 * @throws DecodeException
	 */
	public ImageData read(byte[] bytes, String name) throws DecodeException {
		try {
			return parse(bytes, name);
		} catch (BufferUnderflowException | IndexOutOfBoundsException e) {
			throw new DecodeException("Unexpected end of data reading " + name, e);
		}
	}

	private ImageData parse(byte[] bytes, String name) throws DecodeException {
		var buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
		boolean hasPreamble = hasPrefix(bytes, PREAMBLE_LENGTH);
		String transferSyntax;
		if (hasPreamble) {
			buffer.position(PREAMBLE_LENGTH + 4);
			var meta = new HashMap<Integer, Element>();
			var metaInput = new DicomInput(buffer, true);
			while (buffer.remaining() >= 8 && (buffer.getShort(buffer.position()) & 0xFFFF) == 0x0002)
				metaInput.readElementInto(meta);
			transferSyntax = meta.containsKey(TRANSFER_SYNTAX_UID) ? getString(buffer, meta.get(TRANSFER_SYNTAX_UID)) : IMPLICIT_VR_LITTLE_ENDIAN;
		} else if (hasPrefix(bytes, 0)) {
			throw new DecodeException(name + " has a DICM prefix without a preamble");
		} else {
			transferSyntax = looksExplicit(bytes) ? EXPLICIT_VR_LITTLE_ENDIAN : IMPLICIT_VR_LITTLE_ENDIAN;
			logger.debug("No DICOM preamble in {}, assuming {}", name, transferSyntax);
		}

		boolean explicit;
		switch (transferSyntax) {
		case IMPLICIT_VR_LITTLE_ENDIAN:
			explicit = false;
			break;
		case EXPLICIT_VR_LITTLE_ENDIAN:
			explicit = true;
			break;
		case EXPLICIT_VR_BIG_ENDIAN:
			explicit = true;
			buffer.order(ByteOrder.BIG_ENDIAN);
			break;
		default:
			throw new DecodeException("Unsupported transfer syntax " + transferSyntax + " in " + name + " (compressed pixel data is not supported)");
		}

		var input = new DicomInput(buffer, explicit);
		var dataset = new HashMap<Integer, Element>();
		input.readDataset(dataset, Long.MAX_VALUE, false);
		return createImageData(buffer, dataset, name);
	}

	private static boolean hasPrefix(byte[] bytes, int offset) {
		return bytes.length >= offset + 4 &&
				bytes[offset] == 'D' && bytes[offset+1] == 'I' && bytes[offset+2] == 'C' && bytes[offset+3] == 'M';
	}

	private static boolean looksExplicit(byte[] bytes) {
		return bytes.length >= 6 && Character.isUpperCase(bytes[4]) && Character.isUpperCase(bytes[5]);
	}

	private ImageData createImageData(ByteBuffer buffer, Map<Integer, Element> dataset, String name) throws DecodeException {
		int samplesPerPixel = getInt(buffer, dataset, SAMPLES_PER_PIXEL, 1);
		if (samplesPerPixel != 1)
			throw new DecodeException(name + " has " + samplesPerPixel + " samples per pixel, only single-channel images are supported");
		int nFrames = getInt(buffer, dataset, NUMBER_OF_FRAMES, 1);
		if (nFrames > 1)
			throw new DecodeException(name + " has " + nFrames + " frames, only single-frame images are supported");

		String photometric = dataset.containsKey(PHOTOMETRIC_INTERPRETATION) ? getString(buffer, dataset.get(PHOTOMETRIC_INTERPRETATION)) : "MONOCHROME2";
		if ("MONOCHROME1".equals(photometric))
			LogTools.warnOnce(logger, "MONOCHROME1 images are converted without inverting intensities");
		else if (!"MONOCHROME2".equals(photometric))
			throw new DecodeException(name + " has photometric interpretation " + photometric + ", only grayscale images are supported");

		int rows = getRequiredInt(buffer, dataset, ROWS, "Rows", name);
		int columns = getRequiredInt(buffer, dataset, COLUMNS, "Columns", name);
		int bitsAllocated = getRequiredInt(buffer, dataset, BITS_ALLOCATED, "Bits Allocated", name);
		int bitsStored = getInt(buffer, dataset, BITS_STORED, bitsAllocated);
		boolean signed = getInt(buffer, dataset, PIXEL_REPRESENTATION, 0) == 1;
		if (rows <= 0 || columns <= 0)
			throw new DecodeException(name + " has invalid dimensions " + columns + "x" + rows);
		if (bitsStored <= 0 || bitsStored > bitsAllocated)
			throw new DecodeException(name + " has " + bitsStored + " bits stored but " + bitsAllocated + " bits allocated");

		PixelType pixelType;
		try {
			pixelType = PixelType.forIntegerBits(bitsAllocated, signed);
		} catch (IllegalArgumentException e) {
			throw new DecodeException(name + ": " + e.getLocalizedMessage(), e);
		}

		var pixelData = dataset.get(PIXEL_DATA);
		if (pixelData == null)
			throw new DecodeException(name + " contains no pixel data");
		double[] values = readPixels(buffer, pixelData, columns * rows, pixelType, bitsStored, name);

		var metadata = new ImageMetadata.Builder()
				.name(name)
				.size(columns, rows)
				.bits(bitsAllocated, bitsStored)
				.signed(signed)
				.photometricInterpretation(photometric)
				.rescale(readRescale(buffer, dataset))
				.lookupTable(readLookupTable(buffer, dataset, signed, name))
				.build();
		logger.debug("Read {}", metadata);
		return new ImageData(PixelMatrix.createInstance(columns, rows, pixelType, values), metadata);
	}

	private static double[] readPixels(ByteBuffer buffer, Element element, int nPixels, PixelType pixelType, int bitsStored, String name) throws DecodeException {
		int bytesPerPixel = pixelType.getBitsPerPixel() / 8;
		long required = (long)nPixels * bytesPerPixel;
		if (element.length() < required)
			throw new DecodeException(name + " has " + element.length() + " bytes of pixel data, expected " + required);
		int bitsAllocated = pixelType.getBitsPerPixel();
		long mask = (1L << bitsStored) - 1;
		int shift = 64 - bitsStored;
		double[] values = new double[nPixels];
		int offset = element.offset();
		for (int i = 0; i < nPixels; i++) {
			long raw;
			switch (bitsAllocated) {
			case 8:
				raw = buffer.get(offset + i) & 0xFFL;
				break;
			case 16:
				raw = buffer.getShort(offset + i * 2) & 0xFFFFL;
				break;
			default:
				raw = buffer.getInt(offset + i * 4) & 0xFFFFFFFFL;
				break;
			}
			raw &= mask;
			if (pixelType.isSignedInteger())
				raw = (raw << shift) >> shift;
			values[i] = raw;
		}
		return values;
	}

	private static RescaleParameters readRescale(ByteBuffer buffer, Map<Integer, Element> dataset) throws DecodeException {
		boolean hasSlope = dataset.containsKey(RESCALE_SLOPE);
		boolean hasIntercept = dataset.containsKey(RESCALE_INTERCEPT);
		if (!hasSlope && !hasIntercept)
			return null;
		double slope = hasSlope ? getDecimal(buffer, dataset.get(RESCALE_SLOPE)) : 1.0;
		double intercept = hasIntercept ? getDecimal(buffer, dataset.get(RESCALE_INTERCEPT)) : 0.0;
		return new RescaleParameters(slope, intercept);
	}

	private static LookupTable readLookupTable(ByteBuffer buffer, Map<Integer, Element> dataset, boolean signed, String name) {
		var sequence = dataset.get(VOI_LUT_SEQUENCE);
		if (sequence == null || sequence.items().isEmpty())
			return null;
		var item = sequence.items().get(0);
		var descriptor = item.get(LUT_DESCRIPTOR);
		var data = item.get(LUT_DATA);
		if (descriptor == null || data == null) {
			logger.debug("Ignoring VOI LUT in {} without descriptor or data", name);
			return null;
		}
		int nDescriptorValues = (int)(descriptor.length() / 2);
		int count = nDescriptorValues > 0 ? buffer.getShort(descriptor.offset()) & 0xFFFF : 0;
		int firstValue = 0;
		if (nDescriptorValues > 1) {
			short first = buffer.getShort(descriptor.offset() + 2);
			firstValue = signed ? first : first & 0xFFFF;
		}
		int bitDepth = nDescriptorValues > 2 ? buffer.getShort(descriptor.offset() + 4) & 0xFFFF : 0;
		if (count == 0 && nDescriptorValues > 2)
			count = 65536;
		int[] entries = new int[(int)(data.length() / 2)];
		for (int i = 0; i < entries.length; i++)
			entries[i] = buffer.getShort(data.offset() + i * 2) & 0xFFFF;
		return LookupTable.createInstance(firstValue, count, bitDepth, entries);
	}

	private static int getRequiredInt(ByteBuffer buffer, Map<Integer, Element> dataset, int tag, String description, String name) throws DecodeException {
		if (!dataset.containsKey(tag))
			throw new DecodeException(name + " is missing required element " + description + " " + tagToString(tag));
		return getInt(buffer, dataset, tag, 0);
	}

	private static int getInt(ByteBuffer buffer, Map<Integer, Element> dataset, int tag, int defaultValue) throws DecodeException {
		var element = dataset.get(tag);
		if (element == null || element.length() == 0)
			return defaultValue;
		if ("IS".equals(element.vr()) || "DS".equals(element.vr()) || tag == NUMBER_OF_FRAMES)
			return (int)getDecimal(buffer, element);
		if (element.length() < 2)
			throw new DecodeException("Element " + tagToString(tag) + " is too short");
		return buffer.getShort(element.offset()) & 0xFFFF;
	}

	private static double getDecimal(ByteBuffer buffer, Element element) throws DecodeException {
		String s = getString(buffer, element);
		int ind = s.indexOf('\\');
		if (ind >= 0)
			s = s.substring(0, ind).strip();
		try {
			return Double.parseDouble(s);
		} catch (NumberFormatException e) {
			throw new DecodeException("Cannot parse number '" + s + "' for element " + tagToString(element.tag()), e);
		}
	}

	private static String getString(ByteBuffer buffer, Element element) {
		byte[] bytes = new byte[(int)element.length()];
		buffer.get(element.offset(), bytes);
		return new String(bytes, StandardCharsets.US_ASCII).replace('\0', ' ').strip();
	}

	static String tagToString(int tag) {
		return String.format("(%04X,%04X)", tag >>> 16, tag & 0xFFFF);
	}


	/**
	 * A dataset element. Values are not copied; the element stores the position of its value
	 * within the file buffer, or the parsed items if it is a sequence.
	 */
	record Element(int tag, String vr, int offset, long length, List<Map<Integer, Element>> items) {}


	/**
	 * Sequential reader for data elements.
	 */
	private static class DicomInput {

		private final ByteBuffer buffer;
		private final boolean explicit;

		DicomInput(ByteBuffer buffer, boolean explicit) {
			this.buffer = buffer;
			this.explicit = explicit;
		}

		/**
		 * Read elements until the end position is reached, the data is exhausted, or (optionally)
		 * an item delimitation element is found.
		 */
		void readDataset(Map<Integer, Element> output, long end, boolean stopAtItemDelimiter) throws DecodeException {
			while (buffer.position() < end && buffer.remaining() >= 8) {
				var element = readElementInto(output);
				if (stopAtItemDelimiter && element.tag() == ITEM_DELIMITATION)
					return;
			}
		}

		Element readElementInto(Map<Integer, Element> output) throws DecodeException {
			int group = buffer.getShort() & 0xFFFF;
			int elem = buffer.getShort() & 0xFFFF;
			int tag = (group << 16) | elem;

			String vr;
			long length;
			if (group == 0xFFFE) {
				vr = null;
				length = buffer.getInt() & 0xFFFFFFFFL;
			} else if (explicit || group == 0x0002) {
				vr = new String(new byte[] {buffer.get(), buffer.get()}, StandardCharsets.US_ASCII);
				if (LONG_LENGTH_VRS.contains(vr)) {
					buffer.getShort();
					length = buffer.getInt() & 0xFFFFFFFFL;
				} else
					length = buffer.getShort() & 0xFFFF;
			} else {
				vr = tag == VOI_LUT_SEQUENCE ? "SQ" : "UN";
				length = buffer.getInt() & 0xFFFFFFFFL;
			}

			Element element;
			if (tag == ITEM_DELIMITATION || tag == SEQUENCE_DELIMITATION) {
				element = new Element(tag, vr, buffer.position(), 0, Collections.emptyList());
			} else if (tag == PIXEL_DATA && length == UNDEFINED_LENGTH) {
				throw new DecodeException("Encapsulated pixel data is not supported");
			} else if ("SQ".equals(vr) || length == UNDEFINED_LENGTH) {
				int offset = buffer.position();
				var items = readSequence(length);
				element = new Element(tag, "SQ", offset, length, items);
			} else {
				int offset = buffer.position();
				if (length > buffer.remaining())
					throw new DecodeException("Element " + tagToString(tag) + " declares " + length + " bytes, but only " + buffer.remaining() + " remain");
				buffer.position(offset + (int)length);
				element = new Element(tag, vr, offset, length, null);
			}
			output.put(tag, element);
			return element;
		}

		private List<Map<Integer, Element>> readSequence(long length) throws DecodeException {
			long end = length == UNDEFINED_LENGTH ? Long.MAX_VALUE : buffer.position() + length;
			List<Map<Integer, Element>> items = new ArrayList<>();
			while (buffer.position() < end && buffer.remaining() >= 8) {
				int tag = ((buffer.getShort() & 0xFFFF) << 16) | (buffer.getShort() & 0xFFFF);
				long itemLength = buffer.getInt() & 0xFFFFFFFFL;
				if (tag == SEQUENCE_DELIMITATION)
					break;
				if (tag != ITEM)
					throw new DecodeException("Expected sequence item but found " + tagToString(tag));
				var item = new HashMap<Integer, Element>();
				if (itemLength == UNDEFINED_LENGTH) {
					readDataset(item, Long.MAX_VALUE, true);
				} else {
					long itemEnd = buffer.position() + itemLength;
					if (itemEnd > buffer.limit())
						throw new DecodeException("Sequence item declares " + itemLength + " bytes, but only " + buffer.remaining() + " remain");
					readDataset(item, itemEnd, false);
					buffer.position((int)itemEnd);
				}
				items.add(item);
			}
			return items;
		}

	}

}
