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

package dcm2png.lib.images;

import java.util.Optional;

/**
 * Header information read alongside a {@link PixelMatrix}.
 * <p>
 * Instances are immutable. Use {@link Builder} to create new metadata, or to derive a modified
 * copy of existing metadata (e.g. once a rescale or lookup table has been consumed).
 */
public final class ImageMetadata {

	private String name;
	private int width;
	private int height;
	private int bitsAllocated;
	private int bitsStored;
	private boolean signed;
	private String photometricInterpretation = "MONOCHROME2";
	private RescaleParameters rescale;
	private LookupTable lookupTable;

	private ImageMetadata() {}

	private ImageMetadata duplicate() {
		var metadata = new ImageMetadata();
		metadata.name = name;
		metadata.width = width;
		metadata.height = height;
		metadata.bitsAllocated = bitsAllocated;
		metadata.bitsStored = bitsStored;
		metadata.signed = signed;
		metadata.photometricInterpretation = photometricInterpretation;
		metadata.rescale = rescale;
		metadata.lookupTable = lookupTable;
		return metadata;
	}

	/**
	 * Name of the image, usually the source file name.
	 * @return
	 */
	public String getName() {
		return name;
	}

	/**
	 * Image width in pixels.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Image height in pixels.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Number of bits allocated per stored sample.
	 * @return
	 */
	public int getBitsAllocated() {
		return bitsAllocated;
	}

	/**
	 * Number of bits actually used per stored sample.
	 * @return
	 */
	public int getBitsStored() {
		return bitsStored;
	}

	/**
	 * True if stored samples are signed (two's complement).
	 * @return
	 */
	public boolean isSigned() {
		return signed;
	}

	/**
	 * Photometric interpretation, e.g. MONOCHROME2.
	 * @return
	 */
	public String getPhotometricInterpretation() {
		return photometricInterpretation;
	}

	/**
	 * Rescale parameters, if the header defines them and they have not yet been applied.
	 * @return
	 */
	public Optional<RescaleParameters> getRescale() {
		return Optional.ofNullable(rescale);
	}

	/**
	 * Lookup table, if the header defines one and it has not yet been applied.
	 * @return
	 */
	public Optional<LookupTable> getLookupTable() {
		return Optional.ofNullable(lookupTable);
	}

	@Override
	public String toString() {
		return "ImageMetadata [name=" + name + ", " + width + "x" + height + ", bits=" + bitsStored + "/" + bitsAllocated
				+ (signed ? " signed" : "") + ", " + photometricInterpretation
				+ ", rescale=" + rescale + ", lut=" + lookupTable + "]";
	}


	/**
	 * Builder to create new {@link ImageMetadata}.
	 */
	public static class Builder {

		private ImageMetadata metadata;

		/**
		 * Minimal builder; further properties must be set.
		 */
		public Builder() {
			metadata = new ImageMetadata();
		}

		/**
		 * Builder that takes existing metadata as a starting point, but allows individual properties to be overridden.
		 * @param metadata
		 */
		public Builder(final ImageMetadata metadata) {
			this.metadata = metadata.duplicate();
		}

		/**
		 * Set the image name.
		 * @param name
		 * @return
		 */
		public Builder name(String name) {
			metadata.name = name;
			return this;
		}

		/**
		 * Set the image dimensions.
		 * @param width
		 * @param height
		 * @return
		 */
		public Builder size(int width, int height) {
			metadata.width = width;
			metadata.height = height;
			return this;
		}

		/**
		 * Set the bits allocated and stored per sample.
		 * @param bitsAllocated
		 * @param bitsStored
		 * @return
		 */
		public Builder bits(int bitsAllocated, int bitsStored) {
			metadata.bitsAllocated = bitsAllocated;
			metadata.bitsStored = bitsStored;
			return this;
		}

		/**
		 * Set whether stored samples are signed.
		 * @param signed
		 * @return
		 */
		public Builder signed(boolean signed) {
			metadata.signed = signed;
			return this;
		}

		/**
		 * Set the photometric interpretation.
		 * @param photometricInterpretation
		 * @return
		 */
		public Builder photometricInterpretation(String photometricInterpretation) {
			metadata.photometricInterpretation = photometricInterpretation;
			return this;
		}

		/**
		 * Set the rescale parameters; may be null to indicate no rescale.
		 * @param rescale
		 * @return
		 */
		public Builder rescale(RescaleParameters rescale) {
			metadata.rescale = rescale;
			return this;
		}

		/**
		 * Set the lookup table; may be null to indicate no lookup table.
		 * @param lookupTable
		 * @return
		 */
		public Builder lookupTable(LookupTable lookupTable) {
			metadata.lookupTable = lookupTable;
			return this;
		}

		/**
		 * Build the metadata.
		 * @return
		 */
		public ImageMetadata build() {
			return metadata.duplicate();
		}

	}

}
