/*-
 * #%L
 * This file is part of TexQuant.
 * %%
 * Copyright (C) 2014 - 2016 The Queen's University of Belfast, Northern Ireland
 * Contact: IP Management (ipmanagement@qub.ac.uk)
 * Copyright (C) 2018 - 2020 QuPath developers, The University of Edinburgh
 * Copyright (C) 2024 TexQuant developers
 * %%
 * TexQuant is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * TexQuant is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with TexQuant.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package texquant.lib.analysis.images;

import java.util.Objects;

import com.google.common.primitives.Ints;

import texquant.lib.common.GeneralTools;

/**
 * Immutable 2D image of integer grey levels, as required to compute co-occurrence matrices.
 * <p>
 * Pixels are addressed by {@code x} (column) and {@code y} (row), and stored in row-major order.
 * Any int value can be stored; checking that values fall within the range expected by a calculation is
 * left to that calculation (see {@link #getMinLevel()} and {@link #getMaxLevel()}).
 */
public final class GreyLevelImage {

	private final int[] data;
	private final int width;
	private final int height;
	private final int minLevel;
	private final int maxLevel;

	private GreyLevelImage(int[] data, int width, int height) {
		this.data = data;
		this.width = width;
		this.height = height;
		this.minLevel = Ints.min(data);
		this.maxLevel = Ints.max(data);
	}

	/**
	 * Create an image from a 2D array, where each inner array gives the levels for one row.
	 * Values are copied.
	 *
	 * @param rows
	 * @return
	 * @throws IllegalArgumentException if the array is empty or ragged (i.e. rows have different lengths)
	 */
	public static GreyLevelImage create(int[][] rows) throws IllegalArgumentException {
		Objects.requireNonNull(rows, "Pixel array must not be null");
		if (rows.length == 0 || rows[0] == null || rows[0].length == 0)
			throw new IllegalArgumentException("Image must have at least one row and one column");
		int width = rows[0].length;
		int height = rows.length;
		int[] data = new int[width * height];
		for (int y = 0; y < height; y++) {
			int[] row = rows[y];
			if (row == null || row.length != width)
				throw new IllegalArgumentException("Image is not 2-dimensional: row " + y + " has a different length to row 0");
			System.arraycopy(row, 0, data, y * width, width);
		}
		return new GreyLevelImage(data, width, height);
	}

	/**
	 * Create an image from a row-major array of levels. Values are copied.
	 *
	 * @param data
	 * @param width
	 * @param height
	 * @return
	 * @throws IllegalArgumentException if the dimensions are not positive or don't match the length of the array
	 */
	public static GreyLevelImage create(int[] data, int width, int height) throws IllegalArgumentException {
		Objects.requireNonNull(data, "Pixel array must not be null");
		SimpleImages.checkDimensions(width, height);
		if (data.length != width * height)
			throw new IllegalArgumentException("Pixel array length " + data.length + " does not match image size " + width + "x" + height);
		return new GreyLevelImage(data.clone(), width, height);
	}

	/**
	 * Create an image by binning the values of a {@link SimpleImage} into {@code nBins} levels.
	 * <p>
	 * Values are binned linearly between {@code minValue} and {@code maxValue}; values outside this range are
	 * clipped to the first or last bin. If either limit is NaN, both are taken from the image itself.
	 *
	 * @param img the image to quantize
	 * @param nBins number of grey levels in the output, between 1 and 256
	 * @param minValue minimum value for binning
	 * @param maxValue maximum value for binning
	 * @return an image with levels in the range 0 to {@code nBins - 1}
	 * @throws IllegalArgumentException if the number of bins is invalid or the image contains NaN values
	 */
	public static GreyLevelImage quantize(SimpleImage img, int nBins, double minValue, double maxValue) throws IllegalArgumentException {
		Objects.requireNonNull(img, "Image must not be null");
		if (nBins < 1 || nBins > 256)
			throw new IllegalArgumentException("Number of bins must be between 1 and 256, but was " + nBins);
		int width = img.getWidth();
		int height = img.getHeight();
		if (Double.isNaN(minValue) || Double.isNaN(maxValue)) {
			minValue = Double.POSITIVE_INFINITY;
			maxValue = Double.NEGATIVE_INFINITY;
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					float val = img.getValue(x, y);
					if (val < minValue)
						minValue = val;
					if (val > maxValue)
						maxValue = val;
				}
			}
		}
		double binDepth = (maxValue - minValue) / nBins;
		int[] data = new int[width * height];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				float val = img.getValue(x, y);
				if (Float.isNaN(val))
					throw new IllegalArgumentException("Cannot quantize NaN value at (" + x + ", " + y + ")");
				// Constant images end up in the first bin
				int ind = binDepth > 0 ? (int)Math.floor((val - minValue) / binDepth) : 0;
				data[y * width + x] = GeneralTools.clipValue(ind, 0, nBins-1);
			}
		}
		return new GreyLevelImage(data, width, height);
	}

	/**
	 * Get the level of a single pixel.
	 * @param x x-coordinate of the pixel (column)
	 * @param y y-coordinate of the pixel (row)
	 * @return
	 */
	public int getLevel(int x, int y) {
		return data[y * width + x];
	}

	/**
	 * Get the image width.
	 * @return the number of columns
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Get the image height.
	 * @return the number of rows
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Get the smallest level in the image.
	 * @return
	 */
	public int getMinLevel() {
		return minLevel;
	}

	/**
	 * Get the largest level in the image.
	 * @return
	 */
	public int getMaxLevel() {
		return maxLevel;
	}

	@Override
	public String toString() {
		return String.format("%s (%d x %d, levels %d-%d)", getClass().getSimpleName(), width, height, minLevel, maxLevel);
	}

}
