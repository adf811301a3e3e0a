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

/**
 * Create {@link SimpleImage SimpleImage} instances for basic pixel processing.
 *
 * @author Pete Bankhead
 *
 */
public class SimpleImages {

	/**
	 * Get the pixel values for the image.
	 * @param image
	 * @param direct if true, return the direct pixel buffer if possible. The caller should <i>not</i> modify this.
	 * @return
	 */
	public static float[] getPixels(SimpleImage image, boolean direct) {
		if (image instanceof SimpleModifiableImage)
			return ((SimpleModifiableImage)image).getArray(direct);
		int n = image.getWidth() * image.getHeight();
		int w = image.getWidth();
		float[] pixels = new float[n];
		for (int i = 0; i < n; i++)
			pixels[i] = image.getValue(i % w, i / w);
		return pixels;
	}

	/**
	 * Create a {@link SimpleImage} backed by an existing float array of pixels.
	 * <p>
	 * Pixels are stored in row-major order.
	 *
	 * @param data
	 * @param width
	 * @param height
	 * @return
	 * @throws IllegalArgumentException if the dimensions are not positive or don't match the length of the array
	 */
	public static SimpleModifiableImage createFloatImage(float[] data, int width, int height) throws IllegalArgumentException {
		Objects.requireNonNull(data, "Pixel array must not be null");
		checkDimensions(width, height);
		if (data.length != width * height)
			throw new IllegalArgumentException("Pixel array length " + data.length + " does not match image size " + width + "x" + height);
		return new FloatArraySimpleImage(data, width, height);
	}

	/**
	 * Create a {@link SimpleImage} backed by a float array of pixels.
	 *
	 * @param width
	 * @param height
	 * @return
	 * @throws IllegalArgumentException if the dimensions are not positive
	 */
	public static SimpleModifiableImage createFloatImage(int width, int height) throws IllegalArgumentException {
		checkDimensions(width, height);
		return new FloatArraySimpleImage(new float[width * height], width, height);
	}

	/**
	 * Create a {@link SimpleImage} from a 2D array, where each inner array gives the values for one row.
	 * <p>
	 * Values are copied (and converted to float).
	 *
	 * @param rows
	 * @return
	 * @throws IllegalArgumentException if the array is empty or ragged (i.e. rows have different lengths)
	 */
	public static SimpleModifiableImage createFloatImage(double[][] rows) throws IllegalArgumentException {
		Objects.requireNonNull(rows, "Pixel array must not be null");
		if (rows.length == 0 || rows[0] == null || rows[0].length == 0)
			throw new IllegalArgumentException("Image must have at least one row and one column");
		int width = rows[0].length;
		int height = rows.length;
		float[] data = new float[width * height];
		for (int y = 0; y < height; y++) {
			double[] row = rows[y];
			if (row == null || row.length != width)
				throw new IllegalArgumentException("Image is not 2-dimensional: row " + y + " has a different length to row 0");
			for (int x = 0; x < width; x++)
				data[y * width + x] = (float)row[x];
		}
		return new FloatArraySimpleImage(data, width, height);
	}

	/**
	 * Create a float image with the same values as a {@link GreyLevelImage}.
	 *
	 * @param image
	 * @return
	 */
	public static SimpleModifiableImage createFloatImage(GreyLevelImage image) {
		int width = image.getWidth();
		int height = image.getHeight();
		float[] data = new float[width * height];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++)
				data[y * width + x] = image.getLevel(x, y);
		}
		return new FloatArraySimpleImage(data, width, height);
	}

	static void checkDimensions(int width, int height) throws IllegalArgumentException {
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Image dimensions must be positive, but were " + width + "x" + height);
	}


	/**
	 * Implementation of a SimpleImage backed by an array of floats.
	 *
	 * @author Pete Bankhead
	 *
	 */
	static class FloatArraySimpleImage implements SimpleModifiableImage {

		private float[] data;
		private int width;
		private int height;

		FloatArraySimpleImage(float[] data, int width, int height) {
			this.data = data;
			this.width = width;
			this.height = height;
		}

		@Override
		public float getValue(int x, int y) {
			return data[y * width + x];
		}

		@Override
		public void setValue(int x, int y, float val) {
			data[y * width + x] = val;
		}

		@Override
		public int getWidth() {
			return width;
		}

		@Override
		public int getHeight() {
			return height;
		}

		@Override
		public float[] getArray(boolean direct) {
			if (direct)
				return data;
			return data.clone();
		}

	}
}
