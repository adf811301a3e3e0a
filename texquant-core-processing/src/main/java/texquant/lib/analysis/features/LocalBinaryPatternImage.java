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

package texquant.lib.analysis.features;

import texquant.lib.analysis.features.LocalBinaryPatterns.Method;

/**
 * Output of a local binary pattern calculation, with the same dimensions as the input image.
 * <p>
 * Values are integer codes, except for {@link Method#VAR} where they are floating point.
 *
 * @see LocalBinaryPatterns
 */
public class LocalBinaryPatternImage {

	private final int width;
	private final int height;
	private final int nPoints;
	private final double radius;
	private final Method method;

	// Exactly one of these is non-null
	private final long[] codes;
	private final double[] values;

	LocalBinaryPatternImage(int width, int height, int nPoints, double radius, Method method, long[] codes, double[] values) {
		this.width = width;
		this.height = height;
		this.nPoints = nPoints;
		this.radius = radius;
		this.method = method;
		this.codes = codes;
		this.values = values;
	}

	/**
	 * Image width.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Image height.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Number of sample points used to compute the patterns.
	 * @return
	 */
	public int getNumPoints() {
		return nPoints;
	}

	/**
	 * Radius used to compute the patterns.
	 * @return
	 */
	public double getRadius() {
		return radius;
	}

	/**
	 * Method used to compute the patterns.
	 * @return
	 */
	public Method getMethod() {
		return method;
	}

	/**
	 * Returns true if the image contains integer codes, false if it contains floating point values.
	 * @return
	 */
	public boolean hasIntegerCodes() {
		return codes != null;
	}

	/**
	 * Get the integer code for a pixel.
	 * @param x
	 * @param y
	 * @return
	 * @throws UnsupportedOperationException if the image does not contain integer codes
	 */
	public long getCode(int x, int y) throws UnsupportedOperationException {
		if (codes == null)
			throw new UnsupportedOperationException("Local binary patterns computed with method " + method + " are not integer codes");
		return codes[y * width + x];
	}

	/**
	 * Get the value for a pixel as a double.
	 * @param x
	 * @param y
	 * @return
	 */
	public double getValue(int x, int y) {
		int ind = y * width + x;
		return codes == null ? values[ind] : codes[ind];
	}

	/**
	 * Get a copy of all values in row-major order, as doubles.
	 * @return
	 */
	public double[] getValues() {
		if (codes == null)
			return values.clone();
		double[] output = new double[codes.length];
		for (int i = 0; i < codes.length; i++)
			output[i] = codes[i];
		return output;
	}

	/**
	 * Count how many values are infinite or NaN. This can only be non-zero for {@link Method#VAR}.
	 * @return
	 */
	public int countNonFinite() {
		if (codes != null)
			return 0;
		int count = 0;
		for (double v : values) {
			if (!Double.isFinite(v))
				count++;
		}
		return count;
	}

	@Override
	public String toString() {
		return String.format("%s (%d x %d, P=%d, R=%s, method=%s)", getClass().getSimpleName(), width, height, nPoints, radius, method);
	}

}
