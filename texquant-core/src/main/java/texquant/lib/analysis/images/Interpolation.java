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

/**
 * Static methods for interpolating pixel values at non-integer coordinates.
 * <p>
 * Pixels outside the grid are treated as having the value 0.
 */
public class Interpolation {

	/**
	 * Bilinear interpolation within a row-major array of values.
	 * <p>
	 * The value at an integer location is exactly the stored value; neighbouring pixels with zero weight are not read,
	 * so requesting a coordinate on the last row or column does not touch anything beyond the grid.
	 *
	 * @param values row-major pixel values
	 * @param width number of columns
	 * @param height number of rows
	 * @param x x-coordinate (column, may be fractional)
	 * @param y y-coordinate (row, may be fractional)
	 * @return the interpolated value
	 */
	public static double bilinear(final double[] values, final int width, final int height, final double x, final double y) {
		// Relative indices
		int fx = (int)Math.floor(x);
		int fy = (int)Math.floor(y);
		int cx = fx+1;
		int cy = fy+1;
		// Fractional part
		double tx = x - fx;
		double ty = y - fy;
		// Set interpolation weights
		double w1 = (1 - tx) * (1 - ty);
		double w2 =      tx  * (1 - ty);
		double w3 = (1 - tx) *      ty;
		double w4 =      tx  *      ty;
		// Compute the value
		double value = 0;
		if (w1 > 0)
			value += w1 * getValueOrZero(values, width, height, fx, fy);
		if (w2 > 0)
			value += w2 * getValueOrZero(values, width, height, cx, fy);
		if (w3 > 0)
			value += w3 * getValueOrZero(values, width, height, fx, cy);
		if (w4 > 0)
			value += w4 * getValueOrZero(values, width, height, cx, cy);
		return value;
	}

	private static double getValueOrZero(final double[] values, final int width, final int height, final int x, final int y) {
		if (x < 0 || y < 0 || x >= width || y >= height)
			return 0;
		return values[y * width + x];
	}

}
