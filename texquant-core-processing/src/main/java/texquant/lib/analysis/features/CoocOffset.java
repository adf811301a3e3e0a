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

import texquant.lib.common.GeneralTools;

/**
 * Pixel offset used to pair pixels when computing a co-occurrence matrix.
 * <p>
 * The offset is defined by a distance and an angle (in radians). The angle 0 pairs each pixel with a pixel to its right;
 * {@code pi/2} pairs it with a pixel below. The displacement is rounded to the nearest pixel, with halves rounded away from zero.
 *
 * @param distance the distance between paired pixels
 * @param angle the angle in radians
 * @param dx column displacement in pixels
 * @param dy row displacement in pixels
 */
public record CoocOffset(double distance, double angle, int dx, int dy) {

	/**
	 * Create an offset from a distance and angle, computing the integer displacement.
	 * @param distance
	 * @param angle in radians
	 * @return
	 */
	public static CoocOffset fromPolar(double distance, double angle) {
		int dx = GeneralTools.roundHalfAwayFromZero(Math.cos(angle) * distance);
		int dy = GeneralTools.roundHalfAwayFromZero(Math.sin(angle) * distance);
		return new CoocOffset(distance, angle, dx, dy);
	}

	/**
	 * Count the number of pixel pairs that fall inside an image of the given size for this offset.
	 * @param width
	 * @param height
	 * @return
	 */
	public long countPairs(int width, int height) {
		long nx = Math.max(0, width - Math.abs(dx));
		long ny = Math.max(0, height - Math.abs(dy));
		return nx * ny;
	}

}
