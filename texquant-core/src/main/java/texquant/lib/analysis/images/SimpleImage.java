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
 * A minimal interface to define a means to provide access to pixel values from a 2D, 1-channel image.
 * <p>
 * Pixels are addressed by {@code x} (column) and {@code y} (row), with the origin at the top left.
 */
public interface SimpleImage {
	
	/**
	 * Get the value of a single pixel.
	 * @param x x-coordinate of the pixel (column)
	 * @param y y-coordinate of the pixel (row)
	 * @return the pixel value
	 */
	public float getValue(int x, int y);
	
	/**
	 * Get the image width.
	 * @return the number of columns
	 */
	public int getWidth();
	
	/**
	 * Get the image height.
	 * @return the number of rows
	 */
	public int getHeight();
	
}
