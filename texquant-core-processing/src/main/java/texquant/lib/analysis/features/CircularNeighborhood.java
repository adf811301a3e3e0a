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

import texquant.lib.analysis.images.Interpolation;

/**
 * Sample points arranged evenly on a circle, used to compute local binary patterns.
 * <p>
 * Point {@code k} is at row {@code -R sin(2 pi k / P)} and column {@code R cos(2 pi k / P)} relative to the centre,
 * i.e. the first point is to the right of the centre and subsequent points proceed counter-clockwise
 * (as displayed, with rows increasing downwards).
 * <p>
 * Points are sampled from a square window of {@code (2 ceil(R) + 1)} pixels per side, centred on the pixel of interest.
 */
public class CircularNeighborhood {

	private final int nPoints;
	private final double radius;
	private final int windowRadius;
	private final int windowSize;

	// Offsets relative to the centre of the window
	private final double[] xo;
	private final double[] yo;

	private CircularNeighborhood(int nPoints, double radius) {
		this.nPoints = nPoints;
		this.radius = radius;
		this.windowRadius = (int)Math.ceil(radius);
		this.windowSize = 2 * windowRadius + 1;
		this.xo = new double[nPoints];
		this.yo = new double[nPoints];
		double scale = 2 * Math.PI / nPoints;
		for (int k = 0; k < nPoints; k++) {
			xo[k] = Math.cos(scale * k);
			yo[k] = -Math.sin(scale * k);
		}
		// Tidy up the values close to 0 and +/-1
		tidyDoubleUnitArray(xo);
		tidyDoubleUnitArray(yo);
		for (int k = 0; k < nPoints; k++) {
			xo[k] *= radius;
			yo[k] *= radius;
		}
	}

	/**
	 * Create a neighborhood with {@code nPoints} sample points on a circle with the specified radius.
	 *
	 * @param nPoints number of sample points, at least 1
	 * @param radius radius of the circle in pixels, must be finite and &gt; 0
	 * @return
	 * @throws IllegalArgumentException if the number of points or radius is invalid
	 */
	public static CircularNeighborhood create(int nPoints, double radius) throws IllegalArgumentException {
		if (nPoints < 1)
			throw new IllegalArgumentException("Number of points must be at least 1, but was " + nPoints);
		if (!Double.isFinite(radius) || radius <= 0)
			throw new IllegalArgumentException("Radius must be finite and > 0, but was " + radius);
		return new CircularNeighborhood(nPoints, radius);
	}

	/*
	 * Rounds values close to 0 and +/-1 to be exactly those values, so that points on the axes fall
	 * exactly on pixel centres
	 */
	private static void tidyDoubleUnitArray(final double[] arr) {
		for (int i = 0; i < arr.length; i++) {
			double d = arr[i];
			if (Math.abs(d) < 0.00001)
				arr[i] = 0;
			else {
				double signum = Math.signum(d);
				if (Math.abs(d - signum) < 0.00001)
					arr[i] = signum;
			}
		}
	}

	/**
	 * Number of sample points.
	 * @return
	 */
	public int getNumPoints() {
		return nPoints;
	}

	/**
	 * Radius of the circle.
	 * @return
	 */
	public double getRadius() {
		return radius;
	}

	/**
	 * Distance from the centre of the window to its edge, i.e. {@code ceil(radius)}.
	 * @return
	 */
	public int getWindowRadius() {
		return windowRadius;
	}

	/**
	 * Width (and height) of the square window containing all sample points.
	 * @return
	 */
	public int getWindowSize() {
		return windowSize;
	}

	/**
	 * Column offset of a sample point relative to the centre.
	 * @param k index of the sample point
	 * @return
	 */
	public double getXOffset(int k) {
		return xo[k];
	}

	/**
	 * Row offset of a sample point relative to the centre.
	 * @param k index of the sample point
	 * @return
	 */
	public double getYOffset(int k) {
		return yo[k];
	}

	/**
	 * Interpolate the values of all sample points from a window of pixels.
	 *
	 * @param window row-major window values, of length {@code getWindowSize() * getWindowSize()}
	 * @param samples array to store the {@code getNumPoints()} interpolated values
	 */
	void sample(final double[] window, final double[] samples) {
		for (int k = 0; k < nPoints; k++)
			samples[k] = Interpolation.bilinear(window, windowSize, windowSize, windowRadius + xo[k], windowRadius + yo[k]);
	}

}
