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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import texquant.lib.analysis.images.SimpleImage;
import texquant.lib.analysis.images.SimpleImages;
import texquant.lib.common.LogTools;
import texquant.lib.common.ThreadTools;

/**
 * Gray scale and rotation invariant local binary patterns, using circularly symmetric neighbor sets.
 * <p>
 * For each pixel, {@code P} neighbors are sampled by bilinear interpolation on a circle of radius {@code R}
 * (see {@link CircularNeighborhood}). Pixels outside the image are treated as 0.
 * Each neighbor is thresholded against the value of the central pixel, giving one bit per neighbor, which is then
 * encoded according to a {@link Method}.
 * <p>
 * See Ojala, Pietikainen &amp; Maenpaa (2002), <i>Multiresolution Gray-Scale and Rotation Invariant Texture
 * Classification with Local Binary Patterns</i>.
 *
 * @author Pete Bankhead
 *
 */
public class LocalBinaryPatterns {

	private static final Logger logger = LoggerFactory.getLogger(LocalBinaryPatterns.class);

	/**
	 * Maximum number of points for {@link Method#DEFAULT} and {@link Method#ROR}, so that codes fit into a long.
	 */
	public static final int MAX_POINTS_BINARY = 63;

	/**
	 * Maximum number of points for which a histogram can be computed with {@link Method#DEFAULT} and {@link Method#ROR}.
	 */
	public static final int MAX_POINTS_HISTOGRAM = 20;

	/**
	 * Method used to encode the thresholded neighbor values.
	 */
	public enum Method {

		/**
		 * Original local binary pattern: the sum of {@code 2^k} for every neighbor {@code k} that is at least as large
		 * as the central pixel. Gray scale but not rotation invariant.
		 */
		DEFAULT,

		/**
		 * Minimum of all circular rotations of the default pattern. Gray scale and rotation invariant.
		 */
		ROR,

		/**
		 * Number of neighbors at least as large as the central pixel if the pattern is uniform (at most two
		 * transitions between 0 and 1), otherwise {@code P + 1}. Gray scale and rotation invariant.
		 */
		UNIFORM,

		/**
		 * The uniform code divided by the variance of the neighbor values. Rotation but not gray scale invariant.
		 */
		VAR;

		/**
		 * Get the method with the given name, ignoring case ("default", "ror", "uniform" or "var").
		 * @param name
		 * @return
		 * @throws IllegalArgumentException if the name does not match any method
		 */
		public static Method fromString(String name) throws IllegalArgumentException {
			if (name != null) {
				for (var method : values()) {
					if (method.name().equalsIgnoreCase(name.strip()))
						return method;
				}
			}
			throw new IllegalArgumentException(name + " is an invalid local binary pattern method");
		}

		@Override
		public String toString() {
			return name().toLowerCase(Locale.ROOT);
		}

	}

	/**
	 * Compute local binary patterns for every pixel of an image.
	 *
	 * @param img the input image
	 * @param nPoints number of circularly symmetric neighbor points
	 * @param radius radius of the circle
	 * @param method name of the method, one of "default", "ror", "uniform" or "var"
	 * @return
	 * @throws IllegalArgumentException if any of the inputs are invalid
	 * @see Method#fromString(String)
	 */
	public static LocalBinaryPatternImage compute(final SimpleImage img, final int nPoints, final double radius, final String method) throws IllegalArgumentException {
		return compute(img, nPoints, radius, Method.fromString(method));
	}

	/**
	 * Compute local binary patterns for every pixel of an image.
	 * <p>
	 * If {@link ThreadTools#getParallelism()} is greater than 1, bands of rows are processed in parallel.
	 * <p>
	 * For {@link Method#VAR}, pixels in regions of constant value have zero variance and the result is
	 * infinite (or NaN). These values are returned unchanged.
	 *
	 * @param img the input image
	 * @param nPoints number of circularly symmetric neighbor points
	 * @param radius radius of the circle
	 * @param method the method used to encode the pattern
	 * @return
	 * @throws IllegalArgumentException if any of the inputs are invalid
	 */
	public static LocalBinaryPatternImage compute(final SimpleImage img, final int nPoints, final double radius, final Method method) throws IllegalArgumentException {
		if (img == null)
			throw new IllegalArgumentException("Image must not be null");
		if (method == null)
			throw new IllegalArgumentException("Method must not be null");
		if ((method == Method.DEFAULT || method == Method.ROR) && nPoints > MAX_POINTS_BINARY)
			throw new IllegalArgumentException("Method " + method + " supports at most " + MAX_POINTS_BINARY + " points, but " + nPoints + " were requested");
		var neighborhood = CircularNeighborhood.create(nPoints, radius);

		long startTime = System.nanoTime();
		int width = img.getWidth();
		int height = img.getHeight();
		long[] codes = method == Method.VAR ? null : new long[width * height];
		double[] values = method == Method.VAR ? new double[width * height] : null;

		// Read-only access to the pixels, avoiding a copy where possible
		float[] pixels = SimpleImages.getPixels(img, true);

		int nTasks = Math.max(1, Math.min(height, ThreadTools.getParallelism()));
		int rowsPerTask = (int)Math.ceil(height / (double)nTasks);
		List<Runnable> tasks = new ArrayList<>();
		for (int yStart = 0; yStart < height; yStart += rowsPerTask) {
			int y1 = yStart;
			int y2 = Math.min(height, yStart + rowsPerTask);
			tasks.add(() -> computeRows(pixels, width, height, neighborhood, method, y1, y2, codes, values));
		}
		ThreadTools.runAll("lbp-", tasks);

		var output = new LocalBinaryPatternImage(width, height, nPoints, radius, method, codes, values);
		if (method == Method.VAR) {
			int nNonFinite = output.countNonFinite();
			if (nNonFinite > 0) {
				LogTools.warnOnce(logger, "Local binary pattern variance is zero in flat regions - output contains infinite or NaN values");
				logger.debug("{} non-finite values in {}", nNonFinite, output);
			}
		}
		if (logger.isDebugEnabled())
			logger.debug("Computed {} ({} ms)", output, (System.nanoTime() - startTime) / 1_000_000L);
		return output;
	}

	/**
	 * Compute the patterns for rows y1 (inclusive) to y2 (exclusive).
	 * Each call uses its own buffers, and writes only to its own rows of the output.
	 */
	private static void computeRows(final float[] pixels, final int width, final int height, final CircularNeighborhood neighborhood, final Method method,
			final int y1, final int y2, final long[] codes, final double[] values) {
		int size = neighborhood.getWindowSize();
		double[] window = new double[size * size];
		double[] samples = new double[neighborhood.getNumPoints()];
		for (int y = y1; y < y2; y++) {
			for (int x = 0; x < width; x++) {
				extractWindow(pixels, width, height, x, y, neighborhood.getWindowRadius(), window);
				neighborhood.sample(window, samples);
				int ind = y * width + x;
				if (method == Method.VAR)
					values[ind] = encodeVariance(samples);
				else
					codes[ind] = encode(samples, method);
			}
		}
	}

	/**
	 * Extract a square window centred on (x, y), subtracting the value of the central pixel.
	 * Pixels outside the image are treated as 0 (before the subtraction).
	 */
	static void extractWindow(final float[] pixels, final int width, final int height, final int x, final int y, final int windowRadius, final double[] window) {
		double center = pixels[y * width + x];
		int ind = 0;
		for (int yy = y - windowRadius; yy <= y + windowRadius; yy++) {
			boolean rowInside = yy >= 0 && yy < height;
			for (int xx = x - windowRadius; xx <= x + windowRadius; xx++) {
				double val = rowInside && xx >= 0 && xx < width ? pixels[yy * width + xx] : 0;
				window[ind++] = val - center;
			}
		}
	}

	/**
	 * Encode interpolated neighbor values (after subtracting the central value) as an integer pattern.
	 *
	 * @param samples neighbor values, relative to the central pixel
	 * @param method any method except {@link Method#VAR}
	 * @return
	 */
	static long encode(final double[] samples, final Method method) {
		int n = samples.length;
		switch (method) {
		case DEFAULT:
			return binaryPattern(samples);
		case ROR:
			return minimumRotation(binaryPattern(samples), n);
		case UNIFORM:
			return uniformPattern(samples);
		case VAR:
		default:
			throw new IllegalArgumentException("Method " + method + " does not give integer codes");
		}
	}

	/**
	 * Compute the uniform pattern of the samples divided by their (population) variance.
	 * @param samples neighbor values, relative to the central pixel
	 * @return
	 */
	static double encodeVariance(final double[] samples) {
		return uniformPattern(samples) / StatUtils.populationVariance(samples);
	}

	private static long binaryPattern(final double[] samples) {
		long lbp = 0L;
		for (int k = 0; k < samples.length; k++) {
			if (samples[k] >= 0)
				lbp |= 1L << k;
		}
		return lbp;
	}

	/**
	 * Count the number of set bits if there are at most two transitions between consecutive samples,
	 * or return {@code P + 1} otherwise.
	 * Transitions are counted between samples {@code k} and {@code k+1}; the last and first samples are not compared.
	 */
	private static int uniformPattern(final double[] samples) {
		int n = samples.length;
		int nSet = 0;
		int nTransitions = 0;
		boolean previous = false;
		for (int k = 0; k < n; k++) {
			boolean bit = samples[k] >= 0;
			if (bit)
				nSet++;
			if (k > 0 && bit != previous)
				nTransitions++;
			previous = bit;
		}
		return nTransitions <= 2 ? nSet : n + 1;
	}

	/**
	 * Cyclic bit shift to the right.
	 * @param value the value to shift
	 * @param length number of bits used by the value
	 * @return
	 */
	static long rotateRight(final long value, final int length) {
		return (value >>> 1) | ((value & 1L) << (length - 1));
	}

	/**
	 * Get the minimum value from all cyclic rotations of a pattern.
	 * @param pattern
	 * @param length number of bits used by the pattern
	 * @return
	 */
	static long minimumRotation(final long pattern, final int length) {
		long min = pattern;
		long rotated = pattern;
		for (int i = 1; i < length; i++) {
			rotated = rotateRight(rotated, length);
			if (rotated < min)
				min = rotated;
		}
		return min;
	}

	/**
	 * Get the number of histogram bins needed for the codes produced by a method.
	 *
	 * @param method
	 * @param nPoints number of sample points
	 * @return {@code 2^P} for {@link Method#DEFAULT} and {@link Method#ROR}, {@code P + 2} for {@link Method#UNIFORM}
	 * @throws IllegalArgumentException for {@link Method#VAR}, or if {@code 2^P} bins would be required and {@code P} exceeds
	 *                                  {@link #MAX_POINTS_HISTOGRAM}
	 */
	public static int getNumBins(final Method method, final int nPoints) throws IllegalArgumentException {
		Objects.requireNonNull(method, "Method must not be null");
		if (nPoints < 1)
			throw new IllegalArgumentException("Number of points must be at least 1, but was " + nPoints);
		switch (method) {
		case DEFAULT:
		case ROR:
			if (nPoints > MAX_POINTS_HISTOGRAM)
				throw new IllegalArgumentException("Histograms for method " + method + " support at most " + MAX_POINTS_HISTOGRAM + " points");
			return 1 << nPoints;
		case UNIFORM:
			return nPoints + 2;
		case VAR:
		default:
			throw new IllegalArgumentException("Histograms are not supported for method " + method);
		}
	}

	/**
	 * Compute a normalized histogram of local binary pattern codes, i.e. the proportion of pixels having each code.
	 *
	 * @param lbp local binary patterns computed with an integer method
	 * @return
	 * @throws IllegalArgumentException if the patterns are not integer codes, or too many bins would be required
	 * @see #getNumBins(Method, int)
	 */
	public static double[] computeHistogram(final LocalBinaryPatternImage lbp) throws IllegalArgumentException {
		Objects.requireNonNull(lbp, "Local binary patterns must not be null");
		double[] hist = new double[getNumBins(lbp.getMethod(), lbp.getNumPoints())];
		int width = lbp.getWidth();
		int height = lbp.getHeight();
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++)
				hist[(int)lbp.getCode(x, y)]++;
		}
		int n = width * height;
		for (int i = 0; i < hist.length; i++)
			hist[i] /= n;
		return hist;
	}

}
