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
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.primitives.Doubles;

import texquant.lib.analysis.images.GreyLevelImage;
import texquant.lib.common.ThreadTools;

/**
 * Static methods for computing grey-level co-occurrence matrices.
 * <p>
 * For every offset (a combination of distance and angle) each pixel is paired with the pixel at that offset;
 * pairs where the second pixel falls outside the image are skipped (there is no padding or wrapping).
 * <p>
 * If {@link ThreadTools#getParallelism()} is greater than 1, offsets are processed in parallel.
 *
 * @author Pete Bankhead
 *
 */
public class CooccurrenceMatrices {

	private static final Logger logger = LoggerFactory.getLogger(CooccurrenceMatrices.class);

	/**
	 * Maximum supported number of grey levels.
	 */
	public static final int MAX_LEVELS = 256;

	/**
	 * Compute co-occurrence matrices, without symmetrizing or normalizing.
	 *
	 * @param img input image, with values in the range 0 to {@code levels - 1}
	 * @param distances pixel pair distances (non-negative)
	 * @param angles pixel pair angles, in radians
	 * @param levels number of grey levels, at most 256
	 * @return integer co-occurrence histogram of shape {@code (levels, levels, distances.length, angles.length)}
	 * @throws IllegalArgumentException if any of the inputs are invalid
	 */
	public static CoocMatrix compute(final GreyLevelImage img, final double[] distances, final double[] angles, final int levels) throws IllegalArgumentException {
		return compute(img, distances, angles, levels, false, false);
	}

	/**
	 * Compute co-occurrence matrices from lists of distances and angles.
	 *
	 * @param img input image, with values in the range 0 to {@code levels - 1}
	 * @param distances pixel pair distances (non-negative)
	 * @param angles pixel pair angles, in radians
	 * @param levels number of grey levels, at most 256
	 * @param symmetric if true, make each matrix symmetric by adding its transpose
	 * @param normalized if true, normalize each matrix so that it sums to 1
	 * @return
	 * @throws IllegalArgumentException if any of the inputs are invalid
	 * @see #compute(GreyLevelImage, double[], double[], int, boolean, boolean)
	 */
	public static CoocMatrix compute(final GreyLevelImage img, final List<Double> distances, final List<Double> angles, final int levels, final boolean symmetric, final boolean normalized) throws IllegalArgumentException {
		Objects.requireNonNull(distances, "Distances must not be null");
		Objects.requireNonNull(angles, "Angles must not be null");
		return compute(img, Doubles.toArray(distances), Doubles.toArray(angles), levels, symmetric, normalized);
	}

	/**
	 * Compute co-occurrence matrices, optionally symmetrizing and then normalizing them.
	 *
	 * @param img input image, with values in the range 0 to {@code levels - 1}
	 * @param distances pixel pair distances (non-negative)
	 * @param angles pixel pair angles, in radians
	 * @param levels number of grey levels, at most 256
	 * @param symmetric if true, make each matrix symmetric by adding its transpose
	 * @param normalized if true, normalize each matrix so that it sums to 1
	 * @return co-occurrence histogram of shape {@code (levels, levels, distances.length, angles.length)};
	 *         this contains integer counts unless {@code normalized} is true
	 * @throws IllegalArgumentException if any of the inputs are invalid
	 */
	public static CoocMatrix compute(final GreyLevelImage img, final double[] distances, final double[] angles, final int levels, final boolean symmetric, final boolean normalized) throws IllegalArgumentException {
		var matrix = accumulate(img, distances, angles, levels);
		if (symmetric)
			matrix = matrix.symmetrize();
		if (normalized)
			matrix = matrix.normalize();
		return matrix;
	}

	/**
	 * Accumulate raw co-occurrence counts.
	 *
	 * @param img input image, with values in the range 0 to {@code levels - 1}
	 * @param distances pixel pair distances (non-negative)
	 * @param angles pixel pair angles, in radians
	 * @param levels number of grey levels, at most 256
	 * @return integer co-occurrence histogram
	 * @throws IllegalArgumentException if any of the inputs are invalid
	 */
	public static CoocMatrix accumulate(final GreyLevelImage img, final double[] distances, final double[] angles, final int levels) throws IllegalArgumentException {
		checkArguments(img, distances, angles, levels);

		long startTime = System.nanoTime();
		var matrix = new CoocMatrix(levels, distances.clone(), angles.clone());

		List<Runnable> tasks = new ArrayList<>();
		for (int d = 0; d < distances.length; d++) {
			for (int a = 0; a < angles.length; a++) {
				var offset = CoocOffset.fromPolar(distances[d], angles[a]);
				int dInd = d;
				int aInd = a;
				tasks.add(() -> accumulateOffset(matrix, img, offset, dInd, aInd));
			}
		}
		ThreadTools.runAll("cooccurrence-", tasks);

		if (logger.isDebugEnabled())
			logger.debug("Co-occurrence matrices computed for {} with {} levels, {} distances & {} angles ({} ms)",
					img, levels, distances.length, angles.length, (System.nanoTime() - startTime) / 1_000_000L);
		return matrix;
	}

	/**
	 * Count pairs for a single offset. Each call writes only to its own slice of the matrix.
	 */
	private static void accumulateOffset(final CoocMatrix matrix, final GreyLevelImage img, final CoocOffset offset, final int d, final int a) {
		int width = img.getWidth();
		int height = img.getHeight();
		int dx = offset.dx();
		int dy = offset.dy();
		int startRow = Math.max(0, -dy);
		int endRow = Math.min(height, height - dy);
		int startCol = Math.max(0, -dx);
		int endCol = Math.min(width, width - dx);
		for (int y = startRow; y < endRow; y++) {
			for (int x = startCol; x < endCol; x++) {
				int i = img.getLevel(x, y);
				int j = img.getLevel(x + dx, y + dy);
				matrix.addToEntry(i, j, d, a);
			}
		}
	}

	private static void checkArguments(final GreyLevelImage img, final double[] distances, final double[] angles, final int levels) throws IllegalArgumentException {
		if (levels < 1 || levels > MAX_LEVELS)
			throw new IllegalArgumentException("Number of levels must be between 1 and " + MAX_LEVELS + ", but was " + levels);
		if (img == null)
			throw new IllegalArgumentException("Image must not be null");
		if (distances == null)
			throw new IllegalArgumentException("Distances must not be null");
		if (angles == null)
			throw new IllegalArgumentException("Angles must not be null");
		if (img.getMinLevel() < 0)
			throw new IllegalArgumentException("Image values must not be negative, but minimum was " + img.getMinLevel());
		if (img.getMaxLevel() >= levels)
			throw new IllegalArgumentException("Image values must be less than the number of levels (" + levels + "), but maximum was " + img.getMaxLevel());
		try {
			Math.multiplyExact(Math.multiplyExact(levels * levels, distances.length), angles.length);
		} catch (ArithmeticException e) {
			throw new IllegalArgumentException("Too many entries for " + levels + " levels, " + distances.length +
					" distances & " + angles.length + " angles", e);
		}
		for (double d : distances) {
			if (!Double.isFinite(d) || d < 0)
				throw new IllegalArgumentException("Distances must be finite and non-negative, but found " + d);
		}
		for (double a : angles) {
			if (!Double.isFinite(a))
				throw new IllegalArgumentException("Angles must be finite, but found " + a);
		}
	}

}
