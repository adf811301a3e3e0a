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

import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static methods for computing Haralick texture features from co-occurrence matrices.
 * <p>
 * Each feature is computed independently for every offset, giving a 2D array indexed by {@code [distance][angle]}.
 *
 * @author Pete Bankhead
 *
 */
public class HaralickFeatureComputer {

	private static final Logger logger = LoggerFactory.getLogger(HaralickFeatureComputer.class);

	/**
	 * Standard deviations below this are treated as zero when computing correlation.
	 */
	static final double CORRELATION_EPSILON = 1e-15;

	/**
	 * Compute a single feature, requested by its tag.
	 *
	 * @param matrix co-occurrence matrices
	 * @param tag one of "contrast", "dissimilarity", "homogeneity", "ASM", "energy" or "correlation"
	 * @return array of feature values, indexed by {@code [distance][angle]}
	 * @throws IllegalArgumentException if the tag is unknown or the matrix has no offsets
	 * @see HaralickFeature#fromString(String)
	 */
	public static double[][] computeFeature(final CoocMatrix matrix, final String tag) throws IllegalArgumentException {
		return computeFeature(matrix, HaralickFeature.fromString(tag));
	}

	/**
	 * Compute a single feature from a 4D array indexed by {@code [i][j][d][a]}.
	 *
	 * @param p co-occurrence histogram
	 * @param tag one of "contrast", "dissimilarity", "homogeneity", "ASM", "energy" or "correlation"
	 * @return array of feature values, indexed by {@code [distance][angle]}
	 * @throws IllegalArgumentException if the tag is unknown or the array is not a valid co-occurrence histogram
	 * @see CoocMatrix#fromArray(double[][][][])
	 */
	public static double[][] computeFeature(final double[][][][] p, final String tag) throws IllegalArgumentException {
		var feature = HaralickFeature.fromString(tag);
		return computeFeature(CoocMatrix.fromArray(p), feature);
	}

	/**
	 * Compute a single feature.
	 *
	 * @param matrix co-occurrence matrices
	 * @param feature the feature to compute
	 * @return array of feature values, indexed by {@code [distance][angle]}
	 * @throws IllegalArgumentException if the matrix or feature is null, or the matrix has no offsets
	 */
	public static double[][] computeFeature(final CoocMatrix matrix, final HaralickFeature feature) throws IllegalArgumentException {
		checkMatrix(matrix);
		if (feature == null)
			throw new IllegalArgumentException("Feature must not be null");
		int nDistances = matrix.getNumDistances();
		int nAngles = matrix.getNumAngles();
		double[][] results = new double[nDistances][nAngles];
		for (int d = 0; d < nDistances; d++) {
			for (int a = 0; a < nAngles; a++)
				results[d][a] = computeFeature(matrix, d, a, feature);
		}
		return results;
	}

	/**
	 * Compute all the features in {@link HaralickFeature}.
	 *
	 * @param matrix co-occurrence matrices
	 * @return
	 * @throws IllegalArgumentException if the matrix is null or has no offsets
	 */
	public static HaralickFeatures computeFeatures(final CoocMatrix matrix) throws IllegalArgumentException {
		checkMatrix(matrix);
		Map<HaralickFeature, double[][]> map = new EnumMap<>(HaralickFeature.class);
		for (var feature : HaralickFeature.values())
			map.put(feature, computeFeature(matrix, feature));
		return new HaralickFeatures(matrix, map);
	}

	private static void checkMatrix(final CoocMatrix matrix) throws IllegalArgumentException {
		if (matrix == null)
			throw new IllegalArgumentException("Co-occurrence matrix must not be null");
		if (matrix.getNumDistances() < 1 || matrix.getNumAngles() < 1)
			throw new IllegalArgumentException("Co-occurrence matrix needs at least one distance and one angle, but had " +
					matrix.getNumDistances() + " distances & " + matrix.getNumAngles() + " angles");
	}

	static double computeFeature(final CoocMatrix matrix, final int d, final int a, final HaralickFeature feature) {
		switch (feature) {
		case ASM:
			return angularSecondMoment(matrix, d, a);
		case ENERGY:
			return Math.sqrt(angularSecondMoment(matrix, d, a));
		case CORRELATION:
			return correlation(matrix, d, a);
		case CONTRAST:
		case DISSIMILARITY:
		case HOMOGENEITY:
			return weightedSum(matrix, d, a, feature);
		default:
			throw new IllegalArgumentException("Unknown feature " + feature);
		}
	}

	private static double weightedSum(final CoocMatrix matrix, final int d, final int a, final HaralickFeature feature) {
		int n = matrix.getN();
		double sum = 0;
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < n; j++) {
				double val = matrix.get(i, j, d, a);
				if (val == 0)
					continue;
				int diff = i - j;
				switch (feature) {
				case CONTRAST:
					sum += val * diff * diff;
					break;
				case DISSIMILARITY:
					sum += val * Math.abs(diff);
					break;
				case HOMOGENEITY:
					sum += val / (1.0 + diff * diff);
					break;
				default:
					throw new IllegalArgumentException("Feature " + feature + " is not a weighted sum");
				}
			}
		}
		return sum;
	}

	private static double angularSecondMoment(final CoocMatrix matrix, final int d, final int a) {
		int n = matrix.getN();
		double sum = 0;
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < n; j++) {
				double val = matrix.get(i, j, d, a);
				sum += val * val;
			}
		}
		return sum;
	}

	private static double correlation(final CoocMatrix matrix, final int d, final int a) {
		int n = matrix.getN();
		// Mean row & column levels
		double mx = 0;
		double my = 0;
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < n; j++) {
				double val = matrix.get(i, j, d, a);
				mx += i * val;
				my += j * val;
			}
		}
		// Standard deviations & covariance
		double sx = 0;
		double sy = 0;
		double cov = 0;
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < n; j++) {
				double val = matrix.get(i, j, d, a);
				double diffX = i - mx;
				double diffY = j - my;
				sx += val * diffX * diffX;
				sy += val * diffY * diffY;
				cov += val * diffX * diffY;
			}
		}
		sx = Math.sqrt(sx);
		sy = Math.sqrt(sy);
		if (sx < CORRELATION_EPSILON || sy < CORRELATION_EPSILON) {
			logger.trace("Standard deviation close to zero for distance index {}, angle index {} - correlation set to 1", d, a);
			return 1;
		}
		return cov / (sx * sy);
	}

}
