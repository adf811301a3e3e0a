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

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

import texquant.lib.common.GeneralTools;

/**
 * Data structure for containing grey-level co-occurrence matrices for a set of pixel offsets.
 * <p>
 * Conceptually this is a 4D array {@code P[i, j, d, a]}, giving the number of times grey level {@code j} occurs
 * at distance index {@code d} and angle index {@code a} from grey level {@code i}.
 * Entries are either integer counts or (e.g. after normalization) floating point values.
 * <p>
 * Instances are effectively immutable once built: {@link #symmetrize()} and {@link #normalize()} return new matrices.
 *
 * @author Pete Bankhead
 *
 */
public class CoocMatrix {

	private final int n;
	private final double[] distances;
	private final double[] angles;

	// Exactly one of these is non-null
	private final long[] counts;
	private final double[] values;

	private final boolean symmetric;
	private final boolean normalized;

	/**
	 * Create an empty count matrix.
	 * @param n number of grey levels
	 * @param distances
	 * @param angles
	 */
	CoocMatrix(int n, double[] distances, double[] angles) {
		this(n, distances, angles, new long[n * n * distances.length * angles.length], null, false, false);
	}

	private CoocMatrix(int n, double[] distances, double[] angles, long[] counts, double[] values, boolean symmetric, boolean normalized) {
		this.n = n;
		this.distances = distances;
		this.angles = angles;
		this.counts = counts;
		this.values = values;
		this.symmetric = symmetric;
		this.normalized = normalized;
	}

	/**
	 * Create a floating point co-occurrence matrix from a 4D array indexed by {@code [i][j][d][a]}.
	 * <p>
	 * Distances and angles are not known in this case, and are reported as NaN.
	 *
	 * @param p the array to copy
	 * @return
	 * @throws IllegalArgumentException if the array is not a complete 4D array, if the first two dimensions differ,
	 *                                  or if there are no distances or angles
	 */
	public static CoocMatrix fromArray(double[][][][] p) throws IllegalArgumentException {
		Objects.requireNonNull(p, "Co-occurrence array must not be null");
		int n = p.length;
		if (n == 0)
			throw new IllegalArgumentException("Co-occurrence array must have at least one level");
		if (p[0] == null || p[0].length != n)
			throw new IllegalArgumentException("Co-occurrence array level dimensions differ: " + n + " and " + (p[0] == null ? 0 : p[0].length));
		if (p[0][0] == null)
			throw new IllegalArgumentException("Co-occurrence array must be 4-dimensional");
		int nDistances = p[0][0].length;
		if (nDistances > 0 && p[0][0][0] == null)
			throw new IllegalArgumentException("Co-occurrence array must be 4-dimensional");
		int nAngles = nDistances == 0 ? 0 : p[0][0][0].length;
		if (nDistances == 0 || nAngles == 0)
			throw new IllegalArgumentException("Co-occurrence array needs at least one distance and one angle, but shape was " +
					n + "x" + n + "x" + nDistances + "x" + nAngles);
		double[] distances = new double[nDistances];
		double[] angles = new double[nAngles];
		Arrays.fill(distances, Double.NaN);
		Arrays.fill(angles, Double.NaN);
		double[] values = new double[n * n * nDistances * nAngles];
		for (int i = 0; i < n; i++) {
			if (p[i] == null || p[i].length != n)
				throw new IllegalArgumentException("Co-occurrence array is not 4-dimensional at level " + i);
			for (int j = 0; j < n; j++) {
				if (p[i][j] == null || p[i][j].length != nDistances)
					throw new IllegalArgumentException("Co-occurrence array is not 4-dimensional at [" + i + "][" + j + "]");
				for (int d = 0; d < nDistances; d++) {
					if (p[i][j][d] == null || p[i][j][d].length != nAngles)
						throw new IllegalArgumentException("Co-occurrence array is not 4-dimensional at [" + i + "][" + j + "][" + d + "]");
					for (int a = 0; a < nAngles; a++)
						values[index(n, nAngles, i, j, d, a)] = p[i][j][d][a];
				}
			}
		}
		return new CoocMatrix(n, distances, angles, null, values, false, false);
	}

	private static int index(int n, int nAngles, int i, int j, int d, int a) {
		return ((d * nAngles + a) * n + i) * n + j;
	}

	private int index(int i, int j, int d, int a) {
		return index(n, angles.length, i, j, d, a);
	}

	/**
	 * Number of grey levels, i.e. the size of each of the first two dimensions.
	 * @return
	 */
	public int getN() {
		return n;
	}

	/**
	 * Number of distances.
	 * @return
	 */
	public int getNumDistances() {
		return distances.length;
	}

	/**
	 * Number of angles.
	 * @return
	 */
	public int getNumAngles() {
		return angles.length;
	}

	/**
	 * Get the distance for a distance index, or NaN if this is unknown.
	 * @param d
	 * @return
	 */
	public double getDistance(int d) {
		return distances[d];
	}

	/**
	 * Get the angle (in radians) for an angle index, or NaN if this is unknown.
	 * @param a
	 * @return
	 */
	public double getAngle(int a) {
		return angles[a];
	}

	/**
	 * Returns true if entries are integer counts, false if they are floating point values.
	 * @return
	 */
	public boolean isIntegerHistogram() {
		return counts != null;
	}

	/**
	 * Returns true if this matrix was created by {@link #symmetrize()}.
	 * @return
	 */
	public boolean isSymmetric() {
		return symmetric;
	}

	/**
	 * Returns true if this matrix was created by {@link #normalize()}.
	 * @return
	 */
	public boolean isNormalized() {
		return normalized;
	}

	void addToEntry(int row, int col, int d, int a) {
		counts[index(row, col, d, a)]++;
	}

	/**
	 * Get an entry, as a count or probability (depending upon whether the matrix has been normalized).
	 *
	 * @param i first grey level
	 * @param j second grey level
	 * @param d distance index
	 * @param a angle index
	 * @return
	 */
	public double get(int i, int j, int d, int a) {
		int ind = index(i, j, d, a);
		return counts == null ? values[ind] : counts[ind];
	}

	/**
	 * Get an entry as an integer count.
	 *
	 * @param i first grey level
	 * @param j second grey level
	 * @param d distance index
	 * @param a angle index
	 * @return
	 * @throws UnsupportedOperationException if this is not an integer histogram
	 * @see #isIntegerHistogram()
	 */
	public long getRawCounts(int i, int j, int d, int a) throws UnsupportedOperationException {
		if (counts == null)
			throw new UnsupportedOperationException("Co-occurrence matrix does not contain integer counts");
		return counts[index(i, j, d, a)];
	}

	/**
	 * Get the sum of all entries for a single offset.
	 * @param d distance index
	 * @param a angle index
	 * @return
	 */
	public double getSliceSum(int d, int a) {
		int start = index(0, 0, d, a);
		int end = start + n * n;
		double sum = 0;
		for (int k = start; k < end; k++)
			sum += counts == null ? values[k] : counts[k];
		return sum;
	}

	/**
	 * Get a copy of the {@code n x n} matrix for a single offset, indexed by {@code [i][j]}.
	 * @param d distance index
	 * @param a angle index
	 * @return
	 */
	public double[][] getSlice(int d, int a) {
		double[][] slice = new double[n][n];
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < n; j++)
				slice[i][j] = get(i, j, d, a);
		}
		return slice;
	}

	/**
	 * Get a copy of all entries as a 4D array indexed by {@code [i][j][d][a]}.
	 * @return
	 */
	public double[][][][] toArray() {
		double[][][][] p = new double[n][n][distances.length][angles.length];
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < n; j++) {
				for (int d = 0; d < distances.length; d++) {
					for (int a = 0; a < angles.length; a++)
						p[i][j][d][a] = get(i, j, d, a);
				}
			}
		}
		return p;
	}

	/**
	 * Create a symmetric matrix by adding the transpose of each slice, i.e. {@code P[i,j] + P[j,i]}.
	 * <p>
	 * This counts each pair twice, so that entries on the diagonal are doubled.
	 *
	 * @return a new matrix; this one is unchanged
	 */
	public CoocMatrix symmetrize() {
		int nSlices = distances.length * angles.length;
		if (counts != null) {
			long[] output = new long[counts.length];
			for (int s = 0; s < nSlices; s++) {
				int offset = s * n * n;
				for (int i = 0; i < n; i++) {
					for (int j = 0; j < n; j++)
						output[offset + i * n + j] = counts[offset + i * n + j] + counts[offset + j * n + i];
				}
			}
			return new CoocMatrix(n, distances, angles, output, null, true, false);
		} else {
			double[] output = new double[values.length];
			for (int s = 0; s < nSlices; s++) {
				int offset = s * n * n;
				for (int i = 0; i < n; i++) {
					for (int j = 0; j < n; j++)
						output[offset + i * n + j] = values[offset + i * n + j] + values[offset + j * n + i];
				}
			}
			return new CoocMatrix(n, distances, angles, null, output, true, false);
		}
	}

	/**
	 * Create a normalized floating point matrix, in which each slice sums to 1.
	 * <p>
	 * Slices that sum to 0 (i.e. where no pixel pairs were found) remain 0.
	 *
	 * @return a new matrix; this one is unchanged
	 */
	public CoocMatrix normalize() {
		double[] output = new double[n * n * distances.length * angles.length];
		for (int d = 0; d < distances.length; d++) {
			for (int a = 0; a < angles.length; a++) {
				double sum = getSliceSum(d, a);
				if (sum == 0)
					sum = 1;
				int start = index(0, 0, d, a);
				for (int k = start; k < start + n * n; k++)
					output[k] = (counts == null ? values[k] : counts[k]) / sum;
			}
		}
		return new CoocMatrix(n, distances, angles, null, output, symmetric, true);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(getClass().getSimpleName())
			.append(" (").append(n).append(" levels, ")
			.append(distances.length).append(" distances, ")
			.append(angles.length).append(" angles)");
		for (int d = 0; d < distances.length; d++) {
			for (int a = 0; a < angles.length; a++) {
				sb.append("\n").append(String.format(Locale.US, "d=%s, angle=%s:", distances[d], angles[a]));
				double[][] slice = getSlice(d, a);
				sb.append("\n[");
				for (int i = 0; i < n; i++) {
					sb.append(GeneralTools.arrayToString(Locale.US, slice[i], ", ", 4));
					if (i < n-1)
						sb.append("\n");
				}
				sb.append("]");
			}
		}
		return sb.toString();
	}

}
