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

import java.util.Locale;
import java.util.Map;

import texquant.lib.common.GeneralTools;

/**
 * Haralick features computed for every offset of a {@link CoocMatrix}.
 * <p>
 * As well as the values for individual offsets, features can be summarized across all angles for a given distance.
 * This is useful to obtain (approximately) rotation invariant measurements.
 *
 * @author Pete Bankhead
 * @see HaralickFeatureComputer#computeFeatures(CoocMatrix)
 */
public class HaralickFeatures {

	private final int nDistances;
	private final int nAngles;
	private final double[] distances;
	private final Map<HaralickFeature, double[][]> features;

	HaralickFeatures(final CoocMatrix matrix, final Map<HaralickFeature, double[][]> features) {
		this.nDistances = matrix.getNumDistances();
		this.nAngles = matrix.getNumAngles();
		this.distances = new double[nDistances];
		for (int d = 0; d < nDistances; d++)
			distances[d] = matrix.getDistance(d);
		this.features = features;
	}

	/**
	 * Number of distances.
	 * @return
	 */
	public int getNumDistances() {
		return nDistances;
	}

	/**
	 * Number of angles.
	 * @return
	 */
	public int getNumAngles() {
		return nAngles;
	}

	/**
	 * Get the value of a feature for a single offset.
	 * @param feature
	 * @param d distance index
	 * @param a angle index
	 * @return
	 */
	public double getValue(final HaralickFeature feature, final int d, final int a) {
		return features.get(feature)[d][a];
	}

	/**
	 * Get a copy of the values of a feature for all offsets, indexed by {@code [distance][angle]}.
	 * @param feature
	 * @return
	 */
	public double[][] getValues(final HaralickFeature feature) {
		double[][] values = features.get(feature);
		double[][] copy = new double[nDistances][];
		for (int d = 0; d < nDistances; d++)
			copy[d] = values[d].clone();
		return copy;
	}

	/**
	 * Get the mean value of a feature across all angles for one distance.
	 * @param feature
	 * @param d distance index
	 * @return
	 */
	public double getMeanOverAngles(final HaralickFeature feature, final int d) {
		double[] values = features.get(feature)[d];
		double sum = 0;
		for (double val : values)
			sum += val / nAngles;
		return sum;
	}

	/**
	 * Get the minimum value of a feature across all angles for one distance.
	 * NaN is returned only if all values are NaN.
	 * @param feature
	 * @param d distance index
	 * @return
	 */
	public double getMinOverAngles(final HaralickFeature feature, final int d) {
		double min = Double.NaN;
		for (double val : features.get(feature)[d]) {
			if (!(min < val))
				min = Double.isNaN(val) ? min : val;
		}
		return min;
	}

	/**
	 * Get the maximum value of a feature across all angles for one distance.
	 * NaN is returned only if all values are NaN.
	 * @param feature
	 * @param d distance index
	 * @return
	 */
	public double getMaxOverAngles(final HaralickFeature feature, final int d) {
		double max = Double.NaN;
		for (double val : features.get(feature)[d]) {
			if (!(max > val))
				max = Double.isNaN(val) ? max : val;
		}
		return max;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(getClass().getSimpleName());
		for (var entry : features.entrySet()) {
			for (int d = 0; d < nDistances; d++) {
				sb.append("\n").append(entry.getKey())
					.append(" (d=").append(GeneralTools.formatNumber(Locale.US, distances[d], 2)).append("): ")
					.append(GeneralTools.arrayToString(Locale.US, entry.getValue()[d], ", ", 4));
			}
		}
		return sb.toString();
	}

}
