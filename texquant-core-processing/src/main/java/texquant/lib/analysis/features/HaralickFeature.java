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

/**
 * Scalar properties that can be computed from a grey-level co-occurrence matrix.
 * <p>
 * In the definitions, {@code P} is the matrix entry for grey levels {@code i} and {@code j}, and
 * sums are taken over both levels for each offset independently.
 *
 * @see HaralickFeatureComputer
 */
public enum HaralickFeature {

	/**
	 * {@code sum P (i-j)^2}
	 */
	CONTRAST("contrast", "Contrast"),

	/**
	 * {@code sum P |i-j|}
	 */
	DISSIMILARITY("dissimilarity", "Dissimilarity"),

	/**
	 * {@code sum P / (1 + (i-j)^2)}, also known as the inverse difference moment
	 */
	HOMOGENEITY("homogeneity", "Homogeneity"),

	/**
	 * Angular second moment, {@code sum P^2}
	 */
	ASM("ASM", "Angular second moment"),

	/**
	 * Square root of the angular second moment
	 */
	ENERGY("energy", "Energy"),

	/**
	 * Correlation between the grey levels of paired pixels.
	 * This is defined to be 1 if the standard deviation of either level is (almost) zero.
	 */
	CORRELATION("correlation", "Correlation");

	private final String tag;
	private final String name;

	HaralickFeature(String tag, String name) {
		this.tag = tag;
		this.name = name;
	}

	/**
	 * Short tag used to request this feature by name, e.g. "contrast" or "ASM".
	 * @return
	 */
	public String getTag() {
		return tag;
	}

	/**
	 * Get the feature corresponding to a tag.
	 * <p>
	 * Tags are case-sensitive: "contrast", "dissimilarity", "homogeneity", "ASM", "energy" or "correlation".
	 *
	 * @param tag
	 * @return
	 * @throws IllegalArgumentException if the tag does not match any feature
	 */
	public static HaralickFeature fromString(String tag) throws IllegalArgumentException {
		for (var feature : values()) {
			if (feature.tag.equals(tag))
				return feature;
		}
		throw new IllegalArgumentException(tag + " is an invalid property");
	}

	@Override
	public String toString() {
		return name;
	}

}
