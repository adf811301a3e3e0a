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

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestCircularNeighborhood {
	
	private static final double EPSILON = 1e-12;
	
	@Test
	public void test_offsets() {
		var neighborhood = CircularNeighborhood.create(8, 1);
		assertEquals(8, neighborhood.getNumPoints());
		assertEquals(1, neighborhood.getWindowRadius());
		assertEquals(3, neighborhood.getWindowSize());
		
		// Points on the axes are exact, proceeding counter-clockwise from the right
		double[] xExpected = {1, Math.sqrt(0.5), 0, -Math.sqrt(0.5), -1, -Math.sqrt(0.5), 0, Math.sqrt(0.5)};
		double[] yExpected = {0, -Math.sqrt(0.5), -1, -Math.sqrt(0.5), 0, Math.sqrt(0.5), 1, Math.sqrt(0.5)};
		for (int k = 0; k < 8; k++) {
			assertEquals(xExpected[k], neighborhood.getXOffset(k), EPSILON);
			assertEquals(yExpected[k], neighborhood.getYOffset(k), EPSILON);
		}
		assertEquals(0.0, neighborhood.getXOffset(2));
		assertEquals(-1.0, neighborhood.getYOffset(2));
		assertEquals(0.0, neighborhood.getXOffset(6));
		assertEquals(1.0, neighborhood.getYOffset(6));
	}
	
	@Test
	public void test_window() {
		var neighborhood = CircularNeighborhood.create(12, 1.5);
		assertEquals(2, neighborhood.getWindowRadius());
		assertEquals(5, neighborhood.getWindowSize());
		assertEquals(1.5, neighborhood.getRadius());
		assertEquals(-1.5, neighborhood.getXOffset(6));
		
		neighborhood = CircularNeighborhood.create(4, 3);
		assertEquals(3, neighborhood.getWindowRadius());
		assertEquals(7, neighborhood.getWindowSize());
	}
	
	@Test
	public void test_sample() {
		var neighborhood = CircularNeighborhood.create(4, 1);
		double[] window = {
				0, 1, 0,
				2, 9, 3,
				0, 4, 0
		};
		double[] samples = new double[4];
		neighborhood.sample(window, samples);
		// Right, up, left, down
		Assertions.assertArrayEquals(new double[] {3, 1, 2, 4}, samples);
		
		// Diagonal points are interpolated
		neighborhood = CircularNeighborhood.create(8, 1);
		samples = new double[8];
		double[] ones = {1, 1, 1, 1, 1, 1, 1, 1, 1};
		neighborhood.sample(ones, samples);
		Assertions.assertArrayEquals(new double[] {1, 1, 1, 1, 1, 1, 1, 1}, samples, EPSILON);
	}
	
	@Test
	public void test_invalid() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> CircularNeighborhood.create(0, 1));
		Assertions.assertThrows(IllegalArgumentException.class, () -> CircularNeighborhood.create(8, 0));
		Assertions.assertThrows(IllegalArgumentException.class, () -> CircularNeighborhood.create(8, -1));
		Assertions.assertThrows(IllegalArgumentException.class, () -> CircularNeighborhood.create(8, Double.NaN));
		Assertions.assertThrows(IllegalArgumentException.class, () -> CircularNeighborhood.create(8, Double.POSITIVE_INFINITY));
	}

}
