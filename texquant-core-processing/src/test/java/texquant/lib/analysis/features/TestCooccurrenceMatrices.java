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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import texquant.lib.analysis.images.GreyLevelImage;
import texquant.lib.common.ThreadTools;

@SuppressWarnings("javadoc")
public class TestCooccurrenceMatrices {
	
	private static final double EPSILON = 1e-12;
	
	static GreyLevelImage createExampleImage() {
		return GreyLevelImage.create(new int[][] {
			{0, 0, 1, 1},
			{0, 0, 1, 1},
			{0, 2, 2, 2},
			{2, 2, 3, 3}
		});
	}
	
	static GreyLevelImage createRandomImage(int width, int height, int levels, long seed) {
		var random = new Random(seed);
		int[] data = new int[width * height];
		for (int i = 0; i < data.length; i++)
			data[i] = random.nextInt(levels);
		return GreyLevelImage.create(data, width, height);
	}
	
	@AfterEach
	public void resetParallelism() {
		ThreadTools.setParallelism(1);
	}
	
	@Test
	public void test_exampleCounts() {
		var matrix = CooccurrenceMatrices.compute(createExampleImage(), new double[] {1}, new double[] {0, Math.PI/2}, 4);
		
		assertEquals(4, matrix.getN());
		assertEquals(1, matrix.getNumDistances());
		assertEquals(2, matrix.getNumAngles());
		assertTrue(matrix.isIntegerHistogram());
		assertFalse(matrix.isSymmetric());
		assertFalse(matrix.isNormalized());
		
		double[][] horizontal = {
				{2, 2, 1, 0},
				{0, 2, 0, 0},
				{0, 0, 3, 1},
				{0, 0, 0, 1}
		};
		double[][] vertical = {
				{3, 0, 2, 0},
				{0, 2, 2, 0},
				{0, 0, 1, 2},
				{0, 0, 0, 0}
		};
		assertTrue(Arrays.deepEquals(horizontal, matrix.getSlice(0, 0)));
		assertTrue(Arrays.deepEquals(vertical, matrix.getSlice(0, 1)));
		assertEquals(3, matrix.getRawCounts(2, 2, 0, 0));
		assertEquals(2, matrix.getRawCounts(0, 2, 0, 1));
	}
	
	@Test
	public void test_diagonalCounts() {
		var matrix = CooccurrenceMatrices.compute(createExampleImage(), new double[] {1}, new double[] {Math.PI/4, Math.PI*3/4}, 4);
		double[][] diagonal = {
				{1, 1, 3, 0},
				{0, 1, 1, 0},
				{0, 0, 0, 2},
				{0, 0, 0, 0}
		};
		double[][] antiDiagonal = {
				{2, 0, 0, 0},
				{1, 1, 2, 0},
				{0, 0, 2, 1},
				{0, 0, 0, 0}
		};
		assertTrue(Arrays.deepEquals(diagonal, matrix.getSlice(0, 0)));
		assertTrue(Arrays.deepEquals(antiDiagonal, matrix.getSlice(0, 1)));
	}
	
	@Test
	public void test_countsMatchPairs() {
		var img = createRandomImage(23, 17, 8, 42L);
		double[] distances = {0, 1, 2.5, 5, 30};
		double[] angles = {0, Math.PI/4, Math.PI/2, Math.PI*3/4, Math.PI, -Math.PI/3};
		var matrix = CooccurrenceMatrices.compute(img, distances, angles, 8);
		for (int d = 0; d < distances.length; d++) {
			for (int a = 0; a < angles.length; a++) {
				long expected = CoocOffset.fromPolar(distances[d], angles[a]).countPairs(img.getWidth(), img.getHeight());
				assertEquals(expected, matrix.getSliceSum(d, a), "Pair count for distance " + distances[d] + ", angle " + angles[a]);
				assertEquals(distances[d], matrix.getDistance(d));
				assertEquals(angles[a], matrix.getAngle(a));
			}
		}
		// Distance 0 pairs each pixel with itself
		for (int i = 0; i < 8; i++) {
			for (int j = 0; j < 8; j++) {
				if (i != j)
					assertEquals(0, matrix.getRawCounts(i, j, 0, 0));
			}
		}
		// No pairs at all for a distance larger than the image
		assertEquals(0, matrix.getSliceSum(4, 0));
	}
	
	@Test
	public void test_symmetric() {
		var img = createRandomImage(20, 15, 6, 7L);
		double[] distances = {1, 3};
		double[] angles = {0, Math.PI/4, Math.PI/2, Math.PI*3/4};
		var raw = CooccurrenceMatrices.compute(img, distances, angles, 6);
		var sym = CooccurrenceMatrices.compute(img, distances, angles, 6, true, false);
		assertTrue(sym.isSymmetric());
		assertTrue(sym.isIntegerHistogram());
		for (int d = 0; d < distances.length; d++) {
			for (int a = 0; a < angles.length; a++) {
				assertEquals(raw.getSliceSum(d, a) * 2, sym.getSliceSum(d, a));
				for (int i = 0; i < 6; i++) {
					for (int j = 0; j < 6; j++) {
						assertEquals(sym.getRawCounts(i, j, d, a), sym.getRawCounts(j, i, d, a));
						assertEquals(raw.getRawCounts(i, j, d, a) + raw.getRawCounts(j, i, d, a), sym.getRawCounts(i, j, d, a));
					}
				}
			}
		}
		// The original is unchanged
		assertFalse(raw.isSymmetric());
	}
	
	@Test
	public void test_normalized() {
		var img = createExampleImage();
		double[] distances = {1, 2, 10};
		double[] angles = {0, Math.PI/2};
		for (boolean symmetric : new boolean[] {false, true}) {
			var matrix = CooccurrenceMatrices.compute(img, distances, angles, 4, symmetric, true);
			assertTrue(matrix.isNormalized());
			assertEquals(symmetric, matrix.isSymmetric());
			assertFalse(matrix.isIntegerHistogram());
			Assertions.assertThrows(UnsupportedOperationException.class, () -> matrix.getRawCounts(0, 0, 0, 0));
			for (int d = 0; d < 2; d++) {
				for (int a = 0; a < angles.length; a++)
					assertEquals(1.0, matrix.getSliceSum(d, a), EPSILON);
			}
			// No pairs for the largest distance, so the slice stays at zero
			for (int a = 0; a < angles.length; a++)
				assertEquals(0.0, matrix.getSliceSum(2, a));
		}
		
		var normalized = CooccurrenceMatrices.compute(img, new double[] {1}, new double[] {0}, 4, false, true);
		assertEquals(2.0 / 12.0, normalized.get(0, 0, 0, 0), EPSILON);
		assertEquals(3.0 / 12.0, normalized.get(2, 2, 0, 0), EPSILON);
	}
	
	@Test
	public void test_listsMatchArrays() {
		var img = createExampleImage();
		var fromLists = CooccurrenceMatrices.compute(img, List.of(1.0, 2.0), List.of(0.0, Math.PI/2), 4, true, true);
		var fromArrays = CooccurrenceMatrices.compute(img, new double[] {1, 2}, new double[] {0, Math.PI/2}, 4, true, true);
		assertTrue(Arrays.deepEquals(fromArrays.toArray(), fromLists.toArray()));
	}
	
	@Test
	public void test_emptyOffsets() {
		var matrix = CooccurrenceMatrices.compute(createExampleImage(), new double[0], new double[] {0}, 4);
		assertEquals(0, matrix.getNumDistances());
		assertEquals(1, matrix.getNumAngles());
		assertEquals(4, matrix.getN());
	}
	
	@Test
	public void test_parallel() {
		var img = createRandomImage(64, 48, 16, 123L);
		double[] distances = {1, 2, 3};
		double[] angles = {0, Math.PI/4, Math.PI/2, Math.PI*3/4};
		ThreadTools.setParallelism(1);
		var sequential = CooccurrenceMatrices.compute(img, distances, angles, 16, true, false);
		ThreadTools.setParallelism(4);
		var parallel = CooccurrenceMatrices.compute(img, distances, angles, 16, true, false);
		assertTrue(Arrays.deepEquals(sequential.toArray(), parallel.toArray()));
	}
	
	@Test
	public void test_invalidInput() {
		var img = createExampleImage();
		double[] distances = {1};
		double[] angles = {0};
		Assertions.assertThrows(IllegalArgumentException.class, () -> CooccurrenceMatrices.compute(img, distances, angles, 0));
		Assertions.assertThrows(IllegalArgumentException.class, () -> CooccurrenceMatrices.compute(img, distances, angles, 257));
		// Image values must be less than the number of levels
		Assertions.assertThrows(IllegalArgumentException.class, () -> CooccurrenceMatrices.compute(img, distances, angles, 3));
		var negative = GreyLevelImage.create(new int[] {-1, 0, 1, 2}, 2, 2);
		Assertions.assertThrows(IllegalArgumentException.class, () -> CooccurrenceMatrices.compute(negative, distances, angles, 4));
		Assertions.assertThrows(IllegalArgumentException.class, () -> CooccurrenceMatrices.compute(null, distances, angles, 4));
		Assertions.assertThrows(IllegalArgumentException.class, () -> CooccurrenceMatrices.compute(img, null, angles, 4));
		Assertions.assertThrows(IllegalArgumentException.class, () -> CooccurrenceMatrices.compute(img, distances, null, 4));
		Assertions.assertThrows(IllegalArgumentException.class, () -> CooccurrenceMatrices.compute(img, new double[] {-1}, angles, 4));
		Assertions.assertThrows(IllegalArgumentException.class, () -> CooccurrenceMatrices.compute(img, new double[] {Double.NaN}, angles, 4));
		Assertions.assertThrows(IllegalArgumentException.class, () -> CooccurrenceMatrices.compute(img, distances, new double[] {Double.POSITIVE_INFINITY}, 4));
	}
	
	@Test
	public void test_tooManyEntries() {
		// 256 * 256 * 40000 entries cannot be indexed by an int
		var img = GreyLevelImage.create(new int[] {0, 255}, 2, 1);
		double[] distances = new double[40000];
		var e = Assertions.assertThrows(IllegalArgumentException.class,
				() -> CooccurrenceMatrices.compute(img, distances, new double[] {0}, CooccurrenceMatrices.MAX_LEVELS));
		assertTrue(e.getCause() instanceof ArithmeticException);
	}
	
	@Test
	public void test_maxLevels() {
		var img = GreyLevelImage.create(new int[] {0, 255, 255, 0}, 2, 2);
		var matrix = CooccurrenceMatrices.compute(img, new double[] {1}, new double[] {0}, CooccurrenceMatrices.MAX_LEVELS);
		assertEquals(256, matrix.getN());
		assertEquals(1, matrix.getRawCounts(0, 255, 0, 0));
		assertEquals(1, matrix.getRawCounts(255, 0, 0, 0));
		assertArrayEquals(new double[] {0, 1}, new double[] {matrix.get(0, 0, 0, 0), matrix.get(0, 255, 0, 0)});
	}

}
