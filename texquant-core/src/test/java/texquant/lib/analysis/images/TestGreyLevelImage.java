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

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestGreyLevelImage {
	
	@Test
	public void test_create() {
		int[][] rows = {
				{0, 0, 1, 1},
				{0, 0, 1, 1},
				{0, 2, 2, 2},
				{2, 2, 3, 3}
		};
		var img = GreyLevelImage.create(rows);
		assertEquals(4, img.getWidth());
		assertEquals(4, img.getHeight());
		assertEquals(0, img.getMinLevel());
		assertEquals(3, img.getMaxLevel());
		assertEquals(1, img.getLevel(3, 0));
		assertEquals(2, img.getLevel(1, 2));
		
		// Input is copied
		rows[0][0] = 10;
		assertEquals(0, img.getLevel(0, 0));
		
		var img2 = GreyLevelImage.create(new int[] {5, 7, -1}, 3, 1);
		assertEquals(-1, img2.getMinLevel());
		assertEquals(7, img2.getMaxLevel());
	}
	
	@Test
	public void test_invalidShapes() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> GreyLevelImage.create(new int[][] {{0, 1}, {2}}));
		Assertions.assertThrows(IllegalArgumentException.class, () -> GreyLevelImage.create(new int[0][]));
		Assertions.assertThrows(IllegalArgumentException.class, () -> GreyLevelImage.create(new int[4], 3, 1));
		Assertions.assertThrows(IllegalArgumentException.class, () -> GreyLevelImage.create(new int[0], 0, 0));
		Assertions.assertThrows(NullPointerException.class, () -> GreyLevelImage.create((int[][])null));
	}
	
	@Test
	public void test_quantize() {
		var img = SimpleImages.createFloatImage(new float[] {0, 1, 2, 3, 4, 5, 6, 7, 8, 9}, 10, 1);
		
		// Fixed limits
		var levels = GreyLevelImage.quantize(img, 5, 0, 10);
		int[] expected = {0, 0, 1, 1, 2, 2, 3, 3, 4, 4};
		for (int x = 0; x < expected.length; x++)
			assertEquals(expected[x], levels.getLevel(x, 0));
		
		// Limits from the image, maximum value in the last bin
		levels = GreyLevelImage.quantize(img, 5, Double.NaN, Double.NaN);
		for (int x = 0; x < expected.length; x++)
			assertEquals(expected[x], levels.getLevel(x, 0));
		
		// Values outside the limits are clipped
		var img2 = SimpleImages.createFloatImage(new float[] {-5, 100}, 2, 1);
		levels = GreyLevelImage.quantize(img2, 8, 0, 10);
		assertEquals(0, levels.getLevel(0, 0));
		assertEquals(7, levels.getLevel(1, 0));
	}
	
	@Test
	public void test_quantizeConstant() {
		var img = SimpleImages.createFloatImage(new float[] {3, 3, 3, 3}, 2, 2);
		var levels = GreyLevelImage.quantize(img, 16, Double.NaN, Double.NaN);
		assertEquals(0, levels.getMinLevel());
		assertEquals(0, levels.getMaxLevel());
	}
	
	@Test
	public void test_quantizeInvalid() {
		var img = SimpleImages.createFloatImage(new float[] {0, Float.NaN}, 2, 1);
		Assertions.assertThrows(IllegalArgumentException.class, () -> GreyLevelImage.quantize(img, 4, 0, 1));
		var img2 = SimpleImages.createFloatImage(2, 2);
		Assertions.assertThrows(IllegalArgumentException.class, () -> GreyLevelImage.quantize(img2, 0, 0, 1));
		Assertions.assertThrows(IllegalArgumentException.class, () -> GreyLevelImage.quantize(img2, 257, 0, 1));
	}

}
