/*-
 * #%L
 * This file is part of RTKit.
 * %%
 * Copyright (C) 2024 RTKit developers
 * %%
 * RTKit is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * RTKit is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with RTKit.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package rtkit.lib.images;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import rtkit.lib.analysis.images.PixelGrids;
import rtkit.lib.geom.Coordinate;
import rtkit.lib.regions.HorizontalAlignment;
import rtkit.lib.regions.VerticalAlignment;

@SuppressWarnings("javadoc")
public class TestPlanarImage {
	
	private static final String UID = "1.2.840.113704.1.111.2496.1287397130.8";
	
	private static ImageGeometry createGeometry() {
		return new ImageGeometry.Builder()
				.position(-5, -3, 50)
				.spacing(3, 2)
				.extents(4, 4)
				.build();
	}
	
	@Test
	public void test_create() {
		var image = new PlanarImage(UID, createGeometry());
		assertEquals(UID, image.getUID());
		assertFalse(image.hasPixels());
		assertNull(image.getPixels());
		assertEquals(4, image.getColumns());
		assertEquals(4, image.getRows());
		
		var pixels = PixelGrids.create(4, 4);
		image = new PlanarImage(UID, createGeometry(), pixels);
		assertTrue(image.hasPixels());
		assertSame(pixels, image.getPixels());
		
		assertThrows(IllegalArgumentException.class, () -> new PlanarImage(UID, createGeometry(), PixelGrids.create(3, 4)));
		assertThrows(NullPointerException.class, () -> new PlanarImage(null, createGeometry()));
	}
	
	@Test
	public void test_setters() {
		var image = new PlanarImage(UID, createGeometry());
		image.setPosition(10, 20);
		assertEquals(new Coordinate(10, 20, 50), image.getGeometry().getPosition());
		image.setSpacing(0.5, 0.75);
		assertEquals(0.5, image.getGeometry().getRowSpacing());
		assertEquals(0.75, image.getGeometry().getColumnSpacing());
		
		// Without pixels, extents can be changed freely
		image.setColumns(8);
		image.setRows(2);
		assertEquals(8, image.getColumns());
		assertEquals(2, image.getRows());
		assertThrows(IllegalArgumentException.class, () -> image.setColumns(-1));
		assertThrows(IllegalArgumentException.class, () -> image.setRows(-1));
		
		// With pixels, extents must match
		image.setPixels(PixelGrids.create(8, 2));
		var e = assertThrows(IllegalArgumentException.class, () -> image.setColumns(7));
		assertTrue(e.getMessage().contains("pixels"));
		assertThrows(IllegalArgumentException.class, () -> image.setPixels(PixelGrids.create(2, 8)));
		
		image.setPixels(null);
		assertFalse(image.hasPixels());
		image.setColumns(7);
		assertEquals(7, image.getColumns());
	}
	
	@Test
	public void test_setResolutionWithPixels() {
		var pixels = PixelGrids.createFilled(4, 4, 1f);
		PixelGrids.fill(pixels, 0, 0, 2, 4, -1f);
		var image = new PlanarImage(UID, createGeometry(), pixels);
		
		image.setResolution(2, 6, HorizontalAlignment.LEFT, VerticalAlignment.BOTTOM);
		assertEquals(2, image.getColumns());
		assertEquals(6, image.getRows());
		assertEquals(2, image.getPixels().getColumns());
		assertEquals(6, image.getPixels().getRows());
		for (int r = 0; r < 6; r++) {
			for (int c = 0; c < 2; c++)
				assertEquals(r < 4 ? 1f : 0f, image.getPixels().getValue(c, r));
		}
		// Two columns removed at the left
		assertEquals(new Coordinate(-1, -3, 50), image.getGeometry().getPosition());
	}
	
	@Test
	public void test_setResolutionWithoutPixels() {
		var image = new PlanarImage(UID, createGeometry());
		image.setResolution(6, 5);
		assertFalse(image.hasPixels());
		assertEquals(6, image.getColumns());
		assertEquals(5, image.getRows());
		// One column added on the left, one row added at the top
		assertEquals(new Coordinate(-7, -6, 50), image.getGeometry().getPosition());
		
		assertThrows(IllegalArgumentException.class, () -> image.setResolution(0, 5));
		assertThrows(IllegalArgumentException.class, () -> image.setResolution(5, -5));
	}
	
	@Test
	public void test_transforms() {
		var image = new PlanarImage(UID, createGeometry());
		var coords = image.coordinatesFromIndices(new int[] {3, 1}, new int[] {3, 1});
		assertEquals(new Coordinate(1, 6, 50), coords.get(0));
		assertEquals(new Coordinate(-3, 0, 50), coords.get(1));
		assertEquals(coords, image.coordinatesFromIndices(new double[] {3, 1}, new double[] {3, 1}));
		
		var indices = image.coordinatesToIndices(coords.getX(), coords.getY(), coords.getZ());
		assertArrayEquals(new int[] {3, 1}, indices.getColumns());
		assertArrayEquals(new int[] {3, 1}, indices.getRows());
	}
	
	@Test
	public void test_equality() {
		var image1 = new PlanarImage(UID, createGeometry(), PixelGrids.createFilled(4, 4, 2f));
		var image2 = new PlanarImage(UID, createGeometry(), PixelGrids.createFilled(4, 4, 2f));
		assertEquals(image1, image2);
		assertEquals(image1.hashCode(), image2.hashCode());
		
		image2.getPixels().setValue(0, 0, 1f);
		assertNotEquals(image1, image2);
		assertNotEquals(image1, new PlanarImage("1.2.3", createGeometry(), PixelGrids.createFilled(4, 4, 2f)));
	}

}
