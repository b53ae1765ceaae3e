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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import rtkit.lib.common.Prefs;

@SuppressWarnings("javadoc")
public class TestBatchTransforms {
	
	private static final int DEFAULT_THREADS = Prefs.getNumThreads();
	
	@AfterEach
	public void resetPrefs() {
		Prefs.setNumThreads(DEFAULT_THREADS);
	}
	
	private static List<ImageGeometry> createGeometries(int n) {
		List<ImageGeometry> list = new ArrayList<>();
		for (int i = 0; i < n; i++) {
			list.add(new ImageGeometry.Builder()
					.position(-5 + i, -3, 50 + 2.5 * i)
					.spacing(3, 2)
					.cosines(i % 2 == 0 ? DirectionCosines.identity() : DirectionCosines.of(0, 0, 1, 1, 0, 0))
					.extents(4, 4)
					.build());
		}
		return list;
	}
	
	@Test
	public void test_matchesSingleTransforms() throws InterruptedException {
		Prefs.setNumThreads(3);
		var geometries = createGeometries(10);
		List<GridIndices> indices = new ArrayList<>();
		for (int i = 0; i < geometries.size(); i++)
			indices.add(GridIndices.of(new int[] {0, i, 3}, new int[] {i, 1, 3}));
		
		var coords = BatchTransforms.coordinatesFromIndices(geometries, indices);
		assertEquals(geometries.size(), coords.size());
		for (int i = 0; i < geometries.size(); i++)
			assertEquals(CoordinateTransforms.coordinatesFromIndices(geometries.get(i), indices.get(i)), coords.get(i));
		
		var roundTrip = BatchTransforms.coordinatesToIndices(geometries, coords);
		assertEquals(indices, roundTrip);
	}
	
	@Test
	public void test_singleThread() throws InterruptedException {
		Prefs.setNumThreads(1);
		var geometries = createGeometries(3);
		var indices = Collections.nCopies(3, GridIndices.of(new int[] {1}, new int[] {2}));
		assertEquals(3, BatchTransforms.coordinatesFromIndices(geometries, indices).size());
	}
	
	@Test
	public void test_empty() throws InterruptedException {
		assertTrue(BatchTransforms.coordinatesFromIndices(Collections.emptyList(), Collections.emptyList()).isEmpty());
	}
	
	@Test
	public void test_sizeMismatch() {
		var geometries = createGeometries(2);
		var indices = Collections.singletonList(GridIndices.of(new int[] {1}, new int[] {2}));
		assertThrows(IllegalArgumentException.class, () -> BatchTransforms.coordinatesFromIndices(geometries, indices));
	}
	
	@Test
	public void test_degenerateGeometryFails() {
		var geometries = new ArrayList<>(createGeometries(2));
		geometries.add(geometries.get(0).toBuilder().cosines(1, 0, 0, 1, 0, 0).build());
		var coords = Collections.nCopies(3, PhysicalCoordinates.of(new double[] {1}, new double[] {2}, new double[] {50}));
		assertThrows(InvalidGeometryException.class, () -> BatchTransforms.coordinatesToIndices(geometries, coords));
	}

}
