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

package rtkit.lib.regions;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import rtkit.lib.analysis.images.PixelGrid;
import rtkit.lib.analysis.images.PixelGrids;
import rtkit.lib.common.Prefs;
import rtkit.lib.images.CoordinateTransforms;
import rtkit.lib.images.DirectionCosines;
import rtkit.lib.images.ImageGeometry;

@SuppressWarnings("javadoc")
public class TestGridResizer {
	
	private static final ImageGeometry GEOMETRY = new ImageGeometry.Builder()
			.position(-5, -3, 50)
			.spacing(3, 2)
			.extents(4, 4)
			.build();
	
	/**
	 * Create a 4x4 grid of ones, with a block of columns set to -1.
	 */
	private static PixelGrid gridWithColumns(int firstColumn, int nColumns) {
		var grid = PixelGrids.createFilled(4, 4, 1f);
		PixelGrids.fill(grid, firstColumn, 0, nColumns, 4, -1f);
		return grid;
	}

	/**
	 * Create a 4x4 grid of ones, with a block of rows set to -1.
	 */
	private static PixelGrid gridWithRows(int firstRow, int nRows) {
		var grid = PixelGrids.createFilled(4, 4, 1f);
		PixelGrids.fill(grid, 0, firstRow, 4, nRows, -1f);
		return grid;
	}
	
	private static void assertAllValues(PixelGrid grid, float expected) {
		for (float v : grid.getArray(false))
			assertEquals(expected, v);
	}
	
	private static void assertColumns(PixelGrid grid, int firstColumn, int lastColumn, float expected) {
		for (int r = 0; r < grid.getRows(); r++) {
			for (int c = firstColumn; c <= lastColumn; c++)
				assertEquals(expected, grid.getValue(c, r), "Unexpected value at column " + c + ", row " + r);
		}
	}

	private static void assertRows(PixelGrid grid, int firstRow, int lastRow, float expected) {
		for (int r = firstRow; r <= lastRow; r++) {
			for (int c = 0; c < grid.getColumns(); c++)
				assertEquals(expected, grid.getValue(c, r), "Unexpected value at column " + c + ", row " + r);
		}
	}
	
	
	@Nested
	class Crop {
		
		@Test
		public void test_centeredEven() {
			var grid = gridWithColumns(0, 1);
			PixelGrids.fill(grid, 3, 0, 1, 4, -1f);
			var result = GridResizer.resize(grid, GEOMETRY, 2, 4);
			assertEquals(2, result.getGrid().getColumns());
			assertEquals(4, result.getGrid().getRows());
			assertAllValues(result.getGrid(), 1f);
			assertEquals(Margins.of(-1, -1, 0, 0), result.getMargins());
		}
		
		@Test
		public void test_centeredOdd() {
			var result = GridResizer.resize(gridWithColumns(0, 1), GEOMETRY, 3, 4);
			assertEquals(3, result.getGrid().getColumns());
			assertAllValues(result.getGrid(), 1f);
			assertEquals(Margins.of(-1, 0, 0, 0), result.getMargins());
		}
		
		@Test
		public void test_left() {
			var result = GridResizer.resize(gridWithColumns(0, 2), GEOMETRY, 2, 4, HorizontalAlignment.LEFT, VerticalAlignment.CENTER);
			assertEquals(2, result.getGrid().getColumns());
			assertAllValues(result.getGrid(), 1f);
		}

		@Test
		public void test_right() {
			var result = GridResizer.resize(gridWithColumns(2, 2), GEOMETRY, 2, 4, HorizontalAlignment.RIGHT, VerticalAlignment.CENTER);
			assertEquals(2, result.getGrid().getColumns());
			assertAllValues(result.getGrid(), 1f);
			// No change at the leading edge, so no change in position
			assertEquals(GEOMETRY.getPosition(), result.getGeometry().getPosition());
		}

		@Test
		public void test_top() {
			var result = GridResizer.resize(gridWithRows(0, 2), GEOMETRY, 4, 2, HorizontalAlignment.CENTER, VerticalAlignment.TOP);
			assertEquals(2, result.getGrid().getRows());
			assertAllValues(result.getGrid(), 1f);
		}

		@Test
		public void test_bottom() {
			var result = GridResizer.resize(gridWithRows(2, 2), GEOMETRY, 4, 2, HorizontalAlignment.CENTER, VerticalAlignment.BOTTOM);
			assertEquals(2, result.getGrid().getRows());
			assertAllValues(result.getGrid(), 1f);
		}
		
		@Test
		public void test_centeredRows() {
			var grid = gridWithRows(0, 1);
			PixelGrids.fill(grid, 0, 3, 4, 1, -1f);
			var result = GridResizer.resize(grid, GEOMETRY, 4, 2);
			assertEquals(2, result.getGrid().getRows());
			assertAllValues(result.getGrid(), 1f);
			
			result = GridResizer.resize(gridWithRows(0, 1), GEOMETRY, 4, 3);
			assertEquals(3, result.getGrid().getRows());
			assertAllValues(result.getGrid(), 1f);
		}
		
		@Test
		public void test_leftMovesPosition() {
			var geometry = GridResizer.resize(GEOMETRY, 2, 4, HorizontalAlignment.LEFT, VerticalAlignment.CENTER);
			assertEquals(2, geometry.getColumns());
			assertEquals(4, geometry.getRows());
			assertEquals(-1, geometry.getPosX(), 1e-12);
			assertEquals(-3, geometry.getPosY(), 1e-12);
			assertEquals(50, geometry.getPosSlice(), 1e-12);
		}
		
	}
	
	
	@Nested
	class Pad {
		
		@Test
		public void test_centeredEven() {
			var result = GridResizer.resize(PixelGrids.createFilled(4, 4, 1f), GEOMETRY, 6, 4);
			var grid = result.getGrid();
			assertEquals(6, grid.getColumns());
			assertColumns(grid, 1, 4, 1f);
			assertColumns(grid, 0, 0, 0f);
			assertColumns(grid, 5, 5, 0f);
		}

		@Test
		public void test_centeredOdd() {
			var result = GridResizer.resize(PixelGrids.createFilled(4, 4, 1f), GEOMETRY, 5, 4);
			var grid = result.getGrid();
			assertEquals(5, grid.getColumns());
			assertColumns(grid, 1, 4, 1f);
			assertColumns(grid, 0, 0, 0f);
			assertEquals(Margins.of(1, 0, 0, 0), result.getMargins());
		}

		@Test
		public void test_left() {
			var result = GridResizer.resize(PixelGrids.createFilled(4, 4, 1f), GEOMETRY, 6, 4, HorizontalAlignment.LEFT, VerticalAlignment.CENTER);
			var grid = result.getGrid();
			assertColumns(grid, 2, 5, 1f);
			assertColumns(grid, 0, 1, 0f);
			assertEquals(-9, result.getGeometry().getPosX(), 1e-12);
		}

		@Test
		public void test_right() {
			var result = GridResizer.resize(PixelGrids.createFilled(4, 4, 1f), GEOMETRY, 6, 4, HorizontalAlignment.RIGHT, VerticalAlignment.CENTER);
			var grid = result.getGrid();
			assertColumns(grid, 0, 3, 1f);
			assertColumns(grid, 4, 5, 0f);
			assertEquals(GEOMETRY.getPosition(), result.getGeometry().getPosition());
		}
		
		@Test
		public void test_rows() {
			var ones = PixelGrids.createFilled(4, 4, 1f);
			
			var grid = GridResizer.resize(ones, GEOMETRY, 4, 6).getGrid();
			assertRows(grid, 1, 4, 1f);
			assertRows(grid, 0, 0, 0f);
			assertRows(grid, 5, 5, 0f);
			
			grid = GridResizer.resize(ones, GEOMETRY, 4, 5).getGrid();
			assertRows(grid, 1, 4, 1f);
			assertRows(grid, 0, 0, 0f);

			grid = GridResizer.resize(ones, GEOMETRY, 4, 6, HorizontalAlignment.CENTER, VerticalAlignment.TOP).getGrid();
			assertRows(grid, 2, 5, 1f);
			assertRows(grid, 0, 1, 0f);

			grid = GridResizer.resize(ones, GEOMETRY, 4, 6, HorizontalAlignment.CENTER, VerticalAlignment.BOTTOM).getGrid();
			assertRows(grid, 0, 3, 1f);
			assertRows(grid, 4, 5, 0f);
		}
		
		@Test
		public void test_padValue() {
			var grid = GridResizer.resize(PixelGrids.createFilled(4, 4, 1f), GEOMETRY, 6, 4,
					HorizontalAlignment.CENTER, VerticalAlignment.CENTER, -1000f).getGrid();
			assertColumns(grid, 1, 4, 1f);
			assertColumns(grid, 0, 0, -1000f);
			assertColumns(grid, 5, 5, -1000f);
		}
		
		@Test
		public void test_padValueIgnoresPrefs() {
			float previous = Prefs.getPadValue();
			try {
				Prefs.setPadValue(7f);
				var grid = GridResizer.resize(PixelGrids.createFilled(4, 4, 1f), GEOMETRY, 4, 6,
						HorizontalAlignment.CENTER, VerticalAlignment.TOP, -2f).getGrid();
				assertRows(grid, 0, 1, -2f);
				assertRows(grid, 2, 5, 1f);
			} finally {
				Prefs.setPadValue(previous);
			}
		}
		
		@Test
		public void test_defaultPadValueFromPrefs() {
			float previous = Prefs.getPadValue();
			try {
				Prefs.setPadValue(-1000f);
				var grid = GridResizer.resize(PixelGrids.createFilled(4, 4, 1f), GEOMETRY, 6, 4).getGrid();
				assertColumns(grid, 0, 0, -1000f);
				assertColumns(grid, 1, 4, 1f);
			} finally {
				Prefs.setPadValue(previous);
			}
		}
		
		@Test
		public void test_sizeOverflow() {
			var e = assertThrows(IllegalArgumentException.class, 
					() -> GridResizer.resize(PixelGrids.createFilled(4, 4, 1f), GEOMETRY, 65536, 65537));
			assertTrue(e.getMessage().contains("65536 x 65537"));
		}
		
	}
	
	
	@Test
	public void test_cropColumnsAndPadRows() {
		var result = GridResizer.resize(gridWithColumns(0, 2), GEOMETRY, 2, 6, HorizontalAlignment.LEFT, VerticalAlignment.BOTTOM);
		var grid = result.getGrid();
		assertEquals(2, grid.getColumns());
		assertEquals(6, grid.getRows());
		assertRows(grid, 0, 3, 1f);
		assertRows(grid, 4, 5, 0f);
		assertEquals(Margins.of(-2, 0, 0, 2), result.getMargins());
	}
	
	@Test
	public void test_noChange() {
		var grid = gridWithColumns(1, 2);
		var result = GridResizer.resize(grid, GEOMETRY, 4, 4);
		assertTrue(result.getMargins().isEmpty());
		assertEquals(grid, result.getGrid());
		assertEquals(GEOMETRY, result.getGeometry());
	}
	
	@ParameterizedTest
	@EnumSource(HorizontalAlignment.class)
	public void test_sameSizeForAnyPolicy(HorizontalAlignment horizontal) {
		for (var vertical : VerticalAlignment.values()) {
			var margins = GridResizer.computeMargins(4, 4, 4, 4, horizontal, vertical);
			assertSame(Margins.empty(), margins);
			assertSame(GEOMETRY, GridResizer.resize(GEOMETRY, 4, 4, horizontal, vertical));
		}
	}
	
	@Test
	public void test_inputUnchanged() {
		var grid = gridWithColumns(0, 1);
		var copy = PixelGrids.copy(grid);
		GridResizer.resize(grid, GEOMETRY, 2, 7, HorizontalAlignment.RIGHT, VerticalAlignment.TOP);
		assertEquals(copy, grid);
		assertEquals(4, GEOMETRY.getColumns());
	}
	
	@Test
	public void test_invalidSize() {
		var grid = PixelGrids.createFilled(4, 4, 1f);
		var e = assertThrows(IllegalArgumentException.class, () -> GridResizer.resize(grid, GEOMETRY, 0, 4));
		assertTrue(e.getMessage().contains("columns"));
		e = assertThrows(IllegalArgumentException.class, () -> GridResizer.resize(grid, GEOMETRY, 4, -2));
		assertTrue(e.getMessage().contains("rows"));
		assertThrows(IllegalArgumentException.class, () -> GridResizer.resize(GEOMETRY, -1, 4));
	}
	
	@Test
	public void test_gridGeometryMismatch() {
		var grid = PixelGrids.createFilled(3, 4, 1f);
		assertThrows(IllegalArgumentException.class, () -> GridResizer.resize(grid, GEOMETRY, 2, 2));
	}
	
	@Test
	public void test_geometryOnlyMatchesGrid() {
		var grid = PixelGrids.createFilled(4, 4, 1f);
		for (var h : HorizontalAlignment.values()) {
			for (var v : VerticalAlignment.values()) {
				var result = GridResizer.resize(grid, GEOMETRY, 7, 1, h, v);
				assertEquals(result.getGeometry(), GridResizer.resize(GEOMETRY, 7, 1, h, v));
			}
		}
	}
	
	@Test
	public void test_halfRoundedAway() {
		assertEquals(0, GridResizer.halfRoundedAway(0));
		assertEquals(1, GridResizer.halfRoundedAway(1));
		assertEquals(1, GridResizer.halfRoundedAway(2));
		assertEquals(2, GridResizer.halfRoundedAway(3));
		assertEquals(-1, GridResizer.halfRoundedAway(-1));
		assertEquals(-1, GridResizer.halfRoundedAway(-2));
		assertEquals(-2, GridResizer.halfRoundedAway(-3));
	}
	
	@Test
	public void test_computeMargins() {
		assertEquals(Margins.of(-3, -2, 0, 0), GridResizer.computeMargins(10, 10, 5, 10, HorizontalAlignment.CENTER, VerticalAlignment.CENTER));
		assertEquals(Margins.of(0, 0, 3, 2), GridResizer.computeMargins(10, 10, 10, 15, HorizontalAlignment.CENTER, VerticalAlignment.CENTER));
		assertEquals(Margins.of(0, 5, -5, 0), GridResizer.computeMargins(10, 10, 15, 5, HorizontalAlignment.RIGHT, VerticalAlignment.TOP));
	}
	
	
	@ParameterizedTest
	@MethodSource("provideResizeParameters")
	public void test_retainedPixelsKeepCoordinates(DirectionCosines cosines, int columns, int rows, 
			HorizontalAlignment horizontal, VerticalAlignment vertical) {
		var geometry = new ImageGeometry.Builder()
				.position(-5, -3, 50)
				.spacing(3, 2)
				.cosines(cosines)
				.extents(4, 4)
				.build();
		var resized = GridResizer.resize(geometry, columns, rows, horizontal, vertical);
		var margins = GridResizer.computeMargins(4, 4, columns, rows, horizontal, vertical);
		assertEquals(columns, resized.getColumns());
		assertEquals(rows, resized.getRows());
		
		for (int r = 0; r < rows; r++) {
			for (int c = 0; c < columns; c++) {
				int cOld = c - margins.getLeft();
				int rOld = r - margins.getTop();
				if (cOld < 0 || rOld < 0 || cOld >= 4 || rOld >= 4)
					continue;
				var before = CoordinateTransforms.coordinateFromIndex(geometry, cOld, rOld);
				var after = CoordinateTransforms.coordinateFromIndex(resized, c, r);
				assertEquals(0, before.distance(after), 1e-9);
			}
		}
	}
	
	static Stream<Arguments> provideResizeParameters() {
		List<Arguments> args = new ArrayList<>();
		var cosines = new DirectionCosines[] {
				DirectionCosines.of(1, 0, 0, 0, 1, 0),
				DirectionCosines.of(-1, 0, 0, 0, -1, 0),
				DirectionCosines.of(0, 0, 1, 1, 0, 0),
				DirectionCosines.of(0.9953, -0.03130, 0.09128, 0.0, 0.9459, 0.3244)
		};
		int[][] sizes = {{2, 3}, {6, 5}, {3, 6}, {1, 1}};
		for (var cos : cosines) {
			for (var size : sizes) {
				for (var h : HorizontalAlignment.values()) {
					for (var v : VerticalAlignment.values()) {
						args.add(Arguments.of(cos, size[0], size[1], h, v));
					}
				}
			}
		}
		return args.stream();
	}
	
	@Test
	public void test_rotatedMovesSlicePosition() {
		var geometry = GEOMETRY.toBuilder()
				.cosines(0, 0, 1, 1, 0, 0)
				.build();
		var resized = GridResizer.resize(geometry, 2, 4, HorizontalAlignment.LEFT, VerticalAlignment.CENTER);
		// Columns run along z here
		assertEquals(-5, resized.getPosX(), 1e-12);
		assertEquals(-3, resized.getPosY(), 1e-12);
		assertEquals(54, resized.getPosSlice(), 1e-12);
	}

}
