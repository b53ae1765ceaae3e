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

import java.util.Arrays;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rtkit.lib.analysis.images.PixelGrid;
import rtkit.lib.analysis.images.PixelGrids;
import rtkit.lib.common.Prefs;
import rtkit.lib.images.CoordinateTransforms;
import rtkit.lib.images.ImageGeometry;

/**
 * Change the number of columns and rows of an image by cropping or padding its edges, 
 * while keeping the physical coordinates of all retained pixels unchanged.
 * <p>
 * Each axis is handled independently. Where columns or rows are removed or added at the 
 * first edge (left or top), the image position is moved accordingly along the direction 
 * cosines, so that {@link CoordinateTransforms} gives the same physical coordinate for 
 * a retained pixel before and after resizing.
 */
public class GridResizer {
	
	private static final Logger logger = LoggerFactory.getLogger(GridResizer.class);
	
	// Suppressed default constructor for non-instantiability
	private GridResizer() {
		throw new AssertionError();
	}
	
	/**
	 * Resize a grid and its geometry, splitting any change evenly between opposite edges.
	 * 
	 * @param grid
	 * @param geometry
	 * @param columns
	 * @param rows
	 * @return
	 * @see #resize(PixelGrid, ImageGeometry, int, int, HorizontalAlignment, VerticalAlignment)
	 */
	public static ResizedGrid resize(PixelGrid grid, ImageGeometry geometry, int columns, int rows) {
		return resize(grid, geometry, columns, rows, HorizontalAlignment.CENTER, VerticalAlignment.CENTER);
	}
	
	/**
	 * Resize a grid and its geometry, setting new pixels to {@link Prefs#getPadValue()}.
	 * 
	 * @param grid
	 * @param geometry
	 * @param columns
	 * @param rows
	 * @param horizontal
	 * @param vertical
	 * @return
	 * @see #resize(PixelGrid, ImageGeometry, int, int, HorizontalAlignment, VerticalAlignment, float)
	 */
	public static ResizedGrid resize(PixelGrid grid, ImageGeometry geometry, int columns, int rows, 
			HorizontalAlignment horizontal, VerticalAlignment vertical) {
		return resize(grid, geometry, columns, rows, horizontal, vertical, Prefs.getPadValue());
	}
	
	/**
	 * Resize a grid and its geometry.
	 * 
	 * @param grid the pixels; dimensions must match the geometry
	 * @param geometry the geometry of the pixels
	 * @param columns the new number of columns
	 * @param rows the new number of rows
	 * @param horizontal where columns are removed or added
	 * @param vertical where rows are removed or added
	 * @param padValue value for any added pixels
	 * @return the resized grid and updated geometry
	 * @throws IllegalArgumentException if the requested size is not positive or too large, or the grid does not match the geometry
	 */
	public static ResizedGrid resize(PixelGrid grid, ImageGeometry geometry, int columns, int rows, 
			HorizontalAlignment horizontal, VerticalAlignment vertical, float padValue) throws IllegalArgumentException {
		Objects.requireNonNull(grid, "Pixel grid must not be null");
		Objects.requireNonNull(geometry, "Geometry must not be null");
		if (grid.getColumns() != geometry.getColumns() || grid.getRows() != geometry.getRows())
			throw new IllegalArgumentException(String.format("Pixel grid size %d x %d does not match geometry size %d x %d",
					grid.getColumns(), grid.getRows(), geometry.getColumns(), geometry.getRows()));
		
		var margins = computeMargins(geometry.getColumns(), geometry.getRows(), columns, rows, horizontal, vertical);
		logger.debug("Resizing {} x {} grid to {} x {} with {}", geometry.getColumns(), geometry.getRows(), columns, rows, margins);
		
		var resizedGrid = applyMargins(grid, margins, padValue);
		var resizedGeometry = applyMargins(geometry, margins);
		return new ResizedGrid(resizedGrid, resizedGeometry, margins);
	}
	
	/**
	 * Resize a geometry without any pixels, splitting any change evenly between opposite edges.
	 * 
	 * @param geometry
	 * @param columns
	 * @param rows
	 * @return
	 */
	public static ImageGeometry resize(ImageGeometry geometry, int columns, int rows) {
		return resize(geometry, columns, rows, HorizontalAlignment.CENTER, VerticalAlignment.CENTER);
	}
	
	/**
	 * Resize a geometry without any pixels.
	 * This gives the same geometry as {@link #resize(PixelGrid, ImageGeometry, int, int, HorizontalAlignment, VerticalAlignment)}.
	 * 
	 * @param geometry
	 * @param columns
	 * @param rows
	 * @param horizontal
	 * @param vertical
	 * @return
	 * @throws IllegalArgumentException if the requested size is not positive
	 */
	public static ImageGeometry resize(ImageGeometry geometry, int columns, int rows, 
			HorizontalAlignment horizontal, VerticalAlignment vertical) throws IllegalArgumentException {
		Objects.requireNonNull(geometry, "Geometry must not be null");
		var margins = computeMargins(geometry.getColumns(), geometry.getRows(), columns, rows, horizontal, vertical);
		return applyMargins(geometry, margins);
	}
	
	/**
	 * Compute the signed change at each edge needed to resize a grid.
	 * 
	 * @param currentColumns
	 * @param currentRows
	 * @param columns target number of columns
	 * @param rows target number of rows
	 * @param horizontal
	 * @param vertical
	 * @return
	 * @throws IllegalArgumentException if the target size is not positive
	 */
	public static Margins computeMargins(int currentColumns, int currentRows, int columns, int rows, 
			HorizontalAlignment horizontal, VerticalAlignment vertical) throws IllegalArgumentException {
		if (columns <= 0)
			throw new IllegalArgumentException("Invalid argument 'columns': must be > 0, got " + columns);
		if (rows <= 0)
			throw new IllegalArgumentException("Invalid argument 'rows': must be > 0, got " + rows);
		Objects.requireNonNull(horizontal, "Horizontal alignment must not be null");
		Objects.requireNonNull(vertical, "Vertical alignment must not be null");
		
		int dx = columns - currentColumns;
		int dy = rows - currentRows;
		int left = horizontal.leading(dx);
		int top = vertical.leading(dy);
		return Margins.of(left, dx - left, top, dy - top);
	}
	
	/**
	 * Apply margins to a grid, creating a new grid. The input grid is unchanged.
	 * 
	 * @param grid
	 * @param margins
	 * @param padValue value for any added pixels
	 * @return
	 * @throws IllegalArgumentException if the margins would remove more columns or rows than the grid has, 
	 *                                  or the resized grid would be too large
	 */
	public static PixelGrid applyMargins(PixelGrid grid, Margins margins, float padValue) throws IllegalArgumentException {
		int oldColumns = grid.getColumns();
		int oldRows = grid.getRows();
		int newColumns = oldColumns + margins.getXSum();
		int newRows = oldRows + margins.getYSum();
		if (newColumns < 0 || newRows < 0)
			throw new IllegalArgumentException("Cannot apply " + margins + " to " + oldColumns + " x " + oldRows + " grid");
		
		int length;
		try {
			length = Math.multiplyExact(newColumns, newRows);
		} catch (ArithmeticException e) {
			throw new IllegalArgumentException("Resized grid " + newColumns + " x " + newRows + " exceeds the maximum number of pixels", e);
		}
		
		float[] src = grid.getArray(true);
		float[] dst = new float[length];
		if (padValue != 0f)
			Arrays.fill(dst, padValue);
		
		// Range of new columns that map onto old columns
		int c1 = Math.max(0, margins.getLeft());
		int c2 = Math.min(newColumns, oldColumns + margins.getLeft());
		int r1 = Math.max(0, margins.getTop());
		int r2 = Math.min(newRows, oldRows + margins.getTop());
		int rowLength = c2 - c1;
		if (rowLength > 0) {
			for (int r = r1; r < r2; r++) {
				int rOld = r - margins.getTop();
				System.arraycopy(src, rOld * oldColumns + c1 - margins.getLeft(), dst, r * newColumns + c1, rowLength);
			}
		}
		return PixelGrids.wrap(dst, newColumns, newRows);
	}
	
	/**
	 * Apply margins to a geometry, updating the extents and moving the position so that 
	 * retained pixels keep their physical coordinates.
	 * 
	 * @param geometry
	 * @param margins
	 * @return
	 */
	public static ImageGeometry applyMargins(ImageGeometry geometry, Margins margins) {
		if (margins.isEmpty())
			return geometry;
		var builder = geometry.toBuilder()
				.extents(geometry.getColumns() + margins.getXSum(), geometry.getRows() + margins.getYSum());
		if (margins.getLeft() != 0 || margins.getTop() != 0) {
			// New first pixel sits at old index (-left, -top)
			var position = CoordinateTransforms.coordinateFromIndex(geometry, -margins.getLeft(), -margins.getTop());
			builder.position(position.getX(), position.getY(), position.getZ());
		}
		return builder.build();
	}
	
	/**
	 * Half of a value, rounded away from zero (so 3 gives 2 and -3 gives -2).
	 */
	static int halfRoundedAway(int delta) {
		return delta >= 0 ? (delta + 1) / 2 : -((1 - delta) / 2);
	}

}
