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

package rtkit.lib.analysis.images;

import java.util.Arrays;
import java.util.Objects;

/**
 * Create {@link PixelGrid} instances.
 */
public class PixelGrids {
	
	/**
	 * Create a grid filled with zeros.
	 * @param columns
	 * @param rows
	 * @return
	 * @throws IllegalArgumentException if either dimension is negative
	 */
	public static PixelGrid create(int columns, int rows) throws IllegalArgumentException {
		return new FloatArrayPixelGrid(new float[checkedLength(columns, rows)], columns, rows);
	}
	
	/**
	 * Create a grid with every pixel set to the same value.
	 * @param columns
	 * @param rows
	 * @param value
	 * @return
	 */
	public static PixelGrid createFilled(int columns, int rows, float value) {
		var grid = create(columns, rows);
		fill(grid, value);
		return grid;
	}
	
	/**
	 * Create a {@link PixelGrid} backed by an existing float array of pixels.
	 * <p>
	 * Pixels are stored row by row, so the value at (column, row) is {@code data[row * columns + column]}.
	 * 
	 * @param data
	 * @param columns
	 * @param rows
	 * @return
	 * @throws IllegalArgumentException if the array length does not match the dimensions
	 */
	public static PixelGrid wrap(float[] data, int columns, int rows) throws IllegalArgumentException {
		Objects.requireNonNull(data, "Pixel array must not be null");
		if (data.length != checkedLength(columns, rows))
			throw new IllegalArgumentException("Pixel array length " + data.length + " does not match " + columns + " x " + rows);
		return new FloatArrayPixelGrid(data, columns, rows);
	}
	
	/**
	 * Create a grid from a 2D array, where {@code values[row][column]}.
	 * All rows must have the same length.
	 * @param values
	 * @return
	 * @throws IllegalArgumentException if rows differ in length
	 */
	public static PixelGrid fromRows(float[]... values) throws IllegalArgumentException {
		int rows = values.length;
		int columns = rows == 0 ? 0 : values[0].length;
		float[] data = new float[columns * rows];
		for (int r = 0; r < rows; r++) {
			if (values[r].length != columns)
				throw new IllegalArgumentException("All rows must have length " + columns + ", but row " + r + " has length " + values[r].length);
			System.arraycopy(values[r], 0, data, r * columns, columns);
		}
		return new FloatArrayPixelGrid(data, columns, rows);
	}
	
	/**
	 * Create an independent copy of a grid.
	 * @param grid
	 * @return
	 */
	public static PixelGrid copy(PixelGrid grid) {
		return new FloatArrayPixelGrid(grid.getArray(false), grid.getColumns(), grid.getRows());
	}
	
	/**
	 * Set all pixels of a grid to the same value.
	 * @param grid
	 * @param value
	 */
	public static void fill(PixelGrid grid, float value) {
		if (grid instanceof FloatArrayPixelGrid) {
			Arrays.fill(((FloatArrayPixelGrid)grid).data, value);
			return;
		}
		for (int r = 0; r < grid.getRows(); r++) {
			for (int c = 0; c < grid.getColumns(); c++)
				grid.setValue(c, r, value);
		}
	}
	
	/**
	 * Fill a rectangle of columns and rows with the same value.
	 * @param grid
	 * @param column first column
	 * @param row first row
	 * @param nColumns number of columns to fill
	 * @param nRows number of rows to fill
	 * @param value
	 * @throws IllegalArgumentException if the rectangle does not lie entirely within the grid
	 */
	public static void fill(PixelGrid grid, int column, int row, int nColumns, int nRows, float value) {
		if (column < 0 || row < 0 || nColumns < 0 || nRows < 0 ||
				nColumns > grid.getColumns() - column || nRows > grid.getRows() - row)
			throw new IllegalArgumentException(String.format("Cannot fill %d x %d region at (%d, %d) of %d x %d grid",
					nColumns, nRows, column, row, grid.getColumns(), grid.getRows()));
		for (int r = row; r < row + nRows; r++) {
			for (int c = column; c < column + nColumns; c++)
				grid.setValue(c, r, value);
		}
	}
	
	private static int checkedLength(int columns, int rows) {
		if (columns < 0 || rows < 0)
			throw new IllegalArgumentException("Grid dimensions must be >= 0, but got " + columns + " x " + rows);
		try {
			return Math.multiplyExact(columns, rows);
		} catch (ArithmeticException e) {
			throw new IllegalArgumentException("Grid size " + columns + " x " + rows + " exceeds the maximum number of pixels", e);
		}
	}
	
	
	/**
	 * Implementation of a PixelGrid backed by an array of floats.
	 */
	static class FloatArrayPixelGrid implements PixelGrid {

		private final float[] data;
		private final int columns;
		private final int rows;
		
		FloatArrayPixelGrid(float[] data, int columns, int rows) {
			this.data = data;
			this.columns = columns;
			this.rows = rows;
		}
		
		private int index(int column, int row) {
			if (column < 0 || column >= columns || row < 0 || row >= rows)
				throw new IndexOutOfBoundsException("Pixel (" + column + ", " + row + ") is outside the " + columns + " x " + rows + " grid");
			return row * columns + column;
		}
		
		@Override
		public float getValue(int column, int row) {
			return data[index(column, row)];
		}

		@Override
		public void setValue(int column, int row, float val) {
			data[index(column, row)] = val;
		}

		@Override
		public int getColumns() {
			return columns;
		}

		@Override
		public int getRows() {
			return rows;
		}
		
		@Override
		public float[] getArray(boolean direct) {
			if (direct)
				return data;
			return data.clone();
		}
		
		@Override
		public String toString() {
			return "PixelGrid (" + columns + " x " + rows + ")";
		}

		@Override
		public int hashCode() {
			return Objects.hash(columns, rows, Arrays.hashCode(data));
		}

		@Override
		public boolean equals(Object obj) {
			if (this == obj)
				return true;
			if (!(obj instanceof FloatArrayPixelGrid))
				return false;
			var other = (FloatArrayPixelGrid)obj;
			return columns == other.columns && rows == other.rows && Arrays.equals(data, other.data);
		}

	}

}
