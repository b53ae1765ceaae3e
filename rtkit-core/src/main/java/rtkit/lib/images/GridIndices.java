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

import java.util.Arrays;

/**
 * An ordered collection of integer pixel indices, stored as parallel column and row arrays.
 * 
 * @see CoordinateTransforms#coordinatesToIndices(ImageGeometry, double[], double[], double[])
 */
public final class GridIndices {
	
	private final int[] columns;
	private final int[] rows;
	
	GridIndices(int[] columns, int[] rows) {
		this.columns = columns;
		this.rows = rows;
	}
	
	/**
	 * Create an instance from column and row index arrays. The arrays are copied.
	 * @param columns
	 * @param rows
	 * @return
	 * @throws IllegalArgumentException if either array is null, or the lengths differ
	 */
	public static GridIndices of(int[] columns, int[] rows) throws IllegalArgumentException {
		if (columns == null)
			throw new IllegalArgumentException("Invalid argument 'columnIndices': must not be null");
		if (rows == null)
			throw new IllegalArgumentException("Invalid argument 'rowIndices': must not be null");
		if (columns.length != rows.length)
			throw new IllegalArgumentException("Index arrays must have equal length, but got " + columns.length + " and " + rows.length);
		return new GridIndices(columns.clone(), rows.clone());
	}
	
	/**
	 * Number of index pairs.
	 * @return
	 */
	public int size() {
		return columns.length;
	}
	
	/**
	 * Get a copy of the column indices.
	 * @return
	 */
	public int[] getColumns() {
		return columns.clone();
	}
	
	/**
	 * Get a copy of the row indices.
	 * @return
	 */
	public int[] getRows() {
		return rows.clone();
	}
	
	/**
	 * Get the column index at the specified position.
	 * @param ind
	 * @return
	 */
	public int getColumn(int ind) {
		return columns[ind];
	}

	/**
	 * Get the row index at the specified position.
	 * @param ind
	 * @return
	 */
	public int getRow(int ind) {
		return rows[ind];
	}
	
	/**
	 * Returns true if every index pair lies within a grid with the specified number of columns and rows.
	 * @param nColumns
	 * @param nRows
	 * @return
	 */
	public boolean allWithin(int nColumns, int nRows) {
		for (int i = 0; i < columns.length; i++) {
			if (columns[i] < 0 || columns[i] >= nColumns || rows[i] < 0 || rows[i] >= nRows)
				return false;
		}
		return true;
	}
	
	@Override
	public String toString() {
		return "GridIndices (columns=" + Arrays.toString(columns) + ", rows=" + Arrays.toString(rows) + ")";
	}

	@Override
	public int hashCode() {
		return 31 * Arrays.hashCode(columns) + Arrays.hashCode(rows);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof GridIndices))
			return false;
		var other = (GridIndices)obj;
		return Arrays.equals(columns, other.columns) && Arrays.equals(rows, other.rows);
	}

}
