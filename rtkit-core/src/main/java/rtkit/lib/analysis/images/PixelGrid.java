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

/**
 * A minimal interface to access the values of a 2D, single-channel pixel grid.
 * <p>
 * Pixels are addressed by (column, row), with column 0 and row 0 at the first pixel of the image.
 * 
 * @see PixelGrids
 */
public interface PixelGrid {
	
	/**
	 * Get the number of columns (image width).
	 * @return
	 */
	int getColumns();
	
	/**
	 * Get the number of rows (image height).
	 * @return
	 */
	int getRows();
	
	/**
	 * Get the value of a single pixel.
	 * @param column
	 * @param row
	 * @return
	 * @throws IndexOutOfBoundsException if the column or row lies outside the grid
	 */
	float getValue(int column, int row);
	
	/**
	 * Set the value of a single pixel.
	 * @param column
	 * @param row
	 * @param val
	 */
	void setValue(int column, int row, float val);
	
	/**
	 * Request the pixel values, stored row by row.
	 * @param direct if true, the internal array will be returned if possible. The caller should <i>not</i> modify this.
	 * @return
	 */
	float[] getArray(boolean direct);
	
	/**
	 * Returns true if the grid is considered 'segmented', i.e. it contains more than two pixels with values &gt; 0.
	 * @return
	 */
	default boolean isSegmented() {
		int count = 0;
		for (float v : getArray(true)) {
			if (v > 0 && ++count > 2)
				return true;
		}
		return false;
	}

}
