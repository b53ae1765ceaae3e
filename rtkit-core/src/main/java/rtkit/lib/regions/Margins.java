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

import java.util.Objects;

/**
 * Signed changes applied to each edge of a 2D grid.
 * <p>
 * Positive values add (pad) columns or rows at that edge, negative values remove (crop) them.
 * 
 * @see GridResizer
 */
public final class Margins {
	
	private static final Margins EMPTY = new Margins(0, 0, 0, 0);
	
	private final int left, right, top, bottom;
	
	private Margins(int left, int right, int top, int bottom) {
		this.left = left;
		this.right = right;
		this.top = top;
		this.bottom = bottom;
	}
	
	/**
	 * Get margins that may differ on each side.
	 * @param left
	 * @param right
	 * @param top
	 * @param bottom
	 * @return
	 */
	public static Margins of(int left, int right, int top, int bottom) {
		if (left == 0 && right == 0 && top == 0 && bottom == 0)
			return EMPTY;
		return new Margins(left, right, top, bottom);
	}
	
	/**
	 * Get empty margins (0 on all sides).
	 * @return
	 */
	public static Margins empty() {
		return EMPTY;
	}
	
	/**
	 * Signed change at the left edge (column 0).
	 * @return
	 */
	public int getLeft() {
		return left;
	}

	/**
	 * Signed change at the right edge.
	 * @return
	 */
	public int getRight() {
		return right;
	}

	/**
	 * Signed change at the top edge (row 0).
	 * @return
	 */
	public int getTop() {
		return top;
	}

	/**
	 * Signed change at the bottom edge.
	 * @return
	 */
	public int getBottom() {
		return bottom;
	}
	
	/**
	 * Total change in the number of columns (left + right).
	 * @return
	 */
	public int getXSum() {
		return left + right;
	}

	/**
	 * Total change in the number of rows (top + bottom).
	 * @return
	 */
	public int getYSum() {
		return top + bottom;
	}
	
	/**
	 * Returns true if no edge is changed.
	 * @return
	 */
	public boolean isEmpty() {
		return left == 0 && right == 0 && top == 0 && bottom == 0;
	}
	
	/**
	 * Returns true if any edge is cropped.
	 * @return
	 */
	public boolean hasCrop() {
		return left < 0 || right < 0 || top < 0 || bottom < 0;
	}
	
	/**
	 * Add these margins to others. This object is unchanged.
	 * @param margins
	 * @return margins where each side is the sum of the corresponding sides of both objects
	 */
	public Margins add(Margins margins) {
		if (isEmpty())
			return margins;
		else if (margins.isEmpty())
			return this;
		return of(left + margins.left, right + margins.right, top + margins.top, bottom + margins.bottom);
	}
	
	@Override
	public String toString() {
		return String.format("Margins (x=[%d, %d], y=[%d, %d])", left, right, top, bottom);
	}

	@Override
	public int hashCode() {
		return Objects.hash(left, right, top, bottom);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Margins))
			return false;
		var other = (Margins)obj;
		return left == other.left && right == other.right && top == other.top && bottom == other.bottom;
	}

}
