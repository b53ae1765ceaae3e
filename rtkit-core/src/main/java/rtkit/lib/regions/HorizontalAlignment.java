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

/**
 * Policy for where columns are removed or added when the width of a grid changes.
 * <p>
 * The policy names the edge that absorbs the change.
 * 
 * @see GridResizer
 */
public enum HorizontalAlignment {
	
	/**
	 * Split the change between both edges. Where the change is odd, 
	 * the extra column is removed from (or added to) the left edge.
	 */
	CENTER,
	
	/**
	 * Remove or add all columns at the left edge (column 0).
	 */
	LEFT,
	
	/**
	 * Remove or add all columns at the right edge.
	 */
	RIGHT;
	
	/**
	 * Get the signed change at the left edge.
	 * @param delta total signed change in width (positive to pad, negative to crop)
	 * @return signed change at the left edge
	 */
	int leading(int delta) {
		switch (this) {
		case LEFT:
			return delta;
		case RIGHT:
			return 0;
		case CENTER:
		default:
			return GridResizer.halfRoundedAway(delta);
		}
	}

}
