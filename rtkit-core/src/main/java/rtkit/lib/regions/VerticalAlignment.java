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
 * Policy for where rows are removed or added when the height of a grid changes.
 * <p>
 * The policy names the edge that absorbs the change.
 * 
 * @see GridResizer
 */
public enum VerticalAlignment {
	
	/**
	 * Split the change between both edges. Where the change is odd, 
	 * the extra row is removed from (or added to) the top edge.
	 */
	CENTER,
	
	/**
	 * Remove or add all rows at the top edge (row 0).
	 */
	TOP,
	
	/**
	 * Remove or add all rows at the bottom edge.
	 */
	BOTTOM;
	
	/**
	 * Get the signed change at the top edge.
	 * @param delta total signed change in height (positive to pad, negative to crop)
	 * @return signed change at the top edge
	 */
	int leading(int delta) {
		switch (this) {
		case TOP:
			return delta;
		case BOTTOM:
			return 0;
		case CENTER:
		default:
			return GridResizer.halfRoundedAway(delta);
		}
	}

}
