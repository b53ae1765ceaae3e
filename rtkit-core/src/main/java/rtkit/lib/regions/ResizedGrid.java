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

import rtkit.lib.analysis.images.PixelGrid;
import rtkit.lib.images.ImageGeometry;

/**
 * The result of resizing a grid: the new pixels, the updated geometry, and the margins that were applied.
 * 
 * @see GridResizer
 */
public final class ResizedGrid {
	
	private final PixelGrid grid;
	private final ImageGeometry geometry;
	private final Margins margins;
	
	ResizedGrid(PixelGrid grid, ImageGeometry geometry, Margins margins) {
		this.grid = grid;
		this.geometry = geometry;
		this.margins = margins;
	}
	
	/**
	 * The resized pixels.
	 * @return
	 */
	public PixelGrid getGrid() {
		return grid;
	}
	
	/**
	 * The geometry of the resized pixels.
	 * @return
	 */
	public ImageGeometry getGeometry() {
		return geometry;
	}
	
	/**
	 * The signed change applied to each edge.
	 * @return
	 */
	public Margins getMargins() {
		return margins;
	}
	
	@Override
	public String toString() {
		return "ResizedGrid (" + grid.getColumns() + " x " + grid.getRows() + ", " + margins + ")";
	}

}
