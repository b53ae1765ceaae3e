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

import java.util.Objects;

import rtkit.lib.geom.Coordinate;

/**
 * Immutable description of where a 2D image grid sits in physical (patient) space.
 * <p>
 * The geometry consists of:
 * <ul>
 * <li>the position (x, y) of the center of the first pixel (column 0, row 0)</li>
 * <li>the slice position, i.e. the z-coordinate of that pixel center</li>
 * <li>the row spacing (distance between adjacent rows) and column spacing (distance between adjacent columns)</li>
 * <li>the {@link DirectionCosines}</li>
 * <li>the number of columns and rows</li>
 * </ul>
 * Together these define an affine map between grid indices and physical coordinates; 
 * see {@link CoordinateTransforms}.
 */
public final class ImageGeometry {
	
	private double posX;
	private double posY;
	private double posSlice;
	
	private double rowSpacing = 1.0;
	private double colSpacing = 1.0;
	
	private DirectionCosines cosines = DirectionCosines.identity();
	
	private int columns;
	private int rows;
	
	private ImageGeometry() {}
	
	private ImageGeometry duplicate() {
		var geom = new ImageGeometry();
		geom.posX = posX;
		geom.posY = posY;
		geom.posSlice = posSlice;
		geom.rowSpacing = rowSpacing;
		geom.colSpacing = colSpacing;
		geom.cosines = cosines;
		geom.columns = columns;
		geom.rows = rows;
		return geom;
	}
	
	/**
	 * Get the x-coordinate of the center of the first pixel.
	 * @return
	 */
	public double getPosX() {
		return posX;
	}

	/**
	 * Get the y-coordinate of the center of the first pixel.
	 * @return
	 */
	public double getPosY() {
		return posY;
	}

	/**
	 * Get the slice position, i.e. the z-coordinate of the center of the first pixel.
	 * @return
	 */
	public double getPosSlice() {
		return posSlice;
	}
	
	/**
	 * Get the position of the center of the first pixel as a coordinate (x, y, slice position).
	 * @return
	 */
	public Coordinate getPosition() {
		return new Coordinate(posX, posY, posSlice);
	}

	/**
	 * Get the physical distance between adjacent rows.
	 * @return
	 */
	public double getRowSpacing() {
		return rowSpacing;
	}

	/**
	 * Get the physical distance between adjacent columns.
	 * @return
	 */
	public double getColumnSpacing() {
		return colSpacing;
	}

	/**
	 * Get the direction cosines.
	 * @return
	 */
	public DirectionCosines getCosines() {
		return cosines;
	}

	/**
	 * Get the number of columns (image width).
	 * @return
	 */
	public int getColumns() {
		return columns;
	}

	/**
	 * Get the number of rows (image height).
	 * @return
	 */
	public int getRows() {
		return rows;
	}
	
	/**
	 * Create a copy of this geometry with a different in-plane position. 
	 * The slice position is unchanged.
	 * @param x
	 * @param y
	 * @return
	 */
	public ImageGeometry withPosition(double x, double y) {
		return new Builder(this).position(x, y).build();
	}

	/**
	 * Create a copy of this geometry with a different pixel spacing.
	 * @param rowSpacing
	 * @param columnSpacing
	 * @return
	 */
	public ImageGeometry withSpacing(double rowSpacing, double columnSpacing) {
		return new Builder(this).spacing(rowSpacing, columnSpacing).build();
	}

	/**
	 * Create a copy of this geometry with a different number of columns and rows.
	 * The position is unchanged.
	 * @param columns
	 * @param rows
	 * @return
	 */
	public ImageGeometry withExtents(int columns, int rows) {
		return new Builder(this).extents(columns, rows).build();
	}
	
	/**
	 * Create a builder initialized with the values of this geometry.
	 * @return
	 */
	public Builder toBuilder() {
		return new Builder(this);
	}
	
	@Override
	public String toString() {
		return String.format("ImageGeometry: position=(%s, %s, %s), spacing=(row=%s, col=%s), %s, size=%dx%d",
				posX, posY, posSlice, rowSpacing, colSpacing, cosines, columns, rows);
	}

	@Override
	public int hashCode() {
		return Objects.hash(posX, posY, posSlice, rowSpacing, colSpacing, cosines, columns, rows);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ImageGeometry other = (ImageGeometry) obj;
		return Double.doubleToLongBits(posX) == Double.doubleToLongBits(other.posX) &&
				Double.doubleToLongBits(posY) == Double.doubleToLongBits(other.posY) &&
				Double.doubleToLongBits(posSlice) == Double.doubleToLongBits(other.posSlice) &&
				Double.doubleToLongBits(rowSpacing) == Double.doubleToLongBits(other.rowSpacing) &&
				Double.doubleToLongBits(colSpacing) == Double.doubleToLongBits(other.colSpacing) &&
				cosines.equals(other.cosines) &&
				columns == other.columns &&
				rows == other.rows;
	}
	
	
	/**
	 * Builder class for {@link ImageGeometry} objects.
	 */
	public static class Builder {
		
		private ImageGeometry geom = new ImageGeometry();
		
		/**
		 * Create a new builder. Defaults are position (0, 0, 0), unit spacing, 
		 * identity direction cosines and an empty (0 x 0) grid.
		 */
		public Builder() {}
		
		/**
		 * Create a new builder, initialized with the values of an existing {@link ImageGeometry}.
		 * @param geometry
		 */
		public Builder(ImageGeometry geometry) {
			this.geom = geometry.duplicate();
		}
		
		/**
		 * Specify the in-plane position of the center of the first pixel.
		 * @param x
		 * @param y
		 * @return
		 */
		public Builder position(double x, double y) {
			requireFinite("x", x);
			requireFinite("y", y);
			geom.posX = x;
			geom.posY = y;
			return this;
		}
		
		/**
		 * Specify the position of the center of the first pixel, including the slice position.
		 * @param x
		 * @param y
		 * @param slice
		 * @return
		 */
		public Builder position(double x, double y, double slice) {
			position(x, y);
			return slicePosition(slice);
		}
		
		/**
		 * Specify the slice position (z-coordinate of the first pixel center).
		 * @param slice
		 * @return
		 */
		public Builder slicePosition(double slice) {
			requireFinite("slice position", slice);
			geom.posSlice = slice;
			return this;
		}
		
		/**
		 * Specify the distance between adjacent rows and adjacent columns.
		 * @param rowSpacing
		 * @param columnSpacing
		 * @return
		 * @throws IllegalArgumentException if either value is not a finite number &gt; 0
		 */
		public Builder spacing(double rowSpacing, double columnSpacing) throws IllegalArgumentException {
			if (!Double.isFinite(rowSpacing) || rowSpacing <= 0)
				throw new IllegalArgumentException("Row spacing must be a finite number > 0, not " + rowSpacing);
			if (!Double.isFinite(columnSpacing) || columnSpacing <= 0)
				throw new IllegalArgumentException("Column spacing must be a finite number > 0, not " + columnSpacing);
			geom.rowSpacing = rowSpacing;
			geom.colSpacing = columnSpacing;
			return this;
		}
		
		/**
		 * Specify the direction cosines.
		 * @param cosines
		 * @return
		 */
		public Builder cosines(DirectionCosines cosines) {
			geom.cosines = Objects.requireNonNull(cosines, "Direction cosines must not be null");
			return this;
		}

		/**
		 * Specify the direction cosines from six values.
		 * @param cosines
		 * @return
		 * @see DirectionCosines#of(double...)
		 */
		public Builder cosines(double... cosines) {
			return cosines(DirectionCosines.of(cosines));
		}
		
		/**
		 * Specify the number of columns and rows.
		 * @param columns
		 * @param rows
		 * @return
		 * @throws IllegalArgumentException if either value is negative
		 */
		public Builder extents(int columns, int rows) throws IllegalArgumentException {
			if (columns < 0)
				throw new IllegalArgumentException("Invalid argument 'columns': must be >= 0, got " + columns);
			if (rows < 0)
				throw new IllegalArgumentException("Invalid argument 'rows': must be >= 0, got " + rows);
			geom.columns = columns;
			geom.rows = rows;
			return this;
		}
		
		/**
		 * Build the {@link ImageGeometry}.
		 * @return
		 */
		public ImageGeometry build() {
			return geom.duplicate();
		}
		
		private static void requireFinite(String name, double value) {
			if (!Double.isFinite(value))
				throw new IllegalArgumentException("Invalid argument '" + name + "': must be finite, got " + value);
		}
		
	}

}
