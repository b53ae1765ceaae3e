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

package rtkit.lib.geom;

import rtkit.lib.common.GeneralTools;

/**
 * An immutable 3D coordinate in physical (patient) space, typically in millimeters.
 */
public final class Coordinate {
	
	private final double x, y, z;
	
	/**
	 * Coordinate constructor.
	 * @param x
	 * @param y
	 * @param z
	 */
	public Coordinate(final double x, final double y, final double z) {
		this.x = x;
		this.y = y;
		this.z = z;
	}
	
	/**
	 * Parse a coordinate from a backslash-separated triplet, as written by {@link #toString()}.
	 * @param s string of the form {@code "x\y\z"}
	 * @return
	 * @throws IllegalArgumentException if the string does not contain exactly three numeric values
	 */
	public static Coordinate parse(String s) throws IllegalArgumentException {
		double[] values = GeneralTools.parseMultiValue(s);
		if (values.length != 3)
			throw new IllegalArgumentException("Expected 3 values for a coordinate, but got " + values.length + " in " + s);
		return new Coordinate(values[0], values[1], values[2]);
	}
	
	/**
	 * Get the x coordinate.
	 * @return
	 */
	public double getX() {
		return x;
	}

	/**
	 * Get the y coordinate.
	 * @return
	 */
	public double getY() {
		return y;
	}

	/**
	 * Get the z coordinate.
	 * @return
	 */
	public double getZ() {
		return z;
	}
	
	/**
	 * Get the value for the specified dimension (0 for x, 1 for y, 2 for z).
	 * @param dim
	 * @return
	 */
	public double get(int dim) {
		switch (dim) {
		case 0:
			return x;
		case 1:
			return y;
		case 2:
			return z;
		default:
			throw new IllegalArgumentException("Requested dimension " + dim + " for Coordinate - allowable values are 0, 1 and 2");
		}
	}
	
	/**
	 * Create a new coordinate by adding offsets to this one. This coordinate is unchanged.
	 * @param dx
	 * @param dy
	 * @param dz
	 * @return
	 */
	public Coordinate translate(final double dx, final double dy, final double dz) {
		if (dx == 0 && dy == 0 && dz == 0)
			return this;
		return new Coordinate(x + dx, y + dy, z + dz);
	}
	
	/**
	 * Calculate the Euclidean distance to another coordinate.
	 * @param other
	 * @return
	 */
	public double distance(final Coordinate other) {
		double dx = x - other.x;
		double dy = y - other.y;
		double dz = z - other.z;
		return Math.sqrt(dx * dx + dy * dy + dz * dz);
	}
	
	/**
	 * Returns the coordinate as a backslash-separated triplet {@code "x\y\z"}, 
	 * matching the DICOM encoding of multi-valued decimal strings.
	 */
	@Override
	public String toString() {
		return GeneralTools.toMultiValue(x, y, z);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		long temp;
		temp = Double.doubleToLongBits(x);
		result = prime * result + (int) (temp ^ (temp >>> 32));
		temp = Double.doubleToLongBits(y);
		result = prime * result + (int) (temp ^ (temp >>> 32));
		temp = Double.doubleToLongBits(z);
		result = prime * result + (int) (temp ^ (temp >>> 32));
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Coordinate other = (Coordinate) obj;
		return Double.doubleToLongBits(x) == Double.doubleToLongBits(other.x) &&
				Double.doubleToLongBits(y) == Double.doubleToLongBits(other.y) &&
				Double.doubleToLongBits(z) == Double.doubleToLongBits(other.z);
	}

}
