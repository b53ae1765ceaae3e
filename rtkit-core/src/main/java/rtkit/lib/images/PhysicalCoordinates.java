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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import rtkit.lib.geom.Coordinate;

/**
 * An ordered collection of physical coordinates, stored as parallel x, y and z arrays.
 * 
 * @see CoordinateTransforms#coordinatesFromIndices(ImageGeometry, double[], double[])
 */
public final class PhysicalCoordinates {
	
	private final double[] x;
	private final double[] y;
	private final double[] z;
	
	PhysicalCoordinates(double[] x, double[] y, double[] z) {
		this.x = x;
		this.y = y;
		this.z = z;
	}
	
	/**
	 * Create an instance from x, y and z arrays. The arrays are copied.
	 * @param x
	 * @param y
	 * @param z
	 * @return
	 * @throws IllegalArgumentException if any array is null, or the lengths differ
	 */
	public static PhysicalCoordinates of(double[] x, double[] y, double[] z) throws IllegalArgumentException {
		CoordinateTransforms.checkArrays(x, y, z);
		return new PhysicalCoordinates(x.clone(), y.clone(), z.clone());
	}
	
	/**
	 * Create an instance from a list of coordinates.
	 * @param coordinates
	 * @return
	 */
	public static PhysicalCoordinates of(List<Coordinate> coordinates) {
		int n = coordinates.size();
		double[] x = new double[n];
		double[] y = new double[n];
		double[] z = new double[n];
		for (int i = 0; i < n; i++) {
			var c = coordinates.get(i);
			x[i] = c.getX();
			y[i] = c.getY();
			z[i] = c.getZ();
		}
		return new PhysicalCoordinates(x, y, z);
	}
	
	/**
	 * Number of coordinates.
	 * @return
	 */
	public int size() {
		return x.length;
	}
	
	/**
	 * Get a copy of the x-coordinates.
	 * @return
	 */
	public double[] getX() {
		return x.clone();
	}

	/**
	 * Get a copy of the y-coordinates.
	 * @return
	 */
	public double[] getY() {
		return y.clone();
	}

	/**
	 * Get a copy of the z-coordinates.
	 * @return
	 */
	public double[] getZ() {
		return z.clone();
	}
	
	double[] xDirect() {
		return x;
	}

	double[] yDirect() {
		return y;
	}

	double[] zDirect() {
		return z;
	}
	
	/**
	 * Get a single coordinate.
	 * @param ind
	 * @return
	 */
	public Coordinate get(int ind) {
		return new Coordinate(x[ind], y[ind], z[ind]);
	}
	
	/**
	 * Get all coordinates as a list.
	 * @return
	 */
	public List<Coordinate> toList() {
		List<Coordinate> list = new ArrayList<>(size());
		for (int i = 0; i < size(); i++)
			list.add(get(i));
		return list;
	}
	
	@Override
	public String toString() {
		return "PhysicalCoordinates (n=" + size() + ")";
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = Arrays.hashCode(x);
		result = prime * result + Arrays.hashCode(y);
		result = prime * result + Arrays.hashCode(z);
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof PhysicalCoordinates))
			return false;
		var other = (PhysicalCoordinates)obj;
		return Arrays.equals(x, other.x) && Arrays.equals(y, other.y) && Arrays.equals(z, other.z);
	}

}
