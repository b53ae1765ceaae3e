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

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * The direction cosines of an image plane, i.e. the DICOM <i>Image Orientation (Patient)</i>.
 * <p>
 * The first three values give the direction of the image rows (the direction in which the column index increases), 
 * and the last three values give the direction of the image columns (the direction in which the row index increases).
 * <p>
 * Values are stored exactly as provided. They are expected to be two orthogonal unit vectors, 
 * but this is not enforced: malformed or skewed cosines are retained so that transforms reproduce 
 * the mapping they imply.
 */
public final class DirectionCosines {
	
	private static final DirectionCosines IDENTITY = new DirectionCosines(new double[] {1, 0, 0, 0, 1, 0});
	
	private final double[] values;
	
	private DirectionCosines(double[] values) {
		this.values = values;
	}
	
	/**
	 * Get the standard (axial, head-first supine) orientation {@code [1, 0, 0, 0, 1, 0]}.
	 * @return
	 */
	public static DirectionCosines identity() {
		return IDENTITY;
	}
	
	/**
	 * Create direction cosines from six values.
	 * @param values row direction (x, y, z) followed by column direction (x, y, z)
	 * @return
	 * @throws IllegalArgumentException if there are not exactly six finite values
	 */
	public static DirectionCosines of(double... values) throws IllegalArgumentException {
		if (values == null || values.length != 6)
			throw new IllegalArgumentException("Invalid argument 'cosines': expected 6 values, got " + 
					(values == null ? null : values.length));
		for (double v : values) {
			if (!Double.isFinite(v))
				throw new IllegalArgumentException("Invalid argument 'cosines': values must be finite, got " + Arrays.toString(values));
		}
		return new DirectionCosines(values.clone());
	}
	
	/**
	 * Get the value at the specified index (0-5).
	 * @param ind
	 * @return
	 */
	public double get(int ind) {
		return values[ind];
	}
	
	/**
	 * Get a copy of all six values.
	 * @return
	 */
	public double[] toArray() {
		return values.clone();
	}
	
	/**
	 * Direction along which the column index increases (first triplet).
	 * @return
	 */
	public Vector3D getRowCosine() {
		return new Vector3D(values[0], values[1], values[2]);
	}

	/**
	 * Direction along which the row index increases (second triplet).
	 * @return
	 */
	public Vector3D getColumnCosine() {
		return new Vector3D(values[3], values[4], values[5]);
	}
	
	/**
	 * Get the normal of the image plane, i.e. the cross product of the row and column cosines.
	 * @return
	 */
	public Vector3D getNormal() {
		return Vector3D.crossProduct(getRowCosine(), getColumnCosine());
	}
	
	/**
	 * Check whether both direction vectors have unit length and are orthogonal to one another, 
	 * within an absolute tolerance.
	 * @param tolerance
	 * @return
	 */
	public boolean isOrthonormal(double tolerance) {
		var row = getRowCosine();
		var col = getColumnCosine();
		return Math.abs(row.getNorm() - 1) <= tolerance &&
				Math.abs(col.getNorm() - 1) <= tolerance &&
				Math.abs(row.dotProduct(col)) <= tolerance;
	}
	
	/**
	 * Returns true if the row and column cosines are parallel (or either is zero), 
	 * in which case pixel indices cannot be recovered from physical coordinates.
	 * @return
	 */
	public boolean isDegenerate() {
		return getNormal().getNorm() == 0;
	}
	
	@Override
	public String toString() {
		return "DirectionCosines " + Arrays.toString(values);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(values);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof DirectionCosines))
			return false;
		return Arrays.equals(values, ((DirectionCosines)obj).values);
	}

}
