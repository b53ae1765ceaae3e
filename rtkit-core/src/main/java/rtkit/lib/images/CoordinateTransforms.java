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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rtkit.lib.common.GeneralTools;
import rtkit.lib.common.Prefs;
import rtkit.lib.geom.Coordinate;

/**
 * Static methods to convert between pixel indices and physical (patient) coordinates for a 2D image.
 * <p>
 * For a pixel at column {@code c} and row {@code r} the physical coordinate is
 * <pre>
 *   P = position + c * columnSpacing * rowCosine + r * rowSpacing * columnCosine
 * </pre>
 * where {@code position} is (x, y, slice position) of the first pixel center, {@code rowCosine} 
 * is the first direction cosine triplet and {@code columnCosine} the second.
 * <p>
 * Direction cosines are applied exactly as provided, even if they are not orthonormal.
 */
public class CoordinateTransforms {
	
	private static final Logger logger = LoggerFactory.getLogger(CoordinateTransforms.class);
	
	/**
	 * Maximum number of non-orthonormal cosines remembered, so that each is only reported once.
	 */
	static final int MAX_REPORTED_COSINES = 100;
	
	private static final Map<DirectionCosines, Boolean> reportedCosines = Collections.synchronizedMap(new LinkedHashMap<DirectionCosines, Boolean>() {
		private static final long serialVersionUID = 1L;

		@Override
		protected boolean removeEldestEntry(Map.Entry<DirectionCosines, Boolean> eldest) {
			return size() > MAX_REPORTED_COSINES;
		}
	});
	
	// Suppressed default constructor for non-instantiability
	private CoordinateTransforms() {
		throw new AssertionError();
	}
	
	/**
	 * Convert pixel indices to physical coordinates.
	 * 
	 * @param geometry the image geometry
	 * @param columnIndices column indices (may be fractional)
	 * @param rowIndices row indices (may be fractional)
	 * @return physical coordinates in the same order as the indices
	 * @throws IllegalArgumentException if either array is null, or the arrays differ in length
	 */
	public static PhysicalCoordinates coordinatesFromIndices(ImageGeometry geometry, double[] columnIndices, double[] rowIndices) throws IllegalArgumentException {
		Objects.requireNonNull(geometry, "Geometry must not be null");
		if (columnIndices == null)
			throw new IllegalArgumentException("Invalid argument 'columnIndices': must not be null");
		if (rowIndices == null)
			throw new IllegalArgumentException("Invalid argument 'rowIndices': must not be null");
		if (columnIndices.length != rowIndices.length)
			throw new IllegalArgumentException("Index arrays must have equal length, but got " + columnIndices.length + " and " + rowIndices.length);
		
		checkCosines(geometry.getCosines());
		
		double[] cos = geometry.getCosines().toArray();
		double colSpacing = geometry.getColumnSpacing();
		double rowSpacing = geometry.getRowSpacing();
		
		double x0 = geometry.getPosX();
		double y0 = geometry.getPosY();
		double z0 = geometry.getPosSlice();
		
		int n = columnIndices.length;
		double[] x = new double[n];
		double[] y = new double[n];
		double[] z = new double[n];
		for (int i = 0; i < n; i++) {
			double c = columnIndices[i] * colSpacing;
			double r = rowIndices[i] * rowSpacing;
			x[i] = x0 + c * cos[0] + r * cos[3];
			y[i] = y0 + c * cos[1] + r * cos[4];
			z[i] = z0 + c * cos[2] + r * cos[5];
		}
		return new PhysicalCoordinates(x, y, z);
	}
	
	/**
	 * Convert integer pixel indices to physical coordinates.
	 * 
	 * @param geometry
	 * @param columnIndices
	 * @param rowIndices
	 * @return
	 * @throws IllegalArgumentException if either array is null, or the arrays differ in length
	 * @see #coordinatesFromIndices(ImageGeometry, double[], double[])
	 */
	public static PhysicalCoordinates coordinatesFromIndices(ImageGeometry geometry, int[] columnIndices, int[] rowIndices) throws IllegalArgumentException {
		return coordinatesFromIndices(geometry, toDouble(columnIndices), toDouble(rowIndices));
	}

	/**
	 * Convert pixel indices to physical coordinates.
	 * 
	 * @param geometry
	 * @param indices
	 * @return
	 */
	public static PhysicalCoordinates coordinatesFromIndices(ImageGeometry geometry, GridIndices indices) {
		return coordinatesFromIndices(geometry, indices.getColumns(), indices.getRows());
	}
	
	/**
	 * Convert a single pixel index to a physical coordinate.
	 * 
	 * @param geometry
	 * @param column
	 * @param row
	 * @return
	 */
	public static Coordinate coordinateFromIndex(ImageGeometry geometry, double column, double row) {
		return coordinatesFromIndices(geometry, new double[] {column}, new double[] {row}).get(0);
	}
	
	/**
	 * Convert physical coordinates to the nearest pixel indices.
	 * <p>
	 * Fractional indices are found by solving the least-squares problem 
	 * {@code (x, y, z) - position = c * a + r * b}, where {@code a} and {@code b} are the displacements 
	 * of one column and one row step. For coordinates in the image plane this is the exact inverse of 
	 * {@link #coordinatesFromIndices(ImageGeometry, double[], double[])}; coordinates off the plane are 
	 * projected onto it. The z values are required because some orientations (e.g. sagittal or coronal 
	 * images) cannot be resolved from x and y alone.
	 * <p>
	 * Fractional indices are then rounded to the nearest integer, with ties rounded away from zero.
	 * Indices outside the image bounds are returned as they are.
	 * 
	 * @param geometry the image geometry
	 * @param x x-coordinates
	 * @param y y-coordinates
	 * @param z z-coordinates
	 * @return indices in the same order as the coordinates
	 * @throws IllegalArgumentException if any array is null, or the arrays differ in length
	 * @throws InvalidGeometryException if the direction cosines are degenerate, so no inverse exists
	 */
	public static GridIndices coordinatesToIndices(ImageGeometry geometry, double[] x, double[] y, double[] z) throws IllegalArgumentException, InvalidGeometryException {
		Objects.requireNonNull(geometry, "Geometry must not be null");
		checkArrays(x, y, z);
		
		var cosines = geometry.getCosines();
		checkCosines(cosines);
		
		var a = cosines.getRowCosine().scalarMultiply(geometry.getColumnSpacing());
		var b = cosines.getColumnCosine().scalarMultiply(geometry.getRowSpacing());
		
		double ab = a.dotProduct(b);
		RealMatrix gram = MatrixUtils.createRealMatrix(new double[][] {
			{a.dotProduct(a), ab},
			{ab, b.dotProduct(b)}
		});
		DecompositionSolver solver = new LUDecomposition(gram).getSolver();
		if (!solver.isNonSingular())
			throw new InvalidGeometryException("Cannot convert coordinates to indices: direction cosines " + cosines + " are degenerate");
		double[][] inv = solver.getInverse().getData();
		
		double x0 = geometry.getPosX();
		double y0 = geometry.getPosY();
		double z0 = geometry.getPosSlice();
		
		int n = x.length;
		int[] columns = new int[n];
		int[] rows = new int[n];
		for (int i = 0; i < n; i++) {
			double dx = x[i] - x0;
			double dy = y[i] - y0;
			double dz = z[i] - z0;
			double ad = dx * a.getX() + dy * a.getY() + dz * a.getZ();
			double bd = dx * b.getX() + dy * b.getY() + dz * b.getZ();
			columns[i] = GeneralTools.roundHalfAwayFromZero(inv[0][0] * ad + inv[0][1] * bd);
			rows[i] = GeneralTools.roundHalfAwayFromZero(inv[1][0] * ad + inv[1][1] * bd);
		}
		return new GridIndices(columns, rows);
	}
	
	/**
	 * Convert physical coordinates to the nearest pixel indices.
	 * 
	 * @param geometry
	 * @param coordinates
	 * @return
	 * @see #coordinatesToIndices(ImageGeometry, double[], double[], double[])
	 */
	public static GridIndices coordinatesToIndices(ImageGeometry geometry, PhysicalCoordinates coordinates) {
		return coordinatesToIndices(geometry, coordinates.xDirect(), coordinates.yDirect(), coordinates.zDirect());
	}
	
	static void checkArrays(double[] x, double[] y, double[] z) throws IllegalArgumentException {
		if (x == null)
			throw new IllegalArgumentException("Invalid argument 'x': must not be null");
		if (y == null)
			throw new IllegalArgumentException("Invalid argument 'y': must not be null");
		if (z == null)
			throw new IllegalArgumentException("Invalid argument 'z': must not be null");
		if (x.length != y.length || x.length != z.length)
			throw new IllegalArgumentException("Coordinate arrays must have equal length, but got " + 
					x.length + ", " + y.length + " and " + z.length);
	}
	
	/**
	 * Log a warning if the cosines are not orthonormal within {@link Prefs#getOrthonormalTolerance()}.
	 * Each set of cosines is reported once, until it is evicted by {@link #MAX_REPORTED_COSINES} newer ones.
	 * @param cosines
	 * @return true if a warning was logged
	 */
	static boolean checkCosines(DirectionCosines cosines) {
		if (cosines.isOrthonormal(Prefs.getOrthonormalTolerance()))
			return false;
		if (reportedCosines.putIfAbsent(cosines, Boolean.TRUE) != null)
			return false;
		logger.warn("{} are not orthonormal - they will be applied as provided", cosines);
		return true;
	}
	
	private static double[] toDouble(int[] values) {
		if (values == null)
			return null;
		double[] result = new double[values.length];
		for (int i = 0; i < values.length; i++)
			result[i] = values[i];
		return result;
	}

}
