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

package rtkit.lib.common;

/**
 * Core RTKit preferences. These are not persistent.
 */
public class Prefs {
	
	private static int nThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
	
	private static float padValue = 0f;
	
	private static double orthonormalTolerance = 1e-3;
	
	/**
	 * Get the requested number of threads to use for parallelization.
	 * @return
	 */
	public static int getNumThreads() {
		return nThreads;
	}

	/**
	 * Set the requested number of threads. This will be clipped to be at least 1.
	 * @param n
	 */
	public static void setNumThreads(int n) {
		nThreads = Math.max(1, n);
	}
	
	/**
	 * Get the value written into pixels added when a grid is padded.
	 * Default is 0.
	 * @return
	 */
	public static float getPadValue() {
		return padValue;
	}
	
	/**
	 * Set the value written into pixels added when a grid is padded.
	 * @param value
	 * @throws IllegalArgumentException if the value is NaN
	 */
	public static void setPadValue(float value) throws IllegalArgumentException {
		if (Float.isNaN(value))
			throw new IllegalArgumentException("Pad value must not be NaN");
		padValue = value;
	}
	
	/**
	 * Get the absolute tolerance used when checking whether direction cosines are unit length and orthogonal.
	 * This only affects diagnostics: cosines are never corrected.
	 * @return
	 */
	public static double getOrthonormalTolerance() {
		return orthonormalTolerance;
	}
	
	/**
	 * Set the absolute tolerance used when checking whether direction cosines are orthonormal.
	 * @param tolerance
	 * @throws IllegalArgumentException if the tolerance is negative or not finite
	 */
	public static void setOrthonormalTolerance(double tolerance) throws IllegalArgumentException {
		if (!Double.isFinite(tolerance) || tolerance < 0)
			throw new IllegalArgumentException("Tolerance must be finite and >= 0, but was " + tolerance);
		orthonormalTolerance = tolerance;
	}

}
