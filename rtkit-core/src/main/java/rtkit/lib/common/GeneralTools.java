/*-
 * #%L
 * This file is part of RTKit.
 * %%
 * Copyright (C) 2018 - 2023 QuPath developers, The University of Edinburgh
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

import java.util.Arrays;

import org.apache.commons.math3.util.Precision;

/**
 * A collection of generally useful static methods.
 * 
 * @author Pete Bankhead
 */
public final class GeneralTools {
	
	/**
	 * Separator used between the components of multi-valued DICOM attributes (e.g. {@code "-5.0\-3.0\50.0"}).
	 */
	public static final String MULTI_VALUE_SEPARATOR = "\\";
	
	// Suppress default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}
	
	/**
	 * Check if a string is blank, i.e. it is null or its length is 0.
	 * @param s
	 * @param trim If true, any string will be trimmed before its length checked.
	 * @return True if the string is null or empty.
	 */
	public static boolean blankString(final String s, final boolean trim) {
		return s == null || (trim ? s.trim().length() == 0 : s.length() == 0);
	}
	
	/**
	 * Round a value to the nearest integer, with ties rounded away from zero 
	 * (so 2.5 becomes 3 and -2.5 becomes -3).
	 * <p>
	 * This differs from {@link Math#round(double)}, which rounds ties towards positive infinity.
	 * 
	 * @param value
	 * @return
	 * @throws IllegalArgumentException if the value is not finite, or cannot be represented as an int
	 */
	public static int roundHalfAwayFromZero(final double value) throws IllegalArgumentException {
		if (!Double.isFinite(value))
			throw new IllegalArgumentException("Cannot round non-finite value " + value);
		double rounded = Precision.round(value, 0);
		if (rounded > Integer.MAX_VALUE || rounded < Integer.MIN_VALUE)
			throw new IllegalArgumentException("Value " + value + " is out of range for an int index");
		return (int)rounded;
	}
	
	/**
	 * Parse a multi-valued decimal string, where values are separated by a backslash.
	 * 
	 * @param s the string to parse, e.g. {@code "0.5\0.75"}
	 * @return the parsed values
	 * @throws IllegalArgumentException if the string is blank or any value cannot be parsed
	 */
	public static double[] parseMultiValue(final String s) throws IllegalArgumentException {
		if (blankString(s, true))
			throw new IllegalArgumentException("Cannot parse values from a blank string");
		String[] tokens = s.trim().split("\\\\", -1);
		double[] values = new double[tokens.length];
		for (int i = 0; i < tokens.length; i++) {
			try {
				values[i] = Double.parseDouble(tokens[i].trim());
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Cannot parse value '" + tokens[i] + "' in " + s, e);
			}
		}
		return values;
	}

	/**
	 * Join values to a multi-valued string, using a backslash as separator.
	 * Values are written with full precision so they can be parsed back exactly.
	 * 
	 * @param values
	 * @return
	 * @see #parseMultiValue(String)
	 */
	public static String toMultiValue(final double... values) {
		return arrayToString(Arrays.stream(values).boxed().toArray(), MULTI_VALUE_SEPARATOR);
	}
	
	/**
	 * Convert an array to a single string, with a specified delimiter string.
	 * @param array
	 * @param delimiter
	 * @return
	 */
	public static String arrayToString(final Object[] array, final String delimiter) {
		StringBuilder sb = new StringBuilder();
		if (array.length == 0)
			return "";
		for (int i = 0; i < array.length; i++) {
			sb.append(array[i]);
			if (i < array.length-1)
				sb.append(delimiter);
		}
		return sb.toString();
	}

}
