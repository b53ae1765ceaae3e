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

package rtkit.lib.io;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rtkit.lib.common.GeneralTools;
import rtkit.lib.images.DirectionCosines;
import rtkit.lib.images.ImageGeometry;

/**
 * Static methods to read and write an {@link ImageGeometry} as DICOM-style attributes.
 * <p>
 * Attributes are provided as a map from tag (e.g. {@code "0020,0032"}) to the attribute value 
 * as it is stored in the file, i.e. a decimal or integer string, with multiple values separated by a backslash.
 * <p>
 * Both regular images (Image Position/Pixel Spacing) and projection images 
 * (RT Image Position/Image Plane Pixel Spacing) are supported.
 * Projection images only carry a two-component position; their slice position is then 0.
 */
public class GeometryAttributes {
	
	private static final Logger logger = LoggerFactory.getLogger(GeometryAttributes.class);
	
	/**
	 * Image Position (Patient)
	 */
	public static final String IMAGE_POSITION = "0020,0032";

	/**
	 * RT Image Position
	 */
	public static final String RT_IMAGE_POSITION = "3002,0012";

	/**
	 * Pixel Spacing
	 */
	public static final String PIXEL_SPACING = "0028,0030";

	/**
	 * Image Plane Pixel Spacing
	 */
	public static final String IMAGE_PLANE_PIXEL_SPACING = "3002,0011";

	/**
	 * Image Orientation (Patient)
	 */
	public static final String IMAGE_ORIENTATION = "0020,0037";

	/**
	 * Rows
	 */
	public static final String ROWS = "0028,0010";

	/**
	 * Columns
	 */
	public static final String COLUMNS = "0028,0011";
	
	// Suppressed default constructor for non-instantiability
	private GeometryAttributes() {
		throw new AssertionError();
	}
	
	/**
	 * Create an image geometry from DICOM-style attributes.
	 * 
	 * @param attributes map of tag to attribute value
	 * @return
	 * @throws IllegalArgumentException if a required attribute is missing, or any value is malformed; 
	 *                                  the message names the offending tag
	 */
	public static ImageGeometry fromAttributes(Map<String, String> attributes) throws IllegalArgumentException {
		Objects.requireNonNull(attributes);
		
		var builder = new ImageGeometry.Builder();

		String positionTag = attributes.containsKey(IMAGE_POSITION) ? IMAGE_POSITION : RT_IMAGE_POSITION;
		double[] position = readValues(attributes, positionTag, 2, 3);
		if (position.length == 3)
			builder.position(position[0], position[1], position[2]);
		else
			builder.position(position[0], position[1]);
		
		String spacingTag = attributes.containsKey(PIXEL_SPACING) ? PIXEL_SPACING : IMAGE_PLANE_PIXEL_SPACING;
		double[] spacing = readValues(attributes, spacingTag, 2, 2);
		try {
			builder.spacing(spacing[0], spacing[1]);
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Invalid value for " + spacingTag + ": " + e.getMessage(), e);
		}
		
		if (attributes.containsKey(IMAGE_ORIENTATION)) {
			double[] cosines = readValues(attributes, IMAGE_ORIENTATION, 6, 6);
			try {
				builder.cosines(DirectionCosines.of(cosines));
			} catch (IllegalArgumentException e) {
				throw new IllegalArgumentException("Invalid value for " + IMAGE_ORIENTATION + ": " + e.getMessage(), e);
			}
		} else
			logger.debug("No {} found, using identity direction cosines", IMAGE_ORIENTATION);
		
		int columns = readInt(attributes, COLUMNS);
		int rows = readInt(attributes, ROWS);
		try {
			builder.extents(columns, rows);
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Invalid value for " + COLUMNS + "/" + ROWS + ": " + e.getMessage(), e);
		}
		return builder.build();
	}
	
	/**
	 * Convert an image geometry to DICOM-style attributes, using the tags of a regular 
	 * (not projection) image.
	 * 
	 * @param geometry
	 * @return a map of tag to value, in tag order of the image plane module
	 */
	public static Map<String, String> toAttributes(ImageGeometry geometry) {
		Objects.requireNonNull(geometry);
		Map<String, String> map = new LinkedHashMap<>();
		map.put(IMAGE_POSITION, GeneralTools.toMultiValue(geometry.getPosX(), geometry.getPosY(), geometry.getPosSlice()));
		map.put(IMAGE_ORIENTATION, GeneralTools.toMultiValue(geometry.getCosines().toArray()));
		map.put(ROWS, Integer.toString(geometry.getRows()));
		map.put(COLUMNS, Integer.toString(geometry.getColumns()));
		map.put(PIXEL_SPACING, GeneralTools.toMultiValue(geometry.getRowSpacing(), geometry.getColumnSpacing()));
		return map;
	}
	
	private static double[] readValues(Map<String, String> attributes, String tag, int minLength, int maxLength) {
		String value = attributes.get(tag);
		if (value == null)
			throw new IllegalArgumentException("Missing required attribute " + tag);
		double[] values;
		try {
			values = GeneralTools.parseMultiValue(value);
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Invalid value for " + tag + ": " + e.getMessage(), e);
		}
		if (values.length < minLength || values.length > maxLength) {
			String expected = minLength == maxLength ? Integer.toString(minLength) : minLength + "-" + maxLength;
			throw new IllegalArgumentException("Invalid value for " + tag + ": expected " + expected + " values, got " + values.length);
		}
		return values;
	}
	
	private static int readInt(Map<String, String> attributes, String tag) {
		String value = attributes.get(tag);
		if (value == null)
			throw new IllegalArgumentException("Missing required attribute " + tag);
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid value for " + tag + ": '" + value + "' is not an integer", e);
		}
	}

}
