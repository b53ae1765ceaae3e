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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rtkit.lib.analysis.images.PixelGrid;
import rtkit.lib.regions.GridResizer;
import rtkit.lib.regions.HorizontalAlignment;
import rtkit.lib.regions.VerticalAlignment;

/**
 * A single 2D image (e.g. a CT slice, dose plane or projection image), identified by its 
 * SOP instance UID, with its geometry and (optionally) its pixels.
 * <p>
 * The geometry and pixels can be replaced, but are always kept consistent: if pixels are set, 
 * their size matches the number of columns and rows in the geometry.
 * <p>
 * This class is not thread-safe.
 */
public class PlanarImage {
	
	private static final Logger logger = LoggerFactory.getLogger(PlanarImage.class);
	
	private final String uid;
	private ImageGeometry geometry;
	private PixelGrid pixels;
	
	/**
	 * Create an image without pixels.
	 * @param uid the SOP instance UID
	 * @param geometry
	 */
	public PlanarImage(String uid, ImageGeometry geometry) {
		this.uid = Objects.requireNonNull(uid, "UID must not be null");
		this.geometry = Objects.requireNonNull(geometry, "Geometry must not be null");
	}

	/**
	 * Create an image with pixels.
	 * @param uid the SOP instance UID
	 * @param geometry
	 * @param pixels pixels, with dimensions matching the geometry
	 * @throws IllegalArgumentException if the pixel dimensions do not match the geometry
	 */
	public PlanarImage(String uid, ImageGeometry geometry, PixelGrid pixels) throws IllegalArgumentException {
		this(uid, geometry);
		setPixels(pixels);
	}
	
	/**
	 * Get the SOP instance UID.
	 * @return
	 */
	public String getUID() {
		return uid;
	}
	
	/**
	 * Get the current geometry.
	 * @return
	 */
	public ImageGeometry getGeometry() {
		return geometry;
	}
	
	/**
	 * Get the pixels, or null if no pixels have been set.
	 * @return
	 */
	public PixelGrid getPixels() {
		return pixels;
	}
	
	/**
	 * Returns true if pixels have been set.
	 * @return
	 */
	public boolean hasPixels() {
		return pixels != null;
	}
	
	/**
	 * Number of columns.
	 * @return
	 */
	public int getColumns() {
		return geometry.getColumns();
	}

	/**
	 * Number of rows.
	 * @return
	 */
	public int getRows() {
		return geometry.getRows();
	}
	
	/**
	 * Replace the geometry.
	 * @param geometry
	 * @throws IllegalArgumentException if pixels are set and their size differs from the new geometry
	 */
	public void setGeometry(ImageGeometry geometry) throws IllegalArgumentException {
		Objects.requireNonNull(geometry, "Geometry must not be null");
		if (pixels != null)
			checkSize(pixels, geometry);
		this.geometry = geometry;
	}
	
	/**
	 * Set the pixels. Use null to remove them.
	 * @param pixels
	 * @throws IllegalArgumentException if the pixel size differs from the geometry
	 */
	public void setPixels(PixelGrid pixels) throws IllegalArgumentException {
		if (pixels != null)
			checkSize(pixels, geometry);
		this.pixels = pixels;
	}
	
	/**
	 * Set the in-plane position of the first pixel center.
	 * @param x
	 * @param y
	 */
	public void setPosition(double x, double y) {
		this.geometry = geometry.withPosition(x, y);
	}
	
	/**
	 * Set the row and column spacing.
	 * @param rowSpacing
	 * @param columnSpacing
	 */
	public void setSpacing(double rowSpacing, double columnSpacing) {
		this.geometry = geometry.withSpacing(rowSpacing, columnSpacing);
	}
	
	/**
	 * Set the number of columns, without changing the pixels.
	 * @param columns
	 * @throws IllegalArgumentException if columns is negative, or pixels are set with a different number of columns
	 * @see #setResolution(int, int, HorizontalAlignment, VerticalAlignment)
	 */
	public void setColumns(int columns) throws IllegalArgumentException {
		setGeometry(geometry.withExtents(columns, geometry.getRows()));
	}

	/**
	 * Set the number of rows, without changing the pixels.
	 * @param rows
	 * @throws IllegalArgumentException if rows is negative, or pixels are set with a different number of rows
	 * @see #setResolution(int, int, HorizontalAlignment, VerticalAlignment)
	 */
	public void setRows(int rows) throws IllegalArgumentException {
		setGeometry(geometry.withExtents(geometry.getColumns(), rows));
	}
	
	/**
	 * Change the number of columns and rows, cropping or padding evenly at opposite edges.
	 * @param columns
	 * @param rows
	 * @see #setResolution(int, int, HorizontalAlignment, VerticalAlignment)
	 */
	public void setResolution(int columns, int rows) {
		setResolution(columns, rows, HorizontalAlignment.CENTER, VerticalAlignment.CENTER);
	}
	
	/**
	 * Change the number of columns and rows by cropping or padding the image edges.
	 * <p>
	 * Pixels (if set) are cropped or padded, and the position is updated so that retained pixels 
	 * keep their physical coordinates.
	 * 
	 * @param columns
	 * @param rows
	 * @param horizontal
	 * @param vertical
	 * @throws IllegalArgumentException if columns or rows is not positive
	 * @see GridResizer
	 */
	public void setResolution(int columns, int rows, HorizontalAlignment horizontal, VerticalAlignment vertical) throws IllegalArgumentException {
		if (pixels == null) {
			logger.debug("Resizing geometry of {} without pixels", uid);
			this.geometry = GridResizer.resize(geometry, columns, rows, horizontal, vertical);
			return;
		}
		var result = GridResizer.resize(pixels, geometry, columns, rows, horizontal, vertical);
		this.pixels = result.getGrid();
		this.geometry = result.getGeometry();
	}
	
	/**
	 * Convert pixel indices of this image to physical coordinates.
	 * @param columnIndices
	 * @param rowIndices
	 * @return
	 * @see CoordinateTransforms#coordinatesFromIndices(ImageGeometry, double[], double[])
	 */
	public PhysicalCoordinates coordinatesFromIndices(double[] columnIndices, double[] rowIndices) {
		return CoordinateTransforms.coordinatesFromIndices(geometry, columnIndices, rowIndices);
	}

	/**
	 * Convert integer pixel indices of this image to physical coordinates.
	 * @param columnIndices
	 * @param rowIndices
	 * @return
	 * @see CoordinateTransforms#coordinatesFromIndices(ImageGeometry, int[], int[])
	 */
	public PhysicalCoordinates coordinatesFromIndices(int[] columnIndices, int[] rowIndices) {
		return CoordinateTransforms.coordinatesFromIndices(geometry, columnIndices, rowIndices);
	}
	
	/**
	 * Convert physical coordinates to the nearest pixel indices of this image.
	 * @param x
	 * @param y
	 * @param z
	 * @return
	 * @see CoordinateTransforms#coordinatesToIndices(ImageGeometry, double[], double[], double[])
	 */
	public GridIndices coordinatesToIndices(double[] x, double[] y, double[] z) {
		return CoordinateTransforms.coordinatesToIndices(geometry, x, y, z);
	}
	
	private static void checkSize(PixelGrid pixels, ImageGeometry geometry) {
		if (pixels.getColumns() != geometry.getColumns())
			throw new IllegalArgumentException("Invalid argument 'pixels': expected " + geometry.getColumns() + " columns, got " + pixels.getColumns());
		if (pixels.getRows() != geometry.getRows())
			throw new IllegalArgumentException("Invalid argument 'pixels': expected " + geometry.getRows() + " rows, got " + pixels.getRows());
	}
	
	@Override
	public String toString() {
		return "PlanarImage (" + uid + ", " + geometry.getColumns() + " x " + geometry.getRows() + ")";
	}

	@Override
	public int hashCode() {
		return Objects.hash(uid, geometry, pixels);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PlanarImage other = (PlanarImage) obj;
		return uid.equals(other.uid) && geometry.equals(other.geometry) && Objects.equals(pixels, other.pixels);
	}

}
