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
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.BiFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rtkit.lib.common.Prefs;
import rtkit.lib.common.ThreadTools;

/**
 * Apply {@link CoordinateTransforms} to many images in parallel, one task per image.
 * <p>
 * Each task works on its own (immutable) geometry, so no coordination between tasks is needed.
 * The number of threads is taken from {@link Prefs#getNumThreads()}.
 */
public class BatchTransforms {
	
	private static final Logger logger = LoggerFactory.getLogger(BatchTransforms.class);
	
	// Suppressed default constructor for non-instantiability
	private BatchTransforms() {
		throw new AssertionError();
	}
	
	/**
	 * Convert pixel indices to physical coordinates for several images.
	 * 
	 * @param geometries the geometry of each image
	 * @param indices the indices to convert for each image (same order as the geometries)
	 * @return the physical coordinates for each image, in the same order
	 * @throws IllegalArgumentException if the lists differ in size, or any single conversion fails with an invalid argument
	 * @throws InterruptedException if interrupted while waiting for the conversions
	 */
	public static List<PhysicalCoordinates> coordinatesFromIndices(List<ImageGeometry> geometries, List<GridIndices> indices) throws InterruptedException {
		return applyAll(geometries, indices, CoordinateTransforms::coordinatesFromIndices);
	}

	/**
	 * Convert physical coordinates to pixel indices for several images.
	 * 
	 * @param geometries the geometry of each image
	 * @param coordinates the coordinates to convert for each image (same order as the geometries)
	 * @return the indices for each image, in the same order
	 * @throws IllegalArgumentException if the lists differ in size, or any single conversion fails with an invalid argument
	 * @throws InvalidGeometryException if any geometry is degenerate
	 * @throws InterruptedException if interrupted while waiting for the conversions
	 */
	public static List<GridIndices> coordinatesToIndices(List<ImageGeometry> geometries, List<PhysicalCoordinates> coordinates) throws InterruptedException {
		return applyAll(geometries, coordinates, CoordinateTransforms::coordinatesToIndices);
	}
	
	private static <S, T> List<T> applyAll(List<ImageGeometry> geometries, List<S> inputs, BiFunction<ImageGeometry, S, T> fun) throws InterruptedException {
		if (geometries.size() != inputs.size())
			throw new IllegalArgumentException("Number of geometries (" + geometries.size() + ") and inputs (" + inputs.size() + ") must be equal");
		if (geometries.isEmpty())
			return new ArrayList<>();
		
		int nThreads = Math.min(Prefs.getNumThreads(), geometries.size());
		logger.debug("Transforming {} images with {} thread(s)", geometries.size(), nThreads);
		
		ExecutorService pool = Executors.newFixedThreadPool(nThreads, ThreadTools.createThreadFactory("rtkit-transform-", true));
		try {
			List<Future<T>> futures = new ArrayList<>();
			for (int i = 0; i < geometries.size(); i++) {
				var geometry = geometries.get(i);
				var input = inputs.get(i);
				Callable<T> task = () -> fun.apply(geometry, input);
				futures.add(pool.submit(task));
			}
			List<T> results = new ArrayList<>(futures.size());
			for (var future : futures) {
				try {
					results.add(future.get());
				} catch (ExecutionException e) {
					var cause = e.getCause();
					if (cause instanceof RuntimeException)
						throw (RuntimeException)cause;
					if (cause instanceof Error)
						throw (Error)cause;
					throw new IllegalStateException("Coordinate transform failed", cause);
				}
			}
			return results;
		} finally {
			pool.shutdownNow();
		}
	}

}
