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

package rtkit.lib.io;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import rtkit.lib.geom.Coordinate;
import rtkit.lib.images.DirectionCosines;
import rtkit.lib.images.ImageGeometry;

/**
 * Helper class providing Gson instances with type adapters registered to serialize 
 * several key classes.
 * <p>
 * These include:
 * <ul>
 * <li>{@link ImageGeometry}</li>
 * <li>{@link DirectionCosines}</li>
 * <li>{@link Coordinate}</li>
 * </ul>
 * Geometry is written using the names of the corresponding DICOM attributes, e.g.
 * <pre>
 * {"imagePosition": [-5.0, -3.0, 50.0], "pixelSpacing": [3.0, 2.0], 
 *  "imageOrientation": [1.0, 0.0, 0.0, 0.0, 1.0, 0.0], "columns": 4, "rows": 4}
 * </pre>
 * 
 * @author Pete Bankhead
 */
public class GsonTools {
	
	private static final Logger logger = LoggerFactory.getLogger(GsonTools.class);
	
	private static GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient()
			.registerTypeAdapterFactory(new RTKitTypeAdapterFactory());
	
	/**
	 * Access the builder used with {@link #getInstance()}.
	 * This makes it possible to register new type adapters if required, which will be used by future Gson instances 
	 * returned by this class.
	 * <p>
	 * To create a derived builder that does not change the default, use {@code getInstance().newBuilder()}.
	 * 
	 * @return
	 */
	public static GsonBuilder getDefaultBuilder() {
		logger.trace("Requesting GsonBuilder from {}", Thread.currentThread().getStackTrace()[0]);
		return builder;
	}
	
	/**
	 * Get default Gson, capable of serializing/deserializing the geometry classes.
	 * @return
	 * 
	 * @see #getInstance(boolean)
	 */
	public static Gson getInstance() {
		return builder.create();
	}
	
	/**
	 * Get default Gson, optionally with pretty printing enabled.
	 * 
	 * @param pretty if true, write using pretty-printing (i.e. more whitespace for formatting)
	 * @return
	 * 
	 * @see #getInstance()
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return getInstance().newBuilder().setPrettyPrinting().create();
		return getInstance();
	}
	
	
	static class RTKitTypeAdapterFactory implements TypeAdapterFactory {

		@Override
		public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
			return getTypeAdaptor(type.getRawType());
		}
		
		@SuppressWarnings("unchecked")
		static <T> TypeAdapter<T> getTypeAdaptor(Class<? super T> cls) {
			if (ImageGeometry.class.equals(cls))
				return (TypeAdapter<T>)ImageGeometryTypeAdapter.INSTANCE.nullSafe();

			if (DirectionCosines.class.equals(cls))
				return (TypeAdapter<T>)DirectionCosinesTypeAdapter.INSTANCE.nullSafe();

			if (Coordinate.class.equals(cls))
				return (TypeAdapter<T>)CoordinateTypeAdapter.INSTANCE.nullSafe();

			return null;
		}
		
	}
	
	
	/**
	 * TypeAdapter for Coordinate objects, written as an array [x, y, z].
	 */
	static class CoordinateTypeAdapter extends TypeAdapter<Coordinate> {
		
		static CoordinateTypeAdapter INSTANCE = new CoordinateTypeAdapter();

		@Override
		public void write(JsonWriter out, Coordinate value) throws IOException {
			writeArray(out, value.getX(), value.getY(), value.getZ());
		}

		@Override
		public Coordinate read(JsonReader in) throws IOException {
			double[] values = readArray(in, 3, "coordinate");
			return new Coordinate(values[0], values[1], values[2]);
		}
		
	}
	
	
	/**
	 * TypeAdapter for DirectionCosines, written as an array of six values.
	 */
	static class DirectionCosinesTypeAdapter extends TypeAdapter<DirectionCosines> {
		
		static DirectionCosinesTypeAdapter INSTANCE = new DirectionCosinesTypeAdapter();

		@Override
		public void write(JsonWriter out, DirectionCosines value) throws IOException {
			writeArray(out, value.toArray());
		}

		@Override
		public DirectionCosines read(JsonReader in) throws IOException {
			try {
				return DirectionCosines.of(readArray(in, 6, "imageOrientation"));
			} catch (IllegalArgumentException e) {
				throw new JsonParseException(e.getMessage(), e);
			}
		}
		
	}
	
	
	/**
	 * TypeAdapter for ImageGeometry objects.
	 */
	static class ImageGeometryTypeAdapter extends TypeAdapter<ImageGeometry> {
		
		static ImageGeometryTypeAdapter INSTANCE = new ImageGeometryTypeAdapter();

		@Override
		public void write(JsonWriter out, ImageGeometry geometry) throws IOException {
			out.beginObject();
			out.name("imagePosition");
			writeArray(out, geometry.getPosX(), geometry.getPosY(), geometry.getPosSlice());
			out.name("pixelSpacing");
			writeArray(out, geometry.getRowSpacing(), geometry.getColumnSpacing());
			out.name("imageOrientation");
			DirectionCosinesTypeAdapter.INSTANCE.write(out, geometry.getCosines());
			out.name("columns");
			out.value(geometry.getColumns());
			out.name("rows");
			out.value(geometry.getRows());
			out.endObject();
		}

		@Override
		public ImageGeometry read(JsonReader in) throws IOException {
			var builder = new ImageGeometry.Builder();
			int columns = 0;
			int rows = 0;
			in.beginObject();
			try {
				while (in.hasNext()) {
					switch (in.nextName()) {
					case "imagePosition":
						double[] pos = readArray(in, 3, "imagePosition");
						builder.position(pos[0], pos[1], pos[2]);
						break;
					case "pixelSpacing":
						double[] spacing = readArray(in, 2, "pixelSpacing");
						builder.spacing(spacing[0], spacing[1]);
						break;
					case "imageOrientation":
						builder.cosines(DirectionCosinesTypeAdapter.INSTANCE.read(in));
						break;
					case "columns":
						columns = in.nextInt();
						break;
					case "rows":
						rows = in.nextInt();
						break;
					default:
						in.skipValue();
					}
				}
				builder.extents(columns, rows);
			} catch (IllegalArgumentException e) {
				throw new JsonParseException("Invalid image geometry: " + e.getMessage(), e);
			}
			in.endObject();
			return builder.build();
		}
		
	}
	
	private static void writeArray(JsonWriter out, double... values) throws IOException {
		out.beginArray();
		for (double v : values)
			out.value(v);
		out.endArray();
	}
	
	private static double[] readArray(JsonReader in, int expectedLength, String name) throws IOException {
		List<Double> values = new ArrayList<>();
		in.beginArray();
		while (in.hasNext())
			values.add(in.nextDouble());
		in.endArray();
		if (values.size() != expectedLength)
			throw new JsonParseException("Expected " + expectedLength + " values for '" + name + "', but got " + values.size());
		return values.stream().mapToDouble(Double::doubleValue).toArray();
	}

}
