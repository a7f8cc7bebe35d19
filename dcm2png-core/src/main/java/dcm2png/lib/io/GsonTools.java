/*-
 * #%L
 * This file is part of dcm2png.
 * %%
 * Copyright (C) 2024 dcm2png developers
 * %%
 * dcm2png is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * dcm2png is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with dcm2png.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package dcm2png.lib.io;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

/**
 * Helper class providing Gson instances with type adapters registered for the classes
 * written to dcm2png's JSON files.
 * <p>
 * Currently this means {@link Path}, which is written as a string.
 */
public class GsonTools {

	private static final Logger logger = LoggerFactory.getLogger(GsonTools.class);

	private static final GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient()
			.registerTypeHierarchyAdapter(Path.class, PathTypeAdapter.INSTANCE);

	private GsonTools() {
		throw new AssertionError();
	}

	/**
	 * Get default Gson.
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

	/**
	 * TypeAdapter writing paths as strings.
	 */
	static class PathTypeAdapter extends TypeAdapter<Path> {

		static final PathTypeAdapter INSTANCE = new PathTypeAdapter();

		@Override
		public void write(JsonWriter out, Path value) throws IOException {
			if (value == null)
				out.nullValue();
			else
				out.value(value.toString());
		}

		@Override
		public Path read(JsonReader in) throws IOException {
			if (in.peek() == JsonToken.NULL) {
				in.nextNull();
				return null;
			}
			String s = in.nextString();
			try {
				return Paths.get(s);
			} catch (InvalidPathException e) {
				logger.debug("Invalid path in JSON: {}", s);
				throw new JsonParseException("Invalid path: " + s, e);
			}
		}

	}

}
