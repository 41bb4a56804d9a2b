package com.github.micycle1.inscribedj.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.inscribedj.PolygonFormatException;
import com.github.micycle1.inscribedj.geometry.PolygonBoundary;

/**
 * Reads polygon boundaries from text.
 * <p>
 * Two formats are understood:
 * <ul>
 * <li>coordinate lists: one vertex per line as two numbers separated by
 * whitespace and/or a comma. Blank lines and lines starting with {@code #} are
 * skipped.</li>
 * <li>WKT {@code POLYGON} or closed {@code LINESTRING}/{@code LINEARRING}.</li>
 * </ul>
 */
public class PolygonReader {

	private static final Logger LOGGER = LoggerFactory.getLogger(PolygonReader.class);

	private static final String SEPARATORS = " \t,;";

	private PolygonReader() {
	}

	public static PolygonBoundary read(Path path) throws IOException {
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return read(reader);
		}
	}

	/**
	 * Reads a coordinate list. The reader is not closed.
	 *
	 * @throws PolygonFormatException if a line does not hold exactly two numbers
	 */
	public static PolygonBoundary read(Reader reader) throws IOException {
		BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
		List<Coordinate> vertices = new ArrayList<>();
		String line;
		int lineNumber = 0;
		while ((line = in.readLine()) != null) {
			lineNumber++;
			String trimmed = line.trim();
			if (trimmed.isEmpty() || trimmed.startsWith("#")) {
				continue;
			}
			String[] tokens = StringUtils.split(trimmed, SEPARATORS);
			if (tokens.length != 2) {
				throw new PolygonFormatException("Line " + lineNumber + ": expected 2 ordinates but found " + tokens.length + ": '" + line + "'");
			}
			try {
				vertices.add(new Coordinate(Double.parseDouble(tokens[0]), Double.parseDouble(tokens[1])));
			} catch (NumberFormatException e) {
				throw new PolygonFormatException("Line " + lineNumber + ": not a number: '" + line + "'", e);
			}
		}
		LOGGER.debug("Read {} vertices from {} lines.", vertices.size(), lineNumber);
		return PolygonBoundary.of(vertices);
	}

	public static PolygonBoundary readCoordinates(String text) {
		try {
			return read(new StringReader(text));
		} catch (IOException e) {
			throw new IllegalStateException(e); // StringReader does not throw
		}
	}

	/**
	 * Reads a polygon from WKT. Only the shell of a polygon is used.
	 *
	 * @throws PolygonFormatException if the text is not valid WKT or not a
	 *                                polygonal ring
	 */
	public static PolygonBoundary fromWkt(String wkt) {
		Geometry geometry;
		try {
			geometry = new WKTReader(new GeometryFactory()).read(wkt);
		} catch (ParseException e) {
			throw new PolygonFormatException("Invalid WKT: " + e.getMessage(), e);
		}
		if (geometry instanceof Polygon) {
			return PolygonBoundary.fromPolygon((Polygon) geometry);
		}
		if (geometry instanceof LinearRing) {
			return PolygonBoundary.fromRing((LinearRing) geometry);
		}
		if (geometry instanceof LineString && ((LineString) geometry).isClosed()) {
			return PolygonBoundary.of(geometry.getCoordinates());
		}
		throw new PolygonFormatException("Expected a POLYGON or closed ring, got " + geometry.getGeometryType());
	}
}
