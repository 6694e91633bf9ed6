package org.sitemodel.points;

import lombok.experimental.UtilityClass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sitemodel.core.MalformedRowException;
import org.sitemodel.core.SiteModelException;
import org.sitemodel.geo.GeoDistance;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Loads headerless {@code longitude, latitude, value} files into one merged point set.
 *
 * <p>Rows are separated by commas or, when a row has no comma, by whitespace. Blank
 * lines are skipped. Any other row must hold exactly three finite numbers with the
 * coordinate inside geographic bounds.</p>
 */
@UtilityClass
public final class PointSetLoader {
    private static final Logger logger = LogManager.getLogger(PointSetLoader.class);

    private static final Pattern COMMA = Pattern.compile(",");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Loads and concatenates all files in the given order.
     *
     * @param files ground-parameter files, first file wins ties downstream.
     * @return merged point set.
     * @throws MalformedRowException when a row does not parse.
     * @throws SiteModelException when a file cannot be read.
     */
    public static GroundParameterSet load(List<Path> files) {
        Objects.requireNonNull(files, "files");
        List<GroundParameterPoint> points = new ArrayList<>();
        List<String> sources = new ArrayList<>(files.size());

        for (int sourceIndex = 0; sourceIndex < files.size(); sourceIndex++) {
            Path file = Objects.requireNonNull(files.get(sourceIndex), "files[" + sourceIndex + "]");
            String sourceName = file.toString();
            int before = points.size();
            readFile(file, sourceName, sourceIndex, points);
            sources.add(sourceName);
            logger.info("Read {} ground-parameter points from {}", points.size() - before, sourceName);
        }
        return new GroundParameterSet(points, sources);
    }

    private static void readFile(Path file, String sourceName, int sourceIndex, List<GroundParameterPoint> sink) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.strip();
                if (trimmed.isEmpty()) {
                    continue;
                }
                sink.add(parseRow(trimmed, sourceName, sourceIndex, lineNumber, sink.size()));
            }
        } catch (IOException e) {
            throw new SiteModelException(
                    SiteModelException.REASON_INPUT_READ_FAILED,
                    "cannot read ground-parameter file " + sourceName,
                    e
            );
        }
    }

    static GroundParameterPoint parseRow(String row, String sourceName, int sourceIndex, int lineNumber, int loadOrder) {
        String[] fields = row.indexOf(',') >= 0 ? COMMA.split(row, -1) : WHITESPACE.split(row);
        if (fields.length != 3) {
            throw new MalformedRowException(sourceName, lineNumber,
                    "expected 3 fields (lon, lat, value), got " + fields.length);
        }
        double lon = parseField(fields[0], "longitude", sourceName, lineNumber);
        double lat = parseField(fields[1], "latitude", sourceName, lineNumber);
        double value = parseField(fields[2], "value", sourceName, lineNumber);
        if (!GeoDistance.isValidCoordinate(lon, lat)) {
            throw new MalformedRowException(sourceName, lineNumber,
                    "coordinate (" + lon + ", " + lat + ") outside [-180,180] x [-90,90]");
        }
        return new GroundParameterPoint(lon, lat, value, sourceName, sourceIndex, lineNumber, loadOrder);
    }

    private static double parseField(String field, String name, String sourceName, int lineNumber) {
        String text = field.strip();
        double parsed;
        try {
            parsed = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new MalformedRowException(sourceName, lineNumber, name + " is not a number: '" + text + "'");
        }
        if (!Double.isFinite(parsed)) {
            throw new MalformedRowException(sourceName, lineNumber, name + " must be finite: '" + text + "'");
        }
        return parsed;
    }
}
