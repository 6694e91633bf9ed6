package org.sitemodel.sites;

import lombok.experimental.UtilityClass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sitemodel.core.SiteModelException;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Readers for the CSV inputs that contribute target coordinates.
 *
 * <ul>
 *   <li>Site files: rows {@code lon,lat[,id]}, with an optional header row.</li>
 *   <li>Exposure files: a header naming {@code lon} and {@code lat} columns (and optionally
 *   {@code id}); all other columns are ignored.</li>
 * </ul>
 */
@UtilityClass
public final class SiteInputReader {
    private static final Logger logger = LogManager.getLogger(SiteInputReader.class);

    private static final Pattern COMMA = Pattern.compile(",");

    /**
     * Reads explicit site coordinates.
     */
    public static List<SiteCoordinate> readSites(Path file) {
        Objects.requireNonNull(file, "file");
        List<SiteCoordinate> sites = new ArrayList<>();
        List<String[]> rows = readRows(file);
        for (int i = 0; i < rows.size(); i++) {
            String[] fields = rows.get(i);
            if (i == 0 && !isNumeric(fields[0])) {
                continue;
            }
            if (fields.length < 2 || fields.length > 3) {
                throw malformed(file, i + 1, "expected lon,lat[,id], got " + fields.length + " fields");
            }
            double lon = parseNumber(fields[0], file, i + 1);
            double lat = parseNumber(fields[1], file, i + 1);
            String identifier = fields.length == 3 && !fields[2].isEmpty() ? fields[2] : null;
            sites.add(new SiteCoordinate(identifier, lon, lat));
        }
        logger.info("Read {} site coordinates from {}", sites.size(), file);
        return sites;
    }

    /**
     * Reads asset locations from an exposure CSV.
     */
    public static List<AssetLocation> readExposure(Path file) {
        Objects.requireNonNull(file, "file");
        List<String[]> rows = readRows(file);
        if (rows.isEmpty()) {
            throw malformed(file, 1, "exposure file has no header");
        }
        String[] header = rows.get(0);
        int lonColumn = -1;
        int latColumn = -1;
        int idColumn = -1;
        for (int c = 0; c < header.length; c++) {
            String name = header[c].toLowerCase(Locale.ROOT);
            if (name.equals("lon") || name.equals("longitude")) {
                lonColumn = c;
            } else if (name.equals("lat") || name.equals("latitude")) {
                latColumn = c;
            } else if (name.equals("id")) {
                idColumn = c;
            }
        }
        if (lonColumn < 0 || latColumn < 0) {
            throw malformed(file, 1, "exposure header must name lon and lat columns");
        }

        List<AssetLocation> assets = new ArrayList<>(rows.size() - 1);
        for (int i = 1; i < rows.size(); i++) {
            String[] fields = rows.get(i);
            if (fields.length != header.length) {
                throw malformed(file, i + 1, "expected " + header.length + " fields, got " + fields.length);
            }
            String assetId = idColumn >= 0 ? fields[idColumn] : Integer.toString(i - 1);
            assets.add(new AssetLocation(
                    assetId,
                    parseNumber(fields[lonColumn], file, i + 1),
                    parseNumber(fields[latColumn], file, i + 1)
            ));
        }
        logger.info("Read {} asset locations from {}", assets.size(), file);
        return assets;
    }

    /**
     * Returns non-blank rows split on commas with trimmed fields. Row numbers are counted
     * over non-blank rows only.
     */
    private static List<String[]> readRows(Path file) {
        List<String[]> rows = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.strip();
                if (trimmed.isEmpty()) {
                    continue;
                }
                String[] fields = COMMA.split(trimmed, -1);
                for (int i = 0; i < fields.length; i++) {
                    fields[i] = fields[i].strip();
                }
                rows.add(fields);
            }
        } catch (IOException e) {
            throw new SiteModelException(
                    SiteModelException.REASON_INPUT_READ_FAILED,
                    "cannot read " + file,
                    e
            );
        }
        return rows;
    }

    private static boolean isNumeric(String field) {
        try {
            Double.parseDouble(field);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static double parseNumber(String field, Path file, int row) {
        try {
            return Double.parseDouble(field);
        } catch (NumberFormatException e) {
            throw malformed(file, row, "not a number: '" + field + "'");
        }
    }

    private static SiteModelException malformed(Path file, int row, String detail) {
        return new SiteModelException(
                SiteModelException.REASON_MALFORMED_SITE_INPUT,
                file + " row " + row + ": " + detail
        );
    }
}
