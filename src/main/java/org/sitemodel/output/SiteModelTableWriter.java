package org.sitemodel.output;

import lombok.experimental.UtilityClass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sitemodel.core.OutputWriteException;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Writes site records as a CSV table with a header row.
 *
 * <p>The table is written to a temporary sibling file and moved over the destination only
 * once complete, so readers never observe a partial table. Columns always appear in
 * {@link SiteModelColumn} order; coordinates and values use {@link Double#toString(double)}
 * so they round-trip exactly; {@code vs30measured} is written as {@code 1} or {@code 0}.</p>
 */
@UtilityClass
public final class SiteModelTableWriter {
    private static final Logger logger = LogManager.getLogger(SiteModelTableWriter.class);

    private static final Set<SiteModelColumn> REQUIRED_COLUMNS =
            EnumSet.of(SiteModelColumn.LON, SiteModelColumn.LAT, SiteModelColumn.VS30);

    /**
     * Writes the table atomically.
     *
     * @param destination final table path; its parent directory must exist.
     * @param columns requested columns; must include lon, lat and vs30.
     * @param records rows in output order.
     * @throws OutputWriteException when the table cannot be written; no file is left at
     *         {@code destination} unless one existed before.
     */
    public static void write(Path destination, Set<SiteModelColumn> columns, List<SiteRecord> records) {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(records, "records");
        List<SiteModelColumn> ordered = orderedColumns(columns);

        Path target = destination.toAbsolutePath();
        if (Files.isDirectory(target)) {
            throw new OutputWriteException("destination is a directory: " + target, null);
        }
        Path directory = target.getParent();

        Path temp = null;
        try {
            temp = Files.createTempFile(directory, "." + target.getFileName() + ".", ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                writeHeader(writer, ordered);
                for (SiteRecord record : records) {
                    writeRow(writer, ordered, record);
                }
            }
            moveIntoPlace(temp, target);
            temp = null;
        } catch (IOException e) {
            throw new OutputWriteException("cannot write site model to " + target, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
        logger.info("Saved {} rows in {}", records.size(), target);
    }

    /**
     * Returns the header line (without line terminator) for the given columns.
     */
    public static String header(Set<SiteModelColumn> columns) {
        List<SiteModelColumn> ordered = orderedColumns(columns);
        StringBuilder header = new StringBuilder();
        for (int i = 0; i < ordered.size(); i++) {
            if (i > 0) {
                header.append(',');
            }
            header.append(ordered.get(i).header());
        }
        return header.toString();
    }

    private static List<SiteModelColumn> orderedColumns(Set<SiteModelColumn> columns) {
        Objects.requireNonNull(columns, "columns");
        if (!columns.containsAll(REQUIRED_COLUMNS)) {
            throw new IllegalArgumentException("columns must include lon, lat and vs30, got " + columns);
        }
        return new ArrayList<>(EnumSet.copyOf(columns));
    }

    private static void writeHeader(Writer writer, List<SiteModelColumn> columns) throws IOException {
        writer.write(header(EnumSet.copyOf(columns)));
        writer.write('\n');
    }

    private static void writeRow(Writer writer, List<SiteModelColumn> columns, SiteRecord record) throws IOException {
        for (int i = 0; i < columns.size(); i++) {
            SiteModelColumn column = columns.get(i);
            if (!record.has(column)) {
                throw new IllegalArgumentException("record " + record + " has no value for column " + column.header());
            }
            if (i > 0) {
                writer.write(',');
            }
            writer.write(format(column, record));
        }
        writer.write('\n');
    }

    private static String format(SiteModelColumn column, SiteRecord record) {
        return switch (column) {
            case LON -> Double.toString(record.longitude());
            case LAT -> Double.toString(record.latitude());
            case VS30 -> Double.toString(record.vs30());
            case Z1PT0 -> Double.toString(record.z1pt0());
            case Z2PT5 -> Double.toString(record.z2pt5());
            case VS30MEASURED -> record.vs30measured() ? "1" : "0";
        };
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move unsupported for {}, replacing instead", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Could not remove temporary file {}", temp, e);
        }
    }
}
