package org.sitemodel.output;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sitemodel.core.OutputWriteException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Site Model Table Writer Tests")
class SiteModelTableWriterTest {

    private static final Set<SiteModelColumn> BASE =
            EnumSet.of(SiteModelColumn.LON, SiteModelColumn.LAT, SiteModelColumn.VS30);

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Writes header and rows with exact decimal values")
    void testExactText() throws IOException {
        Path output = tempDir.resolve("site_model.csv");
        List<SiteRecord> records = List.of(
                new SiteRecord(10.0, 45.0, 300.0, null, null, null),
                new SiteRecord(-120.125, 35.5, 760.25, null, null, null));

        SiteModelTableWriter.write(output, BASE, records);

        assertEquals("lon,lat,vs30\n10.0,45.0,300.0\n-120.125,35.5,760.25\n", Files.readString(output));
    }

    @Test
    @DisplayName("Optional columns keep their fixed order; vs30measured is 1 or 0")
    void testAllColumns() throws IOException {
        Path output = tempDir.resolve("site_model.csv");
        List<SiteRecord> records = List.of(
                new SiteRecord(1.0, 2.0, 400.0, 120.5, 1.25, true),
                new SiteRecord(3.0, 4.0, 500.0, 80.0, 0.75, false));

        SiteModelTableWriter.write(output, EnumSet.allOf(SiteModelColumn.class), records);

        assertEquals(
                "lon,lat,vs30,z1pt0,z2pt5,vs30measured\n"
                        + "1.0,2.0,400.0,120.5,1.25,1\n"
                        + "3.0,4.0,500.0,80.0,0.75,0\n",
                Files.readString(output));
    }

    @Test
    @DisplayName("Header lists only requested columns")
    void testHeader() {
        Set<SiteModelColumn> columns = EnumSet.of(
                SiteModelColumn.VS30MEASURED, SiteModelColumn.LON, SiteModelColumn.LAT, SiteModelColumn.VS30);

        assertEquals("lon,lat,vs30,vs30measured", SiteModelTableWriter.header(columns));
    }

    @Test
    @DisplayName("Coordinates round-trip through the text form")
    void testRoundTrip() throws IOException {
        Path output = tempDir.resolve("site_model.csv");
        double lon = 12.345678901234567;
        double lat = -0.1 - 0.2;

        SiteModelTableWriter.write(output, BASE, List.of(new SiteRecord(lon, lat, 333.3, null, null, null)));

        String[] row = Files.readAllLines(output).get(1).split(",");
        assertEquals(lon, Double.parseDouble(row[0]), 0.0);
        assertEquals(lat, Double.parseDouble(row[1]), 0.0);
    }

    @Test
    @DisplayName("Empty record list writes a header-only table")
    void testEmptyTable() throws IOException {
        Path output = tempDir.resolve("site_model.csv");

        SiteModelTableWriter.write(output, BASE, List.of());

        assertEquals("lon,lat,vs30\n", Files.readString(output));
    }

    @Test
    @DisplayName("Existing table is replaced and no temporary files remain")
    void testReplaceExisting() throws IOException {
        Path output = tempDir.resolve("site_model.csv");
        Files.writeString(output, "stale content\n");

        SiteModelTableWriter.write(output, BASE, List.of(new SiteRecord(1.0, 1.0, 200.0, null, null, null)));

        assertEquals("lon,lat,vs30\n1.0,1.0,200.0\n", Files.readString(output));
        assertEquals(List.of(output), listDirectory());
    }

    @Test
    @DisplayName("Missing parent directory fails without leaving a file")
    void testMissingDirectory() {
        Path output = tempDir.resolve("absent").resolve("site_model.csv");

        OutputWriteException ex = assertThrows(OutputWriteException.class,
                () -> SiteModelTableWriter.write(output, BASE, List.of()));

        assertEquals(OutputWriteException.REASON, ex.reasonCode());
        assertFalse(Files.exists(output));
    }

    @Test
    @DisplayName("Directory destination is rejected")
    void testDirectoryDestination() {
        assertThrows(OutputWriteException.class, () -> SiteModelTableWriter.write(tempDir, BASE, List.of()));
    }

    @Test
    @DisplayName("Record missing a requested column aborts without touching the destination")
    void testMissingColumnValue() throws IOException {
        Path output = tempDir.resolve("site_model.csv");
        Set<SiteModelColumn> columns = EnumSet.of(
                SiteModelColumn.LON, SiteModelColumn.LAT, SiteModelColumn.VS30, SiteModelColumn.Z1PT0);
        List<SiteRecord> records = List.of(
                new SiteRecord(1.0, 1.0, 200.0, 10.0, null, null),
                new SiteRecord(2.0, 2.0, 300.0, null, null, null));

        assertThrows(IllegalArgumentException.class, () -> SiteModelTableWriter.write(output, columns, records));

        assertFalse(Files.exists(output));
        assertTrue(listDirectory().isEmpty());
    }

    @Test
    @DisplayName("Columns must include lon, lat and vs30")
    void testRequiredColumns() {
        assertThrows(IllegalArgumentException.class,
                () -> SiteModelTableWriter.header(EnumSet.of(SiteModelColumn.LON, SiteModelColumn.LAT)));
    }

    private List<Path> listDirectory() throws IOException {
        try (Stream<Path> entries = Files.list(tempDir)) {
            return entries.toList();
        }
    }
}
