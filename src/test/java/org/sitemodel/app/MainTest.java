package org.sitemodel.app;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Main CLI Tests")
class MainTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("End to end: exposure, two Vs30 files and derived columns")
    void testEndToEnd() throws IOException {
        Path vs30a = tempDir.resolve("vs30_a.csv");
        Path vs30b = tempDir.resolve("vs30_b.csv");
        Path exposure = tempDir.resolve("exposure.csv");
        Path output = tempDir.resolve("site_model.csv");
        Files.writeString(vs30a, "10.0,45.0,300.0\n");
        Files.writeString(vs30b, "11.0 46.0 760.0\n");
        Files.writeString(exposure, "id,lon,lat,taxonomy\na,10.0,45.0,RC\nb,10.0,45.0,W\nc,11.0,46.0,RC\nd,30.0,30.0,W\n");

        int exitCode = Main.run(
                "-e", exposure.toString(),
                "--z1pt0",
                "--vs30measured",
                "--measured-source", vs30b.toString(),
                "-o", output.toString(),
                vs30a.toString(), vs30b.toString());

        assertEquals(Main.EXIT_SUCCESS, exitCode);
        List<String> lines = Files.readAllLines(output);
        assertEquals(3, lines.size());
        assertEquals("lon,lat,vs30,z1pt0,vs30measured", lines.get(0));
        assertTrue(lines.get(1).startsWith("10.0,45.0,300.0,"));
        assertTrue(lines.get(1).endsWith(",0"));
        assertTrue(lines.get(2).startsWith("11.0,46.0,760.0,"));
        assertTrue(lines.get(2).endsWith(",1"));
    }

    @Test
    @DisplayName("Site file with grid spacing writes one row per occupied cell")
    void testSitesWithGrid() throws IOException {
        Path vs30 = tempDir.resolve("vs30.csv");
        Path sites = tempDir.resolve("sites.csv");
        Path output = tempDir.resolve("model.csv");
        Files.writeString(vs30, "0.0,0.0,400.0\n");
        Files.writeString(sites, "lon,lat\n0.0,0.0\n0.001,0.001\n");

        int exitCode = Main.run("-s", sites.toString(), "-g", "10", "-o", output.toString(), vs30.toString());

        assertEquals(Main.EXIT_SUCCESS, exitCode);
        assertEquals(2, Files.readAllLines(output).size());
    }

    @Test
    @DisplayName("Missing site sources is a usage error")
    void testMissingSources() throws IOException {
        Path vs30 = tempDir.resolve("vs30.csv");
        Files.writeString(vs30, "0.0,0.0,400.0\n");

        assertEquals(2, Main.run("-o", tempDir.resolve("out.csv").toString(), vs30.toString()));
        assertFalse(Files.exists(tempDir.resolve("out.csv")));
    }

    @Test
    @DisplayName("Missing Vs30 files is a usage error")
    void testMissingPositional() {
        assertEquals(2, Main.run("-e", tempDir.resolve("exposure.csv").toString()));
    }

    @Test
    @DisplayName("Malformed Vs30 row fails without writing output")
    void testMalformedInput() throws IOException {
        Path vs30 = tempDir.resolve("vs30.csv");
        Path exposure = tempDir.resolve("exposure.csv");
        Path output = tempDir.resolve("site_model.csv");
        Files.writeString(vs30, "0.0,0.0\n");
        Files.writeString(exposure, "lon,lat\n0.0,0.0\n");

        int exitCode = Main.run("-e", exposure.toString(), "-o", output.toString(), vs30.toString());

        assertEquals(Main.EXIT_ERROR, exitCode);
        assertFalse(Files.exists(output));
    }

    @Test
    @DisplayName("Invalid distance is reported as a configuration failure")
    void testInvalidDistance() throws IOException {
        Path vs30 = tempDir.resolve("vs30.csv");
        Path exposure = tempDir.resolve("exposure.csv");
        Files.writeString(vs30, "0.0,0.0,400.0\n");
        Files.writeString(exposure, "lon,lat\n0.0,0.0\n");

        int exitCode = Main.run("-e", exposure.toString(), "--assoc-distance=-1",
                "-o", tempDir.resolve("out.csv").toString(), vs30.toString());

        assertEquals(Main.EXIT_ERROR, exitCode);
    }
}
