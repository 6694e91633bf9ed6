package org.sitemodel.sites;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.sitemodel.core.EmptyInputException;
import org.sitemodel.core.SiteModelException;
import org.sitemodel.geo.GeoDistance;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("SiteSourceBuilder Tests")
class SiteSourceBuilderTest {

    private static AssetLocation asset(String id, double lon, double lat) {
        return new AssetLocation(id, lon, lat);
    }

    @Test
    @DisplayName("Deduplicated mode collapses identical coordinates in first-seen order")
    void testDeduplication() {
        SiteSources sources = SiteSources.builder()
                .assetLocation(asset("a", 10.0, 45.0))
                .assetLocation(asset("b", 11.0, 46.0))
                .assetLocation(asset("c", 10.0, 45.0))
                .assetLocation(asset("d", 12.0, 47.0))
                .assetLocation(asset("e", 11.0, 46.0))
                .build();

        List<TargetSite> sites = SiteSourceBuilder.build(sources, 0.0);

        assertEquals(3, sites.size());
        assertEquals(10.0, sites.get(0).longitude(), 0.0);
        assertEquals(11.0, sites.get(1).longitude(), 0.0);
        assertEquals(12.0, sites.get(2).longitude(), 0.0);
        assertEquals(List.of("0", "1", "2"),
                List.of(sites.get(0).identifier(), sites.get(1).identifier(), sites.get(2).identifier()));
    }

    @Test
    @DisplayName("Nearly equal coordinates are not rounded together")
    void testNoRounding() {
        double lon = 10.123456789;
        SiteSources sources = SiteSources.builder()
                .assetLocation(asset("a", lon, 45.0))
                .assetLocation(asset("b", Math.nextUp(lon), 45.0))
                .build();

        List<TargetSite> sites = SiteSourceBuilder.build(sources, 0.0);

        assertEquals(2, sites.size());
        assertEquals(lon, sites.get(0).longitude(), 0.0);
        assertEquals(Math.nextUp(lon), sites.get(1).longitude(), 0.0);
    }

    @Test
    @DisplayName("Explicit sites come first and keep their identifiers")
    void testExplicitSitesFirst() {
        SiteSources sources = SiteSources.builder()
                .explicitSite(new SiteCoordinate("quarry", 5.0, 5.0))
                .explicitSite(SiteCoordinate.of(6.0, 6.0))
                .assetLocation(asset("x", 5.0, 5.0))
                .assetLocation(asset("y", 7.0, 7.0))
                .build();

        List<TargetSite> sites = SiteSourceBuilder.build(sources, 0.0);

        assertEquals(3, sites.size());
        assertEquals("quarry", sites.get(0).identifier());
        assertEquals("1", sites.get(1).identifier());
        assertEquals(7.0, sites.get(2).longitude(), 0.0);
    }

    @Test
    @DisplayName("Generated identifiers stay unique when explicit sites repeat")
    void testGeneratedIdentifiersUnique() {
        SiteSources sources = SiteSources.builder()
                .explicitSite(SiteCoordinate.of(1.0, 1.0))
                .explicitSite(SiteCoordinate.of(1.0, 1.0))
                .explicitSite(SiteCoordinate.of(2.0, 2.0))
                .assetLocation(asset("a", 3.0, 3.0))
                .build();

        List<TargetSite> sites = SiteSourceBuilder.build(sources, 0.0);

        assertEquals(List.of("0", "1", "2"),
                List.of(sites.get(0).identifier(), sites.get(1).identifier(), sites.get(2).identifier()));
        assertEquals(2.0, sites.get(1).longitude(), 0.0);
        assertEquals(3.0, sites.get(2).longitude(), 0.0);
    }

    @Test
    @DisplayName("No contributing coordinates is an empty-input failure")
    void testEmptySources() {
        EmptyInputException ex = assertThrows(EmptyInputException.class,
                () -> SiteSourceBuilder.build(SiteSources.builder().build(), 0.0));
        assertEquals(EmptyInputException.REASON, ex.reasonCode());
        assertThrows(EmptyInputException.class,
                () -> SiteSourceBuilder.build(SiteSources.builder().build(), 10.0));
    }

    @Test
    @DisplayName("Negative or non-finite spacing is rejected")
    void testInvalidSpacing() {
        SiteSources sources = SiteSources.builder().assetLocation(asset("a", 0.0, 0.0)).build();

        SiteModelException negative = assertThrows(SiteModelException.class,
                () -> SiteSourceBuilder.build(sources, -1.0));
        assertEquals(SiteModelException.REASON_INVALID_CONFIG, negative.reasonCode());
        assertThrows(SiteModelException.class, () -> SiteSourceBuilder.build(sources, Double.NaN));
    }

    @Test
    @DisplayName("Out-of-range coordinates are rejected as malformed site input")
    void testInvalidCoordinate() {
        SiteSources sources = SiteSources.builder().assetLocation(asset("a", 200.0, 0.0)).build();

        SiteModelException ex = assertThrows(SiteModelException.class,
                () -> SiteSourceBuilder.build(sources, 0.0));
        assertEquals(SiteModelException.REASON_MALFORMED_SITE_INPUT, ex.reasonCode());
    }

    @Test
    @DisplayName("10 km grid over a 50x50 km exposure keeps at most 25 cells inside the extent")
    void testGridOverFiftyKilometres() {
        SiteSources sources = squareExposure(10.0, 45.0, 50.0, 11);
        CoordinateExtent extent = extentOf(sources);

        List<TargetSite> sites = SiteSourceBuilder.build(sources, 10.0);

        assertTrue(sites.size() <= 25, "got " + sites.size() + " cells");
        assertEquals(25, sites.size());
        for (TargetSite site : sites) {
            assertTrue(extent.contains(site.longitude(), site.latitude()), site + " outside " + extent);
        }
    }

    @Test
    @DisplayName("Grid output is sorted by cell index and repeatable")
    void testGridDeterminism() {
        SiteSources sources = squareExposure(-120.0, 35.0, 30.0, 7);

        List<TargetSite> first = SiteSourceBuilder.build(sources, 7.5);
        List<TargetSite> second = SiteSourceBuilder.build(sources, 7.5);

        assertEquals(first.size(), second.size());
        long previous = -1L;
        for (int i = 0; i < first.size(); i++) {
            long cell = Long.parseLong(first.get(i).identifier());
            assertTrue(cell > previous);
            previous = cell;
            assertEquals(first.get(i).identifier(), second.get(i).identifier());
            assertEquals(first.get(i).longitude(), second.get(i).longitude(), 0.0);
            assertEquals(first.get(i).latitude(), second.get(i).latitude(), 0.0);
        }
    }

    @Test
    @DisplayName("Spacing too fine for an indexable lattice is a configuration error")
    void testGridTooFine() {
        SiteSources sources = SiteSources.builder()
                .assetLocation(asset("sw", -170.0, -60.0))
                .assetLocation(asset("ne", 170.0, 60.0))
                .build();

        SiteModelException ex = assertThrows(SiteModelException.class,
                () -> SiteSourceBuilder.build(sources, 1e-6));
        assertEquals(SiteModelException.REASON_INVALID_CONFIG, ex.reasonCode());
    }

    @Test
    @DisplayName("Fine but indexable spacing keeps each cell center next to its location")
    void testFineGridCentersStayLocal() {
        SiteSources sources = SiteSources.builder()
                .assetLocation(asset("sw", -170.0, -60.0))
                .assetLocation(asset("ne", 170.0, 60.0))
                .build();

        List<TargetSite> sites = SiteSourceBuilder.build(sources, 0.5);

        assertEquals(2, sites.size());
        assertTrue(Long.parseLong(sites.get(0).identifier()) >= 0L);
        assertTrue(GeoDistance.greatCircleDistanceKm(-170.0, -60.0, sites.get(0).longitude(), sites.get(0).latitude()) < 1.0);
        assertTrue(GeoDistance.greatCircleDistanceKm(170.0, 60.0, sites.get(1).longitude(), sites.get(1).latitude()) < 1.0);
    }

    @Test
    @DisplayName("Distant clusters produce one cell each")
    void testTwoClusters() {
        SiteSources sources = SiteSources.builder()
                .assetLocation(asset("a", 0.0, 0.0))
                .assetLocation(asset("b", 0.001, 0.001))
                .assetLocation(asset("c", 1.0, 1.0))
                .assetLocation(asset("d", 1.001, 1.001))
                .build();

        List<TargetSite> sites = SiteSourceBuilder.build(sources, 10.0);

        assertEquals(2, sites.size());
        assertTrue(sites.get(0).latitude() < 0.5);
        assertTrue(sites.get(1).latitude() > 0.5);
    }

    @Test
    @DisplayName("A single location yields a single cell centered on it")
    void testSingleLocationGrid() {
        SiteSources sources = SiteSources.builder().explicitSite(SiteCoordinate.of(25.0, -10.0)).build();

        List<TargetSite> sites = SiteSourceBuilder.build(sources, 5.0);

        assertEquals(1, sites.size());
        assertEquals(25.0, sites.get(0).longitude(), 1e-9);
        assertEquals(-10.0, sites.get(0).latitude(), 1e-9);
    }

    /**
     * Evenly spaced {@code perSide x perSide} assets over a square of {@code sideKm}.
     */
    private static SiteSources squareExposure(double minLon, double minLat, double sideKm, int perSide) {
        double height = sideKm / GeoDistance.KM_PER_DEGREE;
        double midLat = minLat + height * 0.5;
        double width = sideKm / (GeoDistance.KM_PER_DEGREE * Math.cos(Math.toRadians(midLat)));

        List<AssetLocation> assets = new ArrayList<>();
        for (int r = 0; r < perSide; r++) {
            for (int c = 0; c < perSide; c++) {
                double lon = c == perSide - 1 ? minLon + width : minLon + width * c / (perSide - 1);
                double lat = r == perSide - 1 ? minLat + height : minLat + height * r / (perSide - 1);
                assets.add(asset(r + ":" + c, lon, lat));
            }
        }
        return SiteSources.builder().assetLocations(assets).build();
    }

    private static CoordinateExtent extentOf(SiteSources sources) {
        double[] lonLat = new double[sources.coordinateCount() * 2];
        int offset = 0;
        for (AssetLocation asset : sources.getAssetLocations()) {
            lonLat[offset++] = asset.getLongitude();
            lonLat[offset++] = asset.getLatitude();
        }
        return CoordinateExtent.of(lonLat);
    }
}
