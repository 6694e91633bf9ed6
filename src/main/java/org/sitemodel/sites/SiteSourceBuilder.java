package org.sitemodel.sites;

import lombok.experimental.UtilityClass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sitemodel.core.EmptyInputException;
import org.sitemodel.core.SiteModelException;
import org.sitemodel.geo.GeoDistance;

import java.util.List;
import java.util.Objects;

/**
 * Builds the target sites to parametrize.
 *
 * <p>A grid spacing of zero selects deduplicated-location mode; a positive spacing selects
 * grid mode, where each non-empty lattice cell contributes one site at its center.</p>
 */
@UtilityClass
public final class SiteSourceBuilder {
    private static final Logger logger = LogManager.getLogger(SiteSourceBuilder.class);

    /**
     * Builds target sites in first-seen (deduplicated) or cell-index (grid) order.
     *
     * @param sources contributing coordinates.
     * @param gridSpacingKm 0 for deduplicated mode, otherwise the cell size in km.
     * @return non-empty ordered target sites.
     * @throws EmptyInputException when no site can be built.
     */
    public static List<TargetSite> build(SiteSources sources, double gridSpacingKm) {
        Objects.requireNonNull(sources, "sources");
        if (!Double.isFinite(gridSpacingKm) || gridSpacingKm < 0.0d) {
            throw new SiteModelException(
                    SiteModelException.REASON_INVALID_CONFIG,
                    "gridSpacingKm must be finite and >= 0, got " + gridSpacingKm
            );
        }
        validateCoordinates(sources);
        if (sources.isEmpty()) {
            throw new EmptyInputException("no asset locations and no explicit sites were given");
        }

        List<TargetSite> sites;
        if (gridSpacingKm > 0.0d) {
            GridSiteBuilder.GriddedSites gridded = GridSiteBuilder.build(sources, gridSpacingKm);
            sites = gridded.sites();
            logger.debug("Laid {}", gridded.grid());
            logger.info("Reduced {} locations to {} grid sites (spacing {} km)",
                    sources.coordinateCount(), sites.size(), gridSpacingKm);
        } else {
            sites = DeduplicatedSiteBuilder.build(sources);
            logger.info("Collapsed {} locations to {} unique sites",
                    sources.coordinateCount(), sites.size());
        }

        if (sites.isEmpty()) {
            throw new EmptyInputException("no target site could be built from "
                    + sources.coordinateCount() + " locations");
        }
        return List.copyOf(sites);
    }

    private static void validateCoordinates(SiteSources sources) {
        for (SiteCoordinate site : sources.getExplicitSites()) {
            requireValid(site.getLongitude(), site.getLatitude(), "site " + site.getIdentifier());
        }
        for (AssetLocation asset : sources.getAssetLocations()) {
            requireValid(asset.getLongitude(), asset.getLatitude(), "asset " + asset.getAssetId());
        }
    }

    private static void requireValid(double lon, double lat, String label) {
        if (!GeoDistance.isValidCoordinate(lon, lat)) {
            throw new SiteModelException(
                    SiteModelException.REASON_MALFORMED_SITE_INPUT,
                    label + " has invalid coordinate (" + lon + ", " + lat + ")"
            );
        }
    }
}
