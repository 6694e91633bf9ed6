package org.sitemodel.sites;

import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses explicit sites and asset locations to unique coordinates.
 *
 * <p>Equality is bit-exact on both doubles; no rounding or tolerance is applied.
 * Explicit sites are visited before asset locations and the first occurrence wins. Sites
 * without an identifier are numbered by their position in the output.</p>
 */
@UtilityClass
final class DeduplicatedSiteBuilder {

    private record CoordinateKey(long lonBits, long latBits) {
        static CoordinateKey of(double lon, double lat) {
            return new CoordinateKey(Double.doubleToRawLongBits(lon), Double.doubleToRawLongBits(lat));
        }
    }

    static List<TargetSite> build(SiteSources sources) {
        ObjectOpenHashSet<CoordinateKey> seen = new ObjectOpenHashSet<>(sources.coordinateCount());
        List<TargetSite> sites = new ArrayList<>();

        for (SiteCoordinate site : sources.getExplicitSites()) {
            if (seen.add(CoordinateKey.of(site.getLongitude(), site.getLatitude()))) {
                String identifier = site.getIdentifier() != null ? site.getIdentifier() : Integer.toString(sites.size());
                sites.add(new TargetSite(identifier, site.getLongitude(), site.getLatitude()));
            }
        }

        for (AssetLocation asset : sources.getAssetLocations()) {
            if (seen.add(CoordinateKey.of(asset.getLongitude(), asset.getLatitude()))) {
                sites.add(new TargetSite(Integer.toString(sites.size()), asset.getLongitude(), asset.getLatitude()));
            }
        }
        return sites;
    }
}
