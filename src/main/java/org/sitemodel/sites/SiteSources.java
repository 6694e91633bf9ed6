package org.sitemodel.sites;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Coordinates contributing target sites: explicit sites and/or exposure asset locations.
 */
@Value
@Builder
public class SiteSources {
    @Singular
    List<SiteCoordinate> explicitSites;

    @Singular
    List<AssetLocation> assetLocations;

    /**
     * Total number of contributing coordinates, duplicates included.
     */
    public int coordinateCount() {
        return explicitSites.size() + assetLocations.size();
    }

    public boolean isEmpty() {
        return explicitSites.isEmpty() && assetLocations.isEmpty();
    }
}
