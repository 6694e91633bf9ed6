package org.sitemodel.sites;

import lombok.Value;

/**
 * Location of one exposure asset. Several assets usually share one location.
 */
@Value
public class AssetLocation {
    String assetId;
    double longitude;
    double latitude;
}
