package org.sitemodel.sites;

import lombok.Value;

/**
 * Explicit site input. The identifier may be null, in which case the site's output position is used.
 */
@Value
public class SiteCoordinate {
    String identifier;
    double longitude;
    double latitude;

    public static SiteCoordinate of(double longitude, double latitude) {
        return new SiteCoordinate(null, longitude, latitude);
    }
}
