package org.sitemodel.sites;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Coordinate that needs site parameters, in emission order.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class TargetSite {
    private final String identifier;
    private final double longitude;
    private final double latitude;

    @Override
    public String toString() {
        return "TargetSite[" + identifier + " @ " + longitude + ", " + latitude + "]";
    }
}
