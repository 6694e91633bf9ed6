package org.sitemodel.output;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * One site-model row. Optional fields are null when they were not requested.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class SiteRecord {
    private final double longitude;
    private final double latitude;
    private final double vs30;
    private final Double z1pt0;
    private final Double z2pt5;
    private final Boolean vs30measured;

    /**
     * Returns true when this record carries a value for the column.
     */
    public boolean has(SiteModelColumn column) {
        return switch (column) {
            case Z1PT0 -> z1pt0 != null;
            case Z2PT5 -> z2pt5 != null;
            case VS30MEASURED -> vs30measured != null;
            case LON, LAT, VS30 -> true;
        };
    }

    @Override
    public String toString() {
        return "SiteRecord[lon=" + longitude +
                ", lat=" + latitude +
                ", vs30=" + vs30 +
                (z1pt0 != null ? ", z1pt0=" + z1pt0 : "") +
                (z2pt5 != null ? ", z2pt5=" + z2pt5 : "") +
                (vs30measured != null ? ", vs30measured=" + vs30measured : "") + "]";
    }
}
