package org.sitemodel.output;

/**
 * Site-model table columns in their fixed output order.
 */
public enum SiteModelColumn {
    LON("lon"),
    LAT("lat"),
    VS30("vs30"),
    Z1PT0("z1pt0"),
    Z2PT5("z2pt5"),
    VS30MEASURED("vs30measured");

    private final String header;

    SiteModelColumn(String header) {
        this.header = header;
    }

    public String header() {
        return header;
    }
}
