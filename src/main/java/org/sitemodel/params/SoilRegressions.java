package org.sitemodel.params;

import lombok.experimental.UtilityClass;

/**
 * Published default regressions for basin-depth parameters (California relations).
 */
@UtilityClass
public final class SoilRegressions {

    /**
     * Depth to the 1.0 km/s shear-wave horizon in metres, Chiou &amp; Youngs (2014):
     * {@code ln z1pt0 = -7.15/4 * ln((vs30^4 + 571^4) / (1360^4 + 571^4))}.
     */
    public static final SoilParameterRegression CHIOU_YOUNGS_2014_Z1PT0 = vs30 -> {
        double c1 = Math.pow(571.0d, 4);
        double c2 = Math.pow(1360.0d, 4);
        return Math.exp(-7.15d / 4.0d * Math.log((Math.pow(vs30, 4) + c1) / (c2 + c1)));
    };

    /**
     * Depth to the 2.5 km/s shear-wave horizon in km, Campbell &amp; Bozorgnia (2014):
     * {@code ln z2pt5 = 7.089 - 1.144 * ln(vs30)}.
     */
    public static final SoilParameterRegression CAMPBELL_BOZORGNIA_2014_Z2PT5 =
            vs30 -> Math.exp(7.089d - 1.144d * Math.log(vs30));
}
