package org.sitemodel.params;

/**
 * Derives a secondary soil parameter from Vs30.
 */
@FunctionalInterface
public interface SoilParameterRegression {

    /**
     * @param vs30 shear-wave velocity in the top 30 m, in m/s.
     * @return derived parameter in the regression's native unit.
     */
    double apply(double vs30);
}
