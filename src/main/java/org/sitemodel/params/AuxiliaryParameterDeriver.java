package org.sitemodel.params;

import lombok.Builder;
import lombok.Value;
import org.sitemodel.output.SiteModelColumn;
import org.sitemodel.output.SiteRecord;
import org.sitemodel.spatial.AssociationResult;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Turns accepted associations into site records, adding the requested derived fields.
 *
 * <p>Record coordinates are the target site's, never the matched point's.</p>
 */
@Value
@Builder
public class AuxiliaryParameterDeriver {
    boolean deriveZ1pt0;
    boolean deriveZ2pt5;
    boolean deriveVs30Measured;

    @Builder.Default
    SoilParameterRegression z1pt0Regression = SoilRegressions.CHIOU_YOUNGS_2014_Z1PT0;

    @Builder.Default
    SoilParameterRegression z2pt5Regression = SoilRegressions.CAMPBELL_BOZORGNIA_2014_Z2PT5;

    @Builder.Default
    Vs30MeasuredPolicy vs30MeasuredPolicy = Vs30MeasuredPolicy.alwaysInferred();

    /**
     * Columns produced for every record, in table order.
     */
    public Set<SiteModelColumn> columns() {
        EnumSet<SiteModelColumn> columns = EnumSet.of(SiteModelColumn.LON, SiteModelColumn.LAT, SiteModelColumn.VS30);
        if (deriveZ1pt0) {
            columns.add(SiteModelColumn.Z1PT0);
        }
        if (deriveZ2pt5) {
            columns.add(SiteModelColumn.Z2PT5);
        }
        if (deriveVs30Measured) {
            columns.add(SiteModelColumn.VS30MEASURED);
        }
        return columns;
    }

    public SiteRecord derive(AssociationResult association) {
        Objects.requireNonNull(association, "association");
        double vs30 = association.matchedPoint().value();
        return new SiteRecord(
                association.target().longitude(),
                association.target().latitude(),
                vs30,
                deriveZ1pt0 ? Objects.requireNonNull(z1pt0Regression, "z1pt0Regression").apply(vs30) : null,
                deriveZ2pt5 ? Objects.requireNonNull(z2pt5Regression, "z2pt5Regression").apply(vs30) : null,
                deriveVs30Measured
                        ? Objects.requireNonNull(vs30MeasuredPolicy, "vs30MeasuredPolicy").isMeasured(association.matchedPoint())
                        : null
        );
    }
}
