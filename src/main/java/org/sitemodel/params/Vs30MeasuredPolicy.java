package org.sitemodel.params;

import org.sitemodel.points.GroundParameterPoint;

import java.util.Objects;
import java.util.Set;

/**
 * Decides the {@code vs30measured} flag for the point a site was associated with.
 */
@FunctionalInterface
public interface Vs30MeasuredPolicy {

    boolean isMeasured(GroundParameterPoint point);

    /**
     * Every value is treated as inferred.
     */
    static Vs30MeasuredPolicy alwaysInferred() {
        return point -> false;
    }

    /**
     * Values loaded from one of the given source files are treated as measured.
     *
     * @param measuredSources source identifiers as reported by {@link GroundParameterPoint#sourceFile()}.
     */
    static Vs30MeasuredPolicy measuredSources(Set<String> measuredSources) {
        Set<String> sources = Set.copyOf(Objects.requireNonNull(measuredSources, "measuredSources"));
        return point -> sources.contains(point.sourceFile());
    }
}
