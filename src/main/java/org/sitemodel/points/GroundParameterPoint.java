package org.sitemodel.points;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Immutable ground-parameter sample with load provenance.
 *
 * <p>{@code loadOrder} is the global position in the merged point set (file order, then
 * row order) and is the tie-breaker for equally distant matches.</p>
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class GroundParameterPoint {
    private final double longitude;
    private final double latitude;
    private final double value;
    private final String sourceFile;
    private final int sourceIndex;
    private final int rowNumber;
    private final int loadOrder;

    @Override
    public String toString() {
        return "GroundParameterPoint[lon=" + longitude +
                ", lat=" + latitude +
                ", value=" + value +
                ", source=" + sourceFile + ":" + rowNumber + "]";
    }
}
